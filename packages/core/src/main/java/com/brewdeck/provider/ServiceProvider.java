package com.brewdeck.provider;

import com.brewdeck.domain.Service;
import java.util.List;

/**
 * Boundary to the external service manager. Same blocking and failure contract as {@link
 * PackageProvider}.
 */
public interface ServiceProvider {
  List<Service> listServices() throws InterruptedException;

  void start(String name) throws InterruptedException;

  void stop(String name) throws InterruptedException;

  void restart(String name) throws InterruptedException;
}
