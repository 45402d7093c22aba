package com.brewdeck.provider;

import com.brewdeck.domain.PackageList;
import java.util.List;

/** Captures and replays the set of installed packages. */
public interface PackageListProvider {
  PackageList exportPackageList() throws InterruptedException;

  /** Installs every entry of the list and returns the names that were installed. */
  List<String> importPackages(PackageList packageList) throws InterruptedException;
}
