package com.brewdeck.provider;

import com.brewdeck.domain.CleanupPreview;
import com.brewdeck.domain.Package;
import com.brewdeck.domain.PackageType;
import java.util.List;

/**
 * Boundary to the external package manager. Every call may block on I/O for an arbitrary time and
 * reports failures as {@link com.brewdeck.exception.ProviderException}. Implementations must be
 * safe to call from several worker threads at once.
 */
public interface PackageProvider {
  List<Package> installedPackages(PackageType type) throws InterruptedException;

  List<Package> outdatedPackages(PackageType type) throws InterruptedException;

  List<Package> search(String query, PackageType type) throws InterruptedException;

  /** Full detail for one package, including its current version. */
  Package packageInfo(String name, PackageType type) throws InterruptedException;

  void install(Package pkg) throws InterruptedException;

  void uninstall(Package pkg) throws InterruptedException;

  void update(Package pkg) throws InterruptedException;

  void updateAll() throws InterruptedException;

  void pin(Package pkg) throws InterruptedException;

  void unpin(Package pkg) throws InterruptedException;

  void cleanCache() throws InterruptedException;

  void cleanupOldVersions() throws InterruptedException;

  CleanupPreview cleanCachePreview() throws InterruptedException;

  CleanupPreview cleanupOldVersionsPreview() throws InterruptedException;
}
