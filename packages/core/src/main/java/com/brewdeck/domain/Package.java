package com.brewdeck.domain;

import java.util.Objects;

/**
 * Immutable snapshot of a package as reported by the provider. Optional attributes are {@code
 * null} when unknown.
 *
 * @param versionLoadFailed set when the detail lookup for this package failed or timed out
 */
public record Package(
    String name,
    PackageType type,
    String version,
    String availableVersion,
    String description,
    boolean installed,
    boolean outdated,
    boolean pinned,
    boolean versionLoadFailed) {

  public Package {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }

  public static Package of(String name, PackageType type) {
    return new Package(name, type, null, null, null, false, false, false, false);
  }

  /** A bare placeholder for a package whose details could not be loaded. */
  public static Package loadFailed(String name, PackageType type) {
    return of(name, type).withVersionLoadFailed(true);
  }

  public Package withVersion(String version) {
    return new Package(
        name, type, version, availableVersion, description, installed, outdated, pinned,
        versionLoadFailed);
  }

  public Package withAvailableVersion(String availableVersion) {
    return new Package(
        name, type, version, availableVersion, description, installed, outdated, pinned,
        versionLoadFailed);
  }

  public Package withDescription(String description) {
    return new Package(
        name, type, version, availableVersion, description, installed, outdated, pinned,
        versionLoadFailed);
  }

  public Package withInstalled(boolean installed) {
    return new Package(
        name, type, version, availableVersion, description, installed, outdated, pinned,
        versionLoadFailed);
  }

  public Package withOutdated(boolean outdated) {
    return new Package(
        name, type, version, availableVersion, description, installed, outdated, pinned,
        versionLoadFailed);
  }

  public Package withPinned(boolean pinned) {
    return new Package(
        name, type, version, availableVersion, description, installed, outdated, pinned,
        versionLoadFailed);
  }

  public Package withVersionLoadFailed(boolean versionLoadFailed) {
    return new Package(
        name, type, version, availableVersion, description, installed, outdated, pinned,
        versionLoadFailed);
  }
}
