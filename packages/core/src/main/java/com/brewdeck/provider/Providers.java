package com.brewdeck.provider;

import java.util.Objects;

/** The external collaborators background tasks run against. */
public record Providers(
    PackageProvider packages, ServiceProvider services, PackageListProvider packageLists) {
  public Providers {
    Objects.requireNonNull(packages, "packages");
    Objects.requireNonNull(services, "services");
    Objects.requireNonNull(packageLists, "packageLists");
  }
}
