package com.brewdeck.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Entry of an exported package list. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PackageListItem(
    @JsonProperty("name") String name,
    @JsonProperty("package_type") PackageType type,
    @JsonProperty("version") String version) {

  public static PackageListItem of(Package pkg) {
    return new PackageListItem(pkg.name(), pkg.type(), pkg.version());
  }
}
