package com.brewdeck.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Homebrew package category. */
public enum PackageType {
  FORMULA("Formula"),
  CASK("Cask");

  private final String label;

  PackageType(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  @JsonCreator
  public static PackageType fromLabel(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Package type must not be null");
    }
    for (PackageType type : values()) {
      if (type.label.equalsIgnoreCase(value)
          || type.name().equals(value.toUpperCase(Locale.ROOT))) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown package type: " + value);
  }

  @Override
  public String toString() {
    return label;
  }
}
