package com.brewdeck.tasks;

import com.brewdeck.domain.Package;
import com.brewdeck.domain.PackageType;
import java.time.Duration;

/** Result of one detail lookup: loaded, failed at the provider, or given up on after a timeout. */
public sealed interface DetailOutcome {

  String itemId();

  PackageType category();

  /**
   * Package to render for this item. Failures yield a bare package flagged with {@code
   * versionLoadFailed}.
   */
  Package asPackage();

  default boolean isFailure() {
    return !(this instanceof Loaded);
  }

  record Loaded(String itemId, Package detail) implements DetailOutcome {
    @Override
    public PackageType category() {
      return detail.type();
    }

    @Override
    public Package asPackage() {
      return detail;
    }
  }

  record Failed(String itemId, PackageType category, String message) implements DetailOutcome {
    @Override
    public Package asPackage() {
      return Package.loadFailed(itemId, category);
    }
  }

  /** Synthesized by the coordinator; the lookup itself never answered. */
  record TimedOut(String itemId, PackageType category, Duration elapsed) implements DetailOutcome {
    @Override
    public Package asPackage() {
      return Package.loadFailed(itemId, category);
    }
  }
}
