package com.brewdeck.tasks;

import com.brewdeck.domain.PackageType;
import java.util.Objects;

/** Enrichment request for one package's details, deduplicated by {@code itemId}. */
public record LoadItemDetail(String itemId, PackageType category) implements Task {
  public LoadItemDetail {
    Objects.requireNonNull(itemId, "itemId");
    Objects.requireNonNull(category, "category");
  }
}
