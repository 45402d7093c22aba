package com.brewdeck.domain;

import java.util.List;

/** What a maintenance operation would delete, shown to the user before confirming. */
public record CleanupPreview(List<CleanupItem> items, long totalSize) {
  public CleanupPreview {
    items = items == null ? List.of() : List.copyOf(items);
  }

  public static CleanupPreview of(List<CleanupItem> items) {
    long total = 0;
    for (CleanupItem item : items) total += item.size();
    return new CleanupPreview(items, total);
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }
}
