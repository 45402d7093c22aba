package com.brewdeck.tasks;

import java.util.Locale;
import java.util.concurrent.Future;

/**
 * What happens to a detail lookup once the coordinator stops waiting for it.
 *
 * <p>Both policies stop tracking the lookup immediately, so its concurrency slot is free for the
 * next pending item either way. They differ in the worker thread: {@link #ABANDON} lets the lookup
 * run to completion and drops its late result, {@link #INTERRUPT} cancels it.
 */
public enum TimeoutPolicy {
  ABANDON {
    @Override
    void onTimeout(Future<?> work) {
      // the lookup keeps its worker thread until the provider returns
    }
  },
  INTERRUPT {
    @Override
    void onTimeout(Future<?> work) {
      if (work != null) {
        work.cancel(true);
      }
    }
  };

  abstract void onTimeout(Future<?> work);

  /** Parse a configuration value such as {@code abandon} or {@code INTERRUPT}. */
  public static TimeoutPolicy parse(String value) {
    if (value == null || value.isBlank()) {
      return ABANDON;
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
