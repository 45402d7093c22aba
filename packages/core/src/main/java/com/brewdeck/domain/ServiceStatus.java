package com.brewdeck.domain;

/** State of a background service managed through {@code brew services}. */
public enum ServiceStatus {
  STARTED,
  STOPPED,
  ERROR,
  UNKNOWN;

  public boolean isRunning() {
    return this == STARTED;
  }
}
