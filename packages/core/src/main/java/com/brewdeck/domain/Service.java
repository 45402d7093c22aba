package com.brewdeck.domain;

import java.util.Objects;

/**
 * A service known to the provider.
 *
 * @param user account the service runs as, or {@code null}
 * @param file launchd plist backing the service, or {@code null}
 */
public record Service(String name, ServiceStatus status, String user, String file) {
  public Service {
    Objects.requireNonNull(name, "name");
    status = status == null ? ServiceStatus.UNKNOWN : status;
  }

  public static Service of(String name, ServiceStatus status) {
    return new Service(name, status, null, null);
  }

  public boolean isRunning() {
    return status.isRunning();
  }
}
