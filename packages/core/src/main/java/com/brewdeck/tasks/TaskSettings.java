package com.brewdeck.tasks;

import com.brewdeck.exception.BrewDeckErrorCode;
import com.brewdeck.exception.BrewDeckException;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/** Tunables for the background runtime and the detail enrichment queue. */
public record TaskSettings(
    String threadNamePrefix,
    long shutdownTimeoutSeconds,
    int maxConcurrentEnrichment,
    Duration enrichmentTimeout,
    TimeoutPolicy timeoutPolicy) {

  public static final String DEFAULT_THREAD_NAME_PREFIX = "brewdeck-worker";
  public static final long DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 5;
  public static final int DEFAULT_MAX_CONCURRENT_ENRICHMENT = 15;
  public static final Duration DEFAULT_ENRICHMENT_TIMEOUT = Duration.ofSeconds(10);

  public TaskSettings {
    if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
      throw invalid("tasks.executor.thread-name-prefix must not be blank");
    }
    if (shutdownTimeoutSeconds < 0) {
      throw invalid("tasks.executor.shutdown-timeout-seconds must be >= 0");
    }
    if (maxConcurrentEnrichment < 1) {
      throw invalid("tasks.enrichment.max-concurrent must be >= 1");
    }
    if (enrichmentTimeout == null || enrichmentTimeout.isNegative() || enrichmentTimeout.isZero()) {
      throw invalid("tasks.enrichment.timeout-ms must be > 0");
    }
    if (timeoutPolicy == null) {
      timeoutPolicy = TimeoutPolicy.ABANDON;
    }
  }

  public static TaskSettings defaults() {
    return new TaskSettings(
        DEFAULT_THREAD_NAME_PREFIX,
        DEFAULT_SHUTDOWN_TIMEOUT_SECONDS,
        DEFAULT_MAX_CONCURRENT_ENRICHMENT,
        DEFAULT_ENRICHMENT_TIMEOUT,
        TimeoutPolicy.ABANDON);
  }

  public static TaskSettings from(Configuration config) {
    if (config == null) return defaults();
    try {
      return new TaskSettings(
          config.getString("tasks.executor.thread-name-prefix", DEFAULT_THREAD_NAME_PREFIX),
          config.getLong(
              "tasks.executor.shutdown-timeout-seconds", DEFAULT_SHUTDOWN_TIMEOUT_SECONDS),
          config.getInt("tasks.enrichment.max-concurrent", DEFAULT_MAX_CONCURRENT_ENRICHMENT),
          Duration.ofMillis(
              config.getLong("tasks.enrichment.timeout-ms", DEFAULT_ENRICHMENT_TIMEOUT.toMillis())),
          TimeoutPolicy.parse(config.getString("tasks.enrichment.on-timeout", null)));
    } catch (BrewDeckException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new BrewDeckException(
          BrewDeckErrorCode.CONFIGURATION_ERROR,
          "Invalid task configuration: " + e.getMessage(),
          e);
    }
  }

  public TaskSettings withMaxConcurrentEnrichment(int maxConcurrent) {
    return new TaskSettings(
        threadNamePrefix, shutdownTimeoutSeconds, maxConcurrent, enrichmentTimeout, timeoutPolicy);
  }

  public TaskSettings withEnrichmentTimeout(Duration timeout) {
    return new TaskSettings(
        threadNamePrefix, shutdownTimeoutSeconds, maxConcurrentEnrichment, timeout, timeoutPolicy);
  }

  public TaskSettings withTimeoutPolicy(TimeoutPolicy policy) {
    return new TaskSettings(
        threadNamePrefix,
        shutdownTimeoutSeconds,
        maxConcurrentEnrichment,
        enrichmentTimeout,
        policy);
  }

  private static BrewDeckException invalid(String message) {
    return new BrewDeckException(BrewDeckErrorCode.CONFIGURATION_ERROR, message);
  }
}
