package com.brewdeck.tasks;

import static org.junit.jupiter.api.Assertions.*;

import com.brewdeck.exception.BrewDeckErrorCode;
import com.brewdeck.exception.BrewDeckException;
import java.time.Duration;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TaskSettingsTest {

  @Test
  void defaultsMatchDocumentedValues() {
    TaskSettings settings = TaskSettings.defaults();
    assertEquals(15, settings.maxConcurrentEnrichment());
    assertEquals(Duration.ofSeconds(10), settings.enrichmentTimeout());
    assertEquals(TimeoutPolicy.ABANDON, settings.timeoutPolicy());
    assertEquals("brewdeck-worker", settings.threadNamePrefix());
  }

  @Test
  void readsOverridesFromConfiguration() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("tasks.enrichment.max-concurrent", "4");
    config.setProperty("tasks.enrichment.timeout-ms", "2500");
    config.setProperty("tasks.enrichment.on-timeout", "Interrupt");

    TaskSettings settings = TaskSettings.from(config);

    assertEquals(4, settings.maxConcurrentEnrichment());
    assertEquals(Duration.ofMillis(2500), settings.enrichmentTimeout());
    assertEquals(TimeoutPolicy.INTERRUPT, settings.timeoutPolicy());
    assertEquals(TaskSettings.DEFAULT_SHUTDOWN_TIMEOUT_SECONDS, settings.shutdownTimeoutSeconds());
  }

  @Test
  @DisplayName("Invalid values surface as configuration errors")
  void rejectsInvalidValues() {
    BaseConfiguration zero = new BaseConfiguration();
    zero.setProperty("tasks.enrichment.max-concurrent", "0");
    assertEquals(
        BrewDeckErrorCode.CONFIGURATION_ERROR,
        assertThrows(BrewDeckException.class, () -> TaskSettings.from(zero)).getCode());

    BaseConfiguration policy = new BaseConfiguration();
    policy.setProperty("tasks.enrichment.on-timeout", "retry");
    BrewDeckException e =
        assertThrows(BrewDeckException.class, () -> TaskSettings.from(policy));
    assertEquals(BrewDeckErrorCode.CONFIGURATION_ERROR, e.getCode());

    assertThrows(
        BrewDeckException.class,
        () -> TaskSettings.defaults().withEnrichmentTimeout(Duration.ZERO));
  }

  @Test
  void withersReplaceSingleField() {
    TaskSettings settings =
        TaskSettings.defaults()
            .withMaxConcurrentEnrichment(3)
            .withTimeoutPolicy(TimeoutPolicy.INTERRUPT);
    assertEquals(3, settings.maxConcurrentEnrichment());
    assertEquals(TimeoutPolicy.INTERRUPT, settings.timeoutPolicy());
    assertEquals(TaskSettings.DEFAULT_ENRICHMENT_TIMEOUT, settings.enrichmentTimeout());
  }

  @Test
  void timeoutPolicyParsing() {
    assertEquals(TimeoutPolicy.ABANDON, TimeoutPolicy.parse(null));
    assertEquals(TimeoutPolicy.ABANDON, TimeoutPolicy.parse("  "));
    assertEquals(TimeoutPolicy.INTERRUPT, TimeoutPolicy.parse(" interrupt "));
    assertThrows(IllegalArgumentException.class, () -> TimeoutPolicy.parse("kill"));
  }
}
