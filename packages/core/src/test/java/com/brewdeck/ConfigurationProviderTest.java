package com.brewdeck;

import static org.junit.jupiter.api.Assertions.*;

import com.brewdeck.exception.BrewDeckErrorCode;
import com.brewdeck.exception.BrewDeckException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path dir;

  @Test
  void loadsBundledDefaults() {
    Configuration config = new ConfigurationProvider(null).config();

    assertEquals(15, config.getInt("tasks.enrichment.max-concurrent"));
    assertEquals(10_000L, config.getLong("tasks.enrichment.timeout-ms"));
    assertEquals("abandon", config.getString("tasks.enrichment.on-timeout"));
  }

  @Test
  void loadsExplicitFile() throws Exception {
    Path file = dir.resolve("brewdeck.yaml");
    Files.writeString(
        file,
        String.join(
            "\n",
            "tasks:",
            "  enrichment:",
            "    max-concurrent: 3",
            "    on-timeout: interrupt",
            ""));

    Configuration config = new ConfigurationProvider(file).config();

    assertEquals(3, config.getInt("tasks.enrichment.max-concurrent"));
    assertEquals("interrupt", config.getString("tasks.enrichment.on-timeout"));
    assertFalse(config.containsKey("tasks.enrichment.timeout-ms"));
  }

  @Test
  void missingFileIsConfigurationError() {
    Path missing = dir.resolve("nope.yaml");
    BrewDeckException e =
        assertThrows(BrewDeckException.class, () -> new ConfigurationProvider(missing));
    assertEquals(BrewDeckErrorCode.CONFIGURATION_ERROR, e.getCode());
    assertEquals(missing.toString(), e.getContext().get("path"));
  }

  @Test
  void malformedYamlIsConfigurationError() throws Exception {
    Path file = dir.resolve("broken.yaml");
    Files.writeString(file, "tasks: [unclosed\n");

    BrewDeckException e =
        assertThrows(BrewDeckException.class, () -> new ConfigurationProvider(file));
    assertEquals(BrewDeckErrorCode.CONFIGURATION_ERROR, e.getCode());
  }
}
