package com.brewdeck;

import com.brewdeck.exception.BrewDeckErrorCode;
import com.brewdeck.exception.BrewDeckException;
import com.brewdeck.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;

/**
 * Loads the application configuration. An explicit file wins; otherwise the bundled {@code
 * application.yaml} is read from the classpath.
 */
public final class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULT_RESOURCE = "application.yaml";

  private final YAMLConfiguration configuration;

  public ConfigurationProvider(Path configFile) {
    this.configuration = configFile == null ? loadResource(DEFAULT_RESOURCE) : loadFile(configFile);
  }

  public Configuration config() {
    return configuration;
  }

  private static YAMLConfiguration loadFile(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new BrewDeckException(
              BrewDeckErrorCode.CONFIGURATION_ERROR, "Configuration file not found: " + file)
          .withContext("path", file.toString());
    }
    log.info("Loading configuration from {}", file);
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (IOException | ConfigurationException e) {
      throw new BrewDeckException(
          BrewDeckErrorCode.CONFIGURATION_ERROR, "Failed to read configuration " + file, e);
    }
  }

  private static YAMLConfiguration loadResource(String resource) {
    InputStream in = ConfigurationProvider.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      log.warn("No {} on the classpath, using built-in defaults", resource);
      return new YAMLConfiguration();
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (IOException | ConfigurationException e) {
      throw new BrewDeckException(
          BrewDeckErrorCode.CONFIGURATION_ERROR, "Failed to read classpath " + resource, e);
    }
  }

  private static YAMLConfiguration read(Reader reader) throws ConfigurationException {
    YAMLConfiguration yaml = new YAMLConfiguration();
    yaml.read(reader);
    return yaml;
  }
}
