package com.brewdeck;

import com.brewdeck.logging.LoggingService;
import com.brewdeck.provider.Providers;
import com.brewdeck.tasks.TaskCoordinator;
import com.brewdeck.tasks.TaskExecutor;
import com.brewdeck.tasks.TaskSettings;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Process-lifetime wiring of configuration, the background runtime and the task coordinator. The
 * presentation layer creates one instance at startup and drives {@link #coordinator()} from its
 * render loop.
 */
public class BrewDeck {
  private static final org.slf4j.Logger log = LoggingService.getLogger(BrewDeck.class);

  private final Path configFile;
  private final Providers providers;
  private final Clock clock;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  private ConfigurationProvider configurationProvider;
  private TaskSettings settings;
  private TaskExecutor executor;
  private TaskCoordinator coordinator;

  /**
   * @param configFile YAML configuration file, or {@code null} for the bundled defaults
   */
  public BrewDeck(Path configFile, Providers providers) {
    this(configFile, providers, Clock.systemUTC());
  }

  BrewDeck(Path configFile, Providers providers, Clock clock) {
    this.configFile = configFile;
    this.providers = Objects.requireNonNull(providers, "providers");
    this.clock = clock;
  }

  public BrewDeck initialize() {
    this.configurationProvider = new ConfigurationProvider(configFile);
    // Apply logging levels as early as possible
    LoggingService.applyConfiguration(configuration());

    this.settings = TaskSettings.from(configuration());
    this.executor = new TaskExecutor(settings);
    this.coordinator = new TaskCoordinator(providers, executor, settings, clock);
    log.info(
        "BrewDeck initialized (max concurrent lookups={}, lookup timeout={} ms, on timeout={})",
        settings.maxConcurrentEnrichment(),
        settings.enrichmentTimeout().toMillis(),
        settings.timeoutPolicy());
    return this;
  }

  public Configuration configuration() {
    return configurationProvider.config();
  }

  public TaskSettings settings() {
    return settings;
  }

  public TaskCoordinator coordinator() {
    if (coordinator == null) {
      throw new IllegalStateException("BrewDeck has not been initialized");
    }
    return coordinator;
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    log.info("Shutting down BrewDeck");
    if (executor != null) {
      executor.shutdown();
    }
  }
}
