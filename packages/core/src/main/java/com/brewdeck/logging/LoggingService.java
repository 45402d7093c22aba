package com.brewdeck.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers.
 *
 * <p>Levels can be overridden from {@code application.yaml}:
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.brewdeck.tasks: DEBUG
 * </pre>
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply {@code logging.level.*} entries to the Logback context. Unknown level names are ignored
   * with a warning; a non-Logback SLF4J binding makes this a no-op.
   */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      return;
    }
    Logger log = getLogger(LoggingService.class);

    Iterator<String> keys = configuration.getKeys(LEVEL_PREFIX);
    while (keys.hasNext()) {
      String key = keys.next();
      if (key.length() <= LEVEL_PREFIX.length() + 1) continue;
      // keys containing dots come back escaped as ".." by the default expression engine
      String loggerName = key.substring(LEVEL_PREFIX.length() + 1).replace("..", ".");
      String value = configuration.getString(key, null);
      Level level = Level.toLevel(value, null);
      if (level == null) {
        log.warn("Ignoring unknown log level '{}' for logger '{}'", value, loggerName);
        continue;
      }
      String target =
          "root".equalsIgnoreCase(loggerName) ? org.slf4j.Logger.ROOT_LOGGER_NAME : loggerName;
      context.getLogger(target).setLevel(level);
      log.debug("Log level for '{}' set to {}", target, level);
    }
  }
}
