package com.gentoro.analytics.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for obtaining loggers and applying log levels from configuration.
 *
 * <p>Levels are read from keys under {@code logging.level}, for example:
 *
 * <pre>{@code
 * logging:
 *   level:
 *     root: INFO
 *     com.gentoro.analytics.drilldown: DEBUG
 * }</pre>
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply every {@code logging.level.<logger>} entry to the Logback context. Does nothing when the
   * SLF4J binding is not Logback.
   *
   * @return number of logger levels applied
   */
  public static int applyConfiguration(Configuration config) {
    if (config == null || !(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      return 0;
    }
    int applied = 0;
    Configuration levels = config.subset(LEVEL_PREFIX);
    for (Iterator<String> it = levels.getKeys(); it.hasNext(); ) {
      String name = it.next();
      String value = levels.getString(name);
      if (value == null || value.isBlank()) {
        continue;
      }
      // hierarchical configurations escape dots inside a single key as ".."
      String loggerName = name.replace("..", ".");
      if ("root".equalsIgnoreCase(loggerName)) {
        loggerName = Logger.ROOT_LOGGER_NAME;
      }
      context.getLogger(loggerName).setLevel(Level.toLevel(value.trim(), Level.INFO));
      applied++;
    }
    return applied;
  }
}
