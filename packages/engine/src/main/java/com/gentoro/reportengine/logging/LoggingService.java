package com.gentoro.reportengine.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for obtaining loggers and applying level overrides.
 *
 * <p>Levels are read from configuration keys of the form {@code logging.level.<logger>=<LEVEL>}
 * (use {@code logging.level.root} for the root logger). Overrides are only applied when Logback is
 * the active SLF4J backend; with any other backend the call is a no-op.
 */
public final class LoggingService {

  public static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  public static Logger getLogger(String name) {
    return LoggerFactory.getLogger(name);
  }

  /**
   * Apply every {@code logging.level.*} entry found in {@code configuration}.
   *
   * @return number of loggers whose level was changed
   */
  public static int applyConfiguration(Configuration configuration) {
    if (configuration == null) {
      return 0;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      return 0;
    }
    int applied = 0;
    for (Iterator<String> it = configuration.getKeys(LEVEL_PREFIX); it.hasNext(); ) {
      String key = it.next();
      String loggerName =
          key.length() > LEVEL_PREFIX.length() ? key.substring(LEVEL_PREFIX.length() + 1) : "";
      String levelName = configuration.getString(key);
      if (levelName == null || levelName.isBlank()) {
        continue;
      }
      String target =
          loggerName.isEmpty() || "root".equalsIgnoreCase(loggerName)
              ? Logger.ROOT_LOGGER_NAME
              : loggerName;
      context.getLogger(target).setLevel(Level.toLevel(levelName.trim(), Level.INFO));
      applied++;
    }
    return applied;
  }
}
