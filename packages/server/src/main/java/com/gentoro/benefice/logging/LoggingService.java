package com.gentoro.benefice.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for obtaining loggers and applying runtime log levels.
 *
 * <p>Levels come from {@code logging.level.<logger>} keys in {@code application.yaml}; the special
 * logger name {@code root} addresses the root logger. Keys are applied on top of whatever {@code
 * logback.xml} configured.
 */
public final class LoggingService {
  static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply {@code logging.level.*} entries. Unknown level names fall back to DEBUG (logback). */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      getLogger(LoggingService.class)
          .warn("Logback is not the active SLF4J binding, ignoring logging.level settings");
      return;
    }

    Iterator<String> keys = configuration.getKeys(LEVEL_PREFIX);
    while (keys.hasNext()) {
      String key = keys.next();
      String loggerName = loggerName(key);
      if (loggerName.isEmpty()) continue;
      String level = configuration.getString(key);
      if (level == null || level.isBlank()) continue;

      String target =
          "root".equalsIgnoreCase(loggerName) ? Logger.ROOT_LOGGER_NAME : loggerName;
      context.getLogger(target).setLevel(Level.toLevel(level.trim(), Level.DEBUG));
    }
  }

  // YAML keys containing dots come back escaped as ".." by the default expression engine.
  static String loggerName(String key) {
    if (key.length() <= LEVEL_PREFIX.length() + 1) return "";
    return key.substring(LEVEL_PREFIX.length() + 1).replace("..", ".");
  }
}
