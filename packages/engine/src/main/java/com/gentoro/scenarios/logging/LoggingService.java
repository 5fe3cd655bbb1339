package com.gentoro.scenarios.logging;

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
 * <p>Log levels can be overridden from configuration with keys of the form {@code
 * logging.level.<logger>} (use {@code root} for the root logger). Hierarchical YAML keys that
 * contain dots come back from Commons Configuration with doubled dots, which are folded back.
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply {@code logging.level.*} entries to the Logback context.
   *
   * @return number of loggers whose level was changed
   */
  public static int applyConfiguration(Configuration configuration) {
    if (configuration == null) return 0;
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      getLogger(LoggingService.class)
          .debug("Logback is not the active SLF4J backend, ignoring logging.level settings");
      return 0;
    }

    int applied = 0;
    for (Iterator<String> it = configuration.getKeys(LEVEL_PREFIX); it.hasNext(); ) {
      String key = it.next();
      if (key.length() <= LEVEL_PREFIX.length() + 1) continue;
      String loggerName = key.substring(LEVEL_PREFIX.length() + 1).replace("..", ".");
      String levelName = configuration.getString(key);
      if (levelName == null || levelName.isBlank()) continue;

      ch.qos.logback.classic.Logger logger =
          "root".equalsIgnoreCase(loggerName)
              ? context.getLogger(Logger.ROOT_LOGGER_NAME)
              : context.getLogger(loggerName);
      logger.setLevel(Level.toLevel(levelName.trim(), Level.INFO));
      applied++;
    }
    return applied;
  }
}
