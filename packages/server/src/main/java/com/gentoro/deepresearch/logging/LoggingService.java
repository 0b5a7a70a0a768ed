package com.gentoro.deepresearch.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for obtaining loggers and applying log levels from configuration.
 *
 * <p>Levels are read from the {@code logging.level} subtree, e.g.:
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.gentoro.deepresearch.resilience: DEBUG
 * </pre>
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply {@code logging.level.*} entries to the Logback context. Unknown levels are ignored. */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      // Another SLF4J backend is bound; nothing to adjust.
      return;
    }

    Configuration levels = configuration.subset(LEVEL_PREFIX);
    for (Iterator<String> it = levels.getKeys(); it.hasNext(); ) {
      String loggerName = it.next();
      String value = levels.getString(loggerName);
      if (value == null || value.isBlank()) continue;

      Level level = Level.toLevel(value.trim(), null);
      if (level == null) {
        getLogger(LoggingService.class)
            .warn("Ignoring unknown log level '{}' for logger '{}'", value, loggerName);
        continue;
      }
      // Hierarchical configurations escape dots inside a single YAML key as "..".
      String unescaped = loggerName.replace("..", ".");
      String name = "root".equalsIgnoreCase(unescaped) ? Logger.ROOT_LOGGER_NAME : unescaped;
      context.getLogger(name).setLevel(level);
    }
  }
}
