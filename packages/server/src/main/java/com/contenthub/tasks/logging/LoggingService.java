package com.contenthub.tasks.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for obtaining loggers and applying log levels declared in {@code application.yaml}.
 *
 * <p>Levels are read from keys of the form {@code logging.level.<logger-name>}, where {@code root}
 * addresses the root logger:
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.contenthub.tasks.jobs: DEBUG
 * </pre>
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply configured levels to the Logback context. Unknown level names fall back to {@code DEBUG}
   * (Logback's own default for unparseable values). A non-Logback SLF4J binding is left untouched.
   */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      getLogger(LoggingService.class)
          .debug("SLF4J is not bound to Logback ({}), skipping level configuration", factory);
      return;
    }

    Configuration levels = configuration.subset(LEVEL_PREFIX);
    for (Iterator<String> it = levels.getKeys(); it.hasNext(); ) {
      String name = it.next();
      String value = levels.getString(name);
      if (value == null || value.isBlank()) continue;
      // the expression engine escapes dots inside a YAML key by doubling them
      String unescaped = name.replace("..", ".");
      String loggerName =
          "root".equalsIgnoreCase(unescaped) ? Logger.ROOT_LOGGER_NAME : unescaped;
      context.getLogger(loggerName).setLevel(Level.toLevel(value.trim()));
    }
  }
}
