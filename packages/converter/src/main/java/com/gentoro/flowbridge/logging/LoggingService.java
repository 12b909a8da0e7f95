package com.gentoro.flowbridge.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single access point for SLF4J loggers.
 *
 * <p>Components obtain their logger through {@link #getLogger(Class)}. At start-up {@link
 * #applyConfiguration(Configuration)} copies {@code logging.level.<logger>} entries from the YAML
 * configuration onto the Logback logger context, so levels can be tuned without editing
 * {@code logback.xml}.
 */
public final class LoggingService {

  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply logger levels declared in the configuration.
   *
   * <pre>{@code
   * logging:
   *   level:
   *     com.gentoro.flowbridge: DEBUG
   *     root: WARN
   * }</pre>
   *
   * <p>Unknown level names fall back to {@code INFO}. When SLF4J is bound to something other than
   * Logback the call is a no-op.
   */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      return;
    }
    for (Iterator<String> it = configuration.getKeys(LEVEL_PREFIX); it.hasNext(); ) {
      String key = it.next();
      if (key.length() <= LEVEL_PREFIX.length() + 1) continue;
      // Commons Configuration escapes dots inside YAML keys as "..".
      String loggerName = key.substring(LEVEL_PREFIX.length() + 1).replace("..", ".");
      String levelName = configuration.getString(key);
      Level level = Level.toLevel(levelName, Level.INFO);
      if ("root".equalsIgnoreCase(loggerName)) {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
      } else {
        context.getLogger(loggerName).setLevel(level);
      }
    }
  }
}
