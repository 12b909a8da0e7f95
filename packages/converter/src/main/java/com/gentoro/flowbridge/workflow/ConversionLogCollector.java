package com.gentoro.flowbridge.workflow;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates the caller-visible logs of one conversion. Every entry is mirrored to SLF4J at
 * debug level. Not thread-safe.
 */
public class ConversionLogCollector {
  private static final org.slf4j.Logger log =
      com.gentoro.flowbridge.logging.LoggingService.getLogger(ConversionLogCollector.class);

  private final Clock clock;
  private final List<ConversionLog> logs = new ArrayList<>();

  public ConversionLogCollector(Clock clock) {
    this.clock = clock;
  }

  public void info(String message) {
    add(LogLevel.INFO, message);
  }

  public void warning(String message) {
    add(LogLevel.WARNING, message);
  }

  public void error(String message) {
    add(LogLevel.ERROR, message);
  }

  public void add(LogLevel level, String message) {
    log.debug("[{}] {}", level.label(), message);
    logs.add(new ConversionLog(level, message, clock.instant()));
  }

  public long count(LogLevel level) {
    return logs.stream().filter(l -> l.level() == level).count();
  }

  public List<ConversionLog> logs() {
    return List.copyOf(logs);
  }
}
