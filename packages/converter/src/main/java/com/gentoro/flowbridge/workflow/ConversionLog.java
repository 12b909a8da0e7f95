package com.gentoro.flowbridge.workflow;

import java.time.Instant;

/** A message surfaced to the caller as part of a {@link ConversionResult}. */
public record ConversionLog(LogLevel level, String message, Instant timestamp) {}
