package com.gentoro.flowbridge.exception;

import java.time.Instant;
import java.util.Map;

/** Structured, serializable view of a failure for logs and CLI output. */
public record ErrorDetails(
    String type,
    String message,
    FlowBridgeErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
