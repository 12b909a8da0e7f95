package com.gentoro.flowbridge.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.flowbridge.expression.Dialect;
import java.util.Locale;

/** Workflow platforms FlowBridge converts between. */
public enum Platform {
  N8N("n8n", Dialect.N8N, "n8n-nodes-base.noOp"),
  MAKE("make", Dialect.MAKE, "helper:Note");

  private final String id;
  private final Dialect dialect;
  private final String unknownMarkerType;

  Platform(String id, Dialect dialect, String unknownMarkerType) {
    this.id = id;
    this.dialect = dialect;
    this.unknownMarkerType = unknownMarkerType;
  }

  @JsonValue
  public String id() {
    return id;
  }

  public Dialect dialect() {
    return dialect;
  }

  /** Node type used for passthrough stubs on this platform. */
  public String unknownMarkerType() {
    return unknownMarkerType;
  }

  /** Accepts {@code n8n}, {@code make} and {@code make.com}, case-insensitively. */
  public static Platform fromId(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Platform must not be null");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "n8n" -> N8N;
      case "make", "make.com" -> MAKE;
      default -> throw new IllegalArgumentException("Unknown platform '" + value + "'");
    };
  }
}
