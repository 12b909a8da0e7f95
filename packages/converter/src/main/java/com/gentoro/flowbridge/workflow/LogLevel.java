package com.gentoro.flowbridge.workflow;

import com.fasterxml.jackson.annotation.JsonValue;

/** Severity of a {@link ConversionLog}. */
public enum LogLevel {
  INFO("info"),
  WARNING("warning"),
  ERROR("error");

  private final String label;

  LogLevel(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }
}
