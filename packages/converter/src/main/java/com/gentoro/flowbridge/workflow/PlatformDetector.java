package com.gentoro.flowbridge.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowbridge.model.Platform;
import java.util.Optional;

/** Guesses the platform of a workflow document from its top-level shape. */
public final class PlatformDetector {

  private PlatformDetector() {}

  /**
   * {@code flow} array, or the legacy {@code blueprint} + {@code modules} pair, means Make; a
   * {@code nodes} array next to a {@code connections} object means n8n.
   */
  public static Optional<Platform> detect(JsonNode document) {
    if (document == null || !document.isObject()) {
      return Optional.empty();
    }
    if (document.path("flow").isArray()) {
      return Optional.of(Platform.MAKE);
    }
    if (document.path("modules").isArray() && document.has("blueprint")) {
      return Optional.of(Platform.MAKE);
    }
    if (document.path("nodes").isArray() && document.path("connections").isObject()) {
      return Optional.of(Platform.N8N);
    }
    return Optional.empty();
  }
}
