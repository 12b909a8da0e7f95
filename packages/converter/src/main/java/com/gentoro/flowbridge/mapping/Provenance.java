package com.gentoro.flowbridge.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;

/**
 * Marker stored under {@value #KEY} in the parameters of synthesized nodes, so a later conversion
 * back to the original platform can restore the original node.
 *
 * @param originalType type of the node before conversion
 * @param originalId id of the node before conversion
 * @param originalName name of the node before conversion
 * @param originalPlatform platform id the node came from
 * @param strategy {@code passthrough} or {@code fallback:<category>}
 */
public record Provenance(
    String originalType,
    String originalId,
    String originalName,
    String originalPlatform,
    String strategy) {

  public static final String KEY = "__provenance";
  public static final String PASSTHROUGH = "passthrough";
  public static final String FALLBACK_PREFIX = "fallback:";

  public boolean isFallback() {
    return strategy != null && strategy.startsWith(FALLBACK_PREFIX);
  }

  public String fallbackCategory() {
    return isFallback() ? strategy.substring(FALLBACK_PREFIX.length()) : null;
  }

  public ObjectNode toJson() {
    ObjectNode node = JsonNodeFactory.instance.objectNode();
    node.put("originalType", originalType);
    node.put("originalId", originalId);
    node.put("originalName", originalName);
    node.put("originalPlatform", originalPlatform);
    node.put("strategy", strategy);
    return node;
  }

  /** Reads the marker from a parameter object, when present and carrying an original type. */
  public static Optional<Provenance> read(JsonNode parameters) {
    if (parameters == null || !parameters.path(KEY).isObject()) {
      return Optional.empty();
    }
    JsonNode p = parameters.get(KEY);
    String originalType = p.path("originalType").asText(null);
    if (originalType == null || originalType.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(
        new Provenance(
            originalType,
            p.path("originalId").asText(null),
            p.path("originalName").asText(null),
            p.path("originalPlatform").asText(null),
            p.path("strategy").asText(PASSTHROUGH)));
  }
}
