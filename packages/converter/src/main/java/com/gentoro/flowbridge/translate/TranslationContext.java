package com.gentoro.flowbridge.translate;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Graph facts the translator needs for the node whose parameters are being rewritten.
 *
 * @param nodeId source id of the current node
 * @param predecessors source ids of upstream nodes, in declared connection order
 * @param sourceIdsByName source node name to source id, for {@code $node["Name"]} references
 * @param targetReferences source id to the way the target dialect refers to that node (the Make
 *     module id, or the n8n node name)
 */
public record TranslationContext(
    String nodeId,
    List<String> predecessors,
    Map<String, String> sourceIdsByName,
    Map<String, String> targetReferences) {

  public TranslationContext {
    predecessors = predecessors == null ? List.of() : List.copyOf(predecessors);
    sourceIdsByName = sourceIdsByName == null ? Map.of() : Map.copyOf(sourceIdsByName);
    targetReferences = targetReferences == null ? Map.of() : Map.copyOf(targetReferences);
  }

  /** Context for a string with no surrounding graph; every graph reference is unresolved. */
  public static TranslationContext detached() {
    return new TranslationContext(null, List.of(), Map.of(), Map.of());
  }

  public Optional<String> firstPredecessor() {
    return predecessors.isEmpty() ? Optional.empty() : Optional.of(predecessors.get(0));
  }

  public boolean hasMultiplePredecessors() {
    return predecessors.size() > 1;
  }

  public Optional<String> sourceIdOf(String nodeName) {
    return Optional.ofNullable(sourceIdsByName.get(nodeName));
  }

  public Optional<String> targetReference(String sourceId) {
    return sourceId == null ? Optional.empty() : Optional.ofNullable(targetReferences.get(sourceId));
  }

  /** Source id of the node the target dialect refers to as {@code reference}. */
  public Optional<String> sourceIdOfReference(String reference) {
    return keyOf(targetReferences, reference);
  }

  /** Source name of the node with {@code sourceId}. */
  public Optional<String> nameOf(String sourceId) {
    return keyOf(sourceIdsByName, sourceId);
  }

  private static Optional<String> keyOf(Map<String, String> map, String value) {
    if (value == null) return Optional.empty();
    return map.entrySet().stream()
        .filter(e -> value.equals(e.getValue()))
        .map(Map.Entry::getKey)
        .sorted()
        .findFirst();
  }
}
