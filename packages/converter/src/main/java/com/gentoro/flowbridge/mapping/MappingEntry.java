package com.gentoro.flowbridge.mapping;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural rule for converting one node type.
 *
 * @param sourceType type string on the source platform
 * @param targetType type string on the target platform
 * @param displayName optional human-readable name
 * @param parameterPathMap source parameter path to target parameter path
 * @param valueSubstitutions per source path, literal source value to target value
 * @param valueTransforms per source path, name of a {@link TransformationRegistry} transform
 * @param verbatimPaths source paths holding embedded code; copied unchanged and flagged
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record MappingEntry(
    String sourceType,
    String targetType,
    String displayName,
    Map<String, String> parameterPathMap,
    Map<String, Map<String, JsonNode>> valueSubstitutions,
    Map<String, String> valueTransforms,
    List<String> verbatimPaths) {

  public MappingEntry {
    parameterPathMap = parameterPathMap == null ? Map.of() : copy(parameterPathMap);
    valueSubstitutions = valueSubstitutions == null ? Map.of() : copy(valueSubstitutions);
    valueTransforms = valueTransforms == null ? Map.of() : copy(valueTransforms);
    verbatimPaths = verbatimPaths == null ? List.of() : List.copyOf(verbatimPaths);
  }

  public MappingEntry(String sourceType, String targetType, Map<String, String> parameterPathMap) {
    this(sourceType, targetType, null, parameterPathMap, null, null, null);
  }

  MappingEntry withSourceType(String type) {
    return new MappingEntry(
        type,
        targetType,
        displayName,
        parameterPathMap,
        valueSubstitutions,
        valueTransforms,
        verbatimPaths);
  }

  // keeps declaration order, which Map.copyOf would not
  private static <K, V> Map<K, V> copy(Map<K, V> map) {
    return Collections.unmodifiableMap(new LinkedHashMap<>(map));
  }
}
