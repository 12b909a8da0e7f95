package com.gentoro.flowbridge.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowbridge.utility.ParameterPaths;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Moves parameter values from source paths to target paths.
 *
 * <p>Mapped values pass through value substitutions and then named transforms, both keyed by
 * source path. Top-level parameters no mapping mentions are copied to the same key when {@code
 * copyUnmapped} is set; a partly mapped object is copied without its mapped members.
 */
public class ParameterMapper {

  private final TransformationRegistry transformations;

  public ParameterMapper(TransformationRegistry transformations) {
    this.transformations = Objects.requireNonNull(transformations, "transformations");
  }

  /** Result of {@link #apply}: the target parameters and the source to target path map used. */
  public record MappedParameters(ObjectNode parameters, Map<String, String> pathMap) {

    /** Target path for a source path, or the source path itself when it was not moved. */
    public String targetPath(String sourcePath) {
      String best = null;
      for (String src : pathMap.keySet()) {
        if (ParameterPaths.isWithin(sourcePath, src) && (best == null || src.length() > best.length())) {
          best = src;
        }
      }
      return best == null ? sourcePath : pathMap.get(best) + sourcePath.substring(best.length());
    }
  }

  public MappedParameters apply(MappingEntry entry, ObjectNode parameters, boolean copyUnmapped) {
    return apply(
        parameters,
        entry.parameterPathMap(),
        entry.valueSubstitutions(),
        entry.valueTransforms(),
        copyUnmapped);
  }

  public MappedParameters apply(
      ObjectNode parameters,
      Map<String, String> pathMap,
      Map<String, Map<String, JsonNode>> substitutions,
      Map<String, String> transforms,
      boolean copyUnmapped) {
    ObjectNode out = JsonNodeFactory.instance.objectNode();
    Map<String, String> used = new LinkedHashMap<>();

    for (Map.Entry<String, String> e : pathMap.entrySet()) {
      JsonNode value = ParameterPaths.get(parameters, e.getKey());
      if (value == null) continue;
      ParameterPaths.set(out, e.getValue(), convert(e.getKey(), value.deepCopy(), substitutions, transforms));
      used.put(e.getKey(), e.getValue());
    }

    if (copyUnmapped) {
      for (Iterator<Map.Entry<String, JsonNode>> it = parameters.fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> e = it.next();
        String key = e.getKey();
        if (out.has(key) || isCovered(key, pathMap)) continue;
        JsonNode copy = e.getValue().deepCopy();
        if (copy instanceof ObjectNode obj) {
          for (String inner : nestedMapped(key, pathMap)) {
            ParameterPaths.remove(obj, inner.substring(key.length() + 1));
          }
        }
        out.set(key, convert(key, copy, substitutions, transforms));
      }
    }
    return new MappedParameters(out, used);
  }

  /** Inverse of a path map, for converting a fallback node back. */
  public static Map<String, String> invert(Map<String, String> pathMap) {
    Map<String, String> inverse = new LinkedHashMap<>();
    pathMap.forEach((src, dst) -> inverse.putIfAbsent(dst, src));
    return inverse;
  }

  private JsonNode convert(
      String sourcePath,
      JsonNode value,
      Map<String, Map<String, JsonNode>> substitutions,
      Map<String, String> transforms) {
    JsonNode result = value;
    Map<String, JsonNode> substitution = substitutions.get(sourcePath);
    if (substitution != null && result.isValueNode()) {
      JsonNode replacement = substitution.get(result.asText());
      if (replacement != null) result = replacement.deepCopy();
    }
    String transform = transforms.get(sourcePath);
    if (transform != null) {
      result = transformations.apply(transform, result);
    }
    return result;
  }

  /** Whether top-level {@code key} is itself mapped or lies under a mapped path. */
  private static boolean isCovered(String key, Map<String, String> pathMap) {
    for (String src : pathMap.keySet()) {
      if (ParameterPaths.isWithin(key, src)) return true;
    }
    return false;
  }

  private static List<String> nestedMapped(String key, Map<String, String> pathMap) {
    List<String> out = new ArrayList<>();
    for (String src : pathMap.keySet()) {
      if (src.startsWith(key + ".")) out.add(src);
    }
    return out;
  }
}
