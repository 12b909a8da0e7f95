package com.gentoro.flowbridge.mapping;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Generic target shape for a category of unmapped node types (for example any HTTP-like node).
 *
 * @param category short category name, recorded in the provenance marker
 * @param typeKeywords case-insensitive keywords matched against the source type
 * @param targetType type emitted on the target platform
 * @param parameterPathMap source parameter path to target parameter path
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FallbackTemplate(
    String category,
    List<String> typeKeywords,
    String targetType,
    Map<String, String> parameterPathMap) {

  public FallbackTemplate {
    typeKeywords = typeKeywords == null ? List.of() : List.copyOf(typeKeywords);
    parameterPathMap =
        parameterPathMap == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameterPathMap));
  }

  public boolean matches(String sourceType) {
    if (sourceType == null) return false;
    String lower = sourceType.toLowerCase(Locale.ROOT);
    for (String keyword : typeKeywords) {
      if (lower.contains(keyword.toLowerCase(Locale.ROOT))) return true;
    }
    return false;
  }
}
