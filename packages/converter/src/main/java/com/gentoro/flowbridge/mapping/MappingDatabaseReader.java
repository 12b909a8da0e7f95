package com.gentoro.flowbridge.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.flowbridge.exception.MappingDatabaseException;
import com.gentoro.flowbridge.model.Platform;
import com.gentoro.flowbridge.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads a mapping database document into an {@link ImmutableMappingTable}.
 *
 * <pre>{@code
 * {
 *   "version": "1.0.0",
 *   "lastUpdated": "2024-05-01",
 *   "mappings": { "<sourceType>": { "targetType": "...", "parameterPathMap": { ... } } },
 *   "fallbacks": { "make": [ { "category": "http", "typeKeywords": ["http"], ... } ] }
 * }
 * }</pre>
 *
 * <p>JSON and YAML are both accepted; the format is chosen from the file extension. An entry
 * without {@code sourceType} takes its key.
 */
public final class MappingDatabaseReader {
  private static final org.slf4j.Logger log =
      com.gentoro.flowbridge.logging.LoggingService.getLogger(MappingDatabaseReader.class);

  /** Bundled database used when no location is configured. */
  public static final String DEFAULT_RESOURCE = "mappings/default-mappings.json";

  private MappingDatabaseReader() {}

  public static MappingTable loadDefault() {
    return fromClasspath(DEFAULT_RESOURCE);
  }

  /**
   * Loads from {@code location}: a {@code classpath:} prefixed resource or a file path. A blank
   * location loads the bundled default.
   */
  public static MappingTable load(String location) {
    if (StringUtils.isBlank(location)) {
      return loadDefault();
    }
    if (location.startsWith("classpath:")) {
      return fromClasspath(location.substring("classpath:".length()));
    }
    return fromFile(Path.of(location));
  }

  public static MappingTable fromFile(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new MappingDatabaseException("Mapping database not found: " + file.toAbsolutePath());
    }
    try (InputStream in = Files.newInputStream(file)) {
      return read(in, isYaml(file.toString()));
    } catch (IOException e) {
      throw new MappingDatabaseException("Could not read mapping database " + file, e);
    }
  }

  public static MappingTable fromClasspath(String resource) {
    InputStream in = MappingDatabaseReader.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      throw new MappingDatabaseException("Mapping database resource not found: " + resource);
    }
    try (in) {
      return read(in, isYaml(resource));
    } catch (IOException e) {
      throw new MappingDatabaseException("Could not read mapping database " + resource, e);
    }
  }

  public static MappingTable read(InputStream in, boolean yaml) {
    ObjectMapper mapper = yaml ? JacksonUtility.getYamlMapper() : JacksonUtility.getJsonMapper();
    JsonNode root;
    try {
      root = mapper.readTree(in);
    } catch (IOException e) {
      throw new MappingDatabaseException("Malformed mapping database: " + e.getMessage(), e);
    }
    return read(root);
  }

  public static MappingTable read(JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new MappingDatabaseException("Mapping database must be an object");
    }
    JsonNode mappings = root.path("mappings");
    if (!mappings.isObject()) {
      throw new MappingDatabaseException("Mapping database must contain a 'mappings' object");
    }
    ObjectMapper mapper = JacksonUtility.getJsonMapper();
    ImmutableMappingTable.Builder builder =
        ImmutableMappingTable.builder()
            .version(root.path("version").asText("0"))
            .lastUpdated(root.path("lastUpdated").asText(null));

    for (Iterator<Map.Entry<String, JsonNode>> it = mappings.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> e = it.next();
      MappingEntry entry;
      try {
        entry = mapper.treeToValue(e.getValue(), MappingEntry.class);
      } catch (IOException | IllegalArgumentException ex) {
        throw new MappingDatabaseException(
            "Invalid mapping entry '" + e.getKey() + "': " + ex.getMessage(), ex);
      }
      if (StringUtils.isBlank(entry.sourceType())) {
        entry = entry.withSourceType(e.getKey());
      } else if (!entry.sourceType().equals(e.getKey())) {
        throw new MappingDatabaseException(
            "Mapping key '" + e.getKey() + "' does not match sourceType '" + entry.sourceType() + "'");
      }
      if (StringUtils.isBlank(entry.targetType())) {
        throw new MappingDatabaseException("Mapping entry '" + e.getKey() + "' has no targetType");
      }
      builder.entry(entry);
    }

    JsonNode fallbacks = root.path("fallbacks");
    for (Iterator<Map.Entry<String, JsonNode>> it = fallbacks.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> e = it.next();
      Platform platform;
      try {
        platform = Platform.fromId(e.getKey());
      } catch (IllegalArgumentException ex) {
        throw new MappingDatabaseException("Unknown fallback platform '" + e.getKey() + "'", ex);
      }
      for (JsonNode template : e.getValue()) {
        try {
          builder.fallback(platform, mapper.treeToValue(template, FallbackTemplate.class));
        } catch (IOException ex) {
          throw new MappingDatabaseException("Invalid fallback template: " + ex.getMessage(), ex);
        }
      }
    }

    ImmutableMappingTable table = builder.build();
    log.debug("Loaded mapping database version {} with {} entries", table.version(), table.size());
    return table;
  }

  private static boolean isYaml(String name) {
    String lower = name.toLowerCase(Locale.ROOT);
    return lower.endsWith(".yaml") || lower.endsWith(".yml");
  }
}
