package com.gentoro.flowbridge.utility;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** Shared, pre-configured Jackson mappers. Both are thread-safe once configured. */
public final class JacksonUtility {

  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  private JacksonUtility() {}

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static ObjectMapper getYamlMapper() {
    return YAML_MAPPER;
  }

  /** Pretty-print any value as JSON; wraps Jackson failures in an unchecked exception. */
  public static String toPrettyJson(Object value) {
    try {
      return JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize value as JSON", e);
    }
  }
}
