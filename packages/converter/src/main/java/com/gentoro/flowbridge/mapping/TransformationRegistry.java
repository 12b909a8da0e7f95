package com.gentoro.flowbridge.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * Registry of named value transforms referenced by {@link MappingEntry#valueTransforms()}.
 *
 * <p>Transforms only touch plain values. A string carrying an expression is left as it is, since
 * its value is only known at run time. Unknown names and failing transforms return the original
 * value with a warning.
 */
public class TransformationRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.flowbridge.logging.LoggingService.getLogger(TransformationRegistry.class);

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private final Map<String, UnaryOperator<JsonNode>> transformations = new HashMap<>();

  public TransformationRegistry() {
    registerBuiltInTransformations();
  }

  public void register(String name, UnaryOperator<JsonNode> transformation) {
    transformations.put(name, transformation);
  }

  /**
   * Apply a transformation by name.
   *
   * @return transformed value, or the original value if the transformation is unknown or fails
   */
  public JsonNode apply(String name, JsonNode value) {
    UnaryOperator<JsonNode> transformation = transformations.get(name);
    if (transformation == null) {
      log.warn("Transformation '{}' not found, returning original value", name);
      return value;
    }
    if (value == null || value.isNull() || isExpression(value)) {
      return value;
    }
    try {
      return transformation.apply(value);
    } catch (RuntimeException e) {
      log.warn("Transformation '{}' failed for value '{}': {}", name, value, e.getMessage());
      return value;
    }
  }

  public boolean hasTransformation(String name) {
    return transformations.containsKey(name);
  }

  public Set<String> getAvailableTransformations() {
    return Set.copyOf(transformations.keySet());
  }

  private static boolean isExpression(JsonNode value) {
    return value.isTextual() && value.textValue().contains("{{");
  }

  private void registerBuiltInTransformations() {
    // Boolean <-> String
    register("booleanToString", value -> NODES.textNode(value.isBoolean()
        ? String.valueOf(value.booleanValue())
        : value.asText()));

    register("stringToBoolean", value -> {
      if (value.isBoolean()) return value;
      String str = StringUtils.trimToEmpty(value.asText()).toLowerCase(Locale.ROOT);
      return NODES.booleanNode(
          "true".equals(str) || "1".equals(str) || "yes".equals(str) || "on".equals(str));
    });

    // Number <-> String (using Apache Commons Lang)
    register("numberToString", value -> {
      if (value.isNumber()) {
        return NODES.textNode(value.isIntegralNumber()
            ? value.bigIntegerValue().toString()
            : value.decimalValue().stripTrailingZeros().toPlainString());
      }
      return value;
    });

    register("stringToNumber", value -> {
      if (value.isNumber()) return value;
      String str = StringUtils.trimToEmpty(value.asText());
      if (!NumberUtils.isCreatable(str)) {
        throw new IllegalArgumentException("Cannot convert '" + str + "' to number");
      }
      Number number = NumberUtils.createNumber(str);
      if (number instanceof Integer || number instanceof Long) {
        return NODES.numberNode(number.longValue());
      }
      return NODES.numberNode(NumberUtils.createBigDecimal(str));
    });

    // String operations
    register("toUpperCase", value -> value.isTextual()
        ? NODES.textNode(StringUtils.upperCase(value.textValue()))
        : value);

    register("toLowerCase", value -> value.isTextual()
        ? NODES.textNode(StringUtils.lowerCase(value.textValue()))
        : value);

    register("trim", value -> value.isTextual()
        ? NODES.textNode(StringUtils.trim(value.textValue()))
        : value);
  }
}
