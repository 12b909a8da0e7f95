package com.gentoro.flowbridge.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.gentoro.flowbridge.evaluate.ExpressionEvaluator;
import com.gentoro.flowbridge.exception.ConfigurationException;
import com.gentoro.flowbridge.walker.ParameterTreeWalker;
import com.gentoro.flowbridge.walker.WalkMode;
import java.util.Locale;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;

/**
 * Per-call conversion settings.
 *
 * <p>Defaults: translate mode, no evaluation bindings, fresh ids, unmapped parameters copied,
 * parameter depth {@value ParameterTreeWalker#DEFAULT_MAX_DEPTH}, evaluation budget {@value
 * ExpressionEvaluator#DEFAULT_STEP_BUDGET} steps.
 */
public final class ConversionOptions {

  private final WalkMode mode;
  private final JsonNode evaluationContext;
  private final boolean preserveIds;
  private final boolean copyUnmappedParameters;
  private final int maxDepth;
  private final int evaluationBudget;

  private ConversionOptions(Builder b) {
    this.mode = b.mode;
    this.evaluationContext = b.evaluationContext;
    this.preserveIds = b.preserveIds;
    this.copyUnmappedParameters = b.copyUnmappedParameters;
    this.maxDepth = b.maxDepth;
    this.evaluationBudget = b.evaluationBudget;
  }

  public static ConversionOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads {@code conversion.*} keys; absent keys keep their defaults.
   *
   * <pre>{@code
   * conversion:
   *   mode: translate
   *   preserve-ids: false
   *   copy-unmapped-parameters: true
   *   max-depth: 32
   *   evaluation-budget: 10000
   * }</pre>
   */
  public static ConversionOptions fromConfiguration(Configuration config) {
    Builder b = builder();
    if (config == null) return b.build();
    String mode = config.getString("conversion.mode", null);
    if (mode != null) {
      try {
        b.mode(WalkMode.valueOf(mode.trim().toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException("Invalid conversion.mode '" + mode + "'", e);
      }
    }
    try {
      b.preserveIds(config.getBoolean("conversion.preserve-ids", false));
      b.copyUnmappedParameters(config.getBoolean("conversion.copy-unmapped-parameters", true));
      b.maxDepth(config.getInt("conversion.max-depth", ParameterTreeWalker.DEFAULT_MAX_DEPTH));
      b.evaluationBudget(
          config.getInt("conversion.evaluation-budget", ExpressionEvaluator.DEFAULT_STEP_BUDGET));
    } catch (ConversionException | IllegalArgumentException e) {
      throw new ConfigurationException("Invalid conversion setting: " + e.getMessage(), e);
    }
    return b.build();
  }

  public Builder toBuilder() {
    return builder()
        .mode(mode)
        .evaluationContext(evaluationContext)
        .preserveIds(preserveIds)
        .copyUnmappedParameters(copyUnmappedParameters)
        .maxDepth(maxDepth)
        .evaluationBudget(evaluationBudget);
  }

  public WalkMode getMode() {
    return mode;
  }

  public JsonNode getEvaluationContext() {
    return evaluationContext;
  }

  public boolean isPreserveIds() {
    return preserveIds;
  }

  public boolean isCopyUnmappedParameters() {
    return copyUnmappedParameters;
  }

  public int getMaxDepth() {
    return maxDepth;
  }

  public int getEvaluationBudget() {
    return evaluationBudget;
  }

  public static final class Builder {
    private WalkMode mode = WalkMode.TRANSLATE;
    private JsonNode evaluationContext = JsonNodeFactory.instance.objectNode();
    private boolean preserveIds = false;
    private boolean copyUnmappedParameters = true;
    private int maxDepth = ParameterTreeWalker.DEFAULT_MAX_DEPTH;
    private int evaluationBudget = ExpressionEvaluator.DEFAULT_STEP_BUDGET;

    private Builder() {}

    public Builder mode(WalkMode mode) {
      this.mode = mode == null ? WalkMode.TRANSLATE : mode;
      return this;
    }

    public Builder evaluationContext(JsonNode evaluationContext) {
      this.evaluationContext =
          evaluationContext == null ? JsonNodeFactory.instance.objectNode() : evaluationContext;
      return this;
    }

    public Builder preserveIds(boolean preserveIds) {
      this.preserveIds = preserveIds;
      return this;
    }

    public Builder copyUnmappedParameters(boolean copyUnmappedParameters) {
      this.copyUnmappedParameters = copyUnmappedParameters;
      return this;
    }

    public Builder maxDepth(int maxDepth) {
      if (maxDepth < 1) {
        throw new IllegalArgumentException("maxDepth must be positive");
      }
      this.maxDepth = maxDepth;
      return this;
    }

    public Builder evaluationBudget(int evaluationBudget) {
      if (evaluationBudget < 1) {
        throw new IllegalArgumentException("evaluationBudget must be positive");
      }
      this.evaluationBudget = evaluationBudget;
      return this;
    }

    public ConversionOptions build() {
      return new ConversionOptions(this);
    }
  }
}
