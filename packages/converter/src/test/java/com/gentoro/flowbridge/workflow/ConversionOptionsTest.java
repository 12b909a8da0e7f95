package com.gentoro.flowbridge.workflow;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.flowbridge.evaluate.ExpressionEvaluator;
import com.gentoro.flowbridge.exception.ConfigurationException;
import com.gentoro.flowbridge.walker.ParameterTreeWalker;
import com.gentoro.flowbridge.walker.WalkMode;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConversionOptionsTest {

  @Test
  @DisplayName("defaults")
  void defaults() {
    ConversionOptions options = ConversionOptions.defaults();
    assertEquals(WalkMode.TRANSLATE, options.getMode());
    assertFalse(options.isPreserveIds());
    assertTrue(options.isCopyUnmappedParameters());
    assertEquals(ParameterTreeWalker.DEFAULT_MAX_DEPTH, options.getMaxDepth());
    assertEquals(ExpressionEvaluator.DEFAULT_STEP_BUDGET, options.getEvaluationBudget());
    assertTrue(options.getEvaluationContext().isObject());
  }

  @Test
  @DisplayName("configuration keys override defaults")
  void fromConfiguration() {
    BaseConfiguration config = new BaseConfiguration();
    config.addProperty("conversion.mode", " Evaluate ");
    config.addProperty("conversion.preserve-ids", true);
    config.addProperty("conversion.max-depth", 4);

    ConversionOptions options = ConversionOptions.fromConfiguration(config);

    assertEquals(WalkMode.EVALUATE, options.getMode());
    assertTrue(options.isPreserveIds());
    assertEquals(4, options.getMaxDepth());
    assertTrue(options.isCopyUnmappedParameters());
  }

  @Test
  @DisplayName("invalid settings are configuration errors")
  void invalid() {
    BaseConfiguration badMode = new BaseConfiguration();
    badMode.addProperty("conversion.mode", "guess");
    assertThrows(ConfigurationException.class, () -> ConversionOptions.fromConfiguration(badMode));

    BaseConfiguration badDepth = new BaseConfiguration();
    badDepth.addProperty("conversion.max-depth", 0);
    assertThrows(ConfigurationException.class, () -> ConversionOptions.fromConfiguration(badDepth));

    BaseConfiguration notANumber = new BaseConfiguration();
    notANumber.addProperty("conversion.evaluation-budget", "lots");
    assertThrows(
        ConfigurationException.class, () -> ConversionOptions.fromConfiguration(notANumber));
  }

  @Test
  @DisplayName("toBuilder copies every setting")
  void toBuilder() {
    ConversionOptions original =
        ConversionOptions.builder().mode(WalkMode.EVALUATE).preserveIds(true).maxDepth(5).build();
    ConversionOptions copy = original.toBuilder().copyUnmappedParameters(false).build();
    assertEquals(WalkMode.EVALUATE, copy.getMode());
    assertTrue(copy.isPreserveIds());
    assertEquals(5, copy.getMaxDepth());
    assertFalse(copy.isCopyUnmappedParameters());
  }
}
