package com.gentoro.flowbridge.workflow;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.flowbridge.model.Platform;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PlatformDetectorTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @ParameterizedTest(name = "{0} -> {1}")
  @CsvSource(
      delimiter = '|',
      value = {
        "{\"flow\": []}|MAKE",
        "{\"blueprint\": {}, \"modules\": []}|MAKE",
        "{\"nodes\": [], \"connections\": {}}|N8N"
      })
  @DisplayName("documents are recognized by their top-level shape")
  void detects(String json, Platform expected) throws Exception {
    assertEquals(Optional.of(expected), PlatformDetector.detect(mapper.readTree(json)));
  }

  @Test
  @DisplayName("anything else is not detected")
  void undetected() throws Exception {
    assertTrue(PlatformDetector.detect(mapper.readTree("{\"nodes\": []}")).isEmpty());
    assertTrue(PlatformDetector.detect(mapper.readTree("[1, 2]")).isEmpty());
    assertTrue(PlatformDetector.detect(null).isEmpty());
  }
}
