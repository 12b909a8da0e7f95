package com.gentoro.flowbridge;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.flowbridge.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  @DisplayName("both argument forms and bare flags are accepted")
  void parsesArguments() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"--to", "make", "--input=flow.json", "--verbose", "--depth", "7"});

    assertEquals("make", params.getParameter("to", String.class));
    assertEquals("flow.json", params.getParameter("input", String.class));
    assertTrue(params.getParameter("verbose", Boolean.class));
    assertEquals(7, params.getParameter("depth", Integer.class));
    assertTrue(params.hasParameter("verbose"));
    assertFalse(params.hasParameter("from"));
    assertNull(params.getParameter("from", String.class));
    assertEquals("-", params.getParameter("output", "-"));
    assertNull(params.configFile());
    assertEquals(4, params.asMap().size());
  }

  @Test
  @DisplayName("stray and malformed arguments are rejected")
  void rejects() {
    assertThrows(ConfigurationException.class, () -> new StartupParameters(new String[] {"make"}));
    assertThrows(ConfigurationException.class, () -> new StartupParameters(new String[] {"--"}));
    StartupParameters params = new StartupParameters(new String[] {"--depth", "deep"});
    assertThrows(ConfigurationException.class, () -> params.getParameter("depth", Integer.class));
  }
}
