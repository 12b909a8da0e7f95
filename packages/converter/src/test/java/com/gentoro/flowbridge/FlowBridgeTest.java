package com.gentoro.flowbridge;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.flowbridge.exception.ConfigurationException;
import com.gentoro.flowbridge.walker.WalkMode;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FlowBridgeTest {

  private final ObjectMapper mapper = new ObjectMapper();

  private static InputStream stdin(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("converts stdin to stdout and reports success")
  void stdinToStdout() throws Exception {
    FlowBridge app = new FlowBridge(new String[] {"--to", "make"});
    app.initialize();
    ByteArrayOutputStream out = new ByteArrayOutputStream();

    boolean ok =
        app.run(
            stdin(
                """
                {"name": "CLI", "nodes": [
                  {"id": "a", "name": "Hook", "type": "n8n-nodes-base.webhook", "parameters": {"path": "x"}}
                ], "connections": {}}
                """),
            new PrintStream(out, true, StandardCharsets.UTF_8));

    assertTrue(ok);
    JsonNode result = mapper.readTree(out.toString(StandardCharsets.UTF_8));
    assertEquals("gateway:CustomWebHook", result.at("/convertedWorkflow/flow/0/module").asText());
    assertEquals("n8n", result.at("/debug/sourcePlatform").asText());
    assertEquals("info", result.at("/logs/0/level").asText());
  }

  @Test
  @DisplayName("writes to --output and returns false when the result has errors")
  void outputFileWithErrors(@TempDir Path dir) throws Exception {
    Path input = dir.resolve("in.json");
    Path output = dir.resolve("out.json");
    Files.writeString(input, "{\"nodes\": 3}", StandardCharsets.UTF_8);
    FlowBridge app =
        new FlowBridge(
            new String[] {
              "--from", "n8n", "--to", "make", "--input", input.toString(), "--output", output.toString()
            });
    app.initialize();

    boolean ok = app.run(stdin(""), new PrintStream(new ByteArrayOutputStream()));

    assertFalse(ok);
    JsonNode result = mapper.readTree(output.toFile());
    assertEquals("error", result.at("/logs/0/level").asText());
  }

  @Test
  @DisplayName("--mode overrides the configured mode")
  void modeOverride() {
    FlowBridge app = new FlowBridge(new String[] {"--to", "n8n", "--mode", "evaluate"});
    app.initialize();
    assertEquals(WalkMode.EVALUATE, app.options().getMode());
  }

  @Test
  @DisplayName("missing or invalid platforms are configuration errors")
  void badPlatforms() {
    FlowBridge noTarget = new FlowBridge(new String[] {});
    noTarget.initialize();
    assertThrows(
        ConfigurationException.class,
        () -> noTarget.run(stdin("{}"), new PrintStream(new ByteArrayOutputStream())));

    FlowBridge badTarget = new FlowBridge(new String[] {"--to", "zapier"});
    badTarget.initialize();
    assertThrows(
        ConfigurationException.class,
        () -> badTarget.run(stdin("{}"), new PrintStream(new ByteArrayOutputStream())));

    FlowBridge badMode = new FlowBridge(new String[] {"--to", "make", "--mode", "guess"});
    assertThrows(ConfigurationException.class, badMode::initialize);
  }
}
