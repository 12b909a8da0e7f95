package com.gentoro.flowbridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowbridge.config.ConfigurationProvider;
import com.gentoro.flowbridge.exception.ConfigurationException;
import com.gentoro.flowbridge.exception.FlowBridgeErrorCode;
import com.gentoro.flowbridge.exception.FlowBridgeException;
import com.gentoro.flowbridge.mapping.MappingDatabaseReader;
import com.gentoro.flowbridge.mapping.MappingTable;
import com.gentoro.flowbridge.model.Platform;
import com.gentoro.flowbridge.utility.JacksonUtility;
import com.gentoro.flowbridge.walker.WalkMode;
import com.gentoro.flowbridge.workflow.ConversionOptions;
import com.gentoro.flowbridge.workflow.ConversionResult;
import com.gentoro.flowbridge.workflow.WorkflowConverter;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.apache.commons.configuration2.Configuration;

/**
 * Command line conversion: reads a workflow document, converts it, and writes the {@link
 * ConversionResult} as JSON.
 *
 * <p>Arguments override configuration: {@code --mappings} replaces {@code mappings.location} and
 * {@code --mode} replaces {@code conversion.mode}.
 */
public class FlowBridge {
  private static final org.slf4j.Logger log =
      com.gentoro.flowbridge.logging.LoggingService.getLogger(FlowBridge.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private WorkflowConverter converter;
  private ConversionOptions options;

  public FlowBridge(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // logging levels first, so the rest of start-up honours them
    com.gentoro.flowbridge.logging.LoggingService.applyConfiguration(configuration());

    String mappings =
        startupParameters.getParameter(
            "mappings", configuration().getString("mappings.location", null));
    MappingTable table = MappingDatabaseReader.load(mappings);
    log.info("Mapping database version {} loaded ({} entries)", table.version(), table.size());
    this.converter = new WorkflowConverter(table);

    ConversionOptions configured = ConversionOptions.fromConfiguration(configuration());
    String mode = startupParameters.getParameter("mode", String.class);
    if (mode != null) {
      try {
        configured =
            configured.toBuilder().mode(WalkMode.valueOf(mode.toUpperCase(Locale.ROOT))).build();
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException("Invalid --mode '" + mode + "'", e);
      }
    }
    this.options = configured;
  }

  /** Converts the input and writes the result; returns false when the result carries errors. */
  public boolean run(InputStream stdin, PrintStream stdout) {
    Platform target = platform("to");
    if (target == null) {
      throw new ConfigurationException("Missing required parameter --to (n8n or make)");
    }
    Platform source = platform("from");
    JsonNode document = readInput(stdin);
    ConversionResult result = converter.convert(document, source, target, options);
    writeOutput(JacksonUtility.toPrettyJson(result), stdout);
    return !result.hasErrors();
  }

  public Configuration configuration() {
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  ConversionOptions options() {
    return options;
  }

  private Platform platform(String parameter) {
    String value = startupParameters.getParameter(parameter, String.class);
    if (value == null) return null;
    try {
      return Platform.fromId(value);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid --" + parameter + " '" + value + "'", e);
    }
  }

  private JsonNode readInput(InputStream stdin) {
    String input = startupParameters.getParameter("input", String.class);
    try {
      if (input == null || "-".equals(input)) {
        return JacksonUtility.getJsonMapper().readTree(stdin);
      }
      return JacksonUtility.getJsonMapper().readTree(Path.of(input).toFile());
    } catch (IOException e) {
      throw new FlowBridgeException(
          FlowBridgeErrorCode.CONVERSION_ERROR,
          "Could not read workflow document " + (input == null ? "from stdin" : input),
          e);
    }
  }

  private void writeOutput(String json, PrintStream stdout) {
    String output = startupParameters.getParameter("output", String.class);
    if (output == null || "-".equals(output)) {
      stdout.println(json);
      return;
    }
    try {
      Files.writeString(Path.of(output), json, StandardCharsets.UTF_8);
      log.info("Conversion result written to {}", output);
    } catch (IOException e) {
      throw new FlowBridgeException(
          FlowBridgeErrorCode.CONVERSION_ERROR,
          "Could not write " + output,
          e);
    }
  }
}
