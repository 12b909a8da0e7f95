package com.gentoro.flowbridge.config;

import com.gentoro.flowbridge.exception.ConfigurationException;
import com.gentoro.flowbridge.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads the application configuration from YAML.
 *
 * <p>When an explicit file is given it must exist. Otherwise {@code application.yaml} is read from
 * the classpath; if that is missing too an empty configuration is used and every consumer falls
 * back to its defaults.
 */
public class ConfigurationProvider {
  private static final org.slf4j.Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_RESOURCE = "application.yaml";

  private final YAMLConfiguration config;

  public ConfigurationProvider(String configFile) {
    this.config =
        configFile == null || configFile.isBlank()
            ? loadFromClasspath(DEFAULT_RESOURCE)
            : loadFromFile(Path.of(configFile));
  }

  public Configuration config() {
    return config;
  }

  static YAMLConfiguration loadFromFile(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigurationException("Configuration file not found: " + file.toAbsolutePath());
    }
    log.debug("Loading configuration from {}", file.toAbsolutePath());
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (IOException e) {
      throw new ConfigurationException("Could not read configuration file " + file, e);
    }
  }

  static YAMLConfiguration loadFromClasspath(String resource) {
    InputStream in = ConfigurationProvider.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      log.debug("No {} on the classpath, using an empty configuration", resource);
      return new YAMLConfiguration();
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (IOException e) {
      throw new ConfigurationException("Could not read classpath configuration " + resource, e);
    }
  }

  private static YAMLConfiguration read(Reader reader) throws IOException {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
    } catch (org.apache.commons.configuration2.ex.ConfigurationException | YAMLException e) {
      throw new ConfigurationException("Malformed YAML configuration: " + e.getMessage(), e);
    }
    return yaml;
  }
}
