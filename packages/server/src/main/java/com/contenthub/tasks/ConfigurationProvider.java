package com.contenthub.tasks;

import com.contenthub.tasks.exception.ConfigException;
import com.contenthub.tasks.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;

/**
 * Loads the YAML application configuration.
 *
 * <p>When a file path is given it is read from disk; otherwise {@code application.yaml} is loaded
 * from the classpath. Values may reference environment variables and system properties through
 * the standard interpolation prefixes, e.g. {@code port: ${env:TASKS_HTTP_PORT}}.
 */
public final class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULT_RESOURCE = "application.yaml";

  private final YAMLConfiguration config;

  public ConfigurationProvider(String configFile) {
    this.config =
        configFile == null ? loadResource(DEFAULT_RESOURCE) : loadFile(Path.of(configFile));
  }

  public Configuration config() {
    return config;
  }

  private static YAMLConfiguration loadFile(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
    }
    log.info("Loading configuration from {}", path.toAbsolutePath());
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (IOException e) {
      throw new ConfigException("Failed to read configuration file " + path, e);
    }
  }

  private static YAMLConfiguration loadResource(String resource) {
    InputStream in = ConfigurationProvider.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      log.warn("No {} on the classpath, using built-in defaults", resource);
      return new YAMLConfiguration();
    }
    log.debug("Loading configuration from classpath:{}", resource);
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (IOException e) {
      throw new ConfigException("Failed to read classpath resource " + resource, e);
    }
  }

  private static YAMLConfiguration read(Reader reader) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
    } catch (ConfigurationException e) {
      throw new ConfigException("Invalid YAML configuration", e);
    }
    return yaml;
  }
}
