package com.gentoro.scenarios.config;

import com.gentoro.scenarios.exception.ConfigException;
import com.gentoro.scenarios.logging.LoggingService;
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

/**
 * Loads the engine configuration from YAML.
 *
 * <p>An explicit file wins; otherwise {@code application.yaml} is read from the classpath.
 */
public class ConfigurationProvider {
  private static final org.slf4j.Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_RESOURCE = "application.yaml";

  private final Configuration configuration;

  public ConfigurationProvider(Path configFile) {
    this.configuration =
        configFile == null ? loadClasspath(DEFAULT_RESOURCE) : loadFile(configFile);
  }

  public ConfigurationProvider() {
    this(null);
  }

  public Configuration config() {
    return configuration;
  }

  private static YAMLConfiguration loadFile(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigException("Configuration file does not exist: " + file);
    }
    log.debug("Loading configuration from {}", file);
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Failed to read configuration file: " + file, e);
    }
  }

  private static YAMLConfiguration loadClasspath(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = ConfigurationProvider.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) {
        log.debug("No {} on the classpath, using empty configuration", resource);
        return new YAMLConfiguration();
      }
      log.debug("Loading configuration from classpath:{}", resource);
      return read(new InputStreamReader(in, StandardCharsets.UTF_8));
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Failed to read classpath configuration: " + resource, e);
    }
  }

  private static YAMLConfiguration read(Reader reader) throws ConfigurationException {
    YAMLConfiguration yaml = new YAMLConfiguration();
    yaml.read(reader);
    return yaml;
  }
}
