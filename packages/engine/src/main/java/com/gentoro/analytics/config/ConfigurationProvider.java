package com.gentoro.analytics.config;

import com.gentoro.analytics.exception.ConfigurationException;
import com.gentoro.analytics.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;

/**
 * Loads the engine configuration from YAML.
 *
 * <p>When a file path is given it must exist; otherwise the classpath resource {@value
 * #DEFAULT_RESOURCE} is used, and an empty configuration (all defaults) when that is absent too.
 */
public class ConfigurationProvider {
  public static final String DEFAULT_RESOURCE = "application.yaml";

  private static final org.slf4j.Logger log =
      LoggingService.getLogger(ConfigurationProvider.class);

  private final YAMLConfiguration config;

  /** Load from the classpath default resource. */
  public ConfigurationProvider() {
    this((Path) null);
  }

  public ConfigurationProvider(String configFile) {
    this(configFile == null || configFile.isBlank() ? null : Path.of(configFile));
  }

  public ConfigurationProvider(Path configFile) {
    this.config = configFile == null ? loadClasspath() : loadFile(configFile);
  }

  public Configuration config() {
    return config;
  }

  private static YAMLConfiguration loadFile(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigurationException("Configuration file not found: " + file);
    }
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      YAMLConfiguration yaml = read(reader, file.toString());
      log.info("Loaded configuration from {}", file.toAbsolutePath());
      return yaml;
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read configuration file " + file, e);
    }
  }

  private static YAMLConfiguration loadClasspath() {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) {
      cl = ConfigurationProvider.class.getClassLoader();
    }
    try (InputStream in = cl.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        log.debug("No {} on classpath, using defaults", DEFAULT_RESOURCE);
        return new YAMLConfiguration();
      }
      YAMLConfiguration yaml =
          read(new InputStreamReader(in, StandardCharsets.UTF_8), DEFAULT_RESOURCE);
      log.debug("Loaded configuration from classpath resource {}", DEFAULT_RESOURCE);
      return yaml;
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read classpath " + DEFAULT_RESOURCE, e);
    }
  }

  private static YAMLConfiguration read(Reader reader, String source) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
    } catch (org.apache.commons.configuration2.ex.ConfigurationException e) {
      throw new ConfigurationException("Invalid YAML configuration in " + source, e);
    }
    return yaml;
  }
}
