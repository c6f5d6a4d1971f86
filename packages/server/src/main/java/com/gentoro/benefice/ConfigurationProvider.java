package com.gentoro.benefice;

import com.gentoro.benefice.exception.ConfigException;
import com.gentoro.benefice.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;

/**
 * Layered application configuration.
 *
 * <p>Lookup order: command line overrides, then the optional external YAML file, then the bundled
 * {@code application.yaml}.
 */
public class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULT_RESOURCE = "application.yaml";

  private final CompositeConfiguration config = new CompositeConfiguration();

  public ConfigurationProvider(String configFile) {
    this(configFile, Map.of());
  }

  public ConfigurationProvider(String configFile, Map<String, String> overrides) {
    if (overrides != null && !overrides.isEmpty()) {
      BaseConfiguration cli = new BaseConfiguration();
      overrides.forEach(cli::setProperty);
      config.addConfiguration(cli);
    }
    if (configFile != null) {
      config.addConfiguration(loadExternal(configFile));
    }
    config.addConfiguration(loadBundled());
  }

  public Configuration config() {
    return config;
  }

  private static YAMLConfiguration loadBundled() {
    URL url = ConfigurationProvider.class.getClassLoader().getResource(DEFAULT_RESOURCE);
    if (url == null) {
      log.warn("No {} on the classpath, using built-in defaults", DEFAULT_RESOURCE);
      return new YAMLConfiguration();
    }
    try (InputStream in = url.openStream()) {
      return read(in, url.toString());
    } catch (IOException e) {
      throw new ConfigException("Failed to read " + url, e);
    }
  }

  private static YAMLConfiguration loadExternal(String location) {
    try {
      if (location.contains("://")) {
        try (InputStream in = URI.create(location).toURL().openStream()) {
          return read(in, location);
        }
      }
      Path path = Path.of(location);
      if (!Files.isRegularFile(path)) {
        throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
      }
      try (InputStream in = Files.newInputStream(path)) {
        log.info("Loading configuration from {}", path.toAbsolutePath());
        return read(in, location);
      }
    } catch (IOException | IllegalArgumentException e) {
      throw new ConfigException("Failed to read configuration from " + location, e);
    }
  }

  private static YAMLConfiguration read(InputStream in, String source) throws IOException {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      yaml.read(reader);
    } catch (ConfigurationException e) {
      throw new ConfigException("Invalid YAML in " + source, e);
    }
    return yaml;
  }
}
