package com.gentoro.deepresearch;

import com.gentoro.deepresearch.exception.ConfigException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;

/**
 * Loads the application configuration from YAML. An explicit file wins; otherwise the bundled
 * {@code application.yaml} from the classpath is used.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.deepresearch.logging.LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULT_RESOURCE = "application.yaml";

  private final YAMLConfiguration config;

  public ConfigurationProvider(String configFile) {
    this.config = new YAMLConfiguration();
    if (configFile != null && !configFile.isBlank()) {
      Path path = Path.of(configFile.trim());
      if (!Files.isRegularFile(path)) {
        throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
      }
      try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        config.read(reader);
      } catch (Exception e) {
        throw new ConfigException("Failed to read configuration file " + path, e);
      }
      log.info("Loaded configuration from {}", path.toAbsolutePath());
      return;
    }

    try (InputStream in =
        ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        log.warn("No {} on the classpath, running with built-in defaults", DEFAULT_RESOURCE);
        return;
      }
      config.read(new InputStreamReader(in, StandardCharsets.UTF_8));
    } catch (Exception e) {
      throw new ConfigException("Failed to read bundled " + DEFAULT_RESOURCE, e);
    }
    log.debug("Loaded configuration from classpath:{}", DEFAULT_RESOURCE);
  }

  public Configuration config() {
    return config;
  }
}
