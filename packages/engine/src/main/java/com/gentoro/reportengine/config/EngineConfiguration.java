package com.gentoro.reportengine.config;

import com.gentoro.reportengine.exception.ConfigurationException;
import com.gentoro.reportengine.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.slf4j.Logger;

/**
 * Engine settings backed by Apache Commons Configuration.
 *
 * <p>Recognised keys:
 *
 * <ul>
 *   <li>{@code calculator.strict-mode}: fail a mapping when an argument path does not resolve.
 *   <li>{@code calculator.raise-on-error}: abort a batch on the first failed mapping.
 *   <li>{@code expression.max-depth}: nesting cap for format expressions.
 *   <li>{@code logging.level.<logger>}: Logback level overrides.
 * </ul>
 */
public final class EngineConfiguration {
  private static final Logger log = LoggingService.getLogger(EngineConfiguration.class);

  public static final String DEFAULT_RESOURCE = "report-engine.properties";

  public static final String STRICT_MODE = "calculator.strict-mode";
  public static final String RAISE_ON_ERROR = "calculator.raise-on-error";
  public static final String MAX_EXPRESSION_DEPTH = "expression.max-depth";

  public static final int DEFAULT_MAX_DEPTH = 10;

  private final Configuration config;

  private EngineConfiguration(Configuration config) {
    this.config = config;
  }

  /** Wrap an already-built configuration (e.g. a {@code MapConfiguration} in tests). */
  public static EngineConfiguration from(Configuration config) {
    return new EngineConfiguration(config == null ? new PropertiesConfiguration() : config);
  }

  /** Load {@value #DEFAULT_RESOURCE} from the classpath; a missing resource yields defaults. */
  public static EngineConfiguration load() {
    return load(DEFAULT_RESOURCE);
  }

  public static EngineConfiguration load(String resource) {
    PropertiesConfiguration properties = new PropertiesConfiguration();
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    if (loader == null) {
      loader = EngineConfiguration.class.getClassLoader();
    }
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        log.debug("No '{}' on the classpath, using defaults", resource);
        return new EngineConfiguration(properties);
      }
      try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
        properties.read(reader);
      }
    } catch (IOException | org.apache.commons.configuration2.ex.ConfigurationException e) {
      throw new ConfigurationException("Failed to read configuration '" + resource + "'", e);
    }
    EngineConfiguration loaded = new EngineConfiguration(properties);
    LoggingService.applyConfiguration(properties);
    log.debug("Loaded engine configuration from '{}'", resource);
    return loaded;
  }

  public Configuration configuration() {
    return config;
  }

  public boolean strictMode() {
    return config.getBoolean(STRICT_MODE, false);
  }

  public boolean raiseOnError() {
    return config.getBoolean(RAISE_ON_ERROR, false);
  }

  public int maxExpressionDepth() {
    int depth = config.getInt(MAX_EXPRESSION_DEPTH, DEFAULT_MAX_DEPTH);
    if (depth <= 0) {
      throw new ConfigurationException(
          MAX_EXPRESSION_DEPTH + " must be positive, got: " + depth);
    }
    return depth;
  }
}
