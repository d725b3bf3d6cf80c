package com.gentoro.reportengine.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.MapConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link LoggingService}. */
class LoggingServiceTest {

  private static final String NAME = "com.gentoro.reportengine.logging.sample";

  @AfterEach
  void reset() {
    ((Logger) LoggingService.getLogger(NAME)).setLevel(null);
  }

  @Test
  @DisplayName("level overrides are applied to Logback loggers")
  void appliesLevels() {
    Map<String, Object> settings = new LinkedHashMap<>();
    settings.put("logging.level." + NAME, "debug");
    settings.put("logging.level.other", " ");
    settings.put("calculator.strict-mode", "true");

    int applied = LoggingService.applyConfiguration(new MapConfiguration(settings));

    assertEquals(1, applied);
    assertEquals(Level.DEBUG, ((Logger) LoggingService.getLogger(NAME)).getLevel());
  }

  @Test
  @DisplayName("a null configuration changes nothing")
  void nullConfiguration() {
    assertEquals(0, LoggingService.applyConfiguration(null));
  }

  @Test
  @DisplayName("class loggers are named after the class")
  void classLogger() {
    String name = LoggingService.getLogger(LoggingServiceTest.class).getName();
    assertEquals(LoggingServiceTest.class.getName(), name);
  }
}
