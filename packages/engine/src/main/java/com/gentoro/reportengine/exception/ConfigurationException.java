package com.gentoro.reportengine.exception;

/** Invalid or unreadable engine configuration. */
public class ConfigurationException extends ReportEngineException {
  public ConfigurationException(String message) {
    super(ReportEngineErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(ReportEngineErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
