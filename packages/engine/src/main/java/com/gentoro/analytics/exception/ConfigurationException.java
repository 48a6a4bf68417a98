package com.gentoro.analytics.exception;

/** Errors while loading or interpreting engine configuration. */
public class ConfigurationException extends AnalyticsException {
  public ConfigurationException(String message) {
    super(AnalyticsErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(AnalyticsErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
