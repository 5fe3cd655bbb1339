package com.gentoro.scenarios.exception;

/** Invalid setup document or engine configuration. Never retryable. */
public class ConfigException extends ScenarioException {
  public ConfigException(String message) {
    super(ScenarioErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(ScenarioErrorCode.CONFIG_ERROR, message, cause);
  }
}
