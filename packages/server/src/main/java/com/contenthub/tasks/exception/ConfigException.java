package com.contenthub.tasks.exception;

/** Invalid or missing configuration. */
public class ConfigException extends TaskServerException {
  public ConfigException(String message) {
    super(TaskServerErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(TaskServerErrorCode.CONFIG_ERROR, message, cause);
  }
}
