package com.contenthub.tasks.exception;

/** Stable error codes attached to every {@link TaskServerException}. */
public enum TaskServerErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  STATE_ERROR,
  NETWORK_ERROR,
  EXECUTION_ERROR,
  VALIDATION_ERROR,
  STORAGE_ERROR,
  JOB_NOT_FOUND,
  INVALID_FUNCTION
}
