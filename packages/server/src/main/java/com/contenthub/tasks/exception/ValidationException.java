package com.contenthub.tasks.exception;

/** Input rejected before any state was changed. */
public class ValidationException extends TaskServerException {
  public ValidationException(String message) {
    super(TaskServerErrorCode.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(TaskServerErrorCode.VALIDATION_ERROR, message, cause);
  }
}
