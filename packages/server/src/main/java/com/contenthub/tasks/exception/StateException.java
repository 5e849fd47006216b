package com.contenthub.tasks.exception;

/** Operation not allowed in the current component state. */
public class StateException extends TaskServerException {
  public StateException(String message) {
    super(TaskServerErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(TaskServerErrorCode.STATE_ERROR, message, cause);
  }
}
