package com.contenthub.tasks.exception;

/** Unexpected failures while executing an internal operation. */
public class ExecutionException extends TaskServerException {
  public ExecutionException(String message) {
    super(TaskServerErrorCode.EXECUTION_ERROR, message);
  }

  public ExecutionException(String message, Throwable cause) {
    super(TaskServerErrorCode.EXECUTION_ERROR, message, cause);
  }
}
