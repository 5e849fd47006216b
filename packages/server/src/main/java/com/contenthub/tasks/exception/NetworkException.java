package com.contenthub.tasks.exception;

/** Failures while binding or serving network endpoints. */
public class NetworkException extends TaskServerException {
  public NetworkException(String message) {
    super(TaskServerErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(TaskServerErrorCode.NETWORK_ERROR, message, cause);
  }
}
