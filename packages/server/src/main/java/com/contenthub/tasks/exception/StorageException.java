package com.contenthub.tasks.exception;

/**
 * A job store could not read or persist a record. Fatal to the operation that triggered it only;
 * the scheduler and other jobs keep running.
 */
public class StorageException extends TaskServerException {
  public StorageException(String message) {
    super(TaskServerErrorCode.STORAGE_ERROR, message);
  }

  public StorageException(String message, Throwable cause) {
    super(TaskServerErrorCode.STORAGE_ERROR, message, cause);
  }
}
