package com.contenthub.tasks.exception;

/** The function key given to enqueue does not resolve to a registered job handler. */
public class InvalidFunctionException extends TaskServerException {
  private final String function;

  public InvalidFunctionException(String function) {
    super(TaskServerErrorCode.INVALID_FUNCTION, "No job handler registered for: " + function);
    this.function = function;
    withContext("function", function);
  }

  public String getFunction() {
    return function;
  }
}
