package com.contenthub.tasks.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of all domain exceptions raised by the task server. Carries a {@link
 * TaskServerErrorCode} and an optional context map with diagnostic values (job id, file path, ...).
 */
public class TaskServerException extends RuntimeException {
  private final TaskServerErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public TaskServerException(TaskServerErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public TaskServerException(TaskServerErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public TaskServerErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a diagnostic value; returns {@code this} for chaining at the throw site. */
  public TaskServerException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
