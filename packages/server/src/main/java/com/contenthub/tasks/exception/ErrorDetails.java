package com.contenthub.tasks.exception;

import java.time.Instant;
import java.util.Map;

/** Structured, serializable description of an error for logs and API responses. */
public record ErrorDetails(
    String type,
    String message,
    TaskServerErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
