package com.contenthub.tasks.jobs;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Observer-facing view of a {@link Job}, as returned by the polling endpoints.
 *
 * <p>Serializes to a flat JSON object: {@code id}, {@code status}, {@code percentage} (0.0 to 1.0),
 * {@code cancellable}, {@code exception}, {@code traceback}, followed by every entry of the job's
 * extra metadata. Metadata entries never replace the core keys; {@link
 * JobScheduler#enqueue(JobRequest)} rejects metadata that uses one.
 */
public record JobSummary(
    String id,
    JobState status,
    double percentage,
    boolean cancellable,
    String exception,
    String traceback,
    Map<String, Object> extraMetadata) {

  static final Set<String> CORE_KEYS =
      Set.of("id", "status", "percentage", "cancellable", "exception", "traceback");

  public static JobSummary from(Job job) {
    return new JobSummary(
        job.id(),
        job.state(),
        job.percentageProgress(),
        job.cancellable(),
        job.exception(),
        job.traceback(),
        job.extraMetadata());
  }

  @JsonValue
  public Map<String, Object> asMap() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("id", id);
    out.put("status", status.name());
    out.put("percentage", percentage);
    out.put("cancellable", cancellable);
    out.put("exception", exception);
    out.put("traceback", traceback);
    if (extraMetadata != null) {
      extraMetadata.forEach(
          (key, value) -> {
            if (!CORE_KEYS.contains(key)) out.put(key, value);
          });
    }
    return out;
  }
}
