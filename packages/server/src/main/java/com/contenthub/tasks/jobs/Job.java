package com.contenthub.tasks.jobs;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted description of one unit of background work.
 *
 * <p>Instances are immutable: every state or progress change produces a new instance which the
 * {@link com.contenthub.tasks.jobs.store.JobStore} swaps in atomically. The argument payloads and
 * {@code extraMetadata} are fixed at enqueue time and carried unchanged through every copy.
 *
 * @param id unique identifier, assigned at enqueue time and never reused
 * @param function registry key of the {@link JobHandler} that executes this job
 * @param args JSON-normalised positional arguments
 * @param kwargs JSON-normalised keyword arguments
 * @param state current lifecycle state
 * @param percentageProgress fraction in [0.0, 1.0]
 * @param cancellable whether cancel requests are honoured
 * @param trackProgress whether progress updates are recorded
 * @param exception one-line failure description, only set when {@code FAILED}
 * @param traceback stack trace of the failure, only set when {@code FAILED}
 * @param extraMetadata caller-supplied descriptive fields, never interpreted by the scheduler
 * @param sequence enqueue order; lower values were enqueued earlier
 */
public record Job(
    String id,
    String function,
    List<Object> args,
    Map<String, Object> kwargs,
    JobState state,
    double percentageProgress,
    boolean cancellable,
    boolean trackProgress,
    String exception,
    String traceback,
    Map<String, Object> extraMetadata,
    long sequence,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt) {

  public Job {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(state, "state");
    args = immutableList(args);
    kwargs = immutableMap(kwargs);
    extraMetadata = immutableMap(extraMetadata);
  }

  /** A freshly enqueued job in {@link JobState#SCHEDULED} with zero progress. */
  public static Job scheduled(
      String id,
      String function,
      List<Object> args,
      Map<String, Object> kwargs,
      boolean cancellable,
      boolean trackProgress,
      Map<String, Object> extraMetadata,
      long sequence,
      Instant createdAt) {
    return new Job(
        id,
        function,
        args,
        kwargs,
        JobState.SCHEDULED,
        0.0,
        cancellable,
        trackProgress,
        null,
        null,
        extraMetadata,
        sequence,
        createdAt,
        null,
        null);
  }

  public Job withState(JobState newState) {
    return new Job(
        id,
        function,
        args,
        kwargs,
        newState,
        percentageProgress,
        cancellable,
        trackProgress,
        exception,
        traceback,
        extraMetadata,
        sequence,
        createdAt,
        startedAt,
        finishedAt);
  }

  public Job withProgress(double progress) {
    return new Job(
        id,
        function,
        args,
        kwargs,
        state,
        progress,
        cancellable,
        trackProgress,
        exception,
        traceback,
        extraMetadata,
        sequence,
        createdAt,
        startedAt,
        finishedAt);
  }

  /** Transition to {@link JobState#RUNNING}, stamping the start time. */
  public Job started(Instant at) {
    return new Job(
        id,
        function,
        args,
        kwargs,
        JobState.RUNNING,
        percentageProgress,
        cancellable,
        trackProgress,
        exception,
        traceback,
        extraMetadata,
        sequence,
        createdAt,
        at,
        finishedAt);
  }

  /** Transition to a terminal state other than {@code FAILED}, stamping the finish time. */
  public Job finished(JobState terminal, Instant at) {
    return new Job(
        id,
        function,
        args,
        kwargs,
        terminal,
        percentageProgress,
        cancellable,
        trackProgress,
        exception,
        traceback,
        extraMetadata,
        sequence,
        createdAt,
        startedAt,
        at);
  }

  /** Transition to {@link JobState#FAILED} with the captured diagnostics. */
  public Job failed(String exceptionText, String tracebackText, Instant at) {
    return new Job(
        id,
        function,
        args,
        kwargs,
        JobState.FAILED,
        percentageProgress,
        cancellable,
        trackProgress,
        exceptionText,
        tracebackText,
        extraMetadata,
        sequence,
        createdAt,
        startedAt,
        at);
  }

  @JsonIgnore
  public boolean isTerminal() {
    return state.isTerminal();
  }

  // JSON payloads may contain nulls, which List.copyOf / Map.copyOf reject.
  private static List<Object> immutableList(List<Object> source) {
    if (source == null || source.isEmpty()) return List.of();
    return Collections.unmodifiableList(new ArrayList<>(source));
  }

  private static Map<String, Object> immutableMap(Map<String, Object> source) {
    if (source == null || source.isEmpty()) return Map.of();
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
