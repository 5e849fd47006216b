package com.contenthub.tasks.jobs;

import java.util.Map;

/**
 * Execution context handed to every {@link JobHandler}: the job's identity plus the progress and
 * cancellation channel back to the scheduler.
 *
 * <p>Cancellation is cooperative. Handlers either poll {@link #isCancelRequested()} and unwind on
 * their own, or call {@link #checkForCancel()} at safe checkpoints between side effects and let the
 * thrown {@link JobCancelledException} propagate. In both cases the job ends {@code CANCELED}.
 */
public final class JobContext {
  private final String jobId;
  private final String function;
  private final Map<String, Object> extraMetadata;
  private final ProgressReporter progressReporter;
  private final CancelChecker cancelChecker;
  private volatile boolean cancelObserved;

  /** Functional interface checked by handlers to cooperatively cancel execution. */
  @FunctionalInterface
  public interface CancelChecker {
    boolean isCancelRequested();
  }

  /** Receives progress fractions reported by the handler. */
  @FunctionalInterface
  public interface ProgressReporter {
    void reportProgress(double fraction);
  }

  public JobContext(
      String jobId,
      String function,
      Map<String, Object> extraMetadata,
      ProgressReporter progressReporter,
      CancelChecker cancelChecker) {
    this.jobId = jobId;
    this.function = function;
    this.extraMetadata = extraMetadata == null ? Map.of() : extraMetadata;
    this.progressReporter = progressReporter;
    this.cancelChecker = cancelChecker;
  }

  public String jobId() {
    return jobId;
  }

  public String function() {
    return function;
  }

  public Map<String, Object> extraMetadata() {
    return extraMetadata;
  }

  /**
   * Report progress as a fraction. Values are clamped to [0, 1]; the call is a no-op when the job
   * does not track progress or is no longer running.
   */
  public void updateProgress(double fraction) {
    if (progressReporter != null) progressReporter.reportProgress(fraction);
  }

  /** Report progress as {@code current} of {@code total} units; ignored unless total > 0. */
  public void updateProgress(long current, long total) {
    if (total <= 0) return;
    updateProgress((double) current / (double) total);
  }

  public boolean isCancelRequested() {
    boolean requested = cancelChecker != null && cancelChecker.isCancelRequested();
    if (requested) cancelObserved = true;
    return requested;
  }

  /** Throws {@link JobCancelledException} if a cancel has been requested for this job. */
  public void checkForCancel() throws JobCancelledException {
    if (isCancelRequested()) {
      throw new JobCancelledException(jobId);
    }
  }

  /** Whether the handler has seen a pending cancel request through either method. */
  boolean cancelObserved() {
    return cancelObserved;
  }
}
