package com.contenthub.tasks.jobs;

/**
 * Raised from {@link JobContext#checkForCancel()} when a cancel request is pending. Handlers let it
 * propagate (after their own cleanup) to acknowledge the cancellation; the worker records the job
 * as {@link JobState#CANCELED} rather than {@link JobState#FAILED}.
 */
public class JobCancelledException extends Exception {
  private final String jobId;

  public JobCancelledException(String jobId) {
    super("Job cancelled: " + jobId);
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}
