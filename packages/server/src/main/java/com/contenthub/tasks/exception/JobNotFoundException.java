package com.contenthub.tasks.exception;

/** No job record exists for the requested id, either never created or already cleared. */
public class JobNotFoundException extends TaskServerException {
  private final String jobId;

  public JobNotFoundException(String jobId) {
    super(TaskServerErrorCode.JOB_NOT_FOUND, "Job not found: " + jobId);
    this.jobId = jobId;
    withContext("jobId", jobId);
  }

  public String getJobId() {
    return jobId;
  }
}
