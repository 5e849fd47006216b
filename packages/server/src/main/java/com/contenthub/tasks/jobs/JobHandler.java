package com.contenthub.tasks.jobs;

/**
 * SPI implemented by job bodies. Handlers are registered in a {@link JobRegistry} under a stable
 * key and receive their arguments exactly as they were persisted at enqueue time.
 */
@FunctionalInterface
public interface JobHandler {
  /**
   * Executes the job. Returning normally completes the job; throwing {@link JobCancelledException}
   * acknowledges a cancel request; any other exception fails it.
   */
  void execute(JobContext ctx, JobArguments args) throws Exception;
}
