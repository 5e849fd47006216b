package com.contenthub.tasks.jobs;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a background job.
 *
 * <pre>
 * SCHEDULED -&gt; QUEUED -&gt; RUNNING -&gt; COMPLETED | FAILED | CANCELING
 * QUEUED    -&gt; CANCELED
 * SCHEDULED -&gt; CANCELED
 * CANCELING -&gt; CANCELED | COMPLETED | FAILED
 * </pre>
 *
 * SCHEDULED, QUEUED and RUNNING may also move to FAILED when bookkeeping fails or when stale
 * records are recovered after a restart.
 */
public enum JobState {
  /** Record created, not yet handed to the worker pool. */
  SCHEDULED,
  /** Waiting for a free worker slot. */
  QUEUED,
  /** A worker slot is executing the job body. */
  RUNNING,
  /** Cancel requested while running; waiting for the body to observe it. */
  CANCELING,
  /** Cancelled before or during execution. */
  CANCELED,
  /** Job body returned normally. */
  COMPLETED,
  /** Job body raised, or the job could not be executed. */
  FAILED;

  static {
    SCHEDULED.next = EnumSet.of(QUEUED, CANCELED, FAILED);
    QUEUED.next = EnumSet.of(RUNNING, CANCELED, FAILED);
    RUNNING.next = EnumSet.of(COMPLETED, FAILED, CANCELING);
    CANCELING.next = EnumSet.of(CANCELED, COMPLETED, FAILED);
    CANCELED.next = EnumSet.noneOf(JobState.class);
    COMPLETED.next = EnumSet.noneOf(JobState.class);
    FAILED.next = EnumSet.noneOf(JobState.class);
  }

  private Set<JobState> next;

  public boolean isTerminal() {
    return next.isEmpty();
  }

  public boolean canTransitionTo(JobState target) {
    return next.contains(target);
  }
}
