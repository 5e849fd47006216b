package com.contenthub.tasks.jobs;

import com.contenthub.tasks.exception.ExceptionUtil;
import com.contenthub.tasks.exception.InvalidFunctionException;
import com.contenthub.tasks.exception.JobNotFoundException;
import com.contenthub.tasks.exception.StateException;
import com.contenthub.tasks.exception.StorageException;
import com.contenthub.tasks.exception.ValidationException;
import com.contenthub.tasks.jobs.store.JobStore;
import com.contenthub.tasks.logging.LoggingService;
import com.contenthub.tasks.utility.JacksonUtility;
import com.fasterxml.jackson.core.type.TypeReference;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;

/**
 * Background job scheduler: persists jobs in a {@link JobStore}, executes them on a {@link
 * WorkerPool} and lets any number of observers query or cancel them by id.
 *
 * <p>One instance is created per process and shared by reference. Every state change is a
 * compare-and-set on the stored record, so concurrent cancel requests, progress updates and worker
 * claims never overwrite each other, and only the slot whose {@code QUEUED -> RUNNING} claim
 * succeeds ever executes a job.
 *
 * <p>On construction, records left behind by a previous process are reconciled: anything still
 * {@code SCHEDULED}, {@code QUEUED} or {@code RUNNING} is marked {@code FAILED}, anything {@code
 * CANCELING} is marked {@code CANCELED}. Jobs are never re-executed automatically.
 */
public final class JobScheduler implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(JobScheduler.class);

  static final String RESTART_MESSAGE = "Job interrupted: process restarted";

  private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final JobStore store;
  private final JobRegistry registry;
  private final WorkerPool workers;
  private final Duration shutdownGrace;
  private final Clock clock;
  private final AtomicLong sequence;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public JobScheduler(JobStore store, JobRegistry registry, WorkerPool workers) {
    this(store, registry, workers, Duration.ofSeconds(10), Clock.systemUTC());
  }

  public JobScheduler(
      JobStore store,
      JobRegistry registry,
      WorkerPool workers,
      Duration shutdownGrace,
      Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.workers = Objects.requireNonNull(workers, "workers");
    this.shutdownGrace = Objects.requireNonNull(shutdownGrace, "shutdownGrace");
    this.clock = Objects.requireNonNull(clock, "clock");

    List<Job> existing = store.list();
    this.sequence =
        new AtomicLong(existing.stream().mapToLong(Job::sequence).max().orElse(0L));
    recoverStaleJobs(existing);
  }

  public WorkerPool workers() {
    return workers;
  }

  // --------------------------------------------------------------------
  // Public API
  // --------------------------------------------------------------------

  /** Shorthand for a job with positional arguments only and default options. */
  public String enqueue(String function, Object... args) {
    return enqueue(JobRequest.builder(function).args(args).build());
  }

  /**
   * Persist a new job and hand it to the worker pool. Returns immediately with the job id.
   *
   * @throws InvalidFunctionException if no handler is registered for the function key
   * @throws ValidationException if arguments or metadata cannot be represented as JSON, or a
   *     metadata key collides with a summary field
   * @throws StorageException if the record could not be persisted; no job exists afterwards
   * @throws StateException if the scheduler has been closed
   */
  public String enqueue(JobRequest request) {
    Objects.requireNonNull(request, "request");
    ensureOpen();
    registry.require(request.function());

    List<Object> args = JacksonUtility.convert(request.args(), LIST_TYPE);
    Map<String, Object> kwargs = JacksonUtility.convert(request.kwargs(), MAP_TYPE);
    Map<String, Object> metadata = JacksonUtility.convert(request.extraMetadata(), MAP_TYPE);
    for (String key : metadata.keySet()) {
      if (JobSummary.CORE_KEYS.contains(key)) {
        throw new ValidationException(
            "Extra metadata must not use the reserved key '" + key + "'");
      }
    }

    String id = UUID.randomUUID().toString();
    Job job =
        Job.scheduled(
            id,
            request.function(),
            args,
            kwargs,
            request.cancellable(),
            request.trackProgress(),
            metadata,
            sequence.incrementAndGet(),
            clock.instant());
    store.create(job);
    log.debug("Enqueued job {} ({})", id, request.function());

    boolean queued;
    try {
      queued = transition(id, JobState.SCHEDULED, JobState.QUEUED);
    } catch (StorageException e) {
      discard(id);
      throw e;
    }
    if (!queued) {
      // cancelled between create and hand-off
      return id;
    }

    try {
      workers.submit(() -> runJob(id));
    } catch (StateException e) {
      recordFailure(id, e);
      throw e;
    }
    return id;
  }

  /**
   * @throws JobNotFoundException if no record exists for {@code jobId}
   */
  public Job fetchJob(String jobId) {
    return store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  /** Snapshot of all jobs in enqueue order, true as of the call. */
  public List<Job> jobs() {
    return store.list();
  }

  /**
   * Request cancellation. A job that has not started yet is cancelled immediately; a running job is
   * moved to {@code CANCELING} and ends once its body observes the request. Jobs that are not
   * cancellable, already terminal or already canceling are left unchanged.
   *
   * @return whether the request changed the job's state
   * @throws JobNotFoundException if no record exists for {@code jobId}
   */
  public boolean cancel(String jobId) {
    AtomicReference<Job> before = new AtomicReference<>();
    Job after =
        store
            .update(
                jobId,
                job -> {
                  before.set(job);
                  if (!job.cancellable()) return job;
                  if (job.state() == JobState.SCHEDULED || job.state() == JobState.QUEUED) {
                    return job.finished(JobState.CANCELED, clock.instant());
                  }
                  if (job.state() == JobState.RUNNING) {
                    return job.withState(JobState.CANCELING);
                  }
                  return job;
                })
            .orElseThrow(() -> new JobNotFoundException(jobId));

    boolean changed = after != before.get();
    if (changed) {
      log.info("Job {} cancel requested: {} -> {}", jobId, before.get().state(), after.state());
    } else if (!after.cancellable()) {
      log.debug("Ignoring cancel request for non-cancellable job {}", jobId);
    }
    return changed;
  }

  /**
   * Remove a finished job. Jobs that are still scheduled, queued, running or canceling are left in
   * place.
   *
   * @return whether the record was removed
   * @throws JobNotFoundException if no record exists for {@code jobId}
   */
  public boolean clearJob(String jobId) {
    Job job = fetchJob(jobId);
    if (!job.isTerminal()) {
      log.debug("Not clearing job {} in state {}", jobId, job.state());
      return false;
    }
    return store.delete(jobId);
  }

  /** Remove every finished job; returns the number removed. */
  public int clear() {
    int removed = store.deleteIf(Job::isTerminal);
    log.debug("Cleared {} finished job(s)", removed);
    return removed;
  }

  /**
   * Cancel every job that has not finished yet, exactly as if {@link #cancel(String)} had been
   * called on each.
   *
   * @return the number of jobs whose state changed
   */
  public int empty() {
    int changed = 0;
    for (Job job : store.list()) {
      if (job.isTerminal()) continue;
      try {
        if (cancel(job.id())) changed++;
      } catch (JobNotFoundException e) {
        log.debug("Job {} disappeared while emptying the queue", job.id());
      }
    }
    log.info("Emptied job queue: {} job(s) cancelled or canceling", changed);
    return changed;
  }

  /**
   * Stop accepting work, give running jobs the grace period to finish, then close the store. Jobs
   * interrupted here stay {@code RUNNING} in storage until the next start.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;
    log.info(
        "Shutting down job scheduler ({} running, {} waiting)",
        workers.activeCount(),
        workers.queuedCount());
    workers.shutdown(shutdownGrace);
    try {
      store.close();
    } catch (Exception e) {
      log.warn("Error while closing job store", e);
    }
  }

  // --------------------------------------------------------------------
  // Worker side
  // --------------------------------------------------------------------

  /** Execution wrapper run by a worker slot. Never lets an exception escape. */
  void runJob(String jobId) {
    if (closed.get()) {
      log.debug("Scheduler closed, not starting job {}", jobId);
      return;
    }

    Job job;
    try {
      Optional<Job> claimed = claim(jobId);
      if (claimed.isEmpty()) {
        log.debug("Job {} no longer queued, skipping", jobId);
        return;
      }
      job = claimed.get();
    } catch (RuntimeException e) {
      log.error("Failed to claim job {}", jobId, e);
      recordFailure(jobId, e);
      return;
    }

    Optional<JobHandler> handler = registry.resolve(job.function());
    if (handler.isEmpty()) {
      recordFailure(jobId, new InvalidFunctionException(job.function()));
      return;
    }

    log.debug(
        "Starting job {} ({}) on {}", jobId, job.function(), Thread.currentThread().getName());
    JobContext ctx =
        new JobContext(
            jobId,
            job.function(),
            job.extraMetadata(),
            fraction -> reportProgress(jobId, fraction),
            () -> isCancelRequested(jobId));
    try {
      handler.get().execute(ctx, JobArguments.of(job));
      finish(jobId, ctx.cancelObserved() ? JobState.CANCELED : JobState.COMPLETED);
    } catch (JobCancelledException e) {
      if (isCancelRequested(jobId)) {
        finish(jobId, JobState.CANCELED);
      } else {
        recordFailure(jobId, e);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      if (closed.get()) {
        // left RUNNING; reconciled on the next start
        log.warn("Job {} interrupted by scheduler shutdown", jobId);
        return;
      }
      if (isCancelRequested(jobId)) {
        finish(jobId, JobState.CANCELED);
      } else {
        recordFailure(jobId, e);
      }
    } catch (Throwable t) {
      recordFailure(jobId, t);
    }
  }

  private Optional<Job> claim(String jobId) {
    AtomicBoolean won = new AtomicBoolean(false);
    Optional<Job> result =
        store.update(
            jobId,
            job -> {
              if (job.state() != JobState.QUEUED) return job;
              won.set(true);
              return job.started(clock.instant());
            });
    return won.get() ? result : Optional.empty();
  }

  private void reportProgress(String jobId, double fraction) {
    if (Double.isNaN(fraction)) return;
    double clamped = Math.max(0.0, Math.min(1.0, fraction));
    store.update(
        jobId,
        job -> {
          if (!job.trackProgress() || job.state() != JobState.RUNNING) return job;
          if (clamped <= job.percentageProgress()) return job;
          return job.withProgress(clamped);
        });
  }

  private boolean isCancelRequested(String jobId) {
    return store.get(jobId).map(job -> job.state() == JobState.CANCELING).orElse(false);
  }

  private void finish(String jobId, JobState terminal) {
    try {
      Optional<Job> result =
          store.update(
              jobId,
              job -> {
                if (!job.state().canTransitionTo(terminal)) return job;
                Job done = job.finished(terminal, clock.instant());
                if (terminal == JobState.COMPLETED && done.trackProgress()) {
                  done = done.withProgress(1.0);
                }
                return done;
              });
      result.ifPresent(
          job -> {
            if (job.state() == JobState.CANCELED) {
              log.info("Job {} ({}) cancelled", jobId, job.function());
            } else {
              log.info("Job {} ({}) finished with state {}", jobId, job.function(), job.state());
            }
          });
    } catch (RuntimeException e) {
      log.error("Failed to record {} for job {}", terminal, jobId, e);
      recordFailure(jobId, e);
    }
  }

  private void recordFailure(String jobId, Throwable error) {
    String description = ExceptionUtil.describe(error);
    log.error("Job {} failed: {}", jobId, description, error);
    try {
      store.update(
          jobId,
          job ->
              job.isTerminal()
                  ? job
                  : job.failed(description, ExceptionUtil.fullStackTrace(error), clock.instant()));
    } catch (RuntimeException e) {
      log.error("Could not record failure of job {}", jobId, e);
    }
  }

  // --------------------------------------------------------------------
  // Internals
  // --------------------------------------------------------------------

  private boolean transition(String jobId, JobState from, JobState to) {
    AtomicBoolean won = new AtomicBoolean(false);
    store.update(
        jobId,
        job -> {
          if (job.state() != from) return job;
          won.set(true);
          return job.withState(to);
        });
    return won.get();
  }

  private void discard(String jobId) {
    try {
      store.delete(jobId);
    } catch (RuntimeException e) {
      log.error("Could not remove rejected job {}", jobId, e);
    }
  }

  private static String restartDiagnostic(Job job) {
    return "Job was "
        + job.state()
        + " when the previous process stopped"
        + (job.startedAt() == null ? "" : " (started " + job.startedAt() + ")")
        + "; it was not resumed.";
  }

  private void recoverStaleJobs(List<Job> existing) {
    int recovered = 0;
    for (Job job : existing) {
      if (job.isTerminal()) continue;
      store.update(
          job.id(),
          current -> {
            switch (current.state()) {
              case SCHEDULED:
              case QUEUED:
              case RUNNING:
                return current.failed(
                    RESTART_MESSAGE, restartDiagnostic(current), clock.instant());
              case CANCELING:
                return current.finished(JobState.CANCELED, clock.instant());
              default:
                return current;
            }
          });
      recovered++;
    }
    if (recovered > 0) {
      log.warn("Recovered {} job(s) left unfinished by a previous process", recovered);
    }
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new StateException("Job scheduler is closed");
    }
  }
}
