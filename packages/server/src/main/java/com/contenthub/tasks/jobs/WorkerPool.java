package com.contenthub.tasks.jobs;

import com.contenthub.tasks.exception.StateException;
import com.contenthub.tasks.logging.LoggingService;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Fixed number of worker slots executing jobs in submission (FIFO) order. Each slot runs one job at
 * a time; which job a slot may actually run is decided by the scheduler's claim on the job record,
 * not by the pool.
 */
public final class WorkerPool implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(WorkerPool.class);

  private final int size;
  private final ThreadPoolExecutor executor;

  public WorkerPool(int size) {
    if (size < 1) {
      throw new IllegalArgumentException("Worker pool size must be at least 1, got " + size);
    }
    this.size = size;
    AtomicInteger counter = new AtomicInteger();
    this.executor =
        new ThreadPoolExecutor(
            size,
            size,
            0L,
            TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            r -> {
              Thread t = new Thread(r, "job-worker-" + counter.incrementAndGet());
              t.setDaemon(true);
              t.setUncaughtExceptionHandler(
                  (th, ex) -> log.error("Uncaught exception in {}", th.getName(), ex));
              return t;
            },
            new ThreadPoolExecutor.AbortPolicy());
  }

  public int size() {
    return size;
  }

  /** Queue a unit of work for the next free slot. */
  void submit(Runnable work) {
    try {
      executor.execute(work);
    } catch (RejectedExecutionException e) {
      throw new StateException("Worker pool is shut down", e);
    }
  }

  /** Number of slots currently executing work. */
  public int activeCount() {
    return executor.getActiveCount();
  }

  /** Number of submitted units waiting for a free slot. */
  public int queuedCount() {
    return executor.getQueue().size();
  }

  public boolean isShutdown() {
    return executor.isShutdown();
  }

  /**
   * Stop accepting work, drop everything not yet started and wait up to {@code grace} for running
   * work to finish before interrupting it.
   *
   * @return the number of queued units that were dropped
   */
  public int shutdown(Duration grace) {
    executor.shutdown();
    List<Runnable> dropped = new ArrayList<>();
    executor.getQueue().drainTo(dropped);
    if (!dropped.isEmpty()) {
      log.info("Dropped {} queued job(s) on worker pool shutdown", dropped.size());
    }
    try {
      if (!executor.awaitTermination(Math.max(1, grace.toMillis()), TimeUnit.MILLISECONDS)) {
        log.warn("Worker pool did not stop within {}, interrupting running jobs", grace);
        executor.shutdownNow();
        if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
          log.warn("Some job workers are still running after interruption");
        }
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
    return dropped.size();
  }

  @Override
  public void close() {
    shutdown(Duration.ofSeconds(10));
  }
}
