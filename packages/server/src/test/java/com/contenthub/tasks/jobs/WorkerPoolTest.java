package com.contenthub.tasks.jobs;

import static org.junit.jupiter.api.Assertions.*;

import com.contenthub.tasks.exception.StateException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class WorkerPoolTest {

  @Test
  void rejectsNonPositiveSize() {
    assertThrows(IllegalArgumentException.class, () -> new WorkerPool(0));
  }

  @Test
  void runsWorkInSubmissionOrderOnNamedThreads() throws Exception {
    List<Integer> order = new CopyOnWriteArrayList<>();
    List<String> threads = new CopyOnWriteArrayList<>();
    CountDownLatch done = new CountDownLatch(5);
    try (WorkerPool pool = new WorkerPool(1)) {
      for (int i = 0; i < 5; i++) {
        int n = i;
        pool.submit(
            () -> {
              order.add(n);
              threads.add(Thread.currentThread().getName());
              done.countDown();
            });
      }
      assertTrue(done.await(5, TimeUnit.SECONDS));
    }
    assertEquals(List.of(0, 1, 2, 3, 4), order);
    assertTrue(threads.stream().allMatch(name -> name.startsWith("job-worker-")));
  }

  @Test
  void neverRunsMoreThanItsSizeAtOnce() throws Exception {
    AtomicInteger current = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    CountDownLatch done = new CountDownLatch(20);
    try (WorkerPool pool = new WorkerPool(3)) {
      assertEquals(3, pool.size());
      for (int i = 0; i < 20; i++) {
        pool.submit(
            () -> {
              int now = current.incrementAndGet();
              peak.accumulateAndGet(now, Math::max);
              try {
                Thread.sleep(5);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              current.decrementAndGet();
              done.countDown();
            });
      }
      assertTrue(done.await(5, TimeUnit.SECONDS));
    }
    assertTrue(peak.get() <= 3, "peak was " + peak.get());
  }

  @Test
  void shutdownDropsQueuedWorkAndRejectsNewWork() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    AtomicInteger ran = new AtomicInteger();
    WorkerPool pool = new WorkerPool(1);
    pool.submit(
        () -> {
          started.countDown();
          try {
            Thread.sleep(30_000);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
        });
    assertTrue(started.await(5, TimeUnit.SECONDS));
    pool.submit(ran::incrementAndGet);
    pool.submit(ran::incrementAndGet);
    assertEquals(2, pool.queuedCount());
    assertEquals(1, pool.activeCount());

    int dropped = pool.shutdown(Duration.ofMillis(100));

    assertEquals(2, dropped);
    assertEquals(0, ran.get());
    assertTrue(pool.isShutdown());
    assertThrows(StateException.class, () -> pool.submit(() -> {}));
  }

  @Test
  void shutdownInterruptsWorkThatOutlivesTheGracePeriod() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch interrupted = new CountDownLatch(1);
    WorkerPool pool = new WorkerPool(1);
    pool.submit(
        () -> {
          started.countDown();
          try {
            Thread.sleep(30_000);
          } catch (InterruptedException e) {
            interrupted.countDown();
          }
        });
    assertTrue(started.await(5, TimeUnit.SECONDS));

    pool.shutdown(Duration.ofMillis(50));
    assertTrue(interrupted.await(5, TimeUnit.SECONDS));
  }
}
