package com.contenthub.tasks.jobs.store;

import static org.junit.jupiter.api.Assertions.*;

import com.contenthub.tasks.exception.StorageException;
import com.contenthub.tasks.jobs.Job;
import com.contenthub.tasks.jobs.JobState;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileJobStoreTest {

  @TempDir Path tmp;

  private static Job job(String id, long sequence) {
    return Job.scheduled(
        id,
        "importcontent",
        Arrays.asList("network", 3, null),
        Map.of("node_ids", List.of("n1", "n2")),
        true,
        true,
        Map.of("type", "REMOTECONTENTIMPORT"),
        sequence,
        Instant.parse("2024-05-01T10:00:00Z"));
  }

  @Test
  void recordsSurviveReopen() {
    Path file = tmp.resolve("nested/dir/jobs.json");
    try (FileJobStore store = new FileJobStore(file)) {
      store.create(job("a", 1));
      store.create(job("b", 2));
      store.update("a", j -> j.started(Instant.parse("2024-05-01T10:00:01Z")).withProgress(0.5));
      store.update(
          "b", j -> j.failed("IOException: gone", "trace", Instant.parse("2024-05-01T10:00:02Z")));
    }
    assertTrue(Files.exists(file));

    try (FileJobStore reopened = new FileJobStore(file)) {
      List<Job> jobs = reopened.list();
      assertEquals(List.of("a", "b"), jobs.stream().map(Job::id).collect(Collectors.toList()));

      Job a = jobs.get(0);
      assertEquals(JobState.RUNNING, a.state());
      assertEquals(0.5, a.percentageProgress());
      assertEquals(Arrays.asList("network", 3, null), a.args());
      assertEquals(List.of("n1", "n2"), a.kwargs().get("node_ids"));
      assertEquals("REMOTECONTENTIMPORT", a.extraMetadata().get("type"));
      assertEquals(Instant.parse("2024-05-01T10:00:01Z"), a.startedAt());

      Job b = jobs.get(1);
      assertEquals(JobState.FAILED, b.state());
      assertEquals("IOException: gone", b.exception());
      assertEquals("trace", b.traceback());
    }
  }

  @Test
  void deletesArePersisted() {
    Path file = tmp.resolve("jobs.json");
    try (FileJobStore store = new FileJobStore(file)) {
      store.create(job("a", 1));
      store.create(job("b", 2));
      store.create(job("c", 3));
      store.update("b", j -> j.finished(JobState.COMPLETED, Instant.now()));
      assertEquals(1, store.deleteIf(Job::isTerminal));
      assertTrue(store.delete("c"));
    }
    try (FileJobStore reopened = new FileJobStore(file)) {
      assertEquals(
          List.of("a"), reopened.list().stream().map(Job::id).collect(Collectors.toList()));
      reopened.deleteAll();
    }
    try (FileJobStore reopened = new FileJobStore(file)) {
      assertTrue(reopened.list().isEmpty());
    }
  }

  @Test
  void emptyFileStartsEmpty() throws Exception {
    Path file = Files.createFile(tmp.resolve("jobs.json"));
    try (FileJobStore store = new FileJobStore(file)) {
      assertTrue(store.list().isEmpty());
    }
  }

  @Test
  void corruptFileIsRejected() throws Exception {
    Path file = tmp.resolve("jobs.json");
    Files.writeString(file, "{not json");
    assertThrows(StorageException.class, () -> new FileJobStore(file));
  }

  @Test
  void unknownFormatVersionIsRejected() throws Exception {
    Path file = tmp.resolve("jobs.json");
    Files.writeString(file, "{\"version\": 99, \"jobs\": []}");
    StorageException e = assertThrows(StorageException.class, () -> new FileJobStore(file));
    assertTrue(e.getMessage().contains("99"));
  }

  @Test
  void failedWriteRollsBackTheChange() throws Exception {
    Path dir = Files.createDirectory(tmp.resolve("store"));
    Path file = dir.resolve("jobs.json");
    FileJobStore store = new FileJobStore(file);
    store.create(job("a", 1));

    // a directory where the temp file would be moved makes the write fail
    Files.delete(file);
    Files.createDirectory(file);
    Files.writeString(file.resolve("blocker"), "x");

    assertThrows(StorageException.class, () -> store.create(job("b", 2)));
    assertTrue(store.get("b").isEmpty());
    assertThrows(
        StorageException.class, () -> store.update("a", j -> j.withState(JobState.QUEUED)));
    assertEquals(JobState.SCHEDULED, store.get("a").orElseThrow().state());
    assertThrows(StorageException.class, () -> store.delete("a"));
    assertTrue(store.get("a").isPresent());
  }

  @Test
  void readsDoNotWaitForAWriteInProgress() throws Exception {
    FileJobStore store = new FileJobStore(tmp.resolve("jobs.json"));
    store.create(job("a", 1));

    CountDownLatch inside = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    ExecutorService writer = Executors.newSingleThreadExecutor();
    try {
      Future<?> update =
          writer.submit(
              () ->
                  store.update(
                      "a",
                      j -> {
                        inside.countDown();
                        try {
                          assertTrue(release.await(5, TimeUnit.SECONDS));
                        } catch (InterruptedException e) {
                          throw new IllegalStateException(e);
                        }
                        return j.withProgress(0.5);
                      }));
      assertTrue(inside.await(5, TimeUnit.SECONDS));

      // the writer holds the lock; readers get the committed record without blocking
      assertTimeoutPreemptively(
          Duration.ofSeconds(1),
          () -> {
            assertEquals(0.0, store.get("a").orElseThrow().percentageProgress());
            assertEquals(1, store.list().size());
          });

      release.countDown();
      update.get(5, TimeUnit.SECONDS);
      assertEquals(0.5, store.get("a").orElseThrow().percentageProgress());
    } finally {
      release.countDown();
      writer.shutdownNow();
    }
  }
}
