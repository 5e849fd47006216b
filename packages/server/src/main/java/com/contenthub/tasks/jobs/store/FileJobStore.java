package com.contenthub.tasks.jobs.store;

import com.contenthub.tasks.exception.StorageException;
import com.contenthub.tasks.jobs.Job;
import com.contenthub.tasks.logging.LoggingService;
import com.contenthub.tasks.utility.JacksonUtility;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;

/**
 * Durable JobStore backed by a single JSON document.
 *
 * <p>All records are kept in memory and the whole document is rewritten after every mutation: the
 * new content goes to a temporary file in the same directory which is then moved over the target,
 * so a crash leaves either the previous or the new document on disk, never a partial one. If the
 * write fails the in-memory change is rolled back and a {@link StorageException} is thrown.
 *
 * <p>Mutations are serialized on a single lock. Readers see the last committed snapshot and never
 * wait for a write in progress.
 */
public final class FileJobStore implements JobStore {
  private static final Logger log = LoggingService.getLogger(FileJobStore.class);

  static final int FORMAT_VERSION = 1;

  private final Path file;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();
  private final Object lock = new Object();
  private volatile Map<String, Job> committed = Map.of();

  /** On-disk layout. */
  record Document(int version, List<Job> jobs) {}

  public FileJobStore(Path file) {
    this.file = file.toAbsolutePath().normalize();
    load();
  }

  public Path file() {
    return file;
  }

  private void load() {
    try {
      Path parent = file.getParent();
      if (parent != null) Files.createDirectories(parent);
      if (!Files.exists(file) || Files.size(file) == 0) {
        log.info("Job store {} does not exist yet, starting empty", file);
        return;
      }
      Document document = mapper.readValue(file.toFile(), Document.class);
      if (document.version() != FORMAT_VERSION) {
        throw new StorageException(
            "Unsupported job store format version "
                + document.version()
                + " in "
                + file
                + " (expected "
                + FORMAT_VERSION
                + ")");
      }
      Map<String, Job> loaded = new LinkedHashMap<>();
      if (document.jobs() != null) {
        for (Job job : document.jobs()) {
          loaded.put(job.id(), job);
        }
      }
      committed = Collections.unmodifiableMap(loaded);
      log.info("Loaded {} job record(s) from {}", loaded.size(), file);
    } catch (IOException e) {
      throw new StorageException("Failed to read job store " + file, e);
    }
  }

  @Override
  public void create(Job job) {
    synchronized (lock) {
      if (committed.containsKey(job.id())) {
        throw new StorageException("Job already exists: " + job.id());
      }
      Map<String, Job> next = new LinkedHashMap<>(committed);
      next.put(job.id(), job);
      commit(next);
    }
  }

  @Override
  public Optional<Job> get(String id) {
    if (id == null) return Optional.empty();
    return Optional.ofNullable(committed.get(id));
  }

  @Override
  public List<Job> list() {
    return sorted(committed.values());
  }

  @Override
  public Optional<Job> update(String id, UnaryOperator<Job> mutation) {
    if (id == null) return Optional.empty();
    synchronized (lock) {
      Job current = committed.get(id);
      if (current == null) return Optional.empty();
      Job updated = InMemoryJobStore.apply(current, mutation);
      if (updated == current) return Optional.of(current);
      Map<String, Job> next = new LinkedHashMap<>(committed);
      next.put(id, updated);
      commit(next);
      return Optional.of(updated);
    }
  }

  @Override
  public boolean delete(String id) {
    if (id == null) return false;
    synchronized (lock) {
      if (!committed.containsKey(id)) return false;
      Map<String, Job> next = new LinkedHashMap<>(committed);
      next.remove(id);
      commit(next);
      return true;
    }
  }

  @Override
  public int deleteIf(Predicate<Job> predicate) {
    synchronized (lock) {
      Map<String, Job> next = new LinkedHashMap<>(committed);
      next.values().removeIf(predicate);
      int removed = committed.size() - next.size();
      if (removed == 0) return 0;
      commit(next);
      return removed;
    }
  }

  @Override
  public void deleteAll() {
    synchronized (lock) {
      commit(new LinkedHashMap<>());
    }
  }

  // Caller must hold the lock. The snapshot is published only once the document is on disk.
  private void commit(Map<String, Job> next) {
    flush(next.values());
    committed = Collections.unmodifiableMap(next);
  }

  private void flush(Iterable<Job> records) {
    Path tmp = null;
    try {
      tmp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
      mapper.writeValue(tmp.toFile(), new Document(FORMAT_VERSION, sorted(records)));
      try {
        Files.move(
            tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
      }
      tmp = null;
    } catch (IOException e) {
      throw new StorageException("Failed to write job store " + file, e);
    } finally {
      if (tmp != null) {
        try {
          Files.deleteIfExists(tmp);
        } catch (IOException e) {
          log.warn("Could not remove temporary job store file {}: {}", tmp, e.getMessage());
        }
      }
    }
  }

  private static List<Job> sorted(Iterable<Job> source) {
    List<Job> out = new ArrayList<>();
    source.forEach(out::add);
    out.sort(Comparator.comparingLong(Job::sequence));
    return out;
  }
}
