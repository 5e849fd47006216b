package com.contenthub.tasks.jobs.store;

import com.contenthub.tasks.exception.StorageException;
import com.contenthub.tasks.jobs.Job;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/** Simple in-memory JobStore implementation. Records do not survive a restart. */
public final class InMemoryJobStore implements JobStore {
  private final Map<String, Job> map = new ConcurrentHashMap<>();

  @Override
  public void create(Job job) {
    if (map.putIfAbsent(job.id(), job) != null) {
      throw new StorageException("Job already exists: " + job.id());
    }
  }

  @Override
  public Optional<Job> get(String id) {
    if (id == null) return Optional.empty();
    return Optional.ofNullable(map.get(id));
  }

  @Override
  public List<Job> list() {
    List<Job> out = new ArrayList<>(map.values());
    out.sort(Comparator.comparingLong(Job::sequence));
    return out;
  }

  @Override
  public Optional<Job> update(String id, UnaryOperator<Job> mutation) {
    if (id == null) return Optional.empty();
    return Optional.ofNullable(
        map.computeIfPresent(id, (key, current) -> apply(current, mutation)));
  }

  @Override
  public boolean delete(String id) {
    return id != null && map.remove(id) != null;
  }

  @Override
  public int deleteIf(Predicate<Job> predicate) {
    AtomicInteger removed = new AtomicInteger();
    for (String id : new ArrayList<>(map.keySet())) {
      map.computeIfPresent(
          id,
          (key, current) -> {
            if (predicate.test(current)) {
              removed.incrementAndGet();
              return null;
            }
            return current;
          });
    }
    return removed.get();
  }

  @Override
  public void deleteAll() {
    map.clear();
  }

  static Job apply(Job current, UnaryOperator<Job> mutation) {
    Job next = mutation.apply(current);
    if (next == null || !next.id().equals(current.id())) {
      throw new IllegalArgumentException("Mutation must return a job with id " + current.id());
    }
    return next;
  }
}
