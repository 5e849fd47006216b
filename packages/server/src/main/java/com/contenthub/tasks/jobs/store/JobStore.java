package com.contenthub.tasks.jobs.store;

import com.contenthub.tasks.jobs.Job;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Abstraction for storing job records. The store is the single source of truth for job state;
 * implementations must make every individual operation atomic with respect to concurrent callers.
 *
 * <p>Failures to read or persist are reported as {@link
 * com.contenthub.tasks.exception.StorageException}; a failed mutation leaves the store unchanged.
 */
public interface JobStore extends AutoCloseable {

  /** Insert a new record. Fails if a record with the same id already exists. */
  void create(Job job);

  Optional<Job> get(String id);

  /** Snapshot of all records ordered by enqueue sequence. */
  List<Job> list();

  /**
   * Atomically replace the record for {@code id} with {@code mutation.apply(current)}. Returning
   * the same instance from the mutation leaves the record untouched.
   *
   * @return the stored record after the call, or empty when no record exists for {@code id}
   */
  Optional<Job> update(String id, UnaryOperator<Job> mutation);

  boolean delete(String id);

  /** Delete every record matching {@code predicate}; returns the number removed. */
  int deleteIf(Predicate<Job> predicate);

  void deleteAll();

  @Override
  default void close() {}
}
