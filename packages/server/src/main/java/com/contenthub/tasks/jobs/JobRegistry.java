package com.contenthub.tasks.jobs;

import com.contenthub.tasks.exception.InvalidFunctionException;
import com.contenthub.tasks.logging.LoggingService;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;

/**
 * Maps stable function keys to {@link JobHandler} implementations. Jobs reference their body by
 * key only, which keeps persisted records inspectable and resolvable after a restart.
 */
public final class JobRegistry {
  private static final Logger log = LoggingService.getLogger(JobRegistry.class);

  private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();

  public JobRegistry register(String function, JobHandler handler) {
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(handler, "handler");
    if (function.isBlank()) {
      throw new IllegalArgumentException("Function key must not be blank");
    }
    if (handlers.putIfAbsent(function, handler) != null) {
      throw new IllegalArgumentException("Handler already registered for function: " + function);
    }
    log.debug("Registered job handler '{}' -> {}", function, handler.getClass().getName());
    return this;
  }

  /** Register every handler exposed by {@link JobHandlerProvider}s visible to the class loader. */
  public JobRegistry loadProviders(ClassLoader classLoader) {
    for (JobHandlerProvider provider : ServiceLoader.load(JobHandlerProvider.class, classLoader)) {
      log.info("Loading job handlers from {}", provider.getClass().getName());
      provider.handlers().forEach(this::register);
    }
    return this;
  }

  public Optional<JobHandler> resolve(String function) {
    if (function == null) return Optional.empty();
    return Optional.ofNullable(handlers.get(function));
  }

  /** Resolve or fail with {@link InvalidFunctionException}. */
  public JobHandler require(String function) {
    return resolve(function).orElseThrow(() -> new InvalidFunctionException(function));
  }

  public boolean contains(String function) {
    return function != null && handlers.containsKey(function);
  }

  public Set<String> functions() {
    return new TreeSet<>(handlers.keySet());
  }
}
