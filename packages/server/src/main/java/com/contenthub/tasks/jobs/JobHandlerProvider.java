package com.contenthub.tasks.jobs;

import java.util.Map;

/**
 * Service Provider Interface for contributing job handlers at startup.
 *
 * <p>Implementations must register using ServiceLoader by adding their fully qualified class name
 * to: META-INF/services/com.contenthub.tasks.jobs.JobHandlerProvider
 */
public interface JobHandlerProvider {
  /** Handlers keyed by the stable function name callers pass to enqueue. */
  Map<String, JobHandler> handlers();
}
