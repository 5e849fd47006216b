package com.contenthub.tasks;

import com.contenthub.tasks.exception.ConfigException;
import com.contenthub.tasks.exception.ExecutionException;
import com.contenthub.tasks.exception.StateException;
import com.contenthub.tasks.http.EmbeddedJettyServer;
import com.contenthub.tasks.jobs.JobRegistry;
import com.contenthub.tasks.jobs.JobScheduler;
import com.contenthub.tasks.jobs.WorkerPool;
import com.contenthub.tasks.jobs.store.JobStore;
import com.contenthub.tasks.jobs.store.JobStoreFactory;
import com.contenthub.tasks.logging.LoggingService;
import com.contenthub.tasks.management.TasksManagementServer;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Process bootstrap: loads configuration, builds the job registry, store, worker pool and
 * scheduler, and serves the task endpoints over HTTP.
 *
 * <p>Job handlers come from {@link com.contenthub.tasks.jobs.JobHandlerProvider} implementations on
 * the classpath, plus anything an embedding application registers on {@link #registry()} before
 * calling {@link #initialize()}.
 */
public class TaskServer {
  private static final Logger log = LoggingService.getLogger(TaskServer.class);

  public static final String WORKERS_KEY = "jobs.workers";
  public static final String GRACE_KEY = "jobs.shutdown.grace-seconds";

  private final StartupParameters startupParameters;
  private final JobRegistry registry = new JobRegistry();
  private ConfigurationProvider configurationProvider;
  private JobScheduler scheduler;
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean initialized = new AtomicBoolean(false);
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public TaskServer(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    if (!initialized.compareAndSet(false, true)) {
      throw new StateException("TaskServer already initialized");
    }
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    startupParameters
        .overrides()
        .forEach(
            (key, value) -> {
              log.info("Command line override {}={}", key, value);
              configuration().setProperty(key, value);
            });
    LoggingService.applyConfiguration(configuration());

    registry.loadProviders(Thread.currentThread().getContextClassLoader());
    log.info("Registered job functions: {}", registry.functions());

    int workers = configuration().getInt(WORKERS_KEY, 4);
    if (workers < 1) {
      throw new ConfigException(WORKERS_KEY + " must be at least 1, got " + workers);
    }
    long graceSeconds = configuration().getLong(GRACE_KEY, 10L);
    if (graceSeconds < 0) {
      throw new ConfigException(GRACE_KEY + " must not be negative, got " + graceSeconds);
    }

    JobStore store = JobStoreFactory.create(configuration());
    this.scheduler =
        new JobScheduler(
            store,
            registry,
            new WorkerPool(workers),
            Duration.ofSeconds(graceSeconds),
            Clock.systemUTC());

    this.httpServer = new EmbeddedJettyServer(configuration());
    try {
      httpServer.prepare();
      new TasksManagementServer(scheduler).register(httpServer.getContextHandler());
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw new ExecutionException("Could not start http server", e);
    }
    log.info("Task server started with {} worker(s)", workers);
  }

  /**
   * Block the current thread until a shutdown signal is received (Ctrl+C or JVM termination), then
   * release resources.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "task-server-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) return;
    log.info("Shutting down task server");
    try {
      if (httpServer != null) httpServer.close();
      if (scheduler != null) scheduler.close();
    } finally {
      shutdownLatch.countDown();
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("TaskServer not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public JobRegistry registry() {
    return registry;
  }

  public JobScheduler scheduler() {
    if (scheduler == null) {
      throw new StateException("TaskServer not initialized. Call initialize() first.");
    }
    return scheduler;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}
