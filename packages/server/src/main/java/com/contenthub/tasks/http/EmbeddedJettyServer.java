package com.contenthub.tasks.http;

import com.contenthub.tasks.exception.ConfigException;
import com.contenthub.tasks.exception.ExceptionUtil;
import com.contenthub.tasks.exception.NetworkException;
import com.contenthub.tasks.logging.LoggingService;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>Owns the Jetty lifecycle (prepare/start/stop) and exposes the context handler so that
 * other components can register their servlets. Listens on {@code http.hostname}:{@code
 * http.port}; port {@code 0} picks a free port.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(EmbeddedJettyServer.class);

  static final String ANY_HOST = "0.0.0.0";

  private final Configuration configuration;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Configuration configuration) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
  }

  /** Prepare the Jetty server and root context without starting it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port = configuredPort();
      String hostname;
      try {
        hostname = configuration.getString("http.hostname", ANY_HOST);
        if (Objects.isNull(hostname) || hostname.isBlank()) {
          throw new ConfigException("Missing http.hostname configuration");
        }
        hostname = hostname.trim();
      } catch (RuntimeException e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e, (ex) -> new ConfigException("Failed to resolve http.hostname configuration", ex));
      }

      try {
        // daemon threads so a stuck request cannot keep the JVM alive
        QueuedThreadPool threadPool = new QueuedThreadPool();
        threadPool.setDaemon(true);
        threadPool.setName("jetty-http");

        server = new Server(threadPool);
        ServerConnector connector = new ServerConnector(server);
        if (!ANY_HOST.equals(hostname)) {
          connector.setHost(hostname);
        }
        connector.setPort(port);
        server.addConnector(connector);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
      } catch (RuntimeException e) {
        throw new NetworkException(
            "Failed to initialize HTTP server on " + hostname + ":" + port, e);
      }
    }
  }

  /** Start Jetty if not already started. Non-blocking. */
  public void start() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }
      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }
      try {
        server.start();
        log.info("Task server listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            (ex) ->
                new NetworkException(
                    "Failed to start HTTP server; check that port "
                        + configuredPort()
                        + " is free and that this process may listen on it",
                    ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) return;
      Server s = server;
      try {
        if (s.isStarted() || s.isStarting()) {
          s.setStopTimeout(2000);
          s.stop();
        }
      } catch (Exception e) {
        // other components still need to shut down
        log.error("Error stopping HTTP server", e);
      } finally {
        server = null;
        contextHandler = null;
      }
    }
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  /** Bound port once started, the configured one before. */
  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
      }
      return configuredPort();
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  private int configuredPort() {
    try {
      return configuration.getInt("http.port", 8080);
    } catch (RuntimeException e) {
      throw new ConfigException("Failed to resolve http.port configuration", e);
    }
  }

  @Override
  public void close() {
    stop();
  }
}
