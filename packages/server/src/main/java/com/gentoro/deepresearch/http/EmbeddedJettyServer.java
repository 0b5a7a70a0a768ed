package com.gentoro.deepresearch.http;

import com.gentoro.deepresearch.exception.ConfigException;
import com.gentoro.deepresearch.exception.ExceptionUtil;
import com.gentoro.deepresearch.exception.NetworkException;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>This class owns the Jetty lifecycle (prepare/start/stop) and exposes the {@link
 * ServletContextHandler} so that other components can register their servlets.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.deepresearch.logging.LoggingService.getLogger(EmbeddedJettyServer.class);

  private final Configuration configuration;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Configuration configuration) {
    this.configuration = configuration;
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port;
      String hostname;
      try {
        port = configuration.getInt("http.port", 8080);
        hostname = configuration.getString("http.hostname", "0.0.0.0");
        if (hostname == null || hostname.isBlank()) {
          throw new ConfigException("Missing http.hostname configuration");
        }
        hostname = hostname.trim();
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e, ex -> new ConfigException("Failed to resolve http configuration", ex));
      }

      try {
        QueuedThreadPool threadPool = new QueuedThreadPool();
        threadPool.setDaemon(true);
        threadPool.setName("jetty-http");
        server = new Server(threadPool);

        ServerConnector connector = new ServerConnector(server);
        if (!hostname.equals("0.0.0.0")) {
          connector.setHost(hostname);
        }
        connector.setPort(port);
        server.addConnector(connector);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
      } catch (Exception e) {
        throw new NetworkException(
            "There was a problem while attempting to initialize the management http listener", e);
      }
    }
  }

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
        log.info("Management endpoints listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            ex ->
                new NetworkException(
                    "Could not start the management http listener. "
                        + "Check that the configured port and hostname are available",
                    ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) return;
      try {
        server.setStopTimeout(2000);
        server.stop();
      } catch (Exception e) {
        // Logged but not rethrown so that the remaining services can still stop.
        log.error("Error stopping jetty server", e);
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

  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return server.getURI().getPort();
      }
      return configuration.getInt("http.port", 8080);
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
