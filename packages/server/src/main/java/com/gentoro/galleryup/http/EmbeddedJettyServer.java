package com.gentoro.galleryup.http;

import com.gentoro.galleryup.exception.ConfigException;
import com.gentoro.galleryup.exception.ExceptionUtil;
import com.gentoro.galleryup.exception.NetworkException;
import jakarta.servlet.http.HttpServlet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.util.thread.QueuedThreadPool;

/**
 * Embedded Jetty 12 server hosting the management endpoints.
 *
 * <p>Servlets are added with {@link #addServlet(String, HttpServlet)} before {@link #start()}.
 * Port {@code 0} binds an ephemeral port; {@link #getPort()} reports the bound one once started.
 * Threads are daemons so a drained process can exit while the server is still up.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.galleryup.logging.LoggingService.getLogger(EmbeddedJettyServer.class);

  static final String ANY_HOST = "0.0.0.0";

  private final String hostname;
  private final int configuredPort;
  private final Object lifecycleLock = new Object();
  private final List<String> pathSpecs = new ArrayList<>();
  private Server server;
  private ServerConnector connector;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(String hostname, int port) {
    if (StringUtils.isBlank(hostname)) {
      throw new ConfigException("Missing http.hostname configuration");
    }
    this.hostname = hostname.trim();
    this.configuredPort = port;
  }

  private void prepare() {
    if (server != null) {
      return;
    }
    try {
      QueuedThreadPool threadPool = new QueuedThreadPool();
      threadPool.setDaemon(true);
      threadPool.setName("mng-http");
      server = new Server(threadPool);

      connector = new ServerConnector(server);
      if (!ANY_HOST.equals(hostname)) {
        connector.setHost(hostname);
      }
      connector.setPort(configuredPort);
      server.addConnector(connector);

      contextHandler = new ServletContextHandler();
      contextHandler.setContextPath("/");
      server.setHandler(contextHandler);
    } catch (RuntimeException e) {
      throw new NetworkException("Failed to initialize the management HTTP server", e);
    }
  }

  /** Mount a servlet; must be called before {@link #start()}. */
  public void addServlet(String pathSpec, HttpServlet servlet) {
    synchronized (lifecycleLock) {
      prepare();
      if (server.isStarted()) {
        throw new IllegalStateException("Cannot add " + pathSpec + " to a running server");
      }
      contextHandler.addServlet(new ServletHolder(servlet), pathSpec);
      pathSpecs.add(pathSpec);
    }
  }

  public void start() {
    synchronized (lifecycleLock) {
      prepare();
      if (server.isStarted()) {
        return;
      }
      try {
        server.start();
        log.info(
            "Management API listening on {}:{} ({} endpoint(s))",
            hostname,
            connector.getLocalPort(),
            pathSpecs.size());
        log.debug("Endpoints: {}", pathSpecs);
      } catch (Exception e) {
        throw ExceptionUtil.asGalleryUpException(
            e,
            ex ->
                new NetworkException(
                    "Failed to start the management HTTP server on %s:%d"
                        .formatted(hostname, configuredPort),
                    ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) {
        return;
      }
      try {
        if (server.isRunning() || server.isStarting()) {
          server.setStopTimeout(2000);
          server.stop();
        }
      } catch (Exception e) {
        log.error("Error stopping Jetty server; continuing shutdown", e);
      } finally {
        server = null;
        connector = null;
        contextHandler = null;
        pathSpecs.clear();
      }
    }
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  /** Bound port while running, otherwise the configured one. */
  public int getPort() {
    synchronized (lifecycleLock) {
      if (connector != null && server.isStarted()) {
        return connector.getLocalPort();
      }
      return configuredPort;
    }
  }

  public List<String> getPathSpecs() {
    synchronized (lifecycleLock) {
      return Collections.unmodifiableList(new ArrayList<>(pathSpecs));
    }
  }

  @Override
  public void close() {
    stop();
  }
}
