package com.gentoro.galleryup;

import com.gentoro.galleryup.artifacts.ArtifactWriter;
import com.gentoro.galleryup.bandwidth.BandwidthTracker;
import com.gentoro.galleryup.coordination.ConcurrencyCoordinator;
import com.gentoro.galleryup.disk.DiskSpaceAdmissionController;
import com.gentoro.galleryup.events.QueueEventBus;
import com.gentoro.galleryup.exception.StateException;
import com.gentoro.galleryup.http.EmbeddedJettyServer;
import com.gentoro.galleryup.http.OkHttpFactory;
import com.gentoro.galleryup.http.WebhookNotifier;
import com.gentoro.galleryup.logging.LoggingService;
import com.gentoro.galleryup.management.ManagementServer;
import com.gentoro.galleryup.queue.GalleryQueueItem;
import com.gentoro.galleryup.queue.JsonFileQueueStore;
import com.gentoro.galleryup.queue.QueueManager;
import com.gentoro.galleryup.queue.QueueStats;
import com.gentoro.galleryup.queue.QueueStatus;
import com.gentoro.galleryup.scan.GalleryScanner;
import com.gentoro.galleryup.upload.DirectoryImageHostClient;
import com.gentoro.galleryup.upload.UploadEngine;
import com.gentoro.galleryup.upload.UploadWorker;
import com.gentoro.galleryup.upload.WorkerPool;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/** Wires the queue, admission gates, workers and management endpoints into one process. */
public class GalleryUp {

  private static final org.slf4j.Logger log = LoggingService.getLogger(GalleryUp.class);

  static final Duration DRAIN_POLL = Duration.ofMillis(500);
  static final Duration WEBHOOK_TIMEOUT = Duration.ofSeconds(15);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private volatile PipelineSettings settings;
  private QueueEventBus events;
  private QueueManager queueManager;
  private ConcurrencyCoordinator coordinator;
  private DiskSpaceAdmissionController diskController;
  private BandwidthTracker bandwidthTracker;
  private UploadEngine uploader;
  private ArtifactWriter artifactWriter;
  private GalleryScanner scanner;
  private WebhookNotifier webhook;
  private WorkerPool workerPool;
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public GalleryUp(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    String mode = startupParameters.mode();

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Apply logging levels from application.yaml as early as possible
    LoggingService.applyConfiguration(configuration());
    this.settings = PipelineSettings.from(configuration());
    configurationProvider.setValidator(PipelineSettings::from);
    configurationProvider.addListener(this::onConfigurationReloaded);

    createDirectories(settings.dataDir(), settings.tempDir());

    this.events = new QueueEventBus();
    this.queueManager = new QueueManager(new JsonFileQueueStore(settings.dataDir()), events);
    int recovered = queueManager.recoverInterrupted();
    if (recovered > 0) {
      log.warn("Recovered {} upload(s) interrupted by the previous shutdown", recovered);
    }

    this.coordinator =
        new ConcurrencyCoordinator(settings.globalLimit(), settings.perHostLimit());
    this.diskController =
        new DiskSpaceAdmissionController(
            settings.dataDir(), settings.tempDir(), settings.diskThresholds());
    diskController.start();
    this.bandwidthTracker = new BandwidthTracker();

    this.uploader =
        new UploadEngine(
            new DirectoryImageHostClient(settings.defaultHost(), settings.localTargetDir(), 0));
    this.artifactWriter = new ArtifactWriter(settings.dataDir());
    this.scanner = new GalleryScanner(queueManager, settings.defaultHost());

    if (settings.webhookUrl() != null) {
      this.webhook =
          new WebhookNotifier(settings.webhookUrl(), OkHttpFactory.create(WEBHOOK_TIMEOUT));
      events.register(webhook);
      log.info("Queue status changes are posted to {}", settings.webhookUrl());
    }

    this.workerPool =
        new WorkerPool(
            settings.workers(),
            i ->
                new UploadWorker(
                    "upload-worker-" + (i + 1),
                    queueManager,
                    coordinator,
                    diskController,
                    uploader,
                    bandwidthTracker,
                    () -> settings.workerOptions(),
                    artifactWriter,
                    this::logQueueStats));

    if (settings.httpEnabled()) {
      this.httpServer = new EmbeddedJettyServer(settings.httpHostname(), settings.httpPort());
      try {
        new ManagementServer(this).register(httpServer);
        httpServer.start();
      } catch (RuntimeException e) {
        shutdown();
        throw new StateException("Could not start http server", e);
      }
    }

    for (Path folder : startupParameters.foldersToAdd()) {
      GalleryQueueItem item = scanner.scan(folder, true);
      log.info("Added {} as {}", item.getPath(), item.getStatus());
    }

    workerPool.start();
    configurationProvider.startWatching(settings.reloadInterval());
    log.info(
        "GalleryUp started in {} mode with {} worker(s), data in {}",
        mode,
        settings.workers(),
        settings.dataDir());
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    registerShutdownHook();
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Block until no item is queued or uploading and every worker is idle, then shut down. Returns
   * early if a shutdown signal arrives first.
   */
  public void waitUntilDrained() {
    registerShutdownHook();
    try {
      while (!shutdownLatch.await(DRAIN_POLL.toMillis(), TimeUnit.MILLISECONDS)) {
        if (isDrained()) {
          log.info("Queue drained: {}", queueManager.getQueueStats().countByStatus());
          shutdown();
          return;
        }
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      shutdown();
    }
  }

  boolean isDrained() {
    QueueStats stats = queueManager.getQueueStats();
    boolean busy =
        workerPool.workers().stream().anyMatch(w -> w.getCurrentItemPath().isPresent());
    return stats.pendingOrActive() == 0 && !busy;
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    triggerShutdown("explicit");
  }

  private void registerShutdownHook() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(() -> triggerShutdown("signal"), "galleryup-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
  }

  private void triggerShutdown(String reason) {
    if (shuttingDown.compareAndSet(false, true)) {
      log.info("Shutting down ({})", reason);
      try {
        // Workers first: in-flight uploads soft-stop and persist their resume set.
        if (workerPool != null) {
          workerPool.stop();
        }
        closeQuietly(httpServer);
        closeQuietly(diskController);
        closeQuietly(webhook);
        closeQuietly(configurationProvider);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.debug("Error while closing {}: {}", closeable.getClass().getSimpleName(), e.toString());
      }
    }
  }

  private void onConfigurationReloaded(Configuration reloaded) {
    PipelineSettings next = PipelineSettings.from(reloaded);
    LoggingService.applyConfiguration(reloaded);
    coordinator.updateLimits(next.globalLimit(), next.perHostLimit());
    diskController.updateThresholds(next.diskThresholds());
    diskController.updatePaths(next.dataDir(), next.tempDir());
    if (next.workers() != settings.workers()) {
      log.warn("Worker count changes take effect after a restart");
    }
    this.settings = next;
  }

  private void logQueueStats() {
    QueueStats stats = queueManager.getQueueStats();
    log.debug(
        "Idle: {} queued, {} paused, {} incomplete, {} completed, {} KiB/s",
        stats.count(QueueStatus.QUEUED),
        stats.count(QueueStatus.PAUSED),
        stats.count(QueueStatus.INCOMPLETE),
        stats.count(QueueStatus.COMPLETED),
        Math.round(bandwidthTracker.getCurrentRate()));
  }

  private static void createDirectories(Path... dirs) {
    for (Path dir : dirs) {
      try {
        Files.createDirectories(dir);
      } catch (IOException e) {
        throw new StateException("Cannot create directory " + dir, e);
      }
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("GalleryUp not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public PipelineSettings settings() {
    return settings;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  public QueueManager queueManager() {
    return queueManager;
  }

  public ConcurrencyCoordinator coordinator() {
    return coordinator;
  }

  public DiskSpaceAdmissionController diskController() {
    return diskController;
  }

  public BandwidthTracker bandwidthTracker() {
    return bandwidthTracker;
  }

  public GalleryScanner scanner() {
    return scanner;
  }

  public WorkerPool workerPool() {
    return workerPool;
  }
}
