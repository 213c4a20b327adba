package com.gentoro.galleryup.upload;

import com.gentoro.galleryup.bandwidth.BandwidthTracker;
import com.gentoro.galleryup.coordination.ConcurrencyCoordinator;
import com.gentoro.galleryup.coordination.SlotGuard;
import com.gentoro.galleryup.disk.DiskSpaceAdmissionController;
import com.gentoro.galleryup.exception.ErrorDetails;
import com.gentoro.galleryup.exception.ExceptionUtil;
import com.gentoro.galleryup.exception.SlotTimeoutException;
import com.gentoro.galleryup.exception.StateException;
import com.gentoro.galleryup.queue.GalleryQueueItem;
import com.gentoro.galleryup.queue.QueueManager;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Long-running loop that takes one queued gallery at a time and uploads it.
 *
 * <p>Each iteration reserves the next QUEUED item, checks the disk gate and the coordinator,
 * acquires a slot, claims the item and runs the {@link Uploader}. When any gate is closed the
 * reservation is released and the item stays QUEUED for a later pass. The slot is held in a
 * try-with-resources block so it is returned on every exit path.
 *
 * <p>Several workers may share one coordinator, disk controller and queue. Options are read
 * through a supplier on every pass, so reloaded settings apply to the next item. Control methods
 * are safe to call from any thread.
 */
public final class UploadWorker {
  private static final Logger log =
      com.gentoro.galleryup.logging.LoggingService.getLogger(UploadWorker.class);

  private final String name;
  private final QueueManager queue;
  private final ConcurrencyCoordinator coordinator;
  private final DiskSpaceAdmissionController disk;
  private final Uploader uploader;
  private final BandwidthTracker bandwidth;
  private final Supplier<WorkerOptions> options;
  private final CompletionHandler completionHandler;
  private final IdleMaintenance idleMaintenance;

  private final Object idleMonitor = new Object();
  private final Object lifecycleLock = new Object();
  private final AtomicBoolean stopCurrent = new AtomicBoolean(false);
  private final Set<String> resumeSet = Collections.synchronizedSet(new LinkedHashSet<>());

  private volatile boolean running;
  private volatile boolean paused;
  private volatile String currentItemPath;
  private volatile long lastMaintenance;
  private Thread thread;

  public UploadWorker(
      String name,
      QueueManager queue,
      ConcurrencyCoordinator coordinator,
      DiskSpaceAdmissionController disk,
      Uploader uploader,
      BandwidthTracker bandwidth,
      Supplier<WorkerOptions> options,
      CompletionHandler completionHandler,
      IdleMaintenance idleMaintenance) {
    this.name = name;
    this.queue = queue;
    this.coordinator = coordinator;
    this.disk = disk;
    this.uploader = uploader;
    this.bandwidth = bandwidth;
    this.options = options;
    this.completionHandler = completionHandler == null ? CompletionHandler.NONE : completionHandler;
    this.idleMaintenance = idleMaintenance == null ? IdleMaintenance.NONE : idleMaintenance;
  }

  /** Launch the loop on a thread named after this worker. */
  public void start() {
    synchronized (lifecycleLock) {
      if (thread != null) {
        throw new StateException("Worker " + name + " already started");
      }
      running = true;
      thread = new Thread(this::run, name);
      thread.start();
    }
    log.info("Upload worker {} started", name);
  }

  /** Stop taking new items; the current upload soft-stops. Blocks until the loop has exited. */
  public void stop() {
    Thread t;
    synchronized (lifecycleLock) {
      running = false;
      t = thread;
    }
    wakeUp();
    if (t == null || t == Thread.currentThread()) {
      return;
    }
    try {
      t.join();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for worker {} to stop", name);
      return;
    }
    log.info("Upload worker {} stopped", name);
  }

  /** Stop taking new items. The current upload continues. */
  public void pause() {
    paused = true;
    log.info("Upload worker {} paused", name);
  }

  public void resume() {
    paused = false;
    wakeUp();
    log.info("Upload worker {} resumed", name);
  }

  /**
   * Ask the current upload to finish its in-flight images and stop. The item becomes PAUSED once
   * the uploader has seen the request; a run that already finished still completes.
   *
   * @return false when nothing is being uploaded
   */
  public boolean stopCurrentUpload() {
    String path = currentItemPath;
    if (path == null) {
      return false;
    }
    stopCurrent.set(true);
    log.info("Soft stop requested for {}", path);
    return true;
  }

  public boolean isRunning() {
    return running;
  }

  public boolean isPaused() {
    return paused;
  }

  public String getName() {
    return name;
  }

  public Optional<String> getCurrentItemPath() {
    return Optional.ofNullable(currentItemPath);
  }

  public BandwidthTracker getBandwidth() {
    return bandwidth;
  }

  void run() {
    while (running) {
      try {
        if (paused) {
          idle();
          continue;
        }
        if (!processNext()) {
          idle();
        }
      } catch (RuntimeException e) {
        log.error(
            "Worker {} iteration failed: {} ({})",
            name,
            ExceptionUtil.extractErrorMessage(e),
            ExceptionUtil.describeOrigin(e));
        idle();
      }
    }
  }

  /**
   * One pass of the loop.
   *
   * @return true if an item was taken (whatever its outcome), false if the worker should idle
   */
  boolean processNext() {
    Optional<GalleryQueueItem> next = queue.reserveNextQueued();
    if (next.isEmpty()) {
      maybeRunIdleMaintenance();
      return false;
    }
    GalleryQueueItem item = next.get();
    String path = item.getPath();
    String host = item.getHostId() != null ? item.getHostId() : options.get().defaultHost();

    if (!disk.canStartUpload()) {
      queue.releaseReservation(path);
      log.debug("Disk tier {} blocks new uploads, {} stays queued", disk.getCurrentTier(), path);
      return false;
    }
    if (!coordinator.canStartUpload(host)) {
      queue.releaseReservation(path);
      log.debug("No upload slot free for host {}, {} stays queued", host, path);
      return false;
    }

    SlotGuard slot = acquire(path, host);
    if (slot == null) {
      return false;
    }
    try (slot) {
      GalleryQueueItem claimed;
      try {
        claimed = queue.claimForUpload(path);
      } catch (StateException e) {
        log.info("Skipping {}: {}", path, e.getMessage());
        return true;
      }
      execute(claimed, host);
    }
    return true;
  }

  private SlotGuard acquire(String path, String host) {
    try {
      return coordinator.acquireSlot(path, host, options.get().slotTimeout());
    } catch (SlotTimeoutException e) {
      queue.releaseReservation(path);
      log.debug("{}", e.getMessage());
      return null;
    }
  }

  private void execute(GalleryQueueItem item, String host) {
    String path = item.getPath();
    currentItemPath = path;
    stopCurrent.set(false);
    resumeSet.clear();
    boolean resuming = item.getResumeFrom() != null && item.getResumeFrom().isResumable();
    if (resuming) {
      resumeSet.addAll(item.getUploadedFiles());
      log.info("Resuming {} with {} image(s) already uploaded", path, resumeSet.size());
    }

    UploadConfig config =
        options
            .get()
            .uploadConfig()
            .forItem(
                host,
                item.getTemplateName(),
                resuming ? item.getGalleryId() : null,
                null,
                item.getDimensions());

    boolean success = false;
    WorkerCallbacks callbacks = new WorkerCallbacks(path);
    try {
      UploadResult result =
          uploader.upload(
              Path.of(path), item.displayName(), config, Set.copyOf(resumeSet), callbacks);
      if (callbacks.softStopObserved) {
        queue.markPaused(path, snapshotResumeSet(), result.galleryId());
        log.info("Upload of {} paused after {} image(s)", path, result.successfulCount());
      } else if (result.failedCount() > 0) {
        queue.markIncomplete(
            path,
            snapshotResumeSet(),
            result.failedFileNames(),
            result.galleryId(),
            result.galleryUrl());
        log.warn("Upload of {} incomplete: {} image(s) failed", path, result.failedCount());
      } else {
        queue.markCompleted(path, result.galleryId(), result.galleryUrl());
        success = true;
        notifyCompleted(path, item, result);
      }
    } catch (RuntimeException e) {
      if (callbacks.softStopObserved || stopCurrent.get() || !running) {
        // A stopped item never ends FAILED; what was sent stays in the resume set.
        queue.markPaused(path, snapshotResumeSet(), null);
        log.info(
            "Upload of {} paused after {} image(s); the uploader ended with: {}",
            path,
            resumeSet.size(),
            ExceptionUtil.extractErrorMessage(e));
        return;
      }
      String message = ExceptionUtil.extractErrorMessage(e);
      ErrorDetails details = ExceptionUtil.toErrorDetails(e);
      log.error(
          "Upload of {} failed [{}]: {} {}",
          path,
          details.code(),
          message,
          details.context() == null ? "" : details.context(),
          e);
      queue.markFailed(path, message);
    } finally {
      coordinator.recordCompletion(success);
      currentItemPath = null;
      stopCurrent.set(false);
      resumeSet.clear();
    }
  }

  private void notifyCompleted(String path, GalleryQueueItem fallback, UploadResult result) {
    try {
      completionHandler.onCompleted(queue.getItem(path).orElse(fallback), result);
    } catch (RuntimeException e) {
      log.error("Completion handling failed for {}: {}", path, e.toString());
    }
  }

  private List<String> snapshotResumeSet() {
    synchronized (resumeSet) {
      return new ArrayList<>(resumeSet);
    }
  }

  private void maybeRunIdleMaintenance() {
    long now = System.currentTimeMillis();
    if (now - lastMaintenance < options.get().idleMaintenanceInterval().toMillis()) {
      return;
    }
    lastMaintenance = now;
    try {
      idleMaintenance.run();
    } catch (RuntimeException e) {
      log.warn("Idle maintenance failed: {}", e.toString());
    }
  }

  private void idle() {
    synchronized (idleMonitor) {
      if (!running) {
        return;
      }
      try {
        idleMonitor.wait(Math.max(1, options.get().idleWait().toMillis()));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        running = false;
      }
    }
  }

  private void wakeUp() {
    synchronized (idleMonitor) {
      idleMonitor.notifyAll();
    }
  }

  /** Bridges uploader callbacks to the queue, the bandwidth tracker and the resume set. */
  private final class WorkerCallbacks implements UploadCallbacks {
    private final String path;
    /** Set once the uploader has been told to stop; decides the PAUSED outcome. */
    volatile boolean softStopObserved;

    WorkerCallbacks(String path) {
      this.path = path;
    }

    @Override
    public void onProgress(int completed, int total, int percent, String currentImage) {
      queue.updateProgress(path, completed, total, percent, currentImage);
    }

    @Override
    public void onLog(String message) {
      log.info("[{}] {}", path, message);
      queue.logEvent(path, message);
    }

    @Override
    public boolean shouldSoftStop() {
      boolean stop = stopCurrent.get() || !running;
      if (stop) {
        softStopObserved = true;
      }
      return stop;
    }

    @Override
    public void onItemUploaded(String fileName, long sizeBytes) {
      bandwidth.addTransfer(sizeBytes);
      resumeSet.add(fileName);
      queue.recordUploadedImage(path, fileName, sizeBytes);
    }
  }
}
