package com.gentoro.galleryup.queue;

import com.gentoro.galleryup.events.QueueEventBus;
import com.gentoro.galleryup.exception.IllegalStateTransitionException;
import com.gentoro.galleryup.exception.StateException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;

/**
 * Owner of all queue item state. Every mutation runs under a single lock and is written through
 * to the {@link QueueStore} before the lock is released; events are published after it.
 *
 * <p>Workers take items in two steps. {@link #reserveNextQueued()} hides the next QUEUED item from
 * other workers without changing its status, so a worker can still back off (disk full, no slot)
 * with {@link #releaseReservation(String)}. {@link #claimForUpload(String)} then performs the
 * QUEUED to UPLOADING transition.
 */
public final class QueueManager {
  private static final Logger log =
      com.gentoro.galleryup.logging.LoggingService.getLogger(QueueManager.class);

  private final QueueStore store;
  private final QueueEventBus events;
  private final Object lock = new Object();
  private final Set<String> reserved = new HashSet<>();

  public QueueManager(QueueStore store, QueueEventBus events) {
    this.store = store;
    this.events = events;
  }

  public QueueEventBus events() {
    return events;
  }

  /** Absolute, normalized form of a folder path; the key used by the queue. */
  public static String normalizePath(String path) {
    return Paths.get(path).toAbsolutePath().normalize().toString();
  }

  /**
   * Insert the item, or replace the stored item with the same path. The original {@code
   * addedTime} is kept on update so the item keeps its place in the queue.
   */
  public GalleryQueueItem addOrUpdate(GalleryQueueItem item) {
    GalleryQueueItem toStore = item.copy();
    toStore.setPath(normalizePath(item.getPath()));
    QueueStatus previous;
    synchronized (lock) {
      Optional<GalleryQueueItem> existing = store.get(toStore.getPath());
      previous = existing.map(GalleryQueueItem::getStatus).orElse(null);
      if (existing.isPresent()) {
        toStore.setAddedTime(existing.get().getAddedTime());
      } else if (toStore.getAddedTime() == 0) {
        toStore.setAddedTime(System.currentTimeMillis());
      }
      clamp(toStore);
      store.put(toStore);
    }
    if (previous != toStore.getStatus()) {
      events.publishStatus(toStore.getPath(), previous, toStore.getStatus(), null);
    }
    return toStore.copy();
  }

  public Optional<GalleryQueueItem> getItem(String path) {
    synchronized (lock) {
      return store.get(normalizePath(path));
    }
  }

  public List<GalleryQueueItem> getAll() {
    synchronized (lock) {
      return store.all();
    }
  }

  /**
   * Reserve the next QUEUED item in queue order. A reserved item is not handed out again until
   * its reservation is released or it is claimed.
   */
  public Optional<GalleryQueueItem> reserveNextQueued() {
    synchronized (lock) {
      Optional<GalleryQueueItem> next = store.nextQueued(reserved);
      next.ifPresent(i -> reserved.add(i.getPath()));
      return next;
    }
  }

  public void releaseReservation(String path) {
    synchronized (lock) {
      reserved.remove(path);
    }
  }

  public boolean isReserved(String path) {
    synchronized (lock) {
      return reserved.contains(path);
    }
  }

  /**
   * Move a reserved item from QUEUED to UPLOADING and drop its reservation.
   *
   * @throws StateException if the item no longer exists
   * @throws IllegalStateTransitionException if it is no longer QUEUED
   */
  public GalleryQueueItem claimForUpload(String path) {
    GalleryQueueItem item;
    synchronized (lock) {
      reserved.remove(path);
      item = require(path);
      if (item.getStatus() != QueueStatus.QUEUED) {
        throw new IllegalStateTransitionException(path, item.getStatus(), QueueStatus.UPLOADING);
      }
      if (item.getResumeFrom() == null || !item.getResumeFrom().isResumable()) {
        item.setUploadedFiles(null);
        item.setUploadedBytes(0);
      }
      item.setStatus(QueueStatus.UPLOADING);
      item.setStartTime(System.currentTimeMillis());
      item.setEndTime(0);
      item.setErrorMessage(null);
      store.put(item);
    }
    events.publishStatus(path, QueueStatus.QUEUED, QueueStatus.UPLOADING, null);
    return item.copy();
  }

  /** Validated status change without any other side effect. */
  public void updateItemStatus(String path, QueueStatus status) {
    transition(path, status, null, item -> {});
  }

  /** Soft-stop observed: keep what was uploaded so a later run skips it. */
  public void markPaused(String path, Collection<String> uploadedFiles, String galleryId) {
    transition(
        path,
        QueueStatus.PAUSED,
        "Paused",
        item -> {
          item.setUploadedFiles(new LinkedHashSet<>(uploadedFiles));
          if (galleryId != null) item.setGalleryId(galleryId);
          item.setEndTime(System.currentTimeMillis());
        });
  }

  public void markIncomplete(
      String path,
      Collection<String> uploadedFiles,
      List<String> failedFiles,
      String galleryId,
      String galleryUrl) {
    transition(
        path,
        QueueStatus.INCOMPLETE,
        failedFiles.size() + " image(s) failed",
        item -> {
          item.setUploadedFiles(new LinkedHashSet<>(uploadedFiles));
          item.setFailedFiles(failedFiles);
          if (galleryId != null) item.setGalleryId(galleryId);
          if (galleryUrl != null) item.setGalleryUrl(galleryUrl);
          item.setEndTime(System.currentTimeMillis());
        });
  }

  public void markFailed(String path, String errorMessage) {
    transition(
        path,
        QueueStatus.FAILED,
        errorMessage,
        item -> {
          item.setErrorMessage(errorMessage);
          item.setEndTime(System.currentTimeMillis());
        });
  }

  public void markCompleted(String path, String galleryId, String galleryUrl) {
    transition(
        path,
        QueueStatus.COMPLETED,
        galleryUrl,
        item -> {
          item.setGalleryId(galleryId);
          item.setGalleryUrl(galleryUrl);
          item.setFailedFiles(List.of());
          item.setUploadedImages(item.getTotalImages());
          item.setEndTime(System.currentTimeMillis());
        });
  }

  /**
   * Record upload progress. {@code completed} is clamped to {@code [0, total]}; a positive {@code
   * total} replaces the stored image count.
   */
  public void updateProgress(
      String path, int completed, int total, int percent, String currentImage) {
    int clampedCompleted;
    int effectiveTotal;
    synchronized (lock) {
      Optional<GalleryQueueItem> found = store.get(path);
      if (found.isEmpty()) {
        log.debug("Progress for unknown item {} ignored", path);
        return;
      }
      GalleryQueueItem item = found.get();
      if (total > 0) {
        item.setTotalImages(total);
      }
      item.setUploadedImages(completed);
      clamp(item);
      clampedCompleted = item.getUploadedImages();
      effectiveTotal = item.getTotalImages();
      store.put(item);
    }
    events.publishProgress(
        path, clampedCompleted, effectiveTotal, Math.max(0, Math.min(100, percent)), currentImage);
  }

  /**
   * Record one transferred image: its name joins the persisted resume set and its size the byte
   * total, so an interrupted run can resume from here.
   */
  public void recordUploadedImage(String path, String fileName, long sizeBytes) {
    synchronized (lock) {
      store
          .get(path)
          .ifPresent(
              item -> {
                item.getUploadedFiles().add(fileName);
                item.setUploadedBytes(item.getUploadedBytes() + Math.max(0, sizeBytes));
                store.put(item);
              });
    }
  }

  /** Forward a log line of an item to event subscribers. */
  public void logEvent(String path, String message) {
    events.publishLog(path, message);
  }

  /**
   * Queue an item that is READY, PAUSED, INCOMPLETE or FAILED. A PAUSED or INCOMPLETE item
   * remembers where it came from so the next run resumes from its uploaded files.
   *
   * @return false if the item was already QUEUED
   */
  public boolean start(String path) {
    String key = normalizePath(path);
    QueueStatus previous;
    synchronized (lock) {
      GalleryQueueItem item = require(key);
      previous = item.getStatus();
      if (previous == QueueStatus.QUEUED) {
        return false;
      }
      if (previous == QueueStatus.UPLOADING
          || previous == QueueStatus.SCANNING
          || previous == QueueStatus.COMPLETED) {
        throw new IllegalStateTransitionException(key, previous, QueueStatus.QUEUED);
      }
      item.setResumeFrom(previous.isResumable() ? previous : null);
      if (!previous.isResumable()) {
        item.setUploadedFiles(null);
      }
      item.setStatus(QueueStatus.QUEUED);
      item.setErrorMessage(null);
      store.put(item);
    }
    events.publishStatus(key, previous, QueueStatus.QUEUED, null);
    return true;
  }

  /** Queue a COMPLETED item again as a fresh upload, discarding its resume state. */
  public void rerun(String path) {
    String key = normalizePath(path);
    synchronized (lock) {
      GalleryQueueItem item = require(key);
      if (item.getStatus() != QueueStatus.COMPLETED) {
        throw new IllegalStateTransitionException(key, item.getStatus(), QueueStatus.QUEUED);
      }
      item.setStatus(QueueStatus.QUEUED);
      item.setResumeFrom(null);
      item.setUploadedFiles(null);
      item.setFailedFiles(null);
      item.setUploadedImages(0);
      item.setUploadedBytes(0);
      item.setGalleryId(null);
      item.setGalleryUrl(null);
      item.setErrorMessage(null);
      item.setStartTime(0);
      item.setEndTime(0);
      store.put(item);
    }
    events.publishStatus(key, QueueStatus.COMPLETED, QueueStatus.QUEUED, "Re-run");
  }

  /**
   * Remove an item from the queue.
   *
   * @throws StateException if the item is uploading or reserved by a worker
   */
  public boolean remove(String path) {
    String key = normalizePath(path);
    synchronized (lock) {
      Optional<GalleryQueueItem> item = store.get(key);
      if (item.isEmpty()) {
        return false;
      }
      if (item.get().getStatus() == QueueStatus.UPLOADING || reserved.contains(key)) {
        throw new StateException("Cannot remove " + key + " while it is being uploaded");
      }
      return store.remove(key);
    }
  }

  public QueueStats getQueueStats() {
    synchronized (lock) {
      List<GalleryQueueItem> items = store.all();
      Map<QueueStatus, Integer> counts = store.countByStatus();
      long totalImages = 0;
      long uploadedImages = 0;
      long totalBytes = 0;
      long uploadedBytes = 0;
      for (GalleryQueueItem i : items) {
        totalImages += i.getTotalImages();
        uploadedImages += i.getUploadedImages();
        totalBytes += i.getTotalSize();
        uploadedBytes += i.getUploadedBytes();
      }
      return new QueueStats(
          Map.copyOf(counts), items.size(), totalImages, uploadedImages, totalBytes, uploadedBytes);
    }
  }

  /**
   * Items still marked UPLOADING were interrupted by a previous process exit. They become
   * INCOMPLETE and resume from their persisted uploaded files.
   *
   * @return number of recovered items
   */
  public int recoverInterrupted() {
    List<GalleryQueueItem> recovered = new ArrayList<>();
    synchronized (lock) {
      for (GalleryQueueItem item : store.all()) {
        if (item.getStatus() == QueueStatus.UPLOADING) {
          item.setStatus(QueueStatus.INCOMPLETE);
          item.setErrorMessage("Interrupted by shutdown");
          recovered.add(item);
        }
      }
      if (!recovered.isEmpty()) {
        store.putAll(recovered);
      }
    }
    for (GalleryQueueItem item : recovered) {
      log.warn("Recovered interrupted upload {}", item.getPath());
      events.publishStatus(
          item.getPath(), QueueStatus.UPLOADING, QueueStatus.INCOMPLETE, item.getErrorMessage());
    }
    return recovered.size();
  }

  private void transition(
      String path, QueueStatus target, String message, Consumer<GalleryQueueItem> mutator) {
    QueueStatus previous;
    synchronized (lock) {
      GalleryQueueItem item = require(path);
      previous = item.getStatus();
      if (!previous.canTransitionTo(target)) {
        throw new IllegalStateTransitionException(path, previous, target);
      }
      item.setStatus(target);
      mutator.accept(item);
      clamp(item);
      store.put(item);
    }
    log.debug("{}: {} -> {}", path, previous, target);
    events.publishStatus(path, previous, target, message);
  }

  private GalleryQueueItem require(String path) {
    return store.get(path).orElseThrow(() -> new StateException("Unknown queue item: " + path));
  }

  private static void clamp(GalleryQueueItem item) {
    int total = Math.max(0, item.getTotalImages());
    item.setTotalImages(total);
    item.setUploadedImages(Math.max(0, Math.min(item.getUploadedImages(), total)));
  }
}
