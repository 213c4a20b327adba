package com.gentoro.galleryup.disk;

import com.gentoro.galleryup.exception.StateException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * Samples free space on the data and temp directories and classifies it into a {@link DiskTier}.
 * Workers consult {@link #canStartUpload()} before admitting new uploads.
 *
 * <p>Sampling runs on a single scheduler thread that re-arms itself after every poll with an
 * interval derived from the observed free space: rare while space is abundant, every two seconds
 * once it falls below the critical threshold. The tier, interval and thresholds are written by
 * the poller and read by arbitrary worker threads, hence volatile.
 *
 * <p>On entering {@link DiskTier#EMERGENCY} the 20 MB reserve file in the data directory is
 * deleted to free slack for queue and log flushes. It is created again only by {@link #start()}.
 */
public final class DiskSpaceAdmissionController implements AutoCloseable {
  private static final Logger log =
      com.gentoro.galleryup.logging.LoggingService.getLogger(DiskSpaceAdmissionController.class);

  public static final String RESERVE_FILE_NAME = "disk_reserve.bin";
  public static final long RESERVE_SIZE_BYTES = 20L * 1024 * 1024;

  static final long INTERVAL_COMFORTABLE_MS = 60_000;
  static final long INTERVAL_APPROACHING_MS = 15_000;
  static final long INTERVAL_DANGER_MS = 5_000;
  static final long INTERVAL_EMERGENCY_MS = 2_000;

  private static final long MB = 1024L * 1024L;

  private final FreeSpaceProbe probe;
  private final List<DiskSpaceListener> listeners = new CopyOnWriteArrayList<>();
  private final Object pollLock = new Object();
  private final Object reserveLock = new Object();
  private final Object scheduleLock = new Object();

  private volatile Path dataDir;
  private volatile Path tempDir;
  private volatile boolean sameStore;
  private volatile Path reservePath;
  private volatile DiskThresholds thresholds;

  private volatile DiskTier currentTier = DiskTier.OK;
  private volatile long currentIntervalMillis = INTERVAL_COMFORTABLE_MS;
  private volatile long dataFree;
  private volatile long tempFree;

  private ScheduledExecutorService scheduler;
  private ScheduledFuture<?> nextPoll;

  public DiskSpaceAdmissionController(Path dataDir, Path tempDir, DiskThresholds thresholds) {
    this(dataDir, tempDir, thresholds, FreeSpaceProbe.fileStores());
  }

  public DiskSpaceAdmissionController(
      Path dataDir, Path tempDir, DiskThresholds thresholds, FreeSpaceProbe probe) {
    this.probe = probe;
    this.thresholds = thresholds;
    applyPaths(dataDir, tempDir);
  }

  public void addListener(DiskSpaceListener listener) {
    listeners.add(listener);
  }

  public void removeListener(DiskSpaceListener listener) {
    listeners.remove(listener);
  }

  /** Create the reserve file if missing, sample once, then keep sampling in the background. */
  public void start() {
    synchronized (scheduleLock) {
      if (scheduler != null) {
        throw new StateException("Disk space monitor already started");
      }
      scheduler =
          Executors.newSingleThreadScheduledExecutor(
              r -> {
                Thread t = new Thread(r, "disk-space-monitor");
                t.setDaemon(true);
                return t;
              });
    }
    ensureReserveFile();
    poll();
    scheduleNext();
    log.info(
        "Disk space monitor started (data: {}, temp: {}, same store: {})",
        dataDir,
        tempDir,
        sameStore);
  }

  public void stop() {
    synchronized (scheduleLock) {
      if (nextPoll != null) {
        nextPoll.cancel(false);
        nextPoll = null;
      }
      if (scheduler != null) {
        scheduler.shutdownNow();
        scheduler = null;
      }
    }
  }

  @Override
  public void close() {
    stop();
  }

  /** Sample free space, update the tier and poll interval, and notify listeners. */
  public void poll() {
    synchronized (pollLock) {
      long newDataFree;
      long newTempFree;
      try {
        newDataFree = probe.freeBytes(dataDir);
        newTempFree = sameStore ? newDataFree : probe.freeBytes(tempDir);
      } catch (IOException | RuntimeException e) {
        log.warn("Disk space check failed, keeping tier {}: {}", currentTier, e.toString());
        return;
      }
      dataFree = newDataFree;
      tempFree = newTempFree;

      long minFree = Math.min(newDataFree, newTempFree);
      DiskTier newTier = calculateTier(minFree);

      for (DiskSpaceListener l : listeners) {
        try {
          l.onSpaceUpdated(newDataFree, newTempFree);
        } catch (RuntimeException e) {
          log.warn("Disk space listener failed: {}", e.toString());
        }
      }

      DiskTier oldTier = currentTier;
      if (newTier != oldTier) {
        currentTier = newTier;
        String message =
            "Disk space tier: %s -> %s (data: %dMB, temp: %dMB)"
                .formatted(oldTier, newTier, newDataFree / MB, newTempFree / MB);
        if (newTier == DiskTier.OK) {
          log.info(message);
        } else {
          log.warn(message);
        }
        for (DiskSpaceListener l : listeners) {
          try {
            l.onTierChanged(oldTier, newTier);
          } catch (RuntimeException e) {
            log.warn("Disk tier listener failed: {}", e.toString());
          }
        }
        if (newTier == DiskTier.EMERGENCY) {
          requestEmergencySpace();
        }
      }

      long newInterval = calculateInterval(minFree);
      if (newInterval != currentIntervalMillis) {
        log.debug("Disk poll interval {}ms -> {}ms", currentIntervalMillis, newInterval);
        currentIntervalMillis = newInterval;
      }
    }
  }

  public DiskTier calculateTier(long freeBytes) {
    DiskThresholds t = thresholds;
    if (freeBytes < t.emergencyBytes()) {
      return DiskTier.EMERGENCY;
    } else if (freeBytes < t.criticalBytes()) {
      return DiskTier.CRITICAL;
    } else if (freeBytes < t.warningBytes()) {
      return DiskTier.WARNING;
    }
    return DiskTier.OK;
  }

  public long calculateInterval(long freeBytes) {
    DiskThresholds t = thresholds;
    if (freeBytes > t.warningBytes() * 2) {
      return INTERVAL_COMFORTABLE_MS;
    } else if (freeBytes > t.warningBytes()) {
      return INTERVAL_APPROACHING_MS;
    } else if (freeBytes > t.criticalBytes()) {
      return INTERVAL_DANGER_MS;
    }
    return INTERVAL_EMERGENCY_MS;
  }

  public boolean canStartUpload() {
    return currentTier.allowsUploads();
  }

  /** True when the temp directory holds an archive of the given size plus the critical margin. */
  public boolean canCreateArchive(long estimatedBytes) {
    return tempFree - thresholds.criticalBytes() > estimatedBytes;
  }

  /**
   * Delete the reserve file. Returns the bytes freed, or 0 when the file is already gone or could
   * not be deleted.
   */
  public long requestEmergencySpace() {
    synchronized (reserveLock) {
      Path reserve = reservePath;
      try {
        if (!Files.exists(reserve)) {
          return 0;
        }
        long size = Files.size(reserve);
        if (Files.deleteIfExists(reserve)) {
          log.warn("Deleted disk reserve file, freed {}MB", size / MB);
          return size;
        }
      } catch (IOException e) {
        log.error("Failed to delete reserve file {}: {}", reserve, e.toString());
      }
      return 0;
    }
  }

  public void updateThresholds(long warningMb, long criticalMb, long emergencyMb) {
    updateThresholds(DiskThresholds.ofMegabytes(warningMb, criticalMb, emergencyMb));
  }

  public void updateThresholds(DiskThresholds newThresholds) {
    this.thresholds = newThresholds;
    log.debug("Disk thresholds updated: {}", newThresholds);
  }

  public void updatePaths(Path newDataDir, Path newTempDir) {
    synchronized (pollLock) {
      applyPaths(newDataDir, newTempDir);
    }
    log.info("Disk space monitor paths updated (data: {}, temp: {})", newDataDir, newTempDir);
  }

  public DiskTier getCurrentTier() {
    return currentTier;
  }

  public long getCurrentIntervalMillis() {
    return currentIntervalMillis;
  }

  public long getDataFree() {
    return dataFree;
  }

  public long getTempFree() {
    return tempFree;
  }

  public DiskThresholds getThresholds() {
    return thresholds;
  }

  public Path getReservePath() {
    return reservePath;
  }

  /** Create the reserve file when it does not exist yet. */
  void ensureReserveFile() {
    synchronized (reserveLock) {
      Path reserve = reservePath;
      if (Files.exists(reserve)) {
        return;
      }
      byte[] chunk = new byte[(int) MB];
      try {
        Files.createDirectories(reserve.getParent());
        try (OutputStream out = Files.newOutputStream(reserve)) {
          for (long written = 0; written < RESERVE_SIZE_BYTES; written += chunk.length) {
            out.write(chunk);
          }
        }
        log.info("Created {}MB disk reserve at {}", RESERVE_SIZE_BYTES / MB, reserve);
      } catch (IOException e) {
        log.warn("Could not create disk reserve file {}: {}", reserve, e.toString());
        try {
          Files.deleteIfExists(reserve);
        } catch (IOException cleanup) {
          log.debug("Could not remove partial reserve file {}", reserve, cleanup);
        }
      }
    }
  }

  private void applyPaths(Path newDataDir, Path newTempDir) {
    this.dataDir = newDataDir;
    this.tempDir = newTempDir;
    this.sameStore = probe.sameStore(newDataDir, newTempDir);
    this.reservePath = newDataDir.resolve(RESERVE_FILE_NAME);
  }

  private void scheduleNext() {
    synchronized (scheduleLock) {
      if (scheduler == null || scheduler.isShutdown()) {
        return;
      }
      nextPoll =
          scheduler.schedule(
              () -> {
                try {
                  poll();
                } finally {
                  scheduleNext();
                }
              },
              currentIntervalMillis,
              TimeUnit.MILLISECONDS);
    }
  }
}
