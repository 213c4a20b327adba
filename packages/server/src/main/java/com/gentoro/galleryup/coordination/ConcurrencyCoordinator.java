package com.gentoro.galleryup.coordination;

import com.gentoro.galleryup.exception.SlotTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * Admission control for simultaneous uploads: at most {@code globalLimit} overall and at most
 * {@code perHostLimit} per destination host.
 *
 * <p>A slot is always acquired global first, then per host, so that waiters on different hosts
 * can never hold each other's permits in reverse order. Three independent locks guard the
 * per-host semaphore map (and limits), the active-upload bookkeeping and the statistics counters.
 *
 * <p>{@link #updateLimits(Integer, Integer)} swaps the global semaphore for a new generation.
 * Holders are never evicted. The new semaphore starts with the new limit minus the slots still
 * held (at least zero); each release by an older holder hands one permit to the new generation
 * until it reaches the new limit, so a waiter is admitted as soon as one earlier holder is done.
 * Per-host semaphores keep the limit they were created with; only hosts seen afterwards use the
 * new one.
 */
public final class ConcurrencyCoordinator {
  private static final Logger log =
      com.gentoro.galleryup.logging.LoggingService.getLogger(ConcurrencyCoordinator.class);

  public static final int DEFAULT_GLOBAL_LIMIT = 3;
  public static final int DEFAULT_PER_HOST_LIMIT = 2;

  private final Object hostSemaphoreLock = new Object();
  private final Object activeUploadsLock = new Object();
  private final Object statsLock = new Object();
  private final Object globalLock = new Object();

  private volatile GlobalGeneration global;
  private int globalHeld;
  private final Map<String, Semaphore> hostSemaphores = new HashMap<>();
  private final Map<ActiveUpload, Integer> activeUploads = new LinkedHashMap<>();

  private volatile int globalLimit;
  private volatile int perHostLimit;

  private long totalStarted;
  private long totalCompleted;
  private long totalFailed;

  public ConcurrencyCoordinator() {
    this(DEFAULT_GLOBAL_LIMIT, DEFAULT_PER_HOST_LIMIT);
  }

  public ConcurrencyCoordinator(int globalLimit, int perHostLimit) {
    requirePositive("globalLimit", globalLimit);
    requirePositive("perHostLimit", perHostLimit);
    this.globalLimit = globalLimit;
    this.perHostLimit = perHostLimit;
    this.global = new GlobalGeneration(globalLimit, 0);
  }

  /**
   * Block until both a global and a per-host slot are free, or the timeout elapses.
   *
   * @return a guard that must be closed exactly once when the upload ends, however it ends
   * @throws SlotTimeoutException when no slot became available in time; no state is changed
   */
  public SlotGuard acquireSlot(String galleryId, String host, Duration timeout) {
    long deadline = System.nanoTime() + Math.max(0, timeout.toNanos());
    Semaphore hostSemaphore = getHostSemaphore(host);
    GlobalGeneration generation;
    try {
      generation = acquireGlobal(deadline);
      if (generation == null) {
        throw new SlotTimeoutException(
            "Timed out after %dms waiting for a global upload slot (%s on %s)"
                .formatted(timeout.toMillis(), galleryId, host));
      }
      boolean hostAcquired;
      try {
        hostAcquired = hostSemaphore.tryAcquire(remaining(deadline), TimeUnit.NANOSECONDS);
      } catch (InterruptedException e) {
        releaseGlobal(generation);
        throw e;
      }
      if (!hostAcquired) {
        releaseGlobal(generation);
        throw new SlotTimeoutException(
            "Timed out after %dms waiting for an upload slot on host %s (%s)"
                .formatted(timeout.toMillis(), host, galleryId));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SlotTimeoutException(
          "Interrupted while waiting for an upload slot (%s on %s)".formatted(galleryId, host), e);
    }

    ActiveUpload upload = new ActiveUpload(galleryId, host);
    synchronized (activeUploadsLock) {
      activeUploads.merge(upload, 1, Integer::sum);
    }
    synchronized (statsLock) {
      totalStarted++;
    }
    log.debug("Upload slot acquired for {} on {}", galleryId, host);
    return new SlotGuard(this, upload, generation, hostSemaphore);
  }

  /**
   * Take a permit from the current global generation. A waiter parked on a generation that gets
   * replaced is woken by the flood of permits released into it and retries on the new one.
   *
   * @return the generation the permit belongs to, or null on timeout
   */
  private GlobalGeneration acquireGlobal(long deadline) throws InterruptedException {
    while (true) {
      GlobalGeneration generation = global;
      if (!generation.semaphore.tryAcquire(remaining(deadline), TimeUnit.NANOSECONDS)) {
        return null;
      }
      synchronized (globalLock) {
        if (generation == global) {
          globalHeld++;
          return generation;
        }
      }
    }
  }

  private void releaseGlobal(GlobalGeneration generation) {
    synchronized (globalLock) {
      globalHeld--;
      GlobalGeneration current = global;
      if (generation == current) {
        current.semaphore.release();
      } else if (current.owed > 0) {
        current.owed--;
        current.semaphore.release();
      }
    }
  }

  /** Invoked once per guard by {@link SlotGuard#close()}. */
  void release(ActiveUpload upload, GlobalGeneration generation, Semaphore hostSemaphore) {
    synchronized (activeUploadsLock) {
      activeUploads.computeIfPresent(upload, (k, count) -> count > 1 ? count - 1 : null);
    }
    hostSemaphore.release();
    releaseGlobal(generation);
    log.debug("Upload slot released for {} on {}", upload.galleryId(), upload.host());
  }

  /** Non-blocking check whether a slot for {@code host} would be granted right now. */
  public boolean canStartUpload(String host) {
    return global.semaphore.availablePermits() > 0
        && getHostSemaphore(host).availablePermits() > 0;
  }

  public int getAvailableSlots() {
    return Math.max(0, global.semaphore.availablePermits());
  }

  public int getAvailableSlots(String host) {
    int hostAvailable = getHostSemaphore(host).availablePermits();
    return Math.max(0, Math.min(global.semaphore.availablePermits(), hostAvailable));
  }

  public boolean isUploadActive(String galleryId, String host) {
    synchronized (activeUploadsLock) {
      return activeUploads.containsKey(new ActiveUpload(galleryId, host));
    }
  }

  public int getActiveUploadCount() {
    synchronized (activeUploadsLock) {
      return activeUploads.values().stream().mapToInt(Integer::intValue).sum();
    }
  }

  public int getActiveUploadCount(String host) {
    synchronized (activeUploadsLock) {
      return activeUploads.entrySet().stream()
          .filter(e -> e.getKey().host().equals(host))
          .mapToInt(Map.Entry::getValue)
          .sum();
    }
  }

  public List<ActiveUpload> getActiveUploads() {
    synchronized (activeUploadsLock) {
      return new ArrayList<>(activeUploads.keySet());
    }
  }

  /** Count a finished upload; independent of slot lifetime. */
  public void recordCompletion(boolean success) {
    synchronized (statsLock) {
      if (success) {
        totalCompleted++;
      } else {
        totalFailed++;
      }
    }
  }

  public CoordinatorStatistics getStatistics() {
    int active = getActiveUploadCount();
    synchronized (statsLock) {
      return new CoordinatorStatistics(
          globalLimit, perHostLimit, active, totalStarted, totalCompleted, totalFailed);
    }
  }

  /**
   * Change the limits for future acquisitions. Either argument may be null to keep the current
   * value. Existing slot holders are never evicted.
   */
  public void updateLimits(Integer newGlobalLimit, Integer newPerHostLimit) {
    synchronized (hostSemaphoreLock) {
      if (newGlobalLimit != null) {
        requirePositive("globalLimit", newGlobalLimit);
        synchronized (globalLock) {
          int owed = Math.min(newGlobalLimit, globalHeld);
          GlobalGeneration previous = global;
          global = new GlobalGeneration(newGlobalLimit - owed, owed);
          previous.retire();
        }
        globalLimit = newGlobalLimit;
      }
      if (newPerHostLimit != null) {
        requirePositive("perHostLimit", newPerHostLimit);
        perHostLimit = newPerHostLimit;
      }
    }
    log.info("Concurrency limits updated: global={}, perHost={}", globalLimit, perHostLimit);
  }

  public int getGlobalLimit() {
    return globalLimit;
  }

  public int getPerHostLimit() {
    return perHostLimit;
  }

  Semaphore getHostSemaphore(String host) {
    synchronized (hostSemaphoreLock) {
      return hostSemaphores.computeIfAbsent(host, h -> new Semaphore(perHostLimit, true));
    }
  }

  private static long remaining(long deadline) {
    return Math.max(0, deadline - System.nanoTime());
  }

  private static void requirePositive(String name, int value) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be positive, got " + value);
    }
  }

  /**
   * One global semaphore and the permits it is still owed by holders of older generations. Only
   * read or changed under {@code globalLock}, except for waiting on the semaphore.
   */
  static final class GlobalGeneration {
    private static final int RETIRE_FLOOD = 1 << 20;

    final Semaphore semaphore;
    int owed;

    GlobalGeneration(int permits, int owed) {
      this.semaphore = new Semaphore(permits, true);
      this.owed = owed;
    }

    void retire() {
      semaphore.release(RETIRE_FLOOD);
    }
  }
}
