package com.gentoro.galleryup.bandwidth;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.LongSupplier;

/**
 * Rolling-window transfer-rate estimator. Samples older than the window are discarded on every
 * write and ignored on every read.
 */
public final class BandwidthTracker {
  public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(10);

  private final long windowMillis;
  private final LongSupplier clock;
  private final Deque<Sample> samples = new ArrayDeque<>();
  private long totalBytes;

  public BandwidthTracker() {
    this(DEFAULT_WINDOW, System::currentTimeMillis);
  }

  public BandwidthTracker(Duration window, LongSupplier clock) {
    if (window.isZero() || window.isNegative()) {
      throw new IllegalArgumentException("Window must be positive: " + window);
    }
    this.windowMillis = window.toMillis();
    this.clock = clock;
  }

  public synchronized void addTransfer(long sizeBytes) {
    long now = clock.getAsLong();
    samples.addLast(new Sample(now, sizeBytes));
    totalBytes += sizeBytes;
    evictBefore(now - windowMillis);
  }

  /** Current rate in KiB/s; zero until at least two samples fall inside the window. */
  public synchronized double getCurrentRate() {
    long now = clock.getAsLong();
    long cutoff = now - windowMillis;
    long bytes = 0;
    long oldest = Long.MAX_VALUE;
    int count = 0;
    for (Sample s : samples) {
      if (s.timestamp() > cutoff) {
        bytes += s.bytes();
        oldest = Math.min(oldest, s.timestamp());
        count++;
      }
    }
    if (count < 2) {
      return 0.0;
    }
    long elapsed = now - oldest;
    if (elapsed <= 0) {
      return 0.0;
    }
    return (bytes / (elapsed / 1000.0)) / 1024.0;
  }

  /** Bytes reported since construction or the last {@link #reset()}. */
  public synchronized long getTotalBytes() {
    return totalBytes;
  }

  public synchronized void reset() {
    samples.clear();
    totalBytes = 0;
  }

  private void evictBefore(long cutoff) {
    while (!samples.isEmpty() && samples.peekFirst().timestamp() <= cutoff) {
      samples.removeFirst();
    }
  }

  private record Sample(long timestamp, long bytes) {}
}
