package com.gentoro.galleryup.bandwidth;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BandwidthTrackerTest {

  private final AtomicLong now = new AtomicLong(100_000);
  private final BandwidthTracker tracker =
      new BandwidthTracker(Duration.ofSeconds(10), now::get);

  @Test
  @DisplayName("Rate is zero until two samples are inside the window")
  void zeroWithSingleSample() {
    assertEquals(0.0, tracker.getCurrentRate());
    tracker.addTransfer(4096);
    assertEquals(0.0, tracker.getCurrentRate());
  }

  @Test
  @DisplayName("Rate is KiB per second over the span of samples in the window")
  void rateOverWindow() {
    tracker.addTransfer(1024);
    now.addAndGet(1000);
    tracker.addTransfer(1024);
    now.addAndGet(1000);

    // 2 KiB observed over the 2s since the oldest sample
    assertEquals(1.0, tracker.getCurrentRate(), 1e-9);
  }

  @Test
  @DisplayName("Samples older than the window are ignored")
  void oldSamplesExpire() {
    tracker.addTransfer(1_000_000);
    now.addAndGet(11_000);
    tracker.addTransfer(1024);
    now.addAndGet(1000);
    tracker.addTransfer(1024);

    assertEquals(2.0, tracker.getCurrentRate(), 1e-9);
    assertEquals(1_002_048, tracker.getTotalBytes());
  }

  @Test
  void resetClearsEverything() {
    tracker.addTransfer(10);
    now.addAndGet(10);
    tracker.addTransfer(10);
    tracker.reset();
    assertEquals(0, tracker.getTotalBytes());
    assertEquals(0.0, tracker.getCurrentRate());
  }

  @Test
  void rejectsNonPositiveWindow() {
    assertThrows(
        IllegalArgumentException.class, () -> new BandwidthTracker(Duration.ZERO, now::get));
  }
}
