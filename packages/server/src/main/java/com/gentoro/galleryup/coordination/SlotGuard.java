package com.gentoro.galleryup.coordination;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped ownership of one global and one per-host upload slot. Closing the guard releases both
 * and removes the active-upload entry; further calls to {@link #close()} are no-ops.
 */
public final class SlotGuard implements AutoCloseable {
  private final ConcurrencyCoordinator coordinator;
  private final ActiveUpload upload;
  private final ConcurrencyCoordinator.GlobalGeneration generation;
  private final Semaphore hostSemaphore;
  private final AtomicBoolean released = new AtomicBoolean(false);

  SlotGuard(
      ConcurrencyCoordinator coordinator,
      ActiveUpload upload,
      ConcurrencyCoordinator.GlobalGeneration generation,
      Semaphore hostSemaphore) {
    this.coordinator = coordinator;
    this.upload = upload;
    this.generation = generation;
    this.hostSemaphore = hostSemaphore;
  }

  public ActiveUpload upload() {
    return upload;
  }

  public boolean isReleased() {
    return released.get();
  }

  @Override
  public void close() {
    if (released.compareAndSet(false, true)) {
      coordinator.release(upload, generation, hostSemaphore);
    }
  }
}
