package com.gentoro.galleryup.events;

import com.gentoro.galleryup.queue.QueueStatus;

/**
 * Subscriber to queue activity. All methods have empty defaults so listeners implement only what
 * they care about. Invoked on the thread that caused the event; implementations must not block.
 */
public interface QueueEventListener {
  default void onStatusChanged(
      String path, QueueStatus previous, QueueStatus current, String message) {}

  default void onProgress(
      String path, int completed, int total, int percent, String currentImage) {}

  default void onLog(String path, String message) {}
}
