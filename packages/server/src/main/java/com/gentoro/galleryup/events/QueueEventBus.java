package com.gentoro.galleryup.events;

import com.gentoro.galleryup.queue.QueueStatus;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;

/**
 * Fan-out of queue events to zero or more listeners. A failing listener is logged and skipped; it
 * never affects the publisher or the other listeners.
 */
public final class QueueEventBus {
  private static final Logger log =
      com.gentoro.galleryup.logging.LoggingService.getLogger(QueueEventBus.class);

  private final List<QueueEventListener> listeners = new CopyOnWriteArrayList<>();

  public void register(QueueEventListener listener) {
    listeners.add(listener);
  }

  public void unregister(QueueEventListener listener) {
    listeners.remove(listener);
  }

  public int listenerCount() {
    return listeners.size();
  }

  public void publishStatus(
      String path, QueueStatus previous, QueueStatus current, String message) {
    for (QueueEventListener l : listeners) {
      try {
        l.onStatusChanged(path, previous, current, message);
      } catch (RuntimeException e) {
        log.warn("Listener {} failed on status change of {}: {}", l, path, e.toString());
      }
    }
  }

  public void publishProgress(
      String path, int completed, int total, int percent, String currentImage) {
    for (QueueEventListener l : listeners) {
      try {
        l.onProgress(path, completed, total, percent, currentImage);
      } catch (RuntimeException e) {
        log.warn("Listener {} failed on progress of {}: {}", l, path, e.toString());
      }
    }
  }

  public void publishLog(String path, String message) {
    for (QueueEventListener l : listeners) {
      try {
        l.onLog(path, message);
      } catch (RuntimeException e) {
        log.warn("Listener {} failed on log line of {}: {}", l, path, e.toString());
      }
    }
  }
}
