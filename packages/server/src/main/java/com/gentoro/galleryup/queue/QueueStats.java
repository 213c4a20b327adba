package com.gentoro.galleryup.queue;

import java.util.Map;

/** Snapshot of the queue: item counts per status plus image and byte totals. */
public record QueueStats(
    Map<QueueStatus, Integer> countByStatus,
    int totalItems,
    long totalImages,
    long uploadedImages,
    long totalBytes,
    long uploadedBytes) {

  public int count(QueueStatus status) {
    return countByStatus.getOrDefault(status, 0);
  }

  /** Items a worker may still pick up or is working on. */
  public int pendingOrActive() {
    return count(QueueStatus.QUEUED) + count(QueueStatus.UPLOADING);
  }
}
