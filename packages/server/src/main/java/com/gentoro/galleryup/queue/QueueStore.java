package com.gentoro.galleryup.queue;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Abstraction for durable storage of queue items, keyed by gallery path. */
public interface QueueStore {
  /** Queue order used by {@link #nextQueued(Set)}: oldest first, path as tie-breaker. */
  Comparator<GalleryQueueItem> QUEUE_ORDER =
      Comparator.comparingLong(GalleryQueueItem::getAddedTime)
          .thenComparing(GalleryQueueItem::getPath);

  /** Insert or replace the item with the same path. */
  void put(GalleryQueueItem item);

  /** Bulk upsert. */
  void putAll(Collection<GalleryQueueItem> items);

  Optional<GalleryQueueItem> get(String path);

  List<GalleryQueueItem> all();

  boolean remove(String path);

  /** First {@link QueueStatus#QUEUED} item in queue order whose path is not excluded. */
  default Optional<GalleryQueueItem> nextQueued(Set<String> excludedPaths) {
    return all().stream()
        .filter(i -> i.getStatus() == QueueStatus.QUEUED)
        .filter(i -> !excludedPaths.contains(i.getPath()))
        .min(QUEUE_ORDER);
  }

  default Map<QueueStatus, Integer> countByStatus() {
    Map<QueueStatus, Integer> counts = new EnumMap<>(QueueStatus.class);
    for (QueueStatus s : QueueStatus.values()) counts.put(s, 0);
    for (GalleryQueueItem i : all()) counts.merge(i.getStatus(), 1, Integer::sum);
    return counts;
  }
}
