package com.gentoro.galleryup.queue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Simple in-memory QueueStore. Stores and returns copies. */
public final class InMemoryQueueStore implements QueueStore {
  private final Map<String, GalleryQueueItem> map = new ConcurrentHashMap<>();

  @Override
  public void put(GalleryQueueItem item) {
    map.put(item.getPath(), item.copy());
  }

  @Override
  public void putAll(Collection<GalleryQueueItem> items) {
    for (GalleryQueueItem item : items) {
      put(item);
    }
  }

  @Override
  public Optional<GalleryQueueItem> get(String path) {
    return Optional.ofNullable(map.get(path)).map(GalleryQueueItem::copy);
  }

  @Override
  public List<GalleryQueueItem> all() {
    List<GalleryQueueItem> items = new ArrayList<>(map.size());
    for (GalleryQueueItem item : map.values()) {
      items.add(item.copy());
    }
    items.sort(QUEUE_ORDER);
    return items;
  }

  @Override
  public boolean remove(String path) {
    return map.remove(path) != null;
  }
}
