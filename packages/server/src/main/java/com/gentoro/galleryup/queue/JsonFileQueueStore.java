package com.gentoro.galleryup.queue;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gentoro.galleryup.exception.StorageException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * QueueStore persisted as a JSON array in a single file. The whole queue is kept in memory and
 * rewritten on every mutation through a temp file that replaces the target, so a crash leaves
 * either the old or the new queue on disk.
 */
public final class JsonFileQueueStore implements QueueStore {
  private static final Logger log =
      com.gentoro.galleryup.logging.LoggingService.getLogger(JsonFileQueueStore.class);

  public static final String FILE_NAME = "queue.json";

  private final Path file;
  private final ObjectMapper mapper;
  private final Map<String, GalleryQueueItem> items = new LinkedHashMap<>();

  public JsonFileQueueStore(Path dataDir) {
    this.file = dataDir.resolve(FILE_NAME);
    this.mapper =
        new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    load();
  }

  public Path getFile() {
    return file;
  }

  private void load() {
    if (!Files.exists(file)) {
      log.debug("No queue file at {}, starting empty", file);
      return;
    }
    try {
      List<GalleryQueueItem> loaded =
          mapper.readValue(file.toFile(), new TypeReference<List<GalleryQueueItem>>() {});
      for (GalleryQueueItem item : loaded) {
        if (item.getPath() != null) {
          items.put(item.getPath(), item);
        }
      }
      log.info("Loaded {} queue item(s) from {}", items.size(), file);
    } catch (IOException e) {
      throw new StorageException("Failed to read queue file " + file, e);
    }
  }

  @Override
  public synchronized void put(GalleryQueueItem item) {
    items.put(item.getPath(), item.copy());
    flush();
  }

  @Override
  public synchronized void putAll(Collection<GalleryQueueItem> batch) {
    for (GalleryQueueItem item : batch) {
      items.put(item.getPath(), item.copy());
    }
    flush();
  }

  @Override
  public synchronized Optional<GalleryQueueItem> get(String path) {
    return Optional.ofNullable(items.get(path)).map(GalleryQueueItem::copy);
  }

  @Override
  public synchronized List<GalleryQueueItem> all() {
    List<GalleryQueueItem> result = new ArrayList<>(items.size());
    for (GalleryQueueItem item : items.values()) {
      result.add(item.copy());
    }
    result.sort(QUEUE_ORDER);
    return result;
  }

  @Override
  public synchronized boolean remove(String path) {
    if (items.remove(path) == null) {
      return false;
    }
    flush();
    return true;
  }

  private void flush() {
    Path tmp = file.resolveSibling(FILE_NAME + ".tmp");
    try {
      Files.createDirectories(file.getParent());
      mapper.writeValue(tmp.toFile(), new ArrayList<>(items.values()));
      try {
        Files.move(
            tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new StorageException("Failed to write queue file " + file, e);
    }
  }
}
