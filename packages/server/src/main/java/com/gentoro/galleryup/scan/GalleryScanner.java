package com.gentoro.galleryup.scan;

import com.gentoro.galleryup.exception.ExceptionUtil;
import com.gentoro.galleryup.queue.DimensionStats;
import com.gentoro.galleryup.queue.GalleryQueueItem;
import com.gentoro.galleryup.queue.QueueManager;
import com.gentoro.galleryup.queue.QueueStatus;
import com.gentoro.galleryup.upload.ImageFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import org.slf4j.Logger;

/**
 * Adds folders to the queue. Scanning counts the images, sums their sizes and measures pixel
 * dimensions from the image headers only; pixel data is never decoded.
 */
public final class GalleryScanner {
  private static final Logger log =
      com.gentoro.galleryup.logging.LoggingService.getLogger(GalleryScanner.class);

  private final QueueManager queue;
  private final String defaultHost;

  public GalleryScanner(QueueManager queue, String defaultHost) {
    this.queue = queue;
    this.defaultHost = defaultHost;
  }

  /**
   * Scan {@code folder} and create or refresh its queue item. New and re-scanned items pass
   * through SCANNING and end READY, or QUEUED when {@code autoStart} is set. A folder that cannot
   * be read ends FAILED.
   */
  public GalleryQueueItem scan(Path folder, boolean autoStart) {
    String path = QueueManager.normalizePath(folder.toString());
    Optional<GalleryQueueItem> existing = queue.getItem(path);
    QueueStatus current = existing.map(GalleryQueueItem::getStatus).orElse(null);
    if (current != null && !current.canTransitionTo(QueueStatus.SCANNING)) {
      log.info("{} is {}, not rescanning", path, current);
      return existing.get();
    }

    GalleryQueueItem item =
        existing.orElseGet(() -> newItem(path, folder.toAbsolutePath().normalize()));
    item.setStatus(QueueStatus.SCANNING);
    queue.addOrUpdate(item);

    try {
      List<String> images = ImageFiles.list(Path.of(path));
      long totalSize = 0;
      DimensionAccumulator dims = new DimensionAccumulator();
      for (String name : images) {
        Path file = Path.of(path, name);
        totalSize += Files.size(file);
        readDimensions(file, dims);
      }
      item.setTotalImages(images.size());
      item.setTotalSize(totalSize);
      item.setDimensions(dims.toStats());
      item.setStatus(autoStart ? QueueStatus.QUEUED : QueueStatus.READY);
      log.info("Scanned {}: {} image(s), {} bytes", path, images.size(), totalSize);
    } catch (IOException | RuntimeException e) {
      String message = ExceptionUtil.extractErrorMessage(e);
      log.warn("Scan of {} failed: {}", path, message);
      item.setStatus(QueueStatus.FAILED);
      item.setErrorMessage(message);
    }
    return queue.addOrUpdate(item);
  }

  private GalleryQueueItem newItem(String path, Path folder) {
    Path fileName = folder.getFileName();
    GalleryQueueItem item =
        new GalleryQueueItem(path, fileName == null ? path : fileName.toString());
    item.setHostId(defaultHost);
    return item;
  }

  private static void readDimensions(Path file, DimensionAccumulator dims) {
    try (ImageInputStream in = ImageIO.createImageInputStream(file.toFile())) {
      if (in == null) {
        return;
      }
      Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
      if (!readers.hasNext()) {
        return;
      }
      ImageReader reader = readers.next();
      try {
        reader.setInput(in, true, true);
        dims.add(reader.getWidth(0), reader.getHeight(0));
      } finally {
        reader.dispose();
      }
    } catch (IOException e) {
      log.debug("Cannot read dimensions of {}: {}", file, e.toString());
    }
  }

  static final class DimensionAccumulator {
    private int count;
    private long sumWidth;
    private long sumHeight;
    private int minWidth = Integer.MAX_VALUE;
    private int minHeight = Integer.MAX_VALUE;
    private int maxWidth;
    private int maxHeight;

    void add(int width, int height) {
      count++;
      sumWidth += width;
      sumHeight += height;
      minWidth = Math.min(minWidth, width);
      minHeight = Math.min(minHeight, height);
      maxWidth = Math.max(maxWidth, width);
      maxHeight = Math.max(maxHeight, height);
    }

    DimensionStats toStats() {
      if (count == 0) {
        return DimensionStats.EMPTY;
      }
      return new DimensionStats(
          (double) sumWidth / count,
          (double) sumHeight / count,
          minWidth,
          minHeight,
          maxWidth,
          maxHeight);
    }
  }
}
