package com.gentoro.galleryup.upload;

import com.gentoro.galleryup.queue.DimensionStats;

/**
 * Per-run upload options. The values from configuration form a template that the worker
 * specializes for each item with {@link #forItem}.
 */
public record UploadConfig(
    String hostId,
    int thumbnailSize,
    int thumbnailFormat,
    int maxRetries,
    int parallelBatchSize,
    boolean publicGallery,
    String templateName,
    String existingGalleryId,
    String excludeFileName,
    DimensionStats dimensions) {

  public UploadConfig {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
    }
    if (parallelBatchSize <= 0) {
      throw new IllegalArgumentException(
          "parallelBatchSize must be positive: " + parallelBatchSize);
    }
    if (dimensions == null) {
      dimensions = DimensionStats.EMPTY;
    }
  }

  public static UploadConfig defaults(String hostId) {
    return new UploadConfig(hostId, 3, 2, 3, 4, true, "default", null, null, null);
  }

  public UploadConfig forItem(
      String itemHostId,
      String itemTemplate,
      String galleryId,
      String excludeFile,
      DimensionStats itemDimensions) {
    return new UploadConfig(
        itemHostId == null ? hostId : itemHostId,
        thumbnailSize,
        thumbnailFormat,
        maxRetries,
        parallelBatchSize,
        publicGallery,
        itemTemplate == null ? templateName : itemTemplate,
        galleryId,
        excludeFile,
        itemDimensions);
  }
}
