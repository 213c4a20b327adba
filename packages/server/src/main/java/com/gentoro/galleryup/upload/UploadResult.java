package com.gentoro.galleryup.upload;

import com.gentoro.galleryup.queue.DimensionStats;
import java.util.List;

/** Outcome of one {@link Uploader#upload} call. */
public record UploadResult(
    int successfulCount,
    int failedCount,
    List<FailedImage> failedDetails,
    String galleryId,
    String galleryName,
    String galleryUrl,
    List<UploadedImage> images,
    int totalImages,
    long totalSize,
    long uploadedSize,
    long uploadTimeMillis,
    DimensionStats dimensions) {

  public UploadResult {
    failedDetails = List.copyOf(failedDetails);
    images = List.copyOf(images);
  }

  public List<String> failedFileNames() {
    return failedDetails.stream().map(FailedImage::fileName).toList();
  }

  /** An image that could not be transferred after all retry rounds. */
  public record FailedImage(String fileName, String reason) {}

  /** An image transferred during this run. */
  public record UploadedImage(String fileName, String imageUrl, String thumbUrl, long sizeBytes) {}
}
