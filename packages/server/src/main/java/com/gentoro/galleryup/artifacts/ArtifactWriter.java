package com.gentoro.galleryup.artifacts;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.galleryup.exception.StorageException;
import com.gentoro.galleryup.queue.DimensionStats;
import com.gentoro.galleryup.queue.GalleryQueueItem;
import com.gentoro.galleryup.upload.CompletionHandler;
import com.gentoro.galleryup.upload.UploadResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * Writes one JSON document per completed gallery to {@code <data-dir>/artifacts}. The file holds
 * the gallery link, per-image URLs and the scan statistics so a gallery can be re-posted without
 * contacting the host again.
 */
public final class ArtifactWriter implements CompletionHandler {
  private static final Logger log =
      com.gentoro.galleryup.logging.LoggingService.getLogger(ArtifactWriter.class);

  public static final String DIRECTORY = "artifacts";

  private final Path artifactsDir;
  private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  public ArtifactWriter(Path dataDir) {
    this.artifactsDir = dataDir.resolve(DIRECTORY);
  }

  public Path getArtifactsDir() {
    return artifactsDir;
  }

  @Override
  public void onCompleted(GalleryQueueItem item, UploadResult result) {
    Path file = write(item, result);
    log.info("Artifact for {} written to {}", item.getPath(), file);
  }

  public Path write(GalleryQueueItem item, UploadResult result) {
    ObjectNode root = mapper.createObjectNode();
    root.put("path", item.getPath());
    root.put("galleryName", result.galleryName());
    root.put("galleryId", result.galleryId());
    root.put("galleryUrl", result.galleryUrl());
    root.put("hostId", item.getHostId());
    root.put("templateName", item.getTemplateName());
    root.put("totalImages", result.totalImages());
    root.put("successfulCount", result.successfulCount());
    root.put("failedCount", result.failedCount());
    root.put("totalSize", result.totalSize());
    root.put("uploadedSize", result.uploadedSize());
    root.put("uploadTimeMillis", result.uploadTimeMillis());
    root.put("startTime", item.getStartTime());
    root.put("endTime", item.getEndTime());

    DimensionStats dims = result.dimensions();
    ObjectNode dimensions = root.putObject("dimensions");
    dimensions.put("avgWidth", dims.avgWidth());
    dimensions.put("avgHeight", dims.avgHeight());
    dimensions.put("minWidth", dims.minWidth());
    dimensions.put("minHeight", dims.minHeight());
    dimensions.put("maxWidth", dims.maxWidth());
    dimensions.put("maxHeight", dims.maxHeight());

    ArrayNode images = root.putArray("images");
    for (UploadResult.UploadedImage image : result.images()) {
      ObjectNode node = images.addObject();
      node.put("fileName", image.fileName());
      node.put("imageUrl", image.imageUrl());
      node.put("thumbUrl", image.thumbUrl());
      node.put("sizeBytes", image.sizeBytes());
    }

    Path file = artifactsDir.resolve(fileName(result.galleryName(), result.galleryId()));
    try {
      Files.createDirectories(artifactsDir);
      mapper.writeValue(file.toFile(), root);
      return file;
    } catch (IOException e) {
      throw new StorageException("Failed to write artifact " + file, e);
    }
  }

  static String fileName(String galleryName, String galleryId) {
    String safeName =
        StringUtils.defaultIfBlank(galleryName, "gallery").replaceAll("[\\\\/:*?\"<>|]", "_");
    return safeName + "_" + StringUtils.defaultIfBlank(galleryId, "unknown") + ".json";
  }
}
