package com.gentoro.galleryup.queue;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Persistent state of one gallery folder in the queue, keyed by its absolute path.
 *
 * <p>Instances are mutable data holders. {@link QueueManager} hands out copies, so mutating an
 * instance obtained from it has no effect until it is written back through the manager.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GalleryQueueItem {
  private String path;
  private String name;
  private QueueStatus status = QueueStatus.QUEUED;
  private int totalImages;
  private int uploadedImages;
  private long totalSize;
  private long uploadedBytes;
  private String templateName;
  private String hostId;
  private String coverSourcePath;
  private String coverHostId;
  private long addedTime;
  private long startTime;
  private long endTime;
  private String galleryId;
  private String galleryUrl;
  private String errorMessage;
  private QueueStatus resumeFrom;
  private DimensionStats dimensions = DimensionStats.EMPTY;

  // Resume set: names already on the host, persisted on PAUSED / INCOMPLETE.
  private Set<String> uploadedFiles = new LinkedHashSet<>();
  private List<String> failedFiles = new ArrayList<>();

  public GalleryQueueItem() {}

  public GalleryQueueItem(String path, String name) {
    this.path = path;
    this.name = name;
    this.addedTime = System.currentTimeMillis();
  }

  public GalleryQueueItem copy() {
    GalleryQueueItem c = new GalleryQueueItem();
    c.path = path;
    c.name = name;
    c.status = status;
    c.totalImages = totalImages;
    c.uploadedImages = uploadedImages;
    c.totalSize = totalSize;
    c.uploadedBytes = uploadedBytes;
    c.templateName = templateName;
    c.hostId = hostId;
    c.coverSourcePath = coverSourcePath;
    c.coverHostId = coverHostId;
    c.addedTime = addedTime;
    c.startTime = startTime;
    c.endTime = endTime;
    c.galleryId = galleryId;
    c.galleryUrl = galleryUrl;
    c.errorMessage = errorMessage;
    c.resumeFrom = resumeFrom;
    c.dimensions = dimensions;
    c.uploadedFiles = new LinkedHashSet<>(uploadedFiles);
    c.failedFiles = new ArrayList<>(failedFiles);
    return c;
  }

  /** Display name, falling back to the folder name. */
  public String displayName() {
    if (name != null && !name.isBlank()) return name;
    int idx = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
    return idx >= 0 ? path.substring(idx + 1) : path;
  }

  public String getPath() {
    return path;
  }

  public void setPath(String path) {
    this.path = path;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public QueueStatus getStatus() {
    return status;
  }

  public void setStatus(QueueStatus status) {
    this.status = status;
  }

  public int getTotalImages() {
    return totalImages;
  }

  public void setTotalImages(int totalImages) {
    this.totalImages = totalImages;
  }

  public int getUploadedImages() {
    return uploadedImages;
  }

  public void setUploadedImages(int uploadedImages) {
    this.uploadedImages = uploadedImages;
  }

  public long getTotalSize() {
    return totalSize;
  }

  public void setTotalSize(long totalSize) {
    this.totalSize = totalSize;
  }

  public long getUploadedBytes() {
    return uploadedBytes;
  }

  public void setUploadedBytes(long uploadedBytes) {
    this.uploadedBytes = uploadedBytes;
  }

  public String getTemplateName() {
    return templateName;
  }

  public void setTemplateName(String templateName) {
    this.templateName = templateName;
  }

  public String getHostId() {
    return hostId;
  }

  public void setHostId(String hostId) {
    this.hostId = hostId;
  }

  public String getCoverSourcePath() {
    return coverSourcePath;
  }

  public void setCoverSourcePath(String coverSourcePath) {
    this.coverSourcePath = coverSourcePath;
  }

  public String getCoverHostId() {
    return coverHostId;
  }

  public void setCoverHostId(String coverHostId) {
    this.coverHostId = coverHostId;
  }

  public long getAddedTime() {
    return addedTime;
  }

  public void setAddedTime(long addedTime) {
    this.addedTime = addedTime;
  }

  public long getStartTime() {
    return startTime;
  }

  public void setStartTime(long startTime) {
    this.startTime = startTime;
  }

  public long getEndTime() {
    return endTime;
  }

  public void setEndTime(long endTime) {
    this.endTime = endTime;
  }

  public String getGalleryId() {
    return galleryId;
  }

  public void setGalleryId(String galleryId) {
    this.galleryId = galleryId;
  }

  public String getGalleryUrl() {
    return galleryUrl;
  }

  public void setGalleryUrl(String galleryUrl) {
    this.galleryUrl = galleryUrl;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public void setErrorMessage(String errorMessage) {
    this.errorMessage = errorMessage;
  }

  public QueueStatus getResumeFrom() {
    return resumeFrom;
  }

  public void setResumeFrom(QueueStatus resumeFrom) {
    this.resumeFrom = resumeFrom;
  }

  public DimensionStats getDimensions() {
    return dimensions;
  }

  public void setDimensions(DimensionStats dimensions) {
    this.dimensions = dimensions == null ? DimensionStats.EMPTY : dimensions;
  }

  public Set<String> getUploadedFiles() {
    return uploadedFiles;
  }

  public void setUploadedFiles(Set<String> uploadedFiles) {
    this.uploadedFiles =
        uploadedFiles == null ? new LinkedHashSet<>() : new LinkedHashSet<>(uploadedFiles);
  }

  public List<String> getFailedFiles() {
    return failedFiles;
  }

  public void setFailedFiles(List<String> failedFiles) {
    this.failedFiles = failedFiles == null ? new ArrayList<>() : new ArrayList<>(failedFiles);
  }

  @Override
  public String toString() {
    return "GalleryQueueItem{path='%s', status=%s, %d/%d}"
        .formatted(path, status, uploadedImages, totalImages);
  }
}
