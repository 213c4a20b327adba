package com.gentoro.galleryup.queue;

import java.util.EnumSet;
import java.util.Set;

/** Lifecycle state of a gallery in the upload queue. */
public enum QueueStatus {
  /** Waiting for a worker. */
  QUEUED,
  /** Folder contents are being counted and measured. */
  SCANNING,
  /** Scanned, waiting for the user to start it. */
  READY,
  /** A worker holds a slot for it and is transferring images. */
  UPLOADING,
  /** Stopped on request before completion; the uploaded names are kept for resume. */
  PAUSED,
  /** Finished with some images failed; the uploaded names are kept for resume. */
  INCOMPLETE,
  /** All images transferred. Terminal unless explicitly re-run. */
  COMPLETED,
  /** Transfer aborted before per-image accounting was possible. */
  FAILED;

  public boolean canTransitionTo(QueueStatus target) {
    return allowedTargets().contains(target);
  }

  /** True for statuses from which a later run may resume with already uploaded images. */
  public boolean isResumable() {
    return this == INCOMPLETE || this == PAUSED;
  }

  public Set<QueueStatus> allowedTargets() {
    return switch (this) {
      case QUEUED -> EnumSet.of(SCANNING, UPLOADING, PAUSED);
      case SCANNING -> EnumSet.of(READY, QUEUED, FAILED);
      case READY -> EnumSet.of(QUEUED, SCANNING, UPLOADING);
      case UPLOADING -> EnumSet.of(COMPLETED, INCOMPLETE, FAILED, PAUSED);
      case PAUSED, INCOMPLETE, FAILED -> EnumSet.of(QUEUED, UPLOADING, SCANNING);
      case COMPLETED -> EnumSet.noneOf(QueueStatus.class);
    };
  }
}
