package com.gentoro.galleryup.exception;

/** Failure reading or writing durable queue state or artifacts. */
public class StorageException extends GalleryUpException {
  public StorageException(String message) {
    super(GalleryUpErrorCode.STORAGE_ERROR, message);
  }

  public StorageException(String message, Throwable cause) {
    super(GalleryUpErrorCode.STORAGE_ERROR, message, cause);
  }
}
