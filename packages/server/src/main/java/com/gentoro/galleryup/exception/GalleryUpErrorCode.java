package com.gentoro.galleryup.exception;

/** Error categories attached to every {@link GalleryUpException}. */
public enum GalleryUpErrorCode {
  UNKNOWN,
  CONFIG_ERROR,
  STATE_ERROR,
  ADMISSION_TIMEOUT,
  UPLOAD_ERROR,
  STORAGE_ERROR,
  NETWORK_ERROR
}
