package com.gentoro.galleryup.exception;

/**
 * Raised when an upload slot could not be obtained within the requested timeout. Always
 * recoverable: the caller leaves the item queued and retries later.
 */
public class SlotTimeoutException extends GalleryUpException {
  public SlotTimeoutException(String message) {
    super(GalleryUpErrorCode.ADMISSION_TIMEOUT, message);
  }

  public SlotTimeoutException(String message, Throwable cause) {
    super(GalleryUpErrorCode.ADMISSION_TIMEOUT, message, cause);
  }
}
