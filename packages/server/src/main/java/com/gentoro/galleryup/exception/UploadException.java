package com.gentoro.galleryup.exception;

/** Whole-transfer failure of a gallery upload. */
public class UploadException extends GalleryUpException {
  public UploadException(String message) {
    super(GalleryUpErrorCode.UPLOAD_ERROR, message);
  }

  public UploadException(String message, Throwable cause) {
    super(GalleryUpErrorCode.UPLOAD_ERROR, message, cause);
  }
}
