package com.gentoro.galleryup.exception;

/** Component used in a state that does not allow the operation. */
public class StateException extends GalleryUpException {
  public StateException(String message) {
    super(GalleryUpErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(GalleryUpErrorCode.STATE_ERROR, message, cause);
  }
}
