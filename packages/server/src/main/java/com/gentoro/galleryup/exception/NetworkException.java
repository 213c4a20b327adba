package com.gentoro.galleryup.exception;

/** Failure binding or talking to a network endpoint. */
public class NetworkException extends GalleryUpException {
  public NetworkException(String message) {
    super(GalleryUpErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(GalleryUpErrorCode.NETWORK_ERROR, message, cause);
  }
}
