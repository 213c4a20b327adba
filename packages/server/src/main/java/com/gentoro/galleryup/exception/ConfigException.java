package com.gentoro.galleryup.exception;

/** Invalid or unreadable configuration. */
public class ConfigException extends GalleryUpException {
  public ConfigException(String message) {
    super(GalleryUpErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(GalleryUpErrorCode.CONFIG_ERROR, message, cause);
  }
}
