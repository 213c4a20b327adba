package com.gentoro.galleryup.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base unchecked exception of the upload pipeline. Carries an error code and an optional context
 * map that is surfaced through {@link ExceptionUtil#toErrorDetails(Throwable)}.
 */
public class GalleryUpException extends RuntimeException {
  private final GalleryUpErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public GalleryUpException(GalleryUpErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public GalleryUpException(GalleryUpErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public GalleryUpErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context entry and return this exception for chaining. */
  public GalleryUpException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
