package com.gentoro.galleryup.exception;

import java.time.Instant;
import java.util.Arrays;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Helpers for turning failures into log lines and item error messages. */
public final class ExceptionUtil {
  private static final String HOST_ERROR_PREFIX = "Host error:";
  private static final String OWN_PACKAGE = "com.gentoro.galleryup.";

  private ExceptionUtil() {}

  /**
   * Structured view of a failure. Pipeline exceptions keep their code and context; anything else
   * is reported as {@link GalleryUpErrorCode#UNKNOWN}.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    Throwable root = unwrap(t);
    if (root instanceof GalleryUpException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        root.getClass().getSimpleName(),
        safeMessage(root.getMessage()),
        GalleryUpErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /**
   * Where a failure came from, as the top frames that belong to this application joined with
   * {@code " < "}, e.g. {@code UploadEngine.upload:88 < UploadWorker.execute:241}. Falls back to
   * the top frame when no own frame is present. Empty for null.
   */
  public static String describeOrigin(Throwable t, int maxFrames) {
    if (t == null || t.getStackTrace().length == 0) {
      return "";
    }
    StackTraceElement[] frames = t.getStackTrace();
    String own =
        Arrays.stream(frames)
            .filter(f -> f.getClassName().startsWith(OWN_PACKAGE))
            .limit(maxFrames <= 0 ? Long.MAX_VALUE : maxFrames)
            .map(ExceptionUtil::frame)
            .collect(Collectors.joining(" < "));
    return own.isEmpty() ? frame(frames[0]) : own;
  }

  public static String describeOrigin(Throwable t) {
    return describeOrigin(t, 3);
  }

  /**
   * User-facing message of a failure, stored on FAILED items. A message reported by an image host
   * ({@code "Host error: ..."}) anywhere in the cause chain wins over the wrapper messages;
   * otherwise the unwrapped exception is rendered as {@code SimpleName: message}.
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }

    for (Throwable current = t; current != null; current = current.getCause()) {
      String message = current.getMessage();
      if (message != null && message.contains(HOST_ERROR_PREFIX)) {
        return message.substring(message.indexOf(HOST_ERROR_PREFIX) + HOST_ERROR_PREFIX.length())
            .trim();
      }
    }

    Throwable root = unwrap(t);
    String className = root.getClass().getSimpleName();
    String message = root.getMessage();
    if (message == null || message.isBlank()) {
      return className;
    }
    if (root instanceof GalleryUpException) {
      return message;
    }
    return className + ": " + message;
  }

  /**
   * Return {@code t} as a pipeline exception, unwrapping executor wrappers first. Anything that is
   * not already one is handed to {@code wrapper}.
   */
  public static GalleryUpException asGalleryUpException(
      Throwable t, Function<Throwable, ? extends GalleryUpException> wrapper) {
    Throwable root = unwrap(t);
    if (root instanceof GalleryUpException ex) {
      return ex;
    }
    return wrapper.apply(root);
  }

  private static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while ((current instanceof ExecutionException || current instanceof CompletionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static String frame(StackTraceElement e) {
    String cls = e.getClassName();
    String simple = cls.substring(cls.lastIndexOf('.') + 1);
    return e.getLineNumber() >= 0
        ? simple + "." + e.getMethodName() + ":" + e.getLineNumber()
        : simple + "." + e.getMethodName();
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
