package com.gentoro.galleryup.exception;

import java.time.Instant;
import java.util.Map;

/** Structured view of a failure, suitable for logs and management responses. */
public record ErrorDetails(
    String type,
    String message,
    GalleryUpErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
