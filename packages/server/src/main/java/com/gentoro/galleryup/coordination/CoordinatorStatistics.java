package com.gentoro.galleryup.coordination;

/** Point-in-time view of {@link ConcurrencyCoordinator} limits and counters. */
public record CoordinatorStatistics(
    int globalLimit,
    int perHostLimit,
    int activeUploads,
    long totalStarted,
    long totalCompleted,
    long totalFailed) {}
