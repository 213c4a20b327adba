package com.gentoro.galleryup.queue;

/** Pixel dimensions measured while scanning a gallery. */
public record DimensionStats(
    double avgWidth, double avgHeight, int minWidth, int minHeight, int maxWidth, int maxHeight) {

  public static final DimensionStats EMPTY = new DimensionStats(0, 0, 0, 0, 0, 0);
}
