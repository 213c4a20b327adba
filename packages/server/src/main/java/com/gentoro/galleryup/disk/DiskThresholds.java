package com.gentoro.galleryup.disk;

import com.gentoro.galleryup.exception.ConfigException;

/** Free-space thresholds in bytes; must satisfy {@code emergency < critical < warning}. */
public record DiskThresholds(long warningBytes, long criticalBytes, long emergencyBytes) {
  private static final long MB = 1024L * 1024L;

  public DiskThresholds {
    if (emergencyBytes < 0 || !(emergencyBytes < criticalBytes && criticalBytes < warningBytes)) {
      throw new ConfigException(
          ("Disk thresholds must satisfy 0 <= emergency < critical < warning,"
                  + " got warning=%d critical=%d emergency=%d")
              .formatted(warningBytes, criticalBytes, emergencyBytes));
    }
  }

  public static DiskThresholds ofMegabytes(long warningMb, long criticalMb, long emergencyMb) {
    return new DiskThresholds(warningMb * MB, criticalMb * MB, emergencyMb * MB);
  }
}
