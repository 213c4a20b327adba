package com.gentoro.galleryup.disk;

/** Ordered free-space classification, from most to least comfortable. */
public enum DiskTier {
  OK,
  WARNING,
  CRITICAL,
  EMERGENCY;

  /** New uploads are admitted only while space is at least at the warning tier. */
  public boolean allowsUploads() {
    return this == OK || this == WARNING;
  }
}
