package com.gentoro.galleryup.disk;

/** Observer of {@link DiskSpaceAdmissionController} samples. */
public interface DiskSpaceListener {
  /** Called after every successful poll. */
  default void onSpaceUpdated(long dataFreeBytes, long tempFreeBytes) {}

  /** Called when the tier differs from the previous poll. */
  default void onTierChanged(DiskTier previous, DiskTier current) {}
}
