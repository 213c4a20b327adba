package com.gentoro.galleryup.upload;

/** Housekeeping a worker runs while its queue is empty. */
@FunctionalInterface
public interface IdleMaintenance {
  IdleMaintenance NONE = () -> {};

  void run();
}
