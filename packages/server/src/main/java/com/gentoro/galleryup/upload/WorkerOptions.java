package com.gentoro.galleryup.upload;

import java.time.Duration;

/** Timing and defaults an {@link UploadWorker} runs with. */
public record WorkerOptions(
    String defaultHost,
    Duration slotTimeout,
    Duration idleWait,
    Duration idleMaintenanceInterval,
    UploadConfig uploadConfig) {

  public static WorkerOptions defaults(String defaultHost) {
    return new WorkerOptions(
        defaultHost,
        Duration.ofSeconds(30),
        Duration.ofMillis(100),
        Duration.ofSeconds(1),
        UploadConfig.defaults(defaultHost));
  }
}
