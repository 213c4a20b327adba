package com.gentoro.galleryup.upload;

/**
 * Hooks the uploader calls while it runs. All callbacks are invoked on the thread that called
 * {@link Uploader#upload}.
 */
public interface UploadCallbacks {
  UploadCallbacks NONE = new UploadCallbacks() {};

  default void onProgress(int completed, int total, int percent, String currentImage) {}

  default void onLog(String message) {}

  /** Polled before each new image is started; true lets in-flight images finish, then returns. */
  default boolean shouldSoftStop() {
    return false;
  }

  default void onItemUploaded(String fileName, long sizeBytes) {}
}
