package com.gentoro.galleryup.upload;

import com.gentoro.galleryup.queue.GalleryQueueItem;

/** Receives every gallery that finished with all images transferred. */
@FunctionalInterface
public interface CompletionHandler {
  CompletionHandler NONE = (item, result) -> {};

  void onCompleted(GalleryQueueItem item, UploadResult result);
}
