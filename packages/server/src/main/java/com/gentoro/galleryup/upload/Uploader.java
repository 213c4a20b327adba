package com.gentoro.galleryup.upload;

import java.nio.file.Path;
import java.util.Set;

/** Transfers the images of one folder to an image host. */
public interface Uploader {
  /**
   * Upload every image of {@code folder} that is not in {@code alreadyUploaded}.
   *
   * @throws com.gentoro.galleryup.exception.UploadException when the run could not get as far as
   *     per-image accounting (missing folder, no images, gallery creation failed)
   */
  UploadResult upload(
      Path folder,
      String galleryName,
      UploadConfig config,
      Set<String> alreadyUploaded,
      UploadCallbacks callbacks);
}
