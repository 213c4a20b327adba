package com.gentoro.galleryup.upload;

import java.io.IOException;
import java.nio.file.Path;

/** Client of one image host. Implementations must be safe for concurrent image uploads. */
public interface ImageHostClient {
  String hostId();

  /** Create a gallery by uploading its first image. The result carries the new gallery id. */
  HostImage createGallery(Path image, String galleryName, UploadConfig options) throws IOException;

  HostImage uploadImage(Path image, String galleryId, UploadConfig options) throws IOException;

  String galleryUrl(String galleryId, String galleryName);

  /** Largest accepted file; zero or negative means unlimited. */
  default long maxFileSizeBytes() {
    return 0;
  }
}
