package com.gentoro.galleryup.upload;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.UUID;

/**
 * Image host backed by a local directory. Each gallery is a sub-directory named after its id and
 * every "upload" copies the image into it. Useful for dry runs and for mirroring galleries.
 */
public final class DirectoryImageHostClient implements ImageHostClient {
  public static final String DEFAULT_HOST_ID = "local";

  private final String hostId;
  private final Path targetDir;
  private final long maxFileSizeBytes;

  public DirectoryImageHostClient(Path targetDir) {
    this(DEFAULT_HOST_ID, targetDir, 0);
  }

  public DirectoryImageHostClient(String hostId, Path targetDir, long maxFileSizeBytes) {
    this.hostId = hostId;
    this.targetDir = targetDir.toAbsolutePath().normalize();
    this.maxFileSizeBytes = maxFileSizeBytes;
  }

  @Override
  public String hostId() {
    return hostId;
  }

  public Path targetDir() {
    return targetDir;
  }

  @Override
  public HostImage createGallery(Path image, String galleryName, UploadConfig options)
      throws IOException {
    String galleryId = slug(galleryName) + "-" + UUID.randomUUID().toString().substring(0, 8);
    Files.createDirectories(targetDir.resolve(galleryId));
    return uploadImage(image, galleryId, options);
  }

  @Override
  public HostImage uploadImage(Path image, String galleryId, UploadConfig options)
      throws IOException {
    Path galleryDir = targetDir.resolve(galleryId);
    if (!Files.isDirectory(galleryDir)) {
      throw new IOException("Host error: unknown gallery " + galleryId);
    }
    Path target = galleryDir.resolve(image.getFileName().toString());
    Files.copy(image, target, StandardCopyOption.REPLACE_EXISTING);
    String url = target.toUri().toString();
    return new HostImage(galleryId, url, url);
  }

  @Override
  public String galleryUrl(String galleryId, String galleryName) {
    return targetDir.resolve(galleryId).toUri().toString();
  }

  @Override
  public long maxFileSizeBytes() {
    return maxFileSizeBytes;
  }

  static String slug(String name) {
    String s =
        name == null
            ? ""
            : name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("^-|-$", "");
    return s.isEmpty() ? "gallery" : s;
  }
}
