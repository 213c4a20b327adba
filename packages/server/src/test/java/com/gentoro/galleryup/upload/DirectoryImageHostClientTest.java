package com.gentoro.galleryup.upload;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DirectoryImageHostClientTest {

  @TempDir Path source;
  @TempDir Path target;

  @Test
  void createGalleryCopiesFirstImage() throws Exception {
    Path image = Files.writeString(source.resolve("1.jpg"), "pixels");
    DirectoryImageHostClient client = new DirectoryImageHostClient(target);

    HostImage created = client.createGallery(image, "Summer Trip!", UploadConfig.defaults("local"));

    assertTrue(created.galleryId().startsWith("summer-trip-"));
    Path copied = target.resolve(created.galleryId()).resolve("1.jpg");
    assertEquals("pixels", Files.readString(copied));
    assertEquals(copied.toUri().toString(), created.imageUrl());
    assertEquals(
        target.resolve(created.galleryId()).toUri().toString(),
        client.galleryUrl(created.galleryId(), "Summer Trip!"));
  }

  @Test
  void uploadToUnknownGalleryFails() throws Exception {
    Path image = Files.writeString(source.resolve("1.jpg"), "pixels");
    DirectoryImageHostClient client = new DirectoryImageHostClient(target);

    IOException e =
        assertThrows(
            IOException.class,
            () -> client.uploadImage(image, "nope", UploadConfig.defaults("local")));
    assertTrue(e.getMessage().contains("nope"));
  }

  @Test
  void slugFallsBackForEmptyNames() {
    assertEquals("gallery", DirectoryImageHostClient.slug("!!!"));
    assertEquals("gallery", DirectoryImageHostClient.slug(null));
    assertEquals("a-b-c", DirectoryImageHostClient.slug(" A  b/C "));
  }
}
