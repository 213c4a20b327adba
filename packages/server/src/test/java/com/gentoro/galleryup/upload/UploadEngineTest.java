package com.gentoro.galleryup.upload;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.galleryup.exception.UploadException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UploadEngineTest {

  @TempDir Path folder;

  private FakeHostClient client;
  private UploadEngine engine;

  @BeforeEach
  void setUp() {
    client = new FakeHostClient();
    engine = new UploadEngine(client);
  }

  private List<String> images(int count) throws Exception {
    List<String> names = new ArrayList<>();
    for (int i = 1; i <= count; i++) {
      String name = "img" + i + ".jpg";
      Files.write(folder.resolve(name), new byte[i * 10]);
      names.add(name);
    }
    return names;
  }

  private static UploadConfig config(int retries, int batch) {
    return new UploadConfig("fake", 3, 2, retries, batch, true, "default", null, null, null);
  }

  @Test
  @DisplayName("Creates the gallery with the first image in natural order and uploads the rest")
  void uploadsAll() throws Exception {
    List<String> names = images(12);
    Recorder recorder = new Recorder();

    UploadResult result = engine.upload(folder, "Trip", config(0, 3), Set.of(), recorder);

    assertEquals(List.of("img1.jpg"), client.created);
    assertEquals(11, client.uploaded.size());
    assertEquals(12, result.successfulCount());
    assertEquals(0, result.failedCount());
    assertEquals("gid-Trip", result.galleryId());
    assertEquals("https://host/gid-Trip", result.galleryUrl());
    assertEquals(
        names, result.images().stream().map(UploadResult.UploadedImage::fileName).toList());
    assertEquals(12, recorder.uploaded.size());
    assertEquals(780, result.totalSize());
    assertEquals(780, result.uploadedSize());
    assertEquals(100, recorder.lastPercent);
  }

  @Test
  @DisplayName("Resumed files are skipped but count as completed")
  void resumeSkipsUploaded() throws Exception {
    List<String> names = images(10);
    Set<String> done = new HashSet<>(names.subList(0, 7));
    UploadConfig resumed = config(0, 2).forItem(null, null, "gid-existing", null, null);
    Recorder recorder = new Recorder();

    UploadResult result = engine.upload(folder, "Trip", resumed, done, recorder);

    assertTrue(client.created.isEmpty());
    assertEquals(Set.copyOf(names.subList(7, 10)), Set.copyOf(client.uploaded));
    assertEquals(10, result.successfulCount());
    assertEquals("gid-existing", result.galleryId());
    assertEquals(7, recorder.firstCompleted);
  }

  @Test
  @DisplayName("7 of 10 succeed; a second run with the resume set sends only the 3 failures")
  void incompleteThenResume() throws Exception {
    images(10);
    client.alwaysFail.addAll(List.of("img3.jpg", "img6.jpg", "img9.jpg"));
    Recorder first = new Recorder();

    UploadResult partial = engine.upload(folder, "Trip", config(0, 2), Set.of(), first);

    assertEquals(7, partial.successfulCount());
    assertEquals(3, partial.failedCount());
    assertEquals(
        Set.of("img3.jpg", "img6.jpg", "img9.jpg"), Set.copyOf(partial.failedFileNames()));

    client.alwaysFail.clear();
    client.uploaded.clear();
    UploadConfig retry = config(0, 2).forItem(null, null, partial.galleryId(), null, null);
    UploadResult rest =
        engine.upload(folder, "Trip", retry, Set.copyOf(first.uploaded), new Recorder());

    assertEquals(Set.of("img3.jpg", "img6.jpg", "img9.jpg"), Set.copyOf(client.uploaded));
    assertEquals(10, rest.successfulCount());
    assertEquals(0, rest.failedCount());
  }

  @Test
  void transientFailuresAreRetried() throws Exception {
    images(4);
    client.failTimes("img2.jpg", 2).failTimes("img4.jpg", 1);

    UploadResult result = engine.upload(folder, "Trip", config(2, 2), Set.of(), new Recorder());

    assertEquals(4, result.successfulCount());
    assertEquals(0, result.failedCount());
  }

  @Test
  void failuresRemainAfterRetriesAreExhausted() throws Exception {
    images(3);
    client.failTimes("img2.jpg", 5);

    UploadResult result = engine.upload(folder, "Trip", config(2, 1), Set.of(), new Recorder());

    assertEquals(1, result.failedCount());
    assertEquals("img2.jpg", result.failedDetails().get(0).fileName());
    assertTrue(result.failedDetails().get(0).reason().contains("failed"));
  }

  @Test
  @DisplayName("Soft-stop lets the in-flight image finish and submits nothing new")
  void softStop() throws Exception {
    images(10);
    AtomicBoolean stop = new AtomicBoolean(false);
    client.afterTransfer =
        n -> {
          if (n == 4) {
            stop.set(true);
          }
        };
    Recorder recorder =
        new Recorder() {
          @Override
          public boolean shouldSoftStop() {
            return stop.get();
          }
        };

    UploadResult result = engine.upload(folder, "Trip", config(3, 1), Set.of(), recorder);

    assertEquals(4, result.successfulCount());
    assertEquals(0, result.failedCount());
    assertEquals(List.of("img1.jpg", "img2.jpg", "img3.jpg", "img4.jpg"), recorder.uploaded);
  }

  @Test
  void failedGalleryCreationAborts() throws Exception {
    images(2);
    client.failCreate = true;

    UploadException e =
        assertThrows(
            UploadException.class,
            () -> engine.upload(folder, "Trip", config(0, 1), Set.of(), new Recorder()));
    assertTrue(e.getMessage().startsWith("Failed to create gallery"));
  }

  @Test
  void emptyFolderAborts() throws Exception {
    Files.writeString(folder.resolve("notes.txt"), "x");
    assertThrows(
        UploadException.class,
        () -> engine.upload(folder, "Trip", config(0, 1), Set.of(), UploadCallbacks.NONE));
  }

  @Test
  void oversizedFilesAreSkipped() throws Exception {
    images(5);
    client.maxFileSize = 30;
    Recorder recorder = new Recorder();

    UploadResult result = engine.upload(folder, "Trip", config(0, 2), Set.of(), recorder);

    assertEquals(3, result.totalImages());
    assertEquals(3, result.successfulCount());
    assertTrue(recorder.logs.stream().anyMatch(l -> l.contains("img4.jpg")));
  }

  @Test
  void galleryNameDefaultsToFolderName() throws Exception {
    images(1);
    UploadResult result = engine.upload(folder, " ", config(0, 1), Set.of(), new Recorder());
    assertEquals(folder.getFileName().toString(), result.galleryName());
  }

  @Test
  void excludedFileIsNotUploaded() throws Exception {
    images(3);
    UploadConfig cfg = config(0, 1).forItem(null, null, null, "img1.jpg", null);

    UploadResult result = engine.upload(folder, "Trip", cfg, Set.of(), new Recorder());

    assertEquals(List.of("img2.jpg"), client.created);
    assertEquals(2, result.totalImages());
    assertFalse(
        result.images().stream()
            .map(UploadResult.UploadedImage::fileName)
            .collect(Collectors.toSet())
            .contains("img1.jpg"));
  }

  static class Recorder implements UploadCallbacks {
    final List<String> uploaded = new ArrayList<>();
    final List<String> logs = new ArrayList<>();
    int firstCompleted = -1;
    int lastPercent = -1;

    @Override
    public void onProgress(int completed, int total, int percent, String currentImage) {
      if (firstCompleted < 0) {
        firstCompleted = completed;
      }
      lastPercent = percent;
    }

    @Override
    public void onLog(String message) {
      logs.add(message);
    }

    @Override
    public void onItemUploaded(String fileName, long sizeBytes) {
      uploaded.add(fileName);
    }
  }
}
