package com.gentoro.galleryup;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.galleryup.exception.StateException;
import com.gentoro.galleryup.queue.GalleryQueueItem;
import com.gentoro.galleryup.queue.JsonFileQueueStore;
import com.gentoro.galleryup.queue.QueueStatus;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

class GalleryUpTest {

  @TempDir Path root;

  @Test
  void configurationRequiresInitialize() {
    GalleryUp app = new GalleryUp(new String[0]);
    assertThrows(StateException.class, app::configuration);
  }

  @Test
  @Timeout(30)
  void drainModeUploadsAddedFolderAndStops() throws Exception {
    Path folder = Files.createDirectories(root.resolve("Trip"));
    for (String name : new String[] {"a.png", "b.png", "c.png"}) {
      BufferedImage image = new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB);
      ImageIO.write(image, "png", folder.resolve(name).toFile());
    }
    Path data = root.resolve("data");
    Path config = root.resolve("galleryup.yaml");
    Files.writeString(
        config,
        String.join(
            "\n",
            "data:",
            "  dir: \"" + data + "\"",
            "  temp-dir: \"" + root.resolve("tmp") + "\"",
            "disk:",
            "  warning-mb: 3",
            "  critical-mb: 2",
            "  emergency-mb: 1",
            "http:",
            "  enabled: false",
            "config:",
            "  reload-interval-ms: 0",
            ""));

    GalleryUp app =
        new GalleryUp(new String[] {"--config=" + config, "--mode=drain", "--add=" + folder});
    app.initialize();
    assertEquals(1, app.workerPool().workers().size());

    app.waitUntilDrained();

    GalleryQueueItem item = app.queueManager().getItem(folder.toString()).orElseThrow();
    assertEquals(QueueStatus.COMPLETED, item.getStatus());
    assertEquals(3, item.getUploadedImages());
    assertNotNull(item.getGalleryUrl());
    assertTrue(app.isDrained());
    assertTrue(Files.exists(data.resolve(JsonFileQueueStore.FILE_NAME)));
  }
}
