package com.gentoro.galleryup.upload;

import com.gentoro.galleryup.exception.ExceptionUtil;
import com.gentoro.galleryup.exception.UploadException;
import com.gentoro.galleryup.upload.UploadResult.FailedImage;
import com.gentoro.galleryup.upload.UploadResult.UploadedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Host-agnostic {@link Uploader}: lists the folder, creates the gallery with the first image and
 * pushes the remaining images through a bounded pool, keeping at most {@code parallelBatchSize}
 * transfers in flight. Failed images are retried in whole rounds.
 *
 * <p>Soft-stop is checked before each new image is submitted; images already in flight always
 * finish. Callbacks run on the calling thread only.
 */
public final class UploadEngine implements Uploader {
  private static final Logger log =
      com.gentoro.galleryup.logging.LoggingService.getLogger(UploadEngine.class);

  private static final AtomicInteger POOL_SEQ = new AtomicInteger();

  private final ImageHostClient client;

  public UploadEngine(ImageHostClient client) {
    this.client = client;
  }

  public ImageHostClient client() {
    return client;
  }

  @Override
  public UploadResult upload(
      Path folder,
      String galleryName,
      UploadConfig config,
      Set<String> alreadyUploaded,
      UploadCallbacks callbacks) {
    long startedAt = System.currentTimeMillis();
    List<String> allImages = new ArrayList<>(ImageFiles.list(folder));
    if (config.excludeFileName() != null) {
      allImages.remove(config.excludeFileName());
    }
    if (allImages.isEmpty()) {
      throw new UploadException("No image files found in " + folder);
    }

    long maxBytes = client.maxFileSizeBytes();
    if (maxBytes > 0) {
      allImages.removeIf(
          name -> {
            long size = sizeOf(folder.resolve(name));
            if (size > maxBytes) {
              callbacks.onLog("Skipping %s: exceeds %d bytes".formatted(name, maxBytes));
              return true;
            }
            return false;
          });
    }

    String name = galleryName == null || galleryName.isBlank() ? folderName(folder) : galleryName;
    int totalImages = allImages.size();
    long totalSize = 0;
    for (String f : allImages) {
      totalSize += sizeOf(folder.resolve(f));
    }

    Deque<String> pending = new ArrayDeque<>();
    int resumed = 0;
    for (String f : allImages) {
      if (alreadyUploaded.contains(f)) {
        resumed++;
      } else {
        pending.add(f);
      }
    }

    List<UploadedImage> uploaded = new ArrayList<>();
    String galleryId = config.existingGalleryId();
    if (galleryId != null) {
      callbacks.onLog("Appending to existing gallery " + galleryId);
    } else if (!pending.isEmpty()) {
      String first = pending.removeFirst();
      Path firstPath = folder.resolve(first);
      HostImage created;
      try {
        created = client.createGallery(firstPath, name, config);
      } catch (IOException | RuntimeException e) {
        throw new UploadException(
            "Failed to create gallery: " + ExceptionUtil.extractErrorMessage(e), e);
      }
      if (created == null || created.galleryId() == null) {
        throw new UploadException("Failed to create gallery: host returned no gallery id");
      }
      galleryId = created.galleryId();
      long size = sizeOf(firstPath);
      uploaded.add(new UploadedImage(first, created.imageUrl(), created.thumbUrl(), size));
      callbacks.onItemUploaded(first, size);
      log.info("Created gallery {} on {} for {}", galleryId, client.hostId(), folder);
    }

    int initialCompleted = resumed;
    String firstCurrent;
    if (!uploaded.isEmpty()) {
      firstCurrent = uploaded.get(0).fileName();
    } else {
      firstCurrent = pending.isEmpty() ? "" : pending.peekFirst();
    }
    callbacks.onProgress(
        initialCompleted + uploaded.size(),
        totalImages,
        percent(initialCompleted + uploaded.size(), totalImages),
        firstCurrent);

    List<FailedImage> failed = new ArrayList<>();
    Run run =
        new Run(
            folder, galleryId, config, callbacks, uploaded, failed, initialCompleted, totalImages);
    if (galleryId != null && !pending.isEmpty()) {
      ExecutorService pool =
          Executors.newFixedThreadPool(
              config.parallelBatchSize(),
              r -> {
                Thread t = new Thread(r, "upload-pool-" + POOL_SEQ.incrementAndGet());
                t.setDaemon(true);
                return t;
              });
      try {
        runRound(run, pending, pool);
        int round = 0;
        while (!failed.isEmpty() && round < config.maxRetries() && !callbacks.shouldSoftStop()) {
          round++;
          callbacks.onLog(
              "Retrying %d failed upload(s) (attempt %d/%d)"
                  .formatted(failed.size(), round, config.maxRetries()));
          Deque<String> retry = new ArrayDeque<>();
          for (FailedImage f : failed) {
            retry.add(f.fileName());
          }
          failed.clear();
          runRound(run, retry, pool);
        }
      } finally {
        pool.shutdownNow();
      }
    }

    Map<String, Integer> position = new HashMap<>();
    for (int i = 0; i < allImages.size(); i++) {
      position.put(allImages.get(i), i);
    }
    uploaded.sort(Comparator.comparingInt(img -> position.get(img.fileName())));

    long uploadedSize = uploaded.stream().mapToLong(UploadedImage::sizeBytes).sum();
    long elapsed = System.currentTimeMillis() - startedAt;
    String galleryUrl = galleryId == null ? null : client.galleryUrl(galleryId, name);

    if (failed.isEmpty()) {
      log.info(
          "Gallery '{}' uploaded in {}ms ({} images, {} bytes)",
          name,
          elapsed,
          initialCompleted + uploaded.size(),
          uploadedSize);
    } else {
      log.warn(
          "Gallery '{}' finished with {} failure(s) ({}/{} images)",
          name,
          failed.size(),
          initialCompleted + uploaded.size(),
          totalImages);
    }

    return new UploadResult(
        initialCompleted + uploaded.size(),
        failed.size(),
        failed,
        galleryId,
        name,
        galleryUrl,
        uploaded,
        totalImages,
        totalSize,
        uploadedSize,
        elapsed,
        config.dimensions());
  }

  private void runRound(Run run, Deque<String> queue, ExecutorService pool) {
    CompletionService<Transfer> completion = new ExecutorCompletionService<>(pool);
    int inFlight = 0;
    while (inFlight < run.config().parallelBatchSize() && !queue.isEmpty()) {
      if (run.callbacks().shouldSoftStop()) {
        break;
      }
      submit(completion, run, queue.removeFirst());
      inFlight++;
    }

    while (inFlight > 0) {
      Transfer transfer;
      try {
        Future<Transfer> done = completion.take();
        transfer = done.get();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new UploadException("Interrupted while uploading " + run.folder(), e);
      } catch (ExecutionException e) {
        throw new UploadException("Upload task crashed for " + run.folder(), e.getCause());
      }
      inFlight--;

      if (transfer.error() == null) {
        run.uploaded().add(transfer.image());
        run.callbacks().onItemUploaded(transfer.fileName(), transfer.image().sizeBytes());
        log.debug("Uploaded {} ({})", transfer.fileName(), transfer.image().imageUrl());
      } else {
        run.failed().add(new FailedImage(transfer.fileName(), transfer.error()));
        run.callbacks().onLog(
            "Upload failed: %s - %s".formatted(transfer.fileName(), transfer.error()));
      }
      int completed = run.initialCompleted() + run.uploaded().size();
      int total = run.totalImages();
      run.callbacks().onProgress(completed, total, percent(completed, total), transfer.fileName());

      if (!queue.isEmpty() && !run.callbacks().shouldSoftStop()) {
        submit(completion, run, queue.removeFirst());
        inFlight++;
      }
    }
  }

  private void submit(CompletionService<Transfer> completion, Run run, String fileName) {
    completion.submit(
        () -> {
          Path image = run.folder().resolve(fileName);
          try {
            HostImage stored = client.uploadImage(image, run.galleryId(), run.config());
            return new Transfer(
                fileName,
                new UploadedImage(
                    fileName,
                    stored == null ? null : stored.imageUrl(),
                    stored == null ? null : stored.thumbUrl(),
                    sizeOf(image)),
                null);
          } catch (IOException | RuntimeException e) {
            return new Transfer(fileName, null, ExceptionUtil.extractErrorMessage(e));
          }
        });
  }

  private static int percent(int completed, int total) {
    return (int) ((completed * 100L) / Math.max(total, 1));
  }

  private static long sizeOf(Path file) {
    try {
      return Files.size(file);
    } catch (IOException e) {
      log.debug("Cannot read size of {}: {}", file, e.toString());
      return 0;
    }
  }

  private static String folderName(Path folder) {
    Path name = folder.toAbsolutePath().normalize().getFileName();
    return name == null ? folder.toString() : name.toString();
  }

  private record Transfer(String fileName, UploadedImage image, String error) {}

  private record Run(
      Path folder,
      String galleryId,
      UploadConfig config,
      UploadCallbacks callbacks,
      List<UploadedImage> uploaded,
      List<FailedImage> failed,
      int initialCompleted,
      int totalImages) {}
}
