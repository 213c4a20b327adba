package com.gentoro.galleryup.upload;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;
import org.slf4j.Logger;

/** A fixed set of {@link UploadWorker}s controlled as one. */
public final class WorkerPool {
  private static final Logger log =
      com.gentoro.galleryup.logging.LoggingService.getLogger(WorkerPool.class);

  private final List<UploadWorker> workers;

  public WorkerPool(int size, IntFunction<UploadWorker> factory) {
    if (size <= 0) {
      throw new IllegalArgumentException("Worker count must be positive: " + size);
    }
    List<UploadWorker> created = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      created.add(factory.apply(i));
    }
    this.workers = List.copyOf(created);
  }

  public List<UploadWorker> workers() {
    return workers;
  }

  public void start() {
    workers.forEach(UploadWorker::start);
    log.info("Started {} upload worker(s)", workers.size());
  }

  /** Stop every worker and wait for all loops to exit. */
  public void stop() {
    workers.forEach(UploadWorker::stop);
  }

  public void pause() {
    workers.forEach(UploadWorker::pause);
  }

  public void resume() {
    workers.forEach(UploadWorker::resume);
  }

  /** @return number of workers that had an upload to stop */
  public int stopCurrentUploads() {
    int stopped = 0;
    for (UploadWorker w : workers) {
      if (w.stopCurrentUpload()) {
        stopped++;
      }
    }
    return stopped;
  }

  public boolean isPaused() {
    return workers.stream().allMatch(UploadWorker::isPaused);
  }

  public List<String> currentItems() {
    List<String> paths = new ArrayList<>();
    for (UploadWorker w : workers) {
      w.getCurrentItemPath().ifPresent(paths::add);
    }
    return paths;
  }
}
