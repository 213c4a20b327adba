package com.gentoro.galleryup.upload;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class WorkerPoolTest {

  private final List<UploadWorker> created = new ArrayList<>();

  private WorkerPool pool(int size) {
    return new WorkerPool(
        size,
        i -> {
          UploadWorker w = mock(UploadWorker.class);
          when(w.getCurrentItemPath()).thenReturn(Optional.empty());
          created.add(w);
          return w;
        });
  }

  @Test
  void controlsEveryWorker() {
    WorkerPool pool = pool(3);
    assertEquals(3, pool.workers().size());

    pool.start();
    pool.pause();
    pool.resume();
    pool.stop();

    for (UploadWorker w : created) {
      verify(w).start();
      verify(w).pause();
      verify(w).resume();
      verify(w).stop();
    }
  }

  @Test
  void stopCurrentUploadsCountsBusyWorkers() {
    WorkerPool pool = pool(3);
    when(created.get(0).stopCurrentUpload()).thenReturn(true);
    when(created.get(2).stopCurrentUpload()).thenReturn(true);
    when(created.get(2).getCurrentItemPath()).thenReturn(Optional.of("/g"));

    assertEquals(2, pool.stopCurrentUploads());
    assertEquals(List.of("/g"), pool.currentItems());
  }

  @Test
  void pausedOnlyWhenAllWorkersArePaused() {
    WorkerPool pool = pool(2);
    when(created.get(0).isPaused()).thenReturn(true);
    assertFalse(pool.isPaused());
    when(created.get(1).isPaused()).thenReturn(true);
    assertTrue(pool.isPaused());
  }

  @Test
  void rejectsEmptyPool() {
    assertThrows(IllegalArgumentException.class, () -> pool(0));
  }
}
