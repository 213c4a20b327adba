package com.gentoro.galleryup.disk;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads free space of the file store backing a path. */
public interface FreeSpaceProbe {
  long freeBytes(Path path) throws IOException;

  /** True when both paths resolve to the same file store; false when it cannot be told. */
  boolean sameStore(Path a, Path b);

  /** Probe backed by {@link java.nio.file.FileStore#getUsableSpace()}. */
  static FreeSpaceProbe fileStores() {
    return new FreeSpaceProbe() {
      @Override
      public long freeBytes(Path path) throws IOException {
        return Files.getFileStore(path).getUsableSpace();
      }

      @Override
      public boolean sameStore(Path a, Path b) {
        try {
          return Files.getFileStore(a).equals(Files.getFileStore(b));
        } catch (IOException e) {
          return false;
        }
      }
    };
  }
}
