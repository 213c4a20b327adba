package com.gentoro.galleryup.exception;

/** A queue item was asked to move to a status its current status does not allow. */
public class IllegalStateTransitionException extends StateException {
  public IllegalStateTransitionException(String path, Object from, Object to) {
    super("Illegal status transition %s -> %s for %s".formatted(from, to, path));
    withContext("path", path);
    withContext("from", String.valueOf(from));
    withContext("to", String.valueOf(to));
  }
}
