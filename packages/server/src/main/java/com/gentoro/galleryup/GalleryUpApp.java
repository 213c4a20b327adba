package com.gentoro.galleryup;

import com.gentoro.galleryup.exception.ConfigException;

/**
 * Command line entry point. Exit status is 0 after a normal shutdown or drain, 2 for invalid
 * arguments or configuration and 1 for any other start-up failure.
 */
public class GalleryUpApp {

  private static final org.slf4j.Logger log =
      com.gentoro.galleryup.logging.LoggingService.getLogger(GalleryUpApp.class);

  static final int EXIT_FAILURE = 1;
  static final int EXIT_CONFIG = 2;

  public static void main(String[] args) {
    GalleryUp app;
    try {
      app = new GalleryUp(args);
      app.initialize();
    } catch (ConfigException e) {
      log.error("Invalid configuration: {}", e.getMessage());
      System.exit(EXIT_CONFIG);
      return;
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(EXIT_FAILURE);
      return;
    }

    if (StartupParameters.MODE_DRAIN.equals(app.startupParameters().mode())) {
      app.waitUntilDrained();
    } else {
      app.waitShutdownSignal();
    }
  }
}
