package com.gentoro.galleryup.management;

import com.gentoro.galleryup.GalleryUp;
import com.gentoro.galleryup.http.EmbeddedJettyServer;
import com.gentoro.galleryup.management.endpoints.AdmissionStatusServlet;
import com.gentoro.galleryup.management.endpoints.QueueItemsServlet;
import com.gentoro.galleryup.management.endpoints.QueueStartServlet;
import com.gentoro.galleryup.management.endpoints.QueueStatsServlet;
import com.gentoro.galleryup.management.endpoints.WorkerControlServlet;

/** Registers the queue, admission and worker-control endpoints under {@code /mng}. */
public final class ManagementServer {
  public static final String CONTEXT_PATH = "/mng";

  private final GalleryUp app;

  public ManagementServer(GalleryUp app) {
    this.app = app;
  }

  public void register(EmbeddedJettyServer http) {
    http.addServlet(CONTEXT_PATH + "/queue/stats", new QueueStatsServlet(app.queueManager()));
    http.addServlet(CONTEXT_PATH + "/queue/items", new QueueItemsServlet(app.queueManager()));
    http.addServlet(CONTEXT_PATH + "/queue/start", new QueueStartServlet(app.queueManager()));
    http.addServlet(
        CONTEXT_PATH + "/admission",
        new AdmissionStatusServlet(
            app.coordinator(), app.diskController(), app.bandwidthTracker()));
    http.addServlet(CONTEXT_PATH + "/workers/*", new WorkerControlServlet(app.workerPool()));
  }
}
