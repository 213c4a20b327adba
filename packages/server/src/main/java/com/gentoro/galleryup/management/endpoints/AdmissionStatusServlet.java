package com.gentoro.galleryup.management.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.galleryup.bandwidth.BandwidthTracker;
import com.gentoro.galleryup.coordination.ActiveUpload;
import com.gentoro.galleryup.coordination.ConcurrencyCoordinator;
import com.gentoro.galleryup.coordination.CoordinatorStatistics;
import com.gentoro.galleryup.disk.DiskSpaceAdmissionController;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** GET /mng/admission: coordinator statistics, disk tier and current transfer rate. */
public final class AdmissionStatusServlet extends HttpServlet {
  private final ConcurrencyCoordinator coordinator;
  private final DiskSpaceAdmissionController disk;
  private final BandwidthTracker bandwidth;
  private final ObjectMapper mapper = new ObjectMapper();

  public AdmissionStatusServlet(
      ConcurrencyCoordinator coordinator,
      DiskSpaceAdmissionController disk,
      BandwidthTracker bandwidth) {
    this.coordinator = coordinator;
    this.disk = disk;
    this.bandwidth = bandwidth;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    CoordinatorStatistics stats = coordinator.getStatistics();

    ObjectNode node = mapper.createObjectNode();
    ObjectNode slots = node.putObject("concurrency");
    slots.put("globalLimit", stats.globalLimit());
    slots.put("perHostLimit", stats.perHostLimit());
    slots.put("availableSlots", coordinator.getAvailableSlots());
    slots.put("activeUploads", stats.activeUploads());
    slots.put("totalStarted", stats.totalStarted());
    slots.put("totalCompleted", stats.totalCompleted());
    slots.put("totalFailed", stats.totalFailed());
    ArrayNode active = slots.putArray("active");
    for (ActiveUpload upload : coordinator.getActiveUploads()) {
      active.addObject().put("galleryId", upload.galleryId()).put("host", upload.host());
    }

    ObjectNode diskNode = node.putObject("disk");
    diskNode.put("tier", disk.getCurrentTier().name());
    diskNode.put("canStartUpload", disk.canStartUpload());
    diskNode.put("dataFreeBytes", disk.getDataFree());
    diskNode.put("tempFreeBytes", disk.getTempFree());
    diskNode.put("pollIntervalMs", disk.getCurrentIntervalMillis());

    node.put("bandwidthKiBps", bandwidth.getCurrentRate());

    resp.setStatus(200);
    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(node));
  }
}
