package com.gentoro.galleryup.management.endpoints;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.galleryup.bandwidth.BandwidthTracker;
import com.gentoro.galleryup.coordination.ConcurrencyCoordinator;
import com.gentoro.galleryup.coordination.SlotGuard;
import com.gentoro.galleryup.disk.DiskSpaceAdmissionController;
import com.gentoro.galleryup.disk.DiskTier;
import java.time.Duration;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.ee10.servlet.ServletTester;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class AdmissionStatusServletTest {

  @Test
  void reportsSlotsDiskAndBandwidth() throws Exception {
    ConcurrencyCoordinator coordinator = new ConcurrencyCoordinator(3, 2);
    SlotGuard held = coordinator.acquireSlot("/g/a", "local", Duration.ofMillis(10));
    DiskSpaceAdmissionController disk = Mockito.mock(DiskSpaceAdmissionController.class);
    Mockito.when(disk.getCurrentTier()).thenReturn(DiskTier.WARNING);
    Mockito.when(disk.canStartUpload()).thenReturn(true);
    Mockito.when(disk.getDataFree()).thenReturn(1234L);

    ServletTester tester = new ServletTester();
    tester.addServlet(
        new ServletHolder(new AdmissionStatusServlet(coordinator, disk, new BandwidthTracker())),
        "/mng/admission");
    tester.start();

    HttpTester.Request req = HttpTester.newRequest();
    req.setMethod("GET");
    req.setURI("/mng/admission");
    req.setVersion("HTTP/1.1");
    req.setHeader("Host", "tester");

    HttpTester.Response resp = HttpTester.parseResponse(tester.getResponses(req.generate()));
    tester.stop();
    held.close();

    assertEquals(200, resp.getStatus());
    JsonNode json = new ObjectMapper().readTree(resp.getContent());
    assertEquals(2, json.get("concurrency").get("availableSlots").asInt());
    assertEquals(1, json.get("concurrency").get("activeUploads").asInt());
    assertEquals("local", json.get("concurrency").get("active").get(0).get("host").asText());
    assertEquals("WARNING", json.get("disk").get("tier").asText());
    assertEquals(1234L, json.get("disk").get("dataFreeBytes").asLong());
    assertEquals(0.0, json.get("bandwidthKiBps").asDouble());
  }
}
