package com.gentoro.galleryup.management.endpoints;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.galleryup.upload.WorkerPool;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.ee10.servlet.ServletTester;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WorkerControlServletTest {

  private WorkerPool pool;
  private ServletTester tester;

  @BeforeEach
  void setUp() throws Exception {
    pool = mock(WorkerPool.class);
    tester = new ServletTester();
    tester.addServlet(new ServletHolder(new WorkerControlServlet(pool)), "/mng/workers/*");
    tester.start();
  }

  @AfterEach
  void tearDown() throws Exception {
    tester.stop();
  }

  private HttpTester.Response post(String uri) throws Exception {
    HttpTester.Request req = HttpTester.newRequest();
    req.setMethod("POST");
    req.setURI(uri);
    req.setVersion("HTTP/1.1");
    req.setHeader("Host", "tester");
    return HttpTester.parseResponse(tester.getResponses(req.generate()));
  }

  @Test
  void pauseAndResume() throws Exception {
    when(pool.isPaused()).thenReturn(true);
    HttpTester.Response paused = post("/mng/workers/pause");
    assertEquals(200, paused.getStatus());
    assertTrue(new ObjectMapper().readTree(paused.getContent()).get("paused").asBoolean());
    verify(pool).pause();

    when(pool.isPaused()).thenReturn(false);
    assertEquals(200, post("/mng/workers/resume").getStatus());
    verify(pool).resume();
  }

  @Test
  void stopCurrentReportsCount() throws Exception {
    when(pool.stopCurrentUploads()).thenReturn(2);

    HttpTester.Response resp = post("/mng/workers/stop-current");

    JsonNode json = new ObjectMapper().readTree(resp.getContent());
    assertEquals("stop-current", json.get("action").asText());
    assertEquals(2, json.get("stopped").asInt());
  }

  @Test
  void unknownOrMissingAction() throws Exception {
    assertEquals(404, post("/mng/workers/explode").getStatus());
    assertEquals(400, post("/mng/workers/").getStatus());
    verifyNoInteractions(pool);
  }
}
