package com.gentoro.galleryup.http;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.galleryup.exception.NetworkException;
import com.gentoro.galleryup.queue.QueueStatus;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class WebhookNotifierTest {

  private MockWebServer server;
  private WebhookNotifier notifier;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    notifier = new WebhookNotifier(server.url("/hook").toString(), new OkHttpClient());
  }

  @AfterEach
  void tearDown() throws Exception {
    notifier.close();
    server.shutdown();
  }

  @Test
  @DisplayName("Status changes are posted as JSON")
  void postsStatusChange() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(204));

    notifier.onStatusChanged("/g", QueueStatus.UPLOADING, QueueStatus.COMPLETED, "done");

    RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
    assertNotNull(request);
    assertEquals("POST", request.getMethod());
    assertEquals("/hook", request.getPath());
    JsonNode body = new ObjectMapper().readTree(request.getBody().readUtf8());
    assertEquals("status", body.get("event").asText());
    assertEquals("UPLOADING", body.get("previous").asText());
    assertEquals("COMPLETED", body.get("status").asText());
    assertEquals("done", body.get("message").asText());
  }

  @Test
  void newItemHasNullPrevious() throws Exception {
    JsonNode body =
        new ObjectMapper().readTree(notifier.payload("/g", null, QueueStatus.READY, null));
    assertTrue(body.get("previous").isNull());
    assertFalse(body.has("message"));
  }

  @Test
  void errorResponseIsReported() {
    server.enqueue(new MockResponse().setResponseCode(500));
    NetworkException e = assertThrows(NetworkException.class, () -> notifier.post("{}"));
    assertTrue(e.getMessage().contains("500"));
  }

  @Test
  void deliveryFailureDoesNotReachTheCaller() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(500));
    server.enqueue(new MockResponse().setResponseCode(200));

    notifier.onStatusChanged("/a", null, QueueStatus.QUEUED, null);
    notifier.onStatusChanged("/b", null, QueueStatus.QUEUED, null);

    assertNotNull(server.takeRequest(5, TimeUnit.SECONDS));
    assertNotNull(server.takeRequest(5, TimeUnit.SECONDS));
  }
}
