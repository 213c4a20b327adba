package com.gentoro.galleryup.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.galleryup.events.QueueEventListener;
import com.gentoro.galleryup.exception.NetworkException;
import com.gentoro.galleryup.queue.QueueStatus;
import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;

/**
 * Posts every queue status change as a small JSON document to a configured URL. Delivery happens
 * on a dedicated thread so a slow endpoint never holds up a worker; failed posts are logged and
 * dropped.
 */
public final class WebhookNotifier implements QueueEventListener, AutoCloseable {
  private static final Logger log =
      com.gentoro.galleryup.logging.LoggingService.getLogger(WebhookNotifier.class);

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final String url;
  private final OkHttpClient client;
  private final ObjectMapper mapper = new ObjectMapper();
  private final ExecutorService sender =
      Executors.newSingleThreadExecutor(
          r -> {
            Thread t = new Thread(r, "webhook-sender");
            t.setDaemon(true);
            return t;
          });

  public WebhookNotifier(String url, OkHttpClient client) {
    this.url = url;
    this.client = client;
  }

  @Override
  public void onStatusChanged(
      String path, QueueStatus previous, QueueStatus current, String message) {
    String payload = payload(path, previous, current, message);
    sender.execute(
        () -> {
          try {
            post(payload);
          } catch (NetworkException e) {
            log.warn("Webhook delivery for {} failed: {}", path, e.getMessage());
          }
        });
  }

  String payload(String path, QueueStatus previous, QueueStatus current, String message) {
    ObjectNode node = mapper.createObjectNode();
    node.put("event", "status");
    node.put("path", path);
    node.put("previous", previous == null ? null : previous.name());
    node.put("status", current.name());
    if (message != null) node.put("message", message);
    node.put("timestamp", System.currentTimeMillis());
    try {
      return mapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize webhook payload", e);
    }
  }

  void post(String payload) {
    Request request =
        new Request.Builder().url(url).post(RequestBody.create(payload, JSON)).build();
    try (Response response = client.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        throw new NetworkException("Webhook returned HTTP " + response.code());
      }
    } catch (IOException e) {
      throw new NetworkException("Webhook request to " + url + " failed", e);
    }
  }

  @Override
  public void close() {
    sender.shutdown();
    try {
      if (!sender.awaitTermination(2, TimeUnit.SECONDS)) {
        sender.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      sender.shutdownNow();
    }
  }
}
