package com.gentoro.galleryup.management.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.galleryup.queue.QueueManager;
import com.gentoro.galleryup.queue.QueueStats;
import com.gentoro.galleryup.queue.QueueStatus;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Locale;

/** GET /mng/queue/stats: item counts per status and image/byte totals. */
public final class QueueStatsServlet extends HttpServlet {
  private final QueueManager queue;
  private final ObjectMapper mapper = new ObjectMapper();

  public QueueStatsServlet(QueueManager queue) {
    this.queue = queue;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    QueueStats stats = queue.getQueueStats();

    ObjectNode node = mapper.createObjectNode();
    node.put("totalItems", stats.totalItems());
    ObjectNode counts = node.putObject("byStatus");
    for (QueueStatus s : QueueStatus.values()) {
      counts.put(s.name().toLowerCase(Locale.ROOT), stats.count(s));
    }
    node.put("totalImages", stats.totalImages());
    node.put("uploadedImages", stats.uploadedImages());
    node.put("totalBytes", stats.totalBytes());
    node.put("uploadedBytes", stats.uploadedBytes());

    resp.setStatus(200);
    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(node));
  }
}
