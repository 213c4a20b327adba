package com.gentoro.galleryup.management.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.galleryup.queue.GalleryQueueItem;
import com.gentoro.galleryup.queue.QueueManager;
import com.gentoro.galleryup.queue.QueueStatus;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Locale;

/** GET /mng/queue/items[?status=queued]: queue items in queue order. */
public final class QueueItemsServlet extends HttpServlet {
  private final QueueManager queue;
  private final ObjectMapper mapper = new ObjectMapper();

  public QueueItemsServlet(QueueManager queue) {
    this.queue = queue;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    List<GalleryQueueItem> items = queue.getAll();

    String statusParam = req.getParameter("status");
    if (statusParam != null && !statusParam.isBlank()) {
      QueueStatus status;
      try {
        status = QueueStatus.valueOf(statusParam.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        resp.sendError(400, "Unknown status: " + statusParam);
        return;
      }
      QueueStatus wanted = status;
      items = items.stream().filter(i -> i.getStatus() == wanted).toList();
    }

    resp.setStatus(200);
    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(items));
  }
}
