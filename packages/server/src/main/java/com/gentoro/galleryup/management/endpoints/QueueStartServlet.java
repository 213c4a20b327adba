package com.gentoro.galleryup.management.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.galleryup.exception.IllegalStateTransitionException;
import com.gentoro.galleryup.queue.GalleryQueueItem;
import com.gentoro.galleryup.queue.QueueManager;
import com.gentoro.galleryup.queue.QueueStatus;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;

/**
 * POST /mng/queue/start?path=...: queue a READY, PAUSED, INCOMPLETE or FAILED gallery. A
 * COMPLETED gallery is re-run only with {@code rerun=true}.
 */
public final class QueueStartServlet extends HttpServlet {
  private final QueueManager queue;
  private final ObjectMapper mapper = new ObjectMapper();

  public QueueStartServlet(QueueManager queue) {
    this.queue = queue;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String path = req.getParameter("path");
    if (path == null || path.isBlank()) {
      resp.sendError(400, "Missing path");
      return;
    }

    Optional<GalleryQueueItem> item = queue.getItem(path);
    if (item.isEmpty()) {
      resp.sendError(404, "Unknown gallery");
      return;
    }

    boolean changed;
    try {
      if (item.get().getStatus() == QueueStatus.COMPLETED
          && Boolean.parseBoolean(req.getParameter("rerun"))) {
        queue.rerun(path);
        changed = true;
      } else {
        changed = queue.start(path);
      }
    } catch (IllegalStateTransitionException e) {
      resp.sendError(409, e.getMessage());
      return;
    }

    ObjectNode node = mapper.createObjectNode();
    node.put("path", item.get().getPath());
    node.put("queued", changed);
    resp.setStatus(202);
    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(node));
  }
}
