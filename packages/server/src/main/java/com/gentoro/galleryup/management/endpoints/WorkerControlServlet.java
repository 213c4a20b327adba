package com.gentoro.galleryup.management.endpoints;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.galleryup.upload.WorkerPool;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/** POST /mng/workers/{pause|resume|stop-current}: control the upload workers. */
public final class WorkerControlServlet extends HttpServlet {
  private final WorkerPool workers;
  private final ObjectMapper mapper = new ObjectMapper();

  public WorkerControlServlet(WorkerPool workers) {
    this.workers = workers;
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    String action = req.getPathInfo();
    if (action == null || action.length() <= 1) {
      resp.sendError(400, "Missing action");
      return;
    }
    action = action.substring(1);

    ObjectNode node = mapper.createObjectNode();
    node.put("action", action);
    switch (action) {
      case "pause" -> workers.pause();
      case "resume" -> workers.resume();
      case "stop-current" -> node.put("stopped", workers.stopCurrentUploads());
      default -> {
        resp.sendError(404, "Unknown action: " + action);
        return;
      }
    }
    node.put("paused", workers.isPaused());

    resp.setStatus(200);
    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(node));
  }
}
