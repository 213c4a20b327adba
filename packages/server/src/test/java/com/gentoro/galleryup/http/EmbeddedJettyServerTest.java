package com.gentoro.galleryup.http;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.galleryup.exception.ConfigException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.junit.jupiter.api.Test;

class EmbeddedJettyServerTest {

  /** Answers with the caller's User-Agent header. */
  static class EchoAgentServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      resp.setContentType("text/plain");
      resp.getWriter().write(String.valueOf(req.getHeader("User-Agent")));
    }
  }

  @Test
  void servesMountedServletsOnEphemeralPort() throws Exception {
    try (EmbeddedJettyServer server = new EmbeddedJettyServer("127.0.0.1", 0)) {
      server.addServlet("/mng/echo", new EchoAgentServlet());
      server.start();
      assertTrue(server.isRunning());
      assertTrue(server.getPort() > 0);
      assertEquals(List.of("/mng/echo"), server.getPathSpecs());

      OkHttpClient client = OkHttpFactory.create(Duration.ofSeconds(5));
      Request request =
          new Request.Builder().url("http://127.0.0.1:" + server.getPort() + "/mng/echo").build();
      try (Response response = client.newCall(request).execute()) {
        assertEquals(200, response.code());
        assertEquals(OkHttpFactory.USER_AGENT, response.body().string());
      }

      assertThrows(
          IllegalStateException.class, () -> server.addServlet("/late", new EchoAgentServlet()));
    }
  }

  @Test
  void stopIsIdempotent() {
    EmbeddedJettyServer server = new EmbeddedJettyServer("127.0.0.1", 0);
    server.stop();
    server.start();
    server.stop();
    server.close();
    assertFalse(server.isRunning());
    assertEquals(0, server.getPort());
  }

  @Test
  void blankHostnameIsRejected() {
    assertThrows(ConfigException.class, () -> new EmbeddedJettyServer(" ", 8080));
  }
}
