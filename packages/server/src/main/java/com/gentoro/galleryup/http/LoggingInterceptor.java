package com.gentoro.galleryup.http;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/**
 * Logs each outgoing call with its size, status and duration. Successful calls go to debug;
 * non-2xx answers and transport failures to warn. Bodies are never logged.
 */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.galleryup.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    String target = request.method() + " " + request.url().redact();
    long start = System.nanoTime();

    Response response;
    try {
      response = chain.proceed(request);
    } catch (IOException e) {
      log.warn("{} failed after {}ms: {}", target, elapsed(start), failureKind(e));
      throw e;
    }

    if (response.isSuccessful()) {
      log.debug(
          "{} ({} bytes) -> {} in {}ms",
          target,
          bodySize(request.body()),
          response.code(),
          elapsed(start));
    } else {
      log.warn("{} returned HTTP {} in {}ms", target, response.code(), elapsed(start));
    }
    return response;
  }

  static String failureKind(IOException e) {
    if (e instanceof SocketTimeoutException) {
      return "timeout";
    }
    if (e instanceof ConnectException) {
      return "connection refused (" + e.getMessage() + ")";
    }
    return e.toString();
  }

  private static long bodySize(RequestBody body) {
    if (body == null) {
      return 0;
    }
    try {
      return body.contentLength();
    } catch (IOException e) {
      return -1;
    }
  }

  private static long elapsed(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }
}
