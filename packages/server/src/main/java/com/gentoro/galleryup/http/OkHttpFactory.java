package com.gentoro.galleryup.http;

import java.time.Duration;
import okhttp3.OkHttpClient;

/** OkHttp clients for outgoing calls, identified by {@link #USER_AGENT} and logged. */
public final class OkHttpFactory {
  public static final String USER_AGENT = "galleryup/0.1";

  private OkHttpFactory() {}

  /**
   * @param callTimeout upper bound for a whole call including redirects; connect is capped at 10s
   */
  public static OkHttpClient create(Duration callTimeout) {
    Duration connect =
        callTimeout.compareTo(Duration.ofSeconds(10)) < 0 ? callTimeout : Duration.ofSeconds(10);
    return new OkHttpClient.Builder()
        .connectTimeout(connect)
        .readTimeout(callTimeout)
        .writeTimeout(callTimeout)
        .callTimeout(callTimeout)
        .addInterceptor(
            chain ->
                chain.proceed(
                    chain.request().newBuilder().header("User-Agent", USER_AGENT).build()))
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
