package com.gentoro.galleryup;

import com.gentoro.galleryup.disk.DiskThresholds;
import com.gentoro.galleryup.exception.ConfigException;
import com.gentoro.galleryup.upload.UploadConfig;
import com.gentoro.galleryup.upload.WorkerOptions;
import java.nio.file.Path;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/** Typed, validated view of the configuration. Built anew on every reload. */
public record PipelineSettings(
    Path dataDir,
    Path tempDir,
    int workers,
    String defaultHost,
    int thumbnailSize,
    int thumbnailFormat,
    int maxRetries,
    boolean publicGallery,
    int parallelBatchSize,
    Duration slotTimeout,
    Duration idleWait,
    Duration idleMaintenanceInterval,
    int globalLimit,
    int perHostLimit,
    DiskThresholds diskThresholds,
    boolean scanAutoStart,
    Path localTargetDir,
    String webhookUrl,
    boolean httpEnabled,
    String httpHostname,
    int httpPort,
    Duration reloadInterval) {

  /**
   * @throws ConfigException when a value is missing, malformed or out of range
   */
  public static PipelineSettings from(Configuration c) {
    try {
      Path dataDir = path(c, "data.dir");
      Path tempDir = path(c, "data.temp-dir");
      return new PipelineSettings(
          dataDir,
          tempDir,
          positive(c, "upload.workers", 1),
          required(c, "upload.default-host", "local"),
          c.getInt("upload.thumbnail-size", 3),
          c.getInt("upload.thumbnail-format", 2),
          nonNegative(c, "upload.max-retries", 3),
          c.getBoolean("upload.public-gallery", true),
          positive(c, "upload.parallel-batch-size", 4),
          Duration.ofMillis(positive(c, "upload.slot-timeout-ms", 30_000)),
          Duration.ofMillis(positive(c, "upload.idle-wait-ms", 100)),
          Duration.ofMillis(nonNegative(c, "upload.idle-maintenance-interval-ms", 1000)),
          positive(c, "concurrency.global-limit", 3),
          positive(c, "concurrency.per-host-limit", 2),
          DiskThresholds.ofMegabytes(
              c.getLong("disk.warning-mb", 2048),
              c.getLong("disk.critical-mb", 1024),
              c.getLong("disk.emergency-mb", 512)),
          c.getBoolean("scan.auto-start", false),
          c.containsKey("hosts.local.target-dir")
              ? path(c, "hosts.local.target-dir")
              : dataDir.resolve("local-host"),
          StringUtils.trimToNull(c.getString("hooks.webhook-url", null)),
          c.getBoolean("http.enabled", true),
          required(c, "http.hostname", "0.0.0.0"),
          port(c, "http.port", 8080),
          Duration.ofMillis(nonNegative(c, "config.reload-interval-ms", 5000)));
    } catch (ConfigException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ConfigException("Invalid configuration: " + e.getMessage(), e);
    }
  }

  public UploadConfig uploadConfig() {
    return new UploadConfig(
        defaultHost,
        thumbnailSize,
        thumbnailFormat,
        maxRetries,
        parallelBatchSize,
        publicGallery,
        "default",
        null,
        null,
        null);
  }

  public WorkerOptions workerOptions() {
    return new WorkerOptions(
        defaultHost, slotTimeout, idleWait, idleMaintenanceInterval, uploadConfig());
  }

  private static Path path(Configuration c, String key) {
    return Path.of(required(c, key, null)).toAbsolutePath().normalize();
  }

  private static String required(Configuration c, String key, String defaultValue) {
    String value = StringUtils.trimToNull(c.getString(key, defaultValue));
    if (value == null) {
      throw new ConfigException("Missing required configuration key: " + key);
    }
    return value;
  }

  private static int positive(Configuration c, String key, int defaultValue) {
    int value = c.getInt(key, defaultValue);
    if (value <= 0) {
      throw new ConfigException(key + " must be positive, got " + value);
    }
    return value;
  }

  private static int port(Configuration c, String key, int defaultValue) {
    int value = c.getInt(key, defaultValue);
    if (value < 0 || value > 65535) {
      throw new ConfigException(key + " must be between 0 and 65535, got " + value);
    }
    return value;
  }

  private static int nonNegative(Configuration c, String key, int defaultValue) {
    int value = c.getInt(key, defaultValue);
    if (value < 0) {
      throw new ConfigException(key + " must not be negative, got " + value);
    }
    return value;
  }
}
