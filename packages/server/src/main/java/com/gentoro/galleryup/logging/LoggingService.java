package com.gentoro.galleryup.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.TimeBasedRollingPolicy;
import java.io.File;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for obtaining loggers and for applying the {@code logging.*} section of the
 * application configuration to Logback.
 *
 * <p>Levels are configured as nested YAML keys, e.g.
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com:
 *       gentoro:
 *         galleryup: DEBUG
 * </pre>
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";
  private static final String FILE_APPENDER = "FILE";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply logger levels and the optional file appender. Safe to call again on reload. */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      return;
    }

    for (Iterator<String> it = configuration.getKeys(LEVEL_PREFIX); it.hasNext(); ) {
      String key = it.next();
      String loggerName =
          key.equals(LEVEL_PREFIX + ".root")
              ? Logger.ROOT_LOGGER_NAME
              : key.substring(LEVEL_PREFIX.length() + 1);
      String value = configuration.getString(key, null);
      if (value == null || value.isBlank()) continue;
      context.getLogger(loggerName).setLevel(Level.toLevel(value.trim(), Level.INFO));
    }

    String logDir = configuration.getString("logging.dir", null);
    if (logDir != null && !logDir.isBlank()) {
      attachFileAppender(context, new File(logDir.trim()));
    }
  }

  private static void attachFileAppender(LoggerContext context, File logsDir) {
    ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
    if (root.getAppender(FILE_APPENDER) != null) {
      return;
    }
    if (!logsDir.exists()) {
      // noinspection ResultOfMethodCallIgnored
      logsDir.mkdirs();
    }

    RollingFileAppender<ILoggingEvent> fileAppender = new RollingFileAppender<>();
    fileAppender.setContext(context);
    fileAppender.setName(FILE_APPENDER);
    fileAppender.setFile(new File(logsDir, "galleryup.log").getPath());

    TimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new TimeBasedRollingPolicy<>();
    rollingPolicy.setContext(context);
    rollingPolicy.setParent(fileAppender);
    rollingPolicy.setFileNamePattern(
        new File(logsDir, "galleryup.%d{yyyy-MM-dd}.log.gz").getPath());
    rollingPolicy.setMaxHistory(7);
    rollingPolicy.start();

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n");
    encoder.start();

    fileAppender.setEncoder(encoder);
    fileAppender.setRollingPolicy(rollingPolicy);
    fileAppender.start();

    root.addAppender(fileAppender);
    getLogger(LoggingService.class)
        .info("File logging enabled at {}", new File(logsDir, "galleryup.log").getPath());
  }
}
