package com.gentoro.galleryup;

import com.gentoro.galleryup.exception.ConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;

/**
 * Loads {@code application.yaml} from the classpath and layers an optional user file over it.
 *
 * <p>When watching is enabled the user file's modification time is polled; a changed file is
 * loaded, validated and only then published to listeners. A file that fails to parse or validate
 * is logged and the previous configuration stays in effect.
 */
public final class ConfigurationProvider implements AutoCloseable {
  private static final Logger log =
      com.gentoro.galleryup.logging.LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULTS_RESOURCE = "/application.yaml";

  private final Path userFile;
  private final List<Consumer<Configuration>> listeners = new CopyOnWriteArrayList<>();
  private volatile Consumer<Configuration> validator = c -> {};
  private volatile Configuration current;
  private volatile long lastModified;
  private ScheduledExecutorService watcher;

  public ConfigurationProvider(Path userFile) {
    this.userFile = userFile;
    if (userFile != null && !Files.isRegularFile(userFile)) {
      throw new ConfigException("Configuration file not found: " + userFile);
    }
    this.current = load();
    this.lastModified = modifiedTime();
  }

  public Configuration config() {
    return current;
  }

  public Path userFile() {
    return userFile;
  }

  /** Checked against every reloaded configuration; throwing rejects the reload. */
  public void setValidator(Consumer<Configuration> validator) {
    this.validator = validator;
  }

  public void addListener(Consumer<Configuration> listener) {
    listeners.add(listener);
  }

  /**
   * Reload when the user file changed since the last successful load.
   *
   * @return true when a new configuration was published
   */
  public synchronized boolean reloadIfChanged() {
    if (userFile == null) {
      return false;
    }
    long modified = modifiedTime();
    if (modified == lastModified) {
      return false;
    }
    lastModified = modified;
    Configuration reloaded;
    try {
      reloaded = load();
      validator.accept(reloaded);
    } catch (ConfigException e) {
      log.error("Ignoring invalid configuration in {}: {}", userFile, e.getMessage());
      return false;
    }
    current = reloaded;
    log.info("Configuration reloaded from {}", userFile);
    for (Consumer<Configuration> l : listeners) {
      try {
        l.accept(reloaded);
      } catch (RuntimeException e) {
        log.error("Configuration listener failed: {}", e.toString());
      }
    }
    return true;
  }

  public void startWatching(Duration interval) {
    if (userFile == null || interval.isZero() || interval.isNegative()) {
      return;
    }
    synchronized (this) {
      if (watcher != null) {
        return;
      }
      watcher =
          Executors.newSingleThreadScheduledExecutor(
              r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
              });
    }
    long millis = interval.toMillis();
    watcher.scheduleWithFixedDelay(
        () -> {
          try {
            reloadIfChanged();
          } catch (RuntimeException e) {
            log.error("Configuration reload failed: {}", e.toString());
          }
        },
        millis,
        millis,
        TimeUnit.MILLISECONDS);
  }

  @Override
  public synchronized void close() {
    if (watcher != null) {
      watcher.shutdownNow();
      watcher = null;
    }
  }

  private Configuration load() {
    CompositeConfiguration composite = new CompositeConfiguration();
    if (userFile != null) {
      try (Reader reader = Files.newBufferedReader(userFile, StandardCharsets.UTF_8)) {
        composite.addConfiguration(read(reader));
      } catch (IOException e) {
        throw new ConfigException("Cannot read configuration file " + userFile, e);
      }
    }
    try (InputStream in = ConfigurationProvider.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (in == null) {
        throw new ConfigException("Missing bundled " + DEFAULTS_RESOURCE);
      }
      composite.addConfiguration(read(new InputStreamReader(in, StandardCharsets.UTF_8)));
    } catch (IOException e) {
      throw new ConfigException("Cannot read bundled " + DEFAULTS_RESOURCE, e);
    }
    return composite;
  }

  private static YAMLConfiguration read(Reader reader) throws IOException {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
    } catch (ConfigurationException e) {
      throw new ConfigException("Invalid YAML configuration: " + e.getMessage(), e);
    }
    return yaml;
  }

  private long modifiedTime() {
    if (userFile == null) {
      return 0;
    }
    try {
      return Files.getLastModifiedTime(userFile).toMillis();
    } catch (IOException e) {
      log.warn("Cannot stat configuration file {}: {}", userFile, e.toString());
      return lastModified;
    }
  }
}
