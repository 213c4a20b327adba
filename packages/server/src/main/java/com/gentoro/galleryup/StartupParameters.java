package com.gentoro.galleryup;

import com.gentoro.galleryup.exception.ConfigException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * Command line arguments in {@code --key=value} form. A bare {@code --flag} is read as {@code
 * true}.
 *
 * <ul>
 *   <li>{@code --config=<file>} user YAML file layered over the bundled defaults
 *   <li>{@code --mode=server|drain} run until signalled, or exit once the queue is drained
 *   <li>{@code --add=<dir>[,<dir>...]} folders to scan and queue at start-up
 * </ul>
 */
public final class StartupParameters {
  public static final String MODE_SERVER = "server";
  public static final String MODE_DRAIN = "drain";

  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    for (String arg : args == null ? new String[0] : args) {
      if (!arg.startsWith("--") || arg.length() == 2) {
        throw new ConfigException("Unsupported argument: " + arg);
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq < 0) {
        parameters.put(body, "true");
      } else {
        parameters.put(body.substring(0, eq), body.substring(eq + 1));
      }
    }
  }

  public boolean has(String name) {
    return parameters.containsKey(name);
  }

  @SuppressWarnings("unchecked")
  public <T> T getParameter(String name, Class<T> type) {
    String raw = parameters.get(name);
    if (raw == null) {
      return null;
    }
    if (type == String.class) {
      return (T) raw;
    }
    if (type == Integer.class) {
      if (!NumberUtils.isCreatable(raw)) {
        throw new ConfigException("Parameter --" + name + " must be a number: " + raw);
      }
      return (T) Integer.valueOf(NumberUtils.toInt(raw));
    }
    if (type == Boolean.class) {
      return (T) Boolean.valueOf(raw);
    }
    throw new IllegalArgumentException("Unsupported parameter type: " + type);
  }

  public Path configFile() {
    String value = getParameter("config", String.class);
    return StringUtils.isBlank(value) ? null : Path.of(value.trim());
  }

  public String mode() {
    String value = StringUtils.defaultIfBlank(getParameter("mode", String.class), MODE_SERVER);
    if (!MODE_SERVER.equals(value) && !MODE_DRAIN.equals(value)) {
      throw new ConfigException("Invalid mode: " + value);
    }
    return value;
  }

  public List<Path> foldersToAdd() {
    String value = getParameter("add", String.class);
    if (StringUtils.isBlank(value)) {
      return Collections.emptyList();
    }
    List<Path> folders = new ArrayList<>();
    for (String part : StringUtils.split(value, ',')) {
      if (StringUtils.isNotBlank(part)) {
        folders.add(Path.of(part.trim()));
      }
    }
    return folders;
  }
}
