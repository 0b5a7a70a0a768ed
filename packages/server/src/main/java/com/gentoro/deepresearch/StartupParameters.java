package com.gentoro.deepresearch;

import com.gentoro.deepresearch.exception.ConfigException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Command line parameters in the {@code --name=value} form. Bare flags ({@code --name}) are stored
 * as {@code "true"}.
 */
public final class StartupParameters {
  private final Map<String, String> parameters = new HashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (String arg : args) {
      if (arg == null || !arg.startsWith("--") || arg.length() <= 2) {
        throw new ConfigException("Unrecognized startup argument: " + arg);
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

  public boolean hasParameter(String name) {
    return parameters.containsKey(name);
  }

  public <T> T getParameter(String name, Class<T> type) {
    return getParameter(name, type, null);
  }

  public <T> T getParameter(String name, Class<T> type, T defaultValue) {
    String raw = parameters.get(name);
    if (raw == null) return defaultValue;
    try {
      if (type == String.class) return type.cast(raw);
      if (type == Integer.class) return type.cast(Integer.valueOf(raw.trim()));
      if (type == Long.class) return type.cast(Long.valueOf(raw.trim()));
      if (type == Boolean.class) return type.cast(Boolean.valueOf(raw.trim()));
    } catch (NumberFormatException e) {
      throw new ConfigException("Invalid value for --%s: %s".formatted(name, raw), e);
    }
    throw new ConfigException("Unsupported parameter type " + type.getSimpleName());
  }

  /** Path of the YAML configuration file, or {@code null} to use the bundled defaults. */
  public String configFile() {
    return getParameter("config-file", String.class);
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(parameters);
  }
}
