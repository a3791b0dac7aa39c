package ca.gc.cra.halo.api;

import java.util.Map;

/** Helpers shared by commands that accept a {@code config=} YAML file. */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /** Removes and returns the {@code config} (or {@code --config}) entry, or {@code null}. */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }
}
