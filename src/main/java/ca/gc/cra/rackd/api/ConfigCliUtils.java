package ca.gc.cra.rackd.api;

import java.util.Map;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the configuration file path so it never reaches config validation.
   *
   * @param args mutable CLI map
   * @return trimmed path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String path = null;
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (path == null && value != null && !value.isBlank()) {
        path = value.trim();
      }
    }
    return path;
  }

  /**
   * Removes a boolean switch from the map; only {@code true} (any case) enables it.
   *
   * @param map mutable configuration map
   * @param key switch name such as {@code dryRun}
   * @return parsed value, {@code false} when absent or blank
   */
  static boolean takeBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.remove(key);
    if (value == null || value.isBlank()) {
      return false;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
