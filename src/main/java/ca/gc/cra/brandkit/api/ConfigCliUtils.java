package ca.gc.cra.brandkit.api;

import ca.gc.cra.brandkit.config.RegistrySettings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Shared helpers for separating registry settings from operation arguments on one command line.
 */
final class ConfigCliUtils {
  /** Argument names consumed by {@link ca.gc.cra.brandkit.config.RegistrySettings}. */
  static final Set<String> SETTINGS_KEYS = RegistrySettings.KEYS;

  private ConfigCliUtils() {}

  /**
   * Removes {@code config=PATH} (or {@code --config=PATH}) from {@code args}.
   *
   * @param args parsed arguments; modified in place
   * @return settings file location, or {@code null} when not given
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Removes the settings keys from {@code args}.
   *
   * @param args parsed arguments; modified in place
   * @return the removed settings, in argument order
   */
  static Map<String, String> extractSettings(Map<String, String> args) {
    Map<String, String> settings = new LinkedHashMap<>();
    args.entrySet().removeIf(entry -> {
      if (SETTINGS_KEYS.contains(entry.getKey())) {
        settings.put(entry.getKey(), entry.getValue());
        return true;
      }
      return false;
    });
    return settings;
  }

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    if (map == null) {
      return defaultValue;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
