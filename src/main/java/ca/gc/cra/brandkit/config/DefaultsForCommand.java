package ca.gc.cra.brandkit.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default settings for each Brandkit CLI command.
 *
 * <p>{@code archiveDir} has no entry: it defaults to the parent of whichever {@code brandsRoot} wins.</p>
 */
public final class DefaultsForCommand {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForCommand() {}

  /**
   * Returns defaults for {@code command} merged with the common defaults.
   *
   * @param command CLI command ({@code brand}, {@code asset}, {@code template})
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException if the command is unknown
   */
  public static Map<String, String> asFlatMap(String command) {
    Objects.requireNonNull(command, "command");
    String normalized = command.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "brand", "template" -> Map.of();
      case "asset" -> Map.of("maxAssetBytes", Long.toString(RegistrySettings.DEFAULT_MAX_ASSET_BYTES));
      default -> throw new IllegalArgumentException("Unsupported command: " + command);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    RegistrySettings defaults = RegistrySettings.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("brandsRoot", defaults.brandsRoot().toString());
    map.put("templatesRoot", defaults.templatesRoot().toString());
    map.put("metricsExporter", defaults.metricsExporter());
    return Map.copyOf(map);
  }
}
