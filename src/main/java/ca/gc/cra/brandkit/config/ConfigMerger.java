package ca.gc.cra.brandkit.config;

import ca.gc.cra.brandkit.validation.Numbers;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges structured documents and flat settings maps.
 *
 * <p>{@link #merge(Map, Map)} combines brand and template documents: nested mappings merge recursively and every
 * other value (lists and scalars included) is replaced whole by the overlay. {@link #buildEffectiveConfig} applies
 * the CLI &gt; YAML &gt; defaults precedence to runtime settings.</p>
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Recursively merges {@code overlay} onto {@code base}.
   *
   * <p>Neither argument is modified. The result shares no mutable containers with either input.</p>
   *
   * @param base base document; {@code null} is treated as empty
   * @param overlay document whose values win; {@code null} is treated as empty
   * @return new merged document preserving {@code base} key order, with new overlay keys appended
   */
  public static Map<String, Object> merge(Map<String, ?> base, Map<String, ?> overlay) {
    Map<String, Object> result = new LinkedHashMap<>();
    if (base != null) {
      base.forEach((key, value) -> result.put(key, copyValue(value)));
    }
    if (overlay == null) {
      return result;
    }
    for (Map.Entry<String, ?> entry : overlay.entrySet()) {
      String key = entry.getKey();
      Object value = entry.getValue();
      Object current = result.get(key);
      if (current instanceof Map<?, ?> currentMap && value instanceof Map<?, ?> valueMap) {
        result.put(key, merge(stringKeyed(currentMap), stringKeyed(valueMap)));
      } else {
        result.put(key, copyValue(value));
      }
    }
    return result;
  }

  /**
   * Builds an effective settings map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param command active CLI command ({@code brand}, {@code asset}, {@code template})
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged settings map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String command,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    String maxAssetBytes = effective.get("maxAssetBytes");
    if (maxAssetBytes != null && !maxAssetBytes.isBlank()) {
      Numbers.parseRange("maxAssetBytes", maxAssetBytes, 1, RegistrySettings.MAX_ASSET_BYTES_CEILING);
    }
    String exporter = trim(effective.get("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty() && !exporter.equals("none") && !exporter.equals("otlp")) {
      throw new IllegalArgumentException("metricsExporter must be one of none, otlp (was " + exporter + ")");
    }
    if (trim(effective.get("brandsRoot")).isEmpty()) {
      throw new IllegalArgumentException("brandsRoot must not be blank");
    }
    if (trim(effective.get("templatesRoot")).isEmpty()) {
      throw new IllegalArgumentException("templatesRoot must not be blank");
    }
  }

  private static Object copyValue(Object value) {
    if (value instanceof Map<?, ?> map) {
      return merge(stringKeyed(map), null);
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object item : list) {
        copy.add(copyValue(item));
      }
      return copy;
    }
    return value;
  }

  private static Map<String, Object> stringKeyed(Map<?, ?> raw) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      map.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return map;
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
