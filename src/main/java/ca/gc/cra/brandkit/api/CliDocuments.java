package ca.gc.cra.brandkit.api;

import ca.gc.cra.brandkit.infrastructure.persistence.YamlConfigStore;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Turns CLI argument values into documents and lists.
 *
 * <p>A document value is either {@code @PATH}, read as a YAML file, or an inline YAML flow mapping such as
 * {@code {colors: {primary: '#0055AA'}}}. JSON objects are valid flow mappings.</p>
 */
final class CliDocuments {
  private static final YamlConfigStore FILES = new YamlConfigStore();

  private CliDocuments() {
    // Utility
  }

  /**
   * Parses a document argument.
   *
   * @param key argument name, for diagnostics
   * @param raw argument value; {@code null} yields {@code null}
   * @return mutable document, or {@code null} when {@code raw} is {@code null}
   * @throws IllegalArgumentException if the file is missing or unreadable, or the value is not a mapping
   */
  static Map<String, Object> parse(String key, String raw) {
    if (raw == null) {
      return null;
    }
    if (raw.startsWith("@")) {
      return load(key, raw.substring(1));
    }
    Object parsed;
    try {
      parsed = new Yaml(new SafeConstructor(new LoaderOptions())).load(raw);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException(key + " is not a valid YAML/JSON document: " + ex.getMessage(), ex);
    }
    if (!(parsed instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException(key + " must be a mapping, e.g. " + key + "={colors: {primary: '#000'}}");
    }
    Map<String, Object> document = new LinkedHashMap<>();
    map.forEach((k, v) -> document.put(String.valueOf(k), v));
    return document;
  }

  /**
   * Splits a comma-separated argument, dropping blank items.
   *
   * @param raw argument value; {@code null} yields an empty list
   * @return trimmed items in order
   */
  static List<String> list(String raw) {
    List<String> items = new ArrayList<>();
    if (raw == null) {
      return items;
    }
    for (String part : raw.split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        items.add(trimmed);
      }
    }
    return items;
  }

  private static Map<String, Object> load(String key, String location) {
    Path path;
    try {
      path = Path.of(location.trim());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " file is not a valid path: " + location, ex);
    }
    try {
      return FILES.load(path);
    } catch (NoSuchFileException ex) {
      throw new IllegalArgumentException(key + " file not found: " + path, ex);
    } catch (IOException ex) {
      throw new IllegalArgumentException(key + " file could not be read: " + ex.getMessage(), ex);
    }
  }
}
