package ca.gc.cra.brandkit.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads {@link RegistrySettings} values from the Brandkit settings file ({@code brandkit.yaml}).
 *
 * <pre>
 * common:
 *   brandsRoot: brands
 *   templatesRoot: templates
 *   metrics_exporter: otlp
 * asset:
 *   maxAssetBytes: 5242880
 * </pre>
 *
 * <p>The {@code common} section applies to every command and the section named after the command overrides it.
 * Setting names may be written in camelCase or snake_case. Relative {@code brandsRoot}, {@code templatesRoot} and
 * {@code archiveDir} values resolve against the directory holding the file, so a settings file keeps working
 * from any working directory. Unknown sections and settings are logged at WARN and ignored; a {@code null}
 * value leaves the setting unset.</p>
 */
public final class SettingsFile {
  private static final Logger log = LoggerFactory.getLogger(SettingsFile.class);

  /** Sections understood in the settings file. */
  static final Set<String> SECTIONS = Set.of("common", "brand", "asset", "template");

  private static final Set<String> PATH_KEYS = Set.of("brandsRoot", "templatesRoot", "archiveDir");

  private SettingsFile() {
    // Utility
  }

  /**
   * Reads the settings that apply to {@code command}.
   *
   * @param file settings file location
   * @param command CLI command ({@code brand}, {@code asset}, {@code template})
   * @return settings keyed by {@link RegistrySettings#KEYS} names, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the file is not valid YAML or a section or setting has the wrong shape
   */
  public static Optional<Map<String, String>> read(Path file, String command) throws IOException {
    Objects.requireNonNull(file, "file");
    Objects.requireNonNull(command, "command");
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    if (Files.isDirectory(file)) {
      throw new IllegalArgumentException("Settings file " + file + " is a directory");
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Settings file " + file + " is not valid YAML: " + ex.getMessage(), ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("Settings file " + file + " must be a mapping of sections");
    }

    String wanted = command.trim().toLowerCase(Locale.ROOT);
    Object common = null;
    Object selected = null;
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      String section = String.valueOf(entry.getKey()).trim().toLowerCase(Locale.ROOT);
      if (!SECTIONS.contains(section)) {
        log.warn("Ignoring unknown settings section '{}' in {}", entry.getKey(), file);
      } else if (section.equals("common")) {
        common = entry.getValue();
      } else if (section.equals(wanted)) {
        selected = entry.getValue();
      }
    }

    Path base = file.toAbsolutePath().getParent();
    Map<String, String> settings = new LinkedHashMap<>();
    readSection(file, base, "common", common, settings);
    readSection(file, base, wanted, selected, settings);
    return Optional.of(Map.copyOf(settings));
  }

  private static void readSection(Path file, Path base, String section, Object node, Map<String, String> target) {
    if (node == null) {
      return;
    }
    if (!(node instanceof Map<?, ?> values)) {
      throw new IllegalArgumentException("Section '" + section + "' in " + file + " must be a mapping");
    }
    for (Map.Entry<?, ?> entry : values.entrySet()) {
      String raw = String.valueOf(entry.getKey()).trim();
      String key = settingName(raw);
      if (key == null) {
        log.warn("Ignoring unknown setting '{}' in section '{}' of {}", raw, section, file);
        continue;
      }
      Object value = entry.getValue();
      if (value == null) {
        target.remove(key);
        continue;
      }
      if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
        throw new IllegalArgumentException(
            "Setting '" + raw + "' in section '" + section + "' of " + file + " must be a single value");
      }
      String text = value.toString().trim();
      target.put(key, PATH_KEYS.contains(key) ? resolve(base, key, text) : text);
    }
  }

  /** Maps {@code brands_root} or {@code brandsRoot} to {@code brandsRoot}; {@code null} for unknown names. */
  static String settingName(String raw) {
    if (RegistrySettings.KEYS.contains(raw)) {
      return raw;
    }
    StringBuilder camel = new StringBuilder(raw.length());
    boolean upper = false;
    for (char c : raw.toCharArray()) {
      if (c == '_' || c == '-') {
        upper = true;
      } else {
        camel.append(upper ? Character.toUpperCase(c) : c);
        upper = false;
      }
    }
    String candidate = camel.toString();
    return RegistrySettings.KEYS.contains(candidate) ? candidate : null;
  }

  private static String resolve(Path base, String key, String value) {
    if (value.isEmpty() || base == null) {
      return value;
    }
    try {
      return base.resolve(value).normalize().toString();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + value, ex);
    }
  }
}
