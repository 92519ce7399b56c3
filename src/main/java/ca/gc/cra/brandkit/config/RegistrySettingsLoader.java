package ca.gc.cra.brandkit.config;

import ca.gc.cra.brandkit.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves {@link RegistrySettings} for a CLI command from defaults, an optional YAML file
 * and CLI arguments.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load the YAML {@code common} and command sections when the settings file exists.</li>
 *   <li>Apply CLI &gt; YAML &gt; defaults precedence, reporting CLI overrides.</li>
 *   <li>Validate and create the brand and template roots.</li>
 * </ul>
 *
 * @since 0.1.0
 * @see ConfigMerger
 * @see SettingsFile
 */
public final class RegistrySettingsLoader {
  private static final Logger log = LoggerFactory.getLogger(RegistrySettingsLoader.class);

  /** Settings file consulted when no {@code config=PATH} argument is given. */
  public static final Path DEFAULT_CONFIG_FILE = Path.of("brandkit.yaml");

  private RegistrySettingsLoader() {
    // Utility
  }

  /**
   * Resolves settings for {@code command}.
   *
   * @param command CLI command ({@code brand}, {@code asset}, {@code template})
   * @param configFile YAML settings file; may be absent on disk
   * @param cli CLI settings overrides
   * @param warn receives override warnings; {@code null} logs them at WARN
   * @return validated settings with created roots
   * @throws IOException if the settings file cannot be read
   * @throws IllegalArgumentException if any setting is invalid
   */
  public static RegistrySettings load(
      String command, Path configFile, Map<String, String> cli, Consumer<String> warn) throws IOException {
    Objects.requireNonNull(command, "command");
    Consumer<String> sink = warn == null ? log::warn : warn;
    Optional<Map<String, String>> yaml = configFile == null
        ? Optional.empty()
        : SettingsFile.read(configFile, command);
    yaml.ifPresent(values -> log.debug("Loaded {} settings from {}", values.size(), configFile));
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        command, yaml, cli, DefaultsForCommand.asFlatMap(command), sink);
    RegistrySettings settings = RegistrySettings.fromMap(effective);
    Path brands = Paths.validateWritableDir(settings.brandsRoot(), null, true, true);
    Path templates = Paths.validateWritableDir(settings.templatesRoot(), null, true, true);
    return settings.withRoots(brands, templates);
  }
}
