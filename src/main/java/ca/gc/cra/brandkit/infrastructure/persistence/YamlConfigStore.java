package ca.gc.cra.brandkit.infrastructure.persistence;

import ca.gc.cra.brandkit.application.port.ConfigStore;
import ca.gc.cra.brandkit.application.port.MalformedDocumentException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;

/**
 * {@link ConfigStore} backed by SnakeYAML block-style documents.
 *
 * <p>Key order is preserved on load and save. Unquoted timestamps load as plain strings so they round-trip
 * unchanged. Saves go through {@link AtomicFiles#write(Path, byte[])}.</p>
 *
 * @since 0.1.0
 */
public final class YamlConfigStore implements ConfigStore {
  private static final int MAX_ALIASES = 50;

  @Override
  public Map<String, Object> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = newYaml().load(reader);
    } catch (YAMLException ex) {
      throw new MalformedDocumentException(path, "Invalid YAML in " + path + ": " + ex.getMessage(), ex);
    }
    if (document == null) {
      throw new MalformedDocumentException(path, "Empty document: " + path);
    }
    if (!(document instanceof Map<?, ?> raw)) {
      throw new MalformedDocumentException(path, "Document root must be a mapping: " + path);
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (entry.getKey() == null) {
        throw new MalformedDocumentException(path, "Document contains a null key: " + path);
      }
      map.put(entry.getKey().toString(), entry.getValue());
    }
    return map;
  }

  @Override
  public void save(Path path, Map<String, Object> document) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(document, "document");
    String text;
    try {
      text = newYaml().dump(document);
    } catch (YAMLException ex) {
      throw new IOException("Unable to serialize document for " + path + ": " + ex.getMessage(), ex);
    }
    AtomicFiles.write(path, text.getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public boolean exists(Path path) {
    return path != null && Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS);
  }

  @Override
  public String fileExtension() {
    return "yaml";
  }

  private static Yaml newYaml() {
    LoaderOptions loaderOptions = new LoaderOptions();
    loaderOptions.setMaxAliasesForCollections(MAX_ALIASES);
    loaderOptions.setAllowDuplicateKeys(false);
    DumperOptions dumperOptions = new DumperOptions();
    dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    dumperOptions.setIndent(2);
    dumperOptions.setIndicatorIndent(0);
    dumperOptions.setPrettyFlow(true);
    dumperOptions.setSplitLines(false);
    return new Yaml(
        new TimestampAsStringConstructor(loaderOptions),
        new Representer(dumperOptions),
        dumperOptions,
        loaderOptions);
  }

  private static final class TimestampAsStringConstructor extends SafeConstructor {
    private TimestampAsStringConstructor(LoaderOptions options) {
      super(options);
      this.yamlConstructors.put(Tag.TIMESTAMP, new ConstructYamlStr());
    }
  }
}
