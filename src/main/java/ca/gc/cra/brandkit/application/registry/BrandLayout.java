package ca.gc.cra.brandkit.application.registry;

import ca.gc.cra.brandkit.domain.error.RegistryValidationException;
import ca.gc.cra.brandkit.validation.Strings;
import java.nio.file.Path;
import java.util.Objects;

/**
 * On-disk layout of the brand registry root.
 *
 * <pre>
 * &lt;root&gt;/&lt;brand&gt;/brand_config.&lt;ext&gt;
 * &lt;root&gt;/&lt;brand&gt;/assets/{images,fonts,misc}/
 * &lt;root&gt;/&lt;brand&gt;/templates/
 * &lt;root&gt;/&lt;brand&gt;/backups/
 * &lt;root&gt;/&lt;brand&gt;/asset_registry.json
 * </pre>
 *
 * @since 0.1.0
 */
public final class BrandLayout {
  /** Base name of the brand document. */
  public static final String DOCUMENT_BASENAME = "brand_config";
  /** Asset index file name. */
  public static final String INDEX_FILE = "asset_registry.json";
  /** Asset tree directory name. */
  public static final String ASSETS_DIR = "assets";
  /** Backup directory name. */
  public static final String BACKUPS_DIR = "backups";
  /** Brand-specific template directory name. */
  public static final String TEMPLATES_DIR = "templates";

  private final Path root;
  private final String documentExtension;

  /**
   * Creates a layout rooted at {@code root}.
   *
   * @param root registry root directory
   * @param documentExtension document file extension without the dot, e.g. {@code yaml}
   */
  public BrandLayout(Path root, String documentExtension) {
    this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    this.documentExtension = Strings.requireNonBlank("documentExtension", documentExtension);
  }

  public Path root() {
    return root;
  }

  /**
   * Returns the directory of {@code name} after validating the name.
   *
   * @param name brand name
   * @return absolute brand directory
   * @throws RegistryValidationException if {@code name} is not a valid entity name
   */
  public Path directory(String name) {
    if (!Strings.isValidEntityName(name)) {
      throw new RegistryValidationException(name,
          "Invalid brand name '" + name + "': use 1-" + Strings.MAX_ENTITY_NAME_LENGTH
              + " letters, digits, '_' or '-', not starting with a digit or '_'");
    }
    return root.resolve(name);
  }

  public Path document(String name) {
    return directory(name).resolve(documentFileName());
  }

  public Path assets(String name) {
    return directory(name).resolve(ASSETS_DIR);
  }

  public Path backups(String name) {
    return directory(name).resolve(BACKUPS_DIR);
  }

  public Path index(String name) {
    return directory(name).resolve(INDEX_FILE);
  }

  public String documentFileName() {
    return DOCUMENT_BASENAME + "." + documentExtension;
  }
}
