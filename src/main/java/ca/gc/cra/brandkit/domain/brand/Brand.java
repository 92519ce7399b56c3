package ca.gc.cra.brandkit.domain.brand;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Typed view of a loaded brand document.
 *
 * <p>Section maps preserve document order and are read-only. {@link #document()} holds the document exactly
 * as stored, with asset paths unresolved, so callers can round-trip it; {@link #assets()} holds the same
 * entries resolved to absolute paths.</p>
 *
 * @param name storage key, equal to the brand directory name
 * @param directory absolute brand directory
 * @param identity display metadata from the {@code brand} section
 * @param colors color token to CSS color value
 * @param typography nested font declarations
 * @param layout layout token to CSS length
 * @param assets asset role to resolved paths, in document order
 * @param templates document type to template filename
 * @param templateOptions per document type option bags
 * @param pdfSettings PDF rendering settings
 * @param compliance brand compliance rules
 * @param status advisory lifecycle status
 * @param version three-component semantic version
 * @param createdAt ISO-8601 creation time, or {@code null}
 * @param updatedAt ISO-8601 last update time, or {@code null}
 * @param templateSource template the brand was created from, or {@code null}
 * @param protection protection sub-record
 * @param extensions unrecognised top-level keys, preserved verbatim
 * @param document the stored document
 * @param cssVariables generated {@code :root} custom properties
 * @since 0.1.0
 */
public record Brand(
    String name,
    Path directory,
    BrandIdentity identity,
    Map<String, String> colors,
    Map<String, Object> typography,
    Map<String, String> layout,
    Map<String, AssetReference> assets,
    Map<String, String> templates,
    Map<String, Object> templateOptions,
    Map<String, Object> pdfSettings,
    Map<String, Object> compliance,
    BrandStatus status,
    String version,
    String createdAt,
    String updatedAt,
    String templateSource,
    BrandProtection protection,
    Map<String, Object> extensions,
    Map<String, Object> document,
    String cssVariables) {

  public Brand {
    name = Objects.requireNonNull(name, "name");
    directory = Objects.requireNonNull(directory, "directory");
    identity = Objects.requireNonNull(identity, "identity");
    status = Objects.requireNonNull(status, "status");
    version = Objects.requireNonNull(version, "version");
    protection = Objects.requireNonNull(protection, "protection");
    colors = BrandDocuments.readOnly(colors);
    typography = BrandDocuments.readOnly(typography);
    layout = BrandDocuments.readOnly(layout);
    assets = BrandDocuments.readOnly(assets);
    templates = BrandDocuments.readOnly(templates);
    templateOptions = BrandDocuments.readOnly(templateOptions);
    pdfSettings = BrandDocuments.readOnly(pdfSettings);
    compliance = BrandDocuments.readOnly(compliance);
    extensions = BrandDocuments.readOnly(extensions);
    document = BrandDocuments.readOnly(document);
    cssVariables = cssVariables == null ? "" : cssVariables;
  }

  /**
   * Returns every resolved asset path, flattening list-valued roles.
   *
   * @return absolute, normalized paths in document order
   */
  public Set<Path> referencedAssetPaths() {
    Set<Path> paths = new LinkedHashSet<>();
    for (AssetReference reference : assets.values()) {
      for (ResolvedAsset asset : reference.paths()) {
        paths.add(asset.path());
      }
    }
    return paths;
  }
}
