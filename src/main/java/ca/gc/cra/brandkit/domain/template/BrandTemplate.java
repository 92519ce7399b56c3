package ca.gc.cra.brandkit.domain.template;

import ca.gc.cra.brandkit.domain.brand.BrandDocuments;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named preset document used as the basis for new brands.
 *
 * <p>{@link #document()} excludes the {@code template_info} metadata section, so it can be merged straight
 * into a new brand document.</p>
 *
 * @param name template name, equal to its directory name
 * @param description operator-supplied description
 * @param category grouping used for listing; {@code custom} when unspecified
 * @param version template version, independent of brand versions
 * @param createdAt ISO-8601 creation time, or {@code null}
 * @param updatedAt ISO-8601 last update time, or {@code null}
 * @param features feature tags
 * @param requiredAssets asset paths the preset expects
 * @param optionalAssets asset paths under optional roles
 * @param document preset brand document
 * @since 0.1.0
 */
public record BrandTemplate(
    String name,
    String description,
    String category,
    String version,
    String createdAt,
    String updatedAt,
    List<String> features,
    List<String> requiredAssets,
    List<String> optionalAssets,
    Map<String, Object> document) {

  /** Category assigned when none is given. */
  public static final String DEFAULT_CATEGORY = "custom";

  public BrandTemplate {
    name = Objects.requireNonNull(name, "name");
    description = description == null ? "" : description;
    category = category == null || category.isBlank() ? DEFAULT_CATEGORY : category;
    version = version == null ? BrandDocuments.INITIAL_VERSION : version;
    features = List.copyOf(features);
    requiredAssets = List.copyOf(requiredAssets);
    optionalAssets = List.copyOf(optionalAssets);
    document = BrandDocuments.readOnly(document);
  }

  /**
   * Returns the listing view of this template.
   *
   * @return summary
   */
  public TemplateSummary summary() {
    return new TemplateSummary(name, description, category, version, features, requiredAssets, optionalAssets);
  }
}
