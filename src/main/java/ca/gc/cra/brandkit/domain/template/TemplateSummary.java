package ca.gc.cra.brandkit.domain.template;

import java.util.List;

/**
 * Listing view of a template.
 *
 * @param name template name
 * @param description description
 * @param category category
 * @param version template version
 * @param features feature tags
 * @param requiredAssets required asset paths
 * @param optionalAssets optional asset paths
 */
public record TemplateSummary(
    String name,
    String description,
    String category,
    String version,
    List<String> features,
    List<String> requiredAssets,
    List<String> optionalAssets) {

  public TemplateSummary {
    features = List.copyOf(features);
    requiredAssets = List.copyOf(requiredAssets);
    optionalAssets = List.copyOf(optionalAssets);
  }
}
