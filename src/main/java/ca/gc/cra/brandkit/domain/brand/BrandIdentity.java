package ca.gc.cra.brandkit.domain.brand;

/**
 * Display metadata from the document's {@code brand} section.
 *
 * @param name display name
 * @param tagline tagline, empty when absent
 * @param website website URL, empty when absent
 * @param community community URL or handle, empty when absent
 * @since 0.1.0
 */
public record BrandIdentity(String name, String tagline, String website, String community) {
  public BrandIdentity {
    name = name == null ? "" : name;
    tagline = tagline == null ? "" : tagline;
    website = website == null ? "" : website;
    community = community == null ? "" : community;
  }
}
