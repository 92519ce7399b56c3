package ca.gc.cra.brandkit.application.registry;

import ca.gc.cra.brandkit.domain.brand.BrandStatus;
import ca.gc.cra.brandkit.domain.brand.ProtectionLevel;

/**
 * One row of {@link BrandRegistry#list}.
 *
 * @param name brand name
 * @param displayName {@code brand.name} from the document
 * @param status lifecycle status
 * @param version document version
 * @param protectionLevel effective protection level
 * @param templateSource template or brand the brand was created from; {@code null} when unknown
 * @param createdAt creation timestamp; {@code null} when unknown
 * @param updatedAt last update timestamp; {@code null} when unknown
 * @param assetCount regular files under {@code assets/}; {@code -1} when not computed
 * @param assetBytes bytes under {@code assets/}; {@code -1} when not computed
 */
public record BrandSummary(
    String name,
    String displayName,
    BrandStatus status,
    String version,
    ProtectionLevel protectionLevel,
    String templateSource,
    String createdAt,
    String updatedAt,
    long assetCount,
    long assetBytes) {

  /** Returns whether asset totals were computed. */
  public boolean detailed() {
    return assetCount >= 0;
  }
}
