package ca.gc.cra.brandkit.domain.brand;

import java.util.List;
import java.util.Objects;

/**
 * One entry of a brand's {@code assets} section.
 *
 * @param role asset role such as {@code logo} or {@code fonts}
 * @param paths resolved paths; a scalar entry yields exactly one
 * @param multiValued {@code true} when the document holds a list for this role
 * @since 0.1.0
 */
public record AssetReference(String role, List<ResolvedAsset> paths, boolean multiValued) {
  public AssetReference {
    role = Objects.requireNonNull(role, "role");
    paths = List.copyOf(paths);
  }

  /**
   * Returns {@code true} when every path resolved to an existing file.
   *
   * @return resolution flag
   */
  public boolean allResolved() {
    return paths.stream().allMatch(ResolvedAsset::resolved);
  }
}
