package ca.gc.cra.brandkit.domain.brand;

import java.nio.file.Path;
import java.util.Objects;

/**
 * An asset path from the document resolved to an absolute location.
 *
 * @param declared value as written in the document
 * @param path absolute, normalized path; relative values are resolved against the brand directory
 * @param resolved {@code true} when a file existed at {@code path} during load
 * @since 0.1.0
 */
public record ResolvedAsset(String declared, Path path, boolean resolved) {
  public ResolvedAsset {
    declared = Objects.requireNonNull(declared, "declared");
    path = Objects.requireNonNull(path, "path");
  }
}
