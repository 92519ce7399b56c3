package ca.gc.cra.brandkit.application.registry;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of {@link BrandRegistry#create}.
 *
 * @param name brand name
 * @param directory brand directory
 * @param version initial version
 * @param templateSource template or source brand the brand was created from; {@code null} when neither
 * @param createdFiles files written, relative to {@code directory}
 * @param warnings advisory structure warnings
 */
public record CreationResult(
    String name,
    Path directory,
    String version,
    String templateSource,
    List<String> createdFiles,
    List<String> warnings) {
  public CreationResult {
    createdFiles = List.copyOf(createdFiles);
    warnings = List.copyOf(warnings);
  }
}
