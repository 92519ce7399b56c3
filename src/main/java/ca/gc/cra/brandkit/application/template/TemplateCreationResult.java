package ca.gc.cra.brandkit.application.template;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of {@link TemplateCatalog#create}.
 *
 * @param name template name
 * @param directory template directory
 * @param category assigned category
 * @param version initial version
 * @param warnings advisory structure warnings
 */
public record TemplateCreationResult(
    String name, Path directory, String category, String version, List<String> warnings) {
  public TemplateCreationResult {
    warnings = List.copyOf(warnings);
  }
}
