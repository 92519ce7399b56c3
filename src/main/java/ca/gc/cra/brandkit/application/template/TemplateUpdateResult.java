package ca.gc.cra.brandkit.application.template;

import java.util.List;

/**
 * Outcome of {@link TemplateCatalog#update}.
 *
 * @param name template name
 * @param version version after the update
 * @param updatedFields top-level keys present in the update
 * @param warnings advisory structure warnings
 */
public record TemplateUpdateResult(String name, String version, List<String> updatedFields, List<String> warnings) {
  public TemplateUpdateResult {
    updatedFields = List.copyOf(updatedFields);
    warnings = List.copyOf(warnings);
  }
}
