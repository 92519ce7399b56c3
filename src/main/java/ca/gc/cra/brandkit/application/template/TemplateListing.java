package ca.gc.cra.brandkit.application.template;

import ca.gc.cra.brandkit.domain.template.TemplateSummary;
import java.util.List;

/**
 * Result of {@link TemplateCatalog#list(String)}.
 *
 * @param templates summaries sorted by category, then name
 * @param categories every category seen in the catalog, sorted, regardless of the filter
 * @param categoryFilter filter applied; {@code null} when none
 */
public record TemplateListing(List<TemplateSummary> templates, List<String> categories, String categoryFilter) {
  public TemplateListing {
    templates = List.copyOf(templates);
    categories = List.copyOf(categories);
  }
}
