package ca.gc.cra.brandkit.application.template;

/**
 * Outcome of {@link TemplateCatalog#delete}.
 *
 * @param name template name
 * @param category category of the deleted template; {@code null} when its document was unreadable
 * @param version version of the deleted template; {@code null} when its document was unreadable
 * @param filesDeleted regular files removed
 */
public record TemplateDeletionResult(String name, String category, String version, long filesDeleted) {}
