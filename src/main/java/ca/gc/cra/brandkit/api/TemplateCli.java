package ca.gc.cra.brandkit.api;

import ca.gc.cra.brandkit.application.template.TemplateCreationResult;
import ca.gc.cra.brandkit.application.template.TemplateDeletionResult;
import ca.gc.cra.brandkit.application.template.TemplateListing;
import ca.gc.cra.brandkit.application.template.TemplateUpdateResult;
import ca.gc.cra.brandkit.application.template.TemplateValidationReport;
import ca.gc.cra.brandkit.domain.template.BrandTemplate;
import ca.gc.cra.brandkit.domain.template.TemplateSummary;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Operator commands for brand templates.
 *
 * @since 0.1.0
 */
public final class TemplateCli {
  static final String SUMMARY_USAGE =
      "usage: template <create|show|list|update|delete|validate> name=NAME [document=DOC] [updates=DOC] "
          + "[category=CATEGORY] [--confirm]";
  private static final String HELP_TEXT = """
      Brandkit template catalog

      Usage:
        template <action> [arguments] [settings] [flags]

      Actions:
        create    name=NAME document=DOC [description=TEXT] [category=CATEGORY] [features=a,b,c]
        show      name=NAME                 Print template metadata and asset lists
        list      [category=CATEGORY]
        update    name=NAME updates=DOC
        delete    name=NAME --confirm
        validate  name=NAME                 Report structure and asset issues

      Documents (DOC):
        @PATH                 YAML or JSON file
        {key: value, ...}     Inline YAML flow mapping or JSON object

      Settings (override config=PATH, default brandkit.yaml):
        templatesRoot=PATH  metricsExporter=none|otlp

      Flags:
        --confirm   Required for delete
        --verbose   Enable DEBUG logging
        --help      Show this message
      """;

  private TemplateCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs a template action and returns a normalized exit code.
   *
   * @param args action followed by its arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    return runner().run(args);
  }

  static CommandRunner runner() {
    return new CommandRunner("template", SUMMARY_USAGE, HELP_TEXT, Map.<String, CommandRunner.Action>of(
        "create", TemplateCli::create,
        "show", TemplateCli::show,
        "list", TemplateCli::list,
        "update", TemplateCli::update,
        "delete", TemplateCli::delete,
        "validate", TemplateCli::validate));
  }

  private static ExitCode create(Invocation call) {
    String name = call.required("name");
    Map<String, Object> document = call.document("document");
    if (document == null) {
      throw new IllegalArgumentException("document is required");
    }
    TemplateCreationResult result = call.root().templateCatalog().create(
        name,
        document,
        call.optional("description"),
        call.optional("category"),
        CliDocuments.list(call.optional("features")));
    CliPrinter.println("Created template '" + result.name() + "'");
    CliPrinter.field("Directory", result.directory());
    CliPrinter.field("Category", result.category());
    CliPrinter.field("Version", result.version());
    CliPrinter.bullets("Warnings:", result.warnings());
    return ExitCode.SUCCESS;
  }

  private static ExitCode show(Invocation call) {
    BrandTemplate template = call.root().templateCatalog().load(call.required("name"));
    CliPrinter.println("Template '" + template.name() + "'");
    CliPrinter.field("Description", template.description());
    CliPrinter.field("Category", template.category());
    CliPrinter.field("Version", template.version());
    CliPrinter.field("Created", template.createdAt());
    CliPrinter.field("Updated", template.updatedAt());
    CliPrinter.field("Features", String.join(", ", template.features()));
    CliPrinter.bullets("Required assets:", template.requiredAssets());
    CliPrinter.bullets("Optional assets:", template.optionalAssets());
    return ExitCode.SUCCESS;
  }

  private static ExitCode list(Invocation call) {
    TemplateListing listing = call.root().templateCatalog().list(call.optional("category"));
    if (listing.templates().isEmpty()) {
      CliPrinter.println("No templates found");
      return ExitCode.SUCCESS;
    }
    for (TemplateSummary summary : listing.templates()) {
      CliPrinter.println(summary.name() + "  " + summary.version() + "  [" + summary.category() + "]  "
          + summary.description());
    }
    CliPrinter.println("Categories: " + String.join(", ", listing.categories()));
    return ExitCode.SUCCESS;
  }

  private static ExitCode update(Invocation call) {
    String name = call.required("name");
    Map<String, Object> updates = call.document("updates");
    if (updates == null) {
      throw new IllegalArgumentException("updates is required");
    }
    TemplateUpdateResult result = call.root().templateCatalog().update(name, updates);
    CliPrinter.println("Updated template '" + result.name() + "'");
    CliPrinter.field("Version", result.version());
    CliPrinter.bullets("Updated fields:", result.updatedFields());
    CliPrinter.bullets("Warnings:", result.warnings());
    return ExitCode.SUCCESS;
  }

  private static ExitCode delete(Invocation call) {
    TemplateDeletionResult result = call.root().templateCatalog()
        .delete(call.required("name"), call.flag("--confirm"));
    CliPrinter.println("Deleted template '" + result.name() + "'");
    CliPrinter.field("Category", result.category());
    CliPrinter.field("Version", result.version());
    CliPrinter.field("Files deleted", result.filesDeleted());
    return ExitCode.SUCCESS;
  }

  private static ExitCode validate(Invocation call) {
    TemplateValidationReport report = call.root().templateCatalog().validate(call.required("name"));
    CliPrinter.println("Template '" + report.name() + "': " + report.status().value());
    List<String> issues = new ArrayList<>();
    for (TemplateValidationReport.Issue issue : report.issues()) {
      issues.add("[" + issue.type().value() + "] " + issue.message());
    }
    CliPrinter.bullets("Issues:", issues);
    return report.status() == TemplateValidationReport.Status.ERROR ? ExitCode.INVALID_ARGS : ExitCode.SUCCESS;
  }
}
