package ca.gc.cra.brandkit.api;

import ca.gc.cra.brandkit.application.registry.BrandRegistry;
import ca.gc.cra.brandkit.application.registry.BrandSummary;
import ca.gc.cra.brandkit.application.registry.CreationResult;
import ca.gc.cra.brandkit.application.registry.DeletionResult;
import ca.gc.cra.brandkit.application.registry.ProtectionStatus;
import ca.gc.cra.brandkit.application.registry.UpdateResult;
import ca.gc.cra.brandkit.domain.brand.Brand;
import ca.gc.cra.brandkit.domain.brand.BrandStatus;
import ca.gc.cra.brandkit.domain.brand.ProtectionLevel;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Operator commands for brand configurations: create, show, update, delete, list, protection and status.
 *
 * @since 0.1.0
 */
public final class BrandCli {
  static final String SUMMARY_USAGE =
      "usage: brand <create|show|update|delete|list|lock|unlock|protection|set-status|compliance> "
          + "name=NAME [key=value...] [--force] [--confirm] [--no-backup] [--detailed]";
  private static final String HELP_TEXT = """
      Brandkit brand registry

      Usage:
        brand <action> [arguments] [settings] [flags]

      Actions:
        create      name=NAME [document=DOC] [template=NAME] [overrides=DOC] [copyFrom=BRAND]
        show        name=NAME                       Print the brand, missing assets and CSS variables
        update      name=NAME updates=DOC [--force] [--no-backup]
        delete      name=NAME --confirm [--force] [--no-backup]
        list        [status=active|archived] [--detailed]
        lock        name=NAME level=warn|strict by=ACTOR [reason=TEXT]
        unlock      name=NAME by=ACTOR
        protection  name=NAME                       Print protection level and permitted operations
        set-status  name=NAME status=active|archived by=ACTOR [--force]
        compliance  name=NAME                       Check the brand against its compliance rules

      Documents (DOC):
        @PATH                 YAML or JSON file
        {key: value, ...}     Inline YAML flow mapping or JSON object

      Settings (override config=PATH, default brandkit.yaml):
        brandsRoot=PATH  templatesRoot=PATH  archiveDir=PATH  metricsExporter=none|otlp

      Flags:
        --force      Bypass strict protection (admin only)
        --confirm    Required for delete
        --no-backup  Skip the pre-change backup
        --verbose    Enable DEBUG logging
        --help       Show this message
      """;

  private BrandCli() {}

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
   * Runs a brand action and returns a normalized exit code.
   *
   * @param args action followed by its arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    return runner().run(args);
  }

  static CommandRunner runner() {
    return new CommandRunner("brand", SUMMARY_USAGE, HELP_TEXT, Map.<String, CommandRunner.Action>of(
        "create", BrandCli::create,
        "show", BrandCli::show,
        "update", BrandCli::update,
        "delete", BrandCli::delete,
        "list", BrandCli::list,
        "lock", BrandCli::lock,
        "unlock", BrandCli::unlock,
        "protection", BrandCli::protection,
        "set-status", BrandCli::setStatus,
        "compliance", BrandCli::compliance));
  }

  private static ExitCode create(Invocation call) {
    String name = call.required("name");
    CreationResult result = call.root().brandRegistry().create(
        name,
        call.document("document"),
        call.optional("template"),
        call.document("overrides"),
        call.optional("copyFrom"));
    CliPrinter.println("Created brand '" + result.name() + "'");
    CliPrinter.field("Directory", result.directory());
    CliPrinter.field("Version", result.version());
    CliPrinter.field("Template source", result.templateSource());
    CliPrinter.bullets("Created files:", result.createdFiles());
    CliPrinter.bullets("Warnings:", result.warnings());
    return ExitCode.SUCCESS;
  }

  private static ExitCode show(Invocation call) {
    BrandRegistry registry = call.root().brandRegistry();
    Brand brand = registry.load(call.required("name"));
    CliPrinter.println("Brand '" + brand.name() + "'");
    CliPrinter.field("Display name", brand.identity().name());
    CliPrinter.field("Tagline", brand.identity().tagline());
    CliPrinter.field("Website", brand.identity().website());
    CliPrinter.field("Status", brand.status().value());
    CliPrinter.field("Version", brand.version());
    CliPrinter.field("Template source", brand.templateSource());
    CliPrinter.field("Created", brand.createdAt());
    CliPrinter.field("Updated", brand.updatedAt());
    CliPrinter.field("Protection", brand.protection().effectiveLevel().value());
    List<String> colors = new ArrayList<>();
    brand.colors().forEach((key, value) -> colors.add(key + " = " + value));
    CliPrinter.bullets("Colors:", colors);
    CliPrinter.bullets("Missing assets:", BrandRegistry.missingAssetWarnings(brand));
    if (brand.cssVariables() != null && !brand.cssVariables().isBlank()) {
      CliPrinter.println("CSS variables:");
      CliPrinter.println(brand.cssVariables());
    }
    return ExitCode.SUCCESS;
  }

  private static ExitCode update(Invocation call) {
    String name = call.required("name");
    Map<String, Object> updates = call.document("updates");
    if (updates == null) {
      throw new IllegalArgumentException("updates is required");
    }
    UpdateResult result = call.root().brandRegistry()
        .update(name, updates, !call.flag("--no-backup"), call.flag("--force"));
    printUpdate("Updated brand", result);
    return ExitCode.SUCCESS;
  }

  private static ExitCode delete(Invocation call) {
    String name = call.required("name");
    DeletionResult result = call.root().brandRegistry()
        .delete(name, call.flag("--confirm"), call.flag("--force"), !call.flag("--no-backup"));
    CliPrinter.println("Deleted brand '" + result.name() + "'");
    CliPrinter.field("Files deleted", result.filesDeleted());
    CliPrinter.field("Directories", result.directoriesRemoved());
    CliPrinter.field("Bytes deleted", result.bytesDeleted());
    CliPrinter.field("Backup", result.backupPath());
    CliPrinter.field("Forced", result.forceUsed());
    CliPrinter.bullets("Warnings:", result.warnings());
    return ExitCode.SUCCESS;
  }

  private static ExitCode list(Invocation call) {
    String rawStatus = call.optional("status");
    BrandStatus filter = rawStatus == null ? null : BrandStatus.fromValue(rawStatus);
    boolean detailed = call.flag("--detailed");
    List<BrandSummary> brands = call.root().brandRegistry().list(detailed, filter);
    if (brands.isEmpty()) {
      CliPrinter.println("No brands found");
      return ExitCode.SUCCESS;
    }
    for (BrandSummary summary : brands) {
      StringBuilder line = new StringBuilder()
          .append(summary.name())
          .append("  ").append(summary.version())
          .append("  ").append(summary.status().value())
          .append("  protection=").append(summary.protectionLevel().value());
      if (summary.detailed()) {
        line.append("  assets=").append(summary.assetCount())
            .append(" (").append(summary.assetBytes()).append(" bytes)");
      }
      CliPrinter.println(line.toString());
    }
    return ExitCode.SUCCESS;
  }

  private static ExitCode lock(Invocation call) {
    String name = call.required("name");
    ProtectionLevel level = ProtectionLevel.fromValue(call.required("level"));
    UpdateResult result = call.root().brandRegistry()
        .lock(name, level, call.optional("reason"), call.required("by"));
    printUpdate("Locked brand at '" + level.value() + "'", result);
    return ExitCode.SUCCESS;
  }

  private static ExitCode unlock(Invocation call) {
    UpdateResult result = call.root().brandRegistry().unlock(call.required("name"), call.required("by"));
    printUpdate("Unlocked brand", result);
    return ExitCode.SUCCESS;
  }

  private static ExitCode protection(Invocation call) {
    ProtectionStatus status = call.root().brandRegistry().protectionStatus(call.required("name"));
    CliPrinter.println("Protection for brand '" + status.name() + "'");
    CliPrinter.field("Protected", status.isProtected());
    CliPrinter.field("Level", status.level().value());
    CliPrinter.field("Protected by", status.protectedBy());
    CliPrinter.field("Protected at", status.protectedAt());
    CliPrinter.field("Reason", status.reason());
    CliPrinter.field("Can update", status.canUpdate());
    CliPrinter.field("Can delete", status.canDelete());
    return ExitCode.SUCCESS;
  }

  private static ExitCode setStatus(Invocation call) {
    String name = call.required("name");
    BrandStatus status = BrandStatus.fromValue(call.required("status"));
    UpdateResult result = call.root().brandRegistry()
        .setStatus(name, status, call.required("by"), call.flag("--force"));
    printUpdate("Set status '" + status.value() + "' on brand", result);
    return ExitCode.SUCCESS;
  }

  private static ExitCode compliance(Invocation call) {
    String name = call.required("name");
    List<String> warnings = call.root().brandRegistry().validateCompliance(name);
    if (warnings.isEmpty()) {
      CliPrinter.println("Brand '" + name + "' is compliant");
    } else {
      CliPrinter.bullets("Brand '" + name + "' compliance warnings:", warnings);
    }
    return ExitCode.SUCCESS;
  }

  private static void printUpdate(String heading, UpdateResult result) {
    CliPrinter.println(heading + " '" + result.name() + "'");
    CliPrinter.field("Version", result.versionChanged()
        ? result.previousVersion() + " -> " + result.version()
        : result.version());
    CliPrinter.field("Backup", result.backupPath());
    CliPrinter.bullets("Updated fields:", result.updatedFields());
    CliPrinter.bullets("Warnings:", result.warnings());
  }
}
