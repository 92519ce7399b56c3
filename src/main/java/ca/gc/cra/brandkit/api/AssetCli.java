package ca.gc.cra.brandkit.api;

import ca.gc.cra.brandkit.application.asset.AssetDeletionResult;
import ca.gc.cra.brandkit.application.asset.AssetListing;
import ca.gc.cra.brandkit.application.asset.AssetSummary;
import ca.gc.cra.brandkit.application.asset.AssetValidationReport;
import ca.gc.cra.brandkit.application.asset.CleanupSummary;
import ca.gc.cra.brandkit.application.asset.UploadResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Map;

/**
 * Operator commands for brand asset files: upload, validate, list, delete and cleanup.
 *
 * @since 0.1.0
 */
public final class AssetCli {
  static final String SUMMARY_USAGE =
      "usage: asset <upload|validate|list|delete|cleanup> brand=NAME [file=PATH|data=BASE64] [type=TYPE] "
          + "[path=RELATIVE] [--remove-unused] [--no-backup]";
  private static final String HELP_TEXT = """
      Brandkit asset registry

      Usage:
        asset <action> [arguments] [settings] [flags]

      Actions:
        upload    brand=NAME type=TYPE (file=PATH | data=BASE64 filename=NAME) [filename=NAME] [metadata=DOC]
        validate  brand=NAME path=RELATIVE       Check existence, type and recorded checksum
        list      brand=NAME [type=TYPE]         List files under the brand's assets directory
        delete    brand=NAME path=RELATIVE [--no-backup]
        cleanup   brand=NAME [--remove-unused]   Remove empty directories and, optionally, unreferenced files

      Types:
        logo, image, icon, background, font, css, template, misc

      Settings (override config=PATH, default brandkit.yaml):
        brandsRoot=PATH  maxAssetBytes=BYTES  metricsExporter=none|otlp

      Flags:
        --remove-unused  Delete asset files the brand configuration does not reference
        --no-backup      Skip the copy into backups/ before delete
        --verbose        Enable DEBUG logging
        --help           Show this message
      """;

  private AssetCli() {}

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
   * Runs an asset action and returns a normalized exit code.
   *
   * @param args action followed by its arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    return runner().run(args);
  }

  static CommandRunner runner() {
    return new CommandRunner("asset", SUMMARY_USAGE, HELP_TEXT, Map.<String, CommandRunner.Action>of(
        "upload", AssetCli::upload,
        "validate", AssetCli::validate,
        "list", AssetCli::list,
        "delete", AssetCli::delete,
        "cleanup", AssetCli::cleanup));
  }

  private static ExitCode upload(Invocation call) throws IOException {
    String brand = call.required("brand");
    String type = call.required("type");
    String file = call.optional("file");
    String data = call.optional("data");
    String filename = call.optional("filename");
    if ((file == null) == (data == null)) {
      throw new IllegalArgumentException("exactly one of file or data is required");
    }
    String encoded;
    if (file != null) {
      Path source = Path.of(file);
      if (!Files.isRegularFile(source)) {
        throw new IllegalArgumentException("file not found: " + source);
      }
      encoded = Base64.getEncoder().encodeToString(Files.readAllBytes(source));
      if (filename == null) {
        filename = source.getFileName().toString();
      }
    } else {
      if (filename == null) {
        throw new IllegalArgumentException("filename is required with data");
      }
      encoded = data;
    }
    UploadResult result = call.root().assetRegistry()
        .upload(brand, encoded, filename, type, call.document("metadata"));
    CliPrinter.println("Uploaded '" + result.filename() + "' to brand '" + result.brand() + "'");
    CliPrinter.field("Path", result.relativePath());
    CliPrinter.field("Type", result.assetType());
    CliPrinter.field("Size", result.fileSize());
    CliPrinter.field("SHA-256", result.checksum());
    CliPrinter.field("Uploaded at", result.uploadedAt());
    return ExitCode.SUCCESS;
  }

  private static ExitCode validate(Invocation call) {
    AssetValidationReport report = call.root().assetRegistry()
        .validate(call.required("brand"), call.required("path"));
    CliPrinter.println("Asset '" + report.assetPath() + "' in brand '" + report.brand() + "': "
        + report.status().value());
    CliPrinter.field("Size", report.fileSize());
    CliPrinter.field("SHA-256", report.checksum());
    CliPrinter.field("Modified", report.modifiedTime());
    CliPrinter.field("Extension", report.extension());
    CliPrinter.field("Allowed type", report.allowedType());
    CliPrinter.field("Index checksum", report.indexChecksumMatches() == null
        ? "not recorded"
        : report.indexChecksumMatches() ? "matches" : "differs");
    if (report.message() != null) {
      CliPrinter.field("Message", report.message());
    }
    return report.status() == AssetValidationReport.Status.MISSING ? ExitCode.NOT_FOUND : ExitCode.SUCCESS;
  }

  private static ExitCode list(Invocation call) {
    AssetListing listing = call.root().assetRegistry().list(call.required("brand"), call.optional("type"));
    if (listing.assets().isEmpty()) {
      CliPrinter.println("No assets found for brand '" + listing.brand() + "'");
      return ExitCode.SUCCESS;
    }
    for (AssetSummary asset : listing.assets()) {
      CliPrinter.println(asset.relativePath() + "  " + asset.assetType() + "  " + asset.fileSize() + " bytes  "
          + asset.modifiedTime());
    }
    CliPrinter.println(listing.totalCount() + " assets, " + listing.totalSize() + " bytes");
    return ExitCode.SUCCESS;
  }

  private static ExitCode delete(Invocation call) {
    AssetDeletionResult result = call.root().assetRegistry()
        .delete(call.required("brand"), call.required("path"), !call.flag("--no-backup"));
    CliPrinter.println("Deleted asset '" + result.assetPath() + "' from brand '" + result.brand() + "'");
    CliPrinter.field("Bytes deleted", result.fileSizeDeleted());
    CliPrinter.field("Backup", result.backupPath());
    return ExitCode.SUCCESS;
  }

  private static ExitCode cleanup(Invocation call) {
    CleanupSummary summary = call.root().assetRegistry()
        .cleanup(call.required("brand"), call.flag("--remove-unused"));
    CliPrinter.println("Cleaned assets for brand '" + summary.brand() + "'");
    CliPrinter.field("Files processed", summary.filesProcessed());
    CliPrinter.field("Files removed", summary.filesRemoved());
    CliPrinter.field("Bytes reclaimed", summary.spaceReclaimed());
    CliPrinter.field("Empty dirs removed", summary.emptyDirsRemoved());
    CliPrinter.bullets("Warnings:", summary.warnings());
    return ExitCode.SUCCESS;
  }
}
