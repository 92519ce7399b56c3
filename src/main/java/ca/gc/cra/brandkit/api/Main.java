package ca.gc.cra.brandkit.api;

import ca.gc.cra.brandkit.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brandkit CLI dispatcher that routes to the {@code brand}, {@code asset} and {@code template} commands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: brandkit <brand|asset|template> <action> [key=value...] [--verbose]";
  private static final String HELP_TEXT = """
      Brandkit command dispatcher

      Usage:
        brandkit <command> <action> [key=value...] [flags]

      Commands:
        brand     Create, update, protect and delete brand configurations (brand --help)
        asset     Upload, validate, list and clean up brand assets (asset --help)
        template  Manage the templates new brands start from (template --help)

      Settings:
        config=PATH  YAML settings file (default brandkit.yaml); its common section and the section
                     named after the command apply, and key=value settings override both

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

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
   * Dispatches a command and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the command)
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    CommandLine line;
    try {
      line = CommandLine.parse(args);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = line.head();
    if (command == null) {
      if (line.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (line.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    CommandLine delegated = line.shift();
    return switch (command) {
      case "brand" -> BrandCli.runner().run(delegated);
      case "asset" -> AssetCli.runner().run(delegated);
      case "template" -> TemplateCli.runner().run(delegated);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
