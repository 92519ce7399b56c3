package ca.gc.cra.brandkit.api;

import ca.gc.cra.brandkit.config.CompositionRoot;
import ca.gc.cra.brandkit.config.RegistrySettings;
import ca.gc.cra.brandkit.config.RegistrySettingsLoader;
import ca.gc.cra.brandkit.domain.error.EntityExistsException;
import ca.gc.cra.brandkit.domain.error.EntityNotFoundException;
import ca.gc.cra.brandkit.domain.error.ProtectionViolationException;
import ca.gc.cra.brandkit.domain.error.RegistryInternalException;
import ca.gc.cra.brandkit.domain.error.RegistryValidationException;
import ca.gc.cra.brandkit.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Shared lifecycle of the {@code brand}, {@code asset} and {@code template} commands.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the action from the {@link CommandLine}; print help or usage.</li>
 *   <li>Resolve {@link RegistrySettings} from {@code config=PATH}, defaults and CLI overrides.</li>
 *   <li>Open a {@link CompositionRoot}, run the selected action and close it.</li>
 *   <li>Map registry exceptions to {@link ExitCode} values.</li>
 * </ul>
 *
 * @since 0.1.0
 */
final class CommandRunner {
  private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

  /** Executes one action against an opened registry. */
  @FunctionalInterface
  interface Action {
    ExitCode run(Invocation invocation) throws IOException;
  }

  private final String command;
  private final String summaryUsage;
  private final String helpText;
  private final Map<String, Action> actions;
  private final Function<RegistrySettings, CompositionRoot> rootFactory;

  CommandRunner(String command, String summaryUsage, String helpText, Map<String, Action> actions) {
    this(command, summaryUsage, helpText, actions, CompositionRoot::new);
  }

  CommandRunner(
      String command,
      String summaryUsage,
      String helpText,
      Map<String, Action> actions,
      Function<RegistrySettings, CompositionRoot> rootFactory) {
    this.command = Objects.requireNonNull(command, "command");
    this.summaryUsage = Objects.requireNonNull(summaryUsage, "summaryUsage");
    this.helpText = Objects.requireNonNull(helpText, "helpText");
    this.actions = Map.copyOf(actions);
    this.rootFactory = Objects.requireNonNull(rootFactory, "rootFactory");
  }

  /**
   * Runs {@code <action> key=value... [--flags]}.
   *
   * @param args arguments following the command name
   * @return exit code describing the outcome
   */
  ExitCode run(String[] args) {
    CommandLine line;
    try {
      line = CommandLine.parse(args);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(summaryUsage);
      return ExitCode.INVALID_ARGS;
    }
    return run(line);
  }

  /**
   * Runs an already parsed command line whose first word is the action.
   *
   * @param line parsed arguments following the command name
   * @return exit code describing the outcome
   */
  ExitCode run(CommandLine line) {
    if (line.help()) {
      CliPrinter.println(helpText.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (line.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} command", command);
    }

    String actionName = line.head();
    if (actionName == null) {
      log.error("Missing {} action", command);
      CliPrinter.println(summaryUsage);
      return ExitCode.INVALID_ARGS;
    }
    Action action = actions.get(actionName);
    if (action == null) {
      log.error("Unknown {} action: {}", command, actionName);
      CliPrinter.println(summaryUsage);
      return ExitCode.INVALID_ARGS;
    }
    if (line.words().size() > 1) {
      log.error("Unexpected argument for {} {}: {} (arguments are key=value)",
          command, actionName, line.words().get(1));
      CliPrinter.println(summaryUsage);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv = line.arguments();
    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Map<String, String> cliSettings = ConfigCliUtils.extractSettings(kv);
    RegistrySettings settings;
    try {
      Path configFile = configPath == null ? RegistrySettingsLoader.DEFAULT_CONFIG_FILE : Path.of(configPath);
      settings = RegistrySettingsLoader.load(command, configFile, cliSettings, null);
    } catch (IOException ex) {
      log.error("Unable to read settings: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", command, ex.getMessage());
      CliPrinter.println(summaryUsage);
      return ExitCode.CONFIG_ERROR;
    }

    try (CompositionRoot root = rootFactory.apply(settings)) {
      Invocation invocation = new Invocation(root, kv, line);
      ExitCode exit = action.run(invocation);
      invocation.warnUnused(command + " " + actionName);
      return exit;
    } catch (EntityNotFoundException ex) {
      log.error("{}", ex.getMessage());
      return ExitCode.NOT_FOUND;
    } catch (EntityExistsException ex) {
      log.error("{}", ex.getMessage());
      return ExitCode.CONFLICT;
    } catch (ProtectionViolationException ex) {
      log.error("{}", ex.getMessage());
      return ExitCode.PROTECTED;
    } catch (RegistryValidationException ex) {
      log.error("Validation failed: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(summaryUsage);
      return ExitCode.INVALID_ARGS;
    } catch (RegistryInternalException ex) {
      log.error("Registry I/O failure: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (IOException ex) {
      log.error("{} {} I/O failure", command, actionName, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {} {}", command, actionName, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
