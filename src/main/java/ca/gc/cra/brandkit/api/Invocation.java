package ca.gc.cra.brandkit.api;

import ca.gc.cra.brandkit.config.CompositionRoot;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Arguments and services available to a single CLI action.
 *
 * <p>Tracks which arguments and flags were read so that misspelled ones are reported instead of silently ignored.</p>
 */
final class Invocation {
  private static final Logger log = LoggerFactory.getLogger(Invocation.class);

  private final CompositionRoot root;
  private final Map<String, String> args;
  private final CommandLine line;
  private final Set<String> consumed = new LinkedHashSet<>();
  private final Set<String> consumedFlags = new LinkedHashSet<>();

  Invocation(CompositionRoot root, Map<String, String> args, CommandLine line) {
    this.root = root;
    this.args = args;
    this.line = line;
  }

  CompositionRoot root() {
    return root;
  }

  /**
   * Returns a required argument.
   *
   * @param key argument name
   * @return trimmed value
   * @throws IllegalArgumentException if the argument is absent
   */
  String required(String key) {
    String value = optional(key);
    if (value == null) {
      throw new IllegalArgumentException(key + " is required");
    }
    return value;
  }

  String optional(String key) {
    consumed.add(key);
    return args.get(key);
  }

  boolean bool(String key, boolean defaultValue) {
    consumed.add(key);
    return ConfigCliUtils.parseBoolean(args, key, defaultValue);
  }

  Map<String, Object> document(String key) {
    return CliDocuments.parse(key, optional(key));
  }

  boolean flag(String flag) {
    consumedFlags.add(flag);
    return line.hasFlag(flag);
  }

  /**
   * Logs every argument and flag the action never looked at.
   *
   * @param action command and action name, e.g. {@code brand delete}
   */
  void warnUnused(String action) {
    for (String key : args.keySet()) {
      if (!consumed.contains(key)) {
        log.warn("Ignoring unknown argument for {}: {}", action, key);
      }
    }
    for (String flag : line.flags()) {
      if (!consumedFlags.contains(flag)) {
        log.warn("Ignoring unknown flag for {}: {}", action, flag);
      }
    }
  }
}
