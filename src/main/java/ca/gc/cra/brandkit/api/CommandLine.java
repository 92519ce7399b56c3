package ca.gc.cra.brandkit.api;

import ca.gc.cra.brandkit.validation.Strings;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One Brandkit command line split into words, {@code key=value} arguments and flags.
 *
 * <p>{@code brandkit brand update name=acme updates=@acme.yaml --force} yields the words
 * {@code [brand, update]}, the arguments {@code name} and {@code updates}, and the flag {@code --force}.
 * {@code --key=value} is the same argument as {@code key=value}. Help ({@code --help}, {@code -h},
 * {@code help}) and verbose ({@code --verbose}, {@code -v}, {@code --debug}) aliases are folded into
 * {@link #help()} and {@link #verbose()}.</p>
 *
 * <p>Argument values keep any {@code '='} after the first one, so inline documents such as
 * {@code updates={colors: {primary: '#000'}}} pass through intact. Values must be single-line; multi-line
 * documents go through the {@code @PATH} form handled by {@link CliDocuments}.</p>
 */
final class CommandLine {
  private static final Set<String> HELP_ALIASES = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_ALIASES = Set.of("--verbose", "-v", "--debug");
  private static final Pattern ARGUMENT_NAME = Pattern.compile("^[A-Za-z0-9._-]+$");

  private final List<String> words;
  private final Map<String, String> arguments;
  private final Set<String> flags;
  private final boolean help;
  private final boolean verbose;

  private CommandLine(
      List<String> words, Map<String, String> arguments, Set<String> flags, boolean help, boolean verbose) {
    this.words = List.copyOf(words);
    this.arguments = arguments;
    this.flags = Set.copyOf(flags);
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments. Null and blank tokens are skipped.
   *
   * @param args raw CLI arguments; {@code null} is an empty command line
   * @return parsed command line
   * @throws IllegalArgumentException if an argument has a bad name, an empty value or control characters,
   *     or is given twice
   */
  static CommandLine parse(String[] args) {
    List<String> words = new ArrayList<>();
    Map<String, String> arguments = new LinkedHashMap<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    if (args != null) {
      for (String raw : args) {
        String token = raw == null ? "" : raw.trim();
        if (token.isEmpty()) {
          continue;
        }
        String lower = token.toLowerCase(Locale.ROOT);
        if (HELP_ALIASES.contains(lower)) {
          help = true;
        } else if (VERBOSE_ALIASES.contains(lower)) {
          verbose = true;
        } else if (token.indexOf('=') >= 0) {
          addArgument(arguments, token);
        } else if (token.startsWith("-")) {
          flags.add(lower);
        } else {
          words.add(token);
        }
      }
    }
    return new CommandLine(words, arguments, flags, help, verbose);
  }

  /**
   * Returns this command line without its first word, keeping arguments and flags.
   *
   * @return command line for the delegated command
   */
  CommandLine shift() {
    List<String> rest = words.isEmpty() ? List.of() : words.subList(1, words.size());
    return new CommandLine(rest, new LinkedHashMap<>(arguments), flags, help, verbose);
  }

  /** Positional words in order: command, then action. */
  List<String> words() {
    return words;
  }

  /**
   * Returns the first word lower-cased.
   *
   * @return command or action name, or {@code null} when there are no words
   */
  String head() {
    return words.isEmpty() ? null : words.get(0).toLowerCase(Locale.ROOT);
  }

  /**
   * Returns the {@code key=value} arguments in command-line order.
   *
   * @return mutable copy; callers may remove the keys they consume
   */
  Map<String, String> arguments() {
    return new LinkedHashMap<>(arguments);
  }

  boolean help() {
    return help;
  }

  boolean verbose() {
    return verbose;
  }

  /**
   * Checks for a flag such as {@code --force}, ignoring case.
   *
   * @param flag flag to query
   * @return {@code true} if the flag was supplied
   */
  boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /** Lower-cased flags other than the help and verbose aliases. */
  Set<String> flags() {
    return flags;
  }

  private static void addArgument(Map<String, String> arguments, String token) {
    int idx = token.indexOf('=');
    String key = token.substring(0, idx).trim();
    if (key.startsWith("--")) {
      key = key.substring(2);
    }
    String value = token.substring(idx + 1).trim();
    if (key.isEmpty() || value.isEmpty()) {
      throw new IllegalArgumentException("argument must be key=value (was '" + token + "')");
    }
    if (!ARGUMENT_NAME.matcher(key).matches()) {
      throw new IllegalArgumentException("invalid argument name: " + key);
    }
    if (value.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("argument " + key + " must not contain null bytes");
    }
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
    }
    Strings.requireNonBlank(key, value);
    if (arguments.putIfAbsent(key, value) != null) {
      throw new IllegalArgumentException("argument " + key + " given more than once");
    }
  }
}
