package ca.gc.cra.brandkit.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings used by Brandkit registries and CLI layers.
 * <p><strong>Why:</strong> Brand and template names double as directory names, so they must be safe to
 * use as a single filesystem path segment on every platform.
 * <p><strong>Role:</strong> Domain support utilities invoked before registries touch the filesystem.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs supplied via CLI or documents.</li>
 *   <li>Check entity names against the directory-safe character set.</li>
 *   <li>Reject filenames that would escape their target directory.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  /** Maximum length of a brand or template name. */
  public static final int MAX_ENTITY_NAME_LENGTH = 50;

  private static final Pattern ENTITY_NAME_PATTERN = Pattern.compile("^[A-Za-z0-9_-]+$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Tests whether {@code name} is usable as a brand or template name.
   *
   * <p>Accepted names are 1-50 characters of letters, digits, underscore, or hyphen and must not start
   * with a digit, a dot, or an underscore.</p>
   *
   * @param name candidate name; {@code null} is rejected
   * @return {@code true} when the name is directory-safe
   */
  public static boolean isValidEntityName(String name) {
    if (name == null || name.isEmpty() || name.length() > MAX_ENTITY_NAME_LENGTH) {
      return false;
    }
    if (!ENTITY_NAME_PATTERN.matcher(name).matches()) {
      return false;
    }
    char first = name.charAt(0);
    return first != '.' && first != '_' && !Character.isDigit(first);
  }

  /**
   * Tests whether {@code filename} names a single file without directory components.
   *
   * @param filename candidate filename
   * @return {@code true} when the name contains no separators, parent references, or control characters
   */
  public static boolean isPlainFilename(String filename) {
    if (filename == null || filename.isBlank()) {
      return false;
    }
    if (filename.indexOf('/') >= 0 || filename.indexOf('\\') >= 0 || filename.indexOf('\0') >= 0) {
      return false;
    }
    if (filename.equals(".") || filename.equals("..")) {
      return false;
    }
    return !containsControl(filename);
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
