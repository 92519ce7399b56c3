package ca.gc.cra.brandkit.domain.brand;

import java.util.Locale;

/**
 * Protection levels gating mutation of a brand.
 *
 * @since 0.1.0
 */
public enum ProtectionLevel {
  /** Unrestricted. */
  NONE("none"),
  /** Mutations proceed but emit a recorded warning. */
  WARN("warn"),
  /** Mutations are refused unless the caller forces them. */
  STRICT("strict");

  private final String value;

  ProtectionLevel(String value) {
    this.value = value;
  }

  /**
   * Returns the document representation.
   *
   * @return lower-case level name
   */
  public String value() {
    return value;
  }

  /**
   * Parses a document or CLI value.
   *
   * @param raw level name, case-insensitive; {@code null} or blank maps to {@link #NONE}
   * @return parsed level
   * @throws IllegalArgumentException if {@code raw} names no level
   */
  public static ProtectionLevel fromValue(String raw) {
    if (raw == null || raw.isBlank()) {
      return NONE;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (ProtectionLevel level : values()) {
      if (level.value.equals(normalized)) {
        return level;
      }
    }
    throw new IllegalArgumentException(
        "Invalid protection level: " + raw + ". Must be one of none, warn, strict");
  }
}
