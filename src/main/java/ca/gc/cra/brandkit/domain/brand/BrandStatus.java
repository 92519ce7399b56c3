package ca.gc.cra.brandkit.domain.brand;

import java.util.Locale;

/**
 * Advisory lifecycle status stored in {@code metadata.status}. An archived brand stays loadable and mutable.
 *
 * @since 0.1.0
 */
public enum BrandStatus {
  ACTIVE("active"),
  ARCHIVED("archived");

  private final String value;

  BrandStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * Parses a status value strictly.
   *
   * @param raw status name, case-insensitive
   * @return parsed status
   * @throws IllegalArgumentException if {@code raw} names no status
   */
  public static BrandStatus fromValue(String raw) {
    if (raw != null) {
      String normalized = raw.trim().toLowerCase(Locale.ROOT);
      for (BrandStatus status : values()) {
        if (status.value.equals(normalized)) {
          return status;
        }
      }
    }
    throw new IllegalArgumentException("Invalid brand status: " + raw + ". Must be one of active, archived");
  }

  /**
   * Parses a stored status, returning {@code fallback} for absent or unrecognised values.
   *
   * @param raw stored value; may be {@code null}
   * @param fallback value used when {@code raw} is not a known status
   * @return parsed status
   */
  public static BrandStatus parseOr(String raw, BrandStatus fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return fromValue(raw);
    } catch (IllegalArgumentException ex) {
      return fallback;
    }
  }
}
