package ca.gc.cra.brandkit.domain.asset;

import java.util.Locale;

/**
 * Declared asset types and the brand subdirectory each is stored under.
 *
 * @since 0.1.0
 */
public enum AssetType {
  LOGO("logo", "assets/images"),
  IMAGE("image", "assets/images"),
  ICON("icon", "assets/misc"),
  BACKGROUND("background", "assets/misc"),
  FONT("font", "assets/fonts"),
  CSS("css", "assets"),
  TEMPLATE("template", "templates"),
  MISC("misc", "assets/misc");

  private final String value;
  private final String directory;

  AssetType(String value, String directory) {
    this.value = value;
    this.directory = directory;
  }

  /**
   * Returns the stored name of this type.
   *
   * @return lower-case type name
   */
  public String value() {
    return value;
  }

  /**
   * Returns the brand-relative directory uploads of this type are written to.
   *
   * @return relative directory using {@code /} separators
   */
  public String directory() {
    return directory;
  }

  /**
   * Parses a declared type. Types outside this list are stored with {@link #MISC}.
   *
   * @param raw type name, case-insensitive; may be {@code null}
   * @return parsed type, {@link #MISC} when {@code raw} is blank or unlisted
   */
  public static AssetType fromValue(String raw) {
    String normalized = normalize(raw);
    for (AssetType type : values()) {
      if (type.value.equals(normalized)) {
        return type;
      }
    }
    return MISC;
  }

  /**
   * Returns the type name recorded for an upload: the declared name, lower-cased, or {@code misc} when blank.
   *
   * @param raw declared type name; may be {@code null}
   * @return recorded type name
   */
  public static String declaredName(String raw) {
    String normalized = normalize(raw);
    return normalized.isEmpty() ? MISC.value : normalized;
  }

  private static String normalize(String raw) {
    return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
  }
}
