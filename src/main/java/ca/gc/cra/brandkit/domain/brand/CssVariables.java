package ca.gc.cra.brandkit.domain.brand;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders brand colors, typography and layout as CSS custom properties.
 *
 * <p>Token names have underscores replaced by hyphens, e.g. {@code text_muted} becomes
 * {@code --color-text-muted}.</p>
 */
public final class CssVariables {
  private static final String DEFAULT_FALLBACK = "sans-serif";

  private CssVariables() {
    // Utility
  }

  /**
   * Builds a {@code :root} block.
   *
   * @param colors color tokens
   * @param typography typography section; {@code primary_font}, {@code secondary_font}, {@code fallback},
   *     {@code sizes} and {@code weights} are used
   * @param layout layout tokens
   * @return CSS text, one declaration per line
   */
  public static String generate(
      Map<String, String> colors, Map<String, Object> typography, Map<String, String> layout) {
    List<String> lines = new ArrayList<>();
    lines.add(":root {");
    colors.forEach((token, value) -> lines.add("  --color-" + cssName(token) + ": " + value + ";"));

    Object fallbackValue = typography.get("fallback");
    String fallback = fallbackValue == null ? DEFAULT_FALLBACK : fallbackValue.toString();
    Object primary = typography.get("primary_font");
    if (primary != null) {
      lines.add("  --font-primary: '" + primary + "', " + fallback + ";");
    }
    Object secondary = typography.get("secondary_font");
    if (secondary != null) {
      lines.add("  --font-secondary: '" + secondary + "', " + fallback + ";");
    }
    if (typography.get("sizes") instanceof Map<?, ?> sizes) {
      sizes.forEach((token, value) -> lines.add("  --font-size-" + cssName(token) + ": " + value + ";"));
    }
    if (typography.get("weights") instanceof Map<?, ?> weights) {
      weights.forEach((token, value) -> lines.add("  --font-weight-" + cssName(token) + ": " + value + ";"));
    }

    layout.forEach((token, value) -> lines.add("  --layout-" + cssName(token) + ": " + value + ";"));
    lines.add("}");
    return String.join("\n", lines);
  }

  private static String cssName(Object token) {
    return String.valueOf(token).replace('_', '-');
  }
}
