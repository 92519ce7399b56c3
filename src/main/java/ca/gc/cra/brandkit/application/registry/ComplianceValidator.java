package ca.gc.cra.brandkit.application.registry;

import ca.gc.cra.brandkit.domain.brand.Brand;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Advisory checks of a brand against the rules declared in its own {@code compliance} section.
 *
 * <p>Recognised keys: {@code required_colors} (list of color tokens), {@code required_fonts} (list of font
 * families matched against {@code typography.primary_font} and {@code secondary_font}) and
 * {@code max_color_variations} (integer ceiling on the number of colors).</p>
 */
public final class ComplianceValidator {
  static final String REQUIRED_COLORS = "required_colors";
  static final String REQUIRED_FONTS = "required_fonts";
  static final String MAX_COLOR_VARIATIONS = "max_color_variations";

  /**
   * Returns every compliance warning for {@code brand}. Never throws for rule violations.
   *
   * @param brand loaded brand
   * @return warnings, empty when compliant or when no rules are declared
   */
  public List<String> validate(Brand brand) {
    Objects.requireNonNull(brand, "brand");
    Map<String, Object> compliance = brand.compliance();
    List<String> warnings = new ArrayList<>();
    if (compliance.isEmpty()) {
      return warnings;
    }

    for (String color : stringList(compliance.get(REQUIRED_COLORS))) {
      if (!brand.colors().containsKey(color)) {
        warnings.add("Missing required color: " + color);
      }
    }

    List<String> availableFonts = new ArrayList<>();
    availableFonts.add(String.valueOf(brand.typography().getOrDefault("primary_font", "")));
    availableFonts.add(String.valueOf(brand.typography().getOrDefault("secondary_font", "")));
    for (String font : stringList(compliance.get(REQUIRED_FONTS))) {
      if (!availableFonts.contains(font)) {
        warnings.add("Missing required font: " + font);
      }
    }

    Object ceiling = compliance.get(MAX_COLOR_VARIATIONS);
    if (ceiling != null) {
      try {
        long max = ceiling instanceof Number n ? n.longValue() : Long.parseLong(ceiling.toString().trim());
        if (brand.colors().size() > max) {
          warnings.add("Too many color variations: " + brand.colors().size() + " > " + max);
        }
      } catch (NumberFormatException ex) {
        warnings.add("Invalid max_color_variations: " + ceiling);
      }
    }
    return warnings;
  }

  private static List<String> stringList(Object value) {
    if (value instanceof List<?> list) {
      List<String> out = new ArrayList<>(list.size());
      for (Object item : list) {
        if (item != null) {
          out.add(item.toString());
        }
      }
      return out;
    }
    if (value != null && !value.toString().isBlank()) {
      return List.of(value.toString());
    }
    return List.of();
  }
}
