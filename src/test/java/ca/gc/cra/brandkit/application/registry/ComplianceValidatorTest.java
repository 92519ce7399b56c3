package ca.gc.cra.brandkit.application.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.brandkit.domain.brand.Brand;
import ca.gc.cra.brandkit.domain.brand.BrandDocuments;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ComplianceValidatorTest {
  private final ComplianceValidator validator = new ComplianceValidator();

  @Test
  void noRulesMeansCompliant() {
    assertTrue(validator.validate(brand(Map.of("colors", Map.of("primary", "#000000")))).isEmpty());
  }

  @Test
  void reportsMissingColorsAndFonts() {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("colors", Map.of("primary", "#0055AA"));
    document.put("typography", Map.of("primary_font", "Inter", "secondary_font", "Lora"));
    document.put("compliance", Map.of(
        "required_colors", List.of("primary", "secondary"),
        "required_fonts", List.of("Lora", "Roboto")));

    assertEquals(
        List.of("Missing required color: secondary", "Missing required font: Roboto"),
        validator.validate(brand(document)));
  }

  @Test
  void reportsTooManyColorVariations() {
    Map<String, Object> document = Map.of(
        "colors", Map.of("a", "#1", "b", "#2", "c", "#3"),
        "compliance", Map.of("max_color_variations", 2));

    assertEquals(List.of("Too many color variations: 3 > 2"), validator.validate(brand(document)));
  }

  @Test
  void reportsUnparseableCeiling() {
    Map<String, Object> document = Map.of("compliance", Map.of("max_color_variations", "several"));

    assertEquals(List.of("Invalid max_color_variations: several"), validator.validate(brand(document)));
  }

  private static Brand brand(Map<String, Object> document) {
    return BrandDocuments.toBrand("acme", Path.of("/srv/brands/acme"), document, path -> true);
  }
}
