package ca.gc.cra.brandkit.domain.brand;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CssVariablesTest {

  @Test
  void rendersColorsFontsAndLayout() {
    Map<String, String> colors = new LinkedHashMap<>();
    colors.put("primary", "#0055AA");
    colors.put("text_muted", "#666666");
    Map<String, Object> typography = new LinkedHashMap<>();
    typography.put("primary_font", "Inter");
    typography.put("fallback", "Arial, sans-serif");
    typography.put("sizes", Map.of("heading_1", "32px"));

    String css = CssVariables.generate(colors, typography, Map.of("max_width", "1200px"));

    assertTrue(css.startsWith(":root {\n"));
    assertTrue(css.contains("  --color-primary: #0055AA;"));
    assertTrue(css.contains("  --color-text-muted: #666666;"));
    assertTrue(css.contains("  --font-primary: 'Inter', Arial, sans-serif;"));
    assertTrue(css.contains("  --font-size-heading-1: 32px;"));
    assertTrue(css.contains("  --layout-max-width: 1200px;"));
    assertTrue(css.endsWith("}"));
  }

  @Test
  void emptySectionsRenderEmptyBlock() {
    assertEquals(":root {\n}", CssVariables.generate(Map.of(), Map.of(), Map.of()));
  }

  @Test
  void defaultFallbackIsSansSerif() {
    String css = CssVariables.generate(Map.of(), Map.of("secondary_font", "Lora"), Map.of());
    assertTrue(css.contains("--font-secondary: 'Lora', sans-serif;"));
  }
}
