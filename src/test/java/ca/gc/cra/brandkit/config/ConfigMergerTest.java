package ca.gc.cra.brandkit.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void mergeCombinesNestedSectionsAndReplacesScalars() {
    Map<String, Object> base = new LinkedHashMap<>();
    base.put("colors", new LinkedHashMap<>(Map.of("primary", "#000000", "secondary", "#FFFFFF")));
    base.put("metadata", new LinkedHashMap<>(Map.of("version", "1.0.0")));
    Map<String, Object> overlay = Map.of("colors", Map.of("primary", "#0055AA"));

    Map<String, Object> merged = ConfigMerger.merge(base, overlay);

    @SuppressWarnings("unchecked")
    Map<String, Object> colors = (Map<String, Object>) merged.get("colors");
    assertEquals("#0055AA", colors.get("primary"));
    assertEquals("#FFFFFF", colors.get("secondary"));
    assertEquals(List.of("colors", "metadata"), new ArrayList<>(merged.keySet()));
  }

  @Test
  void mergeWithEmptyOrItselfIsIdentity() {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("brand", Map.of("name", "Acme", "community", Map.of("forum", "https://forum.example")));
    document.put("colors", Map.of("primary", "#0055AA"));
    document.put("compliance", Map.of("required_colors", List.of("primary")));
    document.put("is_protected", false);

    assertEquals(document, ConfigMerger.merge(document, Map.of()));
    assertEquals(document, ConfigMerger.merge(document, null));
    assertEquals(document, ConfigMerger.merge(document, document));
    assertEquals(document, ConfigMerger.merge(ConfigMerger.merge(document, document), document));
  }

  @Test
  void overlayValueWinsForNonMappingKeys() {
    Map<String, Object> base = Map.of("colors", Map.of("primary", "#000000"), "layout", "grid");
    Map<String, Object> overlay = Map.of("colors", "#FFFFFF", "layout", List.of("a", "b"));

    Map<String, Object> merged = ConfigMerger.merge(base, overlay);

    assertEquals("#FFFFFF", merged.get("colors"));
    assertEquals(List.of("a", "b"), merged.get("layout"));
  }

  @Test
  void mergeReplacesListsWhole() {
    Map<String, Object> base = Map.of("compliance", Map.of("required_colors", List.of("primary", "secondary")));
    Map<String, Object> overlay = Map.of("compliance", Map.of("required_colors", List.of("accent")));

    Map<String, Object> merged = ConfigMerger.merge(base, overlay);

    @SuppressWarnings("unchecked")
    Map<String, Object> compliance = (Map<String, Object>) merged.get("compliance");
    assertEquals(List.of("accent"), compliance.get("required_colors"));
  }

  @Test
  void mergeDoesNotMutateInputs() {
    Map<String, Object> colors = new LinkedHashMap<>(Map.of("primary", "#000000"));
    Map<String, Object> base = new LinkedHashMap<>(Map.of("colors", colors));

    Map<String, Object> merged = ConfigMerger.merge(base, Map.of("colors", Map.of("accent", "#FF0000")));
    @SuppressWarnings("unchecked")
    Map<String, Object> mergedColors = (Map<String, Object>) merged.get("colors");
    mergedColors.put("tertiary", "#00FF00");

    assertEquals(Map.of("primary", "#000000"), colors);
    assertEquals(1, base.size());
  }

  @Test
  void cliOverridesYamlAndWarns() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "asset",
        Optional.of(Map.of("maxAssetBytes", "2048")),
        Map.of("maxAssetBytes", "4096"),
        DefaultsForCommand.asFlatMap("asset"),
        warnings::add);

    assertEquals("4096", effective.get("maxAssetBytes"));
    assertEquals(List.of("CLI overrides YAML for key: maxAssetBytes"), warnings);
  }

  @Test
  void yamlOverridesDefaults() {
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "brand",
        Optional.of(Map.of("brandsRoot", "/srv/brands")),
        Map.of(),
        DefaultsForCommand.asFlatMap("brand"),
        null);

    assertEquals("/srv/brands", effective.get("brandsRoot"));
    assertEquals("none", effective.get("metricsExporter"));
  }

  @Test
  void rejectsUnknownExporter() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "brand", Optional.empty(), Map.of("metricsExporter", "prometheus"),
            DefaultsForCommand.asFlatMap("brand"), null));
    assertTrue(ex.getMessage().contains("metricsExporter"));
  }

  @Test
  void rejectsOutOfRangeAssetCeiling() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "asset", Optional.empty(), Map.of("maxAssetBytes", "0"),
            DefaultsForCommand.asFlatMap("asset"), null));
  }

  @Test
  void rejectsBlankBrandsRoot() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "brand", Optional.empty(), Map.of("brandsRoot", " "),
            DefaultsForCommand.asFlatMap("brand"), null));
  }
}
