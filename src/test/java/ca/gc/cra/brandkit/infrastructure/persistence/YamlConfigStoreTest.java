package ca.gc.cra.brandkit.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.brandkit.application.port.MalformedDocumentException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigStoreTest {
  @TempDir Path tempDir;

  private final YamlConfigStore store = new YamlConfigStore();

  @Test
  void saveThenLoadPreservesKeyOrderAndNesting() throws IOException {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("metadata", Map.of("version", "1.0.0"));
    document.put("brand", Map.of("name", "Acme"));
    document.put("colors", new LinkedHashMap<>(Map.of("primary", "#0055AA")));
    document.put("assets", Map.of("fonts", List.of("assets/fonts/a.woff")));
    Path file = tempDir.resolve("brand_config.yaml");

    store.save(file, document);
    Map<String, Object> loaded = store.load(file);

    assertEquals(List.of("metadata", "brand", "colors", "assets"), new ArrayList<>(loaded.keySet()));
    assertEquals(Map.of("primary", "#0055AA"), loaded.get("colors"));
    assertEquals(Map.of("fonts", List.of("assets/fonts/a.woff")), loaded.get("assets"));
    assertTrue(store.exists(file));
  }

  @Test
  void unquotedTimestampsLoadAsStrings() throws IOException {
    Path file = tempDir.resolve("dated.yaml");
    Files.writeString(file, "metadata:\n  created_at: 2024-03-01T10:15:30Z\n");

    @SuppressWarnings("unchecked")
    Map<String, Object> metadata = (Map<String, Object>) store.load(file).get("metadata");

    assertEquals("2024-03-01T10:15:30Z", metadata.get("created_at"));
  }

  @Test
  void missingFileSurfacesNoSuchFile() {
    assertThrows(NoSuchFileException.class, () -> store.load(tempDir.resolve("absent.yaml")));
  }

  @Test
  void emptyDocumentIsMalformed() throws IOException {
    Path file = tempDir.resolve("empty.yaml");
    Files.writeString(file, "");
    MalformedDocumentException ex = assertThrows(MalformedDocumentException.class, () -> store.load(file));
    assertTrue(ex.getMessage().startsWith("Empty document"));
  }

  @Test
  void scalarRootIsMalformed() throws IOException {
    Path file = tempDir.resolve("scalar.yaml");
    Files.writeString(file, "just a string\n");
    MalformedDocumentException ex = assertThrows(MalformedDocumentException.class, () -> store.load(file));
    assertTrue(ex.getMessage().startsWith("Document root must be a mapping"));
  }

  @Test
  void invalidYamlIsMalformed() throws IOException {
    Path file = tempDir.resolve("broken.yaml");
    Files.writeString(file, "brand: [unclosed\n");
    assertThrows(MalformedDocumentException.class, () -> store.load(file));
  }

  @Test
  void saveReplacesExistingFile() throws IOException {
    Path file = tempDir.resolve("brand_config.yaml");
    store.save(file, Map.of("brand", Map.of("name", "Old")));
    store.save(file, Map.of("brand", Map.of("name", "New")));

    assertEquals(Map.of("name", "New"), store.load(file).get("brand"));
    try (var entries = Files.list(tempDir)) {
      assertEquals(1, entries.count());
    }
  }
}
