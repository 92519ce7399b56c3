package ca.gc.cra.brandkit.application.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.brandkit.domain.brand.ProtectionEvent;
import ca.gc.cra.brandkit.domain.brand.ProtectionLevel;
import ca.gc.cra.brandkit.domain.error.ProtectionViolationException;
import ca.gc.cra.brandkit.infrastructure.events.InMemoryProtectionEventEmitter;
import ca.gc.cra.brandkit.infrastructure.persistence.YamlConfigStore;
import ca.gc.cra.brandkit.testutil.MutableClock;
import ca.gc.cra.brandkit.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProtectionGuardTest {
  @TempDir Path tempDir;

  private final YamlConfigStore store = new YamlConfigStore();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final InMemoryProtectionEventEmitter events = new InMemoryProtectionEventEmitter();
  private BrandLayout layout;
  private ProtectionGuard guard;

  @BeforeEach
  void setUp() {
    layout = new BrandLayout(tempDir, store.fileExtension());
    guard = new ProtectionGuard(layout, store, events, metrics, MutableClock.at("2024-03-01T10:15:30Z"));
  }

  @Test
  void absentBrandIsAllowed() {
    assertEquals(Optional.empty(), guard.check("acme", "update"));
  }

  @Test
  void unprotectedBrandIsAllowed() throws IOException {
    write("acme", Map.of("brand", Map.of("name", "Acme"), "is_protected", false));
    assertEquals(Optional.empty(), guard.check("acme", "update"));
    assertTrue(events.snapshot().isEmpty());
  }

  @Test
  void strictProtectionBlocksWithDetails() throws IOException {
    write("acme", protectedDocument("strict", "admin", "2024-01-01T00:00:00Z", "Production brand"));

    ProtectionViolationException ex = assertThrows(ProtectionViolationException.class,
        () -> guard.check("acme", "delete"));

    assertEquals("Cannot delete protected brand 'acme': Production brand. Protected by: admin on "
        + "2024-01-01T00:00:00Z. Use --force to override (admin only).", ex.getMessage());
    assertEquals("delete", ex.operation());
    assertEquals(1, metrics.count("brand.protection.blocked"));
  }

  @Test
  void strictProtectionWithoutAttributionUsesPlaceholders() throws IOException {
    write("acme", protectedDocument("strict", null, null, "Frozen"));

    ProtectionViolationException ex = assertThrows(ProtectionViolationException.class,
        () -> guard.check("acme", "update"));

    assertTrue(ex.getMessage().contains("Protected by: system on unknown date"));
  }

  @Test
  void warnProtectionEmitsEventAndReturnsWarning() throws IOException {
    write("acme", protectedDocument("warn", "design-lead", null, "Launch freeze"));

    Optional<String> warning = guard.check("acme", "update");

    assertEquals(Optional.of("Brand 'acme' is protected (warn): Launch freeze. Protected by: design-lead"), warning);
    ProtectionEvent event = events.snapshot().get(0);
    assertEquals(ProtectionLevel.WARN, event.level());
    assertEquals("update", event.operation());
    assertEquals(Instant.parse("2024-03-01T10:15:30Z"), event.timestamp());
    assertEquals(0, metrics.count("brand.protection.blocked"));
  }

  @Test
  void unreadableDocumentFailsClosed() throws IOException {
    Files.createDirectories(layout.directory("acme"));
    Files.writeString(layout.document("acme"), "brand: [broken\n");

    ProtectionViolationException ex = assertThrows(ProtectionViolationException.class,
        () -> guard.check("acme", "update"));

    assertTrue(ex.getMessage().startsWith("Unable to verify protection status for brand 'acme'"));
    assertEquals(1, metrics.count("brand.protection.blocked"));
  }

  @Test
  void unknownLevelFailsClosed() throws IOException {
    write("acme", protectedDocument("extreme", "admin", null, ""));
    assertThrows(ProtectionViolationException.class, () -> guard.check("acme", "update"));
  }

  private void write(String name, Map<String, Object> document) throws IOException {
    Files.createDirectories(layout.directory(name));
    store.save(layout.document(name), document);
  }

  private static Map<String, Object> protectedDocument(String level, String by, String at, String reason) {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("brand", Map.of("name", "Acme"));
    document.put("is_protected", true);
    document.put("protection_level", level);
    document.put("protected_by", by);
    document.put("protected_at", at);
    document.put("protection_reason", reason);
    return document;
  }
}
