package ca.gc.cra.brandkit.application.asset;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.brandkit.domain.asset.AssetRecord;
import ca.gc.cra.brandkit.domain.error.EntityNotFoundException;
import ca.gc.cra.brandkit.domain.error.RegistryValidationException;
import ca.gc.cra.brandkit.infrastructure.persistence.JsonAssetIndexAdapter;
import ca.gc.cra.brandkit.testutil.RegistryFixture;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AssetRegistryTest {
  private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', 1, 2, 3, 4};

  @TempDir Path tempDir;

  private RegistryFixture fixture;
  private AssetRegistry assets;
  private Path brandDir;

  @BeforeEach
  void setUp() {
    fixture = new RegistryFixture(tempDir);
    fixture.brands().create("acme", RegistryFixture.sampleDocument("Acme"));
    assets = fixture.assets();
    brandDir = fixture.brandsRoot.resolve("acme");
  }

  @AfterEach
  void tearDown() {
    fixture.close();
  }

  @Test
  void uploadStoresFileByTypeAndIndexesIt() throws IOException {
    UploadResult result = assets.upload("acme", encode(PNG), "logo.png", "logo", Map.of("alt", "Acme logo"));

    assertEquals("logo.png", result.filename());
    assertEquals("assets/images/logo.png", result.relativePath());
    assertEquals(PNG.length, result.fileSize());
    assertEquals(64, result.checksum().length());
    assertEquals("2024-03-01T10:15:30Z", result.uploadedAt());
    assertArrayEquals(PNG, Files.readAllBytes(brandDir.resolve("assets/images/logo.png")));

    Map<String, AssetRecord> index = new JsonAssetIndexAdapter().read(brandDir.resolve("asset_registry.json"));
    AssetRecord record = index.get("logo.png");
    assertEquals("logo", record.assetType());
    assertEquals(result.checksum(), record.checksum());
    assertEquals("Acme logo", record.metadata().get("alt"));
    assertEquals(1, fixture.metrics.count("asset.upload.success"));
    assertEquals(List.of((long) PNG.length), fixture.metrics.observed("asset.upload.bytes"));
  }

  @Test
  void uploadRoutesTypesToTheirDirectories() {
    assertEquals("assets/fonts/body.woff2",
        assets.upload("acme", encode(new byte[] {1}), "body.woff2", "font", null).relativePath());
    assertEquals("assets/site.css",
        assets.upload("acme", encode("body{}".getBytes(StandardCharsets.UTF_8)), "site.css", "css", null)
            .relativePath());
    assertEquals("assets/misc/bg.jpg",
        assets.upload("acme", encode(new byte[] {2}), "bg.jpg", "background", null).relativePath());
    assertEquals("templates/letter.html",
        assets.upload("acme", encode(new byte[] {3}), "letter.html", "template", null).relativePath());
  }

  @Test
  void duplicateFilenameGetsCounterSuffix() {
    assets.upload("acme", encode(PNG), "logo.png", "logo", null);

    UploadResult second = assets.upload("acme", encode(new byte[] {7}), "logo.png", "logo", null);

    assertEquals("logo_1.png", second.filename());
    assertTrue(Files.exists(brandDir.resolve("assets/images/logo.png")));
    assertTrue(Files.exists(brandDir.resolve("assets/images/logo_1.png")));
  }

  @Test
  void oversizedUploadRejected() {
    byte[] fifteenMiB = new byte[15 * 1024 * 1024];

    RegistryValidationException ex = assertThrows(RegistryValidationException.class,
        () -> assets.upload("acme", encode(fifteenMiB), "huge.png", "image", null));

    assertTrue(ex.getMessage().startsWith("File too large: 15728640 bytes > 10485760"));
    assertEquals(1, fixture.metrics.count("asset.upload.rejected"));
    assertFalse(Files.exists(brandDir.resolve("assets/images/huge.png")));
  }

  @Test
  void contentChecksRejectBadInput() {
    assertEquals("Invalid asset data: must be non-empty base64 string",
        assertThrows(RegistryValidationException.class,
            () -> assets.upload("acme", "", "a.png", "logo", null)).getMessage());
    assertTrue(assertThrows(RegistryValidationException.class,
        () -> assets.upload("acme", "not base64!!", "a.png", "logo", null)).getMessage()
        .startsWith("Invalid base64 data"));
    assertEquals("File type not allowed: .exe",
        assertThrows(RegistryValidationException.class,
            () -> assets.upload("acme", encode(PNG), "tool.exe", "misc", null)).getMessage());
    assertEquals("Invalid filename: must not contain path separators",
        assertThrows(RegistryValidationException.class,
            () -> assets.upload("acme", encode(PNG), "../logo.png", "logo", null)).getMessage());
    assertThrows(RegistryValidationException.class,
        () -> assets.upload("acme", encode(PNG), "a".repeat(252) + ".png", "logo", null));
    assertEquals(5, fixture.metrics.count("asset.upload.rejected"));
  }

  @Test
  void unknownBrandRejected() {
    assertThrows(EntityNotFoundException.class, () -> assets.upload("ghost", encode(PNG), "a.png", "logo", null));
  }

  @Test
  void unlistedTypeIsStoredUnderMiscAndIndexedAsDeclared() throws IOException {
    UploadResult result = assets.upload("acme", encode(PNG), "fav.png", "Favicon", null);

    assertEquals("assets/misc/fav.png", result.relativePath());
    assertEquals("favicon", result.assetType());
    Path brandDir = fixture.brandsRoot.resolve("acme");
    assertTrue(Files.isRegularFile(brandDir.resolve("assets/misc/fav.png")));
    Map<String, AssetRecord> index = new JsonAssetIndexAdapter().read(brandDir.resolve("asset_registry.json"));
    assertEquals("favicon", index.get("fav.png").assetType());
  }

  @Test
  void blankTypeFallsBackToMisc() {
    UploadResult result = assets.upload("acme", encode(PNG), "plain.png", " ", null);

    assertEquals("assets/misc/plain.png", result.relativePath());
    assertEquals("misc", result.assetType());
  }

  @Test
  void validateReportsChecksumAgainstIndex() throws IOException {
    UploadResult uploaded = assets.upload("acme", encode(PNG), "logo.png", "logo", null);

    AssetValidationReport report = assets.validate("acme", "assets/images/logo.png");

    assertEquals(AssetValidationReport.Status.VALID, report.status());
    assertEquals(uploaded.checksum(), report.checksum());
    assertEquals(Boolean.TRUE, report.indexChecksumMatches());

    Files.write(brandDir.resolve("assets/images/logo.png"), new byte[] {0});
    assertEquals(Boolean.FALSE, assets.validate("acme", "assets/images/logo.png").indexChecksumMatches());
  }

  @Test
  void validateFlagsMissingAndDisallowedFiles() throws IOException {
    AssetValidationReport missing = assets.validate("acme", "assets/images/absent.png");
    assertEquals(AssetValidationReport.Status.MISSING, missing.status());
    assertEquals(-1, missing.fileSize());
    assertEquals("Asset file not found", missing.message());

    Files.writeString(brandDir.resolve("assets/notes.txt"), "hello");
    AssetValidationReport text = assets.validate("acme", "assets/notes.txt");
    assertEquals(AssetValidationReport.Status.INVALID_TYPE, text.status());
    assertFalse(text.allowedType());
    assertNull(text.indexChecksumMatches());
  }

  @Test
  void validateRejectsEscapingPaths() {
    assertThrows(RegistryValidationException.class, () -> assets.validate("acme", "../other/brand_config.yaml"));
    assertThrows(RegistryValidationException.class, () -> assets.validate("acme", "/etc/passwd"));
  }

  @Test
  void listInfersTypesAndFilters() {
    assets.upload("acme", encode(PNG), "logo.png", "logo", null);
    assets.upload("acme", encode(new byte[] {1, 2}), "a.woff", "font", null);
    assets.upload("acme", encode(new byte[] {3}), "site.css", "css", null);

    AssetListing all = assets.list("acme", null);
    assertEquals(List.of("a.woff", "logo.png", "site.css"),
        all.assets().stream().map(AssetSummary::filename).toList());
    assertEquals(PNG.length + 3, all.totalSize());
    assertEquals(List.of("font", "image", "css"),
        all.assets().stream().map(AssetSummary::assetType).toList());

    AssetListing fonts = assets.list("acme", "font");
    assertEquals(1, fonts.assets().size());
    assertEquals("images/logo.png", all.assets().get(1).relativePath());
  }

  @Test
  void deleteBacksUpAndUnindexes() throws IOException {
    assets.upload("acme", encode(PNG), "logo.png", "logo", null);

    AssetDeletionResult result = assets.delete("acme", "assets/images/logo.png", true);

    assertEquals(PNG.length, result.fileSizeDeleted());
    assertEquals("backups/logo_20240301_101530.png", result.backupPath());
    assertTrue(Files.exists(brandDir.resolve(result.backupPath())));
    assertFalse(Files.exists(brandDir.resolve("assets/images/logo.png")));
    assertFalse(new JsonAssetIndexAdapter().read(brandDir.resolve("asset_registry.json")).containsKey("logo.png"));
    assertEquals(1, fixture.metrics.count("asset.delete.success"));
  }

  @Test
  void deleteMissingAssetFails() {
    RegistryValidationException ex = assertThrows(RegistryValidationException.class,
        () -> assets.delete("acme", "assets/images/ghost.png", false));
    assertEquals("Asset not found: assets/images/ghost.png", ex.getMessage());
  }

  @Test
  void cleanupRemovesOnlyUnreferencedFiles() throws IOException {
    Files.write(brandDir.resolve("assets/images/a.png"), new byte[] {1});
    Files.write(brandDir.resolve("assets/fonts/b.woff"), new byte[] {2, 2});
    Files.writeString(brandDir.resolve("assets/orphan.css"), "x{}");
    Files.createDirectories(brandDir.resolve("assets/misc/empty"));
    fixture.brands().update("acme", Map.of("assets", Map.of(
        "logo", "assets/images/a.png",
        "fonts", List.of("assets/fonts/b.woff"))));

    CleanupSummary summary = assets.cleanup("acme", true);

    assertEquals(3, summary.filesProcessed());
    assertEquals(1, summary.filesRemoved());
    assertEquals(3, summary.spaceReclaimed());
    assertEquals(2, summary.emptyDirsRemoved());
    assertTrue(summary.warnings().isEmpty());
    assertFalse(Files.exists(brandDir.resolve("assets/orphan.css")));
    assertTrue(Files.exists(brandDir.resolve("assets/images/a.png")));
    assertTrue(Files.exists(brandDir.resolve("assets/fonts/b.woff")));
    assertEquals(1, fixture.metrics.count("asset.cleanup.removed"));
  }

  @Test
  void cleanupWithoutRemovalOnlyPrunesEmptyDirectories() throws IOException {
    Files.writeString(brandDir.resolve("assets/orphan.css"), "x{}");

    CleanupSummary summary = assets.cleanup("acme", false);

    assertEquals(0, summary.filesRemoved());
    assertTrue(Files.exists(brandDir.resolve("assets/orphan.css")));
    assertEquals(2, summary.emptyDirsRemoved());
  }

  @Test
  void cleanupKeepsFilesWhenBrandDocumentIsUnreadable() throws IOException {
    Files.writeString(brandDir.resolve("assets/orphan.css"), "x{}");
    Files.writeString(brandDir.resolve("brand_config.yaml"), "colors: [broken\n");

    CleanupSummary summary = assets.cleanup("acme", true);

    assertEquals(0, summary.filesRemoved());
    assertTrue(Files.exists(brandDir.resolve("assets/orphan.css")));
    assertEquals(1, summary.warnings().size());
    assertTrue(summary.warnings().get(0).startsWith("Brand configuration unreadable; no files removed"));
  }

  @Test
  void cleanupWithoutAssetsDirectoryWarns() throws IOException {
    fixture.brands().create("bare", RegistryFixture.sampleDocument("Bare"));
    Path assetsDir = fixture.brandsRoot.resolve("bare/assets");
    Files.delete(assetsDir.resolve("images"));
    Files.delete(assetsDir.resolve("fonts"));
    Files.delete(assetsDir);

    CleanupSummary summary = assets.cleanup("bare", true);

    assertEquals(List.of("No assets directory to clean"), summary.warnings());
  }

  private static String encode(byte[] content) {
    return Base64.getEncoder().encodeToString(content);
  }
}
