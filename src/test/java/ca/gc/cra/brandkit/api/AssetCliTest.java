package ca.gc.cra.brandkit.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AssetCliTest {
  private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', 1, 2, 3, 4};

  @TempDir Path tempDir;

  private CliTestSupport cli;

  @BeforeEach
  void setUp() {
    cli = new CliTestSupport(tempDir);
    assertEquals(ExitCode.SUCCESS, BrandCli.run(cli.args("create", "name=acme")));
    cli.reset();
  }

  @AfterEach
  void tearDown() {
    CliTestSupport.close();
  }

  @Test
  void uploadsFromFileUsingItsName() throws Exception {
    Path source = Files.write(tempDir.resolve("logo.png"), PNG);

    ExitCode code = AssetCli.run(cli.args("upload", "brand=acme", "type=logo", "file=" + source));

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(cli.output().contains("Uploaded 'logo.png' to brand 'acme'"));
    assertTrue(cli.output().contains("assets/images/logo.png"));
    Path stored = cli.brandsRoot().resolve("acme/assets/images/logo.png");
    assertEquals(PNG.length, Files.size(stored));
  }

  @Test
  void uploadsInlineBase64Data() {
    String data = Base64.getEncoder().encodeToString("body{}".getBytes());

    ExitCode code = AssetCli.run(cli.args("upload", "brand=acme", "type=css", "data=" + data, "filename=site.css"));

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(Files.exists(cli.brandsRoot().resolve("acme/assets/site.css")));
  }

  @Test
  void uploadNeedsExactlyOneSource() throws Exception {
    Path source = Files.write(tempDir.resolve("logo.png"), PNG);
    String data = Base64.getEncoder().encodeToString(PNG);

    assertEquals(ExitCode.INVALID_ARGS, AssetCli.run(cli.args("upload", "brand=acme", "type=logo")));
    assertEquals(ExitCode.INVALID_ARGS, AssetCli.run(cli.args("upload", "brand=acme", "type=logo",
        "file=" + source, "data=" + data, "filename=logo.png")));
    assertEquals(ExitCode.INVALID_ARGS, AssetCli.run(cli.args("upload", "brand=acme", "type=logo", "data=" + data)));
    assertEquals(ExitCode.INVALID_ARGS,
        AssetCli.run(cli.args("upload", "brand=acme", "type=logo", "file=" + tempDir.resolve("absent.png"))));
  }

  @Test
  void uploadToUnknownBrandIsNotFound() throws Exception {
    Path source = Files.write(tempDir.resolve("logo.png"), PNG);
    assertEquals(ExitCode.NOT_FOUND, AssetCli.run(cli.args("upload", "brand=ghost", "type=logo", "file=" + source)));
  }

  @Test
  void validateReportsMissingAsNotFound() throws Exception {
    Path source = Files.write(tempDir.resolve("logo.png"), PNG);
    AssetCli.run(cli.args("upload", "brand=acme", "type=logo", "file=" + source));

    assertEquals(ExitCode.SUCCESS, AssetCli.run(cli.args("validate", "brand=acme", "path=assets/images/logo.png")));
    assertEquals(ExitCode.NOT_FOUND, AssetCli.run(cli.args("validate", "brand=acme", "path=assets/images/gone.png")));
  }

  @Test
  void listThenDeleteWithoutBackup() throws Exception {
    Path source = Files.write(tempDir.resolve("logo.png"), PNG);
    AssetCli.run(cli.args("upload", "brand=acme", "type=logo", "file=" + source));

    cli.reset();
    assertEquals(ExitCode.SUCCESS, AssetCli.run(cli.args("list", "brand=acme")));
    assertTrue(cli.output().contains("images/logo.png"));
    assertTrue(cli.output().contains("1 assets, 8 bytes"));

    assertEquals(ExitCode.SUCCESS,
        AssetCli.run(cli.args("delete", "brand=acme", "path=assets/images/logo.png", "--no-backup")));
    assertFalse(Files.exists(cli.brandsRoot().resolve("acme/assets/images/logo.png")));
    assertFalse(Files.exists(cli.brandsRoot().resolve("acme/backups/logo.png")));

    cli.reset();
    AssetCli.run(cli.args("list", "brand=acme"));
    assertTrue(cli.output().contains("No assets found for brand 'acme'"));
  }

  @Test
  void cleanupReportsSummary() {
    assertEquals(ExitCode.SUCCESS, AssetCli.run(cli.args("cleanup", "brand=acme")));
    assertTrue(cli.output().contains("Cleaned assets for brand 'acme'"));
  }
}
