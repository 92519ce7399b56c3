package ca.gc.cra.brandkit.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TemplateCliTest {
  private static final String DOCUMENT =
      "document={brand: {tagline: Starter}, colors: {primary: '#222222'}, typography: {primary_font: Inter}}";

  @TempDir Path tempDir;

  private CliTestSupport cli;

  @BeforeEach
  void setUp() {
    cli = new CliTestSupport(tempDir);
  }

  @AfterEach
  void tearDown() {
    CliTestSupport.close();
  }

  @Test
  void createShowAndList() {
    assertEquals(ExitCode.SUCCESS, TemplateCli.run(cli.args("create", "name=corporate", DOCUMENT,
        "description=Corporate starter", "category=business", "features=print, web")));
    assertTrue(cli.output().contains("Created template 'corporate'"));

    cli.reset();
    assertEquals(ExitCode.SUCCESS, TemplateCli.run(cli.args("show", "name=corporate")));
    assertTrue(cli.output().contains("Corporate starter"));
    assertTrue(cli.output().contains("print, web"));

    cli.reset();
    assertEquals(ExitCode.SUCCESS, TemplateCli.run(cli.args("list", "category=business")));
    assertTrue(cli.output().contains("corporate  1.0.0  [business]"));
    assertTrue(cli.output().contains("Categories: business"));
  }

  @Test
  void createRequiresDocument() {
    assertEquals(ExitCode.INVALID_ARGS, TemplateCli.run(cli.args("create", "name=corporate")));
  }

  @Test
  void duplicateTemplateIsConflict() {
    TemplateCli.run(cli.args("create", "name=corporate", DOCUMENT));
    assertEquals(ExitCode.CONFLICT, TemplateCli.run(cli.args("create", "name=corporate", DOCUMENT)));
  }

  @Test
  void brandCanStartFromTemplate() {
    TemplateCli.run(cli.args("create", "name=corporate", DOCUMENT));

    cli.reset();
    assertEquals(ExitCode.SUCCESS, BrandCli.run(cli.args("create", "name=acme", "template=corporate")));
    assertTrue(cli.output().contains("corporate"));

    cli.reset();
    BrandCli.run(cli.args("show", "name=acme"));
    assertTrue(cli.output().contains("primary = #222222"));
  }

  @Test
  void brandFromUnknownTemplateIsNotFound() {
    assertEquals(ExitCode.NOT_FOUND, BrandCli.run(cli.args("create", "name=acme", "template=ghost")));
    assertFalse(Files.exists(cli.brandsRoot().resolve("acme")));
  }

  @Test
  void deleteNeedsConfirmation() {
    TemplateCli.run(cli.args("create", "name=corporate", DOCUMENT));

    assertEquals(ExitCode.INVALID_ARGS, TemplateCli.run(cli.args("delete", "name=corporate")));
    assertEquals(ExitCode.SUCCESS, TemplateCli.run(cli.args("delete", "name=corporate", "--confirm")));
    assertEquals(ExitCode.NOT_FOUND, TemplateCli.run(cli.args("show", "name=corporate")));
  }

  @Test
  void updateBumpsVersion() {
    TemplateCli.run(cli.args("create", "name=corporate", DOCUMENT));

    cli.reset();
    assertEquals(ExitCode.SUCCESS,
        TemplateCli.run(cli.args("update", "name=corporate", "updates={colors: {primary: '#333333'}}")));
    assertTrue(cli.output().contains("Updated template 'corporate'"));
    assertTrue(cli.output().contains("1.1.0"));
  }
}
