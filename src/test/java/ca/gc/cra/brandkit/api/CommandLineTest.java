package ca.gc.cra.brandkit.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CommandLineTest {
  @Test
  void splitsWordsArgumentsAndFlags() {
    CommandLine line = CommandLine.parse(new String[] {
        "brand", "update", "name=acme", " by = ops ", "--FORCE", "--no-backup"});

    assertEquals(List.of("brand", "update"), line.words());
    assertEquals("brand", line.head());
    assertEquals(List.of("name", "by"), List.copyOf(line.arguments().keySet()));
    assertEquals("ops", line.arguments().get("by"));
    assertEquals(Set.of("--force", "--no-backup"), line.flags());
    assertTrue(line.hasFlag(" --No-Backup "));
    assertFalse(line.hasFlag("--confirm"));
    assertFalse(line.help());
    assertFalse(line.verbose());
  }

  @Test
  void inlineDocumentsKeepTheirEqualsSigns() {
    Map<String, String> args = CommandLine.parse(new String[] {
        "updates={colors: {primary: '#000'}}", "reason=a=b"}).arguments();
    assertEquals("{colors: {primary: '#000'}}", args.get("updates"));
    assertEquals("a=b", args.get("reason"));
  }

  @Test
  void dashedArgumentIsTheSameAsPlainOne() {
    CommandLine line = CommandLine.parse(new String[] {"--config=brandkit.yaml"});
    assertEquals("brandkit.yaml", line.arguments().get("config"));
    assertTrue(line.flags().isEmpty());

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CommandLine.parse(new String[] {"--config=a.yaml", "config=b.yaml"}));
    assertEquals("argument config given more than once", ex.getMessage());
  }

  @Test
  void helpAndVerboseAliasesAreNotFlags() {
    CommandLine line = CommandLine.parse(new String[] {"-h", "-v"});
    assertTrue(line.help());
    assertTrue(line.verbose());
    assertTrue(line.flags().isEmpty());
    assertTrue(CommandLine.parse(new String[] {"help"}).help());
    assertTrue(CommandLine.parse(new String[] {"--debug"}).verbose());
  }

  @Test
  void shiftDropsOnlyTheCommandWord() {
    CommandLine line = CommandLine.parse(new String[] {"asset", "--verbose", "cleanup", "brand=acme", "--remove-unused"});
    CommandLine action = line.shift();

    assertEquals(List.of("cleanup"), action.words());
    assertEquals("acme", action.arguments().get("brand"));
    assertTrue(action.hasFlag("--remove-unused"));
    assertTrue(action.verbose());
    assertNull(action.shift().head());
  }

  @Test
  void argumentsCopyIsIndependent() {
    CommandLine line = CommandLine.parse(new String[] {"name=acme"});
    line.arguments().remove("name");
    assertEquals("acme", line.arguments().get("name"));
  }

  @Test
  void rejectsMalformedArguments() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CommandLine.parse(new String[] {"name="}));
    assertTrue(ex.getMessage().contains("key=value"));
    assertThrows(IllegalArgumentException.class, () -> CommandLine.parse(new String[] {"=acme"}));
    assertThrows(IllegalArgumentException.class, () -> CommandLine.parse(new String[] {"na me=a"}));
    assertThrows(IllegalArgumentException.class, () -> CommandLine.parse(new String[] {"name=a\u0007b"}));
    assertThrows(IllegalArgumentException.class, () -> CommandLine.parse(new String[] {"name=a\0b"}));
  }

  @Test
  void emptyInputHasNothing() {
    CommandLine line = CommandLine.parse(new String[] {null, "  "});
    assertNull(line.head());
    assertTrue(line.arguments().isEmpty());
    assertFalse(line.hasFlag(null));
    assertFalse(CommandLine.parse(null).help());
  }
}
