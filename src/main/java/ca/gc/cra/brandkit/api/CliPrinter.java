package ca.gc.cra.brandkit.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output for command results and usage text.
 *
 * <p>Results go to stdout through a UTF-8 writer on the native descriptor; diagnostics go through SLF4J, so
 * piping a command's output never mixes the two.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout using the shared CLI writer.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints zero or more lines to stdout using the shared CLI writer.
   *
   * @param lines lines to emit
   */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
  }

  /**
   * Prints a labelled field, padded so consecutive fields line up.
   *
   * @param label field label
   * @param value field value; {@code null} prints {@code -}
   */
  public static void field(String label, Object value) {
    writer().printf(" %-18s: %s%n", label, value == null ? "-" : value);
  }

  /**
   * Prints each item as an indented bullet under a heading, or nothing when {@code items} is empty.
   *
   * @param heading line printed before the items
   * @param items items to print
   */
  public static void bullets(String heading, Iterable<?> items) {
    if (items == null || !items.iterator().hasNext()) {
      return;
    }
    PrintWriter writer = writer();
    writer.println(heading);
    for (Object item : items) {
      writer.println("  - " + item);
    }
  }

  /**
   * Overrides the CLI writer for tests.
   *
   * @param writer writer to use during the test
   */
  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  /**
   * Clears any test writer override.
   */
  static void clearTestWriter() {
    override = null;
  }

  /**
   * Resolves the active writer, preferring a test override.
   *
   * @return writer used for CLI output
   */
  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
