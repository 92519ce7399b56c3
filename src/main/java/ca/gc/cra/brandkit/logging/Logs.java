package ca.gc.cra.brandkit.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Logging hygiene helpers for operator-supplied values and brand-scoped MDC.
 * <p><strong>Why:</strong> Filenames, protection reasons and document values arrive from operators and must
 * not flood log lines; mutating operations tag their log lines with the brand being changed.
 * <p><strong>Thread-safety:</strong> Stateless; MDC scopes are bound to the calling thread.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} so truncation mid-codepoint never throws.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** MDC key holding the brand name for the duration of a mutating operation. */
  public static final String MDC_BRAND = "brand";

  /** Default byte budget for operator-supplied strings in log lines. */
  public static final int DEFAULT_MAX_BYTES = 256;

  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String fallback = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return fallback + "... (truncated)";
    }
  }

  /**
   * Truncates with {@link #DEFAULT_MAX_BYTES}.
   *
   * @param value operator-supplied value
   * @return bounded value safe to log
   */
  public static String truncate(String value) {
    return truncate(value, DEFAULT_MAX_BYTES);
  }

  /**
   * Binds {@code brandName} to the {@link #MDC_BRAND} key until the returned scope is closed.
   *
   * @param brandName brand being mutated
   * @return closeable that restores the previous MDC value
   */
  public static MdcScope brandScope(String brandName) {
    String previous = MDC.get(MDC_BRAND);
    MDC.put(MDC_BRAND, brandName);
    return new MdcScope(previous);
  }

  /** Restores the previous {@link #MDC_BRAND} value on close. */
  public static final class MdcScope implements AutoCloseable {
    private final String previous;

    private MdcScope(String previous) {
      this.previous = previous;
    }

    @Override
    public void close() {
      if (previous == null) {
        MDC.remove(MDC_BRAND);
      } else {
        MDC.put(MDC_BRAND, previous);
      }
    }
  }
}
