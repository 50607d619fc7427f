package ca.gc.cra.dataflow.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Helpers that bound user-supplied values before they reach log lines.
 * <p><strong>Why:</strong> Resource identifiers, grouping keys and error messages come from user functions and
 * may be arbitrarily long.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent stage workers.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  /** Default byte budget for values embedded in log lines. */
  public static final int DEFAULT_MAX_BYTES = 256;

  private Logs() {
    // Utility
  }

  /**
   * Truncates {@code value} to at most {@code maxBytes} UTF-8 bytes, appending a marker when shortened.
   *
   * @param value text to bound; {@code null} yields {@code "<null>"}
   * @param maxBytes positive byte budget
   * @return bounded text
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
   * Renders an arbitrary value for a log line within {@link #DEFAULT_MAX_BYTES}.
   *
   * @param value value to render; may be {@code null}
   * @return bounded text
   */
  public static String describe(Object value) {
    return truncate(value == null ? null : String.valueOf(value), DEFAULT_MAX_BYTES);
  }
}
