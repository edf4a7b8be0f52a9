package ca.gc.cra.sconv.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

/**
 * <strong>What:</strong> Logging hygiene helpers for untrusted text.
 * <p><strong>Why:</strong> Charset names and converted names come from archive headers and may be huge,
 * malformed, or full of control characters.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Truncate strings to a byte budget while preserving readability.</li>
 *   <li>Render raw bytes as a bounded hex preview.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** Byte budget used by {@link #truncate(String)}. */
  public static final int DEFAULT_MAX_BYTES = 64;

  private static final String NULL_PLACEHOLDER = "<null>";
  private static final HexFormat HEX = HexFormat.of().withUpperCase();

  private Logs() {
    // Utility
  }

  /** Truncates to {@link #DEFAULT_MAX_BYTES} and escapes control characters. */
  public static String truncate(String value) {
    return escapeControls(truncate(value, DEFAULT_MAX_BYTES));
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
      return buffer + "? (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String utf16Safe = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return utf16Safe + "? (truncated)";
    }
  }

  /**
   * Hex preview of at most {@code maxBytes} bytes, e.g. {@code 61 62 FF ... (12 bytes)}.
   *
   * @param bytes source array; {@code null} results in {@code "<null>"}
   * @param offset first byte
   * @param length number of bytes available
   * @param maxBytes maximum number of bytes rendered; must be positive
   */
  public static String hexPreview(byte[] bytes, int offset, int length, int maxBytes) {
    if (bytes == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    int shown = Math.min(length, maxBytes);
    StringBuilder sb = new StringBuilder(shown * 3 + 16);
    for (int i = 0; i < shown; i++) {
      if (i > 0) {
        sb.append(' ');
      }
      sb.append(HEX.toHexDigits(bytes[offset + i]));
    }
    if (shown < length) {
      sb.append(" ... (").append(length).append(" bytes)");
    }
    return sb.toString();
  }

  private static String escapeControls(String value) {
    StringBuilder sb = null;
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (Character.isISOControl(c)) {
        if (sb == null) {
          sb = new StringBuilder(value.length() + 8).append(value, 0, i);
        }
        sb.append(String.format("\\u%04X", (int) c));
      } else if (sb != null) {
        sb.append(c);
      }
    }
    return sb == null ? value : sb.toString();
  }
}
