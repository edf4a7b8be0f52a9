package ca.gc.cra.sconv.application.port;

import ca.gc.cra.sconv.domain.buffer.ByteTextBuffer;
import ca.gc.cra.sconv.domain.buffer.WideTextBuffer;
import ca.gc.cra.sconv.domain.conversion.BufferExhaustedException;
import ca.gc.cra.sconv.domain.conversion.ConversionResult;

/**
 * Converts between system-charset bytes and wide ({@code char}) text.
 *
 * <p>Unconvertible input never aborts: malformed bytes decode to U+FFFD and characters the system
 * charset cannot represent encode as {@code '?'}, each reported in the result.</p>
 *
 * @since 0.1.0
 */
public interface NativeWideCodec {

  /** Name of the system charset this codec encodes to. */
  String charsetName();

  /**
   * Decodes system bytes and appends them to {@code dst}.
   *
   * @throws BufferExhaustedException when {@code dst} cannot grow
   */
  ConversionResult decode(byte[] src, int offset, int length, WideTextBuffer dst)
      throws BufferExhaustedException;

  /**
   * Encodes wide text and appends it to {@code dst}.
   *
   * @throws BufferExhaustedException when {@code dst} cannot grow
   */
  ConversionResult encode(char[] src, int offset, int length, ByteTextBuffer dst)
      throws BufferExhaustedException;

  /**
   * Encodes a single char, the unit of legacy wide text.
   *
   * @throws BufferExhaustedException when {@code dst} cannot grow
   */
  default ConversionResult encodeChar(char value, ByteTextBuffer dst)
      throws BufferExhaustedException {
    return encode(new char[] {value}, 0, 1, dst);
  }

  /** Returns {@code true} when the bytes form valid text in the system charset. */
  boolean isWellFormed(byte[] src, int offset, int length);
}
