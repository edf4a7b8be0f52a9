package ca.gc.cra.sconv.domain.unicode;

import ca.gc.cra.sconv.domain.buffer.ByteTextBuffer;
import java.nio.ByteOrder;
import java.util.Locale;
import java.util.Optional;

/**
 * Byte encodings of Unicode that the engine converts between without a backend.
 *
 * @since 0.1.0
 */
public enum UnicodeForm {
  UTF_8("UTF-8", 1, null),
  UTF_16BE("UTF-16BE", 2, ByteOrder.BIG_ENDIAN),
  UTF_16LE("UTF-16LE", 2, ByteOrder.LITTLE_ENDIAN);

  private static final byte[] UTF8_REPLACEMENT = {(byte) 0xEF, (byte) 0xBF, (byte) 0xBD};

  private final String charsetName;
  private final int unitWidth;
  private final ByteOrder order;

  UnicodeForm(String charsetName, int unitWidth, ByteOrder order) {
    this.charsetName = charsetName;
    this.unitWidth = unitWidth;
    this.order = order;
  }

  /**
   * Recognizes a charset name as one of the Unicode forms. Matching ignores case and an optional
   * hyphen after "UTF".
   *
   * @param name charset name; may be {@code null}
   * @return the form, or empty when the name is not a Unicode form handled here
   */
  public static Optional<UnicodeForm> forCharset(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String normalized = name.trim().toUpperCase(Locale.ROOT);
    return switch (normalized) {
      case "UTF-8", "UTF8" -> Optional.of(UTF_8);
      case "UTF-16BE", "UTF16BE" -> Optional.of(UTF_16BE);
      case "UTF-16LE", "UTF16LE" -> Optional.of(UTF_16LE);
      default -> Optional.empty();
    };
  }

  /** Canonical charset name, e.g. {@code UTF-16BE}. */
  public String charsetName() {
    return charsetName;
  }

  /** Size of one code unit in bytes. */
  public int unitWidth() {
    return unitWidth;
  }

  /**
   * Decodes one code point. UTF-8 input accepts CESU-8 surrogate pairs.
   *
   * @return packed result as produced by {@link UnicodeCodec}
   */
  public long decode(byte[] src, int offset, int limit) {
    if (this == UTF_8) {
      return UnicodeCodec.decodeCesu8(src, offset, limit);
    }
    return UnicodeCodec.decodeUtf16(src, offset, limit, order);
  }

  /**
   * Encodes one code point into a raw array.
   *
   * @return bytes written, or 0 when it does not fit
   */
  public int encode(int codePoint, byte[] dst, int offset, int remaining) {
    if (this == UTF_8) {
      return UnicodeCodec.encodeUtf8(codePoint, dst, offset, remaining);
    }
    return UnicodeCodec.encodeUtf16(codePoint, dst, offset, remaining, order);
  }

  /** Upper bound on the bytes one code point occupies in this form. */
  public int maxBytesPerCodePoint() {
    return 4;
  }

  /**
   * Appends one code point to {@code dst}, growing it as needed.
   *
   * @return {@code false} when the buffer could not grow
   */
  public boolean append(ByteTextBuffer dst, int codePoint) {
    if (!dst.ensure(dst.length() + maxBytesPerCodePoint() + unitWidth)) {
      return false;
    }
    int written = encode(codePoint, dst.array(), dst.length(), dst.capacity() - dst.length());
    dst.terminate(dst.length() + written, unitWidth);
    return true;
  }

  /** Appends U+FFFD in this form. */
  public boolean appendReplacement(ByteTextBuffer dst) {
    if (this == UTF_8) {
      return dst.append(UTF8_REPLACEMENT, 0, UTF8_REPLACEMENT.length);
    }
    return append(dst, UnicodeCodec.REPLACEMENT_CHARACTER);
  }

  /**
   * Length in bytes of a zero-terminated string in this form, bounded by {@code maxCount}.
   */
  public int boundedLength(byte[] src, int offset, int maxCount) {
    return unitWidth == 1
        ? ByteTextBuffer.boundedLength(src, offset, maxCount)
        : ByteTextBuffer.boundedLength16(src, offset, maxCount);
  }
}
