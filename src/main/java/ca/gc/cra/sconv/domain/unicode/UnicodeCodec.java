package ca.gc.cra.sconv.domain.unicode;

import java.nio.ByteOrder;

/**
 * <strong>What:</strong> Single-code-point encoders and decoders for UTF-8, CESU-8, and UTF-16.
 * <p><strong>Why:</strong> Every conversion stage walks text one code point at a time and must
 * keep going after malformed input, so the decoders report how many bytes were bad instead of
 * throwing.</p>
 * <p><strong>Role:</strong> Pure domain utility.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Decode one sequence into a packed {@code long} holding the code point and the number of
 *   bytes consumed. The count is positive for a valid sequence, negative for that many invalid
 *   bytes (the code point is then U+FFFD), and zero only when no input remains.</li>
 *   <li>Encode one code point, writing nothing and returning 0 when it does not fit.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 * <p><strong>Performance:</strong> Table driven lead-byte dispatch; no allocation.</p>
 *
 * @since 0.1.0
 */
public final class UnicodeCodec {
  /** U+FFFD, emitted in place of anything that cannot be decoded. */
  public static final int REPLACEMENT_CHARACTER = 0xFFFD;
  /** Largest Unicode scalar value. */
  public static final int MAX_CODE_POINT = 0x10FFFF;

  /**
   * Sequence length implied by each UTF-8 lead byte; 0 marks a byte that cannot start a valid
   * sequence.
   */
  private static final byte[] UTF8_COUNT = buildCountTable();

  private UnicodeCodec() {
    // Utility
  }

  /** Extracts the code point from a packed decode result. */
  public static int codePoint(long decoded) {
    return (int) (decoded >>> 32);
  }

  /** Extracts the consumed byte count from a packed decode result. */
  public static int consumed(long decoded) {
    return (int) decoded;
  }

  static long pack(int codePoint, int consumed) {
    return ((long) codePoint << 32) | (consumed & 0xFFFF_FFFFL);
  }

  private static long invalid(int count) {
    return pack(REPLACEMENT_CHARACTER, -count);
  }

  /** Returns {@code true} for U+D800 through U+DFFF. */
  public static boolean isSurrogate(int codePoint) {
    return codePoint >= 0xD800 && codePoint <= 0xDFFF;
  }

  public static boolean isHighSurrogate(int codePoint) {
    return codePoint >= 0xD800 && codePoint <= 0xDBFF;
  }

  public static boolean isLowSurrogate(int codePoint) {
    return codePoint >= 0xDC00 && codePoint <= 0xDFFF;
  }

  /** Combines a UTF-16 surrogate pair into a supplementary code point. */
  public static int combineSurrogates(int high, int low) {
    return ((high - 0xD800) << 10) + (low - 0xDC00) + 0x10000;
  }

  /**
   * Decodes one UTF-8 sequence. Encoded surrogate halves are returned as their raw value so the
   * CESU-8 decoder can pair them.
   *
   * <p>Invalid lead bytes consume a length that depends on the byte: C0 and C1 claim two bytes,
   * F5 to F7 four, F8 to FB five, FC and FD six, anything else one; the claim is cut short at the
   * first byte that is not a continuation byte and at {@code limit}. Truncated, overlong, and
   * above-U+10FFFF sequences are invalid.</p>
   *
   * @param src input bytes
   * @param offset index of the first byte to decode
   * @param limit exclusive end of the readable range
   * @return packed result; see {@link #codePoint(long)} and {@link #consumed(long)}
   */
  public static long decodeUtf8(byte[] src, int offset, int limit) {
    int n = limit - offset;
    if (n <= 0) {
      return pack(0, 0);
    }
    int ch = src[offset] & 0xFF;
    int cnt = UTF8_COUNT[ch];

    if (cnt == 0) {
      if (ch == 0xC0 || ch == 0xC1) {
        cnt = 2;
      } else if (ch >= 0xF5 && ch <= 0xF7) {
        cnt = 4;
      } else if (ch >= 0xF8 && ch <= 0xFB) {
        cnt = 5;
      } else if (ch == 0xFC || ch == 0xFD) {
        cnt = 6;
      } else {
        cnt = 1;
      }
      return invalid(continuationRun(src, offset, Math.min(cnt, n)));
    }
    if (n < cnt) {
      return invalid(continuationRun(src, offset, n));
    }

    int wc;
    switch (cnt) {
      case 1:
        return pack(ch, 1);
      case 2:
        if (!isContinuation(src[offset + 1])) {
          return invalid(1);
        }
        return pack(((ch & 0x1F) << 6) | (src[offset + 1] & 0x3F), 2);
      case 3:
        if (!isContinuation(src[offset + 1])) {
          return invalid(1);
        }
        if (!isContinuation(src[offset + 2])) {
          return invalid(2);
        }
        wc = ((ch & 0x0F) << 12)
            | ((src[offset + 1] & 0x3F) << 6)
            | (src[offset + 2] & 0x3F);
        if (wc < 0x800) {
          return invalid(3);
        }
        return pack(wc, 3);
      default:
        if (!isContinuation(src[offset + 1])) {
          return invalid(1);
        }
        if (!isContinuation(src[offset + 2])) {
          return invalid(2);
        }
        if (!isContinuation(src[offset + 3])) {
          return invalid(3);
        }
        wc = ((ch & 0x07) << 18)
            | ((src[offset + 1] & 0x3F) << 12)
            | ((src[offset + 2] & 0x3F) << 6)
            | (src[offset + 3] & 0x3F);
        if (wc < 0x10000 || wc > MAX_CODE_POINT) {
          return invalid(4);
        }
        return pack(wc, 4);
    }
  }

  /**
   * Decodes one UTF-8 sequence, rejecting encoded surrogate halves with a consumed count of -3.
   */
  public static long decodeUtf8Strict(byte[] src, int offset, int limit) {
    long decoded = decodeUtf8(src, offset, limit);
    if (consumed(decoded) == 3 && isSurrogate(codePoint(decoded))) {
      return invalid(3);
    }
    return decoded;
  }

  /**
   * Decodes one UTF-8 or CESU-8 sequence. A three-byte high surrogate immediately followed by a
   * three-byte low surrogate yields the supplementary code point and consumes six bytes; any
   * unpaired half is invalid.
   */
  public static long decodeCesu8(byte[] src, int offset, int limit) {
    long decoded = decodeUtf8(src, offset, limit);
    int cnt = consumed(decoded);
    if (cnt != 3) {
      return decoded;
    }
    int wc = codePoint(decoded);
    if (isHighSurrogate(wc)) {
      long low = decodeUtf8(src, offset + 3, limit);
      if (consumed(low) != 3 || !isLowSurrogate(codePoint(low))) {
        return invalid(3);
      }
      return pack(combineSurrogates(wc, codePoint(low)), 6);
    }
    if (isLowSurrogate(wc)) {
      return invalid(3);
    }
    return decoded;
  }

  /**
   * Number of bytes {@link #encodeUtf8} writes for {@code codePoint}.
   */
  public static int utf8Length(int codePoint) {
    if (codePoint >= 0 && codePoint <= 0x7F) {
      return 1;
    }
    if (codePoint >= 0 && codePoint <= 0x7FF) {
      return 2;
    }
    if (codePoint >= 0 && codePoint <= 0xFFFF) {
      return 3;
    }
    if (codePoint > 0 && codePoint <= MAX_CODE_POINT) {
      return 4;
    }
    return 3;
  }

  /**
   * Encodes one code point as UTF-8. Values outside the Unicode range and surrogate halves are
   * written as U+FFFD.
   *
   * @param codePoint value to encode
   * @param dst destination array
   * @param offset first index to write
   * @param remaining bytes available from {@code offset}
   * @return bytes written, or 0 when the encoding does not fit
   */
  public static int encodeUtf8(int codePoint, byte[] dst, int offset, int remaining) {
    int uc = codePoint;
    if (uc < 0 || uc > MAX_CODE_POINT || isSurrogate(uc)) {
      uc = REPLACEMENT_CHARACTER;
    }
    if (uc <= 0x7F) {
      if (remaining < 1) {
        return 0;
      }
      dst[offset] = (byte) uc;
      return 1;
    }
    if (uc <= 0x7FF) {
      if (remaining < 2) {
        return 0;
      }
      dst[offset] = (byte) (0xC0 | ((uc >> 6) & 0x1F));
      dst[offset + 1] = (byte) (0x80 | (uc & 0x3F));
      return 2;
    }
    if (uc <= 0xFFFF) {
      if (remaining < 3) {
        return 0;
      }
      dst[offset] = (byte) (0xE0 | ((uc >> 12) & 0x0F));
      dst[offset + 1] = (byte) (0x80 | ((uc >> 6) & 0x3F));
      dst[offset + 2] = (byte) (0x80 | (uc & 0x3F));
      return 3;
    }
    if (remaining < 4) {
      return 0;
    }
    dst[offset] = (byte) (0xF0 | ((uc >> 18) & 0x07));
    dst[offset + 1] = (byte) (0x80 | ((uc >> 12) & 0x3F));
    dst[offset + 2] = (byte) (0x80 | ((uc >> 6) & 0x3F));
    dst[offset + 3] = (byte) (0x80 | (uc & 0x3F));
    return 4;
  }

  /**
   * Decodes one UTF-16 code unit or surrogate pair.
   *
   * <p>A single trailing byte yields -1. A high surrogate not followed by a low surrogate, and a
   * lone low surrogate, yield -2.</p>
   */
  public static long decodeUtf16(byte[] src, int offset, int limit, ByteOrder order) {
    int n = limit - offset;
    if (n <= 0) {
      return pack(0, 0);
    }
    if (n == 1) {
      return invalid(1);
    }
    int uc = read16(src, offset, order);
    if (isHighSurrogate(uc)) {
      int uc2 = n >= 4 ? read16(src, offset + 2, order) : 0;
      if (!isLowSurrogate(uc2)) {
        return invalid(2);
      }
      return pack(combineSurrogates(uc, uc2), 4);
    }
    if (isLowSurrogate(uc)) {
      return invalid(2);
    }
    return pack(uc, 2);
  }

  /**
   * Encodes one code point as UTF-16, splitting supplementary values into a surrogate pair.
   * Surrogate halves and out-of-range values are written as U+FFFD.
   *
   * @return bytes written (2 or 4), or 0 when the encoding does not fit
   */
  public static int encodeUtf16(int codePoint, byte[] dst, int offset, int remaining,
      ByteOrder order) {
    int uc = codePoint;
    if (uc < 0 || uc > MAX_CODE_POINT || isSurrogate(uc)) {
      uc = REPLACEMENT_CHARACTER;
    }
    if (uc > 0xFFFF) {
      if (remaining < 4) {
        return 0;
      }
      uc -= 0x10000;
      write16(dst, offset, ((uc >> 10) & 0x3FF) + 0xD800, order);
      write16(dst, offset + 2, (uc & 0x3FF) + 0xDC00, order);
      return 4;
    }
    if (remaining < 2) {
      return 0;
    }
    write16(dst, offset, uc, order);
    return 2;
  }

  static int read16(byte[] src, int offset, ByteOrder order) {
    int b0 = src[offset] & 0xFF;
    int b1 = src[offset + 1] & 0xFF;
    return order == ByteOrder.BIG_ENDIAN ? (b0 << 8) | b1 : (b1 << 8) | b0;
  }

  static void write16(byte[] dst, int offset, int unit, ByteOrder order) {
    if (order == ByteOrder.BIG_ENDIAN) {
      dst[offset] = (byte) (unit >> 8);
      dst[offset + 1] = (byte) unit;
    } else {
      dst[offset] = (byte) unit;
      dst[offset + 1] = (byte) (unit >> 8);
    }
  }

  private static boolean isContinuation(byte b) {
    return (b & 0xC0) == 0x80;
  }

  private static int continuationRun(byte[] src, int offset, int cnt) {
    for (int i = 1; i < cnt; i++) {
      if (!isContinuation(src[offset + i])) {
        return i;
      }
    }
    return cnt;
  }

  private static byte[] buildCountTable() {
    byte[] table = new byte[256];
    for (int b = 0x00; b <= 0x7F; b++) {
      table[b] = 1;
    }
    for (int b = 0xC2; b <= 0xDF; b++) {
      table[b] = 2;
    }
    for (int b = 0xE0; b <= 0xEF; b++) {
      table[b] = 3;
    }
    for (int b = 0xF0; b <= 0xF4; b++) {
      table[b] = 4;
    }
    return table;
  }
}
