package ca.gc.cra.sconv.domain.unicode;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.fail;

import java.nio.ByteOrder;
import org.junit.jupiter.api.Test;

class UnicodeCodecTest {

  private static byte[] bytes(int... values) {
    byte[] out = new byte[values.length];
    for (int i = 0; i < values.length; i++) {
      out[i] = (byte) values[i];
    }
    return out;
  }

  private static void assertDecoded(int codePoint, int consumed, long decoded) {
    assertEquals(codePoint, UnicodeCodec.codePoint(decoded), "code point");
    assertEquals(consumed, UnicodeCodec.consumed(decoded), "consumed");
  }

  @Test
  void decodesValidUtf8Sequences() {
    assertDecoded('A', 1, UnicodeCodec.decodeUtf8(bytes('A'), 0, 1));
    assertDecoded(0xE9, 2, UnicodeCodec.decodeUtf8(bytes(0xC3, 0xA9), 0, 2));
    assertDecoded(0x20AC, 3, UnicodeCodec.decodeUtf8(bytes(0xE2, 0x82, 0xAC), 0, 3));
    assertDecoded(0x1F600, 4, UnicodeCodec.decodeUtf8(bytes(0xF0, 0x9F, 0x98, 0x80), 0, 4));
  }

  @Test
  void emptyInputConsumesNothing() {
    assertDecoded(0, 0, UnicodeCodec.decodeUtf8(new byte[4], 2, 2));
  }

  @Test
  void invalidLeadBytesClaimTheirContinuationRun() {
    assertDecoded(0xFFFD, -2, UnicodeCodec.decodeUtf8(bytes(0xC0, 0x80), 0, 2));
    assertDecoded(0xFFFD, -1, UnicodeCodec.decodeUtf8(bytes(0xFF, 'a'), 0, 2));
    assertDecoded(0xFFFD, -1, UnicodeCodec.decodeUtf8(bytes(0x80), 0, 1));
    assertDecoded(0xFFFD, -3, UnicodeCodec.decodeUtf8(bytes(0xF8, 0x80, 0x80, 'a'), 0, 4));
  }

  @Test
  void truncatedAndBrokenSequencesAreInvalid() {
    assertDecoded(0xFFFD, -2, UnicodeCodec.decodeUtf8(bytes(0xE2, 0x82), 0, 2));
    assertDecoded(0xFFFD, -1, UnicodeCodec.decodeUtf8(bytes(0xE2, 'A', 'B'), 0, 3));
    assertDecoded(0xFFFD, -2, UnicodeCodec.decodeUtf8(bytes(0xE2, 0x82, 'B'), 0, 3));
  }

  @Test
  void overlongAndOutOfRangeSequencesAreInvalid() {
    assertDecoded(0xFFFD, -3, UnicodeCodec.decodeUtf8(bytes(0xE0, 0x80, 0x80), 0, 3));
    assertDecoded(0xFFFD, -4, UnicodeCodec.decodeUtf8(bytes(0xF4, 0x90, 0x80, 0x80), 0, 4));
  }

  @Test
  void strictDecoderRejectsEncodedSurrogates() {
    byte[] highSurrogate = bytes(0xED, 0xA0, 0x80);
    assertDecoded(0xD800, 3, UnicodeCodec.decodeUtf8(highSurrogate, 0, 3));
    assertDecoded(0xFFFD, -3, UnicodeCodec.decodeUtf8Strict(highSurrogate, 0, 3));
  }

  @Test
  void cesu8PairsSurrogateHalves() {
    byte[] pair = bytes(0xED, 0xA0, 0xBD, 0xED, 0xB8, 0x80);
    assertDecoded(0x1F600, 6, UnicodeCodec.decodeCesu8(pair, 0, pair.length));
  }

  @Test
  void cesu8RejectsUnpairedHalves() {
    assertDecoded(0xFFFD, -3, UnicodeCodec.decodeCesu8(bytes(0xED, 0xA0, 0xBD, 'A'), 0, 4));
    assertDecoded(0xFFFD, -3, UnicodeCodec.decodeCesu8(bytes(0xED, 0xB8, 0x80), 0, 3));
  }

  @Test
  void encodesUtf8AndReplacesInvalidScalars() {
    byte[] out = new byte[4];
    assertEquals(3, UnicodeCodec.encodeUtf8(0x20AC, out, 0, 4));
    assertArrayEquals(bytes(0xE2, 0x82, 0xAC, 0), out);

    assertEquals(3, UnicodeCodec.encodeUtf8(0xDC00, out, 0, 4));
    assertArrayEquals(bytes(0xEF, 0xBF, 0xBD), java.util.Arrays.copyOf(out, 3));

    assertEquals(3, UnicodeCodec.encodeUtf8(0x110000, out, 0, 4));
    assertEquals(3, UnicodeCodec.utf8Length(-5));
  }

  @Test
  void encodeWritesNothingWhenSpaceIsShort() {
    byte[] out = new byte[4];
    assertEquals(0, UnicodeCodec.encodeUtf8(0x1F600, out, 1, 3));
    assertArrayEquals(new byte[4], out);
    assertEquals(0, UnicodeCodec.encodeUtf16(0x1F600, out, 0, 3, ByteOrder.BIG_ENDIAN));
  }

  @Test
  void decodesUtf16InBothByteOrders() {
    assertDecoded(0x1F600, 4,
        UnicodeCodec.decodeUtf16(bytes(0x3D, 0xD8, 0x00, 0xDE), 0, 4, ByteOrder.LITTLE_ENDIAN));
    assertDecoded(0x1F600, 4,
        UnicodeCodec.decodeUtf16(bytes(0xD8, 0x3D, 0xDE, 0x00), 0, 4, ByteOrder.BIG_ENDIAN));
    assertDecoded(0xE9, 2, UnicodeCodec.decodeUtf16(bytes(0x00, 0xE9), 0, 2, ByteOrder.BIG_ENDIAN));
  }

  @Test
  void utf16InvalidInput() {
    assertDecoded(0xFFFD, -1, UnicodeCodec.decodeUtf16(bytes(0x41), 0, 1, ByteOrder.BIG_ENDIAN));
    assertDecoded(0xFFFD, -2,
        UnicodeCodec.decodeUtf16(bytes(0xDC, 0x00), 0, 2, ByteOrder.BIG_ENDIAN));
    assertDecoded(0xFFFD, -2,
        UnicodeCodec.decodeUtf16(bytes(0xD8, 0x3D, 0x00, 0x41), 0, 4, ByteOrder.BIG_ENDIAN));
  }

  @Test
  void encodesSupplementaryUtf16AsSurrogatePair() {
    byte[] out = new byte[4];
    assertEquals(4, UnicodeCodec.encodeUtf16(0x1F600, out, 0, 4, ByteOrder.BIG_ENDIAN));
    assertArrayEquals(bytes(0xD8, 0x3D, 0xDE, 0x00), out);

    assertEquals(2, UnicodeCodec.encodeUtf16(0xD800, out, 0, 4, ByteOrder.LITTLE_ENDIAN));
    assertEquals((byte) 0xFD, out[0]);
    assertEquals((byte) 0xFF, out[1]);
  }

  @Test
  void everyScalarRoundTripsThroughUtf8() {
    byte[] buf = new byte[4];
    for (int cp = 0; cp <= UnicodeCodec.MAX_CODE_POINT; cp++) {
      if (UnicodeCodec.isSurrogate(cp)) {
        continue;
      }
      int n = UnicodeCodec.encodeUtf8(cp, buf, 0, buf.length);
      assertEquals(UnicodeCodec.utf8Length(cp), n);
      long strict = UnicodeCodec.decodeUtf8Strict(buf, 0, n);
      long cesu = UnicodeCodec.decodeCesu8(buf, 0, n);
      if (UnicodeCodec.codePoint(strict) != cp || UnicodeCodec.consumed(strict) != n
          || UnicodeCodec.codePoint(cesu) != cp || UnicodeCodec.consumed(cesu) != n) {
        fail("UTF-8 round trip failed at U+" + Integer.toHexString(cp));
      }
    }
  }

  @Test
  void everySupplementaryScalarRoundTripsThroughCesu8() {
    byte[] buf = new byte[6];
    for (int cp = 0x10000; cp <= UnicodeCodec.MAX_CODE_POINT; cp++) {
      int high = Character.highSurrogate(cp);
      int low = Character.lowSurrogate(cp);
      // A surrogate half encodes as the three-byte form of its value.
      buf[0] = (byte) (0xE0 | (high >> 12));
      buf[1] = (byte) (0x80 | ((high >> 6) & 0x3F));
      buf[2] = (byte) (0x80 | (high & 0x3F));
      buf[3] = (byte) (0xE0 | (low >> 12));
      buf[4] = (byte) (0x80 | ((low >> 6) & 0x3F));
      buf[5] = (byte) (0x80 | (low & 0x3F));
      long decoded = UnicodeCodec.decodeCesu8(buf, 0, 6);
      if (UnicodeCodec.codePoint(decoded) != cp || UnicodeCodec.consumed(decoded) != 6) {
        fail("CESU-8 round trip failed at U+" + Integer.toHexString(cp));
      }
    }
  }

  @Test
  void everyScalarRoundTripsThroughUtf16() {
    byte[] buf = new byte[4];
    for (ByteOrder order : new ByteOrder[] {ByteOrder.BIG_ENDIAN, ByteOrder.LITTLE_ENDIAN}) {
      for (int cp = 0; cp <= UnicodeCodec.MAX_CODE_POINT; cp++) {
        if (UnicodeCodec.isSurrogate(cp)) {
          continue;
        }
        int n = UnicodeCodec.encodeUtf16(cp, buf, 0, buf.length, order);
        assertEquals(cp > 0xFFFF ? 4 : 2, n);
        long decoded = UnicodeCodec.decodeUtf16(buf, 0, n, order);
        if (UnicodeCodec.codePoint(decoded) != cp || UnicodeCodec.consumed(decoded) != n) {
          fail(order + " round trip failed at U+" + Integer.toHexString(cp));
        }
      }
    }
  }
}
