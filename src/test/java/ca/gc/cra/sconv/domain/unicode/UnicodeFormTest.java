package ca.gc.cra.sconv.domain.unicode;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sconv.domain.buffer.ByteTextBuffer;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class UnicodeFormTest {

  @Test
  void recognizesNamesIgnoringCaseAndHyphen() {
    assertEquals(Optional.of(UnicodeForm.UTF_8), UnicodeForm.forCharset("utf8"));
    assertEquals(Optional.of(UnicodeForm.UTF_8), UnicodeForm.forCharset(" UTF-8 "));
    assertEquals(Optional.of(UnicodeForm.UTF_16LE), UnicodeForm.forCharset("Utf-16le"));
    assertEquals(Optional.of(UnicodeForm.UTF_16BE), UnicodeForm.forCharset("UTF16BE"));
  }

  @Test
  void otherNamesAreNotUnicodeForms() {
    assertTrue(UnicodeForm.forCharset("UTF-16").isEmpty());
    assertTrue(UnicodeForm.forCharset("ISO-8859-1").isEmpty());
    assertTrue(UnicodeForm.forCharset(null).isEmpty());
  }

  @Test
  void utf8DecodeAcceptsCesuPairs() {
    byte[] pair = {(byte) 0xED, (byte) 0xA0, (byte) 0xBD, (byte) 0xED, (byte) 0xB8, (byte) 0x80};
    long decoded = UnicodeForm.UTF_8.decode(pair, 0, pair.length);
    assertEquals(0x1F600, UnicodeCodec.codePoint(decoded));
    assertEquals(6, UnicodeCodec.consumed(decoded));
  }

  @Test
  void appendUsesTwoByteTerminatorForUtf16() {
    ByteTextBuffer buffer = new ByteTextBuffer();
    assertTrue(UnicodeForm.UTF_16LE.append(buffer, 'A'));
    assertTrue(UnicodeForm.UTF_16LE.appendReplacement(buffer));

    assertArrayEquals(new byte[] {'A', 0, (byte) 0xFD, (byte) 0xFF}, buffer.toByteArray());
    assertEquals(0, buffer.array()[4]);
    assertEquals(0, buffer.array()[5]);
  }

  @Test
  void utf8ReplacementIsThreeBytes() {
    ByteTextBuffer buffer = new ByteTextBuffer();
    assertTrue(UnicodeForm.UTF_8.appendReplacement(buffer));
    assertArrayEquals(new byte[] {(byte) 0xEF, (byte) 0xBF, (byte) 0xBD}, buffer.toByteArray());
  }

  @Test
  void boundedLengthFollowsUnitWidth() {
    byte[] text = {'a', 0, 0, 0, 'b', 0};
    assertEquals(1, UnicodeForm.UTF_8.boundedLength(text, 0, text.length));
    assertEquals(2, UnicodeForm.UTF_16LE.boundedLength(text, 0, text.length));
  }
}
