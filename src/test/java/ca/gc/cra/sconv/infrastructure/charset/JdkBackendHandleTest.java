package ca.gc.cra.sconv.infrastructure.charset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.sconv.application.port.TranscodeResult;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class JdkBackendHandleTest {

  private static JdkBackendHandle utf8ToLatin1() {
    return new JdkBackendHandle(StandardCharsets.UTF_8, StandardCharsets.ISO_8859_1);
  }

  @Test
  void convertsAndCompletes() {
    JdkBackendHandle handle = utf8ToLatin1();
    byte[] in = "caf\u00e9".getBytes(StandardCharsets.UTF_8);
    byte[] out = new byte[16];

    TranscodeResult result = handle.transcode(in, 0, in.length, out, 0, out.length);

    assertEquals(new TranscodeResult(5, 4, TranscodeResult.Status.COMPLETED), result);
    assertEquals("caf\u00e9", new String(out, 0, 4, StandardCharsets.ISO_8859_1));
  }

  @Test
  void emptyInputCompletesImmediately() {
    TranscodeResult result = utf8ToLatin1().transcode(new byte[0], 0, 0, new byte[4], 0, 4);
    assertEquals(new TranscodeResult(0, 0, TranscodeResult.Status.COMPLETED), result);
  }

  @Test
  void outputFullCanBeResumed() {
    JdkBackendHandle handle = utf8ToLatin1();
    byte[] in = "hello".getBytes(StandardCharsets.US_ASCII);
    byte[] out = new byte[8];

    TranscodeResult first = handle.transcode(in, 0, in.length, out, 0, 2);
    assertEquals(TranscodeResult.Status.OUTPUT_FULL, first.status());
    assertEquals(2, first.produced());

    TranscodeResult second = handle.transcode(in, first.consumed(), in.length - first.consumed(),
        out, 2, 6);
    assertEquals(TranscodeResult.Status.COMPLETED, second.status());
    assertEquals("hello", new String(out, 0, 2 + second.produced(), StandardCharsets.US_ASCII));
  }

  @Test
  void malformedInputIsReportedAfterPrecedingText() {
    JdkBackendHandle handle = utf8ToLatin1();
    byte[] in = {'a', (byte) 0xFF, 'b'};
    byte[] out = new byte[8];

    TranscodeResult first = handle.transcode(in, 0, in.length, out, 0, out.length);
    assertEquals(new TranscodeResult(2, 1, TranscodeResult.Status.ILLEGAL_SEQUENCE), first);

    TranscodeResult second = handle.transcode(in, 2, 1, out, 1, out.length - 1);
    assertEquals(new TranscodeResult(1, 1, TranscodeResult.Status.COMPLETED), second);
    assertEquals("ab", new String(out, 0, 2, StandardCharsets.US_ASCII));
  }

  @Test
  void unmappableCharacterIsSkipped() {
    JdkBackendHandle handle = utf8ToLatin1();
    byte[] in = "a\u20acb".getBytes(StandardCharsets.UTF_8);
    byte[] out = new byte[8];

    TranscodeResult first = handle.transcode(in, 0, in.length, out, 0, out.length);
    assertEquals(TranscodeResult.Status.UNMAPPABLE, first.status());
    assertEquals(1, first.produced());

    TranscodeResult second = handle.transcode(in, first.consumed(), in.length - first.consumed(),
        out, 1, out.length - 1);
    assertEquals(TranscodeResult.Status.COMPLETED, second.status());
    assertEquals("ab", new String(out, 0, 1 + second.produced(), StandardCharsets.US_ASCII));
  }

  @Test
  void resetAllowsReuse() {
    JdkBackendHandle handle = utf8ToLatin1();
    byte[] out = new byte[4];
    handle.transcode(new byte[] {'x'}, 0, 1, out, 0, out.length);

    handle.reset();
    TranscodeResult again = handle.transcode(new byte[] {'y'}, 0, 1, out, 0, out.length);

    assertEquals(TranscodeResult.Status.COMPLETED, again.status());
    assertEquals('y', out[0]);
  }

  @Test
  void closedHandleRejectsWork() {
    JdkBackendHandle handle = utf8ToLatin1();
    handle.close();
    assertThrows(IllegalStateException.class,
        () -> handle.transcode(new byte[1], 0, 1, new byte[1], 0, 1));
  }
}
