package ca.gc.cra.sconv.application.conversion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sconv.application.port.BackendHandle;
import ca.gc.cra.sconv.application.port.TranscodeResult;
import ca.gc.cra.sconv.domain.buffer.ByteTextBuffer;
import ca.gc.cra.sconv.domain.conversion.ConversionIssue;
import ca.gc.cra.sconv.domain.conversion.ConversionResult;
import ca.gc.cra.sconv.domain.unicode.UnicodeForm;
import ca.gc.cra.sconv.infrastructure.charset.JdkCharsetBackend;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import org.junit.jupiter.api.Test;

class BackendTranscodeStageTest {

  /** Copies input but reports output full until the destination has room for all of it. */
  private static final class StingyHandle implements BackendHandle {
    int resets;
    int calls;

    @Override
    public TranscodeResult transcode(byte[] in, int inOffset, int inLength, byte[] out,
        int outOffset, int outLength) {
      calls++;
      int n = Math.min(inLength, Math.min(outLength, 8));
      System.arraycopy(in, inOffset, out, outOffset, n);
      return new TranscodeResult(n, n, n == inLength
          ? TranscodeResult.Status.COMPLETED : TranscodeResult.Status.OUTPUT_FULL);
    }

    @Override
    public void reset() {
      resets++;
    }

    @Override
    public void close() {}
  }

  /** Replays scripted steps, one per call. */
  private static final class ScriptedHandle implements BackendHandle {
    private final Deque<TranscodeResult> steps = new ArrayDeque<>();
    private final Deque<byte[]> outputs = new ArrayDeque<>();

    ScriptedHandle then(int consumed, byte[] produce, TranscodeResult.Status status) {
      steps.add(new TranscodeResult(consumed, produce.length, status));
      outputs.add(produce);
      return this;
    }

    @Override
    public TranscodeResult transcode(byte[] in, int inOffset, int inLength, byte[] out,
        int outOffset, int outLength) {
      byte[] produce = outputs.poll();
      System.arraycopy(produce, 0, out, outOffset, produce.length);
      return steps.poll();
    }

    @Override
    public void reset() {}

    @Override
    public void close() {}
  }

  @Test
  void resumesAfterOutputFull() throws Exception {
    StingyHandle handle = new StingyHandle();
    BackendTranscodeStage stage = new BackendTranscodeStage(handle, null);
    byte[] src = "twenty-one characters".getBytes(StandardCharsets.US_ASCII);
    ByteTextBuffer dst = new ByteTextBuffer();

    ConversionResult result = stage.apply(src, 0, src.length, dst);

    assertTrue(result.isComplete());
    assertEquals("twenty-one characters", dst.toString(StandardCharsets.US_ASCII));
    assertEquals(1, handle.resets);
    assertTrue(handle.calls >= 3);
  }

  @Test
  void errorsInsertReplacementsInTargetForm() throws Exception {
    ScriptedHandle handle = new ScriptedHandle()
        .then(2, new byte[] {'a', 0}, TranscodeResult.Status.ILLEGAL_SEQUENCE)
        .then(1, new byte[0], TranscodeResult.Status.UNMAPPABLE)
        .then(1, new byte[] {'b', 0}, TranscodeResult.Status.COMPLETED);
    BackendTranscodeStage stage = new BackendTranscodeStage(handle, UnicodeForm.UTF_16LE);
    ByteTextBuffer dst = new ByteTextBuffer();

    ConversionResult result = stage.apply(new byte[4], 0, 4, dst);

    assertTrue(result.has(ConversionIssue.MALFORMED_INPUT));
    assertTrue(result.has(ConversionIssue.UNREPRESENTABLE));
    assertEquals("a\ufffd\ufffdb", dst.toString(StandardCharsets.UTF_16LE));
    assertEquals(0, dst.array()[dst.length() + 1]);
  }

  @Test
  void runsOverJdkHandles() throws Exception {
    BackendHandle handle = new JdkCharsetBackend().open("ISO-8859-1", "UTF-16BE").orElseThrow();
    BackendTranscodeStage stage = new BackendTranscodeStage(handle, UnicodeForm.UTF_16BE);
    byte[] src = {'c', 'a', 'f', (byte) 0xE9};
    ByteTextBuffer dst = new ByteTextBuffer();

    assertTrue(stage.apply(src, 0, src.length, dst).isComplete());
    assertEquals("caf\u00e9", dst.toString(StandardCharsets.UTF_16BE));

    dst.clear();
    assertTrue(stage.apply(src, 0, 1, dst).isComplete());
    assertEquals("c", dst.toString(StandardCharsets.UTF_16BE));
    handle.close();
  }
}
