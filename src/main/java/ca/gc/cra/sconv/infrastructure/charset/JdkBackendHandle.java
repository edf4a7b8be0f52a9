package ca.gc.cra.sconv.infrastructure.charset;

import ca.gc.cra.sconv.application.port.BackendHandle;
import ca.gc.cra.sconv.application.port.TranscodeResult;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.util.Objects;

/**
 * Transcoder for one charset pair built from a {@code java.nio} decoder and encoder with a
 * {@code char} pivot between them.
 *
 * <p>Decoded text not yet encoded stays in the pivot across calls, so an {@code OUTPUT_FULL} call
 * can be resumed. Decoding errors are reported only after the text decoded before them has been
 * encoded.</p>
 *
 * @since 0.1.0
 */
final class JdkBackendHandle implements BackendHandle {
  private static final int PIVOT_CHARS = 1024;
  private static final ByteBuffer NO_BYTES = ByteBuffer.allocate(0);
  private static final CharBuffer NO_CHARS = CharBuffer.allocate(0);

  private final CharsetDecoder decoder;
  private final CharsetEncoder encoder;
  private final CharBuffer pivot = CharBuffer.allocate(PIVOT_CHARS);
  private TranscodeResult.Status pendingError;
  private boolean decoderFlushed;
  private boolean closed;

  JdkBackendHandle(Charset source, Charset target) {
    this.decoder = Objects.requireNonNull(source, "source").newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    this.encoder = Objects.requireNonNull(target, "target").newEncoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    pivot.limit(0);
  }

  @Override
  public TranscodeResult transcode(byte[] in, int inOffset, int inLength, byte[] out,
      int outOffset, int outLength) {
    if (closed) {
      throw new IllegalStateException("backend handle is closed");
    }
    ByteBuffer src = ByteBuffer.wrap(in, inOffset, inLength);
    ByteBuffer dst = ByteBuffer.wrap(out, outOffset, outLength);
    TranscodeResult.Status status = run(src, dst);
    return new TranscodeResult(src.position() - inOffset, dst.position() - outOffset, status);
  }

  private TranscodeResult.Status run(ByteBuffer src, ByteBuffer dst) {
    while (true) {
      if (pivot.hasRemaining()) {
        CoderResult encoded = encoder.encode(pivot, dst, true);
        if (encoded.isOverflow()) {
          return TranscodeResult.Status.OUTPUT_FULL;
        }
        if (encoded.isError()) {
          pivot.position(pivot.position() + encoded.length());
          return encoded.isUnmappable()
              ? TranscodeResult.Status.UNMAPPABLE : TranscodeResult.Status.ILLEGAL_SEQUENCE;
        }
        if (pivot.hasRemaining()) {
          // Underflow with chars left: an unpaired surrogate the encoder will not consume.
          pivot.position(pivot.limit());
          return TranscodeResult.Status.ILLEGAL_SEQUENCE;
        }
      }
      if (pendingError != null) {
        TranscodeResult.Status status = pendingError;
        pendingError = null;
        return status;
      }
      if (src.hasRemaining()) {
        pivot.clear();
        CoderResult decoded = decoder.decode(src, pivot, true);
        pivot.flip();
        if (decoded.isError()) {
          src.position(src.position() + decoded.length());
          pendingError = decoded.isUnmappable()
              ? TranscodeResult.Status.UNMAPPABLE : TranscodeResult.Status.ILLEGAL_SEQUENCE;
        }
        continue;
      }
      if (!decoderFlushed) {
        pivot.clear();
        // A coder must see end of input before it may be flushed.
        CoderResult flushed = decoder.decode(NO_BYTES, pivot, true);
        if (flushed.isUnderflow()) {
          flushed = decoder.flush(pivot);
        }
        pivot.flip();
        decoderFlushed = flushed.isUnderflow();
        continue;
      }
      if (encoder.encode(NO_CHARS, dst, true).isOverflow()) {
        return TranscodeResult.Status.OUTPUT_FULL;
      }
      return encoder.flush(dst).isOverflow()
          ? TranscodeResult.Status.OUTPUT_FULL : TranscodeResult.Status.COMPLETED;
    }
  }

  @Override
  public void reset() {
    decoder.reset();
    encoder.reset();
    pivot.clear();
    pivot.limit(0);
    pendingError = null;
    decoderFlushed = false;
  }

  @Override
  public void close() {
    closed = true;
  }
}
