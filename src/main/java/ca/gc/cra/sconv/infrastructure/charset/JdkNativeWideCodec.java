package ca.gc.cra.sconv.infrastructure.charset;

import ca.gc.cra.sconv.application.port.NativeWideCodec;
import ca.gc.cra.sconv.domain.buffer.ByteTextBuffer;
import ca.gc.cra.sconv.domain.buffer.WideTextBuffer;
import ca.gc.cra.sconv.domain.conversion.BufferExhaustedException;
import ca.gc.cra.sconv.domain.conversion.ConversionIssue;
import ca.gc.cra.sconv.domain.conversion.ConversionResult;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.util.Objects;

/**
 * <strong>What:</strong> {@link NativeWideCodec} over a JVM {@link Charset}.
 * <p><strong>Why:</strong> The JVM already knows how to move between the platform charset and
 * {@code char}; this adapter only adds the substitution and reporting rules conversions rely on.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; coders are created per call.</p>
 *
 * @since 0.1.0
 */
public final class JdkNativeWideCodec implements NativeWideCodec {
  private static final char REPLACEMENT_CHAR = '\uFFFD';
  private static final int CHUNK = 1024;

  private final Charset charset;

  public JdkNativeWideCodec(Charset charset) {
    this.charset = Objects.requireNonNull(charset, "charset");
    if (!charset.canEncode()) {
      throw new IllegalArgumentException("charset " + charset.name() + " cannot encode");
    }
  }

  @Override
  public String charsetName() {
    return charset.name();
  }

  @Override
  public ConversionResult decode(byte[] src, int offset, int length, WideTextBuffer dst)
      throws BufferExhaustedException {
    Objects.checkFromIndexSize(offset, length, src.length);
    CharsetDecoder decoder = charset.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    ByteBuffer in = ByteBuffer.wrap(src, offset, length);
    CharBuffer out = CharBuffer.allocate(CHUNK);
    ConversionResult result = ConversionResult.complete();
    while (true) {
      CoderResult cr = decoder.decode(in, out, true);
      if (cr.isOverflow()) {
        drain(out, dst);
        continue;
      }
      if (cr.isError()) {
        in.position(in.position() + cr.length());
        if (!out.hasRemaining()) {
          drain(out, dst);
        }
        out.put(REPLACEMENT_CHAR);
        result = result.with(ConversionIssue.MALFORMED_INPUT);
        continue;
      }
      break;
    }
    while (decoder.flush(out).isOverflow()) {
      drain(out, dst);
    }
    drain(out, dst);
    return result;
  }

  @Override
  public ConversionResult encode(char[] src, int offset, int length, ByteTextBuffer dst)
      throws BufferExhaustedException {
    Objects.checkFromIndexSize(offset, length, src.length);
    CharsetEncoder encoder = charset.newEncoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    byte[] replacement = encoder.replacement();
    CharBuffer in = CharBuffer.wrap(src, offset, length);
    ByteBuffer out = ByteBuffer.allocate(CHUNK + replacement.length);
    ConversionResult result = ConversionResult.complete();
    while (true) {
      CoderResult cr = encoder.encode(in, out, true);
      if (cr.isOverflow()) {
        drain(out, dst);
        continue;
      }
      if (cr.isError()) {
        in.position(in.position() + cr.length());
        if (out.remaining() < replacement.length) {
          drain(out, dst);
        }
        out.put(replacement);
        result = result.with(cr.isUnmappable()
            ? ConversionIssue.UNREPRESENTABLE : ConversionIssue.MALFORMED_INPUT);
        continue;
      }
      break;
    }
    while (encoder.flush(out).isOverflow()) {
      drain(out, dst);
    }
    drain(out, dst);
    return result;
  }

  @Override
  public boolean isWellFormed(byte[] src, int offset, int length) {
    Objects.checkFromIndexSize(offset, length, src.length);
    CharsetDecoder decoder = charset.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      decoder.decode(ByteBuffer.wrap(src, offset, length));
      return true;
    } catch (CharacterCodingException ex) {
      return false;
    }
  }

  private static void drain(CharBuffer out, WideTextBuffer dst) throws BufferExhaustedException {
    out.flip();
    int count = out.remaining();
    if (!dst.append(out.array(), out.arrayOffset() + out.position(), count)) {
      throw new BufferExhaustedException((long) dst.length() + count + 1);
    }
    out.clear();
  }

  private static void drain(ByteBuffer out, ByteTextBuffer dst) throws BufferExhaustedException {
    out.flip();
    int count = out.remaining();
    if (!dst.append(out.array(), out.arrayOffset() + out.position(), count)) {
      throw new BufferExhaustedException((long) dst.length() + count + 1);
    }
    out.clear();
  }

  @Override
  public String toString() {
    return "JdkNativeWideCodec[" + charset.name() + "]";
  }
}
