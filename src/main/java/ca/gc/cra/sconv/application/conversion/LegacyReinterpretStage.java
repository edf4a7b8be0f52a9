package ca.gc.cra.sconv.application.conversion;

import ca.gc.cra.sconv.application.port.NativeWideCodec;
import ca.gc.cra.sconv.domain.buffer.ByteTextBuffer;
import ca.gc.cra.sconv.domain.conversion.BufferExhaustedException;
import ca.gc.cra.sconv.domain.conversion.ConversionIssue;
import ca.gc.cra.sconv.domain.conversion.ConversionResult;
import ca.gc.cra.sconv.domain.unicode.UnicodeCodec;
import java.util.Objects;

/**
 * Reads UTF-8 the way old archivers produced it: each scalar was stored as a 16-bit wide
 * character, so it is truncated to a {@code char} and encoded with the system wide codec.
 * Malformed UTF-8 becomes {@code '?'}.
 */
final class LegacyReinterpretStage implements TransformStage {
  private final NativeWideCodec wideCodec;

  LegacyReinterpretStage(NativeWideCodec wideCodec) {
    this.wideCodec = Objects.requireNonNull(wideCodec, "wideCodec");
  }

  @Override
  public StageKind kind() {
    return StageKind.LEGACY_REINTERPRET;
  }

  @Override
  public ConversionResult apply(byte[] src, int offset, int length, ByteTextBuffer dst)
      throws BufferExhaustedException {
    ConversionResult result = ConversionResult.complete();
    int position = offset;
    int limit = offset + length;
    while (true) {
      long decoded = UnicodeCodec.decodeUtf8(src, position, limit);
      int n = UnicodeCodec.consumed(decoded);
      if (n == 0) {
        break;
      }
      if (n < 0) {
        position -= n;
        long needed = dst.length() + 2L;
        if (!dst.appendByte('?')) {
          throw new BufferExhaustedException(needed);
        }
        result = result.with(ConversionIssue.MALFORMED_INPUT);
        continue;
      }
      position += n;
      char truncated = (char) UnicodeCodec.codePoint(decoded);
      result = result.merge(wideCodec.encodeChar(truncated, dst));
    }
    dst.reserve(dst.length() + 1);
    dst.setLength(dst.length());
    return result;
  }
}
