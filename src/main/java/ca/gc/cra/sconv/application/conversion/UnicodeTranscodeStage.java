package ca.gc.cra.sconv.application.conversion;

import ca.gc.cra.sconv.domain.buffer.ByteTextBuffer;
import ca.gc.cra.sconv.domain.conversion.BufferExhaustedException;
import ca.gc.cra.sconv.domain.conversion.ConversionIssue;
import ca.gc.cra.sconv.domain.conversion.ConversionResult;
import ca.gc.cra.sconv.domain.unicode.UnicodeCodec;
import ca.gc.cra.sconv.domain.unicode.UnicodeForm;
import java.util.Objects;

/**
 * Converts directly between Unicode encodings.
 *
 * <p>UTF-8 to UTF-8 is not a plain copy: CESU-8 surrogate pairs are folded into four-byte
 * sequences and malformed bytes are replaced, so the output is always well-formed UTF-8.</p>
 */
final class UnicodeTranscodeStage implements TransformStage {
  private final UnicodeForm from;
  private final UnicodeForm to;

  UnicodeTranscodeStage(UnicodeForm from, UnicodeForm to) {
    this.from = Objects.requireNonNull(from, "from");
    this.to = Objects.requireNonNull(to, "to");
  }

  @Override
  public StageKind kind() {
    return StageKind.UNICODE_TRANSCODE;
  }

  @Override
  public ConversionResult apply(byte[] src, int offset, int length, ByteTextBuffer dst)
      throws BufferExhaustedException {
    boolean malformed = false;
    int position = offset;
    int limit = offset + length;
    while (true) {
      long decoded = from.decode(src, position, limit);
      int n = UnicodeCodec.consumed(decoded);
      if (n == 0) {
        break;
      }
      if (n < 0) {
        malformed = true;
        position -= n;
      } else {
        position += n;
      }
      int needed = dst.length() + to.maxBytesPerCodePoint() + to.unitWidth();
      if (!to.append(dst, UnicodeCodec.codePoint(decoded))) {
        throw new BufferExhaustedException(needed);
      }
    }
    dst.reserve(dst.length() + to.unitWidth());
    dst.terminate(dst.length(), to.unitWidth());
    return malformed ? ConversionResult.of(ConversionIssue.MALFORMED_INPUT)
        : ConversionResult.complete();
  }
}
