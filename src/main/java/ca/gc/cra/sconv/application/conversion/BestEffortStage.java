package ca.gc.cra.sconv.application.conversion;

import ca.gc.cra.sconv.domain.buffer.ByteTextBuffer;
import ca.gc.cra.sconv.domain.conversion.BufferExhaustedException;
import ca.gc.cra.sconv.domain.conversion.ConversionIssue;
import ca.gc.cra.sconv.domain.conversion.ConversionResult;
import ca.gc.cra.sconv.domain.unicode.UnicodeCodec;
import ca.gc.cra.sconv.domain.unicode.UnicodeForm;

/**
 * Last-resort conversion when no backend knows the pair: ASCII passes through and everything
 * else is replaced, with {@code '?'} in a byte charset or U+FFFD in a Unicode target.
 * UTF-16 sources are decoded first so ASCII survives.
 */
final class BestEffortStage implements TransformStage {
  private final UnicodeForm sourceForm;
  private final UnicodeForm targetForm;

  /**
   * @param sourceForm source encoding when it is Unicode, otherwise {@code null}
   * @param targetForm target encoding when it is Unicode, otherwise {@code null}
   */
  BestEffortStage(UnicodeForm sourceForm, UnicodeForm targetForm) {
    this.sourceForm = sourceForm;
    this.targetForm = targetForm;
  }

  @Override
  public StageKind kind() {
    return StageKind.BEST_EFFORT;
  }

  @Override
  public ConversionResult apply(byte[] src, int offset, int length, ByteTextBuffer dst)
      throws BufferExhaustedException {
    ConversionResult result = ConversionResult.complete();
    int width = targetForm == null ? 1 : targetForm.unitWidth();
    int position = offset;
    int limit = offset + length;
    while (position < limit) {
      int codePoint;
      boolean malformed = false;
      if (sourceForm != null && sourceForm != UnicodeForm.UTF_8) {
        long decoded = sourceForm.decode(src, position, limit);
        int n = UnicodeCodec.consumed(decoded);
        malformed = n < 0;
        position += Math.abs(n);
        codePoint = UnicodeCodec.codePoint(decoded);
      } else {
        codePoint = src[position++] & 0xFF;
      }

      if (malformed) {
        result = result.with(ConversionIssue.MALFORMED_INPUT);
        writeReplacement(dst);
      } else if (codePoint < 0x80) {
        write(dst, codePoint);
      } else {
        result = result.with(ConversionIssue.BACKEND_UNAVAILABLE);
        writeReplacement(dst);
      }
    }
    dst.reserve(dst.length() + width);
    dst.terminate(dst.length(), width);
    return result;
  }

  private void write(ByteTextBuffer dst, int ascii) throws BufferExhaustedException {
    long needed = dst.length() + 4L;
    boolean ok = targetForm == null ? dst.appendByte(ascii) : targetForm.append(dst, ascii);
    if (!ok) {
      throw new BufferExhaustedException(needed);
    }
  }

  private void writeReplacement(ByteTextBuffer dst) throws BufferExhaustedException {
    long needed = dst.length() + 4L;
    boolean ok = targetForm == null ? dst.appendByte('?') : targetForm.appendReplacement(dst);
    if (!ok) {
      throw new BufferExhaustedException(needed);
    }
  }
}
