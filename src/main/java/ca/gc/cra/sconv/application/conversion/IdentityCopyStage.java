package ca.gc.cra.sconv.application.conversion;

import ca.gc.cra.sconv.application.port.NativeWideCodec;
import ca.gc.cra.sconv.domain.buffer.ByteTextBuffer;
import ca.gc.cra.sconv.domain.conversion.BufferExhaustedException;
import ca.gc.cra.sconv.domain.conversion.ConversionIssue;
import ca.gc.cra.sconv.domain.conversion.ConversionResult;
import java.util.Objects;

/**
 * Copies bytes unchanged between two names for the same charset, then checks that they form
 * valid text. Invalid input is reported but never altered.
 */
final class IdentityCopyStage implements TransformStage {
  private final NativeWideCodec validator;

  IdentityCopyStage(NativeWideCodec validator) {
    this.validator = Objects.requireNonNull(validator, "validator");
  }

  @Override
  public StageKind kind() {
    return StageKind.IDENTITY_COPY;
  }

  @Override
  public ConversionResult apply(byte[] src, int offset, int length, ByteTextBuffer dst)
      throws BufferExhaustedException {
    long needed = (long) dst.length() + length + 1;
    if (!dst.append(src, offset, length)) {
      throw new BufferExhaustedException(needed);
    }
    if (!validator.isWellFormed(src, offset, length)) {
      return ConversionResult.of(ConversionIssue.MALFORMED_INPUT);
    }
    return ConversionResult.complete();
  }
}
