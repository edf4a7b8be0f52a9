package ca.gc.cra.sconv.application.conversion;

import ca.gc.cra.sconv.application.port.BackendHandle;
import ca.gc.cra.sconv.application.port.TranscodeResult;
import ca.gc.cra.sconv.domain.buffer.ByteTextBuffer;
import ca.gc.cra.sconv.domain.conversion.BufferExhaustedException;
import ca.gc.cra.sconv.domain.conversion.ConversionIssue;
import ca.gc.cra.sconv.domain.conversion.ConversionResult;
import ca.gc.cra.sconv.domain.unicode.UnicodeForm;
import java.util.Objects;

/**
 * Converts through an external backend handle.
 *
 * <p>Input the backend rejects is replaced with U+FFFD when the target is a Unicode encoding and
 * with {@code '?'} otherwise; conversion then resumes after the rejected input.</p>
 */
final class BackendTranscodeStage implements TransformStage {
  private final BackendHandle handle;
  private final UnicodeForm targetForm;
  private final int terminatorWidth;

  /**
   * @param handle open handle owned by the enclosing profile
   * @param targetForm target encoding when it is Unicode, otherwise {@code null}
   */
  BackendTranscodeStage(BackendHandle handle, UnicodeForm targetForm) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.targetForm = targetForm;
    this.terminatorWidth = targetForm == null ? 1 : targetForm.unitWidth();
  }

  @Override
  public StageKind kind() {
    return StageKind.BACKEND_TRANSCODE;
  }

  @Override
  public ConversionResult apply(byte[] src, int offset, int length, ByteTextBuffer dst)
      throws BufferExhaustedException {
    ConversionResult result = ConversionResult.complete();
    handle.reset();
    int position = offset;
    int remaining = length;
    dst.reserve(dst.length() + Math.max(remaining, 16) + terminatorWidth);
    while (true) {
      int free = dst.capacity() - dst.length() - terminatorWidth;
      TranscodeResult step = handle.transcode(src, position, remaining, dst.array(),
          dst.length(), free);
      position += step.consumed();
      remaining -= step.consumed();
      dst.terminate(dst.length() + step.produced(), terminatorWidth);

      switch (step.status()) {
        case COMPLETED:
          return result;
        case ILLEGAL_SEQUENCE:
          result = result.with(ConversionIssue.MALFORMED_INPUT);
          appendReplacement(dst);
          break;
        case UNMAPPABLE:
          result = result.with(ConversionIssue.UNREPRESENTABLE);
          appendReplacement(dst);
          break;
        case OUTPUT_FULL:
          dst.reserve(dst.capacity() + Math.max(remaining, 16));
          break;
        default:
          throw new IllegalStateException("unexpected transcode status " + step.status());
      }
    }
  }

  private void appendReplacement(ByteTextBuffer dst) throws BufferExhaustedException {
    long needed = dst.length() + 4L;
    boolean ok = targetForm != null ? targetForm.appendReplacement(dst) : dst.appendByte('?');
    if (!ok) {
      throw new BufferExhaustedException(needed);
    }
    dst.reserve(dst.length() + terminatorWidth);
    dst.terminate(dst.length(), terminatorWidth);
  }
}
