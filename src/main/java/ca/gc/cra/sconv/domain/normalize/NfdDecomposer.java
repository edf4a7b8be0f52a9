package ca.gc.cra.sconv.domain.normalize;

import ca.gc.cra.sconv.domain.buffer.ByteTextBuffer;
import ca.gc.cra.sconv.domain.conversion.BufferExhaustedException;
import ca.gc.cra.sconv.domain.conversion.ConversionIssue;
import ca.gc.cra.sconv.domain.conversion.ConversionResult;
import ca.gc.cra.sconv.domain.unicode.UnicodeCodec;
import ca.gc.cra.sconv.domain.unicode.UnicodeForm;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;

/**
 * Decomposition driver: decodes text, hands the code points to a {@link DecompositionBackend},
 * and re-encodes what comes back.
 *
 * <p>When the backend cannot process the input the decoded text is emitted unchanged and the
 * result reports {@link ConversionIssue#BACKEND_UNAVAILABLE}.</p>
 *
 * @since 0.1.0
 */
public final class NfdDecomposer {
  private final DecompositionBackend backend;

  public NfdDecomposer(DecompositionBackend backend) {
    this.backend = Objects.requireNonNull(backend, "backend");
  }

  /**
   * Decomposes {@code length} bytes of {@code from}-encoded text into {@code dst} as {@code to}.
   *
   * @throws BufferExhaustedException when {@code dst} cannot grow
   */
  public ConversionResult decompose(byte[] src, int offset, int length, UnicodeForm from,
      ByteTextBuffer dst, UnicodeForm to) throws BufferExhaustedException {
    Objects.requireNonNull(src, "src");
    Objects.checkFromIndexSize(offset, length, src.length);
    EnumSet<ConversionIssue> issues = EnumSet.noneOf(ConversionIssue.class);

    int[] codePoints = new int[Math.max(4, length)];
    int count = 0;
    int position = offset;
    int limit = offset + length;
    while (true) {
      long decoded = from.decode(src, position, limit);
      int n = UnicodeCodec.consumed(decoded);
      if (n == 0) {
        break;
      }
      if (n < 0) {
        issues.add(ConversionIssue.MALFORMED_INPUT);
      }
      if (count == codePoints.length) {
        codePoints = Arrays.copyOf(codePoints, count * 2);
      }
      codePoints[count++] = UnicodeCodec.codePoint(decoded);
      position += Math.abs(n);
    }

    int[] output;
    Optional<int[]> decomposed = backend.decompose(codePoints, 0, count);
    if (decomposed.isPresent()) {
      output = decomposed.get();
    } else {
      issues.add(ConversionIssue.BACKEND_UNAVAILABLE);
      output = Arrays.copyOf(codePoints, count);
    }

    for (int cp : output) {
      long needed = (long) dst.length() + 4 + to.unitWidth();
      if (!to.append(dst, cp)) {
        throw new BufferExhaustedException(needed);
      }
    }
    dst.reserve(dst.length() + to.unitWidth());
    dst.terminate(dst.length(), to.unitWidth());
    return issues.isEmpty() ? ConversionResult.complete() : new ConversionResult(issues);
  }
}
