package ca.gc.cra.sconv.domain.buffer;

import java.util.Objects;

/**
 * Append helpers for callers that expect allocation to either succeed or end the process.
 *
 * <p>These mirror the oldest buffer entry points, which never returned an error. New code should
 * use the boolean-returning methods on the buffers themselves.</p>
 *
 * @since 0.1.0
 */
public final class LegacyBufferOps {
  private LegacyBufferOps() {
    // Utility
  }

  /**
   * Appends bytes, invoking {@code handler} when the buffer cannot grow.
   *
   * @return {@code buffer}, for chaining
   */
  public static ByteTextBuffer appendOrAbort(
      ByteTextBuffer buffer, byte[] src, int offset, int count, AbortHandler handler) {
    Objects.requireNonNull(handler, "handler");
    if (!buffer.append(src, offset, count)) {
      handler.abort("append of " + count + " bytes failed");
    }
    return buffer;
  }

  /** Bounded ("strncat") variant of {@link #appendOrAbort}. */
  public static ByteTextBuffer appendBoundedOrAbort(
      ByteTextBuffer buffer, byte[] src, int offset, int maxCount, AbortHandler handler) {
    Objects.requireNonNull(handler, "handler");
    if (!buffer.appendBounded(src, offset, maxCount)) {
      handler.abort("bounded append of up to " + maxCount + " bytes failed");
    }
    return buffer;
  }

  /** Wide-buffer variant of {@link #appendOrAbort}. */
  public static WideTextBuffer appendOrAbort(WideTextBuffer buffer, CharSequence text,
      AbortHandler handler) {
    Objects.requireNonNull(handler, "handler");
    if (!buffer.append(text)) {
      handler.abort("append of " + text.length() + " chars failed");
    }
    return buffer;
  }
}
