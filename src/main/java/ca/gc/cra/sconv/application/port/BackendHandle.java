package ca.gc.cra.sconv.application.port;

/**
 * Open transcoder for one charset pair.
 *
 * <p>The handle may buffer text between calls: a call that returns
 * {@link TranscodeResult.Status#OUTPUT_FULL} must be repeated with more output space and the
 * remaining input. A call that returns {@link TranscodeResult.Status#ILLEGAL_SEQUENCE} or
 * {@link TranscodeResult.Status#UNMAPPABLE} has already skipped the offending input; the caller
 * writes its replacement and calls again with the remaining input.</p>
 *
 * @since 0.1.0
 */
public interface BackendHandle extends AutoCloseable {

  /**
   * Converts as much input as fits into the output range. The whole remaining string is passed on
   * every call, so a truncated trailing sequence is reported as illegal.
   *
   * @param in source bytes
   * @param inOffset first unread byte
   * @param inLength number of unread bytes
   * @param out destination array
   * @param outOffset first free output position
   * @param outLength free output bytes
   * @return counts and the reason the call returned
   */
  TranscodeResult transcode(byte[] in, int inOffset, int inLength, byte[] out, int outOffset,
      int outLength);

  /** Discards buffered state so the next call starts a new string. */
  void reset();

  /** Releases the handle. Further use is undefined. */
  @Override
  void close();
}
