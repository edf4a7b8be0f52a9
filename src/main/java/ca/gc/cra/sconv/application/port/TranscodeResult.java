package ca.gc.cra.sconv.application.port;

/**
 * Outcome of one {@link BackendHandle#transcode} call.
 *
 * @param consumed input bytes consumed, including skipped illegal input
 * @param produced output bytes written
 * @param status why the call returned
 * @since 0.1.0
 */
public record TranscodeResult(int consumed, int produced, Status status) {

  public TranscodeResult {
    if (consumed < 0 || produced < 0) {
      throw new IllegalArgumentException("counts must not be negative");
    }
    if (status == null) {
      throw new IllegalArgumentException("status must not be null");
    }
  }

  /** Reason a transcode call returned. */
  public enum Status {
    /** All input was converted and flushed. */
    COMPLETED,
    /** Malformed input was skipped. */
    ILLEGAL_SEQUENCE,
    /** A valid character with no representation in the target charset was skipped. */
    UNMAPPABLE,
    /** The output range is full. */
    OUTPUT_FULL
  }
}
