package ca.gc.cra.sconv.domain.conversion;

/**
 * Tolerated problems reported alongside converted output.
 *
 * @since 0.1.0
 */
public enum ConversionIssue {
  /** Input bytes did not form a valid sequence in the source encoding; a replacement was emitted. */
  MALFORMED_INPUT,
  /** A valid character has no representation in the target encoding; a replacement was emitted. */
  UNREPRESENTABLE,
  /** No transcoding backend resolved the pair, so a best-effort fallback produced the output. */
  BACKEND_UNAVAILABLE,
  /** A run of combining marks exceeded the normalization limit and was emitted unchanged. */
  NORMALIZATION_INCOMPLETE
}
