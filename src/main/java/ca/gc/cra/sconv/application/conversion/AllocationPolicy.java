package ca.gc.cra.sconv.application.conversion;

import java.util.Locale;

/**
 * How buffer exhaustion is surfaced.
 *
 * @since 0.1.0
 */
public enum AllocationPolicy {
  /** Exhaustion is thrown as {@code BufferExhaustedException}; the caller decides. */
  RECOVERABLE,
  /** Exhaustion ends the process through an {@code AbortHandler}, as the oldest callers expect. */
  FATAL;

  /**
   * Parses a configuration value, ignoring case.
   *
   * @throws IllegalArgumentException for unknown values
   */
  public static AllocationPolicy parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return RECOVERABLE;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "allocationPolicy must be RECOVERABLE or FATAL (was " + raw + ")", ex);
    }
  }
}
