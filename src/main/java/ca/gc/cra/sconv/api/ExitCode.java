package ca.gc.cra.sconv.api;

import ca.gc.cra.sconv.domain.buffer.AbortHandler;

/**
 * <strong>What:</strong> Canonical exit codes shared by sconv commands.
 * <p><strong>Why:</strong> Scripts converting archive listings need to tell a clean conversion from
 * one that substituted characters.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution; every character converted exactly. */
  SUCCESS(0),
  /** Output was produced but some characters were substituted. */
  SUBSTITUTED(1),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the CLI. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** No conversion exists for the charset pair and best effort was not allowed. */
  UNSUPPORTED_CONVERSION(6),
  /** A buffer could not grow; same status the fatal allocation policy exits with. */
  OUT_OF_MEMORY(AbortHandler.EXIT_STATUS);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /** Numeric value reported to the operating system. */
  public int code() {
    return code;
  }
}
