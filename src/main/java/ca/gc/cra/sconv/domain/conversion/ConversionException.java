package ca.gc.cra.sconv.domain.conversion;

/**
 * <strong>What:</strong> Base checked exception for conversion failures that cannot be reported as a
 * best-effort result.
 * <p><strong>Why:</strong> Substitutions and malformed input are tolerated and surface through
 * {@link ConversionResult}; only unsupported pairs and allocation exhaustion abort an operation.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 * @see UnsupportedConversionException
 * @see BufferExhaustedException
 */
public class ConversionException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a diagnostic message.
   *
   * @param message human readable description
   */
  public ConversionException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a diagnostic message and root cause.
   *
   * @param message human readable description
   * @param cause underlying failure
   */
  public ConversionException(String message, Throwable cause) {
    super(message, cause);
  }
}
