package ca.gc.cra.sconv.domain.conversion;

/**
 * Raised when no transcoding pipeline exists for a charset pair and best-effort conversion was not
 * allowed.
 *
 * @since 0.1.0
 */
public final class UnsupportedConversionException extends ConversionException {
  private static final long serialVersionUID = 1L;

  private final String sourceCharset;
  private final String targetCharset;

  /**
   * Creates an exception describing the rejected pair.
   *
   * @param sourceCharset charset name the text was declared in
   * @param targetCharset charset name the text was requested in
   */
  public UnsupportedConversionException(String sourceCharset, String targetCharset) {
    super("Conversion from " + sourceCharset + " to " + targetCharset + " is not supported");
    this.sourceCharset = sourceCharset;
    this.targetCharset = targetCharset;
  }

  public String sourceCharset() {
    return sourceCharset;
  }

  public String targetCharset() {
    return targetCharset;
  }
}
