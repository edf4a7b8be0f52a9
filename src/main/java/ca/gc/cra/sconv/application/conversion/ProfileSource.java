package ca.gc.cra.sconv.application.conversion;

import ca.gc.cra.sconv.application.port.NativeWideCodec;
import ca.gc.cra.sconv.domain.conversion.UnsupportedConversionException;

/**
 * Supplies profiles to code that converts text on behalf of an archive handle.
 *
 * <p>Every profile obtained from {@link #acquire} is handed back through {@link #release} once the
 * conversion is done. A caching source ignores the release; a transient source closes the
 * profile.</p>
 *
 * @since 0.1.0
 */
public interface ProfileSource {

  /**
   * Returns a profile for the pair.
   *
   * @throws UnsupportedConversionException when the pair has no pipeline
   */
  ConversionProfile acquire(String source, String target, ConversionDirection direction,
      boolean bestEffort) throws UnsupportedConversionException;

  /** Hands a profile back after use. */
  void release(ConversionProfile profile);

  /** Name of the system charset, the charset of the system text form. */
  String systemCharset();

  /** Codec between system bytes and wide text. */
  NativeWideCodec wideCodec();
}
