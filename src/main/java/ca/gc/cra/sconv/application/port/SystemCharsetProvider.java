package ca.gc.cra.sconv.application.port;

/**
 * Reports the charset the host uses for file names and console text.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SystemCharsetProvider {

  /**
   * Returns the current system charset name, e.g. {@code UTF-8} or {@code windows-1252}.
   */
  String currentCharset();
}
