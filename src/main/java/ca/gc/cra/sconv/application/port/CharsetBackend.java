package ca.gc.cra.sconv.application.port;

import java.util.Optional;

/**
 * <strong>What:</strong> Port resolving a pair of charset names to a transcoder.
 * <p><strong>Why:</strong> Which legacy charsets are available, and how they are named, depends on the
 * platform; the conversion engine only needs to know whether a pair can be opened.</p>
 * <p><strong>Role:</strong> Application port implemented by adapters in
 * {@code ca.gc.cra.sconv.infrastructure.charset}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open a fresh, exclusively owned {@link BackendHandle} for a supported pair.</li>
 *   <li>Tell whether two names denote the same charset on this backend.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must allow concurrent {@link #open} calls;
 * returned handles are single-threaded.</p>
 *
 * @since 0.1.0
 */
public interface CharsetBackend {

  /**
   * Opens a transcoder from {@code sourceCharset} to {@code targetCharset}.
   *
   * @return a new handle, or empty when either name is unknown or the pair is unsupported
   */
  Optional<BackendHandle> open(String sourceCharset, String targetCharset);

  /**
   * Returns {@code true} when both names resolve to the same charset. The default compares the
   * names ignoring case.
   */
  default boolean sameCharset(String first, String second) {
    return first != null && first.equalsIgnoreCase(second);
  }

  /** Short backend name used in logs and diagnostics. */
  String name();
}
