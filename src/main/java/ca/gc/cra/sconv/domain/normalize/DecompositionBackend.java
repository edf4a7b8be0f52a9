package ca.gc.cra.sconv.domain.normalize;

import java.util.Optional;

/**
 * Platform service that performs canonical decomposition (NFD).
 *
 * <p>Implementations must be pure functions of their input; failure is reported by returning an
 * empty result, never by throwing on well-formed code points.</p>
 *
 * @since 0.1.0
 */
public interface DecompositionBackend {

  /**
   * Decomposes {@code length} code points starting at {@code offset}.
   *
   * @param codePoints Unicode scalar values
   * @param offset first value to decompose
   * @param length number of values
   * @return decomposed code points, or empty when the service could not process the input
   */
  Optional<int[]> decompose(int[] codePoints, int offset, int length);

  /** Short name used in logs. */
  String name();
}
