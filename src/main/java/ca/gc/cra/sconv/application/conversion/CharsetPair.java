package ca.gc.cra.sconv.application.conversion;

import java.util.Objects;

/**
 * Registry key: the exact source and target charset names of a profile.
 *
 * @param source name of the charset text is converted from
 * @param target name of the charset text is converted to
 * @since 0.1.0
 */
public record CharsetPair(String source, String target) {
  public CharsetPair {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
  }

  @Override
  public String toString() {
    return source + " -> " + target;
  }
}
