package ca.gc.cra.sconv.application.conversion;

import ca.gc.cra.sconv.validation.Strings;
import java.util.Objects;

/**
 * Everything needed to build one conversion profile.
 *
 * @param source charset name text is converted from
 * @param target charset name text is converted to
 * @param direction whether the archive charset is the source (READ) or the target (WRITE)
 * @param bestEffort accept lossy substitution when no exact pipeline exists
 * @since 0.1.0
 */
public record ProfileRequest(
    String source, String target, ConversionDirection direction, boolean bestEffort) {

  public ProfileRequest {
    source = Strings.requireCharsetName("source", source);
    target = Strings.requireCharsetName("target", target);
    Objects.requireNonNull(direction, "direction");
  }

  /** Reading direction: archive charset into the system charset. */
  public static ProfileRequest read(String source, String target, boolean bestEffort) {
    return new ProfileRequest(source, target, ConversionDirection.READ, bestEffort);
  }

  /** Writing direction: system charset into an archive charset. */
  public static ProfileRequest write(String source, String target, boolean bestEffort) {
    return new ProfileRequest(source, target, ConversionDirection.WRITE, bestEffort);
  }

  CharsetPair pair() {
    return new CharsetPair(source, target);
  }
}
