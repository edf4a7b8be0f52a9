package ca.gc.cra.sconv.application.conversion;

import java.util.Locale;

/**
 * Normalization applied to Unicode text read from archives.
 *
 * @since 0.1.0
 */
public enum NormalizationForm {
  /** Canonical composition, the form most file systems store. */
  NFC,
  /** Canonical decomposition, used where the host file system stores decomposed names. */
  NFD;

  /**
   * Parses a configuration value, ignoring case.
   *
   * @throws IllegalArgumentException for unknown values
   */
  public static NormalizationForm parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return NFC;
    }
    return switch (raw.trim().toUpperCase(Locale.ROOT)) {
      case "NFC", "C" -> NFC;
      case "NFD", "D" -> NFD;
      default -> throw new IllegalArgumentException(
          "normalization must be NFC or NFD (was " + raw + ")");
    };
  }
}
