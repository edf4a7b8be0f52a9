package ca.gc.cra.sconv.config;

import java.util.Locale;

/**
 * Charset backend wired by {@link CompositionRoot}.
 *
 * @since 0.1.0
 */
public enum BackendVariant {
  /** No charset resolves; only identity copies and best-effort substitution are possible. */
  NONE,
  /** Charsets installed in the JVM. */
  EXTERNAL_CODEC,
  /** Names resolved through Windows codepage numbers. */
  PLATFORM_CODEPAGE,
  /** JVM charsets plus ICU decomposition for decomposed UTF-8 names. */
  PLATFORM_DECOMPOSITION;

  /**
   * Parses a variant name ignoring case; {@code -} is accepted for {@code _}.
   *
   * @param raw configured value; blank selects {@link #EXTERNAL_CODEC}
   * @return parsed variant
   * @throws IllegalArgumentException when the name matches no variant
   */
  public static BackendVariant fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return EXTERNAL_CODEC;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    for (BackendVariant variant : values()) {
      if (variant.name().equals(normalized)) {
        return variant;
      }
    }
    throw new IllegalArgumentException("backend must be one of NONE, EXTERNAL_CODEC, "
        + "PLATFORM_CODEPAGE, PLATFORM_DECOMPOSITION (was " + raw + ")");
  }
}
