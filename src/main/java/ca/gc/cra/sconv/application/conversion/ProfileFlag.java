package ca.gc.cra.sconv.application.conversion;

/**
 * Capabilities and requirements derived when a conversion profile is built.
 *
 * @since 0.1.0
 */
public enum ProfileFlag {
  /** Writing: system charset into an archive charset. */
  TO_CHARSET,
  /** Reading: archive charset into the system charset. */
  FROM_CHARSET,
  /** Substitution is acceptable when no exact pipeline exists. */
  BEST_EFFORT,
  /** UTF-8 written by old archivers is reinterpreted as truncated wide characters. */
  LEGACY_UTF8,
  /** Source text is composed to NFC before conversion. */
  NORMALIZATION_C,
  /** Source text is decomposed to NFD before conversion. */
  NORMALIZATION_D,
  FROM_UTF8,
  TO_UTF8,
  FROM_UTF16BE,
  TO_UTF16BE,
  FROM_UTF16LE,
  TO_UTF16LE,
  /** Both names denote the same charset. */
  SAME_CHARSET
}
