package ca.gc.cra.sconv.application.conversion;

/**
 * Kinds of transformation a conversion pipeline is built from.
 *
 * @since 0.1.0
 */
public enum StageKind {
  NORMALIZE_NFC,
  NORMALIZE_NFD,
  UNICODE_TRANSCODE,
  LEGACY_REINTERPRET,
  BACKEND_TRANSCODE,
  IDENTITY_COPY,
  BEST_EFFORT
}
