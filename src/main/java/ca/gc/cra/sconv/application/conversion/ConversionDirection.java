package ca.gc.cra.sconv.application.conversion;

/**
 * Which side of a conversion is the archive.
 *
 * @since 0.1.0
 */
public enum ConversionDirection {
  /** Text read from an archive, converted into the system charset. Unicode sources are normalized. */
  READ,
  /** Text written into an archive, converted from the system charset. */
  WRITE
}
