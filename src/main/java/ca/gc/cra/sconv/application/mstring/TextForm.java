package ca.gc.cra.sconv.application.mstring;

/**
 * Representations a {@link MultiFormString} can hold.
 *
 * @since 0.1.0
 */
public enum TextForm {
  /** UTF-8 bytes. */
  UTF8,
  /** Bytes in the system charset. */
  SYSTEM,
  /** UTF-16 {@code char} units. */
  WIDE
}
