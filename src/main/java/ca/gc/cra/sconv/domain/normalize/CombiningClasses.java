package ca.gc.cra.sconv.domain.normalize;

import com.ibm.icu.lang.UCharacter;

/**
 * Canonical combining class lookup.
 *
 * @since 0.1.0
 */
public final class CombiningClasses {
  /** Combining class treated as commuting with itself during composition. */
  public static final int SELF_COMMUTATIVE = 228;

  private CombiningClasses() {
    // Utility
  }

  /**
   * Returns the canonical combining class of {@code codePoint}; 0 for starters and for values
   * outside the Unicode range.
   */
  public static int of(int codePoint) {
    if (codePoint < 0 || codePoint > UCharacter.MAX_VALUE) {
      return 0;
    }
    return UCharacter.getCombiningClass(codePoint);
  }
}
