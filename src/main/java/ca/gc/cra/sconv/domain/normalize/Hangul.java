package ca.gc.cra.sconv.domain.normalize;

/**
 * Algorithmic composition of Hangul syllables from conjoining jamo.
 *
 * <p>Precomposed syllables are not listed in the composition table; they are derived from the
 * leading consonant (L), vowel (V), and optional trailing consonant (T) indices.</p>
 *
 * @since 0.1.0
 */
public final class Hangul {
  public static final int S_BASE = 0xAC00;
  public static final int L_BASE = 0x1100;
  public static final int V_BASE = 0x1161;
  public static final int T_BASE = 0x11A7;
  public static final int L_COUNT = 19;
  public static final int V_COUNT = 21;
  public static final int T_COUNT = 28;
  public static final int N_COUNT = V_COUNT * T_COUNT;
  public static final int S_COUNT = L_COUNT * N_COUNT;

  private Hangul() {
    // Utility
  }

  /** Leading consonant jamo. */
  public static boolean isLeading(int cp) {
    return cp >= L_BASE && cp < L_BASE + L_COUNT;
  }

  /** Vowel jamo. */
  public static boolean isVowel(int cp) {
    return cp >= V_BASE && cp < V_BASE + V_COUNT;
  }

  /** Trailing consonant jamo (excluding the T_BASE filler). */
  public static boolean isTrailing(int cp) {
    return cp > T_BASE && cp < T_BASE + T_COUNT;
  }

  public static boolean isSyllable(int cp) {
    return cp >= S_BASE && cp < S_BASE + S_COUNT;
  }

  /** Syllable with a leading consonant and vowel but no trailing consonant. */
  public static boolean isLvSyllable(int cp) {
    return isSyllable(cp) && (cp - S_BASE) % T_COUNT == 0;
  }

  /** Composes L + V into an LV syllable. */
  public static int composeLv(int l, int v) {
    return S_BASE + ((l - L_BASE) * V_COUNT + (v - V_BASE)) * T_COUNT;
  }

  /** Composes LV + T into an LVT syllable. */
  public static int composeLvt(int lv, int t) {
    return lv + (t - T_BASE);
  }

  /**
   * Decomposes a precomposed syllable into its jamo.
   *
   * @return two or three jamo, or {@code null} when {@code cp} is not a syllable
   */
  public static int[] decompose(int cp) {
    if (!isSyllable(cp)) {
      return null;
    }
    int index = cp - S_BASE;
    int l = L_BASE + index / N_COUNT;
    int v = V_BASE + (index % N_COUNT) / T_COUNT;
    int t = T_BASE + index % T_COUNT;
    return t == T_BASE ? new int[] {l, v} : new int[] {l, v, t};
  }
}
