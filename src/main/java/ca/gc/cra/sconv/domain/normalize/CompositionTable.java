package ca.gc.cra.sconv.domain.normalize;

import com.ibm.icu.text.Normalizer2;
import java.util.Arrays;

/**
 * <strong>What:</strong> Sorted table of canonical primary composites keyed by their two-code-point
 * decomposition.
 * <p><strong>Why:</strong> Composition asks "does base + mark form a single character?" once per
 * combining mark; a binary search over packed pair keys answers that without allocation.</p>
 * <p><strong>Role:</strong> Domain data shared by every {@link NfcComposer}.</p>
 * <p><strong>Thread-safety:</strong> Built once during class initialization; immutable afterwards.</p>
 * <p><strong>Performance:</strong> O(log n) lookups over roughly a thousand entries.</p>
 *
 * @implNote Entries are derived from the Unicode Character Database shipped with ICU4J: every code
 *     point whose raw canonical decomposition is exactly two code points that recompose to it.
 *     Hangul syllables are excluded because they compose algorithmically (see {@link Hangul}).
 * @since 0.1.0
 */
public final class CompositionTable {
  private static final long[] KEYS;
  private static final int[] COMPOSITES;

  static {
    Normalizer2 nfc = Normalizer2.getNFCInstance();
    long[] keys = new long[2048];
    int[] composites = new int[2048];
    int size = 0;
    for (int cp = 0; cp <= 0x10FFFF; cp++) {
      if (Hangul.isSyllable(cp)) {
        cp = Hangul.S_BASE + Hangul.S_COUNT - 1;
        continue;
      }
      String raw = nfc.getRawDecomposition(cp);
      if (raw == null || raw.codePointCount(0, raw.length()) != 2) {
        continue;
      }
      int first = raw.codePointAt(0);
      int second = raw.codePointAt(Character.charCount(first));
      if (nfc.composePair(first, second) != cp) {
        continue;
      }
      if (size == keys.length) {
        keys = Arrays.copyOf(keys, size * 2);
        composites = Arrays.copyOf(composites, size * 2);
      }
      keys[size] = key(first, second);
      composites[size] = cp;
      size++;
    }
    sortByKey(keys, composites, size);
    KEYS = Arrays.copyOf(keys, size);
    COMPOSITES = Arrays.copyOf(composites, size);
  }

  private CompositionTable() {
    // Utility
  }

  /**
   * Looks up the primary composite of {@code first} followed by {@code second}.
   *
   * @return the composite code point, or {@code -1} when the pair does not compose
   */
  public static int compose(int first, int second) {
    if (first < 0 || second < 0) {
      return -1;
    }
    int index = Arrays.binarySearch(KEYS, key(first, second));
    return index >= 0 ? COMPOSITES[index] : -1;
  }

  /** Number of pairs in the table. */
  public static int size() {
    return KEYS.length;
  }

  private static long key(int first, int second) {
    return ((long) first << 21) | second;
  }

  private static void sortByKey(long[] keys, int[] values, int size) {
    Integer[] order = new Integer[size];
    for (int i = 0; i < size; i++) {
      order[i] = i;
    }
    Arrays.sort(order, (a, b) -> Long.compare(keys[a], keys[b]));
    long[] sortedKeys = new long[size];
    int[] sortedValues = new int[size];
    for (int i = 0; i < size; i++) {
      sortedKeys[i] = keys[order[i]];
      sortedValues[i] = values[order[i]];
    }
    System.arraycopy(sortedKeys, 0, keys, 0, size);
    System.arraycopy(sortedValues, 0, values, 0, size);
  }
}
