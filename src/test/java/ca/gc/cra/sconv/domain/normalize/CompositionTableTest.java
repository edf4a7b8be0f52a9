package ca.gc.cra.sconv.domain.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CompositionTableTest {

  @Test
  void findsPrimaryComposites() {
    assertEquals(0x00E9, CompositionTable.compose('e', 0x0301));
    assertEquals(0x00C5, CompositionTable.compose('A', 0x030A));
    assertEquals(0x1EAD, CompositionTable.compose(0x1EA1, 0x0302));
  }

  @Test
  void excludedCompositesAreAbsent() {
    // U+0958 DEVANAGARI LETTER QA is a composition exclusion.
    assertEquals(-1, CompositionTable.compose(0x0915, 0x093C));
  }

  @Test
  void hangulIsLeftToTheAlgorithm() {
    assertEquals(-1, CompositionTable.compose(0x1100, 0x1161));
  }

  @Test
  void unrelatedPairsDoNotCompose() {
    assertEquals(-1, CompositionTable.compose('x', 0x0301));
    assertEquals(-1, CompositionTable.compose(-1, 0x0301));
    assertTrue(CompositionTable.size() > 900);
  }

  @Test
  void hangulDecompositionRoundTrips() {
    int[] jamo = Hangul.decompose(0xAC01);
    assertEquals(3, jamo.length);
    assertEquals(0xAC01, Hangul.composeLvt(Hangul.composeLv(jamo[0], jamo[1]), jamo[2]));
    assertEquals(2, Hangul.decompose(0xAC00).length);
  }

  @Test
  void everySyllableRoundTripsThroughItsJamo() {
    for (int cp = Hangul.S_BASE; cp < Hangul.S_BASE + Hangul.S_COUNT; cp++) {
      int[] jamo = Hangul.decompose(cp);
      int lv = Hangul.composeLv(jamo[0], jamo[1]);
      assertTrue(Hangul.isLvSyllable(lv));
      int composed = jamo.length == 3 ? Hangul.composeLvt(lv, jamo[2]) : lv;
      assertEquals(cp, composed, () -> "syllable U+" + Integer.toHexString(composed));
    }
  }
}
