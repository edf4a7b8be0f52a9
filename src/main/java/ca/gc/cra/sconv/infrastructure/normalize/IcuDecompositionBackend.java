package ca.gc.cra.sconv.infrastructure.normalize;

import ca.gc.cra.sconv.domain.normalize.DecompositionBackend;
import com.ibm.icu.text.FilteredNormalizer2;
import com.ibm.icu.text.Normalizer2;
import com.ibm.icu.text.UnicodeSet;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Canonical decomposition backed by ICU4J.
 * <p><strong>Why:</strong> File systems that store names decomposed leave the CJK compatibility
 * ideographs and the symbol blocks untouched; decomposing those would produce names such systems
 * never write.</p>
 * <p><strong>Role:</strong> Infrastructure adapter for {@link DecompositionBackend}.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; ICU normalizers are immutable.</p>
 *
 * @since 0.1.0
 */
public final class IcuDecompositionBackend implements DecompositionBackend {
  private static final Logger log = LoggerFactory.getLogger(IcuDecompositionBackend.class);

  /** Everything except U+2000..U+2FFF, U+F900..U+FAFF and U+2F800..U+2FAFF decomposes. */
  static final String DECOMPOSABLE = "[^\\u2000-\\u2FFF\\uF900-\\uFAFF\\U0002F800-\\U0002FAFF]";

  private final Normalizer2 normalizer;

  public IcuDecompositionBackend() {
    this(new FilteredNormalizer2(Normalizer2.getNFDInstance(),
        new UnicodeSet(DECOMPOSABLE).freeze()));
  }

  IcuDecompositionBackend(Normalizer2 normalizer) {
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
  }

  @Override
  public Optional<int[]> decompose(int[] codePoints, int offset, int length) {
    Objects.requireNonNull(codePoints, "codePoints");
    Objects.checkFromIndexSize(offset, length, codePoints.length);
    try {
      String text = new String(codePoints, offset, length);
      return Optional.of(normalizer.normalize(text).codePoints().toArray());
    } catch (IllegalArgumentException ex) {
      log.debug("ICU decomposition rejected {} code points", length, ex);
      return Optional.empty();
    }
  }

  @Override
  public String name() {
    return "icu";
  }
}
