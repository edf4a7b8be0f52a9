package ca.gc.cra.sconv.application.conversion;

import ca.gc.cra.sconv.domain.buffer.ByteTextBuffer;
import ca.gc.cra.sconv.domain.conversion.BufferExhaustedException;
import ca.gc.cra.sconv.domain.conversion.ConversionResult;
import ca.gc.cra.sconv.domain.normalize.NfcComposer;
import ca.gc.cra.sconv.domain.normalize.NfdDecomposer;
import ca.gc.cra.sconv.domain.unicode.UnicodeForm;
import java.util.Objects;

/**
 * Normalizes Unicode source text, leaving it in its source encoding for the next stage.
 */
final class NormalizeStage implements TransformStage {
  private final UnicodeForm form;
  private final NfcComposer composer;
  private final NfdDecomposer decomposer;

  private NormalizeStage(UnicodeForm form, NfcComposer composer, NfdDecomposer decomposer) {
    this.form = Objects.requireNonNull(form, "form");
    this.composer = composer;
    this.decomposer = decomposer;
  }

  static NormalizeStage compose(UnicodeForm form, int runLimit) {
    return new NormalizeStage(form, new NfcComposer(runLimit), null);
  }

  static NormalizeStage decompose(UnicodeForm form, NfdDecomposer decomposer) {
    return new NormalizeStage(form, null, Objects.requireNonNull(decomposer, "decomposer"));
  }

  @Override
  public StageKind kind() {
    return composer != null ? StageKind.NORMALIZE_NFC : StageKind.NORMALIZE_NFD;
  }

  @Override
  public ConversionResult apply(byte[] src, int offset, int length, ByteTextBuffer dst)
      throws BufferExhaustedException {
    if (composer != null) {
      return composer.compose(src, offset, length, form, dst, form);
    }
    return decomposer.decompose(src, offset, length, form, dst, form);
  }
}
