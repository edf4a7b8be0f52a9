package ca.gc.cra.sconv.application.conversion;

import ca.gc.cra.sconv.application.port.BackendHandle;
import ca.gc.cra.sconv.application.port.CharsetBackend;
import ca.gc.cra.sconv.application.port.NativeWideCodec;
import ca.gc.cra.sconv.domain.conversion.UnsupportedConversionException;
import ca.gc.cra.sconv.domain.normalize.DecompositionBackend;
import ca.gc.cra.sconv.domain.normalize.NfdDecomposer;
import ca.gc.cra.sconv.domain.unicode.UnicodeForm;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Chooses the one or two stages a profile runs for a charset pair.
 * <p><strong>Why:</strong> Selection happens once per profile; conversions then run the stored stages
 * without re-deciding anything.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Derive the profile flags from the names, direction and settings.</li>
 *   <li>Pick the terminal stage: direct Unicode, legacy reinterpretation, backend, identity copy,
 *       then best effort, first match wins.</li>
 *   <li>Prepend normalization when reading Unicode text.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; safe to share if the
 * backend is.</p>
 *
 * @since 0.1.0
 */
final class PipelineSelector {
  private final CharsetBackend backend;
  private final NativeWideCodec wideCodec;
  private final NfdDecomposer decomposer;

  PipelineSelector(CharsetBackend backend, NativeWideCodec wideCodec,
      Optional<DecompositionBackend> decomposition) {
    this.backend = Objects.requireNonNull(backend, "backend");
    this.wideCodec = Objects.requireNonNull(wideCodec, "wideCodec");
    this.decomposer = Objects.requireNonNull(decomposition, "decomposition")
        .map(NfdDecomposer::new)
        .orElse(null);
  }

  /**
   * Builds the pipeline for {@code request}. A backend handle opened here belongs to the returned
   * pipeline.
   *
   * @throws UnsupportedConversionException when no stage applies and best effort is not allowed
   */
  Pipeline select(ProfileRequest request, ConversionSettings settings)
      throws UnsupportedConversionException {
    UnicodeForm from = UnicodeForm.forCharset(request.source()).orElse(null);
    UnicodeForm to = UnicodeForm.forCharset(request.target()).orElse(null);
    EnumSet<ProfileFlag> flags = deriveFlags(request, settings, from, to);

    List<TransformStage> stages = new ArrayList<>(2);
    if (flags.contains(ProfileFlag.NORMALIZATION_D)) {
      stages.add(NormalizeStage.decompose(from, decomposer));
    } else if (flags.contains(ProfileFlag.NORMALIZATION_C)) {
      stages.add(NormalizeStage.compose(from, settings.normalizationRunLimit()));
    }

    if (from != null && to != null) {
      stages.add(new UnicodeTranscodeStage(from, to));
      return new Pipeline(flags, stages, null, from, to);
    }
    if (flags.contains(ProfileFlag.LEGACY_UTF8)) {
      // Old archivers wrote truncated wide characters; normalizing them would alter the bytes.
      return new Pipeline(flags, List.of(new LegacyReinterpretStage(wideCodec)), null, from, to);
    }

    Optional<BackendHandle> handle = backend.open(request.source(), request.target());
    if (handle.isPresent()) {
      stages.add(new BackendTranscodeStage(handle.get(), to));
      return new Pipeline(flags, stages, handle.get(), from, to);
    }
    if (flags.contains(ProfileFlag.SAME_CHARSET)) {
      stages.add(new IdentityCopyStage(wideCodec));
      return new Pipeline(flags, stages, null, from, to);
    }
    if (flags.contains(ProfileFlag.BEST_EFFORT)) {
      stages.add(new BestEffortStage(from, to));
      return new Pipeline(flags, stages, null, from, to);
    }
    throw new UnsupportedConversionException(request.source(), request.target());
  }

  private EnumSet<ProfileFlag> deriveFlags(ProfileRequest request, ConversionSettings settings,
      UnicodeForm from, UnicodeForm to) {
    EnumSet<ProfileFlag> flags = EnumSet.noneOf(ProfileFlag.class);
    flags.add(request.direction() == ConversionDirection.WRITE
        ? ProfileFlag.TO_CHARSET : ProfileFlag.FROM_CHARSET);
    if (request.bestEffort()) {
      flags.add(ProfileFlag.BEST_EFFORT);
    }
    if (backend.sameCharset(request.source(), request.target())) {
      flags.add(ProfileFlag.SAME_CHARSET);
    }
    if (from != null) {
      flags.add(switch (from) {
        case UTF_8 -> ProfileFlag.FROM_UTF8;
        case UTF_16BE -> ProfileFlag.FROM_UTF16BE;
        case UTF_16LE -> ProfileFlag.FROM_UTF16LE;
      });
    }
    if (to != null) {
      flags.add(switch (to) {
        case UTF_8 -> ProfileFlag.TO_UTF8;
        case UTF_16BE -> ProfileFlag.TO_UTF16BE;
        case UTF_16LE -> ProfileFlag.TO_UTF16LE;
      });
    }

    boolean legacy = settings.legacyUtf8() && from == UnicodeForm.UTF_8 && to == null;
    if (legacy) {
      flags.add(ProfileFlag.LEGACY_UTF8);
    } else if (request.direction() == ConversionDirection.READ && from != null) {
      boolean decompose = settings.normalization() == NormalizationForm.NFD
          && to == UnicodeForm.UTF_8
          && decomposer != null;
      flags.add(decompose ? ProfileFlag.NORMALIZATION_D : ProfileFlag.NORMALIZATION_C);
    }
    return flags;
  }

  /**
   * Selected stages with the flags that produced them.
   *
   * @param flags derived profile flags
   * @param stages one or two stages, normalization first
   * @param handle backend handle owned by this pipeline, or {@code null}
   * @param sourceForm source encoding when it is Unicode, otherwise {@code null}
   * @param targetForm target encoding when it is Unicode, otherwise {@code null}
   */
  record Pipeline(EnumSet<ProfileFlag> flags, List<TransformStage> stages, BackendHandle handle,
      UnicodeForm sourceForm, UnicodeForm targetForm) {
    Pipeline {
      flags = EnumSet.copyOf(flags);
      stages = List.copyOf(stages);
    }

    /** Terminator width of the output encoding. */
    int terminatorWidth() {
      return targetForm == null ? 1 : targetForm.unitWidth();
    }

    List<StageKind> kinds() {
      List<StageKind> kinds = new ArrayList<>(stages.size());
      for (TransformStage stage : stages) {
        kinds.add(stage.kind());
      }
      return Collections.unmodifiableList(kinds);
    }
  }
}
