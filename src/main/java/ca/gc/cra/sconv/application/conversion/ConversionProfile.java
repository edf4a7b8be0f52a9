package ca.gc.cra.sconv.application.conversion;

import ca.gc.cra.sconv.application.port.MetricsPort;
import ca.gc.cra.sconv.domain.buffer.ByteTextBuffer;
import ca.gc.cra.sconv.domain.conversion.BufferExhaustedException;
import ca.gc.cra.sconv.domain.conversion.ConversionResult;
import ca.gc.cra.sconv.domain.conversion.UnsupportedConversionException;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Converts text from one charset to another through a pipeline chosen when the
 * profile is built.
 * <p><strong>Why:</strong> Archive metadata arrives in whatever charset the archiver used; the profile
 * moves it into the system charset (or back) while recording every substitution it had to make.</p>
 * <p><strong>Role:</strong> Application service owned by a {@link ConversionProfileRegistry}, or by the
 * caller for a transient profile.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run optional normalization into the scratch buffer, then the terminal stage into the
 *       caller's buffer.</li>
 *   <li>Always produce terminated output, even when input was malformed or unmappable.</li>
 *   <li>Own and release the backend handle and scratch buffer.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; a profile and its scratch buffer belong to one
 * archive handle.</p>
 * <p><strong>Performance:</strong> Linear in the input; stages are fixed at construction.</p>
 * <p><strong>Observability:</strong> Counts {@code sconv.convert.complete} or
 * {@code sconv.convert.substituted} per call and observes {@code sconv.convert.inputBytes}.</p>
 *
 * @since 0.1.0
 */
public final class ConversionProfile implements AutoCloseable {
  private final ProfileRequest request;
  private final PipelineSelector selector;
  private final MetricsPort metrics;
  private final AllocationGuard guard;
  private final ByteTextBuffer scratch;
  private ConversionSettings settings;
  private PipelineSelector.Pipeline pipeline;
  private boolean closed;

  ConversionProfile(ProfileRequest request, PipelineSelector selector, ConversionSettings settings,
      MetricsPort metrics) throws UnsupportedConversionException {
    this.request = Objects.requireNonNull(request, "request");
    this.selector = Objects.requireNonNull(selector, "selector");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.guard = new AllocationGuard(settings.allocationPolicy(), settings.abortHandler());
    this.scratch = new ByteTextBuffer(settings.maxBufferCapacity());
    this.pipeline = selector.select(request, settings);
  }

  public String sourceCharset() {
    return request.source();
  }

  public String targetCharset() {
    return request.target();
  }

  public ConversionDirection direction() {
    return request.direction();
  }

  /** Flags derived when the pipeline was selected. */
  public Set<ProfileFlag> flags() {
    return Collections.unmodifiableSet(pipeline.flags());
  }

  public boolean hasFlag(ProfileFlag flag) {
    return pipeline.flags().contains(flag);
  }

  /** Stage kinds in execution order. */
  public List<StageKind> stages() {
    return pipeline.kinds();
  }

  /** One-line summary, e.g. {@code UTF-8 -> ISO-8859-1 [NORMALIZE_NFC, BACKEND_TRANSCODE]}. */
  public String describe() {
    return request.pair() + " " + stages();
  }

  /**
   * Converts {@code src[offset, offset + length)} and appends the result to {@code dst}. Input
   * ends early at the first zero unit: one zero byte, or two for UTF-16 sources.
   *
   * @return issues met along the way; output was produced either way
   * @throws BufferExhaustedException when the scratch buffer or {@code dst} cannot grow
   * @throws IllegalStateException when the profile is closed
   */
  public ConversionResult convert(byte[] src, int offset, int length, ByteTextBuffer dst)
      throws BufferExhaustedException {
    Objects.requireNonNull(src, "src");
    Objects.requireNonNull(dst, "dst");
    Objects.checkFromIndexSize(offset, length, src.length);
    ensureOpen();

    int n = pipeline.sourceForm() != null
        ? pipeline.sourceForm().boundedLength(src, offset, length)
        : ByteTextBuffer.boundedLength(src, offset, length);
    metrics.observe("sconv.convert.inputBytes", n);
    try {
      ConversionResult result;
      if (n == 0) {
        int width = pipeline.terminatorWidth();
        dst.reserve(dst.length() + width);
        dst.terminate(dst.length(), width);
        result = ConversionResult.complete();
      } else {
        result = runStages(src, offset, n, dst);
      }
      metrics.increment(result.isComplete()
          ? "sconv.convert.complete" : "sconv.convert.substituted");
      return result;
    } catch (BufferExhaustedException ex) {
      throw guard.onExhausted(ex);
    }
  }

  /** Converts a whole array, stopping at the first zero unit. */
  public ConversionResult convert(byte[] src, ByteTextBuffer dst) throws BufferExhaustedException {
    return convert(src, 0, src.length, dst);
  }

  /**
   * Replaces the content of {@code dst} with the converted text.
   *
   * @see #convert(byte[], int, int, ByteTextBuffer)
   */
  public ConversionResult convertInto(byte[] src, int offset, int length, ByteTextBuffer dst)
      throws BufferExhaustedException {
    Objects.requireNonNull(dst, "dst").clear();
    return convert(src, offset, length, dst);
  }

  /**
   * Turns reading of UTF-8 produced by old archivers on or off and rebuilds the pipeline. The
   * previous pipeline stays in place if the rebuild fails.
   *
   * @throws UnsupportedConversionException when the pair has no pipeline under the new setting
   */
  public void setLegacyUtf8(boolean enabled) throws UnsupportedConversionException {
    ensureOpen();
    if (settings.legacyUtf8() == enabled) {
      return;
    }
    ConversionSettings updated = settings.withLegacyUtf8(enabled);
    PipelineSelector.Pipeline rebuilt = selector.select(request, updated);
    closeHandle(pipeline);
    pipeline = rebuilt;
    settings = updated;
  }

  public boolean isClosed() {
    return closed;
  }

  /** Releases the backend handle and scratch buffer. Calling it again has no effect. */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    closeHandle(pipeline);
    scratch.free();
  }

  private ConversionResult runStages(byte[] src, int offset, int length, ByteTextBuffer dst)
      throws BufferExhaustedException {
    List<TransformStage> stages = pipeline.stages();
    if (stages.size() == 1) {
      return stages.get(0).apply(src, offset, length, dst);
    }
    scratch.clear();
    ConversionResult first = stages.get(0).apply(src, offset, length, scratch);
    ConversionResult second = stages.get(1).apply(scratch.array(), 0, scratch.length(), dst);
    return first.merge(second);
  }

  private static void closeHandle(PipelineSelector.Pipeline pipeline) {
    if (pipeline.handle() != null) {
      pipeline.handle().close();
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("conversion profile " + request.pair() + " is closed");
    }
  }

  @Override
  public String toString() {
    return "ConversionProfile[" + describe() + ", flags=" + pipeline.flags() + "]";
  }
}
