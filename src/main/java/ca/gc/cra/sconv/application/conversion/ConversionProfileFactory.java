package ca.gc.cra.sconv.application.conversion;

import ca.gc.cra.sconv.application.port.CharsetBackend;
import ca.gc.cra.sconv.application.port.MetricsPort;
import ca.gc.cra.sconv.application.port.NativeWideCodec;
import ca.gc.cra.sconv.domain.conversion.UnsupportedConversionException;
import ca.gc.cra.sconv.domain.normalize.DecompositionBackend;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds conversion profiles from the adapters chosen at startup.
 *
 * @since 0.1.0
 */
public final class ConversionProfileFactory {
  private final CharsetBackend backend;
  private final NativeWideCodec wideCodec;
  private final ConversionSettings settings;
  private final MetricsPort metrics;
  private final PipelineSelector selector;

  /**
   * @param backend charset backend consulted for non-Unicode pairs
   * @param wideCodec codec for the system charset
   * @param decomposition optional NFD service; NFD is only selected when present
   * @param settings settings applied to every profile
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public ConversionProfileFactory(CharsetBackend backend, NativeWideCodec wideCodec,
      Optional<DecompositionBackend> decomposition, ConversionSettings settings,
      MetricsPort metrics) {
    this.backend = Objects.requireNonNull(backend, "backend");
    this.wideCodec = Objects.requireNonNull(wideCodec, "wideCodec");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.selector = new PipelineSelector(backend, wideCodec, decomposition);
  }

  /**
   * Builds a new profile; the caller owns it.
   *
   * @throws UnsupportedConversionException when the pair has no pipeline
   */
  public ConversionProfile create(ProfileRequest request) throws UnsupportedConversionException {
    return new ConversionProfile(request, selector, settings, metrics);
  }

  public CharsetBackend backend() {
    return backend;
  }

  public NativeWideCodec wideCodec() {
    return wideCodec;
  }

  public ConversionSettings settings() {
    return settings;
  }

  public MetricsPort metrics() {
    return metrics;
  }
}
