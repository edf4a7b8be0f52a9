package ca.gc.cra.sconv.config;

import ca.gc.cra.sconv.application.conversion.ConversionProfileFactory;
import ca.gc.cra.sconv.application.conversion.ConversionProfileRegistry;
import ca.gc.cra.sconv.application.conversion.ConversionSettings;
import ca.gc.cra.sconv.application.conversion.TransientProfileSource;
import ca.gc.cra.sconv.application.mstring.MultiFormString;
import ca.gc.cra.sconv.application.port.CharsetBackend;
import ca.gc.cra.sconv.application.port.MetricsPort;
import ca.gc.cra.sconv.application.port.NativeWideCodec;
import ca.gc.cra.sconv.application.port.SystemCharsetProvider;
import ca.gc.cra.sconv.domain.buffer.AbortHandler;
import ca.gc.cra.sconv.domain.normalize.DecompositionBackend;
import ca.gc.cra.sconv.infrastructure.charset.CodepageCharsetBackend;
import ca.gc.cra.sconv.infrastructure.charset.JdkCharsetBackend;
import ca.gc.cra.sconv.infrastructure.charset.JdkNativeWideCodec;
import ca.gc.cra.sconv.infrastructure.charset.JvmSystemCharsetProvider;
import ca.gc.cra.sconv.infrastructure.charset.NoCharsetBackend;
import ca.gc.cra.sconv.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.sconv.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.sconv.infrastructure.normalize.IcuDecompositionBackend;
import java.nio.charset.Charset;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the conversion engine to concrete
 * adapters.
 * <p><strong>Why:</strong> Provides a single place to translate {@link ConversionConfig} into a
 * profile factory and registries.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the charset backend and optional decomposition backend for the configured
 *       variant.</li>
 *   <li>Resolve the system charset and build the native wide codec for it.</li>
 *   <li>Own the metrics adapter and release it on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The root itself is immutable after construction; registries
 * it creates are single-threaded.</p>
 * <p><strong>Observability:</strong> Logs the selected backend at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final ConversionConfig config;
  private final SystemCharsetProvider systemCharsetProvider;
  private final CharsetBackend backend;
  private final Optional<DecompositionBackend> decomposition;
  private final NativeWideCodec wideCodec;
  private final MetricsPort metrics;
  private final ConversionProfileFactory factory;

  public CompositionRoot(ConversionConfig config) {
    this(config, new JvmSystemCharsetProvider(), AbortHandler.HALT, null);
  }

  /**
   * Wires adapters with explicit collaborators.
   *
   * @param config effective configuration
   * @param systemCharsetProvider source of the system charset when the config leaves it blank
   * @param abortHandler handler used by the fatal allocation policy
   * @param metrics metrics port to use, or {@code null} to build one from the config
   */
  public CompositionRoot(ConversionConfig config, SystemCharsetProvider systemCharsetProvider,
      AbortHandler abortHandler, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.systemCharsetProvider = Objects.requireNonNull(systemCharsetProvider,
        "systemCharsetProvider");
    this.backend = createBackend(config.backend());
    this.decomposition = config.backend() == BackendVariant.PLATFORM_DECOMPOSITION
        ? Optional.of(new IcuDecompositionBackend())
        : Optional.empty();
    String systemCharset = config.systemCharset().isEmpty()
        ? systemCharsetProvider.currentCharset()
        : config.systemCharset();
    this.wideCodec = new JdkNativeWideCodec(resolveSystemCharset(systemCharset));
    this.metrics = metrics != null ? metrics : createMetrics(config.metricsExporter());
    ConversionSettings settings = config.toSettings(Objects.requireNonNull(abortHandler,
        "abortHandler")).withSystemCharset(systemCharset);
    this.factory = new ConversionProfileFactory(backend, wideCodec, decomposition, settings,
        this.metrics);
    log.debug("Conversion engine wired: backend={}, decomposition={}, systemCharset={}",
        backend.name(), decomposition.map(DecompositionBackend::name).orElse("none"),
        systemCharset);
  }

  public ConversionConfig config() {
    return config;
  }

  public CharsetBackend charsetBackend() {
    return backend;
  }

  public Optional<DecompositionBackend> decompositionBackend() {
    return decomposition;
  }

  public NativeWideCodec wideCodec() {
    return wideCodec;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ConversionProfileFactory profileFactory() {
    return factory;
  }

  /** New registry, one per archive handle. The caller closes it. */
  public ConversionProfileRegistry newRegistry() {
    return new ConversionProfileRegistry(factory, systemCharsetProvider);
  }

  /** Profile source that builds and closes a profile around every conversion. */
  public TransientProfileSource transientProfiles() {
    return new TransientProfileSource(factory, systemCharsetProvider);
  }

  /** New multi-form string converting through {@code registry}. */
  public MultiFormString newString(ConversionProfileRegistry registry) {
    return new MultiFormString(registry, metrics);
  }

  /** Flushes and releases the metrics adapter when this root created it. */
  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }

  private static CharsetBackend createBackend(BackendVariant variant) {
    return switch (variant) {
      case NONE -> new NoCharsetBackend();
      case EXTERNAL_CODEC, PLATFORM_DECOMPOSITION -> new JdkCharsetBackend();
      case PLATFORM_CODEPAGE -> new CodepageCharsetBackend();
    };
  }

  private static Charset resolveSystemCharset(String name) {
    Optional<Charset> charset = JdkCharsetBackend.resolve(name);
    if (charset.isEmpty() || !charset.get().canEncode()) {
      log.warn("System charset {} is not available; using {}", name, Charset.defaultCharset());
      return Charset.defaultCharset();
    }
    return charset.get();
  }

  private static MetricsPort createMetrics(String exporter) {
    if ("otlp".equals(exporter)) {
      return OpenTelemetryMetricsAdapter.forExporter(exporter);
    }
    return new NoOpMetricsAdapter();
  }
}
