package ca.gc.cra.sconv.config;

import ca.gc.cra.sconv.application.conversion.AllocationPolicy;
import ca.gc.cra.sconv.application.conversion.ConversionSettings;
import ca.gc.cra.sconv.application.conversion.NormalizationForm;
import ca.gc.cra.sconv.domain.buffer.AbortHandler;
import ca.gc.cra.sconv.domain.buffer.BufferGrowth;
import ca.gc.cra.sconv.domain.normalize.NfcComposer;
import ca.gc.cra.sconv.validation.Numbers;
import ca.gc.cra.sconv.validation.Strings;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable conversion configuration assembled from defaults, files and CLI
 * arguments.
 * <p><strong>Why:</strong> Keeps every tunable in one validated record before the composition root
 * wires adapters from it.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param systemCharset system charset override; blank discovers it from the JVM
 * @param backend charset backend variant
 * @param legacyUtf8 whether UTF-8 names are read as truncated wide characters
 * @param normalization normalization applied when reading Unicode names
 * @param normalizationRunLimit longest combining run recomposed at once, 2 to 64
 * @param allocationPolicy reaction to buffer exhaustion
 * @param maxBufferCapacity largest buffer a conversion may grow
 * @param metricsExporter {@code none} or {@code otlp}
 * @param verbose whether DEBUG logging is enabled
 * @since 0.1.0
 */
public record ConversionConfig(
    String systemCharset,
    BackendVariant backend,
    boolean legacyUtf8,
    NormalizationForm normalization,
    int normalizationRunLimit,
    AllocationPolicy allocationPolicy,
    int maxBufferCapacity,
    String metricsExporter,
    boolean verbose) {

  public static final int MIN_RUN_LIMIT = 2;
  public static final int MAX_RUN_LIMIT = 64;

  public ConversionConfig {
    systemCharset = systemCharset == null ? "" : systemCharset.trim();
    if (!systemCharset.isEmpty()) {
      systemCharset = Strings.requireCharsetName("systemCharset", systemCharset);
    }
    Objects.requireNonNull(backend, "backend");
    Objects.requireNonNull(normalization, "normalization");
    Objects.requireNonNull(allocationPolicy, "allocationPolicy");
    Numbers.requireRange("normalizationRunLimit", normalizationRunLimit, MIN_RUN_LIMIT,
        MAX_RUN_LIMIT);
    Numbers.requireRange("maxBufferCapacity", maxBufferCapacity, 16,
        BufferGrowth.MAX_ARRAY_CAPACITY);
    metricsExporter = metricsExporter == null || metricsExporter.isBlank()
        ? "none" : metricsExporter.trim().toLowerCase(Locale.ROOT);
    if (!metricsExporter.equals("none") && !metricsExporter.equals("otlp")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
  }

  /** Defaults used when no file or argument sets a value. */
  public static ConversionConfig defaults() {
    return new ConversionConfig(
        "",
        BackendVariant.EXTERNAL_CODEC,
        false,
        NormalizationForm.NFC,
        NfcComposer.DEFAULT_RUN_LIMIT,
        AllocationPolicy.RECOVERABLE,
        BufferGrowth.MAX_ARRAY_CAPACITY,
        "none",
        false);
  }

  /**
   * Builds a configuration from a flat key/value map, typically the output of
   * {@link ConfigMerger}. Missing keys take their defaults.
   *
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static ConversionConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    ConversionConfig defaults = defaults();
    BackendVariant backend = BackendVariant.fromString(values.get("backend"));
    String rawNormalization = values.get("normalization");
    NormalizationForm normalization = rawNormalization == null || rawNormalization.isBlank()
        ? (backend == BackendVariant.PLATFORM_DECOMPOSITION ? NormalizationForm.NFD
            : NormalizationForm.NFC)
        : NormalizationForm.parse(rawNormalization);
    return new ConversionConfig(
        values.getOrDefault("systemCharset", defaults.systemCharset()),
        backend,
        parseBoolean("legacyUtf8", values.get("legacyUtf8"), defaults.legacyUtf8()),
        normalization,
        parseInt("normalizationRunLimit", values.get("normalizationRunLimit"),
            defaults.normalizationRunLimit(), MIN_RUN_LIMIT, MAX_RUN_LIMIT),
        AllocationPolicy.parse(values.get("allocationPolicy")),
        parseInt("maxBufferCapacity", values.get("maxBufferCapacity"),
            defaults.maxBufferCapacity(), 16, BufferGrowth.MAX_ARRAY_CAPACITY),
        values.getOrDefault("metricsExporter", defaults.metricsExporter()),
        parseBoolean("verbose", values.get("verbose"), defaults.verbose()));
  }

  /** Conversion settings shared by every profile built from this configuration. */
  public ConversionSettings toSettings(AbortHandler abortHandler) {
    return new ConversionSettings(
        legacyUtf8,
        normalization,
        normalizationRunLimit,
        allocationPolicy,
        abortHandler,
        maxBufferCapacity,
        systemCharset);
  }

  private static int parseInt(String name, String raw, int fallback, int min, int max) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseIntInRange(name, raw, min, max);
  }

  private static boolean parseBoolean(String name, String raw, boolean fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(
          name + " must be true or false (was " + raw + ")");
    };
  }
}
