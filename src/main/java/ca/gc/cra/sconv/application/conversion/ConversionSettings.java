package ca.gc.cra.sconv.application.conversion;

import ca.gc.cra.sconv.domain.buffer.AbortHandler;
import ca.gc.cra.sconv.domain.buffer.BufferGrowth;
import ca.gc.cra.sconv.domain.normalize.NfcComposer;
import java.util.Objects;

/**
 * Per-registry conversion settings handed to every profile it builds.
 *
 * @param legacyUtf8 reinterpret UTF-8 the way old archivers wrote it
 * @param normalization form applied to Unicode text read from archives
 * @param normalizationRunLimit combining marks examined after one base during composition
 * @param allocationPolicy how buffer exhaustion is surfaced
 * @param abortHandler handler invoked under {@link AllocationPolicy#FATAL}
 * @param maxBufferCapacity upper bound for scratch buffers owned by profiles
 * @param systemCharset explicit system charset, or blank to ask the platform
 * @since 0.1.0
 */
public record ConversionSettings(
    boolean legacyUtf8,
    NormalizationForm normalization,
    int normalizationRunLimit,
    AllocationPolicy allocationPolicy,
    AbortHandler abortHandler,
    int maxBufferCapacity,
    String systemCharset) {

  public ConversionSettings {
    Objects.requireNonNull(normalization, "normalization");
    Objects.requireNonNull(allocationPolicy, "allocationPolicy");
    Objects.requireNonNull(abortHandler, "abortHandler");
    if (normalizationRunLimit < 2) {
      throw new IllegalArgumentException("normalizationRunLimit must be at least 2");
    }
    if (maxBufferCapacity <= 0) {
      throw new IllegalArgumentException("maxBufferCapacity must be positive");
    }
    systemCharset = systemCharset == null ? "" : systemCharset.trim();
  }

  /** Settings matching the defaults of the configuration layer. */
  public static ConversionSettings defaults() {
    return new ConversionSettings(
        false,
        NormalizationForm.NFC,
        NfcComposer.DEFAULT_RUN_LIMIT,
        AllocationPolicy.RECOVERABLE,
        AbortHandler.HALT,
        BufferGrowth.MAX_ARRAY_CAPACITY,
        "");
  }

  public ConversionSettings withLegacyUtf8(boolean enabled) {
    return new ConversionSettings(enabled, normalization, normalizationRunLimit, allocationPolicy,
        abortHandler, maxBufferCapacity, systemCharset);
  }

  public ConversionSettings withSystemCharset(String charset) {
    return new ConversionSettings(legacyUtf8, normalization, normalizationRunLimit,
        allocationPolicy, abortHandler, maxBufferCapacity, charset);
  }

  public ConversionSettings withAllocation(AllocationPolicy policy, AbortHandler handler) {
    return new ConversionSettings(legacyUtf8, normalization, normalizationRunLimit, policy,
        handler, maxBufferCapacity, systemCharset);
  }

  public ConversionSettings withNormalization(NormalizationForm form, int runLimit) {
    return new ConversionSettings(legacyUtf8, form, runLimit, allocationPolicy, abortHandler,
        maxBufferCapacity, systemCharset);
  }

  public ConversionSettings withMaxBufferCapacity(int capacity) {
    return new ConversionSettings(legacyUtf8, normalization, normalizationRunLimit,
        allocationPolicy, abortHandler, capacity, systemCharset);
  }
}
