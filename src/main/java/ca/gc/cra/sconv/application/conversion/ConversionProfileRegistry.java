package ca.gc.cra.sconv.application.conversion;

import ca.gc.cra.sconv.application.port.MetricsPort;
import ca.gc.cra.sconv.application.port.NativeWideCodec;
import ca.gc.cra.sconv.application.port.SystemCharsetProvider;
import ca.gc.cra.sconv.domain.conversion.UnsupportedConversionException;
import ca.gc.cra.sconv.logging.Logs;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Per-archive cache of conversion profiles keyed by charset pair.
 * <p><strong>Why:</strong> Building a profile may open a backend handle and allocate buffers; an archive
 * converts thousands of names with the same few pairs.</p>
 * <p><strong>Role:</strong> Owning {@link ProfileSource}; one registry per archive handle.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return the same profile instance for repeated requests of one exact pair.</li>
 *   <li>Resolve the system charset lazily, once.</li>
 *   <li>Close every cached profile, and with it every backend handle, on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confine each registry to one thread.</p>
 * <p><strong>Performance:</strong> Hash lookup per request.</p>
 * <p><strong>Observability:</strong> Counts {@code sconv.profile.created}, {@code sconv.profile.cacheHit}
 * and {@code sconv.profile.unsupported}; logs fallbacks to best effort at WARN.</p>
 *
 * @since 0.1.0
 */
public final class ConversionProfileRegistry implements ProfileSource, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConversionProfileRegistry.class);

  private final ConversionProfileFactory factory;
  private final SystemCharsetProvider systemCharsetProvider;
  private final MetricsPort metrics;
  private final Map<CharsetPair, ConversionProfile> profiles = new HashMap<>();
  private String systemCharset;
  private boolean closed;

  public ConversionProfileRegistry(ConversionProfileFactory factory,
      SystemCharsetProvider systemCharsetProvider) {
    this.factory = Objects.requireNonNull(factory, "factory");
    this.systemCharsetProvider = Objects.requireNonNull(systemCharsetProvider,
        "systemCharsetProvider");
    this.metrics = factory.metrics();
  }

  /**
   * Returns the reading profile for the pair, building it on first use.
   *
   * @throws UnsupportedConversionException when the pair has no pipeline
   */
  public ConversionProfile get(String source, String target, boolean bestEffort)
      throws UnsupportedConversionException {
    return get(source, target, ConversionDirection.READ, bestEffort);
  }

  /**
   * Returns the profile for the pair, building it on first use. The cache is keyed by the pair
   * alone: the direction and best-effort flag of the first request decide how it was built.
   *
   * @throws UnsupportedConversionException when the pair has no pipeline
   * @throws IllegalStateException when the registry is closed
   */
  public ConversionProfile get(String source, String target, ConversionDirection direction,
      boolean bestEffort) throws UnsupportedConversionException {
    ensureOpen();
    ProfileRequest request = new ProfileRequest(source, target, direction, bestEffort);
    CharsetPair pair = request.pair();
    ConversionProfile cached = profiles.get(pair);
    if (cached != null) {
      metrics.increment("sconv.profile.cacheHit");
      return cached;
    }

    ConversionProfile profile;
    try {
      profile = factory.create(request);
    } catch (UnsupportedConversionException ex) {
      metrics.increment("sconv.profile.unsupported");
      log.warn("No conversion available from {} to {}",
          Logs.truncate(request.source()), Logs.truncate(request.target()));
      throw ex;
    }
    profiles.put(pair, profile);
    metrics.increment("sconv.profile.created");
    if (profile.stages().contains(StageKind.BEST_EFFORT)) {
      log.warn("No backend converts {} to {}; using best-effort substitution",
          Logs.truncate(request.source()), Logs.truncate(request.target()));
    } else {
      log.debug("Conversion profile created: {}", profile.describe());
    }
    return profile;
  }

  /**
   * Profile reading text stored in {@code charset} into the system charset.
   *
   * @throws UnsupportedConversionException when the pair has no pipeline
   */
  public ConversionProfile forRead(String charset, boolean bestEffort)
      throws UnsupportedConversionException {
    return get(charset, systemCharset(), ConversionDirection.READ, bestEffort);
  }

  /**
   * Profile writing system-charset text into {@code charset}.
   *
   * @throws UnsupportedConversionException when the pair has no pipeline
   */
  public ConversionProfile forWrite(String charset, boolean bestEffort)
      throws UnsupportedConversionException {
    return get(systemCharset(), charset, ConversionDirection.WRITE, bestEffort);
  }

  /** Archive-side charset of {@code profile}: its target when writing, its source when reading. */
  public static String charsetName(ConversionProfile profile) {
    Objects.requireNonNull(profile, "profile");
    return profile.hasFlag(ProfileFlag.TO_CHARSET)
        ? profile.targetCharset() : profile.sourceCharset();
  }

  @Override
  public ConversionProfile acquire(String source, String target, ConversionDirection direction,
      boolean bestEffort) throws UnsupportedConversionException {
    return get(source, target, direction, bestEffort);
  }

  /** Cached profiles stay open until the registry closes. */
  @Override
  public void release(ConversionProfile profile) {
    // Owned by the cache.
  }

  @Override
  public String systemCharset() {
    if (systemCharset == null) {
      String configured = factory.settings().systemCharset();
      systemCharset = configured.isEmpty() ? systemCharsetProvider.currentCharset() : configured;
      log.debug("System charset resolved to {}", systemCharset);
    }
    return systemCharset;
  }

  @Override
  public NativeWideCodec wideCodec() {
    return factory.wideCodec();
  }

  public ConversionProfileFactory factory() {
    return factory;
  }

  /** Number of cached profiles. */
  public int size() {
    return profiles.size();
  }

  public boolean isClosed() {
    return closed;
  }

  /** Closes every cached profile. The registry cannot be used afterwards. */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    for (ConversionProfile profile : profiles.values()) {
      profile.close();
    }
    log.debug("Closed {} conversion profiles", profiles.size());
    profiles.clear();
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("conversion profile registry is closed");
    }
  }
}
