package ca.gc.cra.sconv.application.conversion;

import ca.gc.cra.sconv.application.port.NativeWideCodec;
import ca.gc.cra.sconv.application.port.SystemCharsetProvider;
import ca.gc.cra.sconv.domain.conversion.UnsupportedConversionException;
import java.util.Objects;

/**
 * Profile source without a cache: each acquisition builds a fresh profile and each release
 * closes it. Used when text is converted outside any archive handle.
 *
 * @since 0.1.0
 */
public final class TransientProfileSource implements ProfileSource {
  private final ConversionProfileFactory factory;
  private final SystemCharsetProvider systemCharsetProvider;

  public TransientProfileSource(ConversionProfileFactory factory,
      SystemCharsetProvider systemCharsetProvider) {
    this.factory = Objects.requireNonNull(factory, "factory");
    this.systemCharsetProvider = Objects.requireNonNull(systemCharsetProvider,
        "systemCharsetProvider");
  }

  @Override
  public ConversionProfile acquire(String source, String target, ConversionDirection direction,
      boolean bestEffort) throws UnsupportedConversionException {
    return factory.create(new ProfileRequest(source, target, direction, bestEffort));
  }

  @Override
  public void release(ConversionProfile profile) {
    if (profile != null) {
      profile.close();
    }
  }

  @Override
  public String systemCharset() {
    String configured = factory.settings().systemCharset();
    return configured.isEmpty() ? systemCharsetProvider.currentCharset() : configured;
  }

  @Override
  public NativeWideCodec wideCodec() {
    return factory.wideCodec();
  }
}
