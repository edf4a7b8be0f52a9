package ca.gc.cra.sconv.testutil;

import ca.gc.cra.sconv.application.conversion.ConversionProfileFactory;
import ca.gc.cra.sconv.application.conversion.ConversionProfileRegistry;
import ca.gc.cra.sconv.application.conversion.ConversionSettings;
import ca.gc.cra.sconv.application.port.CharsetBackend;
import ca.gc.cra.sconv.application.port.MetricsPort;
import ca.gc.cra.sconv.domain.normalize.DecompositionBackend;
import ca.gc.cra.sconv.infrastructure.charset.JdkCharsetBackend;
import ca.gc.cra.sconv.infrastructure.charset.JdkNativeWideCodec;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/** Builds conversion engines with a fixed system charset so results do not depend on the host. */
public final class TestEngines {
  public static final Charset SYSTEM = StandardCharsets.ISO_8859_1;

  private TestEngines() {
    // Utility
  }

  public static ConversionProfileFactory factory() {
    return factory(new JdkCharsetBackend(), ConversionSettings.defaults(), Optional.empty(),
        MetricsPort.NO_OP);
  }

  public static ConversionProfileFactory factory(CharsetBackend backend,
      ConversionSettings settings, Optional<DecompositionBackend> decomposition,
      MetricsPort metrics) {
    return new ConversionProfileFactory(backend, new JdkNativeWideCodec(SYSTEM), decomposition,
        settings, metrics);
  }

  public static ConversionProfileRegistry registry() {
    return registry(factory());
  }

  public static ConversionProfileRegistry registry(ConversionProfileFactory factory) {
    return new ConversionProfileRegistry(factory, SYSTEM::name);
  }
}
