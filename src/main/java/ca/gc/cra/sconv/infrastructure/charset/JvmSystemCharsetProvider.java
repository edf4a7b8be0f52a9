package ca.gc.cra.sconv.infrastructure.charset;

import ca.gc.cra.sconv.application.port.SystemCharsetProvider;
import java.nio.charset.Charset;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Reports the charset the JVM uses for file names: {@code sun.jnu.encoding}, then
 * {@code file.encoding}, then {@link Charset#defaultCharset()}.
 *
 * @since 0.1.0
 */
public final class JvmSystemCharsetProvider implements SystemCharsetProvider {
  private final UnaryOperator<String> properties;

  public JvmSystemCharsetProvider() {
    this(System::getProperty);
  }

  JvmSystemCharsetProvider(UnaryOperator<String> properties) {
    this.properties = properties;
  }

  @Override
  public String currentCharset() {
    for (String key : new String[] {"sun.jnu.encoding", "file.encoding"}) {
      Optional<Charset> charset = JdkCharsetBackend.resolve(properties.apply(key));
      if (charset.isPresent()) {
        return charset.get().name();
      }
    }
    return Charset.defaultCharset().name();
  }
}
