package ca.gc.cra.sconv.infrastructure.charset;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.charset.Charset;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JvmSystemCharsetProviderTest {

  private static JvmSystemCharsetProvider provider(Map<String, String> properties) {
    return new JvmSystemCharsetProvider(properties::get);
  }

  @Test
  void prefersTheFileNameEncoding() {
    JvmSystemCharsetProvider provider = provider(Map.of(
        "sun.jnu.encoding", "ANSI_X3.4-1968",
        "file.encoding", "UTF-8"));

    assertEquals("US-ASCII", provider.currentCharset());
  }

  @Test
  void fallsBackToFileEncoding() {
    assertEquals("ISO-8859-1",
        provider(Map.of("sun.jnu.encoding", "x-bogus", "file.encoding", "latin1"))
            .currentCharset());
  }

  @Test
  void defaultsToTheJvmDefaultCharset() {
    assertEquals(Charset.defaultCharset().name(), provider(Map.of()).currentCharset());
  }

  @Test
  void readsRealSystemProperties() {
    String name = new JvmSystemCharsetProvider().currentCharset();
    assertEquals(name, Charset.forName(name).name());
  }
}
