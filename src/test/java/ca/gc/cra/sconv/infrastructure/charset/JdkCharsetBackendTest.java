package ca.gc.cra.sconv.infrastructure.charset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class JdkCharsetBackendTest {
  private final JdkCharsetBackend backend = new JdkCharsetBackend();

  @Test
  void resolvesJvmNamesAndAliases() {
    assertEquals("ISO-8859-1", JdkCharsetBackend.resolve("latin1").orElseThrow().name());
    assertEquals("UTF-8", JdkCharsetBackend.resolve(" utf8 ").orElseThrow().name());
    assertEquals("GB2312", JdkCharsetBackend.resolve("EUCCN").orElseThrow().name());
  }

  @Test
  void unknownOrIllegalNamesDoNotResolve() {
    assertTrue(JdkCharsetBackend.resolve("x-no-such-charset").isEmpty());
    assertTrue(JdkCharsetBackend.resolve("bad name").isEmpty());
    assertTrue(JdkCharsetBackend.resolve("").isEmpty());
    assertTrue(JdkCharsetBackend.resolve(null).isEmpty());
  }

  @Test
  void aliasesOfOneCharsetAreTheSameCharset() {
    assertTrue(backend.sameCharset("ISO-8859-1", "latin1"));
    assertTrue(backend.sameCharset("x-custom", "X-CUSTOM"));
    assertFalse(backend.sameCharset("ISO-8859-1", "ISO-8859-2"));
    assertFalse(backend.sameCharset("x-one", "x-two"));
  }

  @Test
  void opensOnlyWhenBothNamesResolve() {
    assertTrue(backend.open("UTF-8", "ISO-8859-15").isPresent());
    assertTrue(backend.open("UTF-8", "x-no-such-charset").isEmpty());
    assertEquals("jdk", backend.name());
  }

  @Test
  void noBackendResolvesNothing() {
    NoCharsetBackend none = new NoCharsetBackend();
    assertTrue(none.open("UTF-8", "ISO-8859-1").isEmpty());
    assertTrue(none.sameCharset("utf-8", "UTF-8"));
    assertEquals("none", none.name());
  }
}
