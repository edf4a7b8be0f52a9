package ca.gc.cra.sconv.application.conversion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sconv.domain.conversion.UnsupportedConversionException;
import ca.gc.cra.sconv.infrastructure.charset.JdkCharsetBackend;
import ca.gc.cra.sconv.infrastructure.charset.NoCharsetBackend;
import ca.gc.cra.sconv.testutil.RecordingMetrics;
import ca.gc.cra.sconv.testutil.TestEngines;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ConversionProfileRegistryTest {
  private Logger logger;
  private ListAppender<ILoggingEvent> appender;
  private final RecordingMetrics metrics = new RecordingMetrics();

  @BeforeEach
  void attachAppender() {
    logger = (Logger) LoggerFactory.getLogger(ConversionProfileRegistry.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    logger.setAdditive(false);
  }

  @AfterEach
  void detachAppender() {
    logger.detachAppender(appender);
    logger.setAdditive(true);
  }

  private ConversionProfileRegistry registry(boolean withBackend) {
    return TestEngines.registry(TestEngines.factory(
        withBackend ? new JdkCharsetBackend() : new NoCharsetBackend(),
        ConversionSettings.defaults(), Optional.empty(), metrics));
  }

  @Test
  void repeatedRequestsShareOneProfile() throws Exception {
    try (ConversionProfileRegistry registry = registry(true)) {
      ConversionProfile first = registry.get("UTF-8", "ISO-8859-1", false);
      ConversionProfile second = registry.get("UTF-8", "ISO-8859-1", false);

      assertSame(first, second);
      assertEquals(1, registry.size());
      assertEquals(1, metrics.count("sconv.profile.created"));
      assertEquals(1, metrics.count("sconv.profile.cacheHit"));
    }
  }

  @Test
  void firstRequestDecidesDirection() throws Exception {
    try (ConversionProfileRegistry registry = registry(true)) {
      ConversionProfile read = registry.get("UTF-8", "ISO-8859-1", ConversionDirection.READ, false);
      ConversionProfile write =
          registry.get("UTF-8", "ISO-8859-1", ConversionDirection.WRITE, true);

      assertSame(read, write);
      assertEquals(ConversionDirection.READ, write.direction());
    }
  }

  @Test
  void pairsAreCachedSeparately() throws Exception {
    try (ConversionProfileRegistry registry = registry(true)) {
      assertNotSame(registry.get("UTF-8", "ISO-8859-1", false),
          registry.get("ISO-8859-1", "UTF-8", false));
      assertEquals(2, registry.size());
    }
  }

  @Test
  void readAndWriteUseTheSystemCharset() throws Exception {
    try (ConversionProfileRegistry registry = registry(true)) {
      ConversionProfile read = registry.forRead("UTF-16LE", false);
      ConversionProfile write = registry.forWrite("UTF-8", false);

      assertEquals("ISO-8859-1", read.targetCharset());
      assertEquals("UTF-16LE", ConversionProfileRegistry.charsetName(read));
      assertEquals("ISO-8859-1", write.sourceCharset());
      assertTrue(write.hasFlag(ProfileFlag.TO_CHARSET));
      assertEquals("UTF-8", ConversionProfileRegistry.charsetName(write));
    }
  }

  @Test
  void configuredSystemCharsetWinsOverPlatform() throws Exception {
    ConversionProfileFactory factory = TestEngines.factory(new JdkCharsetBackend(),
        ConversionSettings.defaults().withSystemCharset("UTF-8"), Optional.empty(), metrics);
    try (ConversionProfileRegistry registry = new ConversionProfileRegistry(factory,
        () -> "ISO-8859-1")) {
      assertEquals("UTF-8", registry.systemCharset());
    }
  }

  @Test
  void unsupportedPairIsCountedAndNotCached() {
    try (ConversionProfileRegistry registry = registry(false)) {
      assertThrows(UnsupportedConversionException.class,
          () -> registry.get("ISO-8859-1", "KOI8-R", false));

      assertEquals(0, registry.size());
      assertEquals(1, metrics.count("sconv.profile.unsupported"));
      assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.WARN
          && e.getFormattedMessage().contains("No conversion available")));
    }
  }

  @Test
  void bestEffortFallbackIsLoggedAtWarn() throws Exception {
    try (ConversionProfileRegistry registry = registry(false)) {
      registry.get("ISO-8859-1", "KOI8-R", true);

      assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.WARN
          && e.getFormattedMessage().contains("best-effort substitution")));
    }
  }

  @Test
  void closeReleasesProfilesAndRejectsLaterRequests() throws Exception {
    ConversionProfileRegistry registry = registry(true);
    ConversionProfile profile = registry.get("UTF-8", "ISO-8859-1", false);

    registry.close();

    assertTrue(profile.isClosed());
    assertTrue(registry.isClosed());
    assertEquals(0, registry.size());
    assertThrows(IllegalStateException.class, () -> registry.get("UTF-8", "UTF-16LE", false));
  }

  @Test
  void releaseLeavesCachedProfilesOpen() throws Exception {
    try (ConversionProfileRegistry registry = registry(true)) {
      ConversionProfile profile =
          registry.acquire("UTF-8", "ISO-8859-1", ConversionDirection.READ, false);
      registry.release(profile);
      assertFalse(profile.isClosed());
    }
  }

  @Test
  void transientSourceClosesOnRelease() throws Exception {
    TransientProfileSource source =
        new TransientProfileSource(TestEngines.factory(), () -> "ISO-8859-1");
    ConversionProfile first =
        source.acquire("UTF-8", "ISO-8859-1", ConversionDirection.READ, false);
    ConversionProfile second =
        source.acquire("UTF-8", "ISO-8859-1", ConversionDirection.READ, false);

    assertNotSame(first, second);
    source.release(first);
    assertTrue(first.isClosed());
    assertEquals("ISO-8859-1", source.systemCharset());
    second.close();
  }
}
