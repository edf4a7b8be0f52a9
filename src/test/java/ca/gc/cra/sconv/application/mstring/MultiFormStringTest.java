package ca.gc.cra.sconv.application.mstring;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sconv.application.conversion.ConversionProfile;
import ca.gc.cra.sconv.application.conversion.ConversionProfileFactory;
import ca.gc.cra.sconv.application.conversion.ConversionProfileRegistry;
import ca.gc.cra.sconv.application.conversion.ConversionSettings;
import ca.gc.cra.sconv.application.port.MetricsPort;
import ca.gc.cra.sconv.domain.buffer.ByteTextBuffer;
import ca.gc.cra.sconv.domain.buffer.WideTextBuffer;
import ca.gc.cra.sconv.domain.conversion.ConversionIssue;
import ca.gc.cra.sconv.domain.conversion.ConversionResult;
import ca.gc.cra.sconv.infrastructure.charset.JdkCharsetBackend;
import ca.gc.cra.sconv.infrastructure.charset.JdkNativeWideCodec;
import ca.gc.cra.sconv.testutil.RecordingMetrics;
import ca.gc.cra.sconv.testutil.TestEngines;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class MultiFormStringTest {
  private static final String CAFE = "caf\u00e9";
  private static final byte[] CAFE_UTF8 = CAFE.getBytes(StandardCharsets.UTF_8);
  private static final byte[] CAFE_LATIN1 = CAFE.getBytes(StandardCharsets.ISO_8859_1);

  private final ConversionProfileRegistry registry = TestEngines.registry();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final MultiFormString text = new MultiFormString(registry, metrics);

  @AfterEach
  void closeRegistry() {
    registry.close();
  }

  @Test
  void utf8DerivesSystemThroughReadingProfile() throws Exception {
    text.copyInto(TextForm.UTF8, CAFE_UTF8);

    FormResult<ByteTextBuffer> system = text.system();

    assertTrue(system.isExact());
    assertArrayEquals(CAFE_LATIN1, system.value().toByteArray());
    assertEquals(EnumSet.of(TextForm.UTF8, TextForm.SYSTEM), text.forms());
    assertEquals(1, metrics.count("sconv.mstring.derived"));
  }

  @Test
  void utf8DerivesWideDirectly() throws Exception {
    text.copyInto(TextForm.UTF8, CAFE_UTF8);

    FormResult<WideTextBuffer> wide = text.wide();

    assertTrue(wide.isExact());
    assertEquals(CAFE, wide.value().toString());
    assertFalse(text.has(TextForm.SYSTEM));
  }

  @Test
  void wideDerivesUtf8DirectlyAndSystemThroughCodec() throws Exception {
    text.copyWide(CAFE);

    assertArrayEquals(CAFE_UTF8, text.utf8().value().toByteArray());
    assertArrayEquals(CAFE_LATIN1, text.system().value().toByteArray());
    assertEquals(EnumSet.allOf(TextForm.class), text.forms());
  }

  @Test
  void systemDerivesUtf8ThroughWritingProfile() throws Exception {
    text.copyInto(TextForm.SYSTEM, CAFE_LATIN1);

    FormResult<ByteTextBuffer> utf8 = text.utf8();
    FormResult<WideTextBuffer> wide = text.wide();

    assertTrue(utf8.isExact());
    assertArrayEquals(CAFE_UTF8, utf8.value().toByteArray());
    assertEquals(CAFE, wide.value().toString());
  }

  @Test
  void inexactDerivationIsReturnedButNotRemembered() throws Exception {
    text.copyWide("5\u20ac");

    FormResult<ByteTextBuffer> system = text.system();

    assertTrue(system.isPresent());
    assertFalse(system.isExact());
    assertTrue(system.result().has(ConversionIssue.UNREPRESENTABLE));
    assertEquals("5?", system.value().toString(StandardCharsets.ISO_8859_1));
    assertEquals(Set.of(TextForm.WIDE), text.forms());
  }

  @Test
  void unpairedSurrogateInWideTextIsMalformed() throws Exception {
    text.copyWide("a\ud800");

    FormResult<ByteTextBuffer> utf8 = text.utf8();

    assertTrue(utf8.result().has(ConversionIssue.MALFORMED_INPUT));
    assertEquals("a\ufffd", utf8.value().toString(StandardCharsets.UTF_8));
    assertFalse(text.has(TextForm.UTF8));
  }

  @Test
  void emptyStringHasNoForms() throws Exception {
    assertTrue(text.isEmpty());
    assertFalse(text.get(TextForm.UTF8).isPresent());
    assertFalse(text.get(TextForm.SYSTEM).isPresent());
    assertFalse(text.get(TextForm.WIDE).isPresent());
  }

  @Test
  void storingReplacesEveryOtherForm() throws Exception {
    text.copyWide(CAFE);
    text.utf8();

    text.copyInto(TextForm.SYSTEM, new byte[] {'x', 0, 'y'});

    assertEquals(Set.of(TextForm.SYSTEM), text.forms());
    assertEquals("x", text.utf8().value().toString(StandardCharsets.UTF_8));
  }

  @Test
  void nullInputClears() throws Exception {
    text.copyWide(CAFE);
    text.copyInto(TextForm.UTF8, null);
    assertTrue(text.isEmpty());

    text.copyWide(CAFE);
    text.copyWide(null);
    assertTrue(text.isEmpty());
  }

  @Test
  void wideTextIsStoredSeparately() {
    assertThrows(IllegalArgumentException.class,
        () -> text.copyInto(TextForm.WIDE, CAFE_UTF8));
  }

  @Test
  void updateDerivesEveryForm() throws Exception {
    ConversionResult result = text.update(CAFE_UTF8);

    assertTrue(result.isComplete());
    assertEquals(EnumSet.allOf(TextForm.class), text.forms());
    assertEquals(CAFE, text.wide().value().toString());
  }

  @Test
  void updateStopsAtTheFirstInexactStep() throws Exception {
    ConversionResult result = text.update("\u20ac1".getBytes(StandardCharsets.UTF_8));

    assertTrue(result.has(ConversionIssue.UNREPRESENTABLE));
    assertEquals(Set.of(TextForm.UTF8), text.forms());
  }

  @Test
  void updateWithAsciiSystemCharsetKeepsOnlyUtf8() throws Exception {
    ConversionProfileFactory factory = new ConversionProfileFactory(new JdkCharsetBackend(),
        new JdkNativeWideCodec(StandardCharsets.US_ASCII), Optional.empty(),
        ConversionSettings.defaults(), MetricsPort.NO_OP);
    try (ConversionProfileRegistry ascii = new ConversionProfileRegistry(factory,
        () -> "US-ASCII")) {
      MultiFormString asciiText = new MultiFormString(ascii);

      assertTrue(asciiText.update("cafe".getBytes(StandardCharsets.UTF_8)).isComplete());
      assertFalse(asciiText.update(CAFE_UTF8).isComplete());
      assertEquals(Set.of(TextForm.UTF8), asciiText.forms());

      FormResult<?> system = asciiText.get(TextForm.SYSTEM);
      assertTrue(system.isPresent());
      assertFalse(system.isExact());
      assertTrue(system.result().has(ConversionIssue.UNREPRESENTABLE));
      assertEquals("caf?", ((ByteTextBuffer) system.value()).toString(StandardCharsets.US_ASCII));
      assertEquals(Set.of(TextForm.UTF8), asciiText.forms());

      assertTrue(asciiText.get(TextForm.WIDE).isExact());
      assertEquals(Set.of(TextForm.UTF8, TextForm.WIDE), asciiText.forms());
    }
  }

  @Test
  void copyConvertedKeepsOnlyExactResults() throws Exception {
    ConversionProfile read = registry.forRead("UTF-8", false);

    assertTrue(text.copyConverted(CAFE_UTF8, 0, CAFE_UTF8.length, read).isComplete());
    assertEquals(Set.of(TextForm.SYSTEM), text.forms());

    byte[] euro = "\u20ac".getBytes(StandardCharsets.UTF_8);
    assertFalse(text.copyConverted(euro, 0, euro.length, read).isComplete());
    assertTrue(text.isEmpty());
  }

  @Test
  void localizedConvertsTheSystemForm() throws Exception {
    text.copyWide(CAFE);
    ConversionProfile toUtf16 = registry.forWrite("UTF-16LE", false);

    FormResult<ByteTextBuffer> localized = text.localized(toUtf16);

    assertTrue(localized.isExact());
    assertEquals(CAFE, localized.value().toString(StandardCharsets.UTF_16LE));
    assertTrue(text.has(TextForm.SYSTEM));
    assertArrayEquals(CAFE_LATIN1, text.localized(null).value().toByteArray());
  }

  @Test
  void localizedWithoutTextIsAbsent() throws Exception {
    assertFalse(text.localized(null).isPresent());
  }

  @Test
  void copyFromDuplicatesForms() throws Exception {
    text.copyWide(CAFE);
    text.utf8();
    MultiFormString copy = new MultiFormString(registry);

    copy.copyFrom(text);

    assertEquals(text.forms(), copy.forms());
    assertArrayEquals(CAFE_UTF8, copy.utf8().value().toByteArray());
  }

  @Test
  void exactFormIsReturnedWithoutConversion() throws Exception {
    text.copyInto(TextForm.UTF8, CAFE_UTF8);
    ByteTextBuffer first = text.utf8().value();

    assertSame(first, text.utf8().value());
    assertEquals(0, metrics.count("sconv.mstring.derived"));

    text.clear();
    assertTrue(text.isEmpty());
  }
}
