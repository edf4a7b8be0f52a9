package ca.gc.cra.sconv.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"from=CP932", " to = UTF-8 "});
    assertEquals("CP932", map.get("from"));
    assertEquals("UTF-8", map.get("to"));
  }

  @Test
  void acceptsDashedKeysAndEmptyValues() {
    Map<String, String> map =
        CliArgsParser.toMap(new String[] {"--config=sconv.yaml", "systemCharset="});
    assertEquals("sconv.yaml", map.get("config"));
    assertEquals("", map.get("systemCharset"));
  }

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map =
        CliArgsParser.toMap(new String[] {"otelResourceAttributes=team=archive"});
    assertEquals("team=archive", map.get("otelResourceAttributes"));
  }

  @Test
  void skipsNullAndBlankArguments() {
    assertTrue(CliArgsParser.toMap(new String[] {null, "  "}).isEmpty());
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"=UTF-8"}));
    assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"bad key=x"}));
    assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"from=UTF\u00078"}));
  }

  @Test
  void rejectsRepeatedKeys() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"from=UTF-8", "--from=CP932"}));
    assertEquals("argument from given more than once", ex.getMessage());
  }
}
