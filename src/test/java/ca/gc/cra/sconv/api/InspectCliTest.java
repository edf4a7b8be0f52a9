package ca.gc.cra.sconv.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InspectCliTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void printsReadingPipeline() {
    ExitCode code = InspectCli.run(new String[] {"from=UTF-8", "to=ISO-8859-1"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("profile: UTF-8 -> ISO-8859-1"));
    assertTrue(output.contains("direction: READ"));
    assertTrue(output.contains("backend: jdk"));
    assertTrue(output.contains("FROM_UTF8"));
    assertTrue(output.contains("stages: [NORMALIZE_NFC, BACKEND_TRANSCODE]"));
  }

  @Test
  void writingUnicodeSkipsNormalization() {
    ExitCode code = InspectCli.run(new String[] {
        "from=UTF-8", "to=UTF-16LE", "direction=write"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("stages: [UNICODE_TRANSCODE]"));
    assertTrue(buffer.toString().contains("TO_CHARSET"));
  }

  @Test
  void legacySettingSelectsReinterpretation() {
    ExitCode code = InspectCli.run(new String[] {
        "from=UTF-8", "to=ISO-8859-1", "legacyUtf8=true"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("stages: [LEGACY_REINTERPRET]"));
  }

  @Test
  void unsupportedPairReturnsExitSix() {
    ExitCode code = InspectCli.run(new String[] {"backend=NONE", "from=CP932", "to=UTF-8"});

    assertEquals(ExitCode.UNSUPPORTED_CONVERSION, code);
    assertEquals(6, code.code());
  }

  @Test
  void invalidDirectionIsRejected() {
    ExitCode code = InspectCli.run(new String[] {"from=UTF-8", "direction=both"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: inspect"));
  }
}
