package ca.gc.cra.sconv.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {
        "from=CP932", "--Best-Effort", "-v", "--to=UTF-8", " "});

    assertArrayEquals(new String[] {"from=CP932", "--to=UTF-8"}, input.keyValueArgs());
    assertTrue(input.bestEffort());
    assertTrue(input.verbose());
    assertTrue(input.hasFlag("--debug"));
    assertFalse(input.help());
    assertEquals(Set.of("--best-effort", "--verbose"), input.flags());
  }

  @Test
  void recognisesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"HELP"}).help());
  }

  @Test
  void bareWordsStayWithThePairs() {
    CliInput input = CliInput.parse(new String[] {"convert", "in=a"});

    assertArrayEquals(new String[] {"convert", "in=a"}, input.keyValueArgs());
  }

  @Test
  void emptyInputHasNothing() {
    CliInput input = CliInput.parse(null);

    assertArrayEquals(new String[0], input.keyValueArgs());
    assertTrue(input.flags().isEmpty());
    assertFalse(input.hasFlag(" "));
  }

  @Test
  void keyValueArgumentsAreCopied() {
    CliInput input = CliInput.parse(new String[] {"in=a"});
    input.keyValueArgs()[0] = "in=b";

    assertArrayEquals(new String[] {"in=a"}, input.keyValueArgs());
  }
}
