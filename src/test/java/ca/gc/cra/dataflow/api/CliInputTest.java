package ca.gc.cra.dataflow.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValueTokens() {
    CliInput input = CliInput.parse(new String[] {"in=a.txt", "-V", "--dry-run", " ", "top=3"});

    assertArrayEquals(new String[] {"in=a.txt", "top=3"}, input.tokens());
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.hasFlag("--DRY-RUN"));
  }

  @Test
  void recognisesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"--HELP"}).help());
  }

  @Test
  void emptyArgumentsHaveNoTokens() {
    CliInput input = CliInput.parse(null);

    assertArrayEquals(new String[0], input.tokens());
    assertFalse(input.verbose());
  }
}
