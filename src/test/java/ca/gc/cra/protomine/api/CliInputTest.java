package ca.gc.cra.protomine.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"in=x.wiki", "--Print-Schema", "-v", "revision=3"});

    assertArrayEquals(new String[] {"in=x.wiki", "revision=3"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--print-schema"));
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertFalse(input.hasFlag("--dry-run"));
  }

  @Test
  void recognizesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertFalse(CliInput.parse(null).help());
  }
}
