package ca.gc.cra.rackd.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValueArguments() {
    CliInput input = CliInput.parse(new String[] {"scan", "subnet=10.0.0.0/24", "--DRY-RUN", "-v"});

    assertArrayEquals(new String[] {"scan", "subnet=10.0.0.0/24"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void recognizesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"HELP"}).help());
    assertTrue(CliInput.parse(new String[] {"--help"}).hasFlag("--help"));
  }

  @Test
  void dashedKeyValueStaysInKeyValuePartition() {
    CliInput input = CliInput.parse(new String[] {"--config=rackd.yaml"});

    assertArrayEquals(new String[] {"--config=rackd.yaml"}, input.keyValueArgs());
    assertTrue(input.flags().isEmpty());
  }

  @Test
  void emptyInputHasNoFlags() {
    CliInput input = CliInput.parse(null);

    assertArrayEquals(new String[0], input.keyValueArgs());
    assertFalse(input.hasFlag(" "));
  }
}
