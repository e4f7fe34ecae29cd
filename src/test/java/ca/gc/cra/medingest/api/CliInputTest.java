package ca.gc.cra.medingest.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"in=./records", "--DRY-RUN", "-v", "--no-embed"});

    assertArrayEquals(new String[] {"in=./records"}, input.keyValueArgs());
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.hasFlag("--dry-run"));
  }

  @Test
  void flagsMapToOptions() {
    CliInput input = CliInput.parse(new String[] {"--dry-run", "--no-embed", "--verbose"});

    Map<String, String> options = input.flagOptions(IngestCli.FLAGS);

    assertEquals(Map.of("dryRun", "true", "embed", "false"), options);
  }

  @Test
  void unknownOrDisallowedFlagsAreRejected() {
    CliInput input = CliInput.parse(new String[] {"--dry-run"});

    assertThrows(IllegalArgumentException.class, () -> input.flagOptions(Set.of()));
    assertThrows(IllegalArgumentException.class,
        () -> CliInput.parse(new String[] {"--turbo"}).flagOptions(IngestCli.FLAGS));
  }

  @Test
  void helpIsRecognizedInAnyForm() {
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertFalse(CliInput.parse(null).help());
  }
}
