package ca.gc.cra.medingest.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: medingest <ingest|search>"));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("search      Similarity search"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
  }

  @Test
  void dispatchesRemainingArgumentsToCommand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"ingest", "--help"}));
    assertTrue(buffer.toString().contains("medingest ingest"));

    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"search", "topK=2"}));
    assertTrue(buffer.toString().contains("usage: search"));
  }

  @Test
  void exitCodesFollowFailureType() {
    assertEquals(ExitCode.IO_ERROR, ExitCode.forFailure(new java.io.IOException("disk")));
    assertEquals(ExitCode.CONFIG_ERROR, ExitCode.forFailure(new IllegalStateException("state")));
    assertEquals(ExitCode.INTERRUPTED, ExitCode.forFailure(new InterruptedException()));
    assertEquals(ExitCode.RUNTIME_FAILURE, ExitCode.forFailure(new RuntimeException("boom")));
    assertEquals(130, ExitCode.INTERRUPTED.code());
  }
}
