package ca.gc.cra.dataflow.api;

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
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void noArgumentsPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: dataflow"));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"help"}));
    assertTrue(buffer.toString().contains("Commands:"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"explode"}));
  }

  @Test
  void runHelpIsDelegated() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"RUN", "--help"}));
    assertTrue(buffer.toString().contains("in=PATH"));
  }

  @Test
  void exitCodesAreStable() {
    assertEquals(0, ExitCode.SUCCESS.code());
    assertEquals(2, ExitCode.INVALID_ARGS.code());
    assertEquals(130, ExitCode.INTERRUPTED.code());
  }
}
