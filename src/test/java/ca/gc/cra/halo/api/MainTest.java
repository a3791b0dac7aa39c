package ca.gc.cra.halo.api;

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
  void captureOutput() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    String out = buffer.toString();
    assertTrue(out.contains("live"));
    assertTrue(out.contains("session"));
    assertTrue(out.contains("view"));
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: halo <live|session|view>"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"replay", "in=x.json"}));
    assertTrue(buffer.toString().contains("usage: halo"));
  }

  @Test
  void dispatchesToCommandHelp() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"VIEW", "--help"}));
    assertTrue(buffer.toString().contains("HALO results viewer"));
  }
}
