package ca.gc.cra.sentinel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
  @TempDir Path tempDir;

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
  void helpWithoutCommandListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("analyze     Run analyzers over a directory"));
  }

  @Test
  void missingCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: sentinel analyze"));
  }

  @Test
  void unknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
  }

  @Test
  void delegatesToAnalyzeKeepingFlagsBeforeCommand() throws Exception {
    Files.writeString(tempDir.resolve("a.js"), "let a = 1;\n");

    ExitCode code = Main.run(new String[] {"--dry-run", "ANALYZE", "root=" + tempDir});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Analyze dry-run"));
  }

  @Test
  void exitCodesAreStable() {
    assertEquals(0, ExitCode.SUCCESS.code());
    assertEquals(1, ExitCode.FINDINGS.code());
    assertEquals(2, ExitCode.INVALID_ARGS.code());
    assertEquals(4, ExitCode.CONFIG_ERROR.code());
    assertEquals(130, ExitCode.INTERRUPTED.code());
  }
}
