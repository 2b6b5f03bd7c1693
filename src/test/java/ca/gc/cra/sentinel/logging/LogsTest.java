package ca.gc.cra.sentinel.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    assertEquals("let a = 1;", Logs.truncate("let a = 1;", 64));
    assertEquals("<null>", Logs.truncate(null, 64));
  }

  @Test
  void truncateAppendsLengthMetadata() {
    assertEquals("abcd... (truncated, 4 of 10)", Logs.truncate("abcdefghij", 4));
  }

  @Test
  void truncateDropsPartialCodepoints() {
    String truncated = Logs.truncate("ééé", 3);

    assertTrue(truncated.startsWith("é... (truncated, 3 of 6)"), truncated);
  }

  @Test
  void truncateRejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }

  @Test
  void maskKeepsRecognizablePrefix() {
    assertEquals("key = \"AKIA************\"", Logs.mask("key = \"AKIAABCDEFGHIJKL\"", "AKIAABCDEFGHIJKL"));
    assertEquals("a**", Logs.mask("abc", "abc"));
    assertEquals("plain", Logs.mask("plain", " "));
  }
}
