package ca.gc.cra.sentinel.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("security", Strings.requireNonBlank("analyzer", "  security "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("analyzer", null));
    IllegalArgumentException blank = assertThrows(IllegalArgumentException.class,
        () -> Strings.requireNonBlank("analyzer", "   "));
    assertEquals("analyzer must not be blank", blank.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("analyzer", "sec\nurity"));
  }

  @Test
  void splitIdentifiersLowerCasesAndDeduplicates() {
    assertEquals(List.of("security", "bugs"), Strings.splitIdentifiers("analyzers", "Security, ,bugs,SECURITY"));
  }

  @Test
  void splitIdentifiersRejectsEmptyListsAndOddCharacters() {
    IllegalArgumentException empty = assertThrows(IllegalArgumentException.class,
        () -> Strings.splitIdentifiers("analyzers", ", ,"));
    assertEquals("analyzers must name at least one entry", empty.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.splitIdentifiers("analyzers", "sec/urity"));
  }
}
