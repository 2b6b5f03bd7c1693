package ca.gc.cra.sentinel.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("workers", 10, 1, 64));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 0, 1, 64));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("", 65, 1, 64));
    assertEquals("value must be between 1 and 64 (was 65)", ex.getMessage());
  }

  @Test
  void parseRangeTrimsInput() {
    assertEquals(250L, Numbers.parseRange("queueCapacity", " 250 ", 0, 1_000));
  }

  @Test
  void parseRangeRejectsBlankAndNonNumeric() {
    IllegalArgumentException blank = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseRange("queueCapacity", " ", 0, 1_000));
    assertEquals("queueCapacity must not be blank", blank.getMessage());
    IllegalArgumentException text = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseRange("queueCapacity", "1e3", 0, 1_000));
    assertEquals("queueCapacity must be a whole number (was '1e3')", text.getMessage());
  }
}
