package ca.gc.cra.protomine.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void parseIntAcceptsValuesInRange() {
    assertEquals(16, Numbers.parseInt("depth", " 16 ", 1, 256));
    assertEquals(1, Numbers.parseInt("depth", "1", 1, 256));
  }

  @Test
  void parseIntRejectsOutOfRange() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseInt("table", "0", 1, 10));
    assertTrue(ex.getMessage().contains("table must be between 1 and 10"));
  }

  @Test
  void parseIntRejectsGarbage() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("table", "two", 1, 10));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("table", " ", 1, 10));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseInt("table", "99999999999", 1, Integer.MAX_VALUE));
  }

  @Test
  void requireRangeReturnsValue() {
    assertEquals(5L, Numbers.requireRange("revision", 5L, 1L, Long.MAX_VALUE));
  }
}
