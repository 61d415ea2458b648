package ca.gc.cra.logmerge.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void parsesWithinRange() {
    assertEquals(900L, Numbers.parseInRange("toleranceSeconds", " 900 ", 0, 86_400));
    assertEquals(0L, Numbers.requireRange("x", 0, 0, 1));
  }

  @Test
  void rejectsOutOfRangeAndGarbage() {
    IllegalArgumentException range = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseInRange("chunkBytes", "0", 1, 10));
    assertEquals("chunkBytes must be between 1 and 10 (was 0)", range.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInRange("chunkBytes", "12k", 1, 10));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInRange("chunkBytes", " ", 1, 10));
  }
}
