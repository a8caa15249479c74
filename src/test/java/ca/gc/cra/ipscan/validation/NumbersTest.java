package ca.gc.cra.ipscan.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeIsInclusive() {
    assertEquals(1, Numbers.requireRange("workers", 1, 1, 4));
    assertEquals(4, Numbers.requireRange("workers", 4, 1, 4));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 5, 1, 4));
    assertEquals("workers must be between 1 and 4 (was 5)", ex.getMessage());
  }

  @Test
  void parseIntInRangeTrimsAndValidates() {
    assertEquals(4096, Numbers.parseIntInRange("chunkSizeBytes", " 4096 ", 1, 1 << 20));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("chunkSizeBytes", "4k", 1, 10));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("chunkSizeBytes", "", 1, 10));
  }

  @Test
  void parseIntInRangeRejectsValuesBeyondIntWithoutOverflow() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseIntInRange("workers", "4294967297", 1, 256));

    assertTrue(ex.getMessage().contains("4294967297"));
  }
}
