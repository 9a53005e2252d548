package ca.gc.cra.rackd.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(1L, Numbers.requireRange("hostConcurrency", 1, 1, 256));
    assertEquals(256L, Numbers.requireRange("hostConcurrency", 256, 1, 256));
  }

  @Test
  void requireRangeNamesTheKey() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("timeoutSeconds", 0, 1, 300));
    assertEquals("timeoutSeconds must be between 1 and 300 (was 0)", ex.getMessage());
  }

  @Test
  void parseIntInRangeTrimsInput() {
    assertEquals(443, Numbers.parseIntInRange("customPorts", " 443 ", 1, 65_535));
  }

  @Test
  void parseIntInRangeRejectsNonIntegers() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseIntInRange("maxHosts", "1e6", 1, 10));
    assertEquals("maxHosts must be an integer (was 1e6)", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("maxHosts", " ", 1, 10));
  }
}
