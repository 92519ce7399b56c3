package ca.gc.cra.brandkit.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("maxAssetBytes", 10, 1, 64));
  }

  @Test
  void requireRangeRejectsValuesBelowMinimum() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("maxAssetBytes", 0, 1, 64));
  }

  @Test
  void requireRangeRejectsValuesAboveMaximum() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("maxAssetBytes", 65, 1, 64));
  }

  @Test
  void parseRangeTrimsAndParses() {
    assertEquals(2048, Numbers.parseRange("maxAssetBytes", " 2048 ", 1, 4096));
  }

  @Test
  void parseRangeRejectsNonNumbers() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseRange("maxAssetBytes", "ten", 1, 64));
    assertTrue(ex.getMessage().contains("whole number"));
  }
}
