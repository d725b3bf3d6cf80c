package com.gentoro.reportengine.expression;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ColumnLetters}. */
class ColumnLettersTest {

  @Test
  @DisplayName("letters map to zero-based indices")
  void lettersToIndex() {
    assertEquals(0, ColumnLetters.toIndex("A"));
    assertEquals(25, ColumnLetters.toIndex("Z"));
    assertEquals(26, ColumnLetters.toIndex("AA"));
    assertEquals(51, ColumnLetters.toIndex("AZ"));
    assertEquals(52, ColumnLetters.toIndex("BA"));
    assertEquals(702, ColumnLetters.toIndex("AAA"));
  }

  @Test
  @DisplayName("indices map back to the same letters")
  void indexToLetters() {
    for (int index : new int[] {0, 25, 26, 51, 52, 701, 702, 16383}) {
      assertEquals(index, ColumnLetters.toIndex(ColumnLetters.toLetters(index)));
    }
    assertEquals("AA", ColumnLetters.toLetters(26));
    assertEquals("XFD", ColumnLetters.toLetters(16383));
  }

  @Test
  @DisplayName("lower-case letters and negative indices are rejected")
  void rejectsInvalid() {
    assertThrows(IllegalArgumentException.class, () -> ColumnLetters.toIndex("a"));
    assertThrows(IllegalArgumentException.class, () -> ColumnLetters.toIndex(""));
    assertThrows(IllegalArgumentException.class, () -> ColumnLetters.toLetters(-1));
  }
}
