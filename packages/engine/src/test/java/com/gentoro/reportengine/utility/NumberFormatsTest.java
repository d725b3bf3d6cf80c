package com.gentoro.reportengine.utility;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link NumberFormats}. */
class NumberFormatsTest {

  @Nested
  class Repr {

    @Test
    @DisplayName("whole doubles keep a fractional part")
    void wholeDoubles() {
      assertEquals("4000.0", NumberFormats.repr(4000.0));
      assertEquals("-2.0", NumberFormats.repr(-2.0));
      assertEquals("0.1", NumberFormats.repr(0.1));
    }

    @Test
    @DisplayName("very small and very large values use exponent notation")
    void exponentNotation() {
      assertEquals("1e-05", NumberFormats.repr(1e-5));
      assertEquals("0.0001", NumberFormats.repr(1e-4));
      assertEquals("1e+16", NumberFormats.repr(1e16));
      assertEquals("1.5e+20", NumberFormats.repr(1.5e20));
    }

    @Test
    @DisplayName("non-finite values")
    void nonFinite() {
      assertEquals("nan", NumberFormats.repr(Double.NaN));
      assertEquals("-inf", NumberFormats.repr(Double.NEGATIVE_INFINITY));
    }
  }

  @Test
  @DisplayName("fixed rounds half-even on the exact binary value")
  void fixedRounding() {
    assertEquals("2.67", NumberFormats.fixed(2.675, 2));
    assertEquals("0.12", NumberFormats.fixed(0.125, 2));
    assertEquals("150.00", NumberFormats.fixed(150, 2));
    assertEquals("-1.5", NumberFormats.fixed(-1.45, 1));
    assertThrows(IllegalArgumentException.class, () -> NumberFormats.fixed(1, -1));
  }

  @Nested
  class Format {

    @Test
    @DisplayName("percent, general and exponent specs")
    void specs() {
      assertEquals("12.3%", NumberFormats.format(0.1234, ".1%"));
      assertEquals("1.23e+03", NumberFormats.format(1234.5678, ".3g"));
      assertEquals("0.5", NumberFormats.format(0.5, ".3g"));
      assertEquals("1.23e+04", NumberFormats.format(12345.0, ".2e"));
      assertEquals("3.14", NumberFormats.format(3.14159, ".2f"));
    }

    @Test
    @DisplayName("a bare number is a minimum width")
    void width() {
      assertEquals("  3.141590", NumberFormats.format(3.14159, "10f"));
    }

    @Test
    @DisplayName("integer spec accepts only integral values")
    void integerSpec() {
      assertEquals("42", NumberFormats.format(42L, "d"));
      assertEquals("1", NumberFormats.format(true, "d"));
      assertThrows(IllegalArgumentException.class, () -> NumberFormats.format(4.2, "d"));
      assertThrows(IllegalArgumentException.class, () -> NumberFormats.format(4L, ".2d"));
    }

    @Test
    @DisplayName("malformed specs and non-numbers are rejected")
    void rejected() {
      assertThrows(IllegalArgumentException.class, () -> NumberFormats.format(1.0, ".f"));
      assertThrows(IllegalArgumentException.class, () -> NumberFormats.format(1.0, "x"));
      assertThrows(IllegalArgumentException.class, () -> NumberFormats.format("abc", ".2f"));
    }
  }

  @Test
  @DisplayName("width and precision are capped")
  void caps() {
    assertEquals(500, NumberFormats.format(1.0, "500f").length());
    assertThrows(IllegalArgumentException.class, () -> NumberFormats.format(1.5, "501f"));
    assertThrows(IllegalArgumentException.class, () -> NumberFormats.format(1.5, "2000000000f"));
    assertThrows(
        IllegalArgumentException.class, () -> NumberFormats.format(1.5, ".99999999999f"));
    assertThrows(IllegalArgumentException.class, () -> NumberFormats.fixed(1.5, 501));
  }
}
