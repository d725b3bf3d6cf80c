package com.gentoro.reportengine.utility;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link Values}. */
class ValuesTest {

  @Test
  @DisplayName("coerce tries integer, then floating point, then leaves the text alone")
  void coerce() {
    assertEquals(12L, Values.coerce("12"));
    assertEquals(1000L, Values.coerce("1_000"));
    assertEquals(1.5, Values.coerce(" 1.5 "));
    assertEquals(2e3, Values.coerce("2e3"));
    assertEquals("abc", Values.coerce("abc"));
    assertEquals("", Values.coerce(""));
    assertTrue(((Double) Values.coerce("nan")).isNaN());
  }

  @Test
  @DisplayName("numeric views of loose values")
  void numericViews() {
    assertEquals(3.0, Values.toDouble(" 3 "));
    assertEquals(1.0, Values.toDouble(true));
    assertEquals(2.5, Values.toDouble(DoubleNode.valueOf(2.5)));
    assertNull(Values.toDouble("12abc"));
    assertNull(Values.toDouble(null));
    assertEquals(7L, Values.toLong("7"));
    assertEquals(7L, Values.toLong(7.9));
    assertNull(Values.toLong("x"));
  }

  @Test
  @DisplayName("truthiness of scalars, containers and JSON nodes")
  void truthiness() {
    assertFalse(Values.isTruthy(null));
    assertFalse(Values.isTruthy(0L));
    assertFalse(Values.isTruthy(""));
    assertFalse(Values.isTruthy(List.of()));
    assertFalse(Values.isTruthy(Map.of()));
    assertFalse(Values.isTruthy(IntNode.valueOf(0)));
    assertTrue(Values.isTruthy("0"));
    assertTrue(Values.isTruthy(0.5));
    assertTrue(Values.isTruthy(TextNode.valueOf("x")));
  }

  @Test
  @DisplayName("display form renders doubles with repr and null as empty")
  void str() {
    assertEquals("", Values.str(null));
    assertEquals("4000.0", Values.str(4000.0));
    assertEquals("12", Values.str(12L));
    assertEquals("x", Values.str(TextNode.valueOf("x")));
    assertEquals("2.5", Values.str(DoubleNode.valueOf(2.5)));
    assertEquals("", Values.str(NullNode.getInstance()));
  }

  @Test
  @DisplayName("blank cells are null or whitespace")
  void blank() {
    assertTrue(Values.isBlank(null));
    assertTrue(Values.isBlank("  "));
    assertFalse(Values.isBlank(0L));
  }

  @Test
  @DisplayName("JSON scalars map to plain Java values")
  void fromJson() {
    assertEquals(3L, Values.fromJson(IntNode.valueOf(3)));
    assertEquals(2.5, Values.fromJson(DoubleNode.valueOf(2.5)));
    assertEquals("a", Values.fromJson(TextNode.valueOf("a")));
    assertNull(Values.fromJson(NullNode.getInstance()));
    JsonNode array = JacksonUtility.getJsonMapper().createArrayNode();
    assertSame(array, Values.fromJson(array));
  }
}
