package com.gentoro.reportengine.expression;

/** Lexical token with its start offset in the source text. */
record Token(Type type, String text, Object value, int position) {

  enum Type {
    NUMBER,
    STRING,
    TEMPLATE,
    NAME,
    OPERATOR,
    END
  }

  boolean is(Type expected, String expectedText) {
    return type == expected && text.equals(expectedText);
  }

  boolean isOperator(String symbol) {
    return is(Type.OPERATOR, symbol);
  }

  boolean isName(String name) {
    return is(Type.NAME, name);
  }
}
