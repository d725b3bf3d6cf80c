package com.gentoro.reportengine.expression;

/** Spreadsheet-style column names: {@code A}=0, {@code Z}=25, {@code AA}=26. */
public final class ColumnLetters {

  private ColumnLetters() {}

  /** Zero-based column index of an upper-case letter sequence. */
  public static int toIndex(String letters) {
    if (letters == null || letters.isEmpty()) {
      throw new IllegalArgumentException("Column letters must not be empty");
    }
    int index = 0;
    for (int k = 0; k < letters.length(); k++) {
      char c = letters.charAt(k);
      if (c < 'A' || c > 'Z') {
        throw new IllegalArgumentException("Invalid column letters: " + letters);
      }
      index = Math.addExact(Math.multiplyExact(index, 26), c - 'A' + 1);
    }
    return index - 1;
  }

  public static String toLetters(int index) {
    if (index < 0) {
      throw new IllegalArgumentException("Column index must not be negative: " + index);
    }
    StringBuilder sb = new StringBuilder();
    int n = index + 1;
    while (n > 0) {
      int rem = (n - 1) % 26;
      sb.append((char) ('A' + rem));
      n = (n - 1) / 26;
    }
    return sb.reverse().toString();
  }
}
