package com.github.pdasimulator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reserved symbols and helpers for splitting words and push strings into individual symbols.
 * A symbol is a single unicode code point held as a String.
 */
public final class Symbols {
  /** Empty-symbol sentinel: consume nothing, pop nothing or push nothing. */
  public static final String EPSILON = "ε";

  /** Reserved stack-bottom marker. */
  public static final String BOTTOM_MARKER = "$";

  public static boolean isEpsilon(final String symbol) {
    return EPSILON.equals(symbol);
  }

  /**
   * Splits the given text into its symbols, left to right. Null or empty text yields an empty
   * list.
   */
  public static List<String> split(final String text) {
    if (text == null || text.isEmpty()) {
      return Collections.emptyList();
    }
    final List<String> symbols = new ArrayList<>(text.length());
    int offset = 0;
    while (offset < text.length()) {
      final int codePoint = text.codePointAt(offset);
      symbols.add(new String(Character.toChars(codePoint)));
      offset += Character.charCount(codePoint);
    }
    return symbols;
  }

  /**
   * True iff the text is exactly one symbol.
   */
  static boolean isSingleSymbol(final String text) {
    return text != null && !text.isEmpty() && text.codePointCount(0, text.length()) == 1;
  }

  private Symbols() {}
}
