/*
 * Copyright (c) 2025 Moataz Abdelnasser
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.mizosoft.rebound.internal.text;

import java.util.BitSet;

/**
 * Lookup tables for the characters RFC 9110 allows in request methods, header names and header
 * values. Only ASCII is accepted; {@code obs-text} and {@code obs-fold} are rejected.
 */
public final class HttpCharMatchers {
  private static final String TOKEN_SYMBOLS = "!#$%&'*+-.^_`|~";

  private static final BitSet TOKEN_CHARS = new BitSet(128);
  private static final BitSet FIELD_VALUE_CHARS = new BitSet(128);

  static {
    TOKEN_CHARS.set('0', '9' + 1);
    TOKEN_CHARS.set('A', 'Z' + 1);
    TOKEN_CHARS.set('a', 'z' + 1);
    TOKEN_SYMBOLS.chars().forEach(TOKEN_CHARS::set);

    FIELD_VALUE_CHARS.set(0x21, 0x7F); // VCHAR
    FIELD_VALUE_CHARS.set(' ');
    FIELD_VALUE_CHARS.set('\t');
  }

  private HttpCharMatchers() {}

  /** Returns whether {@code s} is a non-empty {@code token}, as used for methods and names. */
  public static boolean isToken(CharSequence s) {
    return s.length() > 0 && allIn(TOKEN_CHARS, s);
  }

  /** Returns whether every char in {@code s} may appear in a header value. */
  public static boolean isFieldValue(CharSequence s) {
    return allIn(FIELD_VALUE_CHARS, s);
  }

  private static boolean allIn(BitSet allowed, CharSequence s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c >= 128 || !allowed.get(c)) {
        return false;
      }
    }
    return true;
  }
}
