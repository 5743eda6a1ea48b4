/*
 * Copyright 2025 The cellgraph Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.cellgraph.runtime;

import static org.cellgraph.runtime.Values.toText;

import java.util.Locale;

/** Scalar implementations of the text functions. */
public final class TextFunctions {
  private TextFunctions() {}

  public static Object len(Object text) {
    return (double) toText(text).length();
  }

  public static Object left(Object text, Object count) {
    String s = toText(text);
    return s.substring(0, clamp(count, s.length()));
  }

  public static Object right(Object text, Object count) {
    String s = toText(text);
    return s.substring(s.length() - clamp(count, s.length()));
  }

  /** MID(text, start, count) with a 1-based start. */
  public static Object mid(Object text, Object start, Object count) {
    String s = toText(text);
    int from = (int) Values.toDouble(start) - 1;
    if (from < 0) {
      throw new EvaluationError(EvaluationError.VALUE, "MID start must be at least 1");
    }
    if (from >= s.length()) {
      return "";
    }
    return s.substring(from, from + clamp(count, s.length() - from));
  }

  private static int clamp(Object count, int max) {
    int n = (int) Values.toDouble(count);
    if (n < 0) {
      throw new EvaluationError(EvaluationError.VALUE, "Negative character count " + n);
    }
    return Math.min(n, max);
  }

  public static Object upper(Object text) {
    return toText(text).toUpperCase(Locale.ROOT);
  }

  public static Object lower(Object text) {
    return toText(text).toLowerCase(Locale.ROOT);
  }

  /** Capitalizes the first letter of each word and lower-cases the rest. */
  public static Object proper(Object text) {
    String s = toText(text);
    StringBuilder sb = new StringBuilder(s.length());
    boolean startOfWord = true;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
      startOfWord = !Character.isLetter(c);
    }
    return sb.toString();
  }

  /** Removes leading and trailing spaces and collapses internal runs of spaces to one. */
  public static Object trim(Object text) {
    return toText(text).trim().replaceAll(" +", " ");
  }

  public static Object exact(Object x, Object y) {
    return toText(x).equals(toText(y));
  }

  /** Case-sensitive position (1-based) of {@code find} in {@code within}, starting at start. */
  public static Object find(Object find, Object within, Object start) {
    return position(toText(find), toText(within), start, "FIND");
  }

  /** Case-insensitive variant of {@link #find}. */
  public static Object search(Object find, Object within, Object start) {
    return position(
        toText(find).toLowerCase(Locale.ROOT),
        toText(within).toLowerCase(Locale.ROOT),
        start,
        "SEARCH");
  }

  private static Object position(String find, String within, Object start, String fn) {
    int from = (int) Values.toDouble(start) - 1;
    int index = (from < 0) ? -1 : within.indexOf(find, from);
    if (index < 0) {
      throw new EvaluationError(EvaluationError.VALUE, fn + " did not find \"" + find + "\"");
    }
    return (double) (index + 1);
  }

  public static Object substitute(Object text, Object old, Object replacement) {
    String o = toText(old);
    return o.isEmpty() ? toText(text) : toText(text).replace(o, toText(replacement));
  }

  /** Concatenates every element of the (flattened) argument. */
  public static Object concat(Object values) {
    StringBuilder sb = new StringBuilder();
    for (Object v : Values.elements(values)) {
      sb.append(toText(v));
    }
    return sb.toString();
  }

  public static Object value(Object text) {
    return Values.toDouble(text instanceof String s ? s.trim() : text);
  }
}
