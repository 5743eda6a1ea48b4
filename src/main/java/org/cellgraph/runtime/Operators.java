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

import java.util.Locale;
import java.util.function.BinaryOperator;
import org.jspecify.annotations.Nullable;

/**
 * Implementations of the spreadsheet's infix operators. Each accepts scalars or Grids; Grid
 * operands are combined elementwise, with single rows or columns repeated to match the other
 * operand.
 */
public final class Operators {
  private Operators() {}

  public static Object add(Object x, Object y) {
    return broadcast(x, y, (a, b) -> Values.toDouble(a) + Values.toDouble(b));
  }

  public static Object subtract(Object x, Object y) {
    return broadcast(x, y, (a, b) -> Values.toDouble(a) - Values.toDouble(b));
  }

  public static Object multiply(Object x, Object y) {
    return broadcast(x, y, (a, b) -> Values.toDouble(a) * Values.toDouble(b));
  }

  public static Object divide(Object x, Object y) {
    return broadcast(x, y, (a, b) -> Values.toDouble(a) / Values.toDouble(b));
  }

  public static Object power(Object x, Object y) {
    return broadcast(x, y, (a, b) -> Math.pow(Values.toDouble(a), Values.toDouble(b)));
  }

  public static Object concat(Object x, Object y) {
    return broadcast(x, y, (a, b) -> Values.toText(a) + Values.toText(b));
  }

  public static Object eq(Object x, Object y) {
    return broadcast(x, y, (a, b) -> compare(a, b) == 0);
  }

  public static Object ne(Object x, Object y) {
    return broadcast(x, y, (a, b) -> compare(a, b) != 0);
  }

  public static Object lt(Object x, Object y) {
    return broadcast(x, y, (a, b) -> compare(a, b) < 0);
  }

  public static Object le(Object x, Object y) {
    return broadcast(x, y, (a, b) -> compare(a, b) <= 0);
  }

  public static Object gt(Object x, Object y) {
    return broadcast(x, y, (a, b) -> compare(a, b) > 0);
  }

  public static Object ge(Object x, Object y) {
    return broadcast(x, y, (a, b) -> compare(a, b) >= 0);
  }

  /**
   * Compares two scalars. Numbers sort before text, which sorts before logical values; text
   * comparison ignores case. A blank compares as the zero value of the other operand's type.
   */
  public static int compare(@Nullable Object a, @Nullable Object b) {
    if (a == null) {
      a = blankLike(b);
    }
    if (b == null) {
      b = blankLike(a);
    }
    int rankA = rank(a);
    int rankB = rank(b);
    if (rankA != rankB) {
      return Integer.compare(rankA, rankB);
    } else if (a instanceof String sa) {
      return sa.toLowerCase(Locale.ROOT).compareTo(((String) b).toLowerCase(Locale.ROOT));
    } else if (a instanceof Boolean ba) {
      return Boolean.compare(ba, (Boolean) b);
    }
    return Double.compare(Values.toDouble(a), Values.toDouble(b));
  }

  private static Object blankLike(@Nullable Object other) {
    if (other instanceof String) {
      return "";
    } else if (other instanceof Boolean) {
      return Boolean.FALSE;
    }
    return 0.0;
  }

  private static int rank(@Nullable Object x) {
    if (x instanceof String) {
      return 1;
    } else if (x instanceof Boolean) {
      return 2;
    }
    return 0;
  }

  private static Object broadcast(
      Object x, Object y, BinaryOperator<@Nullable Object> op) {
    if (!(x instanceof Grid) && !(y instanceof Grid)) {
      return op.apply(x, y);
    }
    int height = dimension(x, true, y);
    int width = dimension(x, false, y);
    Grid result = Grid.allocate(height, width);
    for (int r = 0; r < height; r++) {
      for (int c = 0; c < width; c++) {
        result.set(r, c, op.apply(Values.element(x, r, c), Values.element(y, r, c)));
      }
    }
    return result;
  }

  private static int dimension(Object x, boolean rows, Object y) {
    int dx = (x instanceof Grid g) ? (rows ? g.height() : g.width()) : 1;
    int dy = (y instanceof Grid g) ? (rows ? g.height() : g.width()) : 1;
    return Values.broadcastSize(dx, dy, true);
  }
}
