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

import com.google.common.collect.ImmutableList;
import java.lang.invoke.MethodHandle;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Static methods for converting and reshaping cell values; called both from the runtime function
 * implementations and directly from generated code.
 *
 * <p>A value is a Double, String, Boolean, null (blank), or a {@link Grid} of those.
 */
public final class Values {
  private Values() {}

  public static double toDouble(@Nullable Object value) {
    if (value == null) {
      return 0;
    } else if (value instanceof Double d) {
      return d;
    } else if (value instanceof Boolean b) {
      return b ? 1 : 0;
    } else if (value instanceof Number n) {
      return n.doubleValue();
    } else if (value instanceof String s) {
      try {
        return Double.parseDouble(s.trim());
      } catch (NumberFormatException e) {
        throw new EvaluationError(EvaluationError.VALUE, "Not a number: \"" + s + "\"");
      }
    } else if (value instanceof Grid g && g.size() == 1) {
      return toDouble(g.get(0, 0));
    }
    throw new EvaluationError(EvaluationError.VALUE, "Expected a scalar, got " + value);
  }

  public static String toText(@Nullable Object value) {
    if (value == null) {
      return "";
    } else if (value instanceof String s) {
      return s;
    } else if (value instanceof Boolean b) {
      return b ? "TRUE" : "FALSE";
    } else if (value instanceof Grid g && g.size() == 1) {
      return toText(g.get(0, 0));
    }
    double d = toDouble(value);
    if (d == Math.rint(d) && Math.abs(d) < 1e15) {
      return Long.toString((long) d);
    }
    return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
  }

  /** Converts a value to a condition; text must be "TRUE" or "FALSE" (in any case). */
  public static boolean isTrue(@Nullable Object value) {
    if (value instanceof Boolean b) {
      return b;
    } else if (value instanceof String s) {
      String upper = s.toUpperCase(Locale.ROOT);
      if (upper.equals("TRUE") || upper.equals("FALSE")) {
        return upper.equals("TRUE");
      }
      throw new EvaluationError(EvaluationError.VALUE, "Not a logical value: \"" + s + "\"");
    }
    return toDouble(value) != 0;
  }

  /** Returns a new Grid with all elements null. */
  public static Object allocate(int height, int width) {
    return Grid.allocate(height, width);
  }

  /** Stores {@code value} into one element of a Grid created by {@link #allocate}. */
  public static void store(Object buffer, int row, int col, @Nullable Object value) {
    ((Grid) buffer).set(row, col, scalar(value));
  }

  /**
   * Returns the given region of {@code value}. A 1x1 region is returned as its element; larger
   * regions are views sharing storage with {@code value}.
   */
  public static @Nullable Object slice(
      @Nullable Object value, int rowFrom, int rowTo, int colFrom, int colTo) {
    if (value instanceof Grid g) {
      if (rowTo - rowFrom == 1 && colTo - colFrom == 1) {
        return g.get(rowFrom, colFrom);
      }
      return g.view(rowFrom, rowTo, colFrom, colTo);
    }
    if (rowFrom == 0 && rowTo == 1 && colFrom == 0 && colTo == 1) {
      return value;
    }
    throw new EvaluationError(EvaluationError.REF, "Cannot slice scalar " + value);
  }

  /** Returns a copy of a constant, so that callers may modify Grids freely. */
  public static @Nullable Object copyConstant(@Nullable Object value) {
    return (value instanceof Grid g) ? g.copy() : value;
  }

  /** Returns the sole element of a 1x1 Grid, or {@code value} itself if it is not a Grid. */
  public static @Nullable Object scalar(@Nullable Object value) {
    if (value instanceof Grid g) {
      if (g.size() != 1) {
        throw new EvaluationError(EvaluationError.VALUE, "Expected a scalar, got " + g);
      }
      return g.get(0, 0);
    }
    return value;
  }

  /** Converts a row or column Grid to a list of its elements; blanks become zero. */
  public static Object toVector(@Nullable Object value) {
    ImmutableList.Builder<Object> result = ImmutableList.builder();
    for (Object element : elements(value)) {
      result.add((element == null) ? 0.0 : element);
    }
    return result.build();
  }

  /** Returns the elements of {@code value} in row-major order; a scalar is a single element. */
  public static List<@Nullable Object> elements(@Nullable Object value) {
    if (value instanceof Grid g) {
      return g.elements();
    }
    List<@Nullable Object> result = new ArrayList<>(1);
    result.add(value);
    return result;
  }

  /** Concatenates the elements of each argument (in order) into a new n x 1 Grid. */
  public static Object flatten(Object[] parts) {
    List<@Nullable Object> all = new ArrayList<>();
    for (Object part : parts) {
      all.addAll(elements(part));
    }
    return Grid.column(all.toArray());
  }

  /**
   * Applies a scalar function elementwise. Arguments whose index appears in {@code iterate} may be
   * Grids; the result has the broadcast shape of those arguments (or is a scalar if none of them
   * is a Grid). Other arguments are passed unchanged.
   */
  public static @Nullable Object broadcast(MethodHandle scalarFn, int[] iterate, Object[] args) {
    int height = 1;
    int width = 1;
    boolean anyGrid = false;
    for (int i : iterate) {
      if (args[i] instanceof Grid g) {
        height = broadcastSize(height, g.height(), anyGrid);
        width = broadcastSize(width, g.width(), anyGrid);
        anyGrid = true;
      }
    }
    if (!anyGrid) {
      return invoke(scalarFn, args);
    }
    Grid result = Grid.allocate(height, width);
    Object[] elementArgs = args.clone();
    for (int r = 0; r < height; r++) {
      for (int c = 0; c < width; c++) {
        for (int i : iterate) {
          elementArgs[i] = element(args[i], r, c);
        }
        result.set(r, c, invoke(scalarFn, elementArgs));
      }
    }
    return result;
  }

  /**
   * Applies a one-argument scalar function to each element of {@code arg}, writing the results into
   * {@code out} (which may be the same Grid as {@code arg}). Returns {@code out}.
   */
  public static Object broadcastInto(MethodHandle scalarFn, Object arg, Object out) {
    Grid src = (Grid) arg;
    Grid dst = (Grid) out;
    for (int r = 0; r < src.height(); r++) {
      for (int c = 0; c < src.width(); c++) {
        dst.set(r, c, invoke(scalarFn, new Object[] {src.get(r, c)}));
      }
    }
    return dst;
  }

  static int broadcastSize(int current, int next, boolean haveCurrent) {
    if (!haveCurrent || current == next || next == 1) {
      return haveCurrent ? current : next;
    } else if (current == 1) {
      return next;
    }
    throw new EvaluationError(EvaluationError.VALUE, "Mismatched array sizes");
  }

  /** Returns the element of {@code value} at (row, col), repeating single rows or columns. */
  static @Nullable Object element(@Nullable Object value, int row, int col) {
    if (value instanceof Grid g) {
      return g.get(g.height() == 1 ? 0 : row, g.width() == 1 ? 0 : col);
    }
    return value;
  }

  private static @Nullable Object invoke(MethodHandle fn, @Nullable Object[] args) {
    try {
      return fn.invokeWithArguments(args);
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Throwable t) {
      throw new IllegalStateException(t);
    }
  }
}
