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

import static org.cellgraph.runtime.Values.toDouble;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Scalar implementations of the numeric spreadsheet functions. Each is applied elementwise by
 * {@link Values#broadcast} when called with arrays.
 */
public final class MathFunctions {
  private MathFunctions() {}

  public static Object abs(Object x) {
    return Math.abs(toDouble(x));
  }

  public static Object sign(Object x) {
    return Math.signum(toDouble(x));
  }

  public static Object sqrt(Object x) {
    double d = toDouble(x);
    if (d < 0) {
      throw new EvaluationError(EvaluationError.NUM, "SQRT of negative number " + d);
    }
    return Math.sqrt(d);
  }

  public static Object exp(Object x) {
    return Math.exp(toDouble(x));
  }

  public static Object ln(Object x) {
    return Math.log(toDouble(x));
  }

  public static Object log10(Object x) {
    return Math.log10(toDouble(x));
  }

  public static Object power(Object x, Object y) {
    return Math.pow(toDouble(x), toDouble(y));
  }

  /** The remainder with the sign of the divisor. */
  public static Object mod(Object x, Object y) {
    double n = toDouble(x);
    double d = toDouble(y);
    if (d == 0) {
      throw new EvaluationError(EvaluationError.NUM, "MOD by zero");
    }
    return n - d * Math.floor(n / d);
  }

  public static Object quotient(Object x, Object y) {
    double d = toDouble(y);
    if (d == 0) {
      throw new EvaluationError(EvaluationError.NUM, "QUOTIENT by zero");
    }
    double q = toDouble(x) / d;
    return (q < 0) ? Math.ceil(q) : Math.floor(q);
  }

  public static Object round(Object x, Object digits) {
    return roundTo(x, digits, RoundingMode.HALF_UP);
  }

  public static Object roundUp(Object x, Object digits) {
    return roundTo(x, digits, RoundingMode.UP);
  }

  public static Object roundDown(Object x, Object digits) {
    return roundTo(x, digits, RoundingMode.DOWN);
  }

  public static Object trunc(Object x, Object digits) {
    return roundTo(x, digits, RoundingMode.DOWN);
  }

  private static Object roundTo(Object x, Object digits, RoundingMode mode) {
    double d = toDouble(x);
    if (Double.isNaN(d) || Double.isInfinite(d)) {
      return d;
    }
    return BigDecimal.valueOf(d).setScale((int) toDouble(digits), mode).doubleValue();
  }

  public static Object floorInt(Object x) {
    return Math.floor(toDouble(x));
  }

  public static Object sin(Object x) {
    return Math.sin(toDouble(x));
  }

  public static Object cos(Object x) {
    return Math.cos(toDouble(x));
  }

  public static Object tan(Object x) {
    return Math.tan(toDouble(x));
  }

  public static Object asin(Object x) {
    return Math.asin(toDouble(x));
  }

  public static Object acos(Object x) {
    return Math.acos(toDouble(x));
  }

  public static Object atan(Object x) {
    return Math.atan(toDouble(x));
  }

  /** Note that the spreadsheet's argument order is (x, y), the reverse of {@link Math#atan2}. */
  public static Object atan2(Object x, Object y) {
    return Math.atan2(toDouble(y), toDouble(x));
  }

  public static Object sinh(Object x) {
    return Math.sinh(toDouble(x));
  }

  public static Object cosh(Object x) {
    return Math.cosh(toDouble(x));
  }

  public static Object tanh(Object x) {
    return Math.tanh(toDouble(x));
  }

  public static Object degrees(Object x) {
    return Math.toDegrees(toDouble(x));
  }

  public static Object radians(Object x) {
    return Math.toRadians(toDouble(x));
  }

  public static Object isEven(Object x) {
    return ((long) toDouble(x)) % 2 == 0;
  }

  public static Object isOdd(Object x) {
    return ((long) toDouble(x)) % 2 != 0;
  }
}
