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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Implementations of the aggregating functions. Each takes a single value, usually an n x 1 Grid
 * built by {@link Values#flatten}; blanks, text and logical values inside arrays are ignored, as
 * they are for range arguments in a spreadsheet.
 */
public final class StatisticalFunctions {
  private StatisticalFunctions() {}

  static List<Double> numbers(Object values) {
    List<Double> result = new ArrayList<>();
    for (Object v : Values.elements(values)) {
      if (v instanceof Double d) {
        result.add(d);
      } else if (!(values instanceof Grid) && v != null) {
        // A scalar argument given directly is converted, as in SUM("3").
        result.add(Values.toDouble(v));
      }
    }
    return result;
  }

  private static List<Double> nonEmpty(Object values, String fn) {
    List<Double> result = numbers(values);
    if (result.isEmpty()) {
      throw new EvaluationError(EvaluationError.NUM, fn + " of no numbers");
    }
    return result;
  }

  public static Object sum(Object values) {
    double sum = 0;
    for (double d : numbers(values)) {
      sum += d;
    }
    return sum;
  }

  public static Object product(Object values) {
    double product = 1;
    for (double d : numbers(values)) {
      product *= d;
    }
    return product;
  }

  public static Object sumSquares(Object values) {
    double sum = 0;
    for (double d : numbers(values)) {
      sum += d * d;
    }
    return sum;
  }

  public static Object count(Object values) {
    double count = 0;
    for (Object v : Values.elements(values)) {
      if (v instanceof Double) {
        count++;
      }
    }
    return count;
  }

  public static Object average(Object values) {
    List<Double> numbers = nonEmpty(values, "AVERAGE");
    return (Double) sum(values) / numbers.size();
  }

  public static Object median(Object values) {
    List<Double> numbers = nonEmpty(values, "MEDIAN");
    Collections.sort(numbers);
    int n = numbers.size();
    return (n % 2 == 1) ? numbers.get(n / 2) : (numbers.get(n / 2 - 1) + numbers.get(n / 2)) / 2;
  }

  public static Object min(Object values) {
    List<Double> numbers = numbers(values);
    return numbers.isEmpty() ? 0.0 : Collections.min(numbers);
  }

  public static Object max(Object values) {
    List<Double> numbers = numbers(values);
    return numbers.isEmpty() ? 0.0 : Collections.max(numbers);
  }

  public static Object geomean(Object values) {
    List<Double> numbers = nonEmpty(values, "GEOMEAN");
    double logSum = 0;
    for (double d : numbers) {
      if (d <= 0) {
        throw new EvaluationError(EvaluationError.NUM, "GEOMEAN of non-positive number");
      }
      logSum += Math.log(d);
    }
    return Math.exp(logSum / numbers.size());
  }

  public static Object harmean(Object values) {
    List<Double> numbers = nonEmpty(values, "HARMEAN");
    double sum = 0;
    for (double d : numbers) {
      if (d <= 0) {
        throw new EvaluationError(EvaluationError.NUM, "HARMEAN of non-positive number");
      }
      sum += 1 / d;
    }
    return numbers.size() / sum;
  }

  /** Returns the k'th largest number (k is 1-based). */
  public static Object large(Object values, Object k) {
    List<Double> numbers = numbers(values);
    numbers.sort(Collections.reverseOrder());
    return kth(numbers, k, "LARGE");
  }

  /** Returns the k'th smallest number (k is 1-based). */
  public static Object small(Object values, Object k) {
    List<Double> numbers = numbers(values);
    Collections.sort(numbers);
    return kth(numbers, k, "SMALL");
  }

  private static Object kth(List<Double> sorted, Object k, String fn) {
    int index = (int) Values.toDouble(k) - 1;
    if (index < 0 || index >= sorted.size()) {
      throw new EvaluationError(EvaluationError.NUM, fn + " index out of range: " + (index + 1));
    }
    return sorted.get(index);
  }

  public static Object sumProduct(Object x, Object y) {
    List<Object> xs = Values.elements(x);
    List<Object> ys = Values.elements(y);
    if (xs.size() != ys.size()) {
      throw new EvaluationError(EvaluationError.VALUE, "SUMPRODUCT of different sized arrays");
    }
    double sum = 0;
    for (int i = 0; i < xs.size(); i++) {
      if (xs.get(i) instanceof Double a && ys.get(i) instanceof Double b) {
        sum += a * b;
      }
    }
    return sum;
  }

  public static Object transpose(Object x) {
    if (!(x instanceof Grid g)) {
      return x;
    }
    Grid result = Grid.allocate(g.width(), g.height());
    for (int r = 0; r < g.height(); r++) {
      for (int c = 0; c < g.width(); c++) {
        result.set(c, r, g.get(r, c));
      }
    }
    return result;
  }

  public static Object mmult(Object x, Object y) {
    Grid a = (x instanceof Grid g) ? g : Grid.of(1, 1, x);
    Grid b = (y instanceof Grid g) ? g : Grid.of(1, 1, y);
    if (a.width() != b.height()) {
      throw new EvaluationError(EvaluationError.VALUE, "MMULT of incompatible arrays");
    }
    Grid result = Grid.allocate(a.height(), b.width());
    for (int r = 0; r < a.height(); r++) {
      for (int c = 0; c < b.width(); c++) {
        double sum = 0;
        for (int k = 0; k < a.width(); k++) {
          sum += Values.toDouble(a.get(r, k)) * Values.toDouble(b.get(k, c));
        }
        result.set(r, c, sum);
      }
    }
    return (result.size() == 1) ? result.get(0, 0) : result;
  }
}
