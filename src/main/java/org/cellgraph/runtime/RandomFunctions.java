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

import java.util.concurrent.ThreadLocalRandom;

/**
 * Implementations of RAND and RANDBETWEEN. Each call draws fresh values; a 1x1 shape yields a
 * scalar.
 */
public final class RandomFunctions {
  private RandomFunctions() {}

  public static Object rand(int height, int width) {
    ThreadLocalRandom random = ThreadLocalRandom.current();
    if (height == 1 && width == 1) {
      return random.nextDouble();
    }
    Grid result = Grid.allocate(height, width);
    for (int i = 0; i < result.size(); i++) {
      result.setFlat(i, random.nextDouble());
    }
    return result;
  }

  /** Draws integers uniformly from {@code [low, high]} (both inclusive). */
  public static Object randBetween(int height, int width, Object low, Object high) {
    long lo = (long) Math.ceil(Values.toDouble(low));
    long hi = (long) Math.floor(Values.toDouble(high));
    if (hi < lo) {
      throw new EvaluationError(EvaluationError.NUM, "RANDBETWEEN with empty range");
    }
    ThreadLocalRandom random = ThreadLocalRandom.current();
    if (height == 1 && width == 1) {
      return (double) random.nextLong(lo, hi + 1);
    }
    Grid result = Grid.allocate(height, width);
    for (int i = 0; i < result.size(); i++) {
      result.setFlat(i, (double) random.nextLong(lo, hi + 1));
    }
    return result;
  }
}
