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

import java.util.List;
import org.jspecify.annotations.Nullable;

/** The shared implementation of VLOOKUP, HLOOKUP and LOOKUP. */
public final class LookupFunctions {
  private LookupFunctions() {}

  /**
   * Finds {@code target} in {@code keys} and returns the element of {@code results} at the same
   * position. If {@code approximate} is true the keys are assumed to be in ascending order and the
   * last key not greater than the target is used.
   */
  public static @Nullable Object lookup(
      Object target, Object keys, Object results, Object approximate) {
    List<@Nullable Object> ks = Values.elements(keys);
    List<@Nullable Object> rs = Values.elements(results);
    int found = -1;
    if (Values.isTrue(approximate)) {
      for (int i = 0; i < ks.size() && Operators.compare(ks.get(i), target) <= 0; i++) {
        found = i;
      }
    } else {
      for (int i = 0; i < ks.size() && found < 0; i++) {
        if (Operators.compare(ks.get(i), target) == 0) {
          found = i;
        }
      }
    }
    if (found < 0) {
      throw new EvaluationError(EvaluationError.NA, "No match for " + target);
    }
    return rs.get(found);
  }
}
