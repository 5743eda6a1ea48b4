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

/** Implementations of the logical and selection functions. */
public final class LogicalFunctions {
  private LogicalFunctions() {}

  public static Object and(Object values) {
    for (Object v : Values.elements(values)) {
      if (v != null && !Values.isTrue(v)) {
        return false;
      }
    }
    return true;
  }

  public static Object or(Object values) {
    for (Object v : Values.elements(values)) {
      if (v != null && Values.isTrue(v)) {
        return true;
      }
    }
    return false;
  }

  public static Object xor(Object values) {
    boolean result = false;
    for (Object v : Values.elements(values)) {
      if (v != null && Values.isTrue(v)) {
        result = !result;
      }
    }
    return result;
  }

  public static Object not(Object x) {
    return !Values.isTrue(x);
  }

  /** The scalar form of IF; both alternatives have already been computed. */
  public static @Nullable Object ifThen(Object condition, Object ifTrue, Object ifFalse) {
    return Values.isTrue(condition) ? ifTrue : ifFalse;
  }

  /** IFS: returns the value paired with the first true condition. */
  public static @Nullable Object ifs(Object conditions, Object values) {
    List<@Nullable Object> cs = Values.elements(conditions);
    List<@Nullable Object> vs = Values.elements(values);
    for (int i = 0; i < cs.size(); i++) {
      if (Values.isTrue(cs.get(i))) {
        return vs.get(i);
      }
    }
    throw new EvaluationError(EvaluationError.NA, "No IFS condition was true");
  }

  /** SWITCH without a default: returns the value paired with the first matching case. */
  public static @Nullable Object switchOf(Object expr, Object cases, Object values) {
    List<@Nullable Object> cs = Values.elements(cases);
    for (int i = 0; i < cs.size(); i++) {
      if (Operators.compare(expr, cs.get(i)) == 0) {
        return Values.elements(values).get(i);
      }
    }
    throw new EvaluationError(EvaluationError.NA, "No SWITCH case matched " + expr);
  }

  /** SWITCH with a default for when no case matches. */
  public static @Nullable Object switchOrDefault(
      Object expr, Object cases, Object values, Object otherwise) {
    List<@Nullable Object> cs = Values.elements(cases);
    for (int i = 0; i < cs.size(); i++) {
      if (Operators.compare(expr, cs.get(i)) == 0) {
        return Values.elements(values).get(i);
      }
    }
    return otherwise;
  }

  /** CHOOSE: returns the index'th (1-based) choice. */
  public static @Nullable Object choose(Object index, Object choices) {
    List<@Nullable Object> cs = Values.elements(choices);
    int i = (int) Values.toDouble(index);
    if (i < 1 || i > cs.size()) {
      throw new EvaluationError(EvaluationError.VALUE, "CHOOSE index out of range: " + i);
    }
    return cs.get(i - 1);
  }
}
