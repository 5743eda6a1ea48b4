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

package org.cellgraph.code;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;

/**
 * The callable result of compiling a workbook. Implementations are thread-safe; each call works
 * on its own copy of any array values.
 */
public interface CompiledFunction {
  /** The names of the parameters, in declaration order. */
  ImmutableList<String> parameterNames();

  /**
   * Computes the outputs. Parameters missing from {@code arguments} take their default values; an
   * unknown parameter name is an {@link IllegalArgumentException}.
   *
   * <p>Returns a map from output name (in declaration order) to value. Scalars are Double, String
   * or Boolean; rows and columns are {@link ImmutableList}s; other arrays are {@link
   * org.cellgraph.runtime.Grid}s.
   */
  ImmutableMap<String, Object> apply(Map<String, ?> arguments);

  default ImmutableMap<String, Object> apply() {
    return apply(ImmutableMap.of());
  }

  /** The program this function executes. */
  Program program();
}
