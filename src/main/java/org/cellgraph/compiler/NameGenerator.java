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

package org.cellgraph.compiler;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/** Hands out node names that are unique within one compilation. */
public final class NameGenerator {
  private final Map<String, Integer> counters = new HashMap<>();
  private final Set<String> used = new HashSet<>();

  /** Returns {@code base_N} for the smallest N (starting from 0) not already used. */
  public String next(String base) {
    int n = counters.getOrDefault(base, 0);
    String name;
    do {
      name = base + "_" + n++;
    } while (used.contains(name));
    counters.put(base, n);
    used.add(name);
    return name;
  }

  /**
   * Returns {@code name} itself if it has not been used yet, and otherwise the next numbered
   * variant of it.
   */
  public String claim(String name) {
    return used.add(name) ? name : next(name);
  }
}
