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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LogicalFunctionsTest {

  @Test
  public void connectives() {
    assertThat(LogicalFunctions.and(Grid.column(true, null, 1.0))).isEqualTo(true);
    assertThat(LogicalFunctions.and(Grid.column(true, 0.0))).isEqualTo(false);
    assertThat(LogicalFunctions.or(Grid.column(false, null))).isEqualTo(false);
    assertThat(LogicalFunctions.xor(Grid.column(true, true, true))).isEqualTo(true);
    assertThat(LogicalFunctions.not("FALSE")).isEqualTo(true);
  }

  @Test
  public void selection() {
    assertThat(LogicalFunctions.ifThen(1.0, "yes", "no")).isEqualTo("yes");
    assertThat(LogicalFunctions.ifs(Grid.column(false, true), Grid.column(1.0, 2.0)))
        .isEqualTo(2.0);
    assertThat(LogicalFunctions.choose(2.0, Grid.column("a", "b", "c"))).isEqualTo("b");
    assertThat(LogicalFunctions.switchOf("B", Grid.column("a", "b"), Grid.column(1.0, 2.0)))
        .isEqualTo(2.0);
    assertThat(
            LogicalFunctions.switchOrDefault(
                "z", Grid.column("a", "b"), Grid.column(1.0, 2.0), -1.0))
        .isEqualTo(-1.0);
  }

  @Test
  public void selectionErrors() {
    EvaluationError e =
        assertThrows(
            EvaluationError.class,
            () -> LogicalFunctions.ifs(Grid.column(false), Grid.column(1.0)));
    assertThat(e.code).isEqualTo(EvaluationError.NA);
    assertThrows(
        EvaluationError.class, () -> LogicalFunctions.choose(4.0, Grid.column("a", "b")));
  }

  @Test
  public void exactLookup() {
    Grid keys = Grid.column("apple", "pear", "plum");
    Grid results = Grid.column(1.0, 2.0, 3.0);
    assertThat(LookupFunctions.lookup("PEAR", keys, results, false)).isEqualTo(2.0);
    EvaluationError e =
        assertThrows(
            EvaluationError.class,
            () -> LookupFunctions.lookup("fig", keys, results, false));
    assertThat(e.code).isEqualTo(EvaluationError.NA);
  }

  @Test
  public void approximateLookup() {
    Grid keys = Grid.row(0.0, 10.0, 20.0);
    Grid results = Grid.row("low", "mid", "high");
    assertThat(LookupFunctions.lookup(15.0, keys, results, true)).isEqualTo("mid");
    assertThat(LookupFunctions.lookup(20.0, keys, results, true)).isEqualTo("high");
    assertThat(LookupFunctions.lookup(99.0, keys, results, true)).isEqualTo("high");
    assertThrows(
        EvaluationError.class, () -> LookupFunctions.lookup(-1.0, keys, results, true));
  }
}
