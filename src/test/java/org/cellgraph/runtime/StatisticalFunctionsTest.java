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
public class StatisticalFunctionsTest {
  private final Grid mixed = Grid.column(1.0, "two", 3.0, null, true, 5.0);

  @Test
  public void nonNumbersInArraysAreIgnored() {
    assertThat(StatisticalFunctions.sum(mixed)).isEqualTo(9.0);
    assertThat(StatisticalFunctions.count(mixed)).isEqualTo(3.0);
    assertThat(StatisticalFunctions.average(mixed)).isEqualTo(3.0);
    assertThat(StatisticalFunctions.product(mixed)).isEqualTo(15.0);
    assertThat(StatisticalFunctions.max(mixed)).isEqualTo(5.0);
  }

  @Test
  public void scalarArgumentsAreConverted() {
    assertThat(StatisticalFunctions.sum("3")).isEqualTo(3.0);
    assertThat(StatisticalFunctions.sum(true)).isEqualTo(1.0);
  }

  @Test
  public void orderStatistics() {
    Grid values = Grid.row(4.0, 1.0, 3.0, 2.0);
    assertThat(StatisticalFunctions.median(values)).isEqualTo(2.5);
    assertThat(StatisticalFunctions.large(values, 1.0)).isEqualTo(4.0);
    assertThat(StatisticalFunctions.small(values, 2.0)).isEqualTo(2.0);
    assertThrows(EvaluationError.class, () -> StatisticalFunctions.large(values, 5.0));
  }

  @Test
  public void emptyInputs() {
    Grid text = Grid.column("a", "b");
    assertThat(StatisticalFunctions.min(text)).isEqualTo(0.0);
    EvaluationError e =
        assertThrows(EvaluationError.class, () -> StatisticalFunctions.average(text));
    assertThat(e.code).isEqualTo(EvaluationError.NUM);
  }

  @Test
  public void means() {
    Grid values = Grid.column(1.0, 2.0, 4.0);
    assertThat((Double) StatisticalFunctions.geomean(values)).isWithin(1e-12).of(2.0);
    assertThat((Double) StatisticalFunctions.harmean(values)).isWithin(1e-12).of(12.0 / 7);
    assertThrows(
        EvaluationError.class, () -> StatisticalFunctions.geomean(Grid.column(1.0, -1.0)));
  }

  @Test
  public void matrices() {
    Grid a = Grid.of(2, 2, 1.0, 2.0, 3.0, 4.0);
    Grid b = Grid.column(5.0, 6.0);
    assertThat(StatisticalFunctions.mmult(a, b)).isEqualTo(Grid.column(17.0, 39.0));
    assertThat(StatisticalFunctions.mmult(Grid.row(1.0, 2.0), b)).isEqualTo(17.0);
    assertThat(StatisticalFunctions.transpose(a)).isEqualTo(Grid.of(2, 2, 1.0, 3.0, 2.0, 4.0));
    assertThat(StatisticalFunctions.sumProduct(a, Grid.of(2, 2, 1.0, 1.0, 2.0, 2.0)))
        .isEqualTo(17.0);
    assertThrows(EvaluationError.class, () -> StatisticalFunctions.mmult(b, b));
  }
}
