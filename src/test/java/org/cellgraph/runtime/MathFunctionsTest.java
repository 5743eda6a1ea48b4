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
public class MathFunctionsTest {

  @Test
  public void rounding() {
    assertThat(MathFunctions.round(2.5, 0.0)).isEqualTo(3.0);
    assertThat(MathFunctions.round(-2.5, 0.0)).isEqualTo(-3.0);
    assertThat(MathFunctions.round(1.005, 2.0)).isEqualTo(1.01);
    assertThat(MathFunctions.round(1234.0, -2.0)).isEqualTo(1200.0);
    assertThat(MathFunctions.roundUp(1.21, 1.0)).isEqualTo(1.3);
    assertThat(MathFunctions.roundDown(-1.29, 1.0)).isEqualTo(-1.2);
    assertThat(MathFunctions.floorInt(-1.5)).isEqualTo(-2.0);
  }

  @Test
  public void modAndQuotient() {
    assertThat(MathFunctions.mod(7.0, 3.0)).isEqualTo(1.0);
    assertThat(MathFunctions.mod(-7.0, 3.0)).isEqualTo(2.0);
    assertThat(MathFunctions.mod(7.0, -3.0)).isEqualTo(-2.0);
    assertThat(MathFunctions.quotient(-7.0, 2.0)).isEqualTo(-3.0);
    EvaluationError e =
        assertThrows(EvaluationError.class, () -> MathFunctions.mod(1.0, 0.0));
    assertThat(e.code).isEqualTo(EvaluationError.NUM);
  }

  @Test
  public void misc() {
    assertThat(MathFunctions.abs(-2.0)).isEqualTo(2.0);
    assertThat(MathFunctions.sign(-0.5)).isEqualTo(-1.0);
    assertThat(MathFunctions.sqrt(16.0)).isEqualTo(4.0);
    assertThat(MathFunctions.isEven(4.0)).isEqualTo(true);
    assertThat(MathFunctions.isOdd(4.0)).isEqualTo(false);
    assertThrows(EvaluationError.class, () -> MathFunctions.sqrt(-1.0));
  }

  @Test
  public void randomValuesAreInRange() {
    Object scalar = RandomFunctions.rand(1, 1);
    assertThat(scalar).isInstanceOf(Double.class);
    Grid grid = (Grid) RandomFunctions.randBetween(3, 2, 1.0, 6.0);
    assertThat(grid.height()).isEqualTo(3);
    assertThat(grid.width()).isEqualTo(2);
    for (Object v : grid.elements()) {
      double d = (Double) v;
      assertThat(d).isAtLeast(1.0);
      assertThat(d).isAtMost(6.0);
      assertThat(d).isEqualTo(Math.rint(d));
    }
    assertThrows(EvaluationError.class, () -> RandomFunctions.randBetween(1, 1, 5.0, 4.0));
  }
}
