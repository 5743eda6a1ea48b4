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
public class OperatorsTest {

  @Test
  public void scalarArithmetic() {
    assertThat(Operators.add(1.0, 2.0)).isEqualTo(3.0);
    assertThat(Operators.subtract(1.0, true)).isEqualTo(0.0);
    assertThat(Operators.power(3.0, 5.0)).isEqualTo(243.0);
    assertThat(Operators.divide(1.0, 4.0)).isEqualTo(0.25);
    assertThat(Operators.concat("a", 2.0)).isEqualTo("a2");
    assertThat(Operators.multiply("3", 2.0)).isEqualTo(6.0);
  }

  @Test
  public void broadcasting() {
    Grid column = Grid.column(1.0, 2.0);
    Grid row = Grid.row(10.0, 20.0, 30.0);
    assertThat(Operators.add(column, 1.0)).isEqualTo(Grid.column(2.0, 3.0));
    assertThat(Operators.add(column, row))
        .isEqualTo(Grid.of(2, 3, 11.0, 21.0, 31.0, 12.0, 22.0, 32.0));
    assertThat(Operators.gt(row, 15.0)).isEqualTo(Grid.row(false, true, true));
  }

  @Test
  public void mismatchedArrays() {
    EvaluationError e =
        assertThrows(
            EvaluationError.class,
            () -> Operators.add(Grid.column(1.0, 2.0), Grid.column(1.0, 2.0, 3.0)));
    assertThat(e.code).isEqualTo(EvaluationError.VALUE);
  }

  @Test
  public void compare() {
    assertThat(Operators.compare(1.0, 2.0)).isLessThan(0);
    assertThat(Operators.compare(100.0, "a")).isLessThan(0);
    assertThat(Operators.compare("z", false)).isLessThan(0);
    assertThat(Operators.compare("abc", "ABC")).isEqualTo(0);
    assertThat(Operators.compare(null, 0.0)).isEqualTo(0);
    assertThat(Operators.compare(null, "")).isEqualTo(0);
    assertThat(Operators.compare(false, null)).isEqualTo(0);
    assertThat(Operators.eq("Yes", "yes")).isEqualTo(true);
    assertThat(Operators.ne(1.0, 1.0)).isEqualTo(false);
  }
}
