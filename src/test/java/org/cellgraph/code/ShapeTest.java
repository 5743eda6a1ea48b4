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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.cellgraph.ShapeBroadcastError;
import org.jspecify.annotations.Nullable;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class ShapeTest {

  enum Sample {
    SCALAR(1, 1),
    ROW(1, 3),
    SHORT_ROW(1, 2),
    COLUMN(3, 1),
    SQUARE(3, 3),
    WIDE(2, 3);

    final Shape shape;

    Sample(int height, int width) {
      shape = Shape.of(height, width);
    }
  }

  private static @Nullable Shape tryMerge(Shape a, Shape b) {
    try {
      return Shape.merge(a, b);
    } catch (ShapeBroadcastError e) {
      return null;
    }
  }

  @Test
  public void scalarIsIdentity(@TestParameter Sample x) {
    assertThat(Shape.merge(Shape.SCALAR, x.shape)).isEqualTo(x.shape);
    assertThat(Shape.merge(x.shape, Shape.SCALAR)).isEqualTo(x.shape);
  }

  @Test
  public void commutative(@TestParameter Sample a, @TestParameter Sample b) {
    assertThat(tryMerge(a.shape, b.shape)).isEqualTo(tryMerge(b.shape, a.shape));
  }

  @Test
  public void associative(
      @TestParameter Sample a, @TestParameter Sample b, @TestParameter Sample c) {
    Shape ab = tryMerge(a.shape, b.shape);
    Shape bc = tryMerge(b.shape, c.shape);
    Shape left = (ab == null) ? null : tryMerge(ab, c.shape);
    Shape right = (bc == null) ? null : tryMerge(a.shape, bc);
    if (left != null && right != null) {
      assertThat(left).isEqualTo(right);
    }
  }

  @Test
  public void broadcasting() {
    assertThat(Shape.merge(Shape.of(1, 3), Shape.of(4, 3))).isEqualTo(Shape.of(4, 3));
    assertThat(Shape.merge(Shape.of(4, 1), Shape.of(4, 3))).isEqualTo(Shape.of(4, 3));
    assertThat(Shape.merge(Shape.of(1, 3), Shape.of(4, 1))).isEqualTo(Shape.of(4, 3));
  }

  @Test
  public void incompatible() {
    assertThrows(ShapeBroadcastError.class, () -> Shape.merge(Shape.of(5, 4), Shape.of(4, 4)));
    assertThrows(ShapeBroadcastError.class, () -> Shape.merge(Shape.of(1, 3), Shape.of(1, 2)));
  }

  @Test
  public void vectors() {
    assertThat(Shape.of(1, 5).horizontal()).isTrue();
    assertThat(Shape.of(5, 1).vertical()).isTrue();
    assertThat(Shape.SCALAR.isVector()).isFalse();
    assertThat(Shape.of(2, 2).isVector()).isFalse();
    assertThat(Shape.of(1, 1)).isSameInstanceAs(Shape.SCALAR);
  }
}
