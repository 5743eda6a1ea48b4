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

import com.google.common.base.Preconditions;
import org.cellgraph.ShapeBroadcastError;

/** The (height, width) of a value; scalars are 1x1. */
public final class Shape {
  public static final Shape SCALAR = new Shape(1, 1);

  public final int height;
  public final int width;

  private Shape(int height, int width) {
    this.height = height;
    this.width = width;
  }

  public static Shape of(int height, int width) {
    Preconditions.checkArgument(height > 0 && width > 0, "Bad shape (%s, %s)", height, width);
    return (height == 1 && width == 1) ? SCALAR : new Shape(height, width);
  }

  public int size() {
    return height * width;
  }

  public boolean isScalar() {
    return height == 1 && width == 1;
  }

  /** True if exactly one dimension is greater than 1. */
  public boolean isVector() {
    return horizontal() || vertical();
  }

  /** A single row with more than one column. */
  public boolean horizontal() {
    return height == 1 && width > 1;
  }

  /** A single column with more than one row. */
  public boolean vertical() {
    return width == 1 && height > 1;
  }

  /**
   * Returns the shape of the result of an elementwise operation on values of shapes {@code a} and
   * {@code b}: a scalar combines with anything, a row combines with a matrix of the same width, a
   * column with a matrix of the same height, and a row with a column (giving their outer product).
   */
  public static Shape merge(Shape a, Shape b) {
    if (a.equals(b) || b.isScalar()) {
      return a;
    } else if (a.isScalar()) {
      return b;
    } else if (a.width == b.width && (a.horizontal() || b.horizontal())) {
      return of(Math.max(a.height, b.height), a.width);
    } else if (a.height == b.height && (a.vertical() || b.vertical())) {
      return of(a.height, Math.max(a.width, b.width));
    } else if ((a.horizontal() && b.vertical()) || (a.vertical() && b.horizontal())) {
      return of(Math.max(a.height, b.height), Math.max(a.width, b.width));
    }
    throw ShapeBroadcastError.of("Cannot combine shapes %s and %s", a, b);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Shape other && height == other.height && width == other.width;
  }

  @Override
  public int hashCode() {
    return height * 31 + width;
  }

  @Override
  public String toString() {
    return "(" + height + ", " + width + ")";
  }
}
