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

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A mutable two-dimensional array of cell values, stored in row-major order. A Grid may be a view
 * onto a rectangular region of another Grid, in which case the two share storage.
 *
 * <p>Elements are Doubles, Strings, Booleans, or null (blank).
 */
public final class Grid {
  private final @Nullable Object[] data;
  private final int offset;
  private final int stride;
  private final int height;
  private final int width;

  private Grid(@Nullable Object[] data, int offset, int stride, int height, int width) {
    this.data = data;
    this.offset = offset;
    this.stride = stride;
    this.height = height;
    this.width = width;
  }

  /** Returns a new Grid with all elements null. */
  public static Grid allocate(int height, int width) {
    Preconditions.checkArgument(height > 0 && width > 0, "Bad grid size %sx%s", height, width);
    return new Grid(new Object[height * width], 0, width, height, width);
  }

  /** Returns a new Grid containing the given elements in row-major order. */
  public static Grid of(int height, int width, @Nullable Object... elements) {
    Preconditions.checkArgument(elements.length == height * width);
    Grid result = allocate(height, width);
    System.arraycopy(elements, 0, result.data, 0, elements.length);
    return result;
  }

  /** Returns a new {@code n}x1 Grid containing the given elements. */
  public static Grid column(@Nullable Object... elements) {
    return of(elements.length, 1, elements);
  }

  /** Returns a new 1x{@code n} Grid containing the given elements. */
  public static Grid row(@Nullable Object... elements) {
    return of(1, elements.length, elements);
  }

  public int height() {
    return height;
  }

  public int width() {
    return width;
  }

  public int size() {
    return height * width;
  }

  public boolean isVector() {
    return height == 1 || width == 1;
  }

  public @Nullable Object get(int row, int col) {
    Preconditions.checkElementIndex(row, height);
    Preconditions.checkElementIndex(col, width);
    return data[offset + row * stride + col];
  }

  public void set(int row, int col, @Nullable Object value) {
    Preconditions.checkElementIndex(row, height);
    Preconditions.checkElementIndex(col, width);
    data[offset + row * stride + col] = value;
  }

  /** Returns the {@code i}th element in row-major order. */
  public @Nullable Object getFlat(int i) {
    return get(i / width, i % width);
  }

  public void setFlat(int i, @Nullable Object value) {
    set(i / width, i % width, value);
  }

  /**
   * Returns a view of rows {@code [rowFrom, rowTo)} and columns {@code [colFrom, colTo)}; changes
   * to either Grid are visible in the other.
   */
  public Grid view(int rowFrom, int rowTo, int colFrom, int colTo) {
    Preconditions.checkPositionIndexes(rowFrom, rowTo, height);
    Preconditions.checkPositionIndexes(colFrom, colTo, width);
    Preconditions.checkArgument(rowTo > rowFrom && colTo > colFrom, "Empty view");
    return new Grid(
        data, offset + rowFrom * stride + colFrom, stride, rowTo - rowFrom, colTo - colFrom);
  }

  /** Returns a new Grid with the same elements, not sharing storage with this one. */
  public Grid copy() {
    Grid result = allocate(height, width);
    for (int i = 0; i < size(); i++) {
      result.data[i] = getFlat(i);
    }
    return result;
  }

  /** Returns the elements in row-major order. */
  public List<@Nullable Object> elements() {
    List<@Nullable Object> result = new ArrayList<>(size());
    for (int i = 0; i < size(); i++) {
      result.add(getFlat(i));
    }
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Grid other) || other.height != height || other.width != width) {
      return false;
    }
    for (int i = 0; i < size(); i++) {
      if (!Objects.equals(getFlat(i), other.getFlat(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int result = height * 31 + width;
    for (int i = 0; i < size(); i++) {
      result = result * 31 + Objects.hashCode(getFlat(i));
    }
    return result;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("[");
    for (int r = 0; r < height; r++) {
      sb.append(r == 0 ? "[" : ", [");
      for (int c = 0; c < width; c++) {
        if (c != 0) {
          sb.append(", ");
        }
        sb.append(get(r, c));
      }
      sb.append("]");
    }
    return sb.append("]").toString();
  }
}
