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

import org.cellgraph.runtime.Grid;
import org.cellgraph.runtime.Values;
import org.jspecify.annotations.Nullable;

/** A value that a statement reads: a slot, a constant, or a view onto part of another operand. */
public abstract class Operand {
  private Operand() {}

  /** A numbered variable in the program's frame. */
  public static final class Slot extends Operand {
    public final int index;
    public final String name;

    Slot(int index, String name) {
      this.index = index;
      this.name = name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** A constant scalar. Grid constants are never operands; they are copied into a slot first. */
  public static final class Constant extends Operand {
    public final @Nullable Object value;

    Constant(@Nullable Object value) {
      assert !(value instanceof Grid);
      this.value = value;
    }

    @Override
    public String toString() {
      return (value instanceof String) ? "\"" + value + "\"" : String.valueOf(value);
    }
  }

  /**
   * The region {@code [rowFrom, rowTo) x [colFrom, colTo)} of another operand, as computed by
   * {@link Values#slice}.
   */
  public static final class View extends Operand {
    public final Operand base;
    public final int rowFrom;
    public final int rowTo;
    public final int colFrom;
    public final int colTo;

    View(Operand base, int rowFrom, int rowTo, int colFrom, int colTo) {
      this.base = base;
      this.rowFrom = rowFrom;
      this.rowTo = rowTo;
      this.colFrom = colFrom;
      this.colTo = colTo;
    }

    @Override
    public String toString() {
      return String.format("%s[%s:%s, %s:%s]", base, rowFrom, rowTo, colFrom, colTo);
    }
  }
}
