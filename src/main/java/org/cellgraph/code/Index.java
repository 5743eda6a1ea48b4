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
import com.google.common.collect.ImmutableList;

/**
 * A rectangular region {@code [rowFrom, rowTo) x [colFrom, colTo)} of another node's value. An
 * Index emits no statements; parents read the region through a view.
 */
public final class Index extends Node {
  public final int rowFrom;
  public final int rowTo;
  public final int colFrom;
  public final int colTo;

  public Index(String name, Node array, int rowFrom, int rowTo, int colFrom, int colTo) {
    super(name, ImmutableList.of(array));
    Shape shape = array.shape();
    Preconditions.checkArgument(
        0 <= rowFrom && rowFrom < rowTo && rowTo <= shape.height
            && 0 <= colFrom && colFrom < colTo && colTo <= shape.width,
        "Bad index [%s:%s, %s:%s] into %s",
        rowFrom,
        rowTo,
        colFrom,
        colTo,
        array);
    this.rowFrom = rowFrom;
    this.rowTo = rowTo;
    this.colFrom = colFrom;
    this.colTo = colTo;
  }

  @Override
  public Kind kind() {
    return Kind.INDEX;
  }

  @Override
  public Shape shape() {
    return Shape.of(rowTo - rowFrom, colTo - colFrom);
  }

  @Override
  public DataType dataType() {
    return child(0).dataType();
  }

  @Override
  void emit(Emitter emitter) {}

  @Override
  Operand ref(Emitter emitter) {
    return emitter.view(emitter.ref(child(0)), rowFrom, rowTo, colFrom, colTo);
  }
}
