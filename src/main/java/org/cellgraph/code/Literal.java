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

import com.google.common.collect.ImmutableList;
import org.cellgraph.runtime.Grid;
import org.jspecify.annotations.Nullable;

/** A constant: a literal cell, a literal in a formula, or the result of constant folding. */
public final class Literal extends Node {
  private final @Nullable Object value;
  private final DataType type;

  public Literal(String name, @Nullable Object value, DataType type) {
    super(name, ImmutableList.of());
    this.value = value;
    this.type = type;
  }

  /** Creates a Literal whose type is inferred from its value. */
  public Literal(String name, @Nullable Object value) {
    this(name, value, inferType(value));
  }

  private static DataType inferType(@Nullable Object value) {
    if (value instanceof Grid grid) {
      for (Object element : grid.elements()) {
        if (element != null) {
          return DataType.of(element);
        }
      }
      return DataType.BLANK;
    }
    return DataType.of(value);
  }

  public @Nullable Object value() {
    return value;
  }

  @Override
  public Kind kind() {
    return Kind.LITERAL;
  }

  @Override
  public Shape shape() {
    return (value instanceof Grid grid) ? Shape.of(grid.height(), grid.width()) : Shape.SCALAR;
  }

  @Override
  public DataType dataType() {
    return type;
  }

  @Override
  void emit(Emitter emitter) {
    if (value instanceof Grid grid) {
      emitter.add(new Statement.Assign(emitter.slot(this), new Expr.Copy(grid)));
    }
  }

  @Override
  Operand ref(Emitter emitter) {
    return (value instanceof Grid) ? emitter.slot(this) : emitter.constant(value);
  }
}
