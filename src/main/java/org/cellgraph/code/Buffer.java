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

/**
 * A newly-allocated array whose elements are written by a chain of {@link BufferAssignment}s and
 * read through {@link BufferIndex} views.
 */
public final class Buffer extends Node {
  private final Shape shape;
  private final DataType type;

  public Buffer(String name, Shape shape, DataType type) {
    super(name, ImmutableList.of());
    this.shape = shape;
    this.type = type;
  }

  @Override
  public Kind kind() {
    return Kind.BUFFER;
  }

  @Override
  public Shape shape() {
    return shape;
  }

  @Override
  public DataType dataType() {
    return type;
  }

  @Override
  void emit(Emitter emitter) {
    emitter.add(
        new Statement.Assign(emitter.slot(this), new Expr.Allocate(shape.height, shape.width)));
  }
}
