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
 * Stores a value into one element of a {@link Buffer}. The second child is the previous write to
 * the same buffer (or the buffer itself), which orders the writes.
 */
public final class BufferAssignment extends Node {
  public final Buffer buffer;
  public final int row;
  public final int col;

  public BufferAssignment(
      String name, Buffer buffer, int row, int col, Node value, Node previous) {
    super(name, ImmutableList.of(value, previous));
    this.buffer = buffer;
    this.row = row;
    this.col = col;
  }

  @Override
  public Kind kind() {
    return Kind.BUFFER_ASSIGNMENT;
  }

  /** An assignment has no value of its own; it is only used to order other nodes. */
  @Override
  public Shape shape() {
    return Shape.SCALAR;
  }

  @Override
  public DataType dataType() {
    return child(0).dataType();
  }

  @Override
  void emit(Emitter emitter) {
    emitter.add(new Statement.Store(emitter.ref(buffer), row, col, emitter.ref(child(0))));
  }
}
