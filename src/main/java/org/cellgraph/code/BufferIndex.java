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
 * A region of a {@link Buffer}. The second child is the last assignment that must complete before
 * the region may be read.
 */
public final class BufferIndex extends Node {
  public final Buffer buffer;
  public final int rowFrom;
  public final int rowTo;
  public final int colFrom;
  public final int colTo;

  public BufferIndex(
      String name, Buffer buffer, Node lastWrite, int rowFrom, int rowTo, int colFrom, int colTo) {
    super(name, ImmutableList.of(buffer, lastWrite));
    this.buffer = buffer;
    this.rowFrom = rowFrom;
    this.rowTo = rowTo;
    this.colFrom = colFrom;
    this.colTo = colTo;
  }

  @Override
  public Kind kind() {
    return Kind.BUFFER_INDEX;
  }

  @Override
  public Shape shape() {
    return Shape.of(rowTo - rowFrom, colTo - colFrom);
  }

  @Override
  public DataType dataType() {
    return buffer.dataType();
  }

  @Override
  void emit(Emitter emitter) {}

  @Override
  Operand ref(Emitter emitter) {
    return emitter.view(emitter.ref(buffer), rowFrom, rowTo, colFrom, colTo);
  }
}
