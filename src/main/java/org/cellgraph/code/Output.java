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
import java.lang.invoke.MethodHandle;
import org.cellgraph.runtime.Handles;
import org.cellgraph.runtime.Values;

/**
 * One of the values returned by the compiled function. Rows and columns are returned as lists;
 * other values are returned unchanged.
 */
public final class Output extends Node {
  private static final MethodHandle TO_VECTOR = Handles.findGeneric(Values.class, "toVector", 1);

  public final String outputName;

  public Output(String name, String outputName, Node value) {
    super(name, ImmutableList.of(value));
    this.outputName = outputName;
  }

  @Override
  public Kind kind() {
    return Kind.OUTPUT;
  }

  @Override
  public Shape shape() {
    return child(0).shape();
  }

  @Override
  public DataType dataType() {
    return child(0).dataType();
  }

  @Override
  void emit(Emitter emitter) {
    if (shape().isVector()) {
      emitter.add(
          new Statement.Assign(
              emitter.slot(this),
              new Expr.Call(TO_VECTOR, "toVector", ImmutableList.of(emitter.ref(child(0))))));
    }
  }

  @Override
  Operand ref(Emitter emitter) {
    return shape().isVector() ? emitter.slot(this) : emitter.ref(child(0));
  }
}
