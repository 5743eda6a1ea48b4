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
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import org.cellgraph.runtime.Handles;
import org.cellgraph.runtime.RandomFunctions;

/** Uniform random numbers in [0, 1), one for each element of the shape. */
public final class Random extends Node {
  private static final MethodHandle RAND =
      Handles.findStatic(
          RandomFunctions.class,
          "rand",
          MethodType.methodType(Object.class, int.class, int.class));

  private final Shape shape;

  public Random(String name, Shape shape) {
    super(name, ImmutableList.of());
    this.shape = shape;
  }

  @Override
  public Kind kind() {
    return Kind.RANDOM;
  }

  @Override
  public Shape shape() {
    return shape;
  }

  @Override
  public boolean isVolatile() {
    return true;
  }

  @Override
  void emit(Emitter emitter) {
    MethodHandle handle = MethodHandles.insertArguments(RAND, 0, shape.height, shape.width);
    emitter.add(
        new Statement.Assign(
            emitter.slot(this), new Expr.Call(handle, "rand", ImmutableList.of())));
  }
}
