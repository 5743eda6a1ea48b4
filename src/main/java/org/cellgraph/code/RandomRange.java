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

/** Random integers between the values of its two children (inclusive). */
public final class RandomRange extends Node {
  private static final MethodHandle RAND_BETWEEN =
      Handles.findStatic(
          RandomFunctions.class,
          "randBetween",
          MethodType.methodType(
              Object.class, int.class, int.class, Object.class, Object.class));

  private final Shape shape;

  public RandomRange(String name, Node low, Node high, Shape shape) {
    super(name, ImmutableList.of(low, high));
    this.shape = shape;
  }

  @Override
  public Kind kind() {
    return Kind.RANDOM_RANGE;
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
    MethodHandle handle =
        MethodHandles.insertArguments(RAND_BETWEEN, 0, shape.height, shape.width);
    emitter.add(
        new Statement.Assign(
            emitter.slot(this),
            new Expr.Call(
                handle,
                "randbetween",
                ImmutableList.of(emitter.ref(child(0)), emitter.ref(child(1))))));
  }
}
