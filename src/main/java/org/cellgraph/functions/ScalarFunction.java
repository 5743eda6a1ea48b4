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

package org.cellgraph.functions;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.List;
import org.cellgraph.code.Node;
import org.cellgraph.code.Shape;
import org.cellgraph.runtime.Handles;
import org.cellgraph.runtime.Values;

/**
 * A function with a scalar implementation, broadcast over the arguments at the iteration
 * positions. The result's shape is the merged shape of those arguments.
 */
public class ScalarFunction extends Function {
  private static final MethodHandle BROADCAST =
      Handles.findStatic(
          Values.class,
          "broadcast",
          MethodType.methodType(Object.class, MethodHandle.class, int[].class, Object[].class));

  private final int[] iterate;
  private final MethodHandle broadcast;

  ScalarFunction(Builder builder, int[] iterate) {
    super(builder);
    this.iterate = iterate.clone();
    int arity = impl.type().parameterCount();
    this.broadcast =
        Handles.collecting(MethodHandles.insertArguments(BROADCAST, 0, impl, this.iterate), arity);
  }

  @Override
  public Shape shape(List<Node> args) {
    Shape result = Shape.SCALAR;
    for (int i : iterate) {
      result = Shape.merge(result, args.get(i).shape());
    }
    return result;
  }

  @Override
  public MethodHandle implementation(int arity) {
    checkArity(arity);
    return broadcast;
  }
}
