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
import java.util.stream.IntStream;
import org.cellgraph.runtime.Handles;
import org.cellgraph.runtime.Values;

/**
 * A numeric function applied to each element of its arguments. One-argument elementwise functions
 * may overwrite their argument with the result.
 */
public class ElementwiseFunction extends ScalarFunction {
  private static final MethodHandle BROADCAST_INTO =
      Handles.findStatic(
          Values.class,
          "broadcastInto",
          MethodType.methodType(Object.class, MethodHandle.class, Object.class, Object.class));

  ElementwiseFunction(Builder builder) {
    super(builder, IntStream.range(0, builder.impl.type().parameterCount()).toArray());
  }

  @Override
  public boolean supportsInPlace() {
    return impl.type().parameterCount() == 1;
  }

  @Override
  public MethodHandle inPlaceImplementation() {
    if (!supportsInPlace()) {
      return super.inPlaceImplementation();
    }
    return MethodHandles.insertArguments(BROADCAST_INTO, 0, impl);
  }
}
