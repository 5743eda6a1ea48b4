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
import java.lang.invoke.MethodType;
import org.cellgraph.code.DataType;

/**
 * A function supplied by the application, implemented by a MethodHandle taking and returning
 * scalars. Array arguments are handled elementwise.
 */
public final class UserFunction extends ScalarFunction {
  private final boolean isVolatile;

  private UserFunction(Builder builder, int[] iterate, boolean isVolatile) {
    super(builder, iterate);
    this.isVolatile = isVolatile;
  }

  /**
   * Returns a user function with a numeric result.
   *
   * @param isVolatile if true, each call is evaluated separately and never folded into a constant
   */
  public static UserFunction of(String name, MethodHandle handle, boolean isVolatile) {
    return of(name, handle, isVolatile, DataType.NUMBER);
  }

  public static UserFunction of(
      String name, MethodHandle handle, boolean isVolatile, DataType resultType) {
    int arity = handle.type().parameterCount();
    MethodHandle generic = handle.asType(MethodType.genericMethodType(arity));
    int[] iterate = new int[arity];
    for (int i = 0; i < arity; i++) {
      iterate[i] = i;
    }
    return new UserFunction(
        Function.builder(name, generic).returns(resultType), iterate, isVolatile);
  }

  @Override
  public boolean isVolatile() {
    return isVolatile;
  }
}
