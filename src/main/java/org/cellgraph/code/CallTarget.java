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

import java.lang.invoke.MethodHandle;
import java.util.List;

/** The function called by a {@link FunctionCall} node. */
public interface CallTarget {
  String name();

  /** The shape of the result when called with the given (prepared) arguments. */
  Shape shape(List<Node> args);

  DataType resultType(List<Node> args);

  /**
   * True if {@link #inPlaceImplementation} may be used to overwrite a single array argument with
   * the result.
   */
  boolean supportsInPlace();

  /** True if each call may return a different result, e.g. because it draws random numbers. */
  boolean isVolatile();

  /** Returns a handle of type {@code (Object, ...)Object} taking {@code arity} arguments. */
  MethodHandle implementation(int arity);

  /**
   * Returns a handle of type {@code (Object, Object)Object} that computes the function of its first
   * argument and stores the result into its second.
   */
  MethodHandle inPlaceImplementation();
}
