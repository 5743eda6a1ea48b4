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

package org.cellgraph.runtime;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;

/** Static helpers for looking up the MethodHandles that generated code calls. */
public final class Handles {
  private Handles() {}

  private static final MethodHandles.Lookup LOOKUP = MethodHandles.publicLookup();

  /** Returns a handle for a public static method; failures are treated as programming errors. */
  public static MethodHandle findStatic(Class<?> klass, String name, MethodType type) {
    try {
      return LOOKUP.findStatic(klass, name, type);
    } catch (ReflectiveOperationException e) {
      throw new AssertionError(e);
    }
  }

  /**
   * Returns a handle for a public static method that takes {@code arity} Object arguments and
   * returns an Object.
   */
  public static MethodHandle findGeneric(Class<?> klass, String name, int arity) {
    return findStatic(klass, name, MethodType.genericMethodType(arity));
  }

  /**
   * Returns a handle that collects {@code arity} Object arguments into an array and passes it as
   * the trailing argument of {@code handle}.
   */
  public static MethodHandle collecting(MethodHandle handle, int arity) {
    return handle.asCollector(Object[].class, arity).asType(MethodType.genericMethodType(arity));
  }
}
