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
import java.util.List;
import java.util.function.Supplier;
import org.cellgraph.code.CallTarget;
import org.cellgraph.code.Node;

/**
 * A function that can be called from a formula. Given the nodes for its arguments, an entry builds
 * the node for the call; usually that is a {@link org.cellgraph.code.FunctionCall} whose target is
 * this entry, but some entries (constants, type tests) produce other nodes.
 */
public abstract class FunctionEntry implements CallTarget {
  private final String name;

  protected FunctionEntry(String name) {
    this.name = name;
  }

  @Override
  public final String name() {
    return name;
  }

  /**
   * Returns the node for a call with the given arguments.
   *
   * @param names supplies a fresh, unique name for each node created
   */
  public abstract Node buildNode(Supplier<String> names, List<Node> args);

  @Override
  public boolean supportsInPlace() {
    return false;
  }

  @Override
  public boolean isVolatile() {
    return false;
  }

  @Override
  public MethodHandle implementation(int arity) {
    throw new IllegalStateException(name + " has no runtime implementation");
  }

  @Override
  public MethodHandle inPlaceImplementation() {
    throw new IllegalStateException(name + " cannot be computed in place");
  }

  @Override
  public String toString() {
    return name;
  }
}
