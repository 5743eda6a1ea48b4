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
import java.lang.invoke.MethodType;
import java.util.List;
import org.cellgraph.runtime.Handles;
import org.cellgraph.runtime.Values;

/**
 * The elements of each child (scalars or arrays) concatenated into a single column; used to pass
 * a variable number of arguments to an aggregating function.
 */
public final class FlatArray extends ArrayNode {
  private static final MethodHandle FLATTEN =
      Handles.findStatic(
          Values.class, "flatten", MethodType.methodType(Object.class, Object[].class));

  public FlatArray(String name, List<Node> parts) {
    super(name, parts);
  }

  @Override
  public Kind kind() {
    return Kind.FLAT_ARRAY;
  }

  @Override
  public Shape shape() {
    return Shape.of(children().stream().mapToInt(c -> c.shape().size()).sum(), 1);
  }

  @Override
  void emit(Emitter emitter) {
    ImmutableList<Operand> parts =
        children().stream().map(emitter::ref).collect(ImmutableList.toImmutableList());
    emitter.add(
        new Statement.Assign(
            emitter.slot(this),
            new Expr.Call(Handles.collecting(FLATTEN, parts.size()), "flatten", parts)));
  }
}
