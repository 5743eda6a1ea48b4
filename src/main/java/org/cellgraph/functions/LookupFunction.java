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

import com.google.common.collect.ImmutableList;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.List;
import java.util.function.Supplier;
import org.cellgraph.InvalidReferenceError;
import org.cellgraph.UnsupportedOperationError;
import org.cellgraph.code.DataType;
import org.cellgraph.code.FunctionCall;
import org.cellgraph.code.Index;
import org.cellgraph.code.Literal;
import org.cellgraph.code.Node;
import org.cellgraph.code.Shape;
import org.cellgraph.runtime.Handles;
import org.cellgraph.runtime.LookupFunctions;
import org.cellgraph.runtime.Values;

/**
 * VLOOKUP, HLOOKUP and LOOKUP. The table is split during compilation into a key vector and a
 * result vector (so the column or row number must be a constant); the call node then has children
 * (target, keys, results, approximate).
 */
public final class LookupFunction extends FunctionEntry {
  /** Which form of lookup this is. */
  public enum Form {
    VERTICAL,
    HORIZONTAL,
    VECTOR
  }

  private static final MethodHandle BROADCAST_TARGET =
      Handles.collecting(
          MethodHandles.insertArguments(
              Handles.findStatic(
                  Values.class,
                  "broadcast",
                  MethodType.methodType(
                      Object.class, MethodHandle.class, int[].class, Object[].class)),
              0,
              Handles.findGeneric(LookupFunctions.class, "lookup", 4),
              new int[] {0}),
          4);

  private final Form form;

  public LookupFunction(String name, Form form) {
    super(name);
    this.form = form;
  }

  @Override
  public Shape shape(List<Node> args) {
    return args.get(0).shape();
  }

  @Override
  public DataType resultType(List<Node> args) {
    return args.get(2).dataType();
  }

  @Override
  public Node buildNode(Supplier<String> names, List<Node> args) {
    int min = (form == Form.VECTOR) ? 2 : 3;
    if (args.size() < min || args.size() > min + 1) {
      throw UnsupportedOperationError.of(
          "%s called with %s arguments (expected %s or %s)", name(), args.size(), min, min + 1);
    }
    Node target = args.get(0);
    Node table = args.get(1);
    Shape shape = table.shape();
    Node keys;
    Node results;
    Node approximate;
    if (form == Form.VECTOR) {
      keys = table;
      results = (args.size() == 3) ? args.get(2) : table;
      if (results.shape().size() != shape.size()) {
        throw UnsupportedOperationError.of("%s vectors have different sizes", name());
      }
      approximate = new Literal(names.get(), true, DataType.BOOLEAN);
    } else {
      int index = constantIndex(args.get(2));
      int limit = (form == Form.VERTICAL) ? shape.width : shape.height;
      if (index < 1 || index > limit) {
        throw InvalidReferenceError.of("%s index %s is outside the table %s", name(), index, shape);
      }
      if (form == Form.VERTICAL) {
        keys = new Index(names.get(), table, 0, shape.height, 0, 1);
        results = new Index(names.get(), table, 0, shape.height, index - 1, index);
      } else {
        keys = new Index(names.get(), table, 0, 1, 0, shape.width);
        results = new Index(names.get(), table, index - 1, index, 0, shape.width);
      }
      approximate =
          (args.size() == 4) ? args.get(3) : new Literal(names.get(), true, DataType.BOOLEAN);
    }
    return new FunctionCall(
        names.get(), this, ImmutableList.of(target, keys, results, approximate));
  }

  private int constantIndex(Node node) {
    if (node instanceof Literal literal && literal.value() instanceof Double d) {
      return d.intValue();
    }
    throw UnsupportedOperationError.of("%s requires a constant column or row number", name());
  }

  @Override
  public MethodHandle implementation(int arity) {
    return BROADCAST_TARGET;
  }
}
