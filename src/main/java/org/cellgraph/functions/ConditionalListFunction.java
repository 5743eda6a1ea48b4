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
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.cellgraph.UnsupportedOperationError;
import org.cellgraph.code.DataType;
import org.cellgraph.code.FlatArray;
import org.cellgraph.code.FunctionCall;
import org.cellgraph.code.Node;
import org.cellgraph.code.Shape;
import org.cellgraph.runtime.Handles;
import org.cellgraph.runtime.LogicalFunctions;

/**
 * IFS and SWITCH, which take alternating lists of tests and values. The tests and the values are
 * each collected into a FlatArray; SWITCH also passes its subject and, if present, its default.
 */
public final class ConditionalListFunction extends FunctionEntry {
  private final boolean isSwitch;

  private ConditionalListFunction(String name, boolean isSwitch) {
    super(name);
    this.isSwitch = isSwitch;
  }

  public static ConditionalListFunction ifs() {
    return new ConditionalListFunction("IFS", false);
  }

  public static ConditionalListFunction switchFunction() {
    return new ConditionalListFunction("SWITCH", true);
  }

  @Override
  public Shape shape(List<Node> args) {
    return Shape.SCALAR;
  }

  /** The type of the values, which are the second (prepared) argument of IFS or third of SWITCH. */
  @Override
  public DataType resultType(List<Node> args) {
    return args.get(isSwitch ? 2 : 1).dataType();
  }

  @Override
  public Node buildNode(Supplier<String> names, List<Node> args) {
    int start = isSwitch ? 1 : 0;
    int pairs = (args.size() - start) / 2;
    boolean hasDefault = isSwitch && (args.size() - start) % 2 == 1;
    if (pairs == 0 || (!isSwitch && args.size() % 2 != 0)) {
      throw UnsupportedOperationError.of("%s called with %s arguments", name(), args.size());
    }
    List<Node> tests = new ArrayList<>();
    List<Node> values = new ArrayList<>();
    for (int i = 0; i < pairs; i++) {
      tests.add(args.get(start + 2 * i));
      values.add(args.get(start + 2 * i + 1));
    }
    ImmutableList.Builder<Node> prepared = ImmutableList.builder();
    if (isSwitch) {
      prepared.add(args.get(0));
    }
    prepared.add(new FlatArray(names.get(), tests), new FlatArray(names.get(), values));
    if (hasDefault) {
      prepared.add(args.get(args.size() - 1));
    }
    return new FunctionCall(names.get(), this, prepared.build());
  }

  @Override
  public MethodHandle implementation(int arity) {
    if (!isSwitch) {
      return Handles.findGeneric(LogicalFunctions.class, "ifs", 2);
    }
    return (arity == 4)
        ? Handles.findGeneric(LogicalFunctions.class, "switchOrDefault", 4)
        : Handles.findGeneric(LogicalFunctions.class, "switchOf", 3);
  }
}
