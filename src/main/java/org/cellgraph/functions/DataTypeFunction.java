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

import java.util.List;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.cellgraph.UnsupportedOperationError;
import org.cellgraph.code.DataType;
import org.cellgraph.code.Literal;
import org.cellgraph.code.Node;
import org.cellgraph.code.Shape;

/**
 * A test of its argument's type, such as ISNUMBER. Since every node's type is known during
 * compilation, the call is replaced by a logical constant.
 */
public final class DataTypeFunction extends FunctionEntry {
  private final Predicate<DataType> test;

  public DataTypeFunction(String name, Predicate<DataType> test) {
    super(name);
    this.test = test;
  }

  @Override
  public Shape shape(List<Node> args) {
    return Shape.SCALAR;
  }

  @Override
  public DataType resultType(List<Node> args) {
    return DataType.BOOLEAN;
  }

  @Override
  public Node buildNode(Supplier<String> names, List<Node> args) {
    if (args.size() != 1) {
      throw UnsupportedOperationError.of("%s takes one argument", name());
    }
    return new Literal(names.get(), test.test(args.get(0).dataType()), DataType.BOOLEAN);
  }
}
