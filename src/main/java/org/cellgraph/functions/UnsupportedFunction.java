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
import java.util.function.Supplier;
import org.cellgraph.UnsupportedOperationError;
import org.cellgraph.code.DataType;
import org.cellgraph.code.Node;
import org.cellgraph.code.Shape;

/** A known spreadsheet function that cannot be compiled, with the reason why. */
public final class UnsupportedFunction extends FunctionEntry {
  public final String reason;

  public UnsupportedFunction(String name, String reason) {
    super(name);
    this.reason = reason;
  }

  UnsupportedOperationError error() {
    return UnsupportedOperationError.of("Function %s is not supported: %s", name(), reason);
  }

  @Override
  public Shape shape(List<Node> args) {
    throw error();
  }

  @Override
  public DataType resultType(List<Node> args) {
    throw error();
  }

  @Override
  public Node buildNode(Supplier<String> names, List<Node> args) {
    throw error();
  }
}
