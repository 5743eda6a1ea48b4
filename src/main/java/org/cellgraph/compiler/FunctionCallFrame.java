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

package org.cellgraph.compiler;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.cellgraph.UnsupportedOperationError;
import org.cellgraph.code.Node;
import org.cellgraph.functions.FunctionEntry;
import org.jspecify.annotations.Nullable;

/** Compiles each argument of a function call, then asks the function to build its node. */
final class FunctionCallFrame extends Frame {
  private final FunctionEntry entry;
  private final List<ImmutableList<Token>> groups;
  private final List<Node> args = new ArrayList<>();

  FunctionCallFrame(
      CompilationKey.FunctionCall key,
      Reference activeCell,
      CompileContext context,
      FunctionEntry entry) {
    super(key, activeCell, context);
    this.entry = entry;
    this.groups = new ArrayList<>(key.args);
  }

  @Override
  @Nullable CompilationKey nextReference() {
    int next = args.size();
    if (next == groups.size()) {
      return null;
    }
    ImmutableList<Token> group = groups.get(next);
    if (group.isEmpty()) {
      throw UnsupportedOperationError.of("Argument %s of %s is empty", next + 1, entry.name());
    }
    return context.parenKey(group, activeCell);
  }

  @Override
  void pushNode(Node node) {
    args.add(node);
  }

  @Override
  Node finish() {
    return entry.buildNode(this::nextName, args);
  }
}
