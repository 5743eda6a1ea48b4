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
import org.cellgraph.code.ArrayLiteral;
import org.cellgraph.code.Node;
import org.jspecify.annotations.Nullable;

/** Compiles a range by compiling each of its cells and combining them into an array. */
final class RangeBuildFrame extends Frame {
  private final ImmutableList<Reference> cells;
  private final List<Node> nodes = new ArrayList<>();

  RangeBuildFrame(CompilationKey.Range key, CompileContext context) {
    super(key, key.reference, context);
    this.cells = key.reference.cells(context.resolver);
  }

  @Override
  @Nullable CompilationKey nextReference() {
    int next = nodes.size();
    return (next < cells.size()) ? new CompilationKey.Range(cells.get(next)) : null;
  }

  @Override
  void pushNode(Node node) {
    nodes.add(node);
  }

  @Override
  Node finish() {
    return new ArrayLiteral(nextName(), activeCell.shape(), nodes);
  }
}
