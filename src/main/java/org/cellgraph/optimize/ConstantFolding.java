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

package org.cellgraph.optimize;

import org.apache.log4j.Logger;
import org.cellgraph.code.Graph;
import org.cellgraph.code.Interpreter;
import org.cellgraph.code.Literal;
import org.cellgraph.code.Node;
import org.cellgraph.runtime.Grid;

/**
 * Replaces each non-volatile node whose children are all literals with a literal holding its
 * value. Since nodes are visited after their children, whole constant subexpressions (including
 * aggregates over constant ranges) collapse to a single literal.
 */
public final class ConstantFolding implements GraphPass {
  private static final Logger logger = Logger.getLogger(ConstantFolding.class);

  @Override
  public String name() {
    return "collapse-literals";
  }

  @Override
  public void apply(Graph graph) {
    graph.visit(
        node -> {
          if (isFoldable(node)) {
            fold(node);
          }
        });
  }

  private static boolean isFoldable(Node node) {
    if (node.kind() == Node.Kind.OUTPUT || node.children().isEmpty() || node.isVolatile()) {
      return false;
    }
    return node.children().stream().allMatch(child -> child instanceof Literal);
  }

  private static void fold(Node node) {
    Object value = Interpreter.evaluateConstant(node);
    if (value instanceof Grid grid) {
      // Runtime values may share storage with other grids.
      value = grid.copy();
    }
    Literal literal = new Literal(node.name(), value, node.dataType());
    logger.debug(String.format("Folded %s to %s", node, value));
    node.replaceInGraph(literal);
    node.detach();
  }
}
