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
import com.google.common.collect.Lists;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A scalar choice between two values that only computes the chosen one. The children are the
 * condition, the value if true, and the value if false.
 *
 * <p>Only nodes used exclusively by one alternative are computed inside its branch; anything that
 * is also needed elsewhere is computed before the condition is tested.
 */
public final class Conditional extends Node {

  public Conditional(String name, Node condition, Node ifTrue, Node ifFalse) {
    super(name, ImmutableList.of(condition, ifTrue, ifFalse));
  }

  @Override
  public Kind kind() {
    return Kind.CONDITIONAL;
  }

  @Override
  public Shape shape() {
    return Shape.SCALAR;
  }

  @Override
  public DataType dataType() {
    return child(1).dataType();
  }

  /** Unlike other nodes, a Conditional is emitted before its children; it emits them itself. */
  @Override
  void emit(Emitter emitter) {
    hoistShared(child(1), emitter);
    hoistShared(child(2), emitter);
    emitter.emitTree(child(0));
    ImmutableList<Statement> ifTrue = emitter.block(() -> emitBranch(child(1), emitter));
    ImmutableList<Statement> ifFalse = emitter.block(() -> emitBranch(child(2), emitter));
    emitter.add(new Statement.Branch(emitter.ref(child(0)), ifTrue, ifFalse));
  }

  private void emitBranch(Node value, Emitter emitter) {
    emitter.emitTree(value);
    emitter.add(new Statement.Assign(emitter.slot(this), new Expr.Load(emitter.ref(value))));
  }

  /**
   * Emits (in the current block) each node reachable from {@code root} that has a parent outside
   * the part of the graph used only by {@code root}.
   */
  private static void hoistShared(Node root, Emitter emitter) {
    if (root.parents().size() > 1) {
      emitter.emitTree(root);
      return;
    }
    // Reverse post-order visits every parent in the subgraph before its children.
    List<Node> order = Lists.reverse(Graph.postOrder(root, emitter::isEmitted));
    Set<Node> exclusive = new HashSet<>();
    exclusive.add(root);
    for (Node node : order.subList(1, order.size())) {
      if (exclusive.containsAll(node.parents())) {
        exclusive.add(node);
      } else {
        emitter.emitTree(node);
      }
    }
  }
}
