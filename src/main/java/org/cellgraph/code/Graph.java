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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

/** The IR for a compilation: the declared inputs and one Output node per declared output. */
public final class Graph {
  public final ImmutableList<Input> inputs;
  public final ImmutableList<Output> outputs;

  public Graph(ImmutableList<Input> inputs, ImmutableList<Output> outputs) {
    this.inputs = inputs;
    this.outputs = outputs;
  }

  /**
   * Calls {@code visitor} on every node reachable from the outputs, each node after all of its
   * children. Children are read as the walk reaches them, so the visitor may replace the node it
   * is given.
   */
  public void visit(Consumer<Node> visitor) {
    Set<Node> visited = new HashSet<>();
    for (Output output : outputs) {
      walk(output, visited::contains, visited, visitor);
    }
  }

  /** Returns every node reachable from the outputs, each after all of its children. */
  public List<Node> nodes() {
    List<Node> result = new ArrayList<>();
    visit(result::add);
    return result;
  }

  /**
   * Returns {@code root} and its descendants in post-order, not descending into (or including)
   * nodes for which {@code skip} returns true.
   */
  public static List<Node> postOrder(Node root, Predicate<Node> skip) {
    List<Node> result = new ArrayList<>();
    Set<Node> visited = new HashSet<>();
    walk(root, n -> skip.test(n) || visited.contains(n), visited, result::add);
    return result;
  }

  private static void walk(
      Node root, Predicate<Node> skip, Set<Node> visited, Consumer<Node> visitor) {
    if (skip.test(root)) {
      return;
    }
    Deque<Node> nodes = new ArrayDeque<>();
    Deque<Integer> positions = new ArrayDeque<>();
    nodes.push(root);
    positions.push(0);
    visited.add(root);
    while (!nodes.isEmpty()) {
      Node node = nodes.peek();
      int next = positions.pop();
      if (next < node.children().size()) {
        positions.push(next + 1);
        Node child = node.child(next);
        if (!skip.test(child)) {
          visited.add(child);
          nodes.push(child);
          positions.push(0);
        }
      } else {
        nodes.pop();
        visitor.accept(node);
      }
    }
  }

  @Override
  public String toString() {
    return "Graph" + outputs;
  }
}
