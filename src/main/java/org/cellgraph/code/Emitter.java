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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Translates an IR graph into a {@link Program}. Each node is emitted once, after the nodes it
 * depends on; the node decides which statements compute its value and how its parents refer to it.
 */
public final class Emitter {
  private final List<Program.Parameter> parameters = new ArrayList<>();
  private final Map<String, Operand.Slot> slots = new HashMap<>();
  private final List<String> slotNames = new ArrayList<>();
  private final Set<Node> emitted = new HashSet<>();
  private List<Statement> current = new ArrayList<>();
  private final List<Statement> body = current;

  public Emitter() {}

  /** Returns the program that computes each of the graph's outputs. */
  public static Program emit(Graph graph) {
    Emitter emitter = new Emitter();
    for (Input input : graph.inputs) {
      emitter.declareParameter(input);
    }
    ImmutableMap.Builder<String, Operand> outputs = ImmutableMap.builder();
    for (Output output : graph.outputs) {
      emitter.emitTree(output);
      outputs.put(output.outputName, emitter.ref(output));
    }
    return emitter.build(outputs.buildOrThrow());
  }

  /** Makes {@code input} a parameter of the program; parameters are numbered in call order. */
  public void declareParameter(Input input) {
    parameters.add(
        new Program.Parameter(
            input.parameterName,
            slot(input),
            input.shape(),
            input.dataType(),
            input.defaultValue()));
    emitted.add(input);
  }

  public Program build(ImmutableMap<String, Operand> outputs) {
    Preconditions.checkState(current == body, "Unfinished block");
    return new Program(
        ImmutableList.copyOf(parameters),
        ImmutableList.copyOf(body),
        outputs,
        ImmutableList.copyOf(slotNames));
  }

  public boolean isEmitted(Node node) {
    return emitted.contains(node);
  }

  /** Emits {@code root} and everything it depends on that has not already been emitted. */
  public void emitTree(Node root) {
    if (emitted.contains(root)) {
      return;
    }
    Deque<Node> nodes = new ArrayDeque<>();
    Deque<Integer> positions = new ArrayDeque<>();
    nodes.push(root);
    positions.push(0);
    while (!nodes.isEmpty()) {
      Node node = nodes.peek();
      int next = positions.pop();
      if (node instanceof Conditional) {
        nodes.pop();
        node.emit(this);
        emitted.add(node);
      } else if (next < node.children().size()) {
        positions.push(next + 1);
        Node child = node.child(next);
        if (!emitted.contains(child)) {
          nodes.push(child);
          positions.push(0);
        }
      } else {
        nodes.pop();
        node.emit(this);
        emitted.add(node);
      }
    }
  }

  /** Returns the operand that refers to an emitted node's value. */
  public Operand ref(Node node) {
    return node.ref(this);
  }

  /** Returns the slot that holds the value of the given node, allocating it if necessary. */
  public Operand.Slot slot(Node node) {
    return slots.computeIfAbsent(
        node.name(),
        name -> {
          slotNames.add(name);
          return new Operand.Slot(slotNames.size() - 1, name);
        });
  }

  /** Returns an operand for a scalar constant. */
  Operand constant(@Nullable Object value) {
    return new Operand.Constant(value);
  }

  Operand view(Operand base, int rowFrom, int rowTo, int colFrom, int colTo) {
    return new Operand.View(base, rowFrom, rowTo, colFrom, colTo);
  }

  public void add(Statement statement) {
    current.add(statement);
  }

  /** Runs {@code emitBlock} with statements redirected to a new list, and returns that list. */
  ImmutableList<Statement> block(Runnable emitBlock) {
    List<Statement> saved = current;
    current = new ArrayList<>();
    try {
      emitBlock.run();
      return ImmutableList.copyOf(current);
    } finally {
      current = saved;
    }
  }
}
