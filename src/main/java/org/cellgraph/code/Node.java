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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A node in the IR graph. Each node has a unique name (which becomes the name of the slot holding
 * its value), an ordered list of children, and a list of back-references to its parents (one entry
 * for each child slot that refers to this node, so a parent that uses a node twice appears twice).
 *
 * <p>The set of Node subclasses is closed; each identifies itself with a {@link Kind}.
 */
public abstract class Node {

  /** Identifies the subclass of a Node. */
  public enum Kind {
    LITERAL,
    BINARY_OP,
    COMPARISON,
    FUNCTION_CALL,
    ARRAY_LITERAL,
    FLAT_ARRAY,
    INDEX,
    RANDOM,
    RANDOM_RANGE,
    INPUT,
    OUTPUT,
    BUFFER,
    BUFFER_ASSIGNMENT,
    BUFFER_INDEX,
    CONDITIONAL
  }

  private final String name;
  private final List<Node> children;
  private final List<Node> parents = new ArrayList<>();

  Node(String name, List<Node> children) {
    this.name = name;
    this.children = new ArrayList<>(children);
    for (Node child : children) {
      child.parents.add(this);
    }
  }

  public abstract Kind kind();

  public abstract Shape shape();

  public DataType dataType() {
    return DataType.NUMBER;
  }

  /** True if evaluating this node twice may give different results. */
  public boolean isVolatile() {
    return false;
  }

  public final String name() {
    return name;
  }

  public final List<Node> children() {
    return Collections.unmodifiableList(children);
  }

  public final Node child(int i) {
    return children.get(i);
  }

  public final List<Node> parents() {
    return Collections.unmodifiableList(parents);
  }

  /**
   * Adds the statements that compute this node's value to {@code emitter}. Called only after each
   * child has been emitted.
   */
  abstract void emit(Emitter emitter);

  /** Returns the operand that parents use to refer to this node's value. */
  Operand ref(Emitter emitter) {
    return emitter.slot(this);
  }

  /**
   * Makes each parent of this node refer to {@code replacement} instead. If a parent refers to
   * this node more than once, each of those references is replaced.
   */
  public final void replaceInGraph(Node replacement) {
    Preconditions.checkArgument(replacement != this);
    for (Node parent : ImmutableList.copyOf(parents)) {
      parent.replaceChild(this, replacement);
    }
  }

  /** Replaces the first child slot holding {@code oldChild} with {@code newChild}. */
  final void replaceChild(Node oldChild, Node newChild) {
    int index = indexOfChild(oldChild);
    Preconditions.checkState(index >= 0, "%s is not a child of %s", oldChild, this);
    children.set(index, newChild);
    newChild.parents.add(this);
    removeParent(oldChild, this);
  }

  /** Removes this node from the parent lists of its children. */
  public final void detach() {
    for (Node child : children) {
      removeParent(child, this);
    }
  }

  private int indexOfChild(Node child) {
    for (int i = 0; i < children.size(); i++) {
      if (children.get(i) == child) {
        return i;
      }
    }
    return -1;
  }

  private static void removeParent(Node child, Node parent) {
    for (int i = 0; i < child.parents.size(); i++) {
      if (child.parents.get(i) == parent) {
        child.parents.remove(i);
        return;
      }
    }
  }

  /** True if any of {@code targets} is a (transitive) parent of this node. */
  public final boolean dependsOn(Collection<? extends Node> targets) {
    Set<Node> visited = new HashSet<>();
    Deque<Node> pending = new ArrayDeque<>(parents);
    while (!pending.isEmpty()) {
      Node next = pending.removeLast();
      if (visited.add(next)) {
        if (targets.contains(next)) {
          return true;
        }
        pending.addAll(next.parents);
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return String.format("%s:%s%s", kind(), name, shape());
  }
}
