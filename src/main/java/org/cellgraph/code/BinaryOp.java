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

/** An arithmetic operator applied to two operands. */
public class BinaryOp extends Node {
  public final Operator operator;

  public BinaryOp(String name, Operator operator, Node left, Node right) {
    super(name, ImmutableList.of(left, right));
    Preconditions.checkArgument(
        operator != Operator.CONCAT && operator.isComparison() == (this instanceof Comparison),
        "Wrong node for %s",
        operator);
    this.operator = operator;
    // Incompatible operands are reported where they are parsed.
    Shape unused = Shape.merge(left.shape(), right.shape());
  }

  @Override
  public Kind kind() {
    return Kind.BINARY_OP;
  }

  @Override
  public Shape shape() {
    return Shape.merge(child(0).shape(), child(1).shape());
  }

  @Override
  void emit(Emitter emitter) {
    emitter.add(
        new Statement.Assign(
            emitter.slot(this),
            new Expr.Call(
                operator.handle(),
                operator.symbol,
                ImmutableList.of(emitter.ref(child(0)), emitter.ref(child(1))))));
  }
}
