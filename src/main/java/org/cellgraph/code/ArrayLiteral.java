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
import java.util.List;

/** An array assembled from one node per element, in row-major order. */
public final class ArrayLiteral extends ArrayNode {
  private final Shape shape;

  public ArrayLiteral(String name, Shape shape, List<Node> elements) {
    super(name, elements);
    Preconditions.checkArgument(
        elements.size() == shape.size(), "%s elements for shape %s", elements.size(), shape);
    this.shape = shape;
  }

  @Override
  public Kind kind() {
    return Kind.ARRAY_LITERAL;
  }

  @Override
  public Shape shape() {
    return shape;
  }

  @Override
  void emit(Emitter emitter) {
    Operand.Slot slot = emitter.slot(this);
    emitter.add(new Statement.Assign(slot, new Expr.Allocate(shape.height, shape.width)));
    List<Node> elements = children();
    for (int i = 0; i < elements.size(); i++) {
      emitter.add(
          new Statement.Store(
              slot, i / shape.width, i % shape.width, emitter.ref(elements.get(i))));
    }
  }
}
