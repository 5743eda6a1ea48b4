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

import java.util.ArrayList;
import java.util.List;
import org.cellgraph.UnsupportedOperationError;

/**
 * Common behavior of the nodes that assemble an array from separately-computed elements. All
 * non-blank elements must have the same type; blank elements are replaced by that type's zero.
 */
abstract class ArrayNode extends Node {
  private final DataType type;

  ArrayNode(String name, List<Node> elements) {
    this(name, elements, elementType(name, elements));
  }

  private ArrayNode(String name, List<Node> elements, DataType type) {
    super(name, fillBlanks(name, elements, type));
    this.type = type;
  }

  private static DataType elementType(String name, List<Node> elements) {
    DataType result = null;
    for (Node element : elements) {
      DataType type = element.dataType();
      if (type == DataType.BLANK) {
        continue;
      } else if (result == null) {
        result = type;
      } else if (result != type) {
        throw UnsupportedOperationError.of(
            "Array %s mixes elements of type %s and %s", name, result, type);
      }
    }
    if (result == null) {
      throw UnsupportedOperationError.of("Array %s has only blank elements", name);
    }
    return result;
  }

  private static List<Node> fillBlanks(String name, List<Node> elements, DataType type) {
    List<Node> result = new ArrayList<>(elements.size());
    Literal zero = null;
    for (Node element : elements) {
      if (element.dataType() == DataType.BLANK) {
        if (zero == null) {
          zero = new Literal(name + "_d", type.zero(), type);
        }
        result.add(zero);
      } else {
        result.add(element);
      }
    }
    return result;
  }

  @Override
  public DataType dataType() {
    return type;
  }
}
