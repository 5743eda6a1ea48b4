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

/** A comparison operator applied to two operands; the result is logical. */
public final class Comparison extends BinaryOp {
  public Comparison(String name, Operator operator, Node left, Node right) {
    super(name, operator, left, right);
  }

  @Override
  public Kind kind() {
    return Kind.COMPARISON;
  }

  @Override
  public DataType dataType() {
    return DataType.BOOLEAN;
  }
}
