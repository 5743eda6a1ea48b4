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
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * A straight-line program (with nested conditional blocks) that computes a set of named outputs
 * from a set of named parameters. All values live in numbered slots.
 */
public final class Program {

  /** A named input to the program. */
  public static final class Parameter {
    public final String name;
    public final Operand.Slot slot;
    public final Shape shape;
    public final DataType type;

    /** Used when the caller does not supply a value; a Grid here is copied before use. */
    public final @Nullable Object defaultValue;

    Parameter(
        String name, Operand.Slot slot, Shape shape, DataType type, @Nullable Object defaultValue) {
      this.name = name;
      this.slot = slot;
      this.shape = shape;
      this.type = type;
      this.defaultValue = defaultValue;
    }

    @Override
    public String toString() {
      return name + "=" + defaultValue;
    }
  }

  public final ImmutableList<Parameter> parameters;
  public final ImmutableList<Statement> body;
  public final ImmutableMap<String, Operand> outputs;

  /** The name of each slot, indexed by slot number. */
  public final ImmutableList<String> slotNames;

  Program(
      ImmutableList<Parameter> parameters,
      ImmutableList<Statement> body,
      ImmutableMap<String, Operand> outputs,
      ImmutableList<String> slotNames) {
    this.parameters = parameters;
    this.body = body;
    this.outputs = outputs;
    this.slotNames = slotNames;
  }

  public int slotCount() {
    return slotNames.size();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("program(");
    for (int i = 0; i < parameters.size(); i++) {
      sb.append(i == 0 ? "" : ", ").append(parameters.get(i));
    }
    sb.append(") {\n");
    body.forEach(s -> s.print(sb, "  "));
    sb.append("  return ").append(outputs).append("\n}\n");
    return sb.toString();
  }
}
