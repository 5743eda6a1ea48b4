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

/** One step of a {@link Program}. */
public abstract class Statement {
  private Statement() {}

  /** Renders this statement as pseudo-code, with each line prefixed by {@code indent}. */
  abstract void print(StringBuilder sb, String indent);

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    print(sb, "");
    return sb.toString().trim();
  }

  /** Sets a slot to the value of an expression. */
  public static final class Assign extends Statement {
    public final Operand.Slot slot;
    public final Expr expr;

    public Assign(Operand.Slot slot, Expr expr) {
      this.slot = slot;
      this.expr = expr;
    }

    @Override
    void print(StringBuilder sb, String indent) {
      sb.append(indent).append(slot).append(" = ").append(expr).append('\n');
    }
  }

  /** Evaluates an expression for its side effects, discarding the result. */
  public static final class Perform extends Statement {
    public final Expr.Call call;

    public Perform(Expr.Call call) {
      this.call = call;
    }

    @Override
    void print(StringBuilder sb, String indent) {
      sb.append(indent).append(call).append('\n');
    }
  }

  /** Stores a value into one element of a Grid. */
  public static final class Store extends Statement {
    public final Operand buffer;
    public final int row;
    public final int col;
    public final Operand value;

    public Store(Operand buffer, int row, int col, Operand value) {
      this.buffer = buffer;
      this.row = row;
      this.col = col;
      this.value = value;
    }

    @Override
    void print(StringBuilder sb, String indent) {
      sb.append(indent)
          .append(String.format("%s[%s, %s] = %s", buffer, row, col, value))
          .append('\n');
    }
  }

  /** Executes one of two blocks depending on a condition. */
  public static final class Branch extends Statement {
    public final Operand condition;
    public final ImmutableList<Statement> ifTrue;
    public final ImmutableList<Statement> ifFalse;

    public Branch(
        Operand condition, ImmutableList<Statement> ifTrue, ImmutableList<Statement> ifFalse) {
      this.condition = condition;
      this.ifTrue = ifTrue;
      this.ifFalse = ifFalse;
    }

    @Override
    void print(StringBuilder sb, String indent) {
      String inner = indent + "  ";
      sb.append(indent).append("if (").append(condition).append(") {\n");
      ifTrue.forEach(s -> s.print(sb, inner));
      sb.append(indent).append("} else {\n");
      ifFalse.forEach(s -> s.print(sb, inner));
      sb.append(indent).append("}\n");
    }
  }
}
