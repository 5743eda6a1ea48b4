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
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodType;
import java.util.stream.Collectors;
import org.cellgraph.runtime.Grid;

/** The value computed by an {@link Statement.Assign} or a {@link Statement.Perform}. */
public abstract class Expr {
  private Expr() {}

  /**
   * Calls a MethodHandle with one argument per operand. The handle is adapted to type {@code
   * (Object, ...)Object}.
   */
  public static final class Call extends Expr {
    public final MethodHandle handle;
    public final String name;
    public final ImmutableList<Operand> operands;

    public Call(MethodHandle handle, String name, ImmutableList<Operand> operands) {
      this.handle = handle.asType(MethodType.genericMethodType(operands.size()));
      this.name = name;
      this.operands = operands;
    }

    @Override
    public String toString() {
      return operands.stream()
          .map(Object::toString)
          .collect(Collectors.joining(", ", name + "(", ")"));
    }
  }

  /** A fresh copy of a constant Grid. */
  public static final class Copy extends Expr {
    public final Grid value;

    public Copy(Grid value) {
      this.value = value;
    }

    @Override
    public String toString() {
      return "copy(" + value + ")";
    }
  }

  /** A new Grid of the given size, to be filled by {@link Statement.Store}s. */
  public static final class Allocate extends Expr {
    public final int height;
    public final int width;

    public Allocate(int height, int width) {
      this.height = height;
      this.width = width;
    }

    @Override
    public String toString() {
      return String.format("allocate(%s, %s)", height, width);
    }
  }

  /** The value of an operand. */
  public static final class Load extends Expr {
    public final Operand operand;

    public Load(Operand operand) {
      this.operand = operand;
    }

    @Override
    public String toString() {
      return operand.toString();
    }
  }
}
