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

import java.lang.invoke.MethodHandle;
import java.util.Arrays;
import java.util.Optional;
import org.cellgraph.runtime.Handles;
import org.cellgraph.runtime.Operators;

/** The infix operators, with their precedence and runtime implementation. */
public enum Operator {
  POWER("^", 5, "power"),
  MULTIPLY("*", 4, "multiply"),
  DIVIDE("/", 4, "divide"),
  ADD("+", 3, "add"),
  SUBTRACT("-", 3, "subtract"),
  CONCAT("&", 2, "concat"),
  EQ("=", 1, "eq"),
  NE("<>", 1, "ne"),
  LT("<", 1, "lt"),
  LE("<=", 1, "le"),
  GT(">", 1, "gt"),
  GE(">=", 1, "ge");

  public final String symbol;
  public final int precedence;
  private final MethodHandle handle;

  Operator(String symbol, int precedence, String method) {
    this.symbol = symbol;
    this.precedence = precedence;
    this.handle = Handles.findGeneric(Operators.class, method, 2);
  }

  public boolean isComparison() {
    return precedence == 1;
  }

  /** A handle of type {@code (Object, Object)Object}. */
  public MethodHandle handle() {
    return handle;
  }

  public static Optional<Operator> forSymbol(String symbol) {
    return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
  }
}
