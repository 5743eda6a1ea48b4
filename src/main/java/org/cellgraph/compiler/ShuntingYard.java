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

package org.cellgraph.compiler;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;
import org.cellgraph.UnsupportedOperationError;
import org.cellgraph.code.BinaryOp;
import org.cellgraph.code.Comparison;
import org.cellgraph.code.Literal;
import org.cellgraph.code.Node;
import org.cellgraph.code.Operator;
import org.cellgraph.functions.FunctionRegistry;

/**
 * Operator-precedence parsing of one formula (or parenthesized group). Operands arrive as
 * already-built nodes, since references and calls are resolved by other frames; operators are held
 * back until their precedence allows them into the output.
 *
 * <p>Prefix operators bind to the next operand and the {@code %} postfix to the previous one, so
 * both are applied eagerly. All binary operators are left associative.
 */
final class ShuntingYard {
  /** Operands (as {@link Node}s) and operators (as {@link Operator}s) in postfix order. */
  private final List<Object> output = new ArrayList<>();

  private final Deque<Operator> operators = new ArrayDeque<>();

  /** Prefix operators seen since the last operand, innermost last. */
  private final List<String> prefixes = new ArrayList<>();

  void pushOperand(Node operand, Supplier<String> names) {
    Node node = operand;
    for (int i = prefixes.size() - 1; i >= 0; i--) {
      if (prefixes.get(i).equals("-")) {
        node = new BinaryOp(names.get(), Operator.MULTIPLY, node, new Literal(names.get(), -1.0));
      }
    }
    prefixes.clear();
    output.add(node);
  }

  void pushOperator(String symbol) {
    Operator op =
        Operator.forSymbol(symbol)
            .orElseThrow(() -> UnsupportedOperationError.of("Unknown operator %s", symbol));
    while (!operators.isEmpty() && operators.peek().precedence >= op.precedence) {
      output.add(operators.pop());
    }
    operators.push(op);
  }

  void pushPrefix(String symbol) {
    if (!symbol.equals("+") && !symbol.equals("-")) {
      throw UnsupportedOperationError.of("Unknown prefix operator %s", symbol);
    }
    prefixes.add(symbol);
  }

  void pushPostfix(String symbol, Supplier<String> names) {
    if (!symbol.equals("%")) {
      throw UnsupportedOperationError.of("Unknown postfix operator %s", symbol);
    }
    int last = output.size() - 1;
    Preconditions.checkState(last >= 0 && output.get(last) instanceof Node, "No operand for %");
    Node percent = new Literal(names.get(), 0.01);
    Node operand = (Node) output.get(last);
    output.set(last, new BinaryOp(names.get(), Operator.MULTIPLY, operand, percent));
  }

  /** Builds the node for everything pushed so far. */
  Node finish(Supplier<String> names) {
    Preconditions.checkState(prefixes.isEmpty(), "Prefix operator without an operand");
    while (!operators.isEmpty()) {
      output.add(operators.pop());
    }
    Deque<Node> stack = new ArrayDeque<>();
    for (Object item : output) {
      if (item instanceof Node node) {
        stack.push(node);
        continue;
      }
      Operator op = (Operator) item;
      Preconditions.checkState(stack.size() >= 2, "Missing operand for %s", op.symbol);
      Node right = stack.pop();
      Node left = stack.pop();
      stack.push(apply(op, left, right, names));
    }
    Preconditions.checkState(stack.size() == 1, "Expression left %s values", stack.size());
    return stack.pop();
  }

  /**
   * Removes tokens up to and including the bracket that closes one that has just been consumed,
   * and returns them split into groups at top-level argument separators. A trailing empty group
   * (as in {@code F(x,)}) is dropped, and so is the only group of {@code F()}; groups holding only
   * whitespace count as empty.
   */
  static List<ImmutableList<Token>> consumeUntilMatchingParen(Deque<Token> tokens) {
    List<ImmutableList<Token>> groups = new ArrayList<>();
    List<Token> group = new ArrayList<>();
    int depth = 1;
    while (true) {
      Token token = tokens.poll();
      Preconditions.checkState(token != null, "Unbalanced parentheses");
      if (token.isOpen() || token.is(Token.Type.ARRAY, Token.Subtype.OPEN)) {
        depth++;
      } else if (token.isClose() || token.is(Token.Type.ARRAY, Token.Subtype.CLOSE)) {
        if (--depth == 0) {
          break;
        }
      } else if (depth == 1 && token.is(Token.Type.SEP, Token.Subtype.ARG)) {
        groups.add(trim(group));
        group = new ArrayList<>();
        continue;
      }
      group.add(token);
    }
    groups.add(trim(group));
    if (groups.get(groups.size() - 1).isEmpty()) {
      groups.remove(groups.size() - 1);
    }
    return groups;
  }

  private static ImmutableList<Token> trim(List<Token> group) {
    int start = 0;
    int end = group.size();
    while (start < end && group.get(start).type == Token.Type.WSPACE) {
      start++;
    }
    while (end > start && group.get(end - 1).type == Token.Type.WSPACE) {
      end--;
    }
    return ImmutableList.copyOf(group.subList(start, end));
  }

  private static Node apply(Operator op, Node left, Node right, Supplier<String> names) {
    if (op == Operator.CONCAT) {
      return FunctionRegistry.concatenate(names, left, right);
    } else if (op.isComparison()) {
      return new Comparison(names.get(), op, left, right);
    } else {
      return new BinaryOp(names.get(), op, left, right);
    }
  }
}
