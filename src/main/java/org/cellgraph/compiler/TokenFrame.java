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
import java.util.List;
import java.util.Locale;
import org.cellgraph.UnsupportedOperationError;
import org.cellgraph.code.Literal;
import org.cellgraph.code.Node;
import org.jspecify.annotations.Nullable;

/**
 * A frame that parses a list of tokens. Constants and operators are handled directly; each
 * reference, function call and parenthesized group suspends parsing until its node is pushed.
 */
abstract class TokenFrame extends Frame {
  private final ArrayDeque<Token> tokens;
  private final ShuntingYard yard = new ShuntingYard();
  private boolean started;
  private @Nullable CompilationKey pending;

  TokenFrame(
      CompilationKey key, Reference activeCell, CompileContext context, List<Token> tokens) {
    super(key, activeCell, context);
    this.tokens = new ArrayDeque<>(tokens);
  }

  @Override
  final @Nullable CompilationKey nextReference() {
    if (!started) {
      started = true;
      consume();
    }
    return pending;
  }

  @Override
  void pushNode(Node node) {
    Preconditions.checkState(pending != null, "%s was not waiting for a node", this);
    yard.pushOperand(node, this::nextName);
    consume();
  }

  @Override
  Node finish() {
    return yard.finish(this::nextName);
  }

  /** Advances to the next token that needs another unit's node, or to the end. */
  private void consume() {
    pending = null;
    while (!tokens.isEmpty()) {
      Token token = tokens.poll();
      switch (token.type) {
        case OPERAND -> {
          if (token.subtype == Token.Subtype.RANGE) {
            pending = context.rangeKey(token.value, activeCell);
            return;
          }
          yard.pushOperand(constant(token), this::nextName);
        }
        case FUNC -> {
          Preconditions.checkState(token.isOpen(), "Unexpected %s", token);
          List<ImmutableList<Token>> args = ShuntingYard.consumeUntilMatchingParen(tokens);
          pending = context.functionKey(token.value, args, activeCell);
          return;
        }
        case PAREN -> {
          Preconditions.checkState(token.isOpen(), "Unexpected %s", token);
          List<ImmutableList<Token>> groups = ShuntingYard.consumeUntilMatchingParen(tokens);
          if (groups.size() != 1) {
            throw UnsupportedOperationError.of("Reference unions are not supported");
          }
          pending = context.parenKey(groups.get(0), activeCell);
          return;
        }
        case OP_PRE -> yard.pushPrefix(token.value);
        case OP_IN -> yard.pushOperator(token.value);
        case OP_POST -> yard.pushPostfix(token.value, this::nextName);
        case WSPACE -> {}
        case ARRAY -> throw UnsupportedOperationError.of("Array constants are not supported");
        case SEP -> throw UnsupportedOperationError.of("Unexpected separator %s", token.value);
      }
    }
  }

  private Node constant(Token token) {
    return switch (token.subtype) {
      case NUMBER -> new Literal(nextName(), Double.parseDouble(token.value));
      case TEXT -> {
        String text = token.value.substring(1, token.value.length() - 1).replace("\"\"", "\"");
        yield new Literal(nextName(), text);
      }
      case LOGICAL -> new Literal(nextName(), token.value.toUpperCase(Locale.ROOT).equals("TRUE"));
      case ERROR -> throw UnsupportedOperationError.of("Error value %s in formula", token.value);
      default -> throw new IllegalStateException("Unexpected operand " + token);
    };
  }
}
