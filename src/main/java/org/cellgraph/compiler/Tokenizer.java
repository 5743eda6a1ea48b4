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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.cellgraph.UnsupportedOperationError;
import org.cellgraph.compiler.Token.Subtype;
import org.cellgraph.compiler.Token.Type;
import org.jspecify.annotations.Nullable;

/** Splits formula text into {@link Token}s. */
public final class Tokenizer {
  private static final ImmutableList<String> ERROR_CODES =
      ImmutableList.of(
          "#NULL!", "#DIV/0!", "#VALUE!", "#REF!", "#NAME?", "#NUM!", "#N/A", "#GETTING_DATA");

  /** A mantissa waiting for its exponent's sign, as in {@code 1.5E+3}. */
  private static final Pattern SCIENTIFIC =
      Pattern.compile("\\d+(\\.\\d*)?E", Pattern.CASE_INSENSITIVE);

  private static final Pattern NUMBER =
      Pattern.compile("(\\d+(\\.\\d*)?|\\.\\d+)(E[+-]?\\d+)?", Pattern.CASE_INSENSITIVE);

  private final String formula;
  private final List<Token> tokens = new ArrayList<>();
  private final StringBuilder current = new StringBuilder();
  private final Deque<Token> openers = new ArrayDeque<>();
  private int offset;

  private Tokenizer(String formula) {
    this.formula = formula;
  }

  /**
   * Tokenizes a formula. A leading {@code =} is skipped; text that does not start with {@code =}
   * is treated as a single literal operand.
   */
  public static ImmutableList<Token> tokenize(String formula) {
    if (!formula.startsWith("=")) {
      return ImmutableList.of(operand(formula));
    }
    Tokenizer tokenizer = new Tokenizer(formula);
    tokenizer.offset = 1;
    tokenizer.run();
    return ImmutableList.copyOf(tokenizer.tokens);
  }

  private void run() {
    while (offset < formula.length()) {
      char c = formula.charAt(offset);
      if (c == '"') {
        flush();
        readQuoted('"');
      } else if (c == '\'') {
        readQuoted('\'');
      } else if (c == '[') {
        readBracketed();
      } else if (c == '#' && (current.length() == 0 || endsWith('!'))) {
        readError();
      } else if ((c == '+' || c == '-')
          && current.length() > 0
          && SCIENTIFIC.matcher(current).matches()) {
        current.append(c);
        offset++;
      } else if (c == ' ' || c == '\n' || c == '\t') {
        flush();
        int start = offset;
        while (offset < formula.length() && " \n\t".indexOf(formula.charAt(offset)) >= 0) {
          offset++;
        }
        tokens.add(new Token(Type.WSPACE, Subtype.NONE, formula.substring(start, offset)));
      } else if (isTwoCharOperator()) {
        flush();
        tokens.add(new Token(Type.OP_IN, Subtype.NONE, formula.substring(offset, offset + 2)));
        offset += 2;
      } else if ("+-*/^&=><%".indexOf(c) >= 0) {
        flush();
        tokens.add(operator(c));
        offset++;
      } else if (c == '{') {
        flush();
        open(new Token(Type.ARRAY, Subtype.OPEN, "{"));
      } else if (c == '(') {
        if (current.length() > 0) {
          String name = current + "(";
          current.setLength(0);
          open(new Token(Type.FUNC, Subtype.OPEN, name));
        } else {
          open(new Token(Type.PAREN, Subtype.OPEN, "("));
        }
      } else if (c == ')' || c == '}') {
        flush();
        close(c);
      } else if (c == ',' || c == ';') {
        flush();
        Subtype subtype =
            (c == ';' && !openers.isEmpty() && openers.peek().type == Type.ARRAY)
                ? Subtype.ROW
                : Subtype.ARG;
        tokens.add(new Token(Type.SEP, subtype, String.valueOf(c)));
        offset++;
      } else {
        current.append(c);
        offset++;
      }
    }
    flush();
    if (!openers.isEmpty()) {
      throw syntaxError("unmatched " + openers.peek().value);
    }
  }

  private boolean endsWith(char c) {
    return current.length() > 0 && current.charAt(current.length() - 1) == c;
  }

  private boolean isTwoCharOperator() {
    if (offset + 1 >= formula.length()) {
      return false;
    }
    String pair = formula.substring(offset, offset + 2);
    return pair.equals(">=") || pair.equals("<=") || pair.equals("<>");
  }

  /** {@code +} and {@code -} are prefix operators unless they follow an operand or a closer. */
  private Token operator(char c) {
    if (c == '%') {
      return new Token(Type.OP_POST, Subtype.NONE, "%");
    }
    if (c == '+' || c == '-') {
      Token previous = previousSignificant();
      boolean infix =
          previous != null
              && (previous.type == Type.OPERAND
                  || previous.type == Type.OP_POST
                  || previous.subtype == Subtype.CLOSE);
      if (!infix) {
        return new Token(Type.OP_PRE, Subtype.NONE, String.valueOf(c));
      }
    }
    return new Token(Type.OP_IN, Subtype.NONE, String.valueOf(c));
  }

  private @Nullable Token previousSignificant() {
    for (int i = tokens.size() - 1; i >= 0; i--) {
      if (tokens.get(i).type != Type.WSPACE) {
        return tokens.get(i);
      }
    }
    return null;
  }

  private void open(Token token) {
    tokens.add(token);
    openers.push(token);
    offset++;
  }

  private void close(char c) {
    if (openers.isEmpty()) {
      throw syntaxError("unmatched " + c);
    }
    Token opener = openers.pop();
    if ((opener.type == Type.ARRAY) != (c == '}')) {
      throw syntaxError("mismatched " + c);
    }
    tokens.add(new Token(opener.type, Subtype.CLOSE, String.valueOf(c)));
    offset++;
  }

  /** Reads a quoted string or sheet name; a doubled quote stands for one quote character. */
  private void readQuoted(char quote) {
    int start = offset++;
    while (true) {
      if (offset >= formula.length()) {
        throw syntaxError("unterminated " + quote);
      }
      if (formula.charAt(offset) == quote) {
        if (offset + 1 < formula.length() && formula.charAt(offset + 1) == quote) {
          offset += 2;
          continue;
        }
        offset++;
        break;
      }
      offset++;
    }
    current.append(formula, start, offset);
    if (quote == '"') {
      flush();
    }
  }

  private void readBracketed() {
    int depth = 0;
    int start = offset;
    do {
      if (offset >= formula.length()) {
        throw syntaxError("unterminated [");
      }
      char c = formula.charAt(offset++);
      if (c == '[') {
        depth++;
      } else if (c == ']') {
        depth--;
      }
    } while (depth > 0);
    current.append(formula, start, offset);
  }

  private void readError() {
    for (String code : ERROR_CODES) {
      if (formula.regionMatches(true, offset, code, 0, code.length())) {
        current.append(code);
        offset += code.length();
        flush();
        return;
      }
    }
    throw syntaxError("unknown error literal");
  }

  private void flush() {
    if (current.length() > 0) {
      tokens.add(operand(current.toString()));
      current.setLength(0);
    }
  }

  private static Token operand(String text) {
    Subtype subtype;
    if (text.startsWith("\"")) {
      subtype = Subtype.TEXT;
    } else if (text.equalsIgnoreCase("TRUE") || text.equalsIgnoreCase("FALSE")) {
      subtype = Subtype.LOGICAL;
    } else if (text.startsWith("#") || ERROR_CODES.contains(errorSuffix(text))) {
      subtype = Subtype.ERROR;
    } else if (NUMBER.matcher(text).matches()) {
      subtype = Subtype.NUMBER;
    } else {
      subtype = Subtype.RANGE;
    }
    return new Token(Type.OPERAND, subtype, text);
  }

  /** For a sheet-qualified error such as {@code Sheet1!#REF!}, returns the error part. */
  private static String errorSuffix(String text) {
    int bang = text.lastIndexOf("!#");
    return (bang < 0) ? "" : text.substring(bang + 1).toUpperCase(Locale.ROOT);
  }

  private UnsupportedOperationError syntaxError(String problem) {
    return UnsupportedOperationError.of(
        "Cannot parse formula %s: %s at offset %s", formula, problem, offset);
  }
}
