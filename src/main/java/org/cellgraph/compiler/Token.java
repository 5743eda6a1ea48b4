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

import java.util.Objects;

/** One lexical element of a formula. Tokens compare equal if their type, subtype and text match. */
public final class Token {

  /** The kind of token. */
  public enum Type {
    OPERAND,
    FUNC,
    PAREN,
    SEP,
    OP_PRE,
    OP_IN,
    OP_POST,
    WSPACE,
    ARRAY
  }

  /** Refines the type: the kind of operand, which side of a bracket, which separator. */
  public enum Subtype {
    NONE,
    RANGE,
    NUMBER,
    TEXT,
    LOGICAL,
    ERROR,
    OPEN,
    CLOSE,
    ARG,
    ROW
  }

  public final Type type;
  public final Subtype subtype;

  /**
   * The token's text. Function openings include the parenthesis ({@code SUM(}) and text operands
   * include their quotes.
   */
  public final String value;

  public Token(Type type, Subtype subtype, String value) {
    this.type = type;
    this.subtype = subtype;
    this.value = value;
  }

  public boolean is(Type type, Subtype subtype) {
    return this.type == type && this.subtype == subtype;
  }

  /** True for the opening token of a function call or parenthesized group. */
  public boolean isOpen() {
    return (type == Type.FUNC || type == Type.PAREN) && subtype == Subtype.OPEN;
  }

  public boolean isClose() {
    return (type == Type.FUNC || type == Type.PAREN) && subtype == Subtype.CLOSE;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Token other
        && type == other.type
        && subtype == other.subtype
        && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, subtype, value);
  }

  @Override
  public String toString() {
    return (subtype == Subtype.NONE) ? type + ":" + value : type + "/" + subtype + ":" + value;
  }
}
