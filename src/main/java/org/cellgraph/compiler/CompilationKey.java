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
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Identifies a unit of compilation. Units with equal keys compile to the same node, so a cell or
 * subexpression that is referenced many times is only compiled once.
 *
 * <p>Function call and parenthesized keys are textual (the sheet plus the tokens), with a
 * discriminator that keeps apart calls whose value depends on more than their text: volatile calls
 * get a fresh object so they are never shared, and calls such as {@code ROW()} get the cell they
 * appear in.
 */
public abstract class CompilationKey {
  private CompilationKey() {}

  /** The sheet that unqualified references in this unit belong to. */
  public abstract String sheet();

  /** A cell, range or array spill. */
  public static final class Range extends CompilationKey {
    public final Reference reference;

    public Range(Reference reference) {
      this.reference = reference;
    }

    @Override
    public String sheet() {
      return reference.sheet;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Range other && reference.equals(other.reference);
    }

    @Override
    public int hashCode() {
      return reference.hashCode();
    }

    @Override
    public String toString() {
      return reference.toString();
    }
  }

  /** A function call: the normalized name and the tokens of each argument. */
  public static final class FunctionCall extends CompilationKey {
    private final String sheet;
    public final String name;
    public final ImmutableList<ImmutableList<Token>> args;
    private final @Nullable Object discriminator;

    public FunctionCall(
        String sheet,
        String name,
        ImmutableList<ImmutableList<Token>> args,
        @Nullable Object discriminator) {
      this.sheet = sheet;
      this.name = name;
      this.args = args;
      this.discriminator = discriminator;
    }

    @Override
    public String sheet() {
      return sheet;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof FunctionCall other
          && sheet.equals(other.sheet)
          && name.equals(other.name)
          && args.equals(other.args)
          && Objects.equals(discriminator, other.discriminator);
    }

    @Override
    public int hashCode() {
      return Objects.hash(sheet, name, args, discriminator);
    }

    @Override
    public String toString() {
      return name + "(" + args.size() + " args)";
    }
  }

  /** A parenthesized group, or one argument of a function call. */
  public static final class Paren extends CompilationKey {
    private final String sheet;
    public final ImmutableList<Token> tokens;
    private final @Nullable Object discriminator;

    public Paren(String sheet, ImmutableList<Token> tokens, @Nullable Object discriminator) {
      this.sheet = sheet;
      this.tokens = tokens;
      this.discriminator = discriminator;
    }

    @Override
    public String sheet() {
      return sheet;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Paren other
          && sheet.equals(other.sheet)
          && tokens.equals(other.tokens)
          && Objects.equals(discriminator, other.discriminator);
    }

    @Override
    public int hashCode() {
      return Objects.hash(sheet, tokens, discriminator);
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder("(");
      tokens.forEach(t -> sb.append(t.value));
      return sb.append(")").toString();
    }
  }
}
