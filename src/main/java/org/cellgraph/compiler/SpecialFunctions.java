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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.function.Supplier;
import org.cellgraph.UnsupportedOperationError;
import org.cellgraph.code.DataType;
import org.cellgraph.code.Literal;
import org.cellgraph.code.Node;
import org.cellgraph.code.Random;
import org.cellgraph.code.RandomRange;
import org.cellgraph.code.Shape;
import org.cellgraph.functions.FunctionEntry;
import org.jspecify.annotations.Nullable;

/**
 * Functions that are compiled from the formula's context rather than from their argument values:
 * the cell they appear in, the workbook, or the raw text of a reference.
 */
final class SpecialFunctions {
  private SpecialFunctions() {}

  /** Creates the frame for one call. */
  interface Handler {
    Frame create(CompilationKey.FunctionCall key, Frame caller);
  }

  private static final ImmutableMap<String, Handler> HANDLERS =
      ImmutableMap.of(
          "ANCHORARRAY", SpecialFunctions::anchorArray,
          "ROW", (key, caller) -> position(key, caller, true),
          "COLUMN", (key, caller) -> position(key, caller, false),
          "SHEETS", SpecialFunctions::sheets,
          "RAND", SpecialFunctions::rand,
          "RANDBETWEEN", SpecialFunctions::randBetween);

  private static final ImmutableSet<String> VOLATILE = ImmutableSet.of("RAND", "RANDBETWEEN");

  /** Functions whose value depends on the cell they are called from. */
  private static final ImmutableSet<String> CELL_SENSITIVE =
      ImmutableSet.of("ROW", "COLUMN", "RAND", "RANDBETWEEN");

  static @Nullable Handler lookup(String name) {
    return HANDLERS.get(name);
  }

  static boolean isVolatile(String name) {
    return VOLATILE.contains(name);
  }

  static boolean isCellSensitive(String name) {
    return CELL_SENSITIVE.contains(name);
  }

  private static Frame anchorArray(CompilationKey.FunctionCall key, Frame caller) {
    String address = singleAddress(key);
    Reference array = caller.context.resolver.resolve(address + "#", caller.activeCell.sheet);
    return new ArraySourceFrame(key, caller.activeCell, caller.context, array);
  }

  /** ROW() and COLUMN(), of the calling cell or of the cell given as an argument. */
  private static Frame position(CompilationKey.FunctionCall key, Frame caller, boolean row) {
    Reference cell = caller.activeCell;
    if (!key.args.isEmpty()) {
      cell = caller.context.resolver.resolve(singleAddress(key), cell.sheet);
    }
    double value = row ? cell.row() : cell.column();
    return resolved(key, caller, new Literal(caller.nextName(), value));
  }

  private static Frame sheets(CompilationKey.FunctionCall key, Frame caller) {
    checkNoArguments(key);
    double count = caller.context.workbook.sheetNames().size();
    return resolved(key, caller, new Literal(caller.nextName(), count));
  }

  /** RAND() produces one value for each cell of the (array) formula it is called from. */
  private static Frame rand(CompilationKey.FunctionCall key, Frame caller) {
    checkNoArguments(key);
    return resolved(key, caller, new Random(caller.nextName(), caller.activeCell.shape()));
  }

  /**
   * RANDBETWEEN's bounds are ordinary arguments, but like RAND its result is shaped like the
   * calling cell.
   */
  private static Frame randBetween(CompilationKey.FunctionCall key, Frame caller) {
    if (key.args.size() != 2) {
      throw UnsupportedOperationError.of("RANDBETWEEN requires 2 arguments");
    }
    RandomBetween entry = new RandomBetween(caller.activeCell.shape());
    return new FunctionCallFrame(key, caller.activeCell, caller.context, entry);
  }

  private static Frame resolved(CompilationKey.FunctionCall key, Frame caller, Node node) {
    return new ResolvedFrame(key, caller.activeCell, caller.context, node);
  }

  private static void checkNoArguments(CompilationKey.FunctionCall key) {
    if (!key.args.isEmpty()) {
      throw UnsupportedOperationError.of("%s does not take arguments", key.name);
    }
  }

  /** Returns the text of the call's only argument, which must be a plain reference. */
  private static String singleAddress(CompilationKey.FunctionCall key) {
    if (key.args.size() == 1) {
      ImmutableList<Token> arg = key.args.get(0);
      if (arg.size() == 1 && arg.get(0).is(Token.Type.OPERAND, Token.Subtype.RANGE)) {
        return arg.get(0).value;
      }
    }
    throw UnsupportedOperationError.of("%s requires a single cell reference", key.name);
  }

  private static final class RandomBetween extends FunctionEntry {
    private final Shape shape;

    RandomBetween(Shape shape) {
      super("RANDBETWEEN");
      this.shape = shape;
    }

    @Override
    public Shape shape(List<Node> args) {
      return shape;
    }

    @Override
    public DataType resultType(List<Node> args) {
      return DataType.NUMBER;
    }

    @Override
    public boolean isVolatile() {
      return true;
    }

    @Override
    public Node buildNode(Supplier<String> names, List<Node> args) {
      return new RandomRange(names.get(), args.get(0), args.get(1), shape);
    }
  }
}
