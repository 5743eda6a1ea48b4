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
import org.cellgraph.InvalidReferenceError;
import org.cellgraph.Workbook;
import org.cellgraph.code.Literal;
import org.cellgraph.code.Node;
import org.jspecify.annotations.Nullable;

/**
 * Compiles a single cell: its formula, or a literal for its constant value. For an array reference
 * the anchor's formula is compiled once for the whole spill.
 */
final class CellFrame extends TokenFrame {
  /** The cell's contents if it holds a constant rather than a formula. */
  private final Workbook.@Nullable Cell constant;

  private CellFrame(
      CompilationKey.Range key,
      CompileContext context,
      ImmutableList<Token> tokens,
      Workbook.@Nullable Cell constant) {
    super(key, key.reference, context, tokens);
    this.constant = constant;
  }

  static CellFrame create(CompilationKey.Range key, CompileContext context) {
    Reference ref = key.reference;
    Workbook.Cell cell = context.workbook.cell(ref.sheet, ref.bounds.topLeft());
    String formula = cell.formula;
    if (formula != null) {
      return new CellFrame(key, context, Tokenizer.tokenize(formula), null);
    } else if (ref.kind == Reference.Kind.ARRAY_REFERENCE) {
      throw InvalidReferenceError.of("%s has no array formula", ref);
    }
    return new CellFrame(key, context, ImmutableList.of(), cell);
  }

  @Override
  Node finish() {
    if (constant != null) {
      String name = context.names.claim(activeCell.encodeName());
      return new Literal(name, constant.value, constant.type);
    }
    return super.finish();
  }
}
