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

package org.cellgraph;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import org.cellgraph.code.DataType;
import org.jspecify.annotations.Nullable;

/**
 * Read-only access to a spreadsheet workbook. The compiler depends only on this interface; file
 * formats are handled by implementations such as {@link org.cellgraph.workbook.SimpleWorkbook}.
 *
 * <p>Addresses passed to these methods are canonical: upper case, without {@code $} markers, and
 * on a sheet name returned by {@link #sheetNames}.
 */
public interface Workbook {

  /** The contents of a single cell. */
  final class Cell {
    public static final Cell BLANK = new Cell(null, DataType.BLANK, null);

    /** The cell's constant value, or null if the cell is blank or holds a formula. */
    public final @Nullable Object value;

    public final DataType type;

    /** The formula text (including the leading {@code =}), or null for a constant cell. */
    public final @Nullable String formula;

    private Cell(@Nullable Object value, DataType type, @Nullable String formula) {
      this.value = value;
      this.type = type;
      this.formula = formula;
    }

    public static Cell number(double value) {
      return new Cell(value, DataType.NUMBER, null);
    }

    public static Cell text(String value) {
      return new Cell(value, DataType.STRING, null);
    }

    public static Cell logical(boolean value) {
      return new Cell(value, DataType.BOOLEAN, null);
    }

    public static Cell formula(String formula) {
      return new Cell(null, DataType.NUMBER, formula.startsWith("=") ? formula : "=" + formula);
    }

    public boolean isFormula() {
      return formula != null;
    }

    @Override
    public String toString() {
      return (formula != null) ? formula : String.valueOf(value);
    }
  }

  /** Returns the contents of the given cell; never null ({@link Cell#BLANK} for empty cells). */
  Cell cell(String sheet, String address);

  /** True if {@code address} is the anchor (top-left cell) of an array formula. */
  boolean isArrayFormula(String sheet, String address);

  /**
   * Returns the region that the array formula anchored at {@code address} spills into. Only valid
   * if {@link #isArrayFormula} returns true.
   */
  CellRange arraySpillBounds(String sheet, String address);

  /** The anchors of every array formula on the given sheet. */
  ImmutableList<String> arrayFormulaAnchors(String sheet);

  /** Returns the reference text a workbook-level defined name stands for, if there is one. */
  Optional<String> resolveDefinedName(String name);

  ImmutableList<String> sheetNames();

  /** The largest row index used on the sheet. */
  int maxRow(String sheet);

  /** The largest column index used on the sheet. */
  int maxColumn(String sheet);

  /** The sheet that unqualified references (e.g. compilation inputs and outputs) refer to. */
  default String activeSheet() {
    return sheetNames().get(0);
  }
}
