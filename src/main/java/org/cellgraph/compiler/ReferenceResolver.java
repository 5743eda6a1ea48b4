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
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.log4j.Logger;
import org.cellgraph.CellRange;
import org.cellgraph.InvalidReferenceError;
import org.cellgraph.Workbook;
import org.cellgraph.compiler.Reference.Kind;

/**
 * Turns reference text as it appears in formulas ({@code A1}, {@code $B$2:C9}, {@code
 * 'My Sheet'!A:A}, {@code H1#}, {@code TaxRate}) into canonical {@link Reference}s.
 */
public final class ReferenceResolver {
  private static final Logger logger = Logger.getLogger(ReferenceResolver.class);

  /** At most seven digits, so that every row number fits in an int. */
  private static final String ROW = "[1-9][0-9]{0,6}";

  private static final String CELL = "[A-Z]{1,3}" + ROW;
  private static final Pattern CELL_OR_RANGE = Pattern.compile(CELL + "(:" + CELL + ")?");
  private static final Pattern COLUMNS = Pattern.compile("([A-Z]{1,3}):([A-Z]{1,3})");
  private static final Pattern ROWS = Pattern.compile("(" + ROW + "):(" + ROW + ")");
  private static final Pattern SPILL = Pattern.compile("(" + CELL + ")#");

  /** Defined names may refer to other defined names, but not endlessly. */
  private static final int MAX_NAME_DEPTH = 16;

  private final Workbook workbook;
  private final Map<String, SheetArrays> arrays = new HashMap<>();

  public ReferenceResolver(Workbook workbook) {
    this.workbook = workbook;
  }

  /**
   * Resolves reference text.
   *
   * @param activeSheet the sheet used when the text does not name one
   * @throws InvalidReferenceError if the text is malformed, names an unknown sheet or an undefined
   *     name, or uses a {@code #} suffix on a cell that is not an array formula
   */
  public Reference resolve(String text, String activeSheet) {
    return resolve(text, activeSheet, 0);
  }

  private Reference resolve(String text, String activeSheet, int depth) {
    String trimmed = text.trim();
    if (trimmed.startsWith("=")) {
      trimmed = trimmed.substring(1);
    }
    String sheet = activeSheet;
    String address = trimmed;
    int bang = trimmed.lastIndexOf('!');
    if (bang >= 0) {
      sheet = unquote(trimmed.substring(0, bang));
      address = trimmed.substring(bang + 1);
    }
    address = address.replace("$", "");
    String upper = address.toUpperCase(Locale.ROOT);
    if (!isAddress(upper)) {
      if (depth >= MAX_NAME_DEPTH) {
        throw InvalidReferenceError.of("Defined name %s is nested too deeply", address);
      }
      Optional<String> definition = workbook.resolveDefinedName(address);
      if (definition.isEmpty()) {
        throw InvalidReferenceError.of("Invalid reference %s", text);
      }
      logger.debug(String.format("Name %s is %s", address, definition.get()));
      return resolve(definition.get(), sheet, depth + 1).withDefinedName(address);
    }
    sheet = canonicalSheet(sheet);
    Matcher m = SPILL.matcher(upper);
    if (m.matches()) {
      String anchor = m.group(1);
      if (!workbook.isArrayFormula(sheet, anchor)) {
        throw InvalidReferenceError.of("%s!%s is not an array formula", sheet, anchor);
      }
      return arrayReference(sheet, anchor, workbook.arraySpillBounds(sheet, anchor));
    }
    m = COLUMNS.matcher(upper);
    if (m.matches()) {
      int first = CellRange.columnIndex(m.group(1));
      int second = CellRange.columnIndex(m.group(2));
      return classify(
          sheet,
          new CellRange(
              1, Math.min(first, second), workbook.maxRow(sheet), Math.max(first, second)));
    }
    m = ROWS.matcher(upper);
    if (m.matches()) {
      int first = Integer.parseInt(m.group(1));
      int second = Integer.parseInt(m.group(2));
      return classify(
          sheet,
          new CellRange(
              Math.min(first, second), 1, Math.max(first, second), workbook.maxColumn(sheet)));
    }
    return classify(sheet, CellRange.parse(upper));
  }

  private static boolean isAddress(String upper) {
    return CELL_OR_RANGE.matcher(upper).matches()
        || COLUMNS.matcher(upper).matches()
        || ROWS.matcher(upper).matches()
        || SPILL.matcher(upper).matches();
  }

  private static String unquote(String sheet) {
    if (sheet.length() >= 2 && sheet.startsWith("'") && sheet.endsWith("'")) {
      return sheet.substring(1, sheet.length() - 1).replace("''", "'");
    }
    return sheet;
  }

  private String canonicalSheet(String sheet) {
    for (String name : workbook.sheetNames()) {
      if (name.equalsIgnoreCase(sheet)) {
        return name;
      }
    }
    throw InvalidReferenceError.of("Sheet %s does not exist", sheet);
  }

  /** Returns the reference for one cell of a sheet (whose name must already be canonical). */
  Reference cell(String sheet, CellRange cell) {
    return classify(sheet, cell);
  }

  private Reference classify(String sheet, CellRange bounds) {
    for (Reference spill : arrays(sheet).spills) {
      if (spill.bounds.contains(bounds)) {
        if (spill.bounds.equals(bounds)) {
          return spill;
        }
        return new Reference(sheet, bounds.address(), Kind.ARRAY_ENTRY, bounds, spill, null);
      }
    }
    Kind kind = bounds.isSingleCell() ? Kind.CELL : Kind.RANGE;
    return new Reference(sheet, bounds.address(), kind, bounds, null, null);
  }

  private static Reference arrayReference(String sheet, String anchor, CellRange bounds) {
    return new Reference(sheet, anchor + "#", Kind.ARRAY_REFERENCE, bounds, null, null);
  }

  private SheetArrays arrays(String sheet) {
    return arrays.computeIfAbsent(sheet, s -> new SheetArrays(workbook, s));
  }

  /** The array formulas of one sheet that spill over more than one cell. */
  private static final class SheetArrays {
    final ImmutableList<Reference> spills;

    SheetArrays(Workbook workbook, String sheet) {
      ImmutableList.Builder<Reference> builder = ImmutableList.builder();
      for (String anchor : workbook.arrayFormulaAnchors(sheet)) {
        CellRange bounds = workbook.arraySpillBounds(sheet, anchor);
        if (!bounds.isSingleCell()) {
          builder.add(arrayReference(sheet, anchor, bounds));
        }
      }
      spills = builder.build();
    }
  }
}
