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

import com.google.common.base.Preconditions;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A rectangular block of cells on a single sheet, identified by 1-based inclusive row and column
 * bounds. A single cell is a range with equal bounds.
 */
public final class CellRange {
  private static final Pattern CELL = Pattern.compile("([A-Z]{1,3})(\\d{1,9})");

  public final int minRow;
  public final int minColumn;
  public final int maxRow;
  public final int maxColumn;

  public CellRange(int minRow, int minColumn, int maxRow, int maxColumn) {
    Preconditions.checkArgument(
        minRow >= 1 && minColumn >= 1 && maxRow >= minRow && maxColumn >= minColumn,
        "Bad range bounds (%s, %s, %s, %s)",
        minRow,
        minColumn,
        maxRow,
        maxColumn);
    this.minRow = minRow;
    this.minColumn = minColumn;
    this.maxRow = maxRow;
    this.maxColumn = maxColumn;
  }

  public static CellRange cell(int row, int column) {
    return new CellRange(row, column, row, column);
  }

  /**
   * Parses an address of the form {@code A1} or {@code A1:C3} (without sheet or {@code $} markers).
   * The corners may be given in either order.
   */
  public static CellRange parse(String address) {
    int colon = address.indexOf(':');
    if (colon < 0) {
      int[] cell = parseCell(address);
      return cell(cell[0], cell[1]);
    }
    int[] first = parseCell(address.substring(0, colon));
    int[] second = parseCell(address.substring(colon + 1));
    return new CellRange(
        Math.min(first[0], second[0]),
        Math.min(first[1], second[1]),
        Math.max(first[0], second[0]),
        Math.max(first[1], second[1]));
  }

  private static int[] parseCell(String cell) {
    Matcher m = CELL.matcher(cell);
    Preconditions.checkArgument(m.matches(), "Not a cell address: %s", cell);
    return new int[] {Integer.parseInt(m.group(2)), columnIndex(m.group(1))};
  }

  /** Converts a column name ("A", "AB", ...) to its 1-based index. */
  public static int columnIndex(String name) {
    int result = 0;
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      Preconditions.checkArgument(c >= 'A' && c <= 'Z', "Bad column name: %s", name);
      result = result * 26 + (c - 'A' + 1);
    }
    return result;
  }

  /** Converts a 1-based column index to its name. */
  public static String columnName(int index) {
    Preconditions.checkArgument(index >= 1);
    StringBuilder sb = new StringBuilder();
    for (int i = index; i > 0; i = (i - 1) / 26) {
      sb.append((char) ('A' + (i - 1) % 26));
    }
    return sb.reverse().toString();
  }

  public int height() {
    return maxRow - minRow + 1;
  }

  public int width() {
    return maxColumn - minColumn + 1;
  }

  public int size() {
    return height() * width();
  }

  public boolean isSingleCell() {
    return minRow == maxRow && minColumn == maxColumn;
  }

  public boolean contains(CellRange other) {
    return other.minRow >= minRow
        && other.maxRow <= maxRow
        && other.minColumn >= minColumn
        && other.maxColumn <= maxColumn;
  }

  /** The address of the top-left cell, e.g. {@code B2}. */
  public String topLeft() {
    return columnName(minColumn) + minRow;
  }

  /** The canonical address of this range: {@code B2} for a single cell, else {@code B2:D5}. */
  public String address() {
    return isSingleCell() ? topLeft() : topLeft() + ":" + columnName(maxColumn) + maxRow;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    return obj instanceof CellRange other
        && minRow == other.minRow
        && minColumn == other.minColumn
        && maxRow == other.maxRow
        && maxColumn == other.maxColumn;
  }

  @Override
  public int hashCode() {
    return ((minRow * 31 + minColumn) * 31 + maxRow) * 31 + maxColumn;
  }

  @Override
  public String toString() {
    return address();
  }
}
