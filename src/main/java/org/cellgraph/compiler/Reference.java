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
import java.util.Locale;
import org.cellgraph.CellRange;
import org.cellgraph.code.Shape;
import org.jspecify.annotations.Nullable;

/**
 * A normalized reference to a cell, a rectangular range, or an array formula's spill.
 *
 * <p>References are created by {@link ReferenceResolver}, which puts the address in canonical form
 * (upper case, no {@code $}, corners ordered), so two references are equal exactly when they name
 * the same sheet and address.
 */
public final class Reference {

  /** How the referenced cells get their values. */
  public enum Kind {
    /** A single cell outside any array formula's spill. */
    CELL,
    /** A rectangle of cells outside any array formula's spill. */
    RANGE,
    /** Part of an array formula's spill, computed by slicing the whole array. */
    ARRAY_ENTRY,
    /** The whole spill of an array formula ({@code H1#}). */
    ARRAY_REFERENCE
  }

  public final String sheet;
  public final String address;
  public final Kind kind;

  /** The cells covered. */
  public final CellRange bounds;

  private final @Nullable Reference arraySource;
  private final @Nullable String definedName;

  Reference(
      String sheet,
      String address,
      Kind kind,
      CellRange bounds,
      @Nullable Reference arraySource,
      @Nullable String definedName) {
    Preconditions.checkArgument((kind == Kind.ARRAY_ENTRY) == (arraySource != null));
    this.sheet = sheet;
    this.address = address;
    this.kind = kind;
    this.bounds = bounds;
    this.arraySource = arraySource;
    this.definedName = definedName;
  }

  /** Returns a copy of this reference that remembers the defined name it was reached through. */
  Reference withDefinedName(String name) {
    return new Reference(sheet, address, kind, bounds, arraySource, name);
  }

  public Shape shape() {
    return Shape.of(bounds.height(), bounds.width());
  }

  /** The 1-based row of the top-left cell. */
  public int row() {
    return bounds.minRow;
  }

  /** The 1-based column of the top-left cell. */
  public int column() {
    return bounds.minColumn;
  }

  /** For an {@link Kind#ARRAY_ENTRY}, the {@link Kind#ARRAY_REFERENCE} it is part of. */
  public Reference arraySource() {
    Preconditions.checkState(arraySource != null, "%s is not part of an array", this);
    return arraySource;
  }

  /**
   * For an {@link Kind#ARRAY_ENTRY}, the half-open row and column ranges {@code (rowFrom, rowTo,
   * colFrom, colTo)} of this entry within its array.
   */
  public int[] offsets() {
    CellRange source = arraySource().bounds;
    return new int[] {
      bounds.minRow - source.minRow,
      bounds.maxRow - source.minRow + 1,
      bounds.minColumn - source.minColumn,
      bounds.maxColumn - source.minColumn + 1
    };
  }

  public @Nullable String definedName() {
    return definedName;
  }

  /** The single cells of this reference, row by row. */
  public ImmutableList<Reference> cells(ReferenceResolver resolver) {
    ImmutableList.Builder<Reference> result = ImmutableList.builder();
    for (int r = bounds.minRow; r <= bounds.maxRow; r++) {
      for (int c = bounds.minColumn; c <= bounds.maxColumn; c++) {
        result.add(resolver.cell(sheet, CellRange.cell(r, c)));
      }
    }
    return result.build();
  }

  /**
   * A lower-case identifier derived from the sheet and address, e.g. {@code sheet1_a1xb2} for
   * {@code Sheet1!A1:B2} and {@code sheet1_h1_xx} for {@code Sheet1!H1#}.
   */
  public String encodeName() {
    String raw = sheet + "_" + address.replace(":", "x").replace("#", "_xx");
    return raw.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Reference other
        && sheet.equals(other.sheet)
        && address.equals(other.address);
  }

  @Override
  public int hashCode() {
    return sheet.hashCode() * 31 + address.hashCode();
  }

  @Override
  public String toString() {
    boolean plain = sheet.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '_');
    String quoted = plain ? sheet : "'" + sheet.replace("'", "''") + "'";
    return quoted + "!" + address;
  }
}
