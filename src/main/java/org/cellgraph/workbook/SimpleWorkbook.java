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

package org.cellgraph.workbook;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.cellgraph.CellRange;
import org.cellgraph.Workbook;
import org.jspecify.annotations.Nullable;

/**
 * An in-memory workbook, built programmatically or read from a simple text format:
 *
 * <pre>
 * # Comments start with '#'
 * [Sheet1]
 * A1 2
 * A2 "some text"
 * A3 TRUE
 * B1 =A1+1
 * C1:C3 {=A1:A3*2}
 * name Rate Sheet1!$A$1
 * </pre>
 *
 * Each line after a {@code [sheet]} header gives one cell's contents (a number, quoted text, a
 * logical value, or a formula) or an array formula with the region it spills into. {@code name}
 * lines define workbook-level names.
 */
public final class SimpleWorkbook implements Workbook {
  private final ImmutableList<String> sheets;
  private final ImmutableMap<String, ImmutableMap<String, Cell>> cells;
  private final ImmutableMap<String, ImmutableMap<String, CellRange>> arrays;
  private final ImmutableMap<String, String> names;

  private SimpleWorkbook(Builder builder) {
    this.sheets = ImmutableList.copyOf(builder.cells.keySet());
    this.cells = copy(builder.cells);
    this.arrays = copy(builder.arrays);
    this.names = ImmutableMap.copyOf(builder.names);
  }

  private static <T> ImmutableMap<String, ImmutableMap<String, T>> copy(
      Map<String, Map<String, T>> map) {
    ImmutableMap.Builder<String, ImmutableMap<String, T>> result = ImmutableMap.builder();
    map.forEach((k, v) -> result.put(k, ImmutableMap.copyOf(v)));
    return result.buildOrThrow();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Reads a workbook in the text format described above. */
  public static SimpleWorkbook load(Path path) throws IOException {
    return parse(Files.readString(path, StandardCharsets.UTF_8));
  }

  /**
   * Parses a workbook in the text format described above.
   *
   * @throws IllegalArgumentException if the text is not well formed
   */
  public static SimpleWorkbook parse(String text) {
    Builder builder = builder();
    List<String> lines = text.lines().toList();
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i).trim();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      try {
        parseLine(line, builder);
      } catch (IllegalArgumentException | IllegalStateException e) {
        throw new IllegalArgumentException("Line " + (i + 1) + ": " + e.getMessage(), e);
      }
    }
    return builder.build();
  }

  private static void parseLine(String line, Builder builder) {
    if (line.startsWith("[")) {
      Preconditions.checkArgument(line.endsWith("]"), "Bad sheet header %s", line);
      builder.sheet(line.substring(1, line.length() - 1).trim());
      return;
    }
    String[] parts = line.split("\\s+", 2);
    Preconditions.checkArgument(parts.length == 2, "Missing contents: %s", line);
    String address = parts[0];
    String contents = parts[1].trim();
    if (address.equals("name")) {
      String[] definition = contents.split("\\s+", 2);
      Preconditions.checkArgument(definition.length == 2, "Bad name definition: %s", line);
      builder.name(definition[0], definition[1].trim());
    } else if (contents.startsWith("{=") && contents.endsWith("}")) {
      builder.arrayFormula(address, contents.substring(1, contents.length() - 1));
    } else if (contents.startsWith("=")) {
      builder.formula(address, contents);
    } else if (contents.startsWith("\"")) {
      Preconditions.checkArgument(
          contents.length() >= 2 && contents.endsWith("\""), "Unterminated text: %s", line);
      builder.text(address, contents.substring(1, contents.length() - 1).replace("\"\"", "\""));
    } else if (contents.equalsIgnoreCase("TRUE") || contents.equalsIgnoreCase("FALSE")) {
      builder.logical(address, Boolean.parseBoolean(contents.toLowerCase(Locale.ROOT)));
    } else {
      // NumberFormatException is an IllegalArgumentException.
      builder.number(address, Double.parseDouble(contents));
    }
  }

  @Override
  public Cell cell(String sheet, String address) {
    return sheetMap(cells, sheet).getOrDefault(address, Cell.BLANK);
  }

  @Override
  public boolean isArrayFormula(String sheet, String address) {
    return sheetMap(arrays, sheet).containsKey(address);
  }

  @Override
  public CellRange arraySpillBounds(String sheet, String address) {
    CellRange bounds = sheetMap(arrays, sheet).get(address);
    Preconditions.checkArgument(bounds != null, "No array formula at %s!%s", sheet, address);
    return bounds;
  }

  @Override
  public ImmutableList<String> arrayFormulaAnchors(String sheet) {
    return sheetMap(arrays, sheet).keySet().asList();
  }

  @Override
  public Optional<String> resolveDefinedName(String name) {
    return Optional.ofNullable(names.get(name.toUpperCase(Locale.ROOT)));
  }

  @Override
  public ImmutableList<String> sheetNames() {
    return sheets;
  }

  @Override
  public int maxRow(String sheet) {
    int max = 1;
    for (String address : sheetMap(cells, sheet).keySet()) {
      max = Math.max(max, CellRange.parse(address).maxRow);
    }
    for (CellRange bounds : sheetMap(arrays, sheet).values()) {
      max = Math.max(max, bounds.maxRow);
    }
    return max;
  }

  @Override
  public int maxColumn(String sheet) {
    int max = 1;
    for (String address : sheetMap(cells, sheet).keySet()) {
      max = Math.max(max, CellRange.parse(address).maxColumn);
    }
    for (CellRange bounds : sheetMap(arrays, sheet).values()) {
      max = Math.max(max, bounds.maxColumn);
    }
    return max;
  }

  private static <T> ImmutableMap<String, T> sheetMap(
      ImmutableMap<String, ImmutableMap<String, T>> map, String sheet) {
    ImmutableMap<String, T> result = map.get(sheet);
    Preconditions.checkArgument(result != null, "No sheet named %s", sheet);
    return result;
  }

  /**
   * Accumulates the contents of a workbook. Cells are added to the most recently named sheet;
   * addresses are written without a sheet name or {@code $} markers.
   */
  public static final class Builder {
    private final Map<String, Map<String, Cell>> cells = new LinkedHashMap<>();
    private final Map<String, Map<String, CellRange>> arrays = new LinkedHashMap<>();
    private final Map<String, String> names = new LinkedHashMap<>();
    private @Nullable String sheet;

    private Builder() {}

    /** Starts (or returns to) the named sheet. */
    @CanIgnoreReturnValue
    public Builder sheet(String name) {
      cells.computeIfAbsent(name, k -> new LinkedHashMap<>());
      arrays.computeIfAbsent(name, k -> new LinkedHashMap<>());
      sheet = name;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder number(String address, double value) {
      return put(address, Cell.number(value));
    }

    @CanIgnoreReturnValue
    public Builder text(String address, String value) {
      return put(address, Cell.text(value));
    }

    @CanIgnoreReturnValue
    public Builder logical(String address, boolean value) {
      return put(address, Cell.logical(value));
    }

    @CanIgnoreReturnValue
    public Builder formula(String address, String formula) {
      return put(address, Cell.formula(formula));
    }

    /** Adds an array formula filling {@code range}; the formula is stored in its top-left cell. */
    @CanIgnoreReturnValue
    public Builder arrayFormula(String range, String formula) {
      CellRange bounds = CellRange.parse(canonical(range));
      put(bounds.topLeft(), Cell.formula(formula));
      arrays.get(sheet).put(bounds.topLeft(), bounds);
      return this;
    }

    /** Defines a workbook-level name as an abbreviation for {@code reference}. */
    @CanIgnoreReturnValue
    public Builder name(String name, String reference) {
      names.put(name.toUpperCase(Locale.ROOT), reference);
      return this;
    }

    private Builder put(String address, Cell cell) {
      Preconditions.checkState(sheet != null, "No sheet has been started");
      cells.get(sheet).put(CellRange.parse(canonical(address)).address(), cell);
      return this;
    }

    private static String canonical(String address) {
      return address.replace("$", "").toUpperCase(Locale.ROOT);
    }

    public SimpleWorkbook build() {
      Preconditions.checkState(!cells.isEmpty(), "A workbook must have at least one sheet");
      return new SimpleWorkbook(this);
    }
  }
}
