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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.io.Resources;
import java.nio.file.Path;
import org.cellgraph.CellRange;
import org.cellgraph.Workbook.Cell;
import org.cellgraph.code.DataType;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SimpleWorkbookTest {

  @Test
  public void parse() {
    SimpleWorkbook workbook =
        SimpleWorkbook.parse(
            String.join(
                "\n",
                "# inputs",
                "[Sheet1]",
                "A1 2",
                "A2 \"say \"\"hi\"\"\"",
                "a3 true",
                "",
                "B1 =A1+1",
                "C1:C3 {=A1:A3*2}",
                "[Other]",
                "E7 -1.5e2",
                "name Rate Sheet1!$A$1"));
    assertThat(workbook.sheetNames()).containsExactly("Sheet1", "Other").inOrder();
    assertThat(workbook.activeSheet()).isEqualTo("Sheet1");

    Cell a1 = workbook.cell("Sheet1", "A1");
    assertThat(a1.value).isEqualTo(2.0);
    assertThat(a1.type).isEqualTo(DataType.NUMBER);
    assertThat(a1.isFormula()).isFalse();
    assertThat(workbook.cell("Sheet1", "A2").value).isEqualTo("say \"hi\"");
    assertThat(workbook.cell("Sheet1", "A3").value).isEqualTo(true);
    assertThat(workbook.cell("Sheet1", "A3").type).isEqualTo(DataType.BOOLEAN);
    assertThat(workbook.cell("Sheet1", "B1").formula).isEqualTo("=A1+1");
    assertThat(workbook.cell("Sheet1", "Z99")).isSameInstanceAs(Cell.BLANK);
    assertThat(workbook.cell("Other", "E7").value).isEqualTo(-150.0);

    assertThat(workbook.isArrayFormula("Sheet1", "C1")).isTrue();
    assertThat(workbook.isArrayFormula("Sheet1", "C2")).isFalse();
    assertThat(workbook.cell("Sheet1", "C1").formula).isEqualTo("=A1:A3*2");
    assertThat(workbook.arraySpillBounds("Sheet1", "C1")).isEqualTo(CellRange.parse("C1:C3"));
    assertThat(workbook.arrayFormulaAnchors("Sheet1")).containsExactly("C1");
    assertThat(workbook.arrayFormulaAnchors("Other")).isEmpty();

    assertThat(workbook.resolveDefinedName("rate")).hasValue("Sheet1!$A$1");
    assertThat(workbook.resolveDefinedName("Missing")).isEmpty();
  }

  @Test
  public void bounds() {
    SimpleWorkbook workbook =
        SimpleWorkbook.builder()
            .sheet("Sheet1")
            .number("B2", 1)
            .arrayFormula("D1:D6", "=ROW(D1:D6)")
            .sheet("Empty")
            .build();
    assertThat(workbook.maxRow("Sheet1")).isEqualTo(6);
    assertThat(workbook.maxColumn("Sheet1")).isEqualTo(4);
    assertThat(workbook.maxRow("Empty")).isEqualTo(1);
    assertThat(workbook.maxColumn("Empty")).isEqualTo(1);
    assertThrows(IllegalArgumentException.class, () -> workbook.maxRow("Missing"));
    assertThrows(IllegalArgumentException.class, () -> workbook.cell("Missing", "A1"));
    assertThrows(IllegalArgumentException.class, () -> workbook.arraySpillBounds("Sheet1", "B2"));
  }

  @Test
  public void builderAddressesAreCanonical() {
    SimpleWorkbook workbook =
        SimpleWorkbook.builder()
            .sheet("Sheet1")
            .formula("$b$3", "A1*2")
            .sheet("Sheet2")
            .text("A1", "x")
            .sheet("Sheet1")
            .logical("C1", false)
            .build();
    assertThat(workbook.cell("Sheet1", "B3").formula).isEqualTo("=A1*2");
    assertThat(workbook.cell("Sheet1", "C1").value).isEqualTo(false);
    assertThat(workbook.sheetNames()).containsExactly("Sheet1", "Sheet2").inOrder();
    assertThrows(IllegalStateException.class, () -> SimpleWorkbook.builder().build());
    assertThrows(
        IllegalStateException.class, () -> SimpleWorkbook.builder().number("A1", 1));
  }

  @Test
  public void parseErrors() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> SimpleWorkbook.parse("[Sheet1]\nA1 2\nA2 \"abc"));
    assertThat(e).hasMessageThat().startsWith("Line 3: Unterminated text");
    e = assertThrows(IllegalArgumentException.class, () -> SimpleWorkbook.parse("A1 2"));
    assertThat(e).hasMessageThat().isEqualTo("Line 1: No sheet has been started");
    e = assertThrows(IllegalArgumentException.class, () -> SimpleWorkbook.parse("[Sheet1\n"));
    assertThat(e).hasMessageThat().startsWith("Line 1: Bad sheet header");
    e =
        assertThrows(
            IllegalArgumentException.class, () -> SimpleWorkbook.parse("[S]\n# x\nA1 twelve"));
    assertThat(e).hasMessageThat().startsWith("Line 3: ");
    e = assertThrows(IllegalArgumentException.class, () -> SimpleWorkbook.parse("[S]\nA1"));
    assertThat(e).hasMessageThat().startsWith("Line 2: Missing contents");
    e = assertThrows(IllegalArgumentException.class, () -> SimpleWorkbook.parse("[S]\n1A 2"));
    assertThat(e).hasMessageThat().startsWith("Line 2: Not a cell address");
    assertThrows(IllegalStateException.class, () -> SimpleWorkbook.parse("# nothing\n"));
  }

  @Test
  public void load() throws Exception {
    SimpleWorkbook workbook =
        SimpleWorkbook.load(
            Path.of(Resources.getResource(SimpleWorkbookTest.class, "pricing.cells").toURI()));
    assertThat(workbook.sheetNames()).containsExactly("Orders");
    assertThat(workbook.cell("Orders", "A2").value).isEqualTo(12.5);
    assertThat(workbook.cell("Orders", "B2").formula).isEqualTo("=B1*(1-Discount)");
    assertThat(workbook.arraySpillBounds("Orders", "C1")).isEqualTo(CellRange.parse("C1:C3"));
    assertThat(workbook.resolveDefinedName("DISCOUNT")).hasValue("Orders!$A$3");
  }
}
