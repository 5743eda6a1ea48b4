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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.Map;
import org.cellgraph.CompileOptions;
import org.cellgraph.CompileSetupError;
import org.cellgraph.InvalidReferenceError;
import org.cellgraph.UnsupportedOperationError;
import org.cellgraph.code.CompiledFunction;
import org.cellgraph.code.Graph;
import org.cellgraph.code.Node;
import org.cellgraph.runtime.EvaluationError;
import org.cellgraph.runtime.Grid;
import org.cellgraph.workbook.SimpleWorkbook;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Compiles small workbooks and runs them with each backend, with and without optimization. */
@RunWith(TestParameterInjector.class)
public class CompilerTest {
  @TestParameter private boolean accelerated;
  @TestParameter private boolean optimized;

  private CompileOptions options() {
    CompileOptions.Builder builder = CompileOptions.builder();
    if (!accelerated) {
      builder.disableNumericAcceleration();
    }
    if (!optimized) {
      builder.disableOptimizations();
    }
    return builder.build();
  }

  private CompiledFunction compile(Compiler compiler) {
    return compiler.compile(options());
  }

  @Test
  public void simpleFormula() {
    SimpleWorkbook workbook =
        SimpleWorkbook.builder().sheet("Sheet1").number("A1", 2).formula("B1", "=A1+1").build();
    CompiledFunction f =
        compile(new Compiler(workbook).addInput("x", "A1").addOutput("y", "B1"));
    assertThat(f.parameterNames()).containsExactly("x");
    assertThat(f.apply()).containsExactly("y", 3.0);
    assertThat(f.apply(ImmutableMap.of("x", 5))).containsExactly("y", 6.0);
    assertThrows(IllegalArgumentException.class, () -> f.apply(ImmutableMap.of("z", 1.0)));
  }

  @Test
  public void precedence() {
    SimpleWorkbook workbook =
        SimpleWorkbook.builder()
            .sheet("Sheet1")
            .number("A1", 3)
            .formula("B1", "=A1^(4+1)")
            .formula("B2", "=-A1^2")
            .formula("B3", "=10-4-A1")
            .formula("B4", "=2^A1^2")
            .formula("B5", "=1+2*A1=7")
            .formula("B6", "=\"a\"&A1+1")
            .formula("B7", "=(A1+1)*(A1-1)")
            .formula("B8", "=+A1--A1")
            .formula("B9", "=A1*50%")
            .build();
    Compiler compiler = new Compiler(workbook).addInput("x", "A1");
    for (int i = 1; i <= 9; i++) {
      compiler.addOutput("b" + i, "B" + i);
    }
    Map<String, Object> result = compile(compiler).apply();
    assertThat(result)
        .containsExactly(
            "b1", 243.0, "b2", 9.0, "b3", 3.0, "b4", 64.0, "b5", true, "b6", "a4", "b7", 8.0,
            "b8", 6.0, "b9", 1.5);
  }

  @Test
  public void sumOfRange() {
    SimpleWorkbook.Builder builder = SimpleWorkbook.builder().sheet("Sheet1");
    for (int i = 1; i <= 10; i++) {
      builder.number("A" + i, i);
    }
    builder.formula("B1", "=SUM(A1:A10)");
    CompiledFunction f =
        compile(new Compiler(builder.build()).addInput("x", "A1").addOutput("total", "B1"));
    assertThat(f.apply()).containsExactly("total", 55.0);
    assertThat(f.apply(ImmutableMap.of("x", 11.0))).containsExactly("total", 65.0);
  }

  @Test
  public void definedNames() {
    SimpleWorkbook workbook =
        SimpleWorkbook.builder()
            .sheet("Sheet1")
            .number("A1", 1)
            .number("A2", 2)
            .number("A3", 3)
            .number("B1", 0.5)
            .formula("C1", "=SUM(Prices)*Rate")
            .name("Prices", "Sheet1!$A$1:$A$3")
            .name("Rate", "Sheet1!$B$1")
            .build();
    CompiledFunction f =
        compile(new Compiler(workbook).addInput("rate", "Rate").addOutput("cost", "C1"));
    assertThat(f.apply()).containsExactly("cost", 3.0);
    assertThat(f.apply(ImmutableMap.of("rate", 2.0))).containsExactly("cost", 12.0);
  }

  @Test
  public void textAndSheets() {
    SimpleWorkbook workbook =
        SimpleWorkbook.builder()
            .sheet("Sheet1")
            .text("A1", "Hello")
            .number("A2", 3)
            .formula("B1", "=A1&\" \"&A2")
            .formula("B2", "=LEN(A1)+A2")
            .sheet("Other Sheet")
            .formula("A1", "=Sheet1!A2*SHEETS()")
            .build();
    CompiledFunction f =
        compile(
            new Compiler(workbook)
                .addInput("n", "A2")
                .addOutput("greeting", "B1")
                .addOutput("length", "B2")
                .addOutput("other", "'Other Sheet'!A1"));
    assertThat(f.apply())
        .containsExactly("greeting", "Hello 3", "length", 8.0, "other", 6.0)
        .inOrder();
  }

  @Test
  public void sharedCellsAreCompiledOnce() {
    SimpleWorkbook workbook =
        SimpleWorkbook.builder()
            .sheet("Sheet1")
            .number("A1", 1)
            .formula("B1", "=A1*2")
            .formula("C1", "=B1+B1")
            .formula("C2", "=B1-1")
            .build();
    Graph graph =
        new Compiler(workbook)
            .addInput("x", "A1")
            .addOutput("sum", "C1")
            .addOutput("diff", "C2")
            .buildGraph(options());
    Node sum = graph.outputs.get(0).child(0);
    Node diff = graph.outputs.get(1).child(0);
    assertThat(sum.child(0)).isSameInstanceAs(sum.child(1));
    assertThat(diff.child(0)).isSameInstanceAs(sum.child(0));
    assertThat(graph.nodes().stream().filter(n -> n.kind() == Node.Kind.BINARY_OP).count())
        .isEqualTo(3);
  }

  @Test
  public void arrayFormulas() {
    SimpleWorkbook workbook =
        SimpleWorkbook.builder()
            .sheet("Sheet1")
            .number("A1", 1)
            .number("A2", 2)
            .number("A3", 3)
            .arrayFormula("C1:C3", "=A1:A3*2")
            .formula("D1", "=SUM(C1#)")
            .formula("D2", "=SUM(_xlfn.ANCHORARRAY(C1))")
            .formula("D3", "=SUM(C2:C3)")
            .build();
    CompiledFunction f =
        compile(
            new Compiler(workbook)
                .addInput("x", "A1")
                .addOutput("spill", "C1#")
                .addOutput("middle", "C2")
                .addOutput("sum", "D1")
                .addOutput("anchored", "D2")
                .addOutput("tail", "D3"));
    assertThat(f.apply())
        .containsExactly(
            "spill", ImmutableList.of(2.0, 4.0, 6.0),
            "middle", 4.0,
            "sum", 12.0,
            "anchored", 12.0,
            "tail", 10.0);
    assertThat(f.apply(ImmutableMap.of("x", 10.0)))
        .containsExactly(
            "spill", ImmutableList.of(20.0, 4.0, 6.0),
            "middle", 4.0,
            "sum", 30.0,
            "anchored", 30.0,
            "tail", 10.0);
  }

  @Test
  public void rangeOutputs() {
    SimpleWorkbook workbook =
        SimpleWorkbook.builder()
            .sheet("Sheet1")
            .number("A1", 1)
            .number("A2", 2)
            .number("B1", 3)
            .formula("B2", "=A1+B1")
            .build();
    CompiledFunction f =
        compile(
            new Compiler(workbook)
                .addInput("x", "A1")
                .addOutput("column", "A1:A3")
                .addOutput("block", "A1:B2"));
    Map<String, Object> result = f.apply(ImmutableMap.of("x", 5.0));
    assertThat(result.get("column")).isEqualTo(ImmutableList.of(5.0, 2.0, 0.0));
    assertThat(result.get("block")).isEqualTo(Grid.of(2, 2, 5.0, 3.0, 2.0, 8.0));
  }

  @Test
  public void rangeInputs() {
    SimpleWorkbook workbook =
        SimpleWorkbook.builder()
            .sheet("Sheet1")
            .number("A1", 1)
            .number("A2", 2)
            .number("A3", 3)
            .formula("B1", "=SUM(A1:A3)")
            .formula("B2", "=A2*10")
            .build();
    CompiledFunction f =
        compile(
            new Compiler(workbook)
                .addInput("xs", "A1:A3")
                .addOutput("sum", "B1")
                .addOutput("second", "B2"));
    assertThat(f.apply()).containsExactly("sum", 6.0, "second", 20.0);
    assertThat(f.apply(ImmutableMap.of("xs", ImmutableList.of(4.0, 5.0, 6.0))))
        .containsExactly("sum", 15.0, "second", 50.0);
    assertThat(f.apply(ImmutableMap.of("xs", new double[] {0, 1, 0})))
        .containsExactly("sum", 1.0, "second", 10.0);
    assertThrows(
        IllegalArgumentException.class,
        () -> f.apply(ImmutableMap.of("xs", ImmutableList.of(1.0, 2.0))));
  }

  @Test
  public void positionFunctions() {
    SimpleWorkbook workbook =
        SimpleWorkbook.builder()
            .sheet("Sheet1")
            .number("A1", 0)
            .formula("B3", "=ROW()*10+COLUMN()+A1")
            .formula("B4", "=ROW(C7)+COLUMN($D$1)")
            .build();
    CompiledFunction f =
        compile(
            new Compiler(workbook)
                .addInput("x", "A1")
                .addOutput("here", "B3")
                .addOutput("there", "B4"));
    assertThat(f.apply()).containsExactly("here", 32.0, "there", 11.0);
  }

  @Test
  public void conditionalsAndLookups() {
    SimpleWorkbook workbook =
        SimpleWorkbook.builder()
            .sheet("Sheet1")
            .number("A1", 1)
            .number("A2", 2)
            .number("A3", 3)
            .number("B1", 10)
            .number("B2", 20)
            .number("B3", 30)
            .text("C1", "one")
            .text("C2", "two")
            .text("C3", "three")
            .number("D1", 2)
            .formula("E1", "=VLOOKUP(D1,A1:B3,2,FALSE)")
            .formula("E2", "=IF(D1>2,\"big\",\"small\")")
            .formula("E3", "=ROUND(MAX(A1:A3)+D1/3,2)")
            .formula("E4", "=LOOKUP(D1,A1:A3,C1:C3)")
            .build();
    CompiledFunction f =
        compile(
            new Compiler(workbook)
                .addInput("key", "D1")
                .addOutput("value", "E1")
                .addOutput("size", "E2")
                .addOutput("score", "E3")
                .addOutput("name", "E4"));
    assertThat(f.apply())
        .containsExactly("value", 20.0, "size", "small", "score", 3.67, "name", "two");
    assertThat(f.apply(ImmutableMap.of("key", 3.0)))
        .containsExactly("value", 30.0, "size", "big", "score", 4.0, "name", "three");
    EvaluationError e =
        assertThrows(EvaluationError.class, () -> f.apply(ImmutableMap.of("key", 7.0)));
    assertThat(e.code).isEqualTo(EvaluationError.NA);
  }

  @Test
  public void mixedTypeTablesAreRejected() {
    SimpleWorkbook workbook =
        SimpleWorkbook.builder()
            .sheet("Sheet1")
            .number("A1", 1)
            .number("A2", 2)
            .text("B1", "one")
            .text("B2", "two")
            .number("D1", 2)
            .formula("E1", "=VLOOKUP(D1,A1:B2,2,FALSE)")
            .build();
    Compiler compiler = new Compiler(workbook).addInput("key", "D1").addOutput("name", "E1");
    UnsupportedOperationError e =
        assertThrows(UnsupportedOperationError.class, () -> compiler.compile(options()));
    assertThat(e).hasMessageThat().contains("mixes elements of type NUMBER and STRING");
  }

  @Test
  public void randomValues() {
    SimpleWorkbook workbook =
        SimpleWorkbook.builder()
            .sheet("Sheet1")
            .number("A1", 1)
            .formula("B1", "=RAND()*A1")
            .formula("B2", "=RANDBETWEEN(1,6)+A1")
            .build();
    CompiledFunction f =
        compile(
            new Compiler(workbook)
                .addInput("x", "A1")
                .addOutput("r", "B1")
                .addOutput("die", "B2"));
    for (int i = 0; i < 20; i++) {
      Map<String, Object> result = f.apply();
      assertThat((Double) result.get("r")).isAtLeast(0.0);
      assertThat((Double) result.get("r")).isLessThan(1.0);
      assertThat((Double) result.get("die")).isIn(ImmutableList.of(2.0, 3.0, 4.0, 5.0, 6.0, 7.0));
    }
  }

  @Test
  public void circularReference() {
    SimpleWorkbook workbook =
        SimpleWorkbook.builder()
            .sheet("Sheet1")
            .formula("A1", "=B1")
            .formula("B1", "=A1+C1")
            .number("C1", 1)
            .build();
    Compiler compiler = new Compiler(workbook).addInput("x", "C1").addOutput("y", "A1");
    InvalidReferenceError e =
        assertThrows(InvalidReferenceError.class, () -> compiler.compile(options()));
    assertThat(e.msg).contains("Circular reference");
    assertThat(e.location()).isEqualTo("Sheet1!B1");
  }

  @Test
  public void unsupportedFormulas(
      @TestParameter({
            "=FOO(1)", "=IFERROR(A1,0)", "={1,2}", "=#REF!", "=SUM(,A1)", "=SUM((A1,A2))"
          })
          String formula) {
    SimpleWorkbook workbook =
        SimpleWorkbook.builder()
            .sheet("Sheet1")
            .number("A1", 1)
            .number("A2", 2)
            .formula("B1", formula)
            .build();
    Compiler compiler = new Compiler(workbook).addInput("x", "A1").addOutput("y", "B1");
    UnsupportedOperationError e =
        assertThrows(UnsupportedOperationError.class, () -> compiler.compile(options()));
    assertThat(e.location()).isEqualTo("Sheet1!B1");
  }

  @Test
  public void setupErrors() {
    SimpleWorkbook workbook =
        SimpleWorkbook.builder().sheet("Sheet1").number("A1", 1).formula("B1", "=A1").build();
    assertThrows(
        CompileSetupError.class,
        () -> new Compiler(workbook).addOutput("y", "B1").compile(options()));
    assertThrows(
        CompileSetupError.class,
        () -> new Compiler(workbook).addInput("x", "A1").compile(options()));
    assertThrows(
        CompileSetupError.class,
        () -> new Compiler(workbook).addInput("x", "A1").addInput("x", "B1"));
    assertThrows(
        InvalidReferenceError.class, () -> new Compiler(workbook).addOutput("y", "Nowhere!B1"));
    assertThrows(
        InvalidReferenceError.class, () -> new Compiler(workbook).addOutput("y", "B1#"));
  }
}
