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
package org.cellgraph.optimize;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.cellgraph.CompileOptions;
import org.cellgraph.code.BinaryOp;
import org.cellgraph.code.CompiledFunction;
import org.cellgraph.code.DataType;
import org.cellgraph.code.FunctionCall;
import org.cellgraph.code.Graph;
import org.cellgraph.code.Input;
import org.cellgraph.code.Literal;
import org.cellgraph.code.Node;
import org.cellgraph.code.Operator;
import org.cellgraph.code.Shape;
import org.cellgraph.compiler.Compiler;
import org.cellgraph.functions.FunctionRegistry;
import org.cellgraph.workbook.SimpleWorkbook;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class InPlaceRewriteTest {
  private final FunctionRegistry registry = FunctionRegistry.standard();
  private final Input column = new Input("xs", "xs", Shape.of(3, 1), DataType.NUMBER, null);
  private int count;

  private String name() {
    return "n" + count++;
  }

  private FunctionCall call(String function, Node... args) {
    Node node = registry.lookup(function).buildNode(this::name, ImmutableList.copyOf(args));
    return (FunctionCall) node;
  }

  private BinaryOp minusTen(Node node) {
    return new BinaryOp(name(), Operator.SUBTRACT, node, new Literal(name(), 10.0));
  }

  @Test
  public void freshArgument() {
    assertThat(InPlaceRewrite.canRunInPlace(call("ABS", minusTen(column)))).isTrue();
  }

  @Test
  public void chainedCalls() {
    FunctionCall inner = call("ABS", minusTen(column));
    FunctionCall outer = call("SQRT", inner);
    assertThat(InPlaceRewrite.canRunInPlace(inner)).isTrue();
    assertThat(InPlaceRewrite.canRunInPlace(outer)).isTrue();
  }

  @Test
  public void argumentOwnedByCaller() {
    assertThat(InPlaceRewrite.canRunInPlace(call("ABS", column))).isFalse();
  }

  @Test
  public void sharedArgument() {
    BinaryOp shared = minusTen(column);
    FunctionCall abs = call("ABS", shared);
    BinaryOp other = new BinaryOp(name(), Operator.ADD, shared, abs);
    assertThat(shared.parents()).containsExactly(abs, other);
    assertThat(InPlaceRewrite.canRunInPlace(abs)).isFalse();
  }

  @Test
  public void scalarsAndBinaryFunctions() {
    Input x = new Input("x", "x", Shape.SCALAR, DataType.NUMBER, 0.0);
    assertThat(InPlaceRewrite.canRunInPlace(call("ABS", minusTen(x)))).isFalse();
    Literal two = new Literal(name(), 2.0);
    assertThat(InPlaceRewrite.canRunInPlace(call("POWER", minusTen(column), two))).isFalse();
  }

  @Test
  public void compiledResultsAgree() {
    SimpleWorkbook workbook =
        SimpleWorkbook.builder()
            .sheet("Sheet1")
            .number("A1", 1)
            .number("A2", 2)
            .number("A3", 3)
            .arrayFormula("B1:B3", "=ABS(A1:A3-10)")
            .arrayFormula("C1:C3", "=ABS(A1:A3)")
            .build();
    Compiler compiler =
        new Compiler(workbook)
            .addInput("xs", "A1:A3")
            .addOutput("distance", "B1#")
            .addOutput("magnitude", "C1#");
    Graph graph = compiler.buildGraph(CompileOptions.DEFAULT);
    FunctionCall distance = (FunctionCall) graph.outputs.get(0).child(0);
    FunctionCall magnitude = (FunctionCall) graph.outputs.get(1).child(0);
    assertThat(distance.inPlace()).isTrue();
    assertThat(magnitude.inPlace()).isFalse();

    for (CompileOptions options :
        ImmutableList.of(
            CompileOptions.DEFAULT,
            CompileOptions.builder().disablePass("array-inplace").build(),
            CompileOptions.builder().disableNumericAcceleration().build())) {
      CompiledFunction f = compiler.compile(options);
      assertThat(f.apply(ImmutableMap.of("xs", ImmutableList.of(-1.0, 12.0, 3.0))))
          .containsExactly(
              "distance", ImmutableList.of(11.0, 2.0, 7.0),
              "magnitude", ImmutableList.of(1.0, 12.0, 3.0));
    }
  }
}
