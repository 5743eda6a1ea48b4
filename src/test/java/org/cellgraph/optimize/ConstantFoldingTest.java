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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.cellgraph.UnsupportedOperationError;
import org.cellgraph.code.ArrayLiteral;
import org.cellgraph.code.BinaryOp;
import org.cellgraph.code.DataType;
import org.cellgraph.code.Graph;
import org.cellgraph.code.Input;
import org.cellgraph.code.Literal;
import org.cellgraph.code.Node;
import org.cellgraph.code.Operator;
import org.cellgraph.code.Output;
import org.cellgraph.code.RandomRange;
import org.cellgraph.code.Shape;
import org.cellgraph.functions.FunctionRegistry;
import org.cellgraph.runtime.EvaluationError;
import org.cellgraph.runtime.Grid;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ConstantFoldingTest {
  private final Input x = new Input("x", "x", Shape.SCALAR, DataType.NUMBER, 0.0);
  private int count;

  private String name() {
    return "n" + count++;
  }

  private Graph graph(Node... outputs) {
    ImmutableList.Builder<Output> builder = ImmutableList.builder();
    for (Node node : outputs) {
      builder.add(new Output(name(), name(), node));
    }
    return new Graph(ImmutableList.of(x), builder.build());
  }

  @Test
  public void foldsNestedConstants() {
    BinaryOp product = new BinaryOp("product", Operator.MULTIPLY, lit(2.0), lit(3.0));
    BinaryOp sum = new BinaryOp("sum", Operator.ADD, product, lit(4.0));
    Graph graph = graph(sum);
    new ConstantFolding().apply(graph);
    Node folded = graph.outputs.get(0).child(0);
    assertThat(folded).isInstanceOf(Literal.class);
    assertThat(((Literal) folded).value()).isEqualTo(10.0);
    assertThat(folded.name()).isEqualTo("sum");
  }

  @Test
  public void stopsAtInputs() {
    BinaryOp product = new BinaryOp("product", Operator.MULTIPLY, lit(2.0), lit(3.0));
    BinaryOp sum = new BinaryOp("sum", Operator.ADD, product, x);
    Graph graph = graph(sum);
    new ConstantFolding().apply(graph);
    assertThat(graph.outputs.get(0).child(0)).isSameInstanceAs(sum);
    assertThat(((Literal) sum.child(0)).value()).isEqualTo(6.0);
    assertThat(sum.child(1)).isSameInstanceAs(x);
    assertThat(product.parents()).isEmpty();
  }

  @Test
  public void foldsArrays() {
    ArrayLiteral array =
        new ArrayLiteral("array", Shape.of(1, 2), ImmutableList.of(lit(1.0), lit(2.0)));
    Graph graph = graph(array);
    new ConstantFolding().apply(graph);
    Literal folded = (Literal) graph.outputs.get(0).child(0);
    assertThat(folded.value()).isEqualTo(Grid.row(1.0, 2.0));
    assertThat(folded.shape()).isEqualTo(Shape.of(1, 2));
  }

  @Test
  public void arraysMustNotMixTypes() {
    UnsupportedOperationError e =
        assertThrows(
            UnsupportedOperationError.class,
            () ->
                new ArrayLiteral(
                    "mixed", Shape.of(1, 2), ImmutableList.of(lit(1.0), lit("a"))));
    assertThat(e).hasMessageThat().contains("mixes elements of type NUMBER and STRING");
  }

  @Test
  public void leavesVolatileNodes() {
    RandomRange random = new RandomRange("random", lit(1.0), lit(6.0), Shape.SCALAR);
    Graph graph = graph(random);
    new ConstantFolding().apply(graph);
    assertThat(graph.outputs.get(0).child(0)).isSameInstanceAs(random);
  }

  @Test
  public void errorsPropagate() {
    Node sqrt =
        FunctionRegistry.standard()
            .lookup("SQRT")
            .buildNode(this::name, ImmutableList.of(lit(-1.0)));
    Graph graph = graph(sqrt);
    EvaluationError e =
        assertThrows(EvaluationError.class, () -> new ConstantFolding().apply(graph));
    assertThat(e.code).isEqualTo(EvaluationError.NUM);
  }

  private Literal lit(Object value) {
    return new Literal(name(), value);
  }
}
