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
import java.util.ArrayList;
import java.util.List;
import org.cellgraph.CompileOptions;
import org.cellgraph.code.Graph;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class OptimizerTest {
  private final List<String> applied = new ArrayList<>();

  private GraphPass recording(String name) {
    return new GraphPass() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public void apply(Graph graph) {
        applied.add(name);
      }
    };
  }

  @Test
  public void standardPipeline() {
    assertThat(Optimizer.standard().passes().stream().map(GraphPass::name).toArray())
        .asList()
        .containsExactly("collapse-literals", "merge-array", "array-inplace", "lazy-conditional")
        .inOrder();
  }

  @Test
  public void runsEnabledPassesInOrder() {
    Optimizer optimizer =
        new Optimizer(ImmutableList.of(recording("one"), recording("two"), recording("three")));
    Graph graph = new Graph(ImmutableList.of(), ImmutableList.of());
    optimizer.run(graph, CompileOptions.DEFAULT);
    assertThat(applied).containsExactly("one", "two", "three").inOrder();

    applied.clear();
    optimizer.run(graph, CompileOptions.builder().disablePass("two").build());
    assertThat(applied).containsExactly("one", "three").inOrder();

    applied.clear();
    optimizer.run(graph, CompileOptions.builder().disableOptimizations().build());
    assertThat(applied).isEmpty();
  }
}
