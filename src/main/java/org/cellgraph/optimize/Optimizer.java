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

import com.google.common.collect.ImmutableList;
import org.apache.log4j.Logger;
import org.cellgraph.CompileOptions;
import org.cellgraph.code.Graph;

/** Runs a fixed sequence of {@link GraphPass}es. */
public final class Optimizer {
  private static final Logger logger = Logger.getLogger(Optimizer.class);

  private final ImmutableList<GraphPass> passes;

  public Optimizer(ImmutableList<GraphPass> passes) {
    this.passes = passes;
  }

  /**
   * The default pipeline. Constant folding runs first, so that array merging only sees arrays
   * that are actually computed; lazy conditionals come last since the other passes do not expect
   * Conditional nodes.
   */
  public static Optimizer standard() {
    return new Optimizer(
        ImmutableList.of(
            new ConstantFolding(), new ArrayMerge(), new InPlaceRewrite(), new LazyConditional()));
  }

  public ImmutableList<GraphPass> passes() {
    return passes;
  }

  /** Applies each pass that {@code options} enables, in order. */
  public void run(Graph graph, CompileOptions options) {
    for (GraphPass pass : passes) {
      if (!options.passEnabled(pass.name())) {
        logger.debug("Skipping " + pass.name());
        continue;
      }
      logger.debug("Starting " + pass.name());
      pass.apply(graph);
      if (logger.isTraceEnabled()) {
        logger.trace("After " + pass.name() + ": " + graph.nodes());
      }
    }
  }
}
