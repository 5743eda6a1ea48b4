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

import java.util.ArrayList;
import java.util.List;
import org.apache.log4j.Logger;
import org.cellgraph.code.Conditional;
import org.cellgraph.code.FunctionCall;
import org.cellgraph.code.Graph;
import org.cellgraph.code.Node;

/**
 * Replaces scalar {@code IF} calls with {@link Conditional}s, which evaluate only the branch that
 * is selected.
 */
public final class LazyConditional implements GraphPass {
  private static final Logger logger = Logger.getLogger(LazyConditional.class);

  @Override
  public String name() {
    return "lazy-conditional";
  }

  @Override
  public void apply(Graph graph) {
    List<FunctionCall> calls = new ArrayList<>();
    graph.visit(
        node -> {
          if (node instanceof FunctionCall call
              && call.target.name().equals("IF")
              && call.children().size() == 3
              && call.shape().isScalar()) {
            calls.add(call);
          }
        });
    // Calls were collected children first, so a nested IF is replaced before the IF using it.
    for (FunctionCall call : calls) {
      Conditional conditional =
          new Conditional(call.name(), call.child(0), call.child(1), call.child(2));
      logger.debug("Lazy: " + call);
      call.replaceInGraph(conditional);
      call.detach();
    }
  }
}
