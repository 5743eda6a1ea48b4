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

import com.google.common.collect.ImmutableSet;
import org.apache.log4j.Logger;
import org.cellgraph.code.FunctionCall;
import org.cellgraph.code.Graph;
import org.cellgraph.code.Node;

/**
 * Lets element-wise functions overwrite their argument instead of allocating a result, when
 * nothing else can observe the argument.
 */
public final class InPlaceRewrite implements GraphPass {
  private static final Logger logger = Logger.getLogger(InPlaceRewrite.class);

  /**
   * The kinds of node whose value is always a newly-allocated array. Other nodes may return
   * storage owned by the caller (inputs), by constants (literals), or by another node (views,
   * conditionals, functions that select one of their arguments).
   */
  private static final ImmutableSet<Node.Kind> FRESH_RESULTS =
      ImmutableSet.of(
          Node.Kind.BINARY_OP,
          Node.Kind.COMPARISON,
          Node.Kind.ARRAY_LITERAL,
          Node.Kind.FLAT_ARRAY,
          Node.Kind.RANDOM,
          Node.Kind.RANDOM_RANGE);

  @Override
  public String name() {
    return "array-inplace";
  }

  @Override
  public void apply(Graph graph) {
    graph.visit(
        node -> {
          if (node instanceof FunctionCall call && canRunInPlace(call)) {
            logger.debug("In place: " + call);
            call.markInPlace();
          }
        });
  }

  static boolean canRunInPlace(FunctionCall call) {
    if (call.children().size() != 1
        || call.shape().isScalar()
        || !call.target.supportsInPlace()) {
      return false;
    }
    Node arg = call.child(0);
    return arg.dataType() == call.dataType()
        && arg.parents().size() == 1
        && arg.shape().equals(call.shape())
        && ownsResult(arg);
  }

  private static boolean ownsResult(Node node) {
    if (node instanceof FunctionCall call) {
      // Element-wise functions either allocate their result or reuse their argument's.
      return call.target.supportsInPlace();
    }
    return FRESH_RESULTS.contains(node.kind());
  }
}
