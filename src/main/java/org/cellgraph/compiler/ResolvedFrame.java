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

import org.cellgraph.code.Node;
import org.jspecify.annotations.Nullable;

/** A frame whose node was known when it was created. */
final class ResolvedFrame extends Frame {
  private final Node node;

  ResolvedFrame(CompilationKey key, Reference activeCell, CompileContext context, Node node) {
    super(key, activeCell, context);
    this.node = node;
  }

  @Override
  @Nullable CompilationKey nextReference() {
    return null;
  }

  @Override
  void pushNode(Node node) {
    throw new IllegalStateException();
  }

  @Override
  Node finish() {
    return node;
  }
}
