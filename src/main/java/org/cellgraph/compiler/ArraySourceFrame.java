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

import com.google.common.base.Preconditions;
import org.cellgraph.code.Node;
import org.jspecify.annotations.Nullable;

/**
 * Compiles {@code ANCHORARRAY(H1)}, which is the whole spill of the array formula anchored at H1.
 * The value is that of the array reference {@code H1#}, so the spill's node is shared with any
 * direct references to it.
 */
final class ArraySourceFrame extends Frame {
  private final Reference array;
  private @Nullable Node node;

  ArraySourceFrame(
      CompilationKey key, Reference activeCell, CompileContext context, Reference array) {
    super(key, activeCell, context);
    Preconditions.checkArgument(array.kind == Reference.Kind.ARRAY_REFERENCE);
    this.array = array;
  }

  @Override
  @Nullable CompilationKey nextReference() {
    return (node == null) ? new CompilationKey.Range(array) : null;
  }

  @Override
  void pushNode(Node node) {
    this.node = node;
  }

  @Override
  Node finish() {
    Preconditions.checkState(node != null);
    return node;
  }
}
