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
import org.cellgraph.code.Index;
import org.cellgraph.code.Node;
import org.jspecify.annotations.Nullable;

/** Compiles part of an array formula's spill as a slice of the whole array. */
final class IndexFrame extends Frame {
  private @Nullable Node array;

  IndexFrame(CompilationKey.Range key, CompileContext context) {
    super(key, key.reference, context);
  }

  @Override
  @Nullable CompilationKey nextReference() {
    return (array == null) ? new CompilationKey.Range(activeCell.arraySource()) : null;
  }

  @Override
  void pushNode(Node node) {
    this.array = node;
  }

  @Override
  Node finish() {
    Preconditions.checkState(array != null);
    int[] offsets = activeCell.offsets();
    return new Index(nextName(), array, offsets[0], offsets[1], offsets[2], offsets[3]);
  }
}
