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

/**
 * The compilation of one unit (a cell, a range, a function call, a parenthesized group). A frame
 * does not compile the units it depends on itself; it names them, one at a time, through {@link
 * #nextReference}, and the compiler's main loop hands each resulting node back through {@link
 * #pushNode}. This keeps deeply nested workbooks from exhausting the Java stack.
 */
abstract class Frame {
  final CompilationKey key;

  /** The cell (or array) whose formula this frame is part of. */
  final Reference activeCell;

  final CompileContext context;

  Frame(CompilationKey key, Reference activeCell, CompileContext context) {
    this.key = key;
    this.activeCell = activeCell;
    this.context = context;
  }

  /** Returns the next unit this frame needs the node of, or null if it needs nothing more. */
  abstract @Nullable CompilationKey nextReference();

  /** Supplies the node for the unit most recently returned by {@link #nextReference}. */
  abstract void pushNode(Node node);

  /** Returns the node for this frame's unit; only called once {@link #nextReference} is null. */
  abstract Node finish();

  /** Returns a fresh node name based on the active cell. */
  final String nextName() {
    return context.names.next(activeCell.encodeName());
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + key + " in " + activeCell + "]";
  }
}
