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

package org.cellgraph;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;

/**
 * All problems detected while compiling a workbook throw a CompileError (or one of its subclasses).
 * Errors are raised at the point of detection and are never downgraded to warnings.
 */
public class CompileError extends RuntimeException {
  public final String msg;

  /** The cell being compiled when the error was detected, if known. */
  private @Nullable String location;

  public CompileError(String msg) {
    super(msg);
    this.msg = msg;
  }

  public CompileError(String msg, Throwable cause) {
    super(msg, cause);
    this.msg = msg;
  }

  public @Nullable String location() {
    return location;
  }

  /** Records the cell that was being compiled, unless a more specific location was already set. */
  @CanIgnoreReturnValue
  public CompileError atLocation(String location) {
    if (this.location == null) {
      this.location = location;
    }
    return this;
  }

  @Override
  public String getMessage() {
    return (location == null) ? msg : String.format("%s (%s)", msg, location);
  }
}
