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

import com.google.errorprone.annotations.FormatMethod;

/**
 * Thrown for constructs the compiler does not handle: unknown or explicitly unsupported functions,
 * error literals, unhandled tokens, mixed-type arrays, and array merges that cannot be expressed as
 * a single rectangular slice.
 */
public class UnsupportedOperationError extends CompileError {
  public UnsupportedOperationError(String msg) {
    super(msg);
  }

  @FormatMethod
  public static UnsupportedOperationError of(String format, Object... args) {
    return new UnsupportedOperationError(String.format(format, args));
  }
}
