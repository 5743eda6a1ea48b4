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

/** Thrown when a compilation is requested with an unusable configuration, e.g. no outputs. */
public class CompileSetupError extends CompileError {
  public CompileSetupError(String msg) {
    super(msg);
  }

  @FormatMethod
  public static CompileSetupError of(String format, Object... args) {
    return new CompileSetupError(String.format(format, args));
  }
}
