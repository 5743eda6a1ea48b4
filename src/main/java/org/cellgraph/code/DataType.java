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

package org.cellgraph.code;

import org.jspecify.annotations.Nullable;

/** The element type of a value. */
public enum DataType {
  NUMBER(0.0),
  STRING(""),
  BOOLEAN(false),
  DATE(0.0),
  /** Only raw cells may be blank; arrays replace blanks with their type's {@link #zero}. */
  BLANK(null);

  private final @Nullable Object zero;

  DataType(@Nullable Object zero) {
    this.zero = zero;
  }

  /** The value that stands in for a blank cell in an array of this type. */
  public @Nullable Object zero() {
    return zero;
  }

  /** Returns the type of a scalar runtime value. */
  public static DataType of(@Nullable Object value) {
    if (value == null) {
      return BLANK;
    } else if (value instanceof String) {
      return STRING;
    } else if (value instanceof Boolean) {
      return BOOLEAN;
    }
    return NUMBER;
  }
}
