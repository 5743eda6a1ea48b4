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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** A value supplied by the caller of the compiled function. */
public final class Input extends Node {
  public final String parameterName;
  private final Shape shape;
  private final DataType type;
  private final @Nullable Object defaultValue;

  public Input(
      String name,
      String parameterName,
      Shape shape,
      DataType type,
      @Nullable Object defaultValue) {
    super(name, ImmutableList.of());
    this.parameterName = parameterName;
    this.shape = shape;
    this.type = type;
    this.defaultValue = defaultValue;
  }

  @Override
  public Kind kind() {
    return Kind.INPUT;
  }

  @Override
  public Shape shape() {
    return shape;
  }

  @Override
  public DataType dataType() {
    return type;
  }

  public @Nullable Object defaultValue() {
    return defaultValue;
  }

  /** Inputs are stored by the caller into their parameter slot; nothing to emit. */
  @Override
  void emit(Emitter emitter) {}
}
