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

package org.cellgraph.functions;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import org.cellgraph.UnsupportedOperationError;
import org.cellgraph.code.DataType;
import org.cellgraph.code.Node;
import org.cellgraph.code.Shape;
import org.cellgraph.runtime.Handles;
import org.cellgraph.runtime.Operators;

/**
 * Maps (normalized, upper-case) function names to their entries. A registry starts with the
 * built-in functions and may be extended with application-defined ones.
 */
public final class FunctionRegistry {
  private final Map<String, FunctionEntry> entries = new HashMap<>();

  /** The entry used for the {@code &} operator. */
  private static final FunctionEntry CONCATENATION =
      Function.builder("&", Handles.findGeneric(Operators.class, "concat", 2))
          .shape(args -> Shape.merge(args.get(0).shape(), args.get(1).shape()))
          .returns(DataType.STRING)
          .build();

  private FunctionRegistry() {}

  /** Returns a new registry containing no functions. */
  public static FunctionRegistry empty() {
    return new FunctionRegistry();
  }

  /** Returns a new registry containing the built-in functions. */
  public static FunctionRegistry standard() {
    FunctionRegistry registry = new FunctionRegistry();
    BuiltinFunctions.registerAll(registry);
    return registry;
  }

  /**
   * Adds a function.
   *
   * @throws IllegalArgumentException if a function with this name is already registered
   */
  @CanIgnoreReturnValue
  public FunctionRegistry register(String name, FunctionEntry entry) {
    String key = name.toUpperCase(Locale.ROOT);
    if (entries.putIfAbsent(key, entry) != null) {
      throw new IllegalArgumentException("Function " + key + " is already registered");
    }
    return this;
  }

  @CanIgnoreReturnValue
  public FunctionRegistry register(FunctionEntry entry) {
    return register(entry.name(), entry);
  }

  /**
   * Returns the entry for the given normalized name.
   *
   * @throws UnsupportedOperationError if there is no such function, or it is marked unsupported
   */
  public FunctionEntry lookup(String name) {
    FunctionEntry entry = entries.get(name);
    if (entry == null) {
      throw UnsupportedOperationError.of("Unknown function %s", name);
    } else if (entry instanceof UnsupportedFunction unsupported) {
      throw unsupported.error();
    }
    return entry;
  }

  public boolean contains(String name) {
    return entries.containsKey(name);
  }

  /** True if the named function is registered and volatile. */
  public boolean isVolatile(String name) {
    FunctionEntry entry = entries.get(name);
    return entry != null && !(entry instanceof UnsupportedFunction) && entry.isVolatile();
  }

  /** Returns a node concatenating the text of two values. */
  public static Node concatenate(Supplier<String> names, Node x, Node y) {
    return CONCATENATION.buildNode(names, List.of(x, y));
  }
}
