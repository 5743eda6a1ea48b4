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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.lang.invoke.MethodHandle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;
import org.cellgraph.UnsupportedOperationError;
import org.cellgraph.code.DataType;
import org.cellgraph.code.FlatArray;
import org.cellgraph.code.FunctionCall;
import org.cellgraph.code.Literal;
import org.cellgraph.code.Node;
import org.cellgraph.code.Shape;

/**
 * A function implemented by a single runtime method. Before the call node is built, the arguments
 * may be completed with default values and rearranged by a sequence of {@link Preparation}s.
 */
public class Function extends FunctionEntry {

  /** Computes the shape of a call's result from its (prepared) arguments. */
  public interface ShapeRule {
    Shape apply(List<Node> args);

    ShapeRule SCALAR = args -> Shape.SCALAR;
    ShapeRule FIRST_ARGUMENT = args -> args.get(0).shape();
  }

  /** Rewrites the argument list before the call node is built. */
  public interface Preparation {
    List<Node> apply(Supplier<String> names, List<Node> args);

    /** Appends literal arguments. */
    static Preparation append(Object... values) {
      return (names, args) -> {
        List<Node> result = new ArrayList<>(args);
        for (Object value : values) {
          result.add(new Literal(names.get(), value));
        }
        return result;
      };
    }

    /**
     * Replaces the arguments starting at {@code from} with a single FlatArray of their elements. A
     * single argument in that position is passed unchanged.
     */
    static Preparation aggregateFrom(int from) {
      return (names, args) -> {
        if (args.size() == from + 1) {
          return args;
        }
        List<Node> result = new ArrayList<>(args.subList(0, from));
        result.add(new FlatArray(names.get(), args.subList(from, args.size())));
        return result;
      };
    }
  }

  final MethodHandle impl;
  private final int minArgs;
  private final int maxArgs;
  private final ImmutableList<Object> defaults;
  private final ShapeRule shapeRule;
  private final int typeOfArg;
  private final DataType returnType;
  private final ImmutableList<Preparation> preparations;

  Function(Builder builder) {
    super(builder.name);
    this.impl = builder.impl;
    this.minArgs = builder.minArgs;
    this.maxArgs = builder.maxArgs;
    this.defaults = ImmutableList.copyOf(builder.defaults);
    this.shapeRule = builder.shapeRule;
    this.typeOfArg = builder.typeOfArg;
    this.returnType = builder.returnType;
    this.preparations = ImmutableList.copyOf(builder.preparations);
  }

  public static Builder builder(String name, MethodHandle impl) {
    return new Builder(name, impl);
  }

  @Override
  public Shape shape(List<Node> args) {
    return shapeRule.apply(args);
  }

  @Override
  public DataType resultType(List<Node> args) {
    return (typeOfArg >= 0) ? args.get(typeOfArg).dataType() : returnType;
  }

  @Override
  public Node buildNode(Supplier<String> names, List<Node> args) {
    if (args.size() < minArgs || (maxArgs >= 0 && args.size() > maxArgs)) {
      throw UnsupportedOperationError.of(
          "%s called with %s arguments (expected %s)", name(), args.size(), arityDescription());
    }
    List<Node> prepared = new ArrayList<>(args);
    for (int i = args.size() - minArgs; i < defaults.size(); i++) {
      prepared.add(new Literal(names.get(), defaults.get(i)));
    }
    for (Preparation preparation : preparations) {
      prepared = preparation.apply(names, prepared);
    }
    return new FunctionCall(names.get(), this, prepared);
  }

  private String arityDescription() {
    if (maxArgs < 0) {
      return "at least " + minArgs;
    }
    return (minArgs == maxArgs) ? String.valueOf(minArgs) : minArgs + " to " + maxArgs;
  }

  @Override
  public MethodHandle implementation(int arity) {
    checkArity(arity);
    return impl;
  }

  final void checkArity(int arity) {
    Preconditions.checkState(
        impl.type().parameterCount() == arity, "%s given %s arguments", name(), arity);
  }

  /** Builder for Function and its subclasses. */
  public static final class Builder {
    final String name;
    final MethodHandle impl;
    int minArgs;
    int maxArgs;
    final List<Object> defaults = new ArrayList<>();
    ShapeRule shapeRule = ShapeRule.SCALAR;
    int typeOfArg = -1;
    DataType returnType = DataType.NUMBER;
    final List<Preparation> preparations = new ArrayList<>();

    private Builder(String name, MethodHandle impl) {
      this.name = name;
      this.impl = impl;
      this.minArgs = impl.type().parameterCount();
      this.maxArgs = minArgs;
    }

    /**
     * Declares that the last {@code values.length} arguments are optional, with the given
     * defaults.
     */
    @CanIgnoreReturnValue
    public Builder defaults(Object... values) {
      defaults.addAll(Arrays.asList(values));
      minArgs = maxArgs - defaults.size();
      return this;
    }

    @CanIgnoreReturnValue
    public Builder arity(int min, int max) {
      minArgs = min;
      maxArgs = max;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder shape(ShapeRule rule) {
      shapeRule = rule;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder returns(DataType type) {
      returnType = type;
      return this;
    }

    /** The result has the same type as the given (prepared) argument. */
    @CanIgnoreReturnValue
    public Builder returnsTypeOf(int arg) {
      typeOfArg = arg;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder prepare(Preparation preparation) {
      preparations.add(preparation);
      return this;
    }

    public Function build() {
      return new Function(this);
    }

    /**
     * Builds a function whose implementation takes scalars; array values for the arguments at
     * the given positions are handled by calling it once per element.
     */
    public ScalarFunction buildScalar(int... iterate) {
      return new ScalarFunction(this, iterate);
    }

    /** Builds a numeric function applied elementwise to all of its arguments. */
    public ElementwiseFunction buildElementwise() {
      return new ElementwiseFunction(this);
    }

    /**
     * Builds a function that takes any number of arguments from position {@code from} onwards,
     * passing their elements to the implementation as a single column.
     */
    public AggregatingFunction buildAggregating(int from) {
      return new AggregatingFunction(this, from);
    }
  }
}
