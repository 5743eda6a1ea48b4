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

import static org.cellgraph.code.DataType.BOOLEAN;
import static org.cellgraph.code.DataType.NUMBER;
import static org.cellgraph.code.DataType.STRING;

import java.lang.invoke.MethodHandle;
import org.cellgraph.code.DataType;
import org.cellgraph.code.Shape;
import org.cellgraph.runtime.Handles;
import org.cellgraph.runtime.LogicalFunctions;
import org.cellgraph.runtime.MathFunctions;
import org.cellgraph.runtime.StatisticalFunctions;
import org.cellgraph.runtime.TextFunctions;

/** The catalogue of built-in spreadsheet functions. */
final class BuiltinFunctions {
  private BuiltinFunctions() {}

  private static MethodHandle math(String method, int arity) {
    return Handles.findGeneric(MathFunctions.class, method, arity);
  }

  private static MethodHandle stat(String method, int arity) {
    return Handles.findGeneric(StatisticalFunctions.class, method, arity);
  }

  private static MethodHandle logic(String method, int arity) {
    return Handles.findGeneric(LogicalFunctions.class, method, arity);
  }

  private static MethodHandle text(String method, int arity) {
    return Handles.findGeneric(TextFunctions.class, method, arity);
  }

  static void registerAll(FunctionRegistry registry) {
    registerStatistical(registry);
    registerLogical(registry);
    registerMath(registry);
    registerText(registry);
    registerLookup(registry);
    registerUnsupported(registry);
  }

  private static void aggregate(FunctionRegistry registry, String name, MethodHandle impl) {
    registry.register(Function.builder(name, impl).buildAggregating(0));
  }

  private static void registerStatistical(FunctionRegistry registry) {
    aggregate(registry, "SUM", stat("sum", 1));
    aggregate(registry, "PRODUCT", stat("product", 1));
    aggregate(registry, "AVERAGE", stat("average", 1));
    aggregate(registry, "MEDIAN", stat("median", 1));
    aggregate(registry, "MIN", stat("min", 1));
    aggregate(registry, "MAX", stat("max", 1));
    aggregate(registry, "COUNT", stat("count", 1));
    aggregate(registry, "SUMSQ", stat("sumSquares", 1));
    aggregate(registry, "GEOMEAN", stat("geomean", 1));
    aggregate(registry, "HARMEAN", stat("harmean", 1));
    registry.register(Function.builder("LARGE", stat("large", 2)).build());
    registry.register(Function.builder("SMALL", stat("small", 2)).build());
    registry.register(Function.builder("SUMPRODUCT", stat("sumProduct", 2)).build());
    registry.register(
        Function.builder("TRANSPOSE", stat("transpose", 1))
            .shape(args -> Shape.of(args.get(0).shape().width, args.get(0).shape().height))
            .returnsTypeOf(0)
            .build());
    registry.register(
        Function.builder("MMULT", stat("mmult", 2))
            .shape(args -> Shape.of(args.get(0).shape().height, args.get(1).shape().width))
            .build());
  }

  private static void registerLogical(FunctionRegistry registry) {
    registry.register(
        Function.builder("AND", logic("and", 1)).returns(BOOLEAN).buildAggregating(0));
    registry.register(Function.builder("OR", logic("or", 1)).returns(BOOLEAN).buildAggregating(0));
    registry.register(
        Function.builder("XOR", logic("xor", 1)).returns(BOOLEAN).buildAggregating(0));
    registry.register(Function.builder("NOT", logic("not", 1)).returns(BOOLEAN).buildScalar(0));
    registry.register(
        Function.builder("IF", logic("ifThen", 3))
            .defaults(false)
            .returnsTypeOf(1)
            .buildScalar(0, 1, 2));
    registry.register(ConditionalListFunction.ifs());
    registry.register(ConditionalListFunction.switchFunction());
    registry.register(
        Function.builder("CHOOSE", logic("choose", 2)).returnsTypeOf(1).buildAggregating(1));
    registry.register(new ConstantFunction("TRUE", true, BOOLEAN));
    registry.register(new ConstantFunction("FALSE", false, BOOLEAN));
    registry.register(
        new DataTypeFunction("ISNUMBER", t -> t == DataType.NUMBER || t == DataType.DATE));
    registry.register(new DataTypeFunction("ISTEXT", t -> t == STRING));
    registry.register(new DataTypeFunction("ISNONTEXT", t -> t != STRING));
    registry.register(new DataTypeFunction("ISBLANK", t -> t == DataType.BLANK));
  }

  private static void elementwise(FunctionRegistry registry, String name, String method) {
    registry.register(Function.builder(name, math(method, 1)).buildElementwise());
  }

  private static void registerMath(FunctionRegistry registry) {
    registry.register(new ConstantFunction("PI", Math.PI, NUMBER));
    elementwise(registry, "ABS", "abs");
    elementwise(registry, "SIGN", "sign");
    elementwise(registry, "SQRT", "sqrt");
    elementwise(registry, "EXP", "exp");
    elementwise(registry, "LN", "ln");
    elementwise(registry, "LOG10", "log10");
    elementwise(registry, "INT", "floorInt");
    elementwise(registry, "SIN", "sin");
    elementwise(registry, "COS", "cos");
    elementwise(registry, "TAN", "tan");
    elementwise(registry, "ASIN", "asin");
    elementwise(registry, "ACOS", "acos");
    elementwise(registry, "ATAN", "atan");
    elementwise(registry, "SINH", "sinh");
    elementwise(registry, "COSH", "cosh");
    elementwise(registry, "TANH", "tanh");
    elementwise(registry, "DEGREES", "degrees");
    elementwise(registry, "RADIANS", "radians");
    registry.register(Function.builder("POWER", math("power", 2)).buildElementwise());
    registry.register(Function.builder("MOD", math("mod", 2)).buildElementwise());
    registry.register(Function.builder("QUOTIENT", math("quotient", 2)).buildElementwise());
    registry.register(Function.builder("ATAN2", math("atan2", 2)).buildElementwise());
    registry.register(Function.builder("ROUND", math("round", 2)).buildElementwise());
    registry.register(Function.builder("ROUNDUP", math("roundUp", 2)).buildElementwise());
    registry.register(Function.builder("ROUNDDOWN", math("roundDown", 2)).buildElementwise());
    registry.register(
        Function.builder("TRUNC", math("trunc", 2)).defaults(0.0).buildElementwise());
    registry.register(
        Function.builder("ISEVEN", math("isEven", 1)).returns(BOOLEAN).buildScalar(0));
    registry.register(
        Function.builder("ISODD", math("isOdd", 1)).returns(BOOLEAN).buildScalar(0));
  }

  private static void registerText(FunctionRegistry registry) {
    registry.register(Function.builder("LEN", text("len", 1)).buildScalar(0));
    registry.register(
        Function.builder("LEFT", text("left", 2)).defaults(1.0).returns(STRING).buildScalar(0, 1));
    registry.register(
        Function.builder("RIGHT", text("right", 2))
            .defaults(1.0)
            .returns(STRING)
            .buildScalar(0, 1));
    registry.register(
        Function.builder("MID", text("mid", 3)).returns(STRING).buildScalar(0, 1, 2));
    registry.register(Function.builder("UPPER", text("upper", 1)).returns(STRING).buildScalar(0));
    registry.register(Function.builder("LOWER", text("lower", 1)).returns(STRING).buildScalar(0));
    registry.register(
        Function.builder("PROPER", text("proper", 1)).returns(STRING).buildScalar(0));
    registry.register(Function.builder("TRIM", text("trim", 1)).returns(STRING).buildScalar(0));
    registry.register(
        Function.builder("EXACT", text("exact", 2)).returns(BOOLEAN).buildScalar(0, 1));
    registry.register(
        Function.builder("FIND", text("find", 3)).defaults(1.0).buildScalar(0, 1, 2));
    registry.register(
        Function.builder("SEARCH", text("search", 3)).defaults(1.0).buildScalar(0, 1, 2));
    registry.register(
        Function.builder("SUBSTITUTE", text("substitute", 3))
            .returns(STRING)
            .buildScalar(0, 1, 2));
    registry.register(Function.builder("VALUE", text("value", 1)).buildScalar(0));
    registry.register(
        Function.builder("CONCAT", text("concat", 1)).returns(STRING).buildAggregating(0));
    registry.register(
        Function.builder("CONCATENATE", text("concat", 1)).returns(STRING).buildAggregating(0));
  }

  private static void registerLookup(FunctionRegistry registry) {
    registry.register(new LookupFunction("VLOOKUP", LookupFunction.Form.VERTICAL));
    registry.register(new LookupFunction("HLOOKUP", LookupFunction.Form.HORIZONTAL));
    registry.register(new LookupFunction("LOOKUP", LookupFunction.Form.VECTOR));
  }

  private static void registerUnsupported(FunctionRegistry registry) {
    String errors = "error values are not represented in compiled code";
    registry.register(new UnsupportedFunction("IFERROR", errors));
    registry.register(new UnsupportedFunction("IFNA", errors));
    String mixed = "arrays mixing text and numbers are not supported";
    registry.register(new UnsupportedFunction("AVERAGEA", mixed));
    registry.register(new UnsupportedFunction("MAXA", mixed));
    registry.register(new UnsupportedFunction("MINA", mixed));
    registry.register(new UnsupportedFunction("N", "conversions of arbitrary values to numbers"));
    registry.register(new UnsupportedFunction("T", "conversions of arbitrary values to text"));
  }
}
