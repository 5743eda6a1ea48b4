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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.cellgraph.CompileOptions;
import org.cellgraph.UnsupportedOperationError;
import org.cellgraph.code.CompiledFunction;
import org.cellgraph.compiler.Compiler;
import org.cellgraph.workbook.SimpleWorkbook;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Evaluates one call of each kind of built-in function through the compiler. */
@RunWith(TestParameterInjector.class)
public class BuiltinFunctionsTest {

  enum Sample {
    SUM("=SUM(A1:A4,10)", 20.0),
    AVERAGE("=AVERAGE(A1:A4)", 2.5),
    PRODUCT("=PRODUCT(A1:A4)", 24.0),
    MEDIAN("=MEDIAN(A1:A4,100)", 3.0),
    MIN("=MIN(A2:A4)", 2.0),
    MAX("=MAX(A1:A4)", 4.0),
    COUNT("=COUNT(A1:A4)", 4.0),
    SUMSQ("=SUMSQ(A1:A2)", 5.0),
    LARGE("=LARGE(A1:A4,2)", 3.0),
    SMALL("=SMALL(A1:A4,1)", 1.0),
    SUMPRODUCT("=SUMPRODUCT(A1:A2,A3:A4)", 11.0),
    MMULT("=MMULT(TRANSPOSE(A1:A2),A3:A4)", 11.0),
    AND("=AND(A1>0,A2<3)", true),
    OR("=OR(A1>5,A2>5)", false),
    XOR("=XOR(A1>0,A2>0)", false),
    NOT("=NOT(A1=1)", false),
    IF("=IF(A1=1,\"one\",\"other\")", "one"),
    IFS("=IFS(A1>2,\"big\",A1>0,\"small\")", "small"),
    SWITCH("=SWITCH(A2,1,\"one\",2,\"two\")", "two"),
    SWITCH_DEFAULT("=SWITCH(A2,9,\"x\",\"none\")", "none"),
    CHOOSE("=CHOOSE(A3,\"a\",\"b\",\"c\")", "c"),
    ISNUMBER("=ISNUMBER(A1)", true),
    ISTEXT("=ISTEXT(B1)", true),
    ISBLANK("=ISBLANK(Z9)", true),
    PI("=ROUND(PI(),4)", 3.1416),
    ABS("=ABS(-A4)", 4.0),
    SQRT("=SQRT(A4)", 2.0),
    MOD("=MOD(A4+3,A3)", 1.0),
    QUOTIENT("=QUOTIENT(A4+3,A2)", 3.0),
    POWER("=POWER(A2,10)", 1024.0),
    INT("=INT(-A1/2)", -1.0),
    ROUNDUP("=ROUNDUP(A1/3,1)", 0.4),
    TRUNC("=TRUNC(A4/3)", 1.0),
    ISEVEN("=ISEVEN(A4)", true),
    LEN("=LEN(B1)", 5.0),
    LEFT("=LEFT(B1)", "A"),
    LEFT_TWO("=LEFT(B1,2)", "Ap"),
    RIGHT("=RIGHT(B2,3)", "ana"),
    MID("=MID(B2,2,3)", "ana"),
    UPPER("=UPPER(B1)", "APPLE"),
    PROPER("=PROPER(B2)", "Banana"),
    TRIM("=TRIM(\"  a   b \")", "a b"),
    FIND("=FIND(\"an\",B2)", 2.0),
    SEARCH("=SEARCH(\"AN\",B2,3)", 4.0),
    SUBSTITUTE("=SUBSTITUTE(B2,\"a\",\"o\")", "bonono"),
    CONCAT("=CONCAT(B1,\"-\",B2)", "Apple-banana"),
    VALUE("=VALUE(\"12\")+A1", 13.0),
    EXACT("=EXACT(B1,\"apple\")", false),
    LOOKUP("=LOOKUP(2.5,A1:A4)", 2.0),
    LOOKUP_RESULTS("=LOOKUP(3,A1:A4,A1:A4*10)", 30.0);

    final String formula;
    final Object expected;

    Sample(String formula, Object expected) {
      this.formula = formula;
      this.expected = expected;
    }
  }

  @TestParameter private boolean accelerated;

  private CompileOptions options() {
    return accelerated
        ? CompileOptions.DEFAULT
        : CompileOptions.builder().disableNumericAcceleration().build();
  }

  private static Compiler compiler(String formula) {
    SimpleWorkbook workbook =
        SimpleWorkbook.builder()
            .sheet("Sheet1")
            .number("A1", 1)
            .number("A2", 2)
            .number("A3", 3)
            .number("A4", 4)
            .text("B1", "Apple")
            .text("B2", "banana")
            .formula("D1", formula)
            .build();
    return new Compiler(workbook).addInput("x", "A1").addOutput("y", "D1");
  }

  @Test
  public void evaluate(@TestParameter Sample sample) {
    CompiledFunction f = compiler(sample.formula).compile(options());
    assertThat(f.apply()).containsExactly("y", sample.expected);
  }

  @Test
  public void inputsFlowThrough() {
    CompiledFunction f = compiler("=SUM(A1:A4)*MAX(A1,A4)").compile(options());
    assertThat(f.apply(ImmutableMap.of("x", 10.0))).containsExactly("y", 190.0);
  }

  @Test
  public void mixedAggregationsAreRejected() {
    UnsupportedOperationError e =
        assertThrows(
            UnsupportedOperationError.class,
            () -> compiler("=CONCAT(B1,A1)").compile(options()));
    assertThat(e.location()).isEqualTo("Sheet1!D1");
  }
}
