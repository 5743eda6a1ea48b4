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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.stream.Collectors;
import org.cellgraph.UnsupportedOperationError;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class TokenizerTest {

  /** Formulas and their tokens, separated by "|". */
  enum Sample {
    ARITHMETIC("=1+A1*2", "OPERAND/NUMBER:1|OP_IN:+|OPERAND/RANGE:A1|OP_IN:*|OPERAND/NUMBER:2"),
    PREFIX_AND_POSTFIX(
        "=-A1*2%", "OP_PRE:-|OPERAND/RANGE:A1|OP_IN:*|OPERAND/NUMBER:2|OP_POST:%"),
    INFIX_AFTER_CLOSE(
        "=(1)-2",
        "PAREN/OPEN:(|OPERAND/NUMBER:1|PAREN/CLOSE:)|OP_IN:-|OPERAND/NUMBER:2"),
    FUNCTION(
        "=SUM(A1:B2, 3)",
        "FUNC/OPEN:SUM(|OPERAND/RANGE:A1:B2|SEP/ARG:,|WSPACE: |OPERAND/NUMBER:3|FUNC/CLOSE:)"),
    QUOTED_TEXT_AND_SHEET(
        "=\"a\"\"b\"&'My Sheet'!A1",
        "OPERAND/TEXT:\"a\"\"b\"|OP_IN:&|OPERAND/RANGE:'My Sheet'!A1"),
    SCIENTIFIC_AND_SPILL(
        "=1.5E+3>=H1#", "OPERAND/NUMBER:1.5E+3|OP_IN:>=|OPERAND/RANGE:H1#"),
    ARRAY_CONSTANT(
        "={1,2;3}",
        "ARRAY/OPEN:{|OPERAND/NUMBER:1|SEP/ARG:,|OPERAND/NUMBER:2|SEP/ROW:;"
            + "|OPERAND/NUMBER:3|ARRAY/CLOSE:}"),
    LOGICAL_AND_ERROR("=IF(TRUE,#N/A)", "FUNC/OPEN:IF(|OPERAND/LOGICAL:TRUE|SEP/ARG:,"
        + "|OPERAND/ERROR:#N/A|FUNC/CLOSE:)"),
    NOT_EQUAL("=A1<>B1", "OPERAND/RANGE:A1|OP_IN:<>|OPERAND/RANGE:B1"),
    PREFIXED_FUNCTION("=_xlfn.CONCAT(A1)", "FUNC/OPEN:_xlfn.CONCAT(|OPERAND/RANGE:A1"
        + "|FUNC/CLOSE:)"),
    CONSTANT("12", "OPERAND/NUMBER:12");

    final String formula;
    final String tokens;

    Sample(String formula, String tokens) {
      this.formula = formula;
      this.tokens = tokens;
    }
  }

  @Test
  public void tokenize(@TestParameter Sample sample) {
    String actual =
        Tokenizer.tokenize(sample.formula).stream()
            .map(Token::toString)
            .collect(Collectors.joining("|"));
    assertThat(actual).isEqualTo(sample.tokens);
  }

  @Test
  public void malformed(
      @TestParameter({"=SUM(1", "=(1}", "=1)", "=\"abc", "=#OOPS"}) String formula) {
    assertThrows(UnsupportedOperationError.class, () -> Tokenizer.tokenize(formula));
  }
}
