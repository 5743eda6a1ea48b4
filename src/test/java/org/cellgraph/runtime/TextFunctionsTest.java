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
package org.cellgraph.runtime;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TextFunctionsTest {

  @Test
  public void substrings() {
    assertThat(TextFunctions.left("spreadsheet", 6.0)).isEqualTo("spread");
    assertThat(TextFunctions.right("spreadsheet", 5.0)).isEqualTo("sheet");
    assertThat(TextFunctions.right("abc", 10.0)).isEqualTo("abc");
    assertThat(TextFunctions.mid("spreadsheet", 3.0, 4.0)).isEqualTo("read");
    assertThat(TextFunctions.mid("abc", 10.0, 2.0)).isEqualTo("");
    assertThat(TextFunctions.len(12.5)).isEqualTo(4.0);
    assertThrows(EvaluationError.class, () -> TextFunctions.mid("abc", 0.0, 1.0));
    assertThrows(EvaluationError.class, () -> TextFunctions.left("abc", -1.0));
  }

  @Test
  public void caseAndSpacing() {
    assertThat(TextFunctions.proper("hello wORLD o'neil")).isEqualTo("Hello World O'Neil");
    assertThat(TextFunctions.trim("  a   b  ")).isEqualTo("a b");
    assertThat(TextFunctions.upper(true)).isEqualTo("TRUE");
    assertThat(TextFunctions.exact("a", "A")).isEqualTo(false);
  }

  @Test
  public void searching() {
    assertThat(TextFunctions.find("a", "banana", 3.0)).isEqualTo(4.0);
    assertThat(TextFunctions.search("N", "banana", 1.0)).isEqualTo(3.0);
    EvaluationError e =
        assertThrows(EvaluationError.class, () -> TextFunctions.find("N", "banana", 1.0));
    assertThat(e.code).isEqualTo(EvaluationError.VALUE);
    assertThat(TextFunctions.substitute("a-b-c", "-", "+")).isEqualTo("a+b+c");
    assertThat(TextFunctions.substitute("abc", "", "+")).isEqualTo("abc");
  }

  @Test
  public void concatAndValue() {
    assertThat(TextFunctions.concat(Grid.column("x", 1.0, null, false))).isEqualTo("x1FALSE");
    assertThat(TextFunctions.value(" 42 ")).isEqualTo(42.0);
  }
}
