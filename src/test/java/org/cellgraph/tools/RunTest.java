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
package org.cellgraph.tools;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;
import java.nio.file.Path;
import org.cellgraph.CompileOptions;
import org.cellgraph.workbook.SimpleWorkbook;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RunTest {
  private SimpleWorkbook workbook;

  @Before
  public void setUp() throws Exception {
    workbook =
        SimpleWorkbook.load(
            Path.of(
                Resources.getResource(SimpleWorkbook.class, "pricing.cells").toURI()));
  }

  private String run(String outputs, String inputs, String... assignments) {
    return Run.run(
        workbook, outputs, inputs, ImmutableList.copyOf(assignments), CompileOptions.DEFAULT);
  }

  @Test
  public void defaults() {
    assertThat(run("total:B2,size:B3", "qty:A1"))
        .isEqualTo("/* RUN () RETURNS\n  {total=28.125, size=large}\n*/\n");
  }

  @Test
  public void assignments() {
    assertThat(run("total:B2,size:B3", "qty:A1,price:A2", "qty=1", "price = 10"))
        .isEqualTo("/* RUN (qty=1, price = 10) RETURNS\n  {total=7.5, size=small}\n*/\n");
  }

  @Test
  public void rangeOutput() {
    assertThat(run("doubled:C1:C3", "qty:A1", "qty=4"))
        .isEqualTo("/* RUN (qty=4) RETURNS\n  {doubled=[8.0, 25.0, 0.5]}\n*/\n");
  }

  @Test
  public void errors() {
    assertThat(run("total:B2", "qty:A1", "count=2"))
        .isEqualTo("/* RUN (count=2) ERRORS\n  Unknown parameter: count\n*/\n");
    assertThat(run("total:B2", "qty A1")).contains("ERRORS\n  Expected name:address, got qty A1");
    assertThat(run("total:Missing!B2", "qty:A1"))
        .isEqualTo("/* RUN () ERRORS\n  Sheet Missing does not exist\n*/\n");
  }
}
