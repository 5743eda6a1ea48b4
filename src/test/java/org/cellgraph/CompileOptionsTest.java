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

import static com.google.common.truth.Truth.assertThat;

import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CompileOptionsTest {

  @After
  public void clearProperties() {
    System.clearProperty("cellgraph.noAccel");
    System.clearProperty("cellgraph.noOpt");
  }

  @Test
  public void defaults() {
    assertThat(CompileOptions.DEFAULT.numericAcceleration()).isTrue();
    assertThat(CompileOptions.DEFAULT.optimize()).isTrue();
    assertThat(CompileOptions.DEFAULT.passEnabled("merge-array")).isTrue();
    assertThat(CompileOptions.fromSystemProperties().toString())
        .isEqualTo(CompileOptions.DEFAULT.toString());
  }

  @Test
  public void disableEverything() {
    System.setProperty("cellgraph.noAccel", "true");
    System.setProperty("cellgraph.noOpt", "TRUE");
    CompileOptions options = CompileOptions.fromSystemProperties();
    assertThat(options.numericAcceleration()).isFalse();
    assertThat(options.optimize()).isFalse();
    assertThat(options.passEnabled("collapse-literals")).isFalse();
  }

  @Test
  public void disableSomePasses() {
    System.setProperty("cellgraph.noOpt", "merge-array, array-inplace");
    CompileOptions options = CompileOptions.fromSystemProperties();
    assertThat(options.numericAcceleration()).isTrue();
    assertThat(options.optimize()).isTrue();
    assertThat(options.passEnabled("merge-array")).isFalse();
    assertThat(options.passEnabled("array-inplace")).isFalse();
    assertThat(options.passEnabled("lazy-conditional")).isTrue();
  }
}
