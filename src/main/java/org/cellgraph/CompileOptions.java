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

import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashSet;
import java.util.Set;

/** Switches that control code generation and the optimization pipeline. */
public final class CompileOptions {
  public static final CompileOptions DEFAULT = builder().build();

  private final boolean numericAcceleration;
  private final boolean optimize;
  private final ImmutableSet<String> disabledPasses;

  private CompileOptions(Builder builder) {
    this.numericAcceleration = builder.numericAcceleration;
    this.optimize = builder.optimize;
    this.disabledPasses = ImmutableSet.copyOf(builder.disabledPasses);
  }

  /**
   * If true, the generated program is translated to JVM bytecode; otherwise it is run by the
   * interpreter.
   */
  public boolean numericAcceleration() {
    return numericAcceleration;
  }

  /** True if the optimization pass with the given name should run. */
  public boolean passEnabled(String passName) {
    return optimize && !disabledPasses.contains(passName);
  }

  public boolean optimize() {
    return optimize;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns options configured from the {@code cellgraph.noAccel} and {@code cellgraph.noOpt}
   * system properties. {@code cellgraph.noOpt} is either {@code true} (disable every pass) or a
   * comma-separated list of pass names.
   */
  public static CompileOptions fromSystemProperties() {
    Builder builder = builder();
    if (Boolean.parseBoolean(System.getProperty("cellgraph.noAccel", "false"))) {
      builder.disableNumericAcceleration();
    }
    String noOpt = System.getProperty("cellgraph.noOpt", "").trim();
    if (noOpt.equalsIgnoreCase("true")) {
      builder.disableOptimizations();
    } else if (!noOpt.isEmpty()) {
      for (String pass : noOpt.split(",")) {
        builder.disablePass(pass.trim());
      }
    }
    return builder.build();
  }

  @Override
  public String toString() {
    return String.format(
        "CompileOptions(accel=%s, optimize=%s, disabled=%s)",
        numericAcceleration, optimize, disabledPasses);
  }

  /** Builder for CompileOptions. */
  public static final class Builder {
    private boolean numericAcceleration = true;
    private boolean optimize = true;
    private final Set<String> disabledPasses = new HashSet<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder disableNumericAcceleration() {
      numericAcceleration = false;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder disableOptimizations() {
      optimize = false;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder disablePass(String passName) {
      disabledPasses.add(passName);
      return this;
    }

    public CompileOptions build() {
      return new CompileOptions(this);
    }
  }
}
