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

/**
 * Thrown by compiled code when a spreadsheet function cannot produce a value, e.g. a lookup with
 * no match or text that cannot be read as a number. The error code is the spreadsheet's spelling
 * of the error ({@code #N/A}, {@code #VALUE!}, ...).
 */
public class EvaluationError extends RuntimeException {
  public static final String NA = "#N/A";
  public static final String VALUE = "#VALUE!";
  public static final String NUM = "#NUM!";
  public static final String REF = "#REF!";

  public final String code;

  public EvaluationError(String code, String detail) {
    super(code + " " + detail);
    this.code = code;
  }
}
