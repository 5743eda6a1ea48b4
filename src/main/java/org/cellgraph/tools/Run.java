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

import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.cellgraph.CompileError;
import org.cellgraph.CompileOptions;
import org.cellgraph.Workbook;
import org.cellgraph.code.CompiledFunction;
import org.cellgraph.compiler.Compiler;
import org.cellgraph.workbook.SimpleWorkbook;

/**
 * A simple command-line tool that compiles part of a workbook and calls the result once.
 *
 * <p>Outputs and inputs are given as comma-separated {@code name:address} pairs; the remaining
 * arguments assign values to inputs. The system properties {@code cellgraph.noAccel} and {@code
 * cellgraph.noOpt} select the interpreter and disable optimizations.
 */
public class Run {
  private Run() {}

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println(
          "Use: run <fileName> <name>:<output>[,...] <name>:<input>[,...] [ <var>=<val> ...]");
      System.exit(1);
    }
  }

  public static void main(String[] args) throws IOException {
    checkUsage(args.length >= 3);
    for (int i = 3; i < args.length; i++) {
      checkUsage(args[i].indexOf('=') > 0);
    }
    SimpleWorkbook workbook = SimpleWorkbook.load(Path.of(args[0]));
    List<String> assignments = Arrays.asList(args).subList(3, args.length);
    System.out.print(
        run(workbook, args[1], args[2], assignments, CompileOptions.fromSystemProperties()));
  }

  /** Compiles and runs, returning a report of the results or of the error. */
  static String run(
      Workbook workbook,
      String outputs,
      String inputs,
      List<String> assignments,
      CompileOptions options) {
    String argsAsString = String.join(", ", assignments);
    try {
      Compiler compiler = new Compiler(workbook);
      parsePairs(outputs).forEach(compiler::addOutput);
      parsePairs(inputs).forEach(compiler::addInput);
      CompiledFunction function = compiler.compile(options);
      Map<String, Object> arguments = new LinkedHashMap<>();
      for (String assignment : assignments) {
        int eq = assignment.indexOf('=');
        arguments.put(
            assignment.substring(0, eq).trim(), parseValue(assignment.substring(eq + 1).trim()));
      }
      ImmutableMap<String, Object> result = function.apply(arguments);
      return String.format("/* RUN (%s) RETURNS\n  %s\n*/\n", argsAsString, result);
    } catch (CompileError | IllegalArgumentException e) {
      return String.format("/* RUN (%s) ERRORS\n  %s\n*/\n", argsAsString, e.getMessage());
    }
  }

  private static Map<String, String> parsePairs(String list) {
    Map<String, String> result = new LinkedHashMap<>();
    for (String pair : list.split(",")) {
      int colon = pair.indexOf(':');
      if (colon <= 0) {
        throw new IllegalArgumentException("Expected name:address, got " + pair);
      }
      result.put(pair.substring(0, colon).trim(), pair.substring(colon + 1).trim());
    }
    return result;
  }

  private static Object parseValue(String text) {
    if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
      return text.substring(1, text.length() - 1);
    }
    String upper = text.toUpperCase(Locale.ROOT);
    if (upper.equals("TRUE") || upper.equals("FALSE")) {
      return upper.equals("TRUE");
    }
    return Double.parseDouble(text);
  }
}
