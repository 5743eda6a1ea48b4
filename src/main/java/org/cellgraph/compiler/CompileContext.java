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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;
import org.cellgraph.Workbook;
import org.cellgraph.functions.FunctionRegistry;
import org.jspecify.annotations.Nullable;

/** State shared by all the frames of one compilation. */
final class CompileContext {
  final Workbook workbook;
  final ReferenceResolver resolver;
  final FunctionRegistry registry;
  final NameGenerator names = new NameGenerator();

  CompileContext(Workbook workbook, FunctionRegistry registry) {
    this.workbook = workbook;
    this.resolver = new ReferenceResolver(workbook);
    this.registry = registry;
  }

  CompilationKey.Range rangeKey(String text, Reference activeCell) {
    return new CompilationKey.Range(resolver.resolve(text, activeCell.sheet));
  }

  /**
   * Returns the key for a call.
   *
   * @param opener the function's opening token, e.g. {@code SUM(}
   */
  CompilationKey.FunctionCall functionKey(
      String opener, List<ImmutableList<Token>> args, Reference activeCell) {
    String name = normalizeFunctionName(opener);
    Object discriminator = discriminator(name, args, activeCell);
    return new CompilationKey.FunctionCall(
        activeCell.sheet, name, ImmutableList.copyOf(args), discriminator);
  }

  CompilationKey.Paren parenKey(ImmutableList<Token> tokens, Reference activeCell) {
    return new CompilationKey.Paren(
        activeCell.sheet, tokens, discriminator(null, List.of(tokens), activeCell));
  }

  /**
   * Upper-cases a function name and removes the decorations that spreadsheet files add to newer
   * functions ({@code _xlfn.}, {@code _xlws.}); any remaining {@code .} becomes {@code _x_}.
   */
  static String normalizeFunctionName(String opener) {
    String name = opener.endsWith("(") ? opener.substring(0, opener.length() - 1) : opener;
    name = name.trim().toUpperCase(Locale.ROOT);
    for (String prefix : List.of("_XLFN.", "_XLWS.")) {
      if (name.startsWith(prefix)) {
        name = name.substring(prefix.length());
      }
    }
    return name.replace(".", "_x_");
  }

  private @Nullable Object discriminator(
      @Nullable String name, List<ImmutableList<Token>> args, Reference activeCell) {
    boolean cellSensitive = false;
    if (name != null) {
      if (isVolatile(name)) {
        return new Object();
      }
      cellSensitive = SpecialFunctions.isCellSensitive(name);
    }
    for (List<Token> arg : args) {
      for (Token token : arg) {
        if (token.type == Token.Type.FUNC && token.isOpen()) {
          String nested = normalizeFunctionName(token.value);
          if (isVolatile(nested)) {
            return new Object();
          }
          cellSensitive |= SpecialFunctions.isCellSensitive(nested);
        }
      }
    }
    return cellSensitive ? activeCell : null;
  }

  private boolean isVolatile(String name) {
    return SpecialFunctions.isVolatile(name) || registry.isVolatile(name);
  }
}
