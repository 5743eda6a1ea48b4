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

package org.cellgraph.code;

import com.google.common.collect.ImmutableMap;
import java.lang.invoke.MethodHandle;
import java.util.List;
import org.cellgraph.runtime.Values;
import org.jspecify.annotations.Nullable;

/**
 * Executes a Program by walking its statements. Used when numeric acceleration is disabled and for
 * evaluating constant subexpressions during optimization.
 */
public final class Interpreter implements Backend {

  @Override
  public CompiledFunction load(Program program) {
    return new ProgramFunction(program) {
      @Override
      void run(@Nullable Object[] slots) {
        execute(program.body, slots);
      }
    };
  }

  /**
   * Computes the value of a node whose children are all {@link Literal}s, without emitting any of
   * the rest of its graph.
   */
  public static @Nullable Object evaluateConstant(Node node) {
    Emitter emitter = new Emitter();
    emitter.emitTree(node);
    Operand result = emitter.ref(node);
    if (!(result instanceof Operand.Slot)) {
      // Nodes such as Index have no statements of their own, just an operand; give them one.
      Operand.Slot slot = emitter.slot(node);
      emitter.add(new Statement.Assign(slot, new Expr.Load(result)));
      result = slot;
    }
    Program program = emitter.build(ImmutableMap.of(node.name(), result));
    @Nullable Object[] slots = new Object[program.slotCount()];
    execute(program.body, slots);
    return evaluate(result, slots);
  }

  static void execute(List<Statement> statements, @Nullable Object[] slots) {
    for (Statement statement : statements) {
      if (statement instanceof Statement.Assign assign) {
        slots[assign.slot.index] = evaluate(assign.expr, slots);
      } else if (statement instanceof Statement.Perform perform) {
        evaluate(perform.call, slots);
      } else if (statement instanceof Statement.Store store) {
        Values.store(
            evaluate(store.buffer, slots), store.row, store.col, evaluate(store.value, slots));
      } else if (statement instanceof Statement.Branch branch) {
        execute(
            Values.isTrue(evaluate(branch.condition, slots)) ? branch.ifTrue : branch.ifFalse,
            slots);
      } else {
        throw new AssertionError(statement);
      }
    }
  }

  static @Nullable Object evaluate(Operand operand, @Nullable Object[] slots) {
    if (operand instanceof Operand.Slot slot) {
      return slots[slot.index];
    } else if (operand instanceof Operand.Constant constant) {
      return constant.value;
    }
    Operand.View view = (Operand.View) operand;
    return Values.slice(
        evaluate(view.base, slots), view.rowFrom, view.rowTo, view.colFrom, view.colTo);
  }

  static @Nullable Object evaluate(Expr expr, @Nullable Object[] slots) {
    if (expr instanceof Expr.Call call) {
      Object[] args = new Object[call.operands.size()];
      for (int i = 0; i < args.length; i++) {
        args[i] = evaluate(call.operands.get(i), slots);
      }
      return invoke(call.handle, args);
    } else if (expr instanceof Expr.Copy copy) {
      return Values.copyConstant(copy.value);
    } else if (expr instanceof Expr.Allocate allocate) {
      return Values.allocate(allocate.height, allocate.width);
    }
    return evaluate(((Expr.Load) expr).operand, slots);
  }

  private static @Nullable Object invoke(MethodHandle handle, Object[] args) {
    try {
      return handle.invokeWithArguments(args);
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Throwable t) {
      throw new IllegalStateException(t);
    }
  }
}
