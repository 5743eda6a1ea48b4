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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.List;
import org.apache.log4j.Logger;
import org.cellgraph.runtime.Values;
import org.jspecify.annotations.Nullable;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassTooLargeException;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodTooLargeException;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.util.TraceClassVisitor;

/**
 * Translates a Program into the body of a static {@code run(Object[] slots)} method in a newly
 * defined hidden class. Calls to runtime functions go through {@link MethodHandle#invokeExact}
 * on handles loaded as class-data constants.
 *
 * <p>Programs too large for a single JVM method are run by the {@link Interpreter} instead.
 */
public final class BytecodeBackend implements Backend {
  private static final Logger logger = Logger.getLogger(BytecodeBackend.class);

  private static final MethodType RUN_TYPE = MethodType.methodType(void.class, Object[].class);
  private static final String VALUES = Loader.asmType(Values.class);

  @Override
  public CompiledFunction load(Program program) {
    MethodHandle run;
    try {
      run = generate(program);
    } catch (MethodTooLargeException | ClassTooLargeException e) {
      logger.warn("Program too large for bytecode, interpreting instead: " + e.getMessage());
      return new Interpreter().load(program);
    }
    return new ProgramFunction(program) {
      @Override
      void run(@Nullable Object[] slots) {
        try {
          run.invokeExact((Object[]) slots);
        } catch (RuntimeException | Error e) {
          throw e;
        } catch (Throwable t) {
          throw new IllegalStateException(t);
        }
      }
    };
  }

  private static MethodHandle generate(Program program) {
    Loader loader = new Loader();
    loader.initialize("run", RUN_TYPE, MethodHandles.lookup());
    new Writer(loader).statements(program.body);
    loader.methodVisitor().visitInsn(Opcodes.RETURN);
    MethodHandle result = loader.load();
    if (logger.isTraceEnabled()) {
      StringWriter listing = new StringWriter();
      new ClassReader(loader.classBytes())
          .accept(new TraceClassVisitor(new PrintWriter(listing)), 0);
      logger.trace("Generated class:\n" + listing);
    }
    return result;
  }

  /** Writes the instructions for statements, expressions and operands. */
  private static class Writer {
    final Loader loader;
    final MethodVisitor mv;

    Writer(Loader loader) {
      this.loader = loader;
      this.mv = loader.methodVisitor();
    }

    void statements(List<Statement> statements) {
      statements.forEach(this::statement);
    }

    void statement(Statement statement) {
      if (statement instanceof Statement.Assign assign) {
        mv.visitVarInsn(Opcodes.ALOAD, 0);
        pushInt(assign.slot.index);
        expr(assign.expr);
        mv.visitInsn(Opcodes.AASTORE);
      } else if (statement instanceof Statement.Perform perform) {
        expr(perform.call);
        mv.visitInsn(Opcodes.POP);
      } else if (statement instanceof Statement.Store store) {
        operand(store.buffer);
        pushInt(store.row);
        pushInt(store.col);
        operand(store.value);
        invokeValues("store", "(Ljava/lang/Object;IILjava/lang/Object;)V");
      } else if (statement instanceof Statement.Branch branch) {
        Label ifFalse = new Label();
        Label done = new Label();
        operand(branch.condition);
        invokeValues("isTrue", "(Ljava/lang/Object;)Z");
        mv.visitJumpInsn(Opcodes.IFEQ, ifFalse);
        statements(branch.ifTrue);
        mv.visitJumpInsn(Opcodes.GOTO, done);
        mv.visitLabel(ifFalse);
        statements(branch.ifFalse);
        mv.visitLabel(done);
      } else {
        throw new AssertionError(statement);
      }
    }

    /** Pushes the value of an expression. */
    void expr(Expr expr) {
      if (expr instanceof Expr.Call call) {
        loader.emitLoadConstant(call.handle, MethodHandle.class);
        call.operands.forEach(this::operand);
        mv.visitMethodInsn(
            Opcodes.INVOKEVIRTUAL,
            Loader.asmType(MethodHandle.class),
            "invokeExact",
            call.handle.type().toMethodDescriptorString(),
            false);
      } else if (expr instanceof Expr.Copy copy) {
        loader.emitLoadConstant(copy.value, Object.class);
        invokeValues("copyConstant", "(Ljava/lang/Object;)Ljava/lang/Object;");
      } else if (expr instanceof Expr.Allocate allocate) {
        pushInt(allocate.height);
        pushInt(allocate.width);
        invokeValues("allocate", "(II)Ljava/lang/Object;");
      } else {
        operand(((Expr.Load) expr).operand);
      }
    }

    /** Pushes the value of an operand. */
    void operand(Operand operand) {
      if (operand instanceof Operand.Slot slot) {
        mv.visitVarInsn(Opcodes.ALOAD, 0);
        pushInt(slot.index);
        mv.visitInsn(Opcodes.AALOAD);
      } else if (operand instanceof Operand.Constant constant) {
        if (constant.value == null) {
          mv.visitInsn(Opcodes.ACONST_NULL);
        } else {
          loader.emitLoadConstant(constant.value, Object.class);
        }
      } else {
        Operand.View view = (Operand.View) operand;
        operand(view.base);
        pushInt(view.rowFrom);
        pushInt(view.rowTo);
        pushInt(view.colFrom);
        pushInt(view.colTo);
        invokeValues("slice", "(Ljava/lang/Object;IIII)Ljava/lang/Object;");
      }
    }

    void invokeValues(String method, String descriptor) {
      mv.visitMethodInsn(Opcodes.INVOKESTATIC, VALUES, method, descriptor, false);
    }

    void pushInt(int i) {
      if (i >= -1 && i <= 5) {
        mv.visitInsn(Opcodes.ICONST_0 + i);
      } else if (i >= Byte.MIN_VALUE && i <= Byte.MAX_VALUE) {
        mv.visitIntInsn(Opcodes.BIPUSH, i);
      } else if (i >= Short.MIN_VALUE && i <= Short.MAX_VALUE) {
        mv.visitIntInsn(Opcodes.SIPUSH, i);
      } else {
        mv.visitLdcInsn(i);
      }
    }
  }
}
