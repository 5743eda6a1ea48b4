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

import com.google.common.base.Preconditions;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.invoke.MethodType;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.ConstantDynamic;
import org.objectweb.asm.Handle;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;

/**
 * A Loader implements the low-level operation of creating a new MethodHandle from the bytecode for
 * a method. The lifecycle of a Loader is
 *
 * <ul>
 *   <li>Create a new Loader and call {@link #initialize} on it.
 *   <li>Write the method body to the result of {@link #methodVisitor()}, using {@link
 *       #emitLoadConstant} to reference existing objects.
 *   <li>Call {@link #load} to get the MethodHandle.
 * </ul>
 */
final class Loader {

  private ClassWriter classWriter;
  private MethodVisitor methodVisitor;
  private Lookup lookup;
  private String methodName;
  private MethodType methodType;
  private byte[] classBytes;

  /**
   * Constants are loaded with CONSTANT_Dynamic entries whose bootstrap method is {@link
   * MethodHandles#classDataAt}, indexing into the list passed as the hidden class's class data.
   */
  private static final Handle CLASS_DATA_AT =
      new Handle(
          Opcodes.H_INVOKESTATIC,
          asmType(MethodHandles.class),
          "classDataAt",
          MethodType.methodType(Object.class, Lookup.class, String.class, Class.class, int.class)
              .toMethodDescriptorString(),
          false);

  /** A constant that has been passed to {@link #emitLoadConstant}, and the type it was given. */
  private static class Constant {
    final ConstantDynamic condy;
    final Class<?> type;

    Constant(ConstantDynamic condy, Class<?> type) {
      this.condy = condy;
      this.type = type;
    }
  }

  private final IdentityHashMap<Object, Constant> constants = new IdentityHashMap<>();

  /**
   * Writes an instruction to {@link #methodVisitor()} to push the given object on the stack, as an
   * instance of the given type.
   */
  void emitLoadConstant(Object x, Class<?> type) {
    Constant constant = constants.get(x);
    if (constant == null) {
      ConstantDynamic cd =
          new ConstantDynamic(
              "_", org.objectweb.asm.Type.getDescriptor(type), CLASS_DATA_AT, constants.size());
      constant = new Constant(cd, type);
      constants.put(x, constant);
    }
    methodVisitor.visitLdcInsn(constant.condy);
    if (!type.isAssignableFrom(constant.type)) {
      methodVisitor.visitTypeInsn(Opcodes.CHECKCAST, asmType(type));
    }
  }

  /**
   * Prepares the loader to start constructing the method body. The new method will be a public
   * static method of a new hidden class in the package of {@code lookup}.
   *
   * @param methodName will appear in any stack traces thrown while executing the method
   * @param methodType the signature of the constructed method
   * @param lookup a full-privilege lookup for the package in which the class will be defined
   */
  void initialize(String methodName, MethodType methodType, Lookup lookup) {
    Preconditions.checkState(classWriter == null);
    this.methodName = methodName;
    this.methodType = methodType;
    this.lookup = lookup;
    String className =
        lookup.lookupClass().getPackageName().replace('.', '/') + "/" + "GeneratedCode";
    // The generated code never leaves values on the stack across a jump, so frame computation
    // never has to merge two reference types.
    classWriter = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
    classWriter.visit(
        Opcodes.V17,
        Opcodes.ACC_FINAL + Opcodes.ACC_SUPER + Opcodes.ACC_PUBLIC,
        className,
        null,
        "java/lang/Object",
        null);
    methodVisitor =
        classWriter.visitMethod(
            Opcodes.ACC_STATIC + Opcodes.ACC_PUBLIC,
            methodName,
            methodType.toMethodDescriptorString(),
            null,
            null);
    methodVisitor.visitCode();
  }

  /** Returns the visitor for the method body; only valid after {@link #initialize}. */
  MethodVisitor methodVisitor() {
    return methodVisitor;
  }

  /**
   * Should be called after a complete method body has been written to {@link #methodVisitor()};
   * returns a MethodHandle that can be used to call it.
   */
  MethodHandle load() {
    methodVisitor.visitMaxs(0, 0);
    methodVisitor.visitEnd();
    classWriter.visitEnd();
    classBytes = classWriter.toByteArray();
    Object[] constArray = new Object[constants.size()];
    for (Map.Entry<Object, Constant> entry : constants.entrySet()) {
      constArray[(int) entry.getValue().condy.getBootstrapMethodArgument(0)] = entry.getKey();
    }
    @SuppressWarnings("JdkImmutableCollections")
    Object classData = List.of(constArray);
    Lookup newLookup;
    try {
      newLookup = lookup.defineHiddenClassWithClassData(classBytes, classData, true);
    } catch (IllegalAccessException e) {
      throw new IllegalArgumentException(e);
    }
    try {
      return newLookup.findStatic(newLookup.lookupClass(), methodName, methodType);
    } catch (ReflectiveOperationException e) {
      throw new AssertionError(e);
    }
  }

  /** The bytes of the generated class; only valid after {@link #load}. */
  byte[] classBytes() {
    return classBytes;
  }

  /** Returns the string used by the JVM to identify the given class. */
  static String asmType(Class<?> type) {
    return org.objectweb.asm.Type.getInternalName(type);
  }
}
