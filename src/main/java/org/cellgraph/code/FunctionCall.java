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
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A call to a built-in or user-registered function. A call may be marked in-place, in which case it
 * overwrites its single array argument with its result instead of allocating a new array.
 */
public final class FunctionCall extends Node {
  public final CallTarget target;
  private boolean inPlace;

  public FunctionCall(String name, CallTarget target, List<Node> args) {
    super(name, args);
    this.target = target;
  }

  @Override
  public Kind kind() {
    return Kind.FUNCTION_CALL;
  }

  @Override
  public Shape shape() {
    return target.shape(children());
  }

  @Override
  public DataType dataType() {
    return target.resultType(children());
  }

  @Override
  public boolean isVolatile() {
    return target.isVolatile();
  }

  public boolean inPlace() {
    return inPlace;
  }

  public void markInPlace() {
    Preconditions.checkState(target.supportsInPlace() && children().size() == 1);
    inPlace = true;
  }

  @Override
  void emit(Emitter emitter) {
    ImmutableList<Operand> args =
        children().stream().map(emitter::ref).collect(ImmutableList.toImmutableList());
    if (inPlace) {
      Operand arg = args.get(0);
      emitter.add(
          new Statement.Perform(
              new Expr.Call(
                  target.inPlaceImplementation(),
                  target.name() + "!",
                  ImmutableList.of(arg, arg))));
    } else {
      emitter.add(
          new Statement.Assign(
              emitter.slot(this),
              new Expr.Call(target.implementation(args.size()), target.name(), args)));
    }
  }

  @Override
  Operand ref(Emitter emitter) {
    return inPlace ? emitter.ref(child(0)) : emitter.slot(this);
  }
}
