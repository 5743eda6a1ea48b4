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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import org.cellgraph.runtime.Grid;
import org.cellgraph.runtime.Values;
import org.jspecify.annotations.Nullable;

/**
 * The shared half of each backend's CompiledFunction: converts arguments into a slot array, runs
 * the program body, and collects the outputs.
 */
abstract class ProgramFunction implements CompiledFunction {
  private final Program program;

  ProgramFunction(Program program) {
    this.program = program;
  }

  /** Executes the program body over the given slots. */
  abstract void run(@Nullable Object[] slots);

  @Override
  public Program program() {
    return program;
  }

  @Override
  public ImmutableList<String> parameterNames() {
    return program.parameters.stream().map(p -> p.name).collect(ImmutableList.toImmutableList());
  }

  @Override
  public ImmutableMap<String, Object> apply(Map<String, ?> arguments) {
    for (String name : arguments.keySet()) {
      if (program.parameters.stream().noneMatch(p -> p.name.equals(name))) {
        throw new IllegalArgumentException("Unknown parameter: " + name);
      }
    }
    @Nullable Object[] slots = new Object[program.slotCount()];
    for (Program.Parameter param : program.parameters) {
      Object value =
          arguments.containsKey(param.name)
              ? coerce(param, arguments.get(param.name))
              : Values.copyConstant(param.defaultValue);
      slots[param.slot.index] = value;
    }
    run(slots);
    ImmutableMap.Builder<String, Object> result = ImmutableMap.builder();
    program.outputs.forEach(
        (name, operand) -> {
          Object value = Interpreter.evaluate(operand, slots);
          if (value instanceof Grid grid) {
            // Views may share storage with the program's other arrays.
            value = grid.copy();
          }
          // A reference to a blank cell evaluates to zero.
          result.put(name, (value == null) ? 0.0 : value);
        });
    return result.buildOrThrow();
  }

  /** Converts a caller-supplied argument to the representation used for the parameter. */
  static @Nullable Object coerce(Program.Parameter param, @Nullable Object value) {
    if (param.shape.isScalar()) {
      if (value instanceof Number n) {
        return n.doubleValue();
      } else if (value instanceof Grid g) {
        return Values.scalar(g);
      } else if (value == null || value instanceof String || value instanceof Boolean) {
        return value;
      }
    } else if (value instanceof Grid g) {
      checkSize(param, g.height(), g.width());
      return g.copy();
    } else if (value instanceof double[] array) {
      boolean vertical = param.shape.vertical();
      checkSize(param, vertical ? array.length : 1, vertical ? 1 : array.length);
      Grid grid = Grid.allocate(param.shape.height, param.shape.width);
      for (int i = 0; i < array.length; i++) {
        grid.setFlat(i, array[i]);
      }
      return grid;
    } else if (value instanceof List<?> list) {
      return fromList(param, list);
    }
    throw new IllegalArgumentException(
        String.format("Bad value for parameter %s%s: %s", param.name, param.shape, value));
  }

  private static Grid fromList(Program.Parameter param, List<?> list) {
    Grid grid = Grid.allocate(param.shape.height, param.shape.width);
    if (!list.isEmpty() && list.get(0) instanceof List<?>) {
      checkSize(param, list.size(), ((List<?>) list.get(0)).size());
      for (int r = 0; r < list.size(); r++) {
        List<?> row = (List<?>) list.get(r);
        checkSize(param, list.size(), row.size());
        for (int c = 0; c < row.size(); c++) {
          grid.set(r, c, scalar(row.get(c)));
        }
      }
    } else {
      if (list.size() != param.shape.size() || !param.shape.isVector()) {
        throw new IllegalArgumentException(
            String.format(
                "Parameter %s%s given %s elements", param.name, param.shape, list.size()));
      }
      for (int i = 0; i < list.size(); i++) {
        grid.setFlat(i, scalar(list.get(i)));
      }
    }
    return grid;
  }

  private static @Nullable Object scalar(@Nullable Object element) {
    return (element instanceof Number n) ? (Object) n.doubleValue() : element;
  }

  private static void checkSize(Program.Parameter param, int height, int width) {
    if (height != param.shape.height || width != param.shape.width) {
      throw new IllegalArgumentException(
          String.format(
              "Parameter %s%s given a (%s, %s) array", param.name, param.shape, height, width));
    }
  }
}
