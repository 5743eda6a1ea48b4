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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.apache.log4j.Logger;
import org.cellgraph.CellRange;
import org.cellgraph.CompileError;
import org.cellgraph.CompileOptions;
import org.cellgraph.CompileSetupError;
import org.cellgraph.InvalidReferenceError;
import org.cellgraph.Workbook;
import org.cellgraph.code.BytecodeBackend;
import org.cellgraph.code.CompiledFunction;
import org.cellgraph.code.DataType;
import org.cellgraph.code.Emitter;
import org.cellgraph.code.Graph;
import org.cellgraph.code.Index;
import org.cellgraph.code.Input;
import org.cellgraph.code.Interpreter;
import org.cellgraph.code.Node;
import org.cellgraph.code.Output;
import org.cellgraph.code.Program;
import org.cellgraph.functions.FunctionEntry;
import org.cellgraph.functions.FunctionRegistry;
import org.cellgraph.optimize.Optimizer;
import org.cellgraph.runtime.Grid;
import org.jspecify.annotations.Nullable;

/**
 * Compiles the part of a workbook that computes some chosen cells (the outputs) from some other
 * chosen cells (the inputs) into a function.
 *
 * <p>Typical use:
 *
 * <pre>
 *   CompiledFunction f = new Compiler(workbook)
 *       .addInput("rate", "Inputs!B2")
 *       .addOutput("total", "Summary!C10")
 *       .compile(CompileOptions.DEFAULT);
 *   f.apply(Map.of("rate", 0.05));
 * </pre>
 *
 * <p>Cells that are neither inputs nor (direct or indirect) dependencies of an output are ignored;
 * cells that the outputs depend on but that are not inputs are treated as constants. A Compiler is
 * not thread-safe.
 */
public final class Compiler {
  private static final Logger logger = Logger.getLogger(Compiler.class);

  private final Workbook workbook;
  private final FunctionRegistry registry;
  private final ReferenceResolver resolver;
  private final Map<String, Reference> inputs = new LinkedHashMap<>();
  private final Map<String, Reference> outputs = new LinkedHashMap<>();

  public Compiler(Workbook workbook) {
    this(workbook, FunctionRegistry.standard());
  }

  public Compiler(Workbook workbook, FunctionRegistry registry) {
    this.workbook = workbook;
    this.registry = registry;
    this.resolver = new ReferenceResolver(workbook);
  }

  /**
   * Makes the cell or range at {@code address} a parameter of the compiled function. Any formula
   * in those cells is ignored.
   *
   * @throws CompileSetupError if an input with this name was already added
   * @throws InvalidReferenceError if the address is invalid
   */
  @CanIgnoreReturnValue
  public Compiler addInput(String name, String address) {
    if (inputs.containsKey(name)) {
      throw CompileSetupError.of("Duplicate input %s", name);
    }
    inputs.put(name, resolver.resolve(address, workbook.activeSheet()));
    return this;
  }

  /**
   * Makes the value of the cell or range at {@code address} one of the results of the compiled
   * function.
   *
   * @throws CompileSetupError if an output with this name was already added
   * @throws InvalidReferenceError if the address is invalid
   */
  @CanIgnoreReturnValue
  public Compiler addOutput(String name, String address) {
    if (outputs.containsKey(name)) {
      throw CompileSetupError.of("Duplicate output %s", name);
    }
    outputs.put(name, resolver.resolve(address, workbook.activeSheet()));
    return this;
  }

  /** Returns the optimized graph. */
  public Graph buildGraph(CompileOptions options) {
    Graph graph = compileGraph();
    Optimizer.standard().run(graph, options);
    return graph;
  }

  /** Returns the program computing the outputs. */
  public Program generate(CompileOptions options) {
    Program program = Emitter.emit(buildGraph(options));
    if (logger.isTraceEnabled()) {
      logger.trace("Generated " + program);
    }
    return program;
  }

  public CompiledFunction compile(CompileOptions options) {
    Program program = generate(options);
    return options.numericAcceleration()
        ? new BytecodeBackend().load(program)
        : new Interpreter().load(program);
  }

  /** Compiles every output, sharing the nodes of units that are reached more than once. */
  Graph compileGraph() {
    if (outputs.isEmpty() || inputs.isEmpty()) {
      throw CompileSetupError.of("Must have at least one output and one input for compilation");
    }
    CompileContext context = new CompileContext(workbook, registry);
    Map<CompilationKey, Node> memo = new HashMap<>();
    Map<Reference, Input> inputNodes = new LinkedHashMap<>();
    // Inputs replace whatever the cells would otherwise compute.
    inputs.forEach(
        (name, ref) -> {
          Input input = input(name, ref, context);
          inputNodes.put(ref, input);
          memo.put(new CompilationKey.Range(ref), input);
        });
    ImmutableList.Builder<Output> outputNodes = ImmutableList.builder();
    outputs.forEach(
        (name, ref) -> {
          Node value = compile(new CompilationKey.Range(ref), memo, inputNodes, context);
          outputNodes.add(new Output(context.names.claim("out_" + name), name, value));
        });
    Graph graph = new Graph(ImmutableList.copyOf(inputNodes.values()), outputNodes.build());
    logger.debug(String.format("Compiled %s units", memo.size()));
    return graph;
  }

  private Input input(String name, Reference ref, CompileContext context) {
    String nodeName = context.names.claim(name);
    if (ref.bounds.isSingleCell()) {
      Workbook.Cell cell = workbook.cell(ref.sheet, ref.bounds.topLeft());
      if (cell.isFormula() || cell.value == null) {
        return new Input(nodeName, name, ref.shape(), DataType.NUMBER, 0.0);
      }
      return new Input(nodeName, name, ref.shape(), cell.type, cell.value);
    }
    Grid defaults = Grid.allocate(ref.bounds.height(), ref.bounds.width());
    @Nullable DataType type = null;
    for (int r = 0; r < defaults.height(); r++) {
      for (int c = 0; c < defaults.width(); c++) {
        String address = CellRange.cell(ref.bounds.minRow + r, ref.bounds.minColumn + c).address();
        Workbook.Cell cell = workbook.cell(ref.sheet, address);
        if (cell.isFormula() || cell.value == null) {
          defaults.set(r, c, 0.0);
        } else {
          defaults.set(r, c, cell.value);
          if (type == null) {
            type = cell.type;
          }
        }
      }
    }
    if (type == null) {
      type = DataType.NUMBER;
    }
    return new Input(nodeName, name, ref.shape(), type, defaults);
  }

  /**
   * The main loop. Frames are kept on an explicit stack; each step either finishes the top frame
   * or gives it the node it asked for, starting a new frame if that node has not been compiled.
   */
  private Node compile(
      CompilationKey root,
      Map<CompilationKey, Node> memo,
      Map<Reference, Input> inputNodes,
      CompileContext context) {
    Node cached = memo.get(root);
    if (cached != null) {
      return cached;
    }
    Deque<Frame> stack = new ArrayDeque<>();
    Set<CompilationKey> active = new HashSet<>();
    stack.push(frameFor(root, null, inputNodes, context));
    active.add(root);
    while (true) {
      Frame frame = stack.peek();
      try {
        CompilationKey next = frame.nextReference();
        if (next == null) {
          Node node = frame.finish();
          memo.put(frame.key, node);
          stack.pop();
          active.remove(frame.key);
          if (stack.isEmpty()) {
            return node;
          }
          stack.peek().pushNode(node);
          continue;
        }
        Node node = memo.get(next);
        if (node != null) {
          logger.debug(String.format("Reusing %s for %s", node.name(), next));
          frame.pushNode(node);
        } else if (!active.add(next)) {
          throw InvalidReferenceError.of("Circular reference through %s", next);
        } else {
          Frame child = frameFor(next, frame, inputNodes, context);
          logger.debug(String.format("Compiling %s", child));
          stack.push(child);
        }
      } catch (CompileError e) {
        throw e.atLocation(frame.activeCell.toString());
      }
    }
  }

  private Frame frameFor(
      CompilationKey key,
      @Nullable Frame caller,
      Map<Reference, Input> inputNodes,
      CompileContext context) {
    if (key instanceof CompilationKey.Range range) {
      Frame inputPart = inputPart(range, inputNodes, context);
      if (inputPart != null) {
        return inputPart;
      }
      return switch (range.reference.kind) {
        case CELL, ARRAY_REFERENCE -> CellFrame.create(range, context);
        case RANGE -> new RangeBuildFrame(range, context);
        case ARRAY_ENTRY -> new IndexFrame(range, context);
      };
    }
    // Only ranges start a compilation; every other unit is part of some cell's formula.
    Preconditions.checkState(caller != null, "No formula for %s", key);
    Reference activeCell = caller.activeCell;
    if (key instanceof CompilationKey.FunctionCall call) {
      SpecialFunctions.Handler handler = SpecialFunctions.lookup(call.name);
      if (handler != null) {
        return handler.create(call, caller);
      }
      FunctionEntry entry = registry.lookup(call.name);
      return new FunctionCallFrame(call, activeCell, context, entry);
    }
    return new NestedFrame((CompilationKey.Paren) key, activeCell, context);
  }

  /** If the range is part of a range input, returns a frame for the corresponding slice of it. */
  private static @Nullable Frame inputPart(
      CompilationKey.Range range, Map<Reference, Input> inputNodes, CompileContext context) {
    Reference ref = range.reference;
    for (Map.Entry<Reference, Input> entry : inputNodes.entrySet()) {
      CellRange bounds = entry.getKey().bounds;
      if (entry.getKey().sheet.equals(ref.sheet) && bounds.contains(ref.bounds)) {
        Index slice =
            new Index(
                context.names.next(ref.encodeName()),
                entry.getValue(),
                ref.bounds.minRow - bounds.minRow,
                ref.bounds.maxRow - bounds.minRow + 1,
                ref.bounds.minColumn - bounds.minColumn,
                ref.bounds.maxColumn - bounds.minColumn + 1);
        return new ResolvedFrame(range, ref, context, slice);
      }
    }
    return null;
  }
}
