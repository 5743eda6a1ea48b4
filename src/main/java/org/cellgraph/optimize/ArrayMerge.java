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

package org.cellgraph.optimize;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.log4j.Logger;
import org.cellgraph.UnsupportedOperationError;
import org.cellgraph.code.ArrayLiteral;
import org.cellgraph.code.Buffer;
import org.cellgraph.code.BufferAssignment;
import org.cellgraph.code.BufferIndex;
import org.cellgraph.code.Graph;
import org.cellgraph.code.Index;
import org.cellgraph.code.Node;
import org.cellgraph.code.Shape;
import org.jspecify.annotations.Nullable;

/**
 * Arranges for overlapping ranges to share storage. Workbooks often aggregate over many ranges
 * that are parts of one larger range ({@code SUM(A$1:A1)}, {@code SUM(A$1:A2)}, ...); rather than
 * building each of those arrays separately, the largest one is built and the others become views
 * of it.
 *
 * <p>Arrays are clustered by their elements: each array joins the cluster of the first larger (or
 * equal) array whose elements include all of its own. If no member of a cluster depends on
 * another, the covering array is built as usual and the rest are replaced by {@link Index} views.
 * Otherwise (typically a running total, where later elements are computed from views of earlier
 * ones) the covering array is replaced by a {@link Buffer} that is filled one element at a time,
 * and each member becomes a {@link BufferIndex} that may only be read after the elements it
 * covers have been written. Members are written in dependency order; a cluster with no such order
 * is rejected.
 */
public final class ArrayMerge implements GraphPass {
  private static final Logger logger = Logger.getLogger(ArrayMerge.class);

  @Override
  public String name() {
    return "merge-array";
  }

  @Override
  public void apply(Graph graph) {
    List<ArrayLiteral> arrays = new ArrayList<>();
    graph.visit(
        node -> {
          if (node instanceof ArrayLiteral array) {
            arrays.add(array);
          }
        });
    // List.sort is stable, so equal-sized arrays stay in visit order.
    arrays.sort(Comparator.comparingInt((ArrayLiteral a) -> a.shape().size()).reversed());
    for (List<ArrayLiteral> candidates : cluster(arrays)) {
      List<ArrayLiteral> cluster = blocks(candidates);
      if (cluster.size() == 1) {
        continue;
      }
      if (hasDependencies(cluster)) {
        logger.debug("Building incrementally: " + cluster);
        buildIncrementally(cluster);
      } else {
        logger.debug("Merging into views: " + cluster);
        replaceWithViews(cluster);
      }
    }
  }

  /** Groups the arrays (sorted largest first); the first member of each cluster covers the rest. */
  static List<List<ArrayLiteral>> cluster(List<ArrayLiteral> arrays) {
    List<Set<String>> elementNames = new ArrayList<>();
    List<List<ArrayLiteral>> clusterOf = new ArrayList<>();
    List<List<ArrayLiteral>> clusters = new ArrayList<>();
    for (ArrayLiteral array : arrays) {
      Set<String> names =
          array.children().stream().map(Node::name).collect(Collectors.toCollection(HashSet::new));
      List<ArrayLiteral> cluster = null;
      for (int i = 0; i < elementNames.size(); i++) {
        if (elementNames.get(i).containsAll(names)) {
          cluster = clusterOf.get(i);
          break;
        }
      }
      if (cluster == null) {
        cluster = new ArrayList<>();
        clusters.add(cluster);
      }
      cluster.add(array);
      elementNames.add(names);
      clusterOf.add(cluster);
    }
    return clusters;
  }

  /**
   * Returns the covering array followed by each other member that is a block of it. Members whose
   * elements are scattered through the covering array (which can happen when cells share a node)
   * are left as they are.
   */
  private static List<ArrayLiteral> blocks(List<ArrayLiteral> candidates) {
    ArrayLiteral covering = candidates.get(0);
    List<ArrayLiteral> result = new ArrayList<>();
    result.add(covering);
    for (ArrayLiteral array : candidates.subList(1, candidates.size())) {
      if (region(array, covering) != null) {
        result.add(array);
      } else {
        logger.debug(String.format("%s is not a block of %s", array.name(), covering.name()));
      }
    }
    return result;
  }

  private static boolean hasDependencies(List<ArrayLiteral> cluster) {
    for (int i = 1; i < cluster.size(); i++) {
      if (cluster.get(i).dependsOn(cluster.subList(0, i))) {
        return true;
      }
    }
    return false;
  }

  private static void replaceWithViews(List<ArrayLiteral> cluster) {
    ArrayLiteral covering = cluster.get(0);
    for (ArrayLiteral array : cluster.subList(1, cluster.size())) {
      Node replacement;
      if (array.children().equals(covering.children())
          && array.shape().equals(covering.shape())) {
        replacement = covering;
      } else {
        int[] region = Objects.requireNonNull(region(array, covering));
        replacement =
            new Index(array.name(), covering, region[0], region[1], region[2], region[3]);
      }
      array.replaceInGraph(replacement);
      array.detach();
    }
  }

  /**
   * Replaces every member of the cluster with a view of a buffer. Members are written one at a
   * time, each in the covering array's order, choosing next a member none of whose unwritten
   * elements is computed from another member still waiting to be written; each view depends on
   * the last write that precedes it.
   *
   * @throws UnsupportedOperationError if the members cannot be ordered that way
   */
  private static void buildIncrementally(List<ArrayLiteral> cluster) {
    ArrayLiteral covering = cluster.get(0);
    List<Node> elements = ImmutableList.copyOf(covering.children());
    int width = covering.shape().width;
    Buffer buffer = new Buffer(covering.name() + "_buffer", covering.shape(), covering.dataType());
    Set<Integer> written = new HashSet<>();
    Node lastWrite = buffer;
    // Smallest first, so that a running total is written from the top down.
    List<ArrayLiteral> pending = new ArrayList<>(ImmutableList.copyOf(cluster).reverse());
    while (!pending.isEmpty()) {
      ArrayLiteral array = nextReady(pending, covering, written);
      int[] region = Objects.requireNonNull(region(array, covering));
      for (int i : unwritten(region, width, elements.size(), written)) {
        written.add(i);
        lastWrite =
            new BufferAssignment(
                buffer.name() + "_" + i, buffer, i / width, i % width, elements.get(i), lastWrite);
      }
      BufferIndex view =
          new BufferIndex(
              array.name(), buffer, lastWrite, region[0], region[1], region[2], region[3]);
      array.replaceInGraph(view);
      array.detach();
      pending.remove(array);
    }
  }

  /**
   * Returns the first pending member whose unwritten elements can be written now, i.e. none of
   * them reads another pending member.
   */
  private static ArrayLiteral nextReady(
      List<ArrayLiteral> pending, ArrayLiteral covering, Set<Integer> written) {
    int width = covering.shape().width;
    for (ArrayLiteral array : pending) {
      int[] region = Objects.requireNonNull(region(array, covering));
      List<Node> toWrite =
          unwritten(region, width, covering.shape().size(), written).stream()
              .map(covering::child)
              .collect(Collectors.toList());
      if (pending.stream().noneMatch(other -> other != array && other.dependsOn(toWrite))) {
        return array;
      }
    }
    throw UnsupportedOperationError.of("Cannot order the writes of merged arrays %s", pending);
  }

  /** Returns the indices (in the covering array) of the region's elements not yet written. */
  private static List<Integer> unwritten(
      int[] region, int width, int size, Set<Integer> written) {
    List<Integer> result = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      int row = i / width;
      int col = i % width;
      if (row >= region[0]
          && row < region[1]
          && col >= region[2]
          && col < region[3]
          && !written.contains(i)) {
        result.add(i);
      }
    }
    return result;
  }

  /**
   * Returns {@code (rowFrom, rowTo, colFrom, colTo)} of a block of {@code covering} that holds
   * the elements of {@code array} in the same order, or null if there is no such block.
   */
  static int @Nullable [] region(ArrayLiteral array, ArrayLiteral covering) {
    Shape shape = covering.shape();
    Shape target = array.shape();
    for (int row = 0; row + target.height <= shape.height; row++) {
      for (int col = 0; col + target.width <= shape.width; col++) {
        if (matchesAt(array, covering, row, col)) {
          return new int[] {row, row + target.height, col, col + target.width};
        }
      }
    }
    return null;
  }

  private static boolean matchesAt(ArrayLiteral array, ArrayLiteral covering, int row, int col) {
    int width = covering.shape().width;
    Shape target = array.shape();
    for (int r = 0; r < target.height; r++) {
      for (int c = 0; c < target.width; c++) {
        if (array.child(r * target.width + c) != covering.child((row + r) * width + col + c)) {
          return false;
        }
      }
    }
    return true;
  }
}
