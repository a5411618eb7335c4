/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.frost.compile;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.frost.eval.FrostRuntimeException;
import net.hydromatic.frost.eval.Interpreter;
import net.hydromatic.frost.graph.Block;
import net.hydromatic.frost.graph.Constants;
import net.hydromatic.frost.graph.Graph;
import net.hydromatic.frost.graph.Graphs;
import net.hydromatic.frost.graph.Node;
import net.hydromatic.frost.graph.Op;
import net.hydromatic.frost.graph.Value;
import net.hydromatic.frost.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simplifies a graph.
 *
 * <p>Each pass performs the following rewrites:
 *
 * <ul>
 *   <li>evaluates arithmetic and comparisons on scalar constants;
 *   <li>replaces the unpacking of a tuple that was just constructed with the
 *       elements;
 *   <li>replaces a conditional whose condition is constant with the nodes of
 *       the branch that is taken;
 *   <li>merges equivalent pure nodes (common-subexpression elimination);
 *   <li>removes nodes whose outputs are unused and that have no side effects
 *       (dead-code elimination).
 * </ul>
 *
 * <p>Passes are repeated until a pass changes nothing, or the pass count is
 * reached.
 */
public class Optimizer {
  private static final Logger LOGGER = LoggerFactory.getLogger(Optimizer.class);

  private final Graph graph;
  private int changeCount;

  private Optimizer(Graph graph) {
    this.graph = graph;
  }

  /** Optimizes a graph in place. Returns the number of rewrites. */
  public static int optimize(Graph graph, int passCount) {
    final Optimizer optimizer = new Optimizer(graph);
    for (int pass = 0; pass < passCount; pass++) {
      final int before = optimizer.changeCount;
      optimizer.simplify();
      optimizer.eliminateCommonSubexpressions(
          graph.block(), new HashMap<>());
      optimizer.eliminateDeadCode(graph.block());
      LOGGER.trace(
          "pass {}: {} rewrites", pass, optimizer.changeCount - before);
      if (optimizer.changeCount == before) {
        break;
      }
    }
    return optimizer.changeCount;
  }

  /** Folds constants, tuples and conditionals. */
  private void simplify() {
    final Deque<Block> blocks = new ArrayDeque<>();
    blocks.push(graph.block());
    while (!blocks.isEmpty()) {
      final Block block = blocks.pop();
      for (Node n : block.nodes()) {
        if (n.op().isArithmetic()) {
          foldArithmetic(n);
        } else if (n.op() == Op.TUPLE_UNPACK) {
          foldUnpack(n);
        } else if (n.op() == Op.IF && Constants.isConstant(n.input(0))) {
          // The nodes of the branch taken move before the cursor; the next
          // pass visits them.
          foldIf(n);
          continue;
        }
        n.blocks().forEach(blocks::push);
      }
    }
  }

  private void foldArithmetic(Node n) {
    final Object left = Constants.constantValue(n.input(0));
    final Object right = Constants.constantValue(n.input(1));
    if (!isScalar(left) || !isScalar(right)) {
      return;
    }
    final Object result;
    try {
      result = Interpreter.apply(n.op(), left, right);
    } catch (FrostRuntimeException e) {
      LOGGER.trace("not folding {}: {}", n, e.getMessage());
      return;
    }
    final Value constant;
    try (Graph.InsertPoint ignore = graph.insertPointBefore(n)) {
      constant = graph.insertConstant(result);
    }
    if (constant == null) {
      return;
    }
    replace(n, Arrays.asList(constant));
  }

  private static boolean isScalar(@Nullable Object o) {
    return o instanceof Boolean
        || o instanceof Long
        || o instanceof Double
        || o instanceof String;
  }

  private void foldUnpack(Node n) {
    final Node producer = n.input(0).node();
    if (producer.op() == Op.TUPLE_CONSTRUCT) {
      replace(n, producer.inputs());
    }
  }

  private void foldIf(Node n) {
    final boolean condition = (Boolean) Constants.constantValue(n.input(0));
    final Block branch = n.blocks().get(condition ? 0 : 1);
    for (Node n2 : branch.nodes()) {
      n2.moveBefore(n);
    }
    replace(n, branch.outputs());
  }

  /** Replaces the outputs of a node with given values, and destroys the
   * node. */
  private void replace(Node n, List<Value> values) {
    for (int i = 0; i < values.size(); i++) {
      n.outputs().get(i).replaceAllUsesWith(values.get(i));
    }
    n.destroy();
    ++changeCount;
  }

  /**
   * Merges pure nodes that have the same kind, name, value and inputs.
   *
   * <p>A node in a nested block may be replaced by an equivalent node of an
   * enclosing block, but not vice versa. Attribute reads are not merged,
   * because an assignment may occur between them; nor are constants other
   * than scalars.
   */
  private void eliminateCommonSubexpressions(
      Block block, Map<List<Object>, Node> outerScope) {
    final Map<List<Object>, Node> scope = new HashMap<>(outerScope);
    for (Node n : block.nodes()) {
      for (Block b : n.blocks()) {
        eliminateCommonSubexpressions(b, scope);
      }
      final List<Object> key = key(n);
      if (key == null) {
        continue;
      }
      final Node existing = scope.get(key);
      if (existing != null) {
        replace(n, existing.outputs());
      } else {
        scope.put(key, n);
      }
    }
  }

  private static @Nullable List<Object> key(Node n) {
    if (!n.op().pure
        || n.op() == Op.GET_ATTR
        || n.hasValue() && !isScalar(n.value())) {
      return null;
    }
    final ImmutableList.Builder<Type> types = ImmutableList.builder();
    for (Value output : n.outputs()) {
      types.add(output.type());
    }
    return Arrays.asList(
        n.op(),
        n.hasName() ? n.name() : null,
        n.hasValue() ? n.value() : null,
        ImmutableList.copyOf(n.inputs()),
        types.build());
  }

  /** Removes unused nodes without side effects, last to first. */
  private void eliminateDeadCode(Block block) {
    for (Node n = block.last(); n != null; ) {
      final Node prev = n.prev();
      for (Block b : n.blocks()) {
        eliminateDeadCode(b);
      }
      if (!Graphs.hasSideEffects(n) && !hasUsedOutput(n)) {
        n.destroy();
        ++changeCount;
      }
      n = prev;
    }
  }

  private static boolean hasUsedOutput(Node n) {
    for (Value output : n.outputs()) {
      if (output.hasUses()) {
        return true;
      }
    }
    return false;
  }
}

// End Optimizer.java
