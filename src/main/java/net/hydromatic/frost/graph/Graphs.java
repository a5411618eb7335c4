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
package net.hydromatic.frost.graph;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/** Utilities for {@link Graph}. */
public abstract class Graphs {
  private Graphs() {}

  /**
   * Calls an action on every node of a graph, including the nodes of nested
   * blocks.
   *
   * <p>The action must not destroy nodes.
   */
  public static void forEachNode(Graph graph, Consumer<Node> action) {
    final Deque<Block> blocks = new ArrayDeque<>();
    blocks.push(graph.block());
    while (!blocks.isEmpty()) {
      final Block block = blocks.pop();
      for (Node n : block.nodes()) {
        n.blocks().forEach(blocks::push);
        action.accept(n);
      }
    }
  }

  /** Returns every node of a graph, including the nodes of nested blocks. */
  public static List<Node> nodes(Graph graph) {
    final ImmutableList.Builder<Node> nodes = ImmutableList.builder();
    forEachNode(graph, nodes::add);
    return nodes.build();
  }

  /** Returns the nodes of a given kind. */
  public static List<Node> nodes(Graph graph, Op op) {
    final ImmutableList.Builder<Node> nodes = ImmutableList.builder();
    forEachNode(
        graph,
        n -> {
          if (n.op() == op) {
            nodes.add(n);
          }
        });
    return nodes.build();
  }

  /** Returns the number of nodes of a given kind. */
  public static int count(Graph graph, Op op) {
    return nodes(graph, op).size();
  }

  /**
   * Returns whether a node has an effect other than producing its outputs.
   *
   * <p>A node that owns blocks has side effects if any node in its blocks
   * does.
   */
  public static boolean hasSideEffects(Node n) {
    switch (n.op()) {
      case IF:
      case LOOP:
        for (Block block : n.blocks()) {
          for (Node n2 : block.nodes()) {
            if (hasSideEffects(n2)) {
              return true;
            }
          }
        }
        return false;
      default:
        return !n.op().pure;
    }
  }

  /**
   * Copies the nodes of {@code callee} to the insertion point of {@code
   * graph}, substituting {@code inputs} for the inputs of the callee, and
   * returns the values that correspond to the outputs of the callee.
   */
  public static List<Value> insertGraph(
      Graph graph, Graph callee, List<Value> inputs) {
    checkArgument(
        inputs.size() == callee.inputs().size(),
        "expected %s inputs, got %s",
        callee.inputs().size(),
        inputs.size());
    final Map<Value, Value> env = new HashMap<>();
    for (int i = 0; i < inputs.size(); i++) {
      env.put(callee.inputs().get(i), inputs.get(i));
    }
    for (Node n : callee.block().nodes()) {
      graph.insertNode(graph.createClone(n, env, UnaryOperator.identity()));
    }
    final ImmutableList.Builder<Value> outputs = ImmutableList.builder();
    for (Value output : callee.outputs()) {
      outputs.add(Graph.lookup(env, output));
    }
    return outputs.build();
  }

  /**
   * Checks that every input of every node is a live value that is in scope,
   * and that the use lists agree with the inputs. Throws {@link
   * IllegalStateException} if not.
   */
  public static void checkWellFormed(Graph graph) {
    checkBlock(graph.block(), new HashSet<>());
  }

  private static void checkBlock(Block block, Set<Value> outerScope) {
    final Set<Value> scope = new HashSet<>(outerScope);
    scope.addAll(block.inputs());
    for (Node n : block.nodes()) {
      checkInputs(n, scope);
      for (Block b : n.blocks()) {
        checkBlock(b, scope);
      }
      scope.addAll(n.outputs());
    }
    checkInputs(block.returnNode(), scope);
  }

  private static void checkInputs(Node n, Set<Value> scope) {
    if (n.isDestroyed()) {
      throw new IllegalStateException("destroyed node in graph: " + n);
    }
    for (Value input : n.inputs()) {
      if (input.node().isDestroyed()) {
        throw new IllegalStateException(
            "node " + n + " uses " + input + " of a destroyed node");
      }
      if (!scope.contains(input)) {
        throw new IllegalStateException(
            "node " + n + " uses " + input + ", which is not in scope");
      }
      if (Collections.frequency(input.uses(), n)
          != Collections.frequency(n.inputs(), input)) {
        throw new IllegalStateException(
            "uses of " + input + " are inconsistent with inputs of " + n);
      }
    }
  }
}

// End Graphs.java
