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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import net.hydromatic.frost.eval.Method;
import net.hydromatic.frost.graph.Block;
import net.hydromatic.frost.graph.Graph;
import net.hydromatic.frost.graph.Graphs;
import net.hydromatic.frost.graph.Node;
import net.hydromatic.frost.graph.Op;
import net.hydromatic.frost.graph.Value;
import net.hydromatic.frost.type.ModuleType;
import net.hydromatic.frost.type.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces method calls with the bodies of the methods called.
 *
 * <p>After inlining, a graph has no {@link Op#CALL_METHOD} nodes, so every
 * attribute access of the entry method and of the methods it calls is
 * visible in one graph. The method is found from the type of the receiver;
 * the callee's graph is copied, inlined itself, and then copied into the
 * caller with the call's inputs substituted for the callee's inputs.
 */
public class Inliner {
  private static final Logger LOGGER = LoggerFactory.getLogger(Inliner.class);

  /** Methods currently being inlined, innermost first. */
  private final Deque<Method> stack = new ArrayDeque<>();

  private Inliner() {}

  /**
   * Inlines all method calls in a graph, in place.
   *
   * @throws FreezeException if a call is to a method that does not exist, or
   *     is recursive
   */
  public static void inline(Graph graph) {
    new Inliner().inlineCalls(graph);
  }

  private void inlineCalls(Graph graph) {
    final Deque<Block> blocks = new ArrayDeque<>();
    blocks.push(graph.block());
    while (!blocks.isEmpty()) {
      final Block block = blocks.pop();
      for (Node n : block.nodes()) {
        n.blocks().forEach(blocks::push);
        if (n.op() == Op.CALL_METHOD) {
          inlineCall(graph, n);
        }
      }
    }
  }

  private void inlineCall(Graph graph, Node call) {
    final Type receiverType = call.input(0).type();
    if (!(receiverType instanceof ModuleType)) {
      throw new FreezeException(
          "cannot call method '" + call.name() + "' of " + receiverType);
    }
    final ModuleType moduleType = (ModuleType) receiverType;
    final Method method = moduleType.getMethod(call.name());
    if (method == null) {
      throw new FreezeException(
          "module " + moduleType.qualifiedName() + " has no method '"
              + call.name() + "'");
    }
    if (stack.contains(method)) {
      throw new FreezeException(
          "recursive call to method '" + method.name + "' of "
              + moduleType.qualifiedName());
    }
    stack.push(method);
    try {
      final Graph callee = method.graph.copy();
      inlineCalls(callee);
      final List<Value> outputs;
      try (Graph.InsertPoint ignore = graph.insertPointBefore(call)) {
        outputs = Graphs.insertGraph(graph, callee, call.inputs());
      }
      for (int i = 0; i < outputs.size(); i++) {
        call.outputs().get(i).replaceAllUsesWith(outputs.get(i));
      }
      call.destroy();
      LOGGER.debug(
          "inlined method {} of {}", method.name, moduleType.qualifiedName());
    } finally {
      stack.pop();
    }
  }
}

// End Inliner.java
