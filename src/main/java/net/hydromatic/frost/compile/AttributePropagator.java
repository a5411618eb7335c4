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
import net.hydromatic.frost.eval.Module;
import net.hydromatic.frost.eval.Tensor;
import net.hydromatic.frost.graph.Block;
import net.hydromatic.frost.graph.Graph;
import net.hydromatic.frost.graph.Node;
import net.hydromatic.frost.graph.Op;
import net.hydromatic.frost.graph.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces reads of immutable attributes with constants.
 *
 * <p>First runs the {@link MutabilityRecorder}. Then, for each {@link
 * Op#GET_ATTR} node whose receiver resolves and whose attribute is not
 * preserved, reads the current value of the attribute and, if the value has
 * a literal form, replaces the node with a constant.
 *
 * <p>Values that are modules or opaque runtime objects, or tuples that
 * contain them, are left as reads. Tensors are detached: the constant does
 * not require gradients.
 */
public abstract class AttributePropagator {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(AttributePropagator.class);

  private AttributePropagator() {}

  /** Folds attribute reads in the context's graph. Returns the number of
   * nodes replaced. */
  public static int propagate(FreezeContext context) {
    MutabilityRecorder.record(context);
    final Graph graph = context.graph;
    int count = 0;
    final Deque<Block> blocks = new ArrayDeque<>();
    blocks.push(graph.block());
    while (!blocks.isEmpty()) {
      final Block block = blocks.pop();
      for (Node n : block.nodes()) {
        n.blocks().forEach(blocks::push);
        if (n.op() == Op.GET_ATTR && fold(context, n)) {
          ++count;
        }
      }
    }
    LOGGER.debug(
        "folded {} attribute reads in module {}",
        count,
        context.root.type().qualifiedName());
    return count;
  }

  private static boolean fold(FreezeContext context, Node n) {
    final Module module = ChainResolver.resolve(context, n);
    if (module == null || !module.hasAttr(n.name())) {
      return false;
    }
    final String name = n.name();
    final Object value = module.attr(name);
    if (value instanceof Tensor) {
      ((Tensor) value).setRequiresGrad(false);
    }
    final Graph graph = context.graph;
    final Value constant;
    try (Graph.InsertPoint ignore = graph.insertPointBefore(n)) {
      constant = graph.insertConstant(value);
    }
    if (constant == null) {
      return false;
    }
    constant.setDebugName(module.type().qualifiedName() + "." + name);
    n.output().replaceAllUsesWith(constant);
    n.removeAllInputs();
    n.destroy();
    LOGGER.trace("folded {}.{} into {}", module, name, constant);
    context.tracer.onFold(module, name, constant);
    return true;
  }
}

// End AttributePropagator.java
