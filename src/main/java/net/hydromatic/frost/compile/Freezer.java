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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Set;
import net.hydromatic.frost.eval.Method;
import net.hydromatic.frost.eval.Module;
import net.hydromatic.frost.graph.Graph;
import net.hydromatic.frost.type.ModuleType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Freezes a module.
 *
 * <p>Freezing produces a copy of a module in which every attribute that the
 * entry method reads but never assigns has been replaced by a constant, and
 * the attributes that are no longer read have been removed. The steps are:
 *
 * <ol>
 *   <li>clone the module ({@link Cloner});
 *   <li>inline method calls into the entry method ({@link Inliner});
 *   <li>record which attributes are assigned ({@link MutabilityRecorder}),
 *       and fold reads of the others ({@link AttributePropagator});
 *   <li>optimize the graph ({@link Optimizer}), unless {@link Prop#OPTIMIZE}
 *       is false;
 *   <li>remove the root attributes that are no longer referenced ({@link
 *       ReferenceCollector}, {@link Pruner}), and the methods other than the
 *       entry method.
 * </ol>
 *
 * <p>The module passed in is not modified.
 */
public abstract class Freezer {
  private static final Logger LOGGER = LoggerFactory.getLogger(Freezer.class);

  private Freezer() {}

  /** Freezes a module with default properties. */
  public static Module freeze(Module module) {
    return freeze(module, ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Freezes a module.
   *
   * @param module Module to freeze; not modified
   * @param props Properties; see {@link Prop}
   * @param tracer Receives events
   * @return Frozen copy of the module
   * @throws FreezeException if the module has no entry method, or its
   *     methods cannot be inlined
   */
  public static Module freeze(
      Module module, Map<Prop, Object> props, Tracer tracer) {
    final String entryMethod = Prop.ENTRY_METHOD.stringValue(props);
    final ModuleType type = module.type();
    if (type.getMethod(entryMethod) == null) {
      throw new FreezeException(
          "module " + type.qualifiedName() + " has no method '" + entryMethod
              + "'");
    }

    final Module frozen = Cloner.clone(module);
    final Method method = requireNonNull(frozen.findMethod(entryMethod));
    final Graph graph = method.graph;

    Inliner.inline(graph);
    tracer.onGraph(Tracer.Phase.INLINED, graph);

    final FreezeContext context = new FreezeContext(frozen, graph, tracer);
    AttributePropagator.propagate(context);
    tracer.onGraph(Tracer.Phase.PROPAGATED, graph);

    if (Prop.OPTIMIZE.booleanValue(props)) {
      Optimizer.optimize(graph, Prop.OPTIMIZE_PASS_COUNT.intValue(props));
      tracer.onGraph(Tracer.Phase.OPTIMIZED, graph);
    }

    final Set<String> keep = ReferenceCollector.collect(context);
    Pruner.prune(context, keep);
    removeOtherMethods(frozen.type(), entryMethod);
    tracer.onGraph(Tracer.Phase.FROZEN, graph);

    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(
          "{}::{}() after freezing module\n{}",
          frozen.type().name(),
          entryMethod,
          graph);
    }
    return frozen;
  }

  /** Removes the methods other than the entry method. Their graphs may read
   * attributes that have been removed. */
  private static void removeOtherMethods(ModuleType type, String entryMethod) {
    for (Method method : type.methods()) {
      if (!method.name.equals(entryMethod)) {
        type.unsafeRemoveMethod(method.name);
      }
    }
  }
}

// End Freezer.java
