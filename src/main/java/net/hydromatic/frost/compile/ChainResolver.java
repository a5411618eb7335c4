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
import net.hydromatic.frost.graph.Node;
import net.hydromatic.frost.graph.Op;
import net.hydromatic.frost.graph.Value;
import net.hydromatic.frost.type.ModuleType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Resolves the receiver of an attribute access to a module instance.
 *
 * <p>Resolution walks back through {@link Op#GET_ATTR} nodes, such as
 * {@code self.encoder.layer1}, until it reaches a value whose type is the
 * root module's type. That value denotes the root instance, however it was
 * computed; an unpacked alias of {@code self} is the same module. The walk
 * then follows the names down through the instances of the frozen module;
 * it fails if any attribute on the chain is preserved (because something
 * assigns to it), or does not hold a module.
 *
 * <p>A receiver that is computed some other way and does not have the root
 * type (a tuple element of a submodule type, the output of a conditional)
 * does not resolve. A failure means "may be mutable"; it is never an error.
 */
public abstract class ChainResolver {
  private ChainResolver() {}

  /**
   * Returns the module instance that owns attribute {@code name} of {@code
   * receiver}, or null if the receiver cannot be resolved or the attribute is
   * preserved.
   */
  public static @Nullable Module resolve(
      FreezeContext context, Value receiver, String name) {
    final Module module = resolveReceiver(context, receiver);
    if (module == null
        || !module.type().hasAttribute(name)
        || context.isPreserved(module, name)) {
      return null;
    }
    return module;
  }

  /** Resolves the receiver of an {@link Op#GET_ATTR} or {@link Op#SET_ATTR}
   * node. */
  public static @Nullable Module resolve(FreezeContext context, Node n) {
    return resolve(context, n.input(0), n.name());
  }

  /** Returns the module instance that a value denotes, or null. */
  private static @Nullable Module resolveReceiver(
      FreezeContext context, Value receiver) {
    final ModuleType rootType = context.root.type();
    final Deque<String> path = new ArrayDeque<>();
    Value v = receiver;
    while (v.type() != rootType) {
      final Node n = v.node();
      if (n.op() != Op.GET_ATTR) {
        return null;
      }
      path.push(n.name());
      v = n.input(0);
    }
    Module module = context.root;
    while (!path.isEmpty()) {
      final String name = path.pop();
      if (context.isPreserved(module, name) || !module.hasAttr(name)) {
        return null;
      }
      final Object o = module.attr(name);
      if (!(o instanceof Module)) {
        return null;
      }
      module = (Module) o;
    }
    return module;
  }
}

// End ChainResolver.java
