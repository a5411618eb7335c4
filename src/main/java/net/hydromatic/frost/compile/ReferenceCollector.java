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

import java.util.Set;
import net.hydromatic.frost.eval.Module;
import net.hydromatic.frost.graph.Graphs;
import net.hydromatic.frost.graph.Op;
import net.hydromatic.frost.type.ModuleType;

/**
 * Finds the attributes of the root module that the entry method still uses
 * after folding.
 *
 * <p>An attribute is used if a remaining {@link Op#GET_ATTR} reads it, or a
 * {@link Op#SET_ATTR} assigns it, through a receiver whose type is the root's
 * type. Used attributes are added to the preserved set of the root.
 */
public abstract class ReferenceCollector {
  private ReferenceCollector() {}

  /** Returns the names of the root attributes that must be kept. */
  public static Set<String> collect(FreezeContext context) {
    final Module root = context.root;
    final ModuleType rootType = root.type();
    Graphs.forEachNode(
        context.graph,
        n -> {
          switch (n.op()) {
            case GET_ATTR:
            case SET_ATTR:
              if (n.input(0).type() == rootType
                  && rootType.hasAttribute(n.name())) {
                context.preserve(root, n.name());
              }
              break;
            default:
              break;
          }
        });
    return context.preservedNames(root);
  }
}

// End ReferenceCollector.java
