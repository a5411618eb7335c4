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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import net.hydromatic.frost.eval.Module;
import net.hydromatic.frost.graph.Graph;

/**
 * State of one freezing run.
 *
 * <p>Holds the root module, the graph of its entry method, and the table of
 * preserved attributes: for each module instance, the names of the
 * attributes that must not be folded into constants. Instances are keyed by
 * identity. Within a run, entries are only ever added.
 */
public class FreezeContext {
  public final Module root;
  public final Graph graph;
  public final Tracer tracer;
  private final Map<Module, Set<String>> preserved =
      Maps.newIdentityHashMap();

  public FreezeContext(Module root, Graph graph, Tracer tracer) {
    this.root = requireNonNull(root);
    this.graph = requireNonNull(graph);
    this.tracer = requireNonNull(tracer);
  }

  /** Marks an attribute of a module as preserved. Returns whether it was
   * not already marked. */
  public boolean preserve(Module module, String name) {
    return preserved
        .computeIfAbsent(module, m -> new LinkedHashSet<>())
        .add(requireNonNull(name));
  }

  /** Returns whether an attribute of a module is preserved. */
  public boolean isPreserved(Module module, String name) {
    final Set<String> names = preserved.get(module);
    return names != null && names.contains(name);
  }

  /** Returns the preserved attributes of a module. */
  public Set<String> preservedNames(Module module) {
    final Set<String> names = preserved.get(module);
    return names == null ? ImmutableSet.of() : ImmutableSet.copyOf(names);
  }

  /** Returns the number of (module, attribute) pairs in the table. */
  public int preservedCount() {
    int n = 0;
    for (Set<String> names : preserved.values()) {
      n += names.size();
    }
    return n;
  }
}

// End FreezeContext.java
