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

import net.hydromatic.frost.eval.Module;
import net.hydromatic.frost.graph.Graphs;
import net.hydromatic.frost.graph.Op;

/**
 * Finds the attributes that the entry method assigns, and marks them
 * preserved.
 *
 * <p>Visits every {@link Op#SET_ATTR} node, including those in nested
 * blocks. If the receiver resolves, the attribute is preserved; if not, the
 * assignment is ignored, and any read that would alias it fails to resolve
 * anyway.
 */
public abstract class MutabilityRecorder {
  private MutabilityRecorder() {}

  /** Records the assignments in the context's graph. Returns the number of
   * attributes newly marked. */
  public static int record(FreezeContext context) {
    final int[] count = {0};
    Graphs.forEachNode(
        context.graph,
        n -> {
          if (n.op() == Op.SET_ATTR) {
            final Module module = ChainResolver.resolve(context, n);
            if (module != null && context.preserve(module, n.name())) {
              ++count[0];
            }
          }
        });
    return count[0];
  }
}

// End MutabilityRecorder.java
