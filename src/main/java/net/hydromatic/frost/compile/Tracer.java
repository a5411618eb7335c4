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
import net.hydromatic.frost.graph.Graph;
import net.hydromatic.frost.graph.Value;

/** Called on various events during freezing. */
public interface Tracer {
  /** Called with the entry method's graph after each phase. */
  void onGraph(Phase phase, Graph graph);

  /** Called when a read of an attribute is replaced by a constant. */
  void onFold(Module module, String attributeName, Value constant);

  /** Called when an attribute is removed from the frozen module. */
  void onPrune(Module module, String attributeName);

  /** Phase of freezing. */
  enum Phase {
    /** Method calls have been inlined into the entry method. */
    INLINED,
    /** Immutable attributes have been folded into constants. */
    PROPAGATED,
    /** The optimizer has run. Skipped if {@link Prop#OPTIMIZE} is false. */
    OPTIMIZED,
    /** Unused attributes have been removed. */
    FROZEN
  }
}

// End Tracer.java
