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

import net.hydromatic.frost.eval.Values;
import net.hydromatic.frost.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Op#CONSTANT} nodes. */
public abstract class Constants {
  private Constants() {}

  /**
   * Inserts a constant node at the graph's insertion point, and returns its
   * output; returns null, and inserts nothing, if the value cannot be
   * represented as a literal.
   *
   * <p>Booleans, integers ({@link Long}), floats ({@link Double}), strings,
   * {@link net.hydromatic.frost.eval.None}, tensors, and tuples of those are
   * literals. Modules and opaque runtime objects are not.
   */
  public static @Nullable Value tryInsertConstant(Graph graph, Object value) {
    final Type type = Values.typeOfOrNull(value);
    if (type == null || !type.isLiteral()) {
      return null;
    }
    final Node n = graph.create(Op.CONSTANT).setValue(value);
    n.addOutput(type);
    graph.insertNode(n);
    return n.output();
  }

  /** Returns whether a value is the output of a constant node. */
  public static boolean isConstant(Value value) {
    return value.node().op() == Op.CONSTANT;
  }

  /** Returns the value of a constant, or null if the value is not the output
   * of a constant node. */
  public static @Nullable Object constantValue(Value value) {
    return isConstant(value) ? value.node().value() : null;
  }
}

// End Constants.java
