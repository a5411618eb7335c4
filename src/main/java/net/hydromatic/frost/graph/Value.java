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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.hydromatic.frost.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Value in an instruction graph.
 *
 * <p>Every value is an output of exactly one node. Inputs of a graph or of a
 * block are outputs of that block's {@link Op#PARAM} node.
 *
 * <p>A value knows its uses: the list contains one entry for each input slot
 * of each node that reads the value.
 */
public class Value {
  private final Node node;
  private final int offset;
  private final int unique;
  private final Type type;
  private @Nullable String debugName;
  final List<Node> uses = new ArrayList<>();

  Value(Node node, int offset, Type type, int unique) {
    this.node = requireNonNull(node);
    this.offset = offset;
    this.type = requireNonNull(type);
    this.unique = unique;
  }

  @Override
  public String toString() {
    return "%" + name();
  }

  /** Returns the node that produces this value. */
  public Node node() {
    return node;
  }

  /** Returns the index of this value among the outputs of its node. */
  public int offset() {
    return offset;
  }

  public Type type() {
    return type;
  }

  /** Returns the number that identifies this value within its graph. */
  public int unique() {
    return unique;
  }

  public @Nullable String debugName() {
    return debugName;
  }

  /**
   * Sets the debug name. If another value in the graph already has the name,
   * adds a numeric suffix. Debug names have no semantic effect.
   */
  public Value setDebugName(String name) {
    node.graph().assignName(this, name);
    return this;
  }

  /** Called by {@link Graph} when it assigns or releases a name. */
  void debugName(@Nullable String debugName) {
    this.debugName = debugName;
  }

  /** Returns the debug name if there is one, otherwise the unique number. */
  public String name() {
    return debugName != null ? debugName : Integer.toString(unique);
  }

  /** Returns the nodes that use this value, one entry per input slot. */
  public List<Node> uses() {
    return Collections.unmodifiableList(uses);
  }

  public boolean hasUses() {
    return !uses.isEmpty();
  }

  /** Replaces every use of this value with {@code value}. Afterwards, this
   * value has no uses. */
  public void replaceAllUsesWith(Value value) {
    checkArgument(value != this, "cannot replace a value with itself");
    checkArgument(
        value.node.graph() == node.graph(),
        "cannot replace a value with a value from another graph");
    for (Node user : ImmutableList.copyOf(uses)) {
      user.replaceInputWith(this, value);
    }
  }
}

// End Value.java
