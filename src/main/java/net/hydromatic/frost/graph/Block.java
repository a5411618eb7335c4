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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.UnaryOperator;
import net.hydromatic.frost.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Ordered sequence of nodes.
 *
 * <p>The inputs of a block are the outputs of its {@link Op#PARAM} node; its
 * outputs are the inputs of its {@link Op#RETURN} node. Neither of those nodes
 * is in the sequence returned by {@link #nodes()}.
 */
public class Block {
  private final Graph graph;
  private final @Nullable Node owningNode;
  private final Node paramNode;
  private final Node returnNode;
  private @Nullable Node first;
  private @Nullable Node last;

  Block(Graph graph, @Nullable Node owningNode) {
    this.graph = requireNonNull(graph);
    this.owningNode = owningNode;
    this.paramNode = new Node(graph, Op.PARAM);
    this.returnNode = new Node(graph, Op.RETURN);
  }

  public Graph graph() {
    return graph;
  }

  /** Returns the node that owns this block, or null for the top-level block
   * of a graph. */
  public @Nullable Node owningNode() {
    return owningNode;
  }

  public Node paramNode() {
    return paramNode;
  }

  public Node returnNode() {
    return returnNode;
  }

  public List<Value> inputs() {
    return paramNode.outputs();
  }

  public List<Value> outputs() {
    return returnNode.inputs();
  }

  public Value addInput(Type type) {
    return paramNode.addOutput(type);
  }

  public Block registerOutput(Value value) {
    returnNode.addInput(value);
    return this;
  }

  public @Nullable Node first() {
    return first;
  }

  public @Nullable Node last() {
    return last;
  }

  public boolean isEmpty() {
    return first == null;
  }

  /**
   * Returns the nodes of this block.
   *
   * <p>The iterator reads the successor of a node before returning the node,
   * so the caller may destroy or move the node it has just been given.
   */
  public Iterable<Node> nodes() {
    return () ->
        new Iterator<Node>() {
          @Nullable Node cursor = first;

          @Override
          public boolean hasNext() {
            return cursor != null;
          }

          @Override
          public Node next() {
            final Node n = cursor;
            if (n == null) {
              throw new NoSuchElementException();
            }
            cursor = n.next;
            return n;
          }
        };
  }

  /** Appends a node, which must not be in a block, to the end of this
   * block. */
  public Node appendNode(Node n) {
    checkState(n.owningBlock == null, "node is already in a block");
    n.owningBlock = this;
    n.prev = last;
    n.next = null;
    if (last == null) {
      first = n;
    } else {
      last.next = n;
    }
    last = n;
    return n;
  }

  void linkBefore(Node n, Node before) {
    checkState(before.owningBlock == this, "node is not in this block");
    n.owningBlock = this;
    n.next = before;
    n.prev = before.prev;
    if (before.prev == null) {
      first = n;
    } else {
      before.prev.next = n;
    }
    before.prev = n;
  }

  void unlink(Node n) {
    checkState(n.owningBlock == this, "node is not in this block");
    if (n.prev == null) {
      first = n.next;
    } else {
      n.prev.next = n.next;
    }
    if (n.next == null) {
      last = n.prev;
    } else {
      n.next.prev = n.prev;
    }
    n.owningBlock = null;
    n.prev = null;
    n.next = null;
  }

  /**
   * Clones the inputs, nodes and outputs of {@code src} into this block,
   * which must be empty.
   *
   * @param src Block to copy
   * @param env Maps values of the source graph to values of this graph;
   *     populated with the inputs and outputs that are cloned
   * @param typeMap Transform applied to the type of each cloned value
   */
  void cloneFrom(
      Block src, Map<Value, Value> env, UnaryOperator<Type> typeMap) {
    checkState(isEmpty() && inputs().isEmpty(), "block is not empty");
    for (Value input : src.inputs()) {
      final Value input2 = addInput(input.type().copy(typeMap));
      if (input.debugName() != null) {
        input2.setDebugName(input.debugName());
      }
      env.put(input, input2);
    }
    for (Node n : src.nodes()) {
      appendNode(graph.createClone(n, env, typeMap));
    }
    for (Value output : src.outputs()) {
      registerOutput(Graph.lookup(env, output));
    }
  }

  /** Destroys all nodes of this block, last to first. */
  void destroy() {
    returnNode.removeAllInputs();
    for (Node n = last; n != null; ) {
      final Node prev = n.prev;
      n.destroy();
      n = prev;
    }
    for (Value input : paramNode.outputs()) {
      graph.releaseName(input);
    }
  }
}

// End Block.java
