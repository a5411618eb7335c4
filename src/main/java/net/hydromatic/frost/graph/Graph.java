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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import net.hydromatic.frost.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Instruction graph.
 *
 * <p>A graph has a top-level {@link Block}; the inputs of that block are the
 * inputs of the graph. For a method, the first input is the receiver.
 *
 * <p>New nodes are inserted at the graph's insertion point, which is the end
 * of the top-level block unless changed by {@link #insertPointBefore(Node)}
 * or {@link #insertPointAtEnd(Block)}.
 */
public class Graph {
  private final Block block;
  private final Map<String, Value> names = new HashMap<>();
  private int nextUnique;
  private Block insertBlock;
  private @Nullable Node insertNode;

  public Graph() {
    this.block = new Block(this, null);
    this.insertBlock = block;
  }

  @Override
  public String toString() {
    return GraphWriter.write(this);
  }

  /** Returns the top-level block. */
  public Block block() {
    return block;
  }

  public List<Value> inputs() {
    return block.inputs();
  }

  public List<Value> outputs() {
    return block.outputs();
  }

  public Value addInput(Type type) {
    return block.addInput(type);
  }

  public Graph registerOutput(Value value) {
    block.registerOutput(value);
    return this;
  }

  int nextUnique() {
    return nextUnique++;
  }

  /** Creates a node that is not yet in any block. */
  public Node create(Op op) {
    checkArgument(
        op != Op.PARAM && op != Op.RETURN, "%s is created by its block", op);
    return new Node(this, op);
  }

  /** Inserts a node at the insertion point. */
  public Node insertNode(Node n) {
    if (insertNode != null) {
      n.insertBefore(insertNode);
    } else {
      insertBlock.appendNode(n);
    }
    return n;
  }

  /**
   * Creates a constant node at the insertion point, or returns null if the
   * value has no literal form.
   *
   * @see Constants#tryInsertConstant(Graph, Object)
   */
  public @Nullable Value insertConstant(Object value) {
    return Constants.tryInsertConstant(this, value);
  }

  /**
   * Sets the insertion point to just before a given node, until the returned
   * guard is closed.
   *
   * <pre>{@code
   * try (Graph.InsertPoint ignore = graph.insertPointBefore(node)) {
   *   graph.insertConstant(value);
   * }
   * }</pre>
   */
  public InsertPoint insertPointBefore(Node n) {
    final InsertPoint guard = new InsertPoint(insertBlock, insertNode);
    this.insertBlock =
        requireNonNull(n.owningBlock(), "node is not in a block");
    this.insertNode = n;
    return guard;
  }

  /** Sets the insertion point to the end of a given block, until the returned
   * guard is closed. */
  public InsertPoint insertPointAtEnd(Block b) {
    checkArgument(b.graph() == this, "block is from another graph");
    final InsertPoint guard = new InsertPoint(insertBlock, insertNode);
    this.insertBlock = b;
    this.insertNode = null;
    return guard;
  }

  /** Assigns a debug name to a value, adding a suffix if the name is
   * taken. */
  void assignName(Value value, String name) {
    checkArgument(!name.isEmpty(), "empty name");
    releaseName(value);
    String name2 = name;
    for (int i = 1; names.containsKey(name2); i++) {
      name2 = name + "." + i;
    }
    names.put(name2, value);
    value.debugName(name2);
  }

  void releaseName(Value value) {
    final String name = value.debugName();
    if (name != null && names.get(name) == value) {
      names.remove(name);
    }
    value.debugName(null);
  }

  /**
   * Creates a copy of a node, which may be from another graph, in this graph.
   * The copy is not inserted.
   *
   * @param n Node to copy
   * @param env Maps values of the source graph to values of this graph;
   *     populated with the outputs of the copied node and its blocks
   * @param typeMap Transform applied to the type of each copied value
   */
  public Node createClone(
      Node n, Map<Value, Value> env, UnaryOperator<Type> typeMap) {
    final Node n2 = create(n.op());
    if (n.hasName()) {
      n2.setName(n.name());
    }
    if (n.hasValue()) {
      n2.setValue(n.value());
    }
    for (Value input : n.inputs()) {
      n2.addInput(lookup(env, input));
    }
    for (Value output : n.outputs()) {
      final Value output2 = n2.addOutput(output.type().copy(typeMap));
      if (output.debugName() != null) {
        output2.setDebugName(output.debugName());
      }
      env.put(output, output2);
    }
    for (Block b : n.blocks()) {
      n2.addBlock().cloneFrom(b, env, typeMap);
    }
    return n2;
  }

  static Value lookup(Map<Value, Value> env, Value value) {
    final Value value2 = env.get(value);
    if (value2 == null) {
      throw new IllegalArgumentException("value " + value + " is not in scope");
    }
    return value2;
  }

  /** Returns a deep copy of this graph. */
  public Graph copy() {
    return copy(UnaryOperator.identity());
  }

  /** Returns a deep copy of this graph, transforming the type of each
   * value. */
  public Graph copy(UnaryOperator<Type> typeMap) {
    final Graph graph = new Graph();
    graph.block.cloneFrom(block, new HashMap<>(), typeMap);
    return graph;
  }

  /** Restores the previous insertion point when closed. */
  public class InsertPoint implements AutoCloseable {
    private final Block prevBlock;
    private final @Nullable Node prevNode;

    private InsertPoint(Block prevBlock, @Nullable Node prevNode) {
      this.prevBlock = prevBlock;
      this.prevNode = prevNode;
    }

    @Override
    public void close() {
      insertBlock = prevBlock;
      insertNode = prevNode;
    }
  }
}

// End Graph.java
