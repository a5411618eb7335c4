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
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.hydromatic.frost.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Instruction in a graph.
 *
 * <p>A node has an {@link Op kind}, an ordered list of inputs, an ordered list
 * of outputs, and zero or more nested blocks. Some kinds carry a name (the
 * attribute of {@link Op#GET_ATTR} and {@link Op#SET_ATTR}, the method of
 * {@link Op#CALL_METHOD}, the message of {@link Op#RAISE}); {@link
 * Op#CONSTANT} carries a value.
 *
 * <p>Nodes are created by {@link Graph#create(Op)} and live in at most one
 * block, where they are linked to the previous and next node.
 */
public class Node {
  private final Graph graph;
  private final Op op;
  private final List<Value> inputs = new ArrayList<>();
  private final List<Value> outputs = new ArrayList<>();
  private final List<Block> blocks = new ArrayList<>();
  private @Nullable String name;
  private @Nullable Object value;
  private boolean destroyed;

  @Nullable Block owningBlock;
  @Nullable Node prev;
  @Nullable Node next;

  Node(Graph graph, Op op) {
    this.graph = requireNonNull(graph);
    this.op = requireNonNull(op);
  }

  @Override
  public String toString() {
    return GraphWriter.describe(this);
  }

  public Graph graph() {
    return graph;
  }

  public Op op() {
    return op;
  }

  /** Returns the name of an attribute, method or exception message. Throws
   * if this node has no name. */
  public String name() {
    return requireNonNull(name, "name");
  }

  public boolean hasName() {
    return name != null;
  }

  public Node setName(String name) {
    this.name = requireNonNull(name);
    return this;
  }

  /** Returns the value of a constant. Throws if this node has no value. */
  public Object value() {
    return requireNonNull(value, "value");
  }

  public boolean hasValue() {
    return value != null;
  }

  public Node setValue(Object value) {
    checkState(op == Op.CONSTANT, "only constants have a value");
    this.value = requireNonNull(value);
    return this;
  }

  public List<Value> inputs() {
    return Collections.unmodifiableList(inputs);
  }

  public Value input(int i) {
    return inputs.get(i);
  }

  public List<Value> outputs() {
    return Collections.unmodifiableList(outputs);
  }

  /** Returns the sole output. Throws if the node does not have exactly one
   * output. */
  public Value output() {
    checkState(
        outputs.size() == 1, "node %s has %s outputs", op, outputs.size());
    return outputs.get(0);
  }

  public List<Block> blocks() {
    return Collections.unmodifiableList(blocks);
  }

  /** Returns the block that contains this node, or null if the node has not
   * been inserted. */
  public @Nullable Block owningBlock() {
    return owningBlock;
  }

  /** Returns the next node in the owning block, or null if this is the
   * last. */
  public @Nullable Node next() {
    return next;
  }

  /** Returns the previous node in the owning block, or null if this is the
   * first. */
  public @Nullable Node prev() {
    return prev;
  }

  public boolean isDestroyed() {
    return destroyed;
  }

  /** Adds an input. */
  public Value addInput(Value input) {
    checkArgument(
        input.node().graph == graph, "input %s is from another graph", input);
    inputs.add(input);
    input.uses.add(this);
    return input;
  }

  /** Replaces the input at position {@code i}. */
  public void replaceInput(int i, Value input) {
    checkArgument(
        input.node().graph == graph, "input %s is from another graph", input);
    final Value old = inputs.set(i, input);
    old.uses.remove(this);
    input.uses.add(this);
  }

  /** Replaces every occurrence of {@code from} among the inputs with
   * {@code to}. */
  public void replaceInputWith(Value from, Value to) {
    for (int i = 0; i < inputs.size(); i++) {
      if (inputs.get(i) == from) {
        replaceInput(i, to);
      }
    }
  }

  /** Detaches this node from all of its inputs. */
  public void removeAllInputs() {
    for (Value input : inputs) {
      input.uses.remove(this);
    }
    inputs.clear();
  }

  /** Adds an output of a given type. */
  public Value addOutput(Type type) {
    final Value output =
        new Value(this, outputs.size(), type, graph.nextUnique());
    outputs.add(output);
    return output;
  }

  /** Adds a nested block. */
  public Block addBlock() {
    final Block block = new Block(graph, this);
    blocks.add(block);
    return block;
  }

  /** Inserts this node, which must not be in a block, before {@code n}. */
  public Node insertBefore(Node n) {
    checkState(owningBlock == null, "node is already in a block");
    requireNonNull(n.owningBlock, "target node is not in a block")
        .linkBefore(this, n);
    return this;
  }

  /** Moves this node from its current block to just before {@code n}. */
  public void moveBefore(Node n) {
    if (owningBlock != null) {
      owningBlock.unlink(this);
    }
    insertBefore(n);
  }

  /**
   * Removes this node from the graph.
   *
   * <p>None of the outputs may have uses. Detaches the inputs, destroys the
   * nested blocks and unlinks the node from its block.
   */
  public void destroy() {
    checkState(!destroyed, "node already destroyed");
    for (Value output : outputs) {
      checkState(
          !output.hasUses(),
          "cannot destroy %s; output %s still has uses",
          op,
          output);
    }
    removeAllInputs();
    for (int i = blocks.size() - 1; i >= 0; i--) {
      blocks.get(i).destroy();
    }
    blocks.clear();
    if (owningBlock != null) {
      owningBlock.unlink(this);
    }
    for (Value output : outputs) {
      graph.releaseName(output);
    }
    destroyed = true;
  }
}

// End Node.java
