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
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import net.hydromatic.frost.eval.Method;
import net.hydromatic.frost.type.ModuleType;
import net.hydromatic.frost.type.PrimitiveType;
import net.hydromatic.frost.type.TupleType;
import net.hydromatic.frost.type.Type;

/**
 * Builds a graph, inserting nodes at the graph's insertion point and deducing
 * the type of each output.
 *
 * <p>For example, the following builds the graph of a method that returns
 * {@code self.scale + x}:
 *
 * <pre>{@code
 * GraphBuilder b = GraphBuilder.create(moduleType);
 * Value x = b.param("x", PrimitiveType.INT);
 * Graph graph = b.ret(b.add(b.getAttr(b.self(), "scale"), x)).build();
 * }</pre>
 */
public class GraphBuilder {
  private final Graph graph;

  private GraphBuilder(Graph graph) {
    this.graph = requireNonNull(graph);
  }

  /** Creates a builder for the graph of a method of a given module type. The
   * graph's first input is the receiver, "self". */
  public static GraphBuilder create(ModuleType selfType) {
    final Graph graph = new Graph();
    graph.addInput(selfType).setDebugName("self");
    return new GraphBuilder(graph);
  }

  /** Creates a builder that adds to an existing graph. */
  public static GraphBuilder of(Graph graph) {
    return new GraphBuilder(graph);
  }

  public Graph graph() {
    return graph;
  }

  /** Returns the receiver of the method. */
  public Value self() {
    return graph.inputs().get(0);
  }

  /** Adds an input to the graph. */
  public Value param(String name, Type type) {
    return graph.addInput(type).setDebugName(name);
  }

  /** Creates a constant. Throws if the value has no literal form. */
  public Value constant(Object value) {
    final Value v = Constants.tryInsertConstant(graph, value);
    checkArgument(v != null, "not a literal: %s", value);
    return v;
  }

  public Value getAttr(Value receiver, String name) {
    final ModuleType moduleType = moduleType(receiver);
    final Type type = moduleType.getAttribute(name);
    checkArgument(
        type != null, "module %s has no attribute '%s'", moduleType, name);
    final Node n = graph.create(Op.GET_ATTR).setName(name);
    n.addInput(receiver);
    n.addOutput(type);
    graph.insertNode(n);
    return n.output();
  }

  public Node setAttr(Value receiver, String name, Value value) {
    final ModuleType moduleType = moduleType(receiver);
    checkArgument(
        moduleType.hasAttribute(name),
        "module %s has no attribute '%s'",
        moduleType,
        name);
    final Node n = graph.create(Op.SET_ATTR).setName(name);
    n.addInput(receiver);
    n.addInput(value);
    return graph.insertNode(n);
  }

  /** Calls a method that returns one value. */
  public Value call(Value receiver, String name, Value... args) {
    final List<Value> outputs = callMulti(receiver, name, args);
    checkArgument(
        outputs.size() == 1,
        "method '%s' returns %s values",
        name,
        outputs.size());
    return outputs.get(0);
  }

  /** Calls a method. The method must already have been added to the
   * receiver's type. */
  public List<Value> callMulti(Value receiver, String name, Value... args) {
    final ModuleType moduleType = moduleType(receiver);
    final Method method = moduleType.getMethod(name);
    checkArgument(
        method != null, "module %s has no method '%s'", moduleType, name);
    final Node n = graph.create(Op.CALL_METHOD).setName(name);
    n.addInput(receiver);
    for (Value arg : args) {
      n.addInput(arg);
    }
    for (Value output : method.graph.outputs()) {
      n.addOutput(output.type());
    }
    graph.insertNode(n);
    return n.outputs();
  }

  public Value add(Value left, Value right) {
    return binary(Op.ADD, left, right, arithmeticType(Op.ADD, left, right));
  }

  public Value sub(Value left, Value right) {
    return binary(Op.SUB, left, right, arithmeticType(Op.SUB, left, right));
  }

  public Value mul(Value left, Value right) {
    return binary(Op.MUL, left, right, arithmeticType(Op.MUL, left, right));
  }

  public Value eq(Value left, Value right) {
    return binary(Op.EQ, left, right, PrimitiveType.BOOL);
  }

  public Value lt(Value left, Value right) {
    return binary(Op.LT, left, right, PrimitiveType.BOOL);
  }

  private Value binary(Op op, Value left, Value right, Type type) {
    final Node n = graph.create(op);
    n.addInput(left);
    n.addInput(right);
    n.addOutput(type);
    graph.insertNode(n);
    return n.output();
  }

  /** Returns the result type of an arithmetic operator. */
  static Type arithmeticType(Op op, Value left, Value right) {
    final Type t0 = left.type();
    final Type t1 = right.type();
    if (t0 == PrimitiveType.TENSOR || t1 == PrimitiveType.TENSOR) {
      return PrimitiveType.TENSOR;
    }
    if (t0 == PrimitiveType.INT && t1 == PrimitiveType.INT) {
      return PrimitiveType.INT;
    }
    if (t0 instanceof PrimitiveType
        && ((PrimitiveType) t0).isNumeric()
        && t1 instanceof PrimitiveType
        && ((PrimitiveType) t1).isNumeric()) {
      return PrimitiveType.FLOAT;
    }
    if (op == Op.ADD
        && t0 == PrimitiveType.STRING
        && t1 == PrimitiveType.STRING) {
      return PrimitiveType.STRING;
    }
    throw new IllegalArgumentException(
        "invalid argument types for " + op.opName + ": " + t0 + ", " + t1);
  }

  public Value tuple(Value... elements) {
    final Node n = graph.create(Op.TUPLE_CONSTRUCT);
    final ImmutableList.Builder<Type> types = ImmutableList.builder();
    for (Value element : elements) {
      n.addInput(element);
      types.add(element.type());
    }
    n.addOutput(TupleType.of(types.build()));
    graph.insertNode(n);
    return n.output();
  }

  /** Decomposes a tuple into its elements. */
  public List<Value> unpack(Value tuple) {
    checkArgument(
        tuple.type() instanceof TupleType, "not a tuple: %s", tuple.type());
    final Node n = graph.create(Op.TUPLE_UNPACK);
    n.addInput(tuple);
    for (Type type : ((TupleType) tuple.type()).elementTypes) {
      n.addOutput(type);
    }
    graph.insertNode(n);
    return n.outputs();
  }

  /** Throws an exception with a given message. */
  public Node raise(String message) {
    return graph.insertNode(graph.create(Op.RAISE).setName(message));
  }

  /**
   * Creates a conditional. Each branch function is called with this builder,
   * positioned at the end of the branch's block, and returns the outputs of
   * the branch.
   */
  public List<Value> ifThenElse(
      Value condition,
      Function<GraphBuilder, List<Value>> thenBranch,
      Function<GraphBuilder, List<Value>> elseBranch) {
    checkArgument(
        condition.type() == PrimitiveType.BOOL,
        "condition must be bool: %s",
        condition.type());
    final Node n = graph.create(Op.IF);
    n.addInput(condition);
    graph.insertNode(n);
    final List<Value> thenOutputs = branch(n.addBlock(), thenBranch);
    final List<Value> elseOutputs = branch(n.addBlock(), elseBranch);
    checkArgument(
        thenOutputs.size() == elseOutputs.size(),
        "branches have different numbers of outputs");
    for (Value output : thenOutputs) {
      n.addOutput(output.type());
    }
    return n.outputs();
  }

  /** Creates a conditional whose branches each return one value. */
  public Value cond(
      Value condition,
      Function<GraphBuilder, Value> thenBranch,
      Function<GraphBuilder, Value> elseBranch) {
    return ifThenElse(
            condition,
            b -> ImmutableList.of(thenBranch.apply(b)),
            b -> ImmutableList.of(elseBranch.apply(b)))
        .get(0);
  }

  private List<Value> branch(
      Block block, Function<GraphBuilder, List<Value>> f) {
    try (Graph.InsertPoint ignore = graph.insertPointAtEnd(block)) {
      final List<Value> outputs = f.apply(this);
      outputs.forEach(block::registerOutput);
      return outputs;
    }
  }

  /**
   * Creates a loop that runs {@code tripCount} times.
   *
   * <p>The body function is called with this builder, positioned at the end
   * of the loop's block, and a list containing the iteration number followed
   * by the loop-carried values; it returns the new loop-carried values.
   */
  public List<Value> loop(
      Value tripCount,
      List<Value> initial,
      BiFunction<GraphBuilder, List<Value>, List<Value>> body) {
    checkArgument(
        tripCount.type() == PrimitiveType.INT,
        "trip count must be int: %s",
        tripCount.type());
    final Node n = graph.create(Op.LOOP);
    n.addInput(tripCount);
    initial.forEach(n::addInput);
    graph.insertNode(n);
    final Block block = n.addBlock();
    final ImmutableList.Builder<Value> params = ImmutableList.builder();
    params.add(block.addInput(PrimitiveType.INT));
    for (Value value : initial) {
      params.add(block.addInput(value.type()));
      n.addOutput(value.type());
    }
    try (Graph.InsertPoint ignore = graph.insertPointAtEnd(block)) {
      final List<Value> outputs = body.apply(this, params.build());
      checkArgument(
          outputs.size() == initial.size(),
          "loop body must return %s values",
          initial.size());
      outputs.forEach(block::registerOutput);
    }
    return n.outputs();
  }

  /** Registers the outputs of the graph. */
  public GraphBuilder ret(Value... values) {
    for (Value value : values) {
      graph.registerOutput(value);
    }
    return this;
  }

  public Graph build() {
    return graph;
  }

  private static ModuleType moduleType(Value receiver) {
    checkArgument(
        receiver.type() instanceof ModuleType,
        "receiver %s is not a module",
        receiver);
    return (ModuleType) receiver.type();
  }
}

// End GraphBuilder.java
