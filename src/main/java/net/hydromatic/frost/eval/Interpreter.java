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
package net.hydromatic.frost.eval;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.frost.graph.Block;
import net.hydromatic.frost.graph.Graph;
import net.hydromatic.frost.graph.Node;
import net.hydromatic.frost.graph.Op;
import net.hydromatic.frost.graph.Value;

/**
 * Evaluates instruction graphs.
 *
 * <p>The interpreter is a reference implementation of the semantics of each
 * {@link Op}. It is not fast; it exists so that a frozen module can be
 * checked against the module it was frozen from.
 */
public class Interpreter {
  private final Map<Value, Object> env = new HashMap<>();

  private Interpreter() {}

  /** Runs a method of a module. */
  public static List<Object> run(
      Module module, String methodName, List<Object> args) {
    final Method method = module.findMethod(methodName);
    if (method == null) {
      throw new FrostRuntimeException(
          "module " + module.type().qualifiedName() + " has no method '"
              + methodName + "'");
    }
    return execute(
        method.graph,
        ImmutableList.builder().add(module).addAll(args).build());
  }

  /** Evaluates a graph with given inputs, and returns its outputs. */
  public static List<Object> execute(Graph graph, List<Object> inputs) {
    return new Interpreter().block(graph.block(), inputs);
  }

  private List<Object> block(Block block, List<Object> inputs) {
    checkArgument(
        inputs.size() == block.inputs().size(),
        "expected %s inputs, got %s",
        block.inputs().size(),
        inputs.size());
    for (int i = 0; i < inputs.size(); i++) {
      env.put(block.inputs().get(i), inputs.get(i));
    }
    for (Node n : block.nodes()) {
      node(n);
    }
    return values(block.outputs());
  }

  private Object value(Value value) {
    final Object o = env.get(value);
    if (o == null) {
      throw new FrostRuntimeException("value " + value + " is not defined");
    }
    return o;
  }

  private List<Object> values(List<Value> values) {
    final ImmutableList.Builder<Object> list = ImmutableList.builder();
    for (Value value : values) {
      list.add(value(value));
    }
    return list.build();
  }

  private void bind(Node n, List<Object> outputs) {
    for (int i = 0; i < outputs.size(); i++) {
      env.put(n.outputs().get(i), outputs.get(i));
    }
  }

  private void node(Node n) {
    switch (n.op()) {
      case CONSTANT:
        env.put(n.output(), n.value());
        return;

      case GET_ATTR:
        env.put(n.output(), module(n.input(0)).attr(n.name()));
        return;

      case SET_ATTR:
        module(n.input(0)).setAttr(n.name(), value(n.input(1)));
        return;

      case CALL_METHOD:
        final List<Object> args = values(n.inputs());
        final Module receiver = module(n.input(0));
        bind(n, run(receiver, n.name(), args.subList(1, args.size())));
        return;

      case ADD:
      case SUB:
      case MUL:
      case EQ:
      case LT:
        env.put(
            n.output(), apply(n.op(), value(n.input(0)), value(n.input(1))));
        return;

      case IF:
        final boolean condition = (Boolean) value(n.input(0));
        bind(n, block(n.blocks().get(condition ? 0 : 1), ImmutableList.of()));
        return;

      case LOOP:
        final long tripCount = (Long) value(n.input(0));
        List<Object> carried = values(n.inputs().subList(1, n.inputs().size()));
        for (long i = 0; i < tripCount; i++) {
          carried =
              block(
                  n.blocks().get(0),
                  ImmutableList.builder().add(i).addAll(carried).build());
        }
        bind(n, carried);
        return;

      case RAISE:
        throw new FrostRuntimeException(n.name());

      case TUPLE_CONSTRUCT:
        env.put(n.output(), values(n.inputs()));
        return;

      case TUPLE_UNPACK:
        final List<?> tuple = (List<?>) value(n.input(0));
        if (tuple.size() != n.outputs().size()) {
          throw new FrostRuntimeException(
              "cannot unpack tuple of " + tuple.size() + " elements into "
                  + n.outputs().size() + " values");
        }
        bind(n, ImmutableList.copyOf(tuple));
        return;

      default:
        throw new AssertionError("unknown op " + n.op());
    }
  }

  private Module module(Value value) {
    final Object o = value(value);
    if (!(o instanceof Module)) {
      throw new FrostRuntimeException("not a module: " + o);
    }
    return (Module) o;
  }

  /**
   * Applies an arithmetic or comparison operator to two values.
   *
   * @throws FrostRuntimeException if the values are not valid arguments, or
   *     if integer arithmetic overflows
   */
  public static Object apply(Op op, Object left, Object right) {
    switch (op) {
      case EQ:
        if (left instanceof Number && right instanceof Number) {
          return ((Number) left).doubleValue()
              == ((Number) right).doubleValue();
        }
        return Objects.equals(left, right);

      case LT:
        if (left instanceof Long && right instanceof Long) {
          return (Long) left < (Long) right;
        }
        if (left instanceof Number && right instanceof Number) {
          return ((Number) left).doubleValue() < ((Number) right).doubleValue();
        }
        if (left instanceof String && right instanceof String) {
          return ((String) left).compareTo((String) right) < 0;
        }
        throw invalid(op, left, right);

      default:
        break;
    }
    if (left instanceof Tensor || right instanceof Tensor) {
      final Tensor t0 = toTensor(op, left, right, left);
      final Tensor t1 = toTensor(op, left, right, right);
      switch (op) {
        case ADD:
          return t0.add(t1);
        case SUB:
          return t0.sub(t1);
        default:
          return t0.mul(t1);
      }
    }
    if (left instanceof Long && right instanceof Long) {
      final long a = (Long) left;
      final long b = (Long) right;
      try {
        switch (op) {
          case ADD:
            return Math.addExact(a, b);
          case SUB:
            return Math.subtractExact(a, b);
          default:
            return Math.multiplyExact(a, b);
        }
      } catch (ArithmeticException e) {
        throw new FrostRuntimeException("integer overflow in " + op.opName, e);
      }
    }
    if (left instanceof Number && right instanceof Number) {
      final double a = ((Number) left).doubleValue();
      final double b = ((Number) right).doubleValue();
      switch (op) {
        case ADD:
          return a + b;
        case SUB:
          return a - b;
        default:
          return a * b;
      }
    }
    if (op == Op.ADD && left instanceof String && right instanceof String) {
      return (String) left + right;
    }
    throw invalid(op, left, right);
  }

  private static Tensor toTensor(Op op, Object left, Object right, Object o) {
    if (o instanceof Tensor) {
      return (Tensor) o;
    }
    if (o instanceof Number) {
      return Tensor.of(((Number) o).doubleValue());
    }
    throw invalid(op, left, right);
  }

  private static FrostRuntimeException invalid(
      Op op, Object left, Object right) {
    return new FrostRuntimeException(
        "invalid arguments for " + op.opName + ": " + left + ", " + right);
  }
}

// End Interpreter.java
