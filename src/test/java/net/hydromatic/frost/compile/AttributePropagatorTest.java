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

import static net.hydromatic.frost.Matchers.hasNodeCount;
import static net.hydromatic.frost.Matchers.isConstant;
import static net.hydromatic.frost.Matchers.isWellFormed;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.frost.Fixtures;
import net.hydromatic.frost.eval.Capsule;
import net.hydromatic.frost.eval.Module;
import net.hydromatic.frost.eval.Tensor;
import net.hydromatic.frost.graph.Graph;
import net.hydromatic.frost.graph.GraphBuilder;
import net.hydromatic.frost.graph.Op;
import net.hydromatic.frost.graph.Value;
import net.hydromatic.frost.type.ModuleType;
import net.hydromatic.frost.type.OpaqueType;
import net.hydromatic.frost.type.PrimitiveType;
import net.hydromatic.frost.type.TupleType;
import org.junit.jupiter.api.Test;

/** Tests for {@link AttributePropagator}. */
public class AttributePropagatorTest {
  private static FreezeContext context(Module module, Tracer tracer) {
    return new FreezeContext(
        module, module.findMethod("forward").graph, tracer);
  }

  @Test
  void testFoldImmutable() {
    final Module m = Fixtures.scaleAndBias();
    final FreezeContext context = context(m, Tracers.empty());
    assertThat(AttributePropagator.propagate(context), is(2));
    final String expected =
        "graph(%self : __torch__.M):\n"
            + "  %__torch__.M.scale : int = prim::Constant[value=2]()\n"
            + "  %2 : __torch__.B = prim::GetAttr[name=\"B\"](%self)\n"
            + "  %__torch__.B.bias : int = prim::Constant[value=5]()\n"
            + "  %4 : int = aten::add(%__torch__.M.scale, %__torch__.B.bias)\n"
            + "  return (%4)\n";
    assertThat(context.graph, hasToString(expected));
    assertThat(context.graph, isWellFormed());
  }

  @Test
  void testMutableNotFolded() {
    final Module m = Fixtures.scaleAndMutableBias();
    final List<String> folded = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnFold(Tracers.empty(), (module, name) -> folded.add(name));
    final FreezeContext context = context(m, tracer);
    assertThat(AttributePropagator.propagate(context), is(1));
    assertThat(folded, is(ImmutableList.of("scale")));
    // Reads of "B" and "bias" remain
    assertThat(context.graph, hasNodeCount(Op.GET_ATTR, 2));
    assertThat(context.graph, hasNodeCount(Op.SET_ATTR, 1));
    assertThat(context.graph, isWellFormed());
  }

  @Test
  void testUnpackedReceiverNotFolded() {
    final Module m = Fixtures.unpackedReceiver();
    final FreezeContext context = context(m, Tracers.empty());
    assertThat(AttributePropagator.propagate(context), is(0));
    assertThat(context.graph, hasNodeCount(Op.GET_ATTR, 2));
  }

  @Test
  void testTensorIsDetached() {
    final ModuleType type =
        new ModuleType("__torch__.Linear")
            .addAttribute("weight", PrimitiveType.TENSOR);
    final GraphBuilder b = GraphBuilder.create(type);
    final Value x = b.param("x", PrimitiveType.TENSOR);
    type.addMethod(
        "forward", b.ret(b.mul(x, b.getAttr(b.self(), "weight"))).build());
    final Module m =
        new Module(type).setAttr("weight", Tensor.parameter(2, 3));

    final FreezeContext context = context(m, Tracers.empty());
    assertThat(AttributePropagator.propagate(context), is(1));
    final Graph graph = context.graph;
    final Value weight = graph.outputs().get(0).node().input(1);
    assertThat(weight, isConstant(Tensor.of(2, 3)));
    assertThat(((Tensor) weight.node().value()).requiresGrad(), is(false));
    assertThat(weight.debugName(), is("__torch__.Linear.weight"));
  }

  @Test
  void testNonLiteralsNotFolded() {
    final OpaqueType handleType = new OpaqueType("Handle");
    final ModuleType bType = Fixtures.bType();
    final ModuleType type =
        new ModuleType("__torch__.Holder")
            .addAttribute("handle", handleType)
            .addAttribute("pair", TupleType.of(PrimitiveType.INT, bType))
            .addAttribute(
                "names", TupleType.of(PrimitiveType.STRING, PrimitiveType.INT));
    final GraphBuilder b = GraphBuilder.create(type);
    final Value handle = b.getAttr(b.self(), "handle");
    final Value pair = b.getAttr(b.self(), "pair");
    final Value names = b.getAttr(b.self(), "names");
    type.addMethod("forward", b.ret(handle, pair, names).build());
    final Module sub = new Module(bType).setAttr("bias", 1L);
    final Module m =
        new Module(type)
            .setAttr("handle", new Capsule(handleType, "fd:3"))
            .setAttr("pair", ImmutableList.of(1L, sub))
            .setAttr("names", ImmutableList.of("a", 2L));

    final FreezeContext context = context(m, Tracers.empty());
    assertThat(AttributePropagator.propagate(context), is(1));
    final List<Value> outputs = context.graph.outputs();
    assertThat(outputs.get(0).node().op(), is(Op.GET_ATTR));
    assertThat(outputs.get(1).node().op(), is(Op.GET_ATTR));
    assertThat(outputs.get(2), isConstant(ImmutableList.of("a", 2L)));
  }
}

// End AttributePropagatorTest.java
