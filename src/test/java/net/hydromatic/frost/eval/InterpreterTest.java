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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.frost.Fixtures;
import net.hydromatic.frost.graph.GraphBuilder;
import net.hydromatic.frost.graph.Op;
import net.hydromatic.frost.graph.Value;
import net.hydromatic.frost.type.ModuleType;
import net.hydromatic.frost.type.PrimitiveType;
import org.junit.jupiter.api.Test;

/** Tests for {@link Interpreter}. */
public class InterpreterTest {
  @Test
  void testAttributes() {
    assertThat(Fixtures.scaleAndBias().run("forward"), is(7L));
  }

  @Test
  void testSetAttr() {
    final Module m = Fixtures.scaleAndMutableBias();
    // Returns the old value, then assigns
    assertThat(m.run("forward", 100L), is(7L));
    assertThat(m.run("forward", 1L), is(102L));
    assertThat(((Module) m.attr("B")).attr("bias"), is(1L));
  }

  @Test
  void testUnpack() {
    assertThat(Fixtures.unpackedReceiver().run("forward"), is(6L));
  }

  @Test
  void testCallIfLoop() {
    final Module net = Fixtures.net();
    final Object result = net.run("forward", Tensor.of(1, 1, 1), 1L);
    assertThat(result, is(ImmutableList.of(Tensor.of(11, 12, 13), 107L)));
    final Object result2 = net.run("forward", Tensor.of(2), 5L);
    assertThat(result2, is(ImmutableList.of(Tensor.of(12, 14, 16), -89L)));
    assertThat(net.run("helper"), is(3L));
  }

  @Test
  void testRaise() {
    final Module guarded = Fixtures.guarded();
    assertThat(guarded.run("forward", 3L), is(9L));
    guarded.setAttr("training", true);
    final FrostRuntimeException e =
        assertThrows(
            FrostRuntimeException.class, () -> guarded.run("forward", 3L));
    assertThat(e.getMessage(), is("not in eval mode"));
  }

  @Test
  void testUnknownMethod() {
    final FrostRuntimeException e =
        assertThrows(
            FrostRuntimeException.class,
            () -> Fixtures.scaleAndBias().run("backward"));
    assertThat(
        e.getMessage(), is("module __torch__.M has no method 'backward'"));
  }

  @Test
  void testApply() {
    assertThat(Interpreter.apply(Op.ADD, 2L, 3L), is(5L));
    assertThat(Interpreter.apply(Op.ADD, 2L, 0.5D), is(2.5D));
    assertThat(Interpreter.apply(Op.SUB, 2.5D, 3L), is(-0.5D));
    assertThat(Interpreter.apply(Op.MUL, 4L, 3L), is(12L));
    assertThat(Interpreter.apply(Op.ADD, "a", "b"), is("ab"));
    assertThat(Interpreter.apply(Op.EQ, 2L, 2.0D), is(true));
    assertThat(Interpreter.apply(Op.EQ, "a", "b"), is(false));
    assertThat(Interpreter.apply(Op.LT, 2L, 3L), is(true));
    assertThat(Interpreter.apply(Op.LT, "b", "a"), is(false));
    assertThat(
        Interpreter.apply(Op.MUL, Tensor.of(1, 2), 2L),
        hasToString("tensor([2.0, 4.0])"));
    assertThrows(
        FrostRuntimeException.class,
        () -> Interpreter.apply(Op.ADD, Long.MAX_VALUE, 1L));
    assertThrows(
        FrostRuntimeException.class, () -> Interpreter.apply(Op.SUB, "a", "b"));
    assertThrows(
        FrostRuntimeException.class, () -> Interpreter.apply(Op.LT, true, 1L));
  }

  @Test
  void testTensorGrad() {
    final Tensor w = Tensor.parameter(1, 2);
    final Tensor x = Tensor.of(3, 4);
    assertThat(w.mul(x).requiresGrad(), is(true));
    assertThat(x.add(x).requiresGrad(), is(false));
    assertThat(w.mul(x), hasToString("tensor([3.0, 8.0], requires_grad=True)"));
    // Equality ignores the flag
    assertThat(w.copy().setRequiresGrad(false), is(w));
  }

  @Test
  void testModuleSetAttrChecksType() {
    final Module m = Fixtures.scaleAndBias();
    assertThrows(
        IllegalArgumentException.class, () -> m.setAttr("scale", 2.0D));
    assertThrows(IllegalArgumentException.class, () -> m.setAttr("nope", 2L));
    assertThrows(IllegalArgumentException.class, () -> m.setAttr("B", 2L));
  }

  @Test
  void testValues() {
    final ModuleType type = new ModuleType("__torch__.T");
    final Module m = new Module(type);
    assertThat(Values.typeOf(1L), is(PrimitiveType.INT));
    assertThat(Values.typeOf(None.INSTANCE), is(PrimitiveType.NONE));
    assertThat(Values.typeOf(m), is(type));
    assertThat(
        Values.typeOf(ImmutableList.of(1L, "a")), hasToString("(int, string)"));
    assertThat(Values.typeOf(ImmutableList.of(1L, m)).isLiteral(), is(false));
    assertThat(Values.typeOfOrNull(1), nullValue());
    assertThrows(IllegalArgumentException.class, () -> Values.typeOf('c'));
    assertThat(
        Values.toLiteralString(ImmutableList.of(1L, "a\"b", None.INSTANCE)),
        is("(1, \"a\\\"b\", None)"));
  }

  /** Tests a loop whose trip count is zero. */
  @Test
  void testEmptyLoop() {
    final ModuleType type = new ModuleType("__torch__.L");
    final GraphBuilder b = GraphBuilder.create(type);
    final Value n = b.param("n", PrimitiveType.INT);
    final List<Value> outputs =
        b.loop(
            n,
            ImmutableList.of(b.constant(1L)),
            (b1, params) -> ImmutableList.of(b1.mul(params.get(1), n)));
    type.addMethod("pow", b.ret(outputs.get(0)).build());
    final Module m = new Module(type);
    assertThat(m.run("pow", 0L), is(1L));
    assertThat(m.run("pow", 3L), is(27L));
  }
}

// End InterpreterTest.java
