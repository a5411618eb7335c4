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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.frost.Fixtures;
import net.hydromatic.frost.eval.Module;
import net.hydromatic.frost.eval.Tensor;
import net.hydromatic.frost.graph.Graph;
import net.hydromatic.frost.type.ModuleType;
import net.hydromatic.frost.type.PrimitiveType;
import net.hydromatic.frost.type.TupleType;
import org.junit.jupiter.api.Test;

/** Tests for {@link Cloner}. */
public class ClonerTest {
  @Test
  void testClone() {
    final Module net = Fixtures.net();
    final Module copy = Cloner.clone(net);
    assertThat(copy, not(sameInstance(net)));
    assertThat(copy.type(), not(sameInstance(net.type())));
    assertThat(copy.type().qualifiedName(), is("__torch__.Net"));
    assertThat(copy.attrNames(), is(net.attrNames()));

    final Module linear = (Module) net.attr("linear");
    final Module linearCopy = (Module) copy.attr("linear");
    assertThat(linearCopy, not(sameInstance(linear)));
    assertThat(linearCopy.type(), not(sameInstance(linear.type())));
    assertThat(
        copy.type().getAttribute("linear"), sameInstance(linearCopy.type()));

    final Tensor weight = (Tensor) linear.attr("weight");
    final Tensor weightCopy = (Tensor) linearCopy.attr("weight");
    assertThat(weightCopy, not(sameInstance(weight)));
    assertThat(weightCopy, is(weight));
    weightCopy.setRequiresGrad(false);
    assertThat(weight.requiresGrad(), is(true));

    // Method graphs are copied, and refer to the copied types
    final Graph graph = net.findMethod("forward").graph;
    final Graph graphCopy = copy.findMethod("forward").graph;
    assertThat(graphCopy, not(sameInstance(graph)));
    assertThat(graphCopy.toString(), is(graph.toString()));
    assertThat(graphCopy.inputs().get(0).type(), sameInstance(copy.type()));

    // Both behave the same
    final Object expected = net.run("forward", Tensor.of(1), 0L);
    assertThat(copy.run("forward", Tensor.of(1), 0L), is(expected));

    // Modifying the copy does not affect the original
    copy.setAttr("step", 1L);
    assertThat(net.attr("step"), is(100L));
  }

  /** A submodule that is reachable by two paths is copied once. */
  @Test
  void testSharedSubmodule() {
    final ModuleType bType = Fixtures.bType();
    final ModuleType type =
        new ModuleType("__torch__.Shared")
            .addAttribute("left", bType)
            .addAttribute("right", bType)
            .addAttribute("both", TupleType.of(bType, PrimitiveType.INT));
    final Module b = new Module(bType).setAttr("bias", 1L);
    final Module m =
        new Module(type)
            .setAttr("left", b)
            .setAttr("right", b)
            .setAttr("both", ImmutableList.of(b, 2L));

    final Module copy = Cloner.clone(m);
    final Object left = copy.attr("left");
    assertThat(left, not(sameInstance((Object) b)));
    assertThat(copy.attr("right"), sameInstance(left));
    final List<?> both = (List<?>) copy.attr("both");
    assertThat(both.get(0), sameInstance(left));
    assertThat(both.get(1), is((Object) 2L));
    assertThat(((Module) left).type(), sameInstance(type(copy, "right")));
  }

  private static ModuleType type(Module module, String attributeName) {
    return (ModuleType) module.type().getAttribute(attributeName);
  }
}

// End ClonerTest.java
