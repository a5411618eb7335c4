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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import net.hydromatic.frost.Fixtures;
import net.hydromatic.frost.eval.Module;
import net.hydromatic.frost.graph.GraphBuilder;
import net.hydromatic.frost.graph.Value;
import net.hydromatic.frost.type.ModuleType;
import net.hydromatic.frost.type.PrimitiveType;
import org.junit.jupiter.api.Test;

/** Tests for {@link MutabilityRecorder}. */
public class MutabilityRecorderTest {
  @Test
  void testRecordSubmoduleAssignment() {
    final Module m = Fixtures.scaleAndMutableBias();
    final Module b = (Module) m.attr("B");
    final FreezeContext context =
        new FreezeContext(m, m.findMethod("forward").graph, Tracers.empty());
    assertThat(MutabilityRecorder.record(context), is(1));
    assertThat(context.preservedNames(b), is(ImmutableSet.of("bias")));
    assertThat(context.preservedNames(m), empty());

    // Recording again adds nothing
    assertThat(MutabilityRecorder.record(context), is(0));
    assertThat(context.preservedCount(), is(1));
  }

  /** Assignments inside a conditional are recorded. */
  @Test
  void testRecordNestedAssignment() {
    final ModuleType type =
        new ModuleType("__torch__.Counter")
            .addAttribute("count", PrimitiveType.INT)
            .addAttribute("enabled", PrimitiveType.BOOL);
    final GraphBuilder b = GraphBuilder.create(type);
    final Value count = b.getAttr(b.self(), "count");
    b.ifThenElse(
        b.getAttr(b.self(), "enabled"),
        b1 -> {
          b1.setAttr(b1.self(), "count", b1.add(count, b1.constant(1L)));
          return ImmutableList.<Value>of();
        },
        b2 -> ImmutableList.<Value>of());
    type.addMethod("forward", b.ret(count).build());
    final Module m =
        new Module(type).setAttr("count", 0L).setAttr("enabled", true);
    final FreezeContext context =
        new FreezeContext(m, m.findMethod("forward").graph, Tracers.empty());
    MutabilityRecorder.record(context);
    assertThat(context.preservedNames(m), is(ImmutableSet.of("count")));
  }

  /** An assignment through a receiver that does not resolve is ignored. */
  @Test
  void testUnresolvedAssignment() {
    final ModuleType bType = Fixtures.bType();
    final ModuleType mType = Fixtures.mType(bType);
    final GraphBuilder b = GraphBuilder.create(mType);
    final Value other = b.param("other", bType);
    b.setAttr(other, "bias", b.constant(0L));
    mType.addMethod("forward", b.ret(b.getAttr(b.self(), "scale")).build());
    final Module m = Fixtures.instance(mType, bType);
    final FreezeContext context =
        new FreezeContext(m, m.findMethod("forward").graph, Tracers.empty());
    assertThat(MutabilityRecorder.record(context), is(0));
    assertThat(context.preservedCount(), is(0));
  }

  /** An assignment through an alias of {@code self} preserves the root's
   * attribute. */
  @Test
  void testRecordAssignmentThroughAlias() {
    final ModuleType bType = Fixtures.bType();
    final ModuleType mType = Fixtures.mType(bType);
    final GraphBuilder b = GraphBuilder.create(mType);
    final Value x = b.param("x", PrimitiveType.INT);
    final List<Value> elements =
        b.unpack(b.tuple(b.self(), b.constant(1L)));
    b.setAttr(elements.get(0), "scale", x);
    mType.addMethod("forward", b.ret(b.getAttr(b.self(), "scale")).build());
    final Module m = Fixtures.instance(mType, bType);
    final FreezeContext context =
        new FreezeContext(m, m.findMethod("forward").graph, Tracers.empty());
    assertThat(MutabilityRecorder.record(context), is(1));
    assertThat(context.preservedNames(m), is(ImmutableSet.of("scale")));
  }
}

// End MutabilityRecorderTest.java
