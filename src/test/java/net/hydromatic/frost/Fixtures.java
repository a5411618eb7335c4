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
package net.hydromatic.frost;

import static net.hydromatic.frost.type.PrimitiveType.BOOL;
import static net.hydromatic.frost.type.PrimitiveType.INT;
import static net.hydromatic.frost.type.PrimitiveType.TENSOR;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.frost.eval.Module;
import net.hydromatic.frost.eval.Tensor;
import net.hydromatic.frost.graph.GraphBuilder;
import net.hydromatic.frost.graph.Value;
import net.hydromatic.frost.type.ModuleType;

/** Modules used by several tests. */
public abstract class Fixtures {
  private Fixtures() {}

  /** Creates module type "B", which has an int attribute "bias". */
  public static ModuleType bType() {
    return new ModuleType("__torch__.B").addAttribute("bias", INT);
  }

  /** Creates module type "M", which has an int attribute "scale" and a
   * submodule "B". */
  public static ModuleType mType(ModuleType bType) {
    return new ModuleType("__torch__.M")
        .addAttribute("scale", INT)
        .addAttribute("B", bType);
  }

  /** Creates an instance of "M" with {@code scale = 2} and
   * {@code B.bias = 5}. */
  public static Module instance(ModuleType mType, ModuleType bType) {
    return new Module(mType)
        .setAttr("scale", 2L)
        .setAttr("B", new Module(bType).setAttr("bias", 5L));
  }

  /**
   * Creates a module whose "forward" method returns
   * {@code self.scale + self.B.bias}.
   */
  public static Module scaleAndBias() {
    final ModuleType bType = bType();
    final ModuleType mType = mType(bType);
    final GraphBuilder b = GraphBuilder.create(mType);
    final Value scale = b.getAttr(b.self(), "scale");
    final Value bias = b.getAttr(b.getAttr(b.self(), "B"), "bias");
    mType.addMethod("forward", b.ret(b.add(scale, bias)).build());
    return instance(mType, bType);
  }

  /**
   * Creates a module whose "forward" method returns
   * {@code self.scale + self.B.bias}, and then assigns {@code x} to
   * {@code self.B.bias}.
   */
  public static Module scaleAndMutableBias() {
    final ModuleType bType = bType();
    final ModuleType mType = mType(bType);
    final GraphBuilder b = GraphBuilder.create(mType);
    final Value x = b.param("x", INT);
    final Value scale = b.getAttr(b.self(), "scale");
    final Value sub = b.getAttr(b.self(), "B");
    final Value result = b.add(scale, b.getAttr(sub, "bias"));
    b.setAttr(sub, "bias", x);
    mType.addMethod("forward", b.ret(result).build());
    return instance(mType, bType);
  }

  /**
   * Creates a module whose "forward" method reads attribute "bias" of a
   * submodule that it obtains by unpacking a tuple:
   * {@code (s, n) = (self.B, 1); return s.bias + n}.
   */
  public static Module unpackedReceiver() {
    final ModuleType bType = bType();
    final ModuleType mType = mType(bType);
    final GraphBuilder b = GraphBuilder.create(mType);
    final Value pair = b.tuple(b.getAttr(b.self(), "B"), b.constant(1L));
    final List<Value> elements = b.unpack(pair);
    final Value bias = b.getAttr(elements.get(0), "bias");
    mType.addMethod("forward", b.ret(b.add(bias, elements.get(1))).build());
    return instance(mType, bType);
  }

  /**
   * Creates a module that calls a method of a submodule, and has control
   * flow.
   *
   * <pre>{@code
   * class Linear:
   *   weight: Tensor
   *   bias: int
   *   def forward(self, x: Tensor): return x * self.weight + self.bias
   *
   * class Net:
   *   linear: Linear
   *   limit: int
   *   step: int
   *   count: int
   *   def forward(self, x: Tensor, n: int):
   *     y = self.linear.forward(x)
   *     if n < self.limit:
   *       k = n + self.step
   *     else:
   *       k = n - self.step
   *     for i in range(self.count):
   *       k = k + i
   *     return (y, k)
   *   def helper(self): return self.limit
   * }</pre>
   */
  public static Module net() {
    final ModuleType linearType =
        new ModuleType("__torch__.Linear")
            .addAttribute("weight", TENSOR)
            .addAttribute("bias", INT);
    final GraphBuilder lb = GraphBuilder.create(linearType);
    final Value lx = lb.param("x", TENSOR);
    linearType.addMethod(
        "forward",
        lb.ret(
                lb.add(
                    lb.mul(lx, lb.getAttr(lb.self(), "weight")),
                    lb.getAttr(lb.self(), "bias")))
            .build());

    final ModuleType netType =
        new ModuleType("__torch__.Net")
            .addAttribute("linear", linearType)
            .addAttribute("limit", INT)
            .addAttribute("step", INT)
            .addAttribute("count", INT);
    final GraphBuilder b = GraphBuilder.create(netType);
    final Value x = b.param("x", TENSOR);
    final Value n = b.param("n", INT);
    final Value y = b.call(b.getAttr(b.self(), "linear"), "forward", x);
    final Value k =
        b.cond(
            b.lt(n, b.getAttr(b.self(), "limit")),
            b1 -> b1.add(n, b1.getAttr(b1.self(), "step")),
            b2 -> b2.sub(n, b2.getAttr(b2.self(), "step")));
    final List<Value> loop =
        b.loop(
            b.getAttr(b.self(), "count"),
            ImmutableList.of(k),
            (b3, params) ->
                ImmutableList.of(b3.add(params.get(1), params.get(0))));
    netType.addMethod("forward", b.ret(b.tuple(y, loop.get(0))).build());

    final GraphBuilder hb = GraphBuilder.create(netType);
    netType.addMethod(
        "helper", hb.ret(hb.getAttr(hb.self(), "limit")).build());

    return new Module(netType)
        .setAttr(
            "linear",
            new Module(linearType)
                .setAttr("weight", Tensor.parameter(1, 2, 3))
                .setAttr("bias", 10L))
        .setAttr("limit", 3L)
        .setAttr("step", 100L)
        .setAttr("count", 4L);
  }

  /** Creates a module that has a bool attribute "training" and a method that
   * raises if it is set. */
  public static Module guarded() {
    final ModuleType type =
        new ModuleType("__torch__.Guarded").addAttribute("training", BOOL);
    final GraphBuilder b = GraphBuilder.create(type);
    final Value x = b.param("x", INT);
    final Value y =
        b.cond(
            b.getAttr(b.self(), "training"),
            b1 -> {
              b1.raise("not in eval mode");
              return x;
            },
            b2 -> b2.mul(x, x));
    type.addMethod("forward", b.ret(y).build());
    return new Module(type).setAttr("training", false);
  }
}

// End Fixtures.java
