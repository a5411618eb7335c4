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
package net.hydromatic.frost.type;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/** Type of a value in an instruction graph or of a module attribute. */
public interface Type {
  /**
   * Name of the type when printed, e.g. "{@code int}", "{@code (int, Tensor)}",
   * "{@code __torch__.M}".
   */
  String moniker();

  /**
   * Copies this type, applying a given transform to component types, and
   * returning the original type if the component types are unchanged.
   *
   * <p>Nominal types (modules) are passed to the transform; structural types
   * copy their components.
   */
  Type copy(UnaryOperator<Type> transform);

  <R> R accept(TypeVisitor<R> typeVisitor);

  /**
   * Returns whether values of this type can be embedded in a graph as a
   * constant.
   *
   * <p>Modules and opaque runtime types cannot, and neither can a tuple that
   * contains one of them.
   */
  default boolean isLiteral() {
    final AtomicInteger c = new AtomicInteger();
    accept(
        new TypeVisitor<Void>() {
          @Override
          public Void visit(ModuleType moduleType) {
            c.incrementAndGet();
            return null;
          }

          @Override
          public Void visit(OpaqueType opaqueType) {
            c.incrementAndGet();
            return null;
          }
        });
    return c.get() == 0;
  }
}

// End Type.java
