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

import static java.util.Objects.requireNonNull;

import java.util.function.UnaryOperator;

/**
 * Type of a runtime-only object, such as a handle to native state.
 *
 * <p>Values of an opaque type can be stored in module attributes and passed
 * around a graph, but have no literal form, so they are never folded into
 * constants.
 */
public class OpaqueType implements Type {
  public final String name;

  public OpaqueType(String name) {
    this.name = requireNonNull(name);
  }

  @Override
  public String moniker() {
    return name;
  }

  @Override
  public String toString() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof OpaqueType && name.equals(((OpaqueType) o).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public OpaqueType copy(UnaryOperator<Type> transform) {
    return this;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }
}

// End OpaqueType.java
