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

import java.util.Locale;
import java.util.function.UnaryOperator;

/** Primitive type. */
public enum PrimitiveType implements Type {
  BOOL,
  INT,
  FLOAT,
  STRING,
  /** Type of the {@link net.hydromatic.frost.eval.None} value. */
  NONE,
  TENSOR {
    @Override
    public String moniker() {
      return "Tensor";
    }
  };

  @Override
  public String moniker() {
    return name().toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return moniker();
  }

  @Override
  public PrimitiveType copy(UnaryOperator<Type> transform) {
    return this;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  /** Returns whether this is a numeric type, {@code int} or {@code float}. */
  public boolean isNumeric() {
    return this == INT || this == FLOAT;
  }
}

// End PrimitiveType.java
