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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/** The type of a tuple value. */
public class TupleType implements Type {
  public final List<Type> elementTypes;

  private TupleType(ImmutableList<Type> elementTypes) {
    this.elementTypes = elementTypes;
  }

  /** Creates a tuple type. */
  public static TupleType of(List<? extends Type> elementTypes) {
    return new TupleType(ImmutableList.copyOf(elementTypes));
  }

  /** Creates a tuple type. */
  public static TupleType of(Type... elementTypes) {
    return new TupleType(ImmutableList.copyOf(elementTypes));
  }

  @Override
  public String moniker() {
    return elementTypes.stream()
        .map(Type::moniker)
        .collect(Collectors.joining(", ", "(", ")"));
  }

  @Override
  public String toString() {
    return moniker();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TupleType
            && elementTypes.equals(((TupleType) o).elementTypes);
  }

  @Override
  public int hashCode() {
    return elementTypes.hashCode();
  }

  @Override
  public TupleType copy(UnaryOperator<Type> transform) {
    int differenceCount = 0;
    final ImmutableList.Builder<Type> elementTypes2 = ImmutableList.builder();
    for (Type type : elementTypes) {
      final Type type2 = type.copy(transform);
      if (type != type2) {
        ++differenceCount;
      }
      elementTypes2.add(type2);
    }
    return differenceCount == 0 ? this : new TupleType(elementTypes2.build());
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }
}

// End TupleType.java
