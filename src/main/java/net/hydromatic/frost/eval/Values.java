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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import net.hydromatic.frost.type.PrimitiveType;
import net.hydromatic.frost.type.TupleType;
import net.hydromatic.frost.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Utilities for runtime values.
 *
 * <p>Values are represented as follows: {@code bool} as {@link Boolean},
 * {@code int} as {@link Long}, {@code float} as {@link Double}, {@code string}
 * as {@link String}, {@code none} as {@link None#INSTANCE}, {@code Tensor} as
 * {@link Tensor}, tuples as {@link List}, modules as {@link Module}, and
 * opaque runtime objects as {@link Capsule}.
 */
public abstract class Values {
  private Values() {}

  /** Returns the type of a value. Throws if it is not a valid value. */
  public static Type typeOf(Object value) {
    final Type type = typeOfOrNull(value);
    if (type == null) {
      throw new IllegalArgumentException(
          "not a valid value: " + value + " (" + value.getClass() + ")");
    }
    return type;
  }

  /** Returns the type of a value, or null if it is not a valid value. */
  public static @Nullable Type typeOfOrNull(Object value) {
    if (value instanceof Boolean) {
      return PrimitiveType.BOOL;
    } else if (value instanceof Long) {
      return PrimitiveType.INT;
    } else if (value instanceof Double) {
      return PrimitiveType.FLOAT;
    } else if (value instanceof String) {
      return PrimitiveType.STRING;
    } else if (value instanceof None) {
      return PrimitiveType.NONE;
    } else if (value instanceof Tensor) {
      return PrimitiveType.TENSOR;
    } else if (value instanceof Module) {
      return ((Module) value).type();
    } else if (value instanceof Capsule) {
      return ((Capsule) value).type;
    } else if (value instanceof List) {
      final ImmutableList.Builder<Type> types = ImmutableList.builder();
      for (Object element : (List<?>) value) {
        final Type type = element == null ? null : typeOfOrNull(element);
        if (type == null) {
          return null;
        }
        types.add(type);
      }
      return TupleType.of(types.build());
    } else {
      return null;
    }
  }

  /** Returns whether a value may be stored in a slot of a given type. */
  public static boolean conforms(Object value, Type type) {
    final Type valueType = typeOfOrNull(value);
    return valueType != null && valueType.equals(type);
  }

  /** Converts a literal to the form used when printing a graph. */
  public static String toLiteralString(Object value) {
    if (value instanceof String) {
      return "\"" + ((String) value).replace("\"", "\\\"") + "\"";
    } else if (value instanceof List) {
      return ((List<?>) value)
          .stream()
          .map(Values::toLiteralString)
          .collect(Collectors.joining(", ", "(", ")"));
    } else {
      return String.valueOf(value);
    }
  }
}

// End Values.java
