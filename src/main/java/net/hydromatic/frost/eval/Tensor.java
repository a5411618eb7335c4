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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Arrays;
import java.util.function.DoubleBinaryOperator;

/**
 * One-dimensional tensor of floating-point values.
 *
 * <p>A tensor is mutable only in its {@link #requiresGrad()} flag. Equality
 * compares the elements and ignores the flag.
 */
public class Tensor {
  private final double[] data;
  private boolean requiresGrad;

  private Tensor(double[] data, boolean requiresGrad) {
    this.data = data;
    this.requiresGrad = requiresGrad;
  }

  /** Creates a tensor that does not require gradients. */
  public static Tensor of(double... data) {
    return new Tensor(data.clone(), false);
  }

  /** Creates a tensor that requires gradients, as a trainable parameter
   * does. */
  public static Tensor parameter(double... data) {
    return new Tensor(data.clone(), true);
  }

  public int size() {
    return data.length;
  }

  public double get(int i) {
    return data[i];
  }

  /** Whether operations on this tensor are recorded for gradient
   * computation. */
  public boolean requiresGrad() {
    return requiresGrad;
  }

  public Tensor setRequiresGrad(boolean requiresGrad) {
    this.requiresGrad = requiresGrad;
    return this;
  }

  /** Returns a copy with its own storage. */
  public Tensor copy() {
    return new Tensor(data.clone(), requiresGrad);
  }

  public Tensor add(Tensor t) {
    return zip(t, Double::sum);
  }

  public Tensor sub(Tensor t) {
    return zip(t, (a, b) -> a - b);
  }

  public Tensor mul(Tensor t) {
    return zip(t, (a, b) -> a * b);
  }

  /** Applies an operator element-wise; a tensor of size 1 is broadcast. */
  private Tensor zip(Tensor t, DoubleBinaryOperator op) {
    final int size = Math.max(data.length, t.data.length);
    checkArgument(
        data.length == t.data.length || data.length == 1 || t.data.length == 1,
        "tensor sizes %s and %s do not match",
        data.length,
        t.data.length);
    final double[] result = new double[size];
    for (int i = 0; i < size; i++) {
      final double a = data[data.length == 1 ? 0 : i];
      final double b = t.data[t.data.length == 1 ? 0 : i];
      result[i] = op.applyAsDouble(a, b);
    }
    return new Tensor(result, requiresGrad || t.requiresGrad);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Tensor && Arrays.equals(data, ((Tensor) o).data);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder("tensor([");
    for (int i = 0; i < data.length; i++) {
      if (i > 0) {
        buf.append(", ");
      }
      buf.append(data[i]);
    }
    buf.append("]");
    if (requiresGrad) {
      buf.append(", requires_grad=True");
    }
    return buf.append(")").toString();
  }
}

// End Tensor.java
