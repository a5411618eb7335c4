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

/**
 * The value of type {@code none}.
 *
 * <p>There is one instance. A method that has nothing to return returns
 * it.
 */
public class None implements Comparable<None> {
  public static final None INSTANCE = new None();

  private None() {}

  @Override
  public String toString() {
    return "None";
  }

  @Override
  public int compareTo(None o) {
    return 0;
  }
}

// End None.java
