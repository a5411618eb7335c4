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

import static java.util.Objects.requireNonNull;

import net.hydromatic.frost.type.OpaqueType;

/**
 * A runtime-only object, such as a handle to native state.
 *
 * <p>A capsule can be stored in an attribute but has no literal form, so
 * reads of it are never folded into constants.
 */
public class Capsule {
  public final OpaqueType type;
  public final Object payload;

  public Capsule(OpaqueType type, Object payload) {
    this.type = requireNonNull(type);
    this.payload = requireNonNull(payload);
  }

  @Override
  public String toString() {
    return "<" + type.name + " " + payload + ">";
  }
}

// End Capsule.java
