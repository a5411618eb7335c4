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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.frost.type.ModuleType;
import net.hydromatic.frost.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Instance of a module.
 *
 * <p>A module holds a value for each attribute declared by its {@link
 * ModuleType}. Identity is by reference: two modules are the same instance
 * only if they are the same object, and this class does not override {@link
 * Object#equals(Object)}.
 */
public class Module {
  private static final AtomicInteger ID_GENERATOR = new AtomicInteger();

  private final ModuleType type;
  private final Map<String, Object> attributes = new LinkedHashMap<>();
  private final int id = ID_GENERATOR.incrementAndGet();

  public Module(ModuleType type) {
    this.type = requireNonNull(type);
  }

  @Override
  public String toString() {
    return "<" + type.qualifiedName() + " at " + id + ">";
  }

  public ModuleType type() {
    return type;
  }

  public boolean hasAttr(String name) {
    return attributes.containsKey(name);
  }

  /** Returns the value of an attribute. Throws if the attribute has no
   * value. */
  public Object attr(String name) {
    final Object value = attributes.get(name);
    checkArgument(value != null, "%s has no attribute '%s'", this, name);
    return value;
  }

  /**
   * Sets the value of an attribute. The attribute must be declared by the
   * type, and the value must conform to the declared type.
   */
  public Module setAttr(String name, Object value) {
    final Type declaredType = type.getAttribute(name);
    checkArgument(
        declaredType != null,
        "module %s has no attribute '%s'",
        type.qualifiedName(),
        name);
    checkArgument(
        Values.conforms(value, declaredType),
        "value %s does not conform to type %s of attribute '%s'",
        value,
        declaredType,
        name);
    attributes.put(name, value);
    return this;
  }

  /** Removes the value of an attribute, without removing the declaration
   * from the type. */
  public void unsafeRemoveAttr(String name) {
    checkArgument(
        attributes.remove(name) != null,
        "%s has no attribute '%s'",
        this,
        name);
  }

  /** Returns the names of the attributes that have values. */
  public Set<String> attrNames() {
    return ImmutableSet.copyOf(attributes.keySet());
  }

  /** Returns a method of this module's type, or null. */
  public @Nullable Method findMethod(String name) {
    return type.getMethod(name);
  }

  /** Runs a method that returns one value. */
  public Object run(String methodName, Object... args) {
    final List<Object> outputs =
        Interpreter.run(this, methodName, ImmutableList.copyOf(args));
    checkArgument(
        outputs.size() == 1,
        "method '%s' returns %s values",
        methodName,
        outputs.size());
    return outputs.get(0);
  }
}

// End Module.java
