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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import net.hydromatic.frost.eval.Method;
import net.hydromatic.frost.graph.Graph;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The type of a module instance.
 *
 * <p>Module types are nominal: two module types are equal only if they are
 * the same object. A module type holds the ordered list of attribute
 * descriptors (name and type) and the methods of the module. Attribute
 * indexes are stable until an attribute is removed.
 *
 * <p>Module types are mutable. Freezing removes attribute descriptors and
 * methods from the module type of the frozen copy.
 */
public class ModuleType implements Type {
  private final String qualifiedName;
  private final List<String> attributeNames = new ArrayList<>();
  private final List<Type> attributeTypes = new ArrayList<>();
  private final Map<String, Method> methods = new LinkedHashMap<>();

  /** Creates a module type with a given qualified name, such as
   * "{@code __torch__.Net}". */
  public ModuleType(String qualifiedName) {
    this.qualifiedName = requireNonNull(qualifiedName);
    checkArgument(!qualifiedName.isEmpty(), "empty name");
  }

  /** Returns the fully-qualified name. */
  public String qualifiedName() {
    return qualifiedName;
  }

  /** Returns the last segment of the qualified name. */
  public String name() {
    return qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1);
  }

  @Override
  public String moniker() {
    return qualifiedName;
  }

  @Override
  public String toString() {
    return qualifiedName;
  }

  /** Declares an attribute. Returns this type, for chaining. */
  public ModuleType addAttribute(String name, Type type) {
    checkArgument(
        !hasAttribute(name),
        "module %s already has attribute '%s'",
        qualifiedName,
        name);
    attributeNames.add(requireNonNull(name));
    attributeTypes.add(requireNonNull(type));
    return this;
  }

  public int numAttributes() {
    return attributeNames.size();
  }

  public String getAttributeName(int i) {
    return attributeNames.get(i);
  }

  public Type getAttribute(int i) {
    return attributeTypes.get(i);
  }

  /** Returns the type of an attribute, or null if there is no such
   * attribute. */
  public @Nullable Type getAttribute(String name) {
    final int i = attributeNames.indexOf(name);
    return i < 0 ? null : attributeTypes.get(i);
  }

  public boolean hasAttribute(String name) {
    return attributeNames.contains(name);
  }

  /** Returns the names of the attributes, in declaration order. */
  public List<String> attributeNames() {
    return ImmutableList.copyOf(attributeNames);
  }

  /**
   * Removes an attribute descriptor.
   *
   * <p>Does not check whether instances or graphs still refer to it; the
   * caller must make sure that they do not.
   */
  public void unsafeRemoveAttribute(String name) {
    final int i = attributeNames.indexOf(name);
    checkArgument(
        i >= 0, "module %s has no attribute '%s'", qualifiedName, name);
    attributeNames.remove(i);
    attributeTypes.remove(i);
  }

  /**
   * Adds a method.
   *
   * <p>The first input of the graph is the receiver, and must have this
   * type.
   */
  public Method addMethod(String name, Graph graph) {
    checkArgument(
        !methods.containsKey(name),
        "module %s already has method '%s'",
        qualifiedName,
        name);
    checkArgument(
        !graph.inputs().isEmpty() && graph.inputs().get(0).type() == this,
        "first input of method '%s' must have type %s",
        name,
        qualifiedName);
    final Method method = new Method(name, graph);
    methods.put(name, method);
    return method;
  }

  /** Returns the method with a given name, or null. */
  public @Nullable Method getMethod(String name) {
    return methods.get(name);
  }

  /** Returns the methods, in the order they were added. */
  public List<Method> methods() {
    return ImmutableList.copyOf(methods.values());
  }

  /** Removes a method. Does not check whether any graph calls it. */
  public void unsafeRemoveMethod(String name) {
    checkArgument(
        methods.remove(name) != null,
        "module %s has no method '%s'",
        qualifiedName,
        name);
  }

  @Override
  public Type copy(UnaryOperator<Type> transform) {
    return transform.apply(this);
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }
}

// End ModuleType.java
