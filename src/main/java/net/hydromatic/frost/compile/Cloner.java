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
package net.hydromatic.frost.compile;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import java.util.List;
import java.util.Map;
import net.hydromatic.frost.eval.Method;
import net.hydromatic.frost.eval.Module;
import net.hydromatic.frost.eval.Tensor;
import net.hydromatic.frost.type.ModuleType;
import net.hydromatic.frost.type.Type;

/**
 * Deep copy of a module hierarchy.
 *
 * <p>Copies each module instance, each module type (with its attributes and
 * method graphs) and each tensor. The copy has the same shape as the
 * original: an instance or type that is reachable by two paths in the
 * original is copied once, and is shared in the copy.
 *
 * <p>Scalars, strings and {@link net.hydromatic.frost.eval.Capsule
 * capsules} are immutable or opaque, and are not copied.
 */
public class Cloner {
  private final Map<ModuleType, ModuleType> types = Maps.newIdentityHashMap();
  private final Map<Module, Module> modules = Maps.newIdentityHashMap();

  private Cloner() {}

  /** Returns a deep copy of a module. */
  public static Module clone(Module module) {
    return new Cloner().cloneModule(module);
  }

  private ModuleType cloneType(ModuleType type) {
    final ModuleType existing = types.get(type);
    if (existing != null) {
      return existing;
    }
    final ModuleType type2 = new ModuleType(type.qualifiedName());
    // Register before copying attributes and methods, which may refer to
    // this type.
    types.put(type, type2);
    for (int i = 0; i < type.numAttributes(); i++) {
      type2.addAttribute(
          type.getAttributeName(i), type.getAttribute(i).copy(this::mapType));
    }
    for (Method method : type.methods()) {
      type2.addMethod(method.name, method.graph.copy(this::mapType));
    }
    return type2;
  }

  private Type mapType(Type type) {
    return type instanceof ModuleType ? cloneType((ModuleType) type) : type;
  }

  private Module cloneModule(Module module) {
    final Module existing = modules.get(module);
    if (existing != null) {
      return existing;
    }
    final Module module2 = new Module(cloneType(module.type()));
    modules.put(module, module2);
    for (String name : module.attrNames()) {
      module2.setAttr(name, cloneValue(module.attr(name)));
    }
    return module2;
  }

  private Object cloneValue(Object value) {
    if (value instanceof Module) {
      return cloneModule((Module) value);
    } else if (value instanceof Tensor) {
      return ((Tensor) value).copy();
    } else if (value instanceof List) {
      final ImmutableList.Builder<Object> list = ImmutableList.builder();
      for (Object element : (List<?>) value) {
        list.add(cloneValue(element));
      }
      return list.build();
    } else {
      return value;
    }
  }
}

// End Cloner.java
