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

import java.util.Set;
import net.hydromatic.frost.eval.Module;
import net.hydromatic.frost.type.ModuleType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes the attributes of the root module that are no longer used.
 *
 * <p>Removes both the value and the attribute descriptor. Only attributes of
 * the root are removed; an unused attribute of a submodule that is still
 * referenced stays.
 */
public abstract class Pruner {
  private static final Logger LOGGER = LoggerFactory.getLogger(Pruner.class);

  private Pruner() {}

  /** Removes every root attribute not in {@code keep}. Returns the number
   * removed. */
  public static int prune(FreezeContext context, Set<String> keep) {
    final Module root = context.root;
    final ModuleType type = root.type();
    int count = 0;
    for (String name : type.attributeNames()) {
      if (keep.contains(name)) {
        continue;
      }
      if (root.hasAttr(name)) {
        root.unsafeRemoveAttr(name);
      }
      type.unsafeRemoveAttribute(name);
      ++count;
      LOGGER.debug("removed attribute {} of {}", name, type.qualifiedName());
      context.tracer.onPrune(root, name);
    }
    return count;
  }
}

// End Pruner.java
