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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.frost.eval.Module;
import net.hydromatic.frost.graph.Graph;
import net.hydromatic.frost.graph.Value;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on the graph after a
   * given phase, then calls the underlying tracer.
   */
  public static Tracer withOnGraph(
      Tracer tracer, Tracer.Phase phase, Consumer<Graph> consumer) {
    final Tracer.Phase expectedPhase = phase;
    return new DelegatingTracer(tracer) {
      @Override
      public void onGraph(Tracer.Phase phase, Graph graph) {
        if (phase == expectedPhase) {
          consumer.accept(graph);
        }
        super.onGraph(phase, graph);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each folded attribute
   * name, then calls the underlying tracer.
   */
  public static Tracer withOnFold(
      Tracer tracer, BiConsumer<Module, String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onFold(Module module, String attributeName, Value constant) {
        consumer.accept(module, attributeName);
        super.onFold(module, attributeName, constant);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each removed attribute
   * name, then calls the underlying tracer.
   */
  public static Tracer withOnPrune(
      Tracer tracer, BiConsumer<Module, String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onPrune(Module module, String attributeName) {
        consumer.accept(module, attributeName);
        super.onPrune(module, attributeName);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onGraph(Phase phase, Graph graph) {}

    @Override
    public void onFold(Module module, String attributeName, Value constant) {}

    @Override
    public void onPrune(Module module, String attributeName) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onGraph(Phase phase, Graph graph) {
      tracer.onGraph(phase, graph);
    }

    @Override
    public void onFold(Module module, String attributeName, Value constant) {
      tracer.onFold(module, attributeName, constant);
    }

    @Override
    public void onPrune(Module module, String attributeName) {
      tracer.onPrune(module, attributeName);
    }
  }
}

// End Tracers.java
