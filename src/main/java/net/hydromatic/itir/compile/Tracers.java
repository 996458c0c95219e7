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
package net.hydromatic.itir.compile;

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.itir.ast.Ir;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on the tree produced
   * by each pass with a given name, then calls the underlying tracer. */
  public static Tracer withOnPass(Tracer tracer, String pass,
      Consumer<Ir.Node> consumer) {
    final String expectedPass = pass;
    return new DelegatingTracer(tracer) {
      @Override public void onPass(String pass, int iteration, Ir.Node node) {
        if (pass.equals(expectedPass)) {
          consumer.accept(node);
        }
        super.onPass(pass, iteration, node);
      }
    };
  }

  /** Returns a tracer that performs the given action when a fixpoint loop
   * converges, then calls the underlying tracer. */
  public static Tracer withOnConverged(Tracer tracer,
      BiConsumer<String, Integer> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onConverged(String loop, int iterations) {
        consumer.accept(loop, iterations);
        super.onConverged(loop, iterations);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onPass(String pass, int iteration, Ir.Node node) {
    }

    @Override public void onConverged(String loop, int iterations) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onPass(String pass, int iteration, Ir.Node node) {
      tracer.onPass(pass, iteration, node);
    }

    @Override public void onConverged(String loop, int iterations) {
      tracer.onConverged(loop, iterations);
    }
  }
}

// End Tracers.java
