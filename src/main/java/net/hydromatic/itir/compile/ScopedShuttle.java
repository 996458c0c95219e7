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

import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.ast.Shuttle;

/** Shuttle that keeps track of which symbols are bound by enclosing
 * lambdas and functions. */
abstract class ScopedShuttle extends Shuttle {
  /** Symbols bound within the tree being visited, enclosing the current
   * node. */
  final ImmutableSet<String> bound;

  /** Creates a ScopedShuttle. */
  protected ScopedShuttle(ImmutableSet<String> bound) {
    this.bound = bound;
  }

  /** Creates a shuttle the same as this but with a new set of bound
   * symbols. */
  protected abstract ScopedShuttle push(ImmutableSet<String> bound);

  /** Creates a shuttle the same as this but with additional bound
   * symbols. */
  protected ScopedShuttle bind(Collection<String> ids) {
    if (bound.containsAll(ids)) {
      return this;
    }
    return push(
        ImmutableSet.<String>builder().addAll(bound).addAll(ids).build());
  }

  @Override
  protected Ir.Expr visit(Ir.Lambda lambda) {
    return lambda.copy(lambda.params,
        lambda.expr.accept(bind(lambda.paramIds())));
  }

  @Override
  protected Ir.FunctionDefinition visit(
      Ir.FunctionDefinition functionDefinition) {
    final ImmutableSet.Builder<String> ids = ImmutableSet.builder();
    functionDefinition.params.forEach(p -> ids.add(p.id));
    return functionDefinition.copy(functionDefinition.params,
        functionDefinition.expr.accept(bind(ids.build())));
  }
}

// End ScopedShuttle.java
