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
import java.util.Collections;
import java.util.function.Predicate;
import net.hydromatic.itir.ast.Ir;

/** Replaces calls that match a predicate with an expression.
 *
 * <p>A call is only replaced if it does not reference a symbol bound by a
 * lambda between the root of the tree and the call; such a call would
 * mean something different at the root. */
class Substituter extends ScopedShuttle {
  private final Predicate<Ir.FunCall> predicate;
  private final Ir.Expr replacement;

  private Substituter(ImmutableSet<String> bound,
      Predicate<Ir.FunCall> predicate, Ir.Expr replacement) {
    super(bound);
    this.predicate = predicate;
    this.replacement = replacement;
  }

  /** Replaces each call in {@code expr} that matches {@code predicate} and
   * is independent of local symbols with {@code replacement}. */
  static Ir.Expr replace(Ir.Expr expr, Predicate<Ir.FunCall> predicate,
      Ir.Expr replacement) {
    return expr.accept(
        new Substituter(ImmutableSet.of(), predicate, replacement));
  }

  /** Whether an expression references any of a set of symbols. */
  static boolean references(Ir.Expr expr, ImmutableSet<String> bound) {
    return !bound.isEmpty()
        && !Collections.disjoint(SymbolRefs.free(expr), bound);
  }

  @Override
  protected ScopedShuttle push(ImmutableSet<String> bound) {
    return new Substituter(bound, predicate, replacement);
  }

  @Override
  protected Ir.Expr visit(Ir.FunCall funCall) {
    if (predicate.test(funCall) && !references(funCall, bound)) {
      return replacement;
    }
    return super.visit(funCall);
  }
}

// End Substituter.java
