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

import static net.hydromatic.itir.ast.IrBuilder.ir;
import static net.hydromatic.itir.util.Static.concat;

import java.util.Collections;
import java.util.Set;
import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.ast.Shuttle;

/** Merges directly nested lets.
 *
 * <p>{@code (λ(a) → (λ(b) → e)(y))(x)} becomes
 * {@code (λ(a, b) → e)(x, y)}, provided that {@code y} does not reference
 * {@code a} and the two lambdas bind distinct names. */
public class MergeLet extends Shuttle {
  private static final MergeLet INSTANCE = new MergeLet();

  private MergeLet() {}

  /** Merges lets in a tree. */
  @SuppressWarnings("unchecked")
  public static <N extends Ir.Node> N apply(N node) {
    return (N) node.accept(INSTANCE);
  }

  @Override
  protected Ir.Expr visit(Ir.FunCall funCall) {
    Ir.Expr e = super.visit(funCall);
    while (e.isLet() && ((Ir.Lambda) ((Ir.FunCall) e).fun).expr.isLet()) {
      final Ir.FunCall outer = (Ir.FunCall) e;
      final Ir.Lambda outerLambda = (Ir.Lambda) outer.fun;
      final Ir.FunCall inner = (Ir.FunCall) outerLambda.expr;
      final Ir.Lambda innerLambda = (Ir.Lambda) inner.fun;
      final Set<String> outerIds = outerLambda.paramIds();
      if (!Collections.disjoint(outerIds, innerLambda.paramIds())
          || !Collections.disjoint(outerIds, SymbolRefs.free(inner.args))) {
        break;
      }
      e = ir.call(outer.pos, outer.type,
          ir.lambda(concat(outerLambda.params, innerLambda.params),
              innerLambda.expr),
          concat(outer.args, inner.args));
    }
    return e;
  }
}

// End MergeLet.java
