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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.itir.ast.IrBuilder.ir;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.ast.Shuttle;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Inlines lambdas that are applied to arguments.
 *
 * <p>A call {@code (λ(x, y) → e)(a, b)} becomes {@code e} with {@code a}
 * substituted for {@code x} and {@code b} for {@code y}.
 *
 * <p>In opcount-preserving mode, a parameter is only inlined if it is
 * referenced exactly once in the body, or if its argument is a reference or
 * a literal (and therefore cheap to duplicate). Parameters that are not
 * inlined remain as an outer lambda applied to their arguments. */
public class InlineLambdas extends Shuttle {
  private final boolean opcountPreserving;
  private final boolean forceInlineLift;
  private final boolean forceInlineLambdaArgs;

  private InlineLambdas(boolean opcountPreserving, boolean forceInlineLift,
      boolean forceInlineLambdaArgs) {
    this.opcountPreserving = opcountPreserving;
    this.forceInlineLift = forceInlineLift;
    this.forceInlineLambdaArgs = forceInlineLambdaArgs;
  }

  /** Inlines all applied lambdas in a tree, bottom up.
   *
   * @param node Tree
   * @param opcountPreserving Whether to avoid duplicating the evaluation of
   *   arguments
   * @param forceInlineLift Whether to inline applied lifts even if this
   *   duplicates them
   * @param forceInlineLambdaArgs Whether to inline lambda arguments even if
   *   this duplicates them
   * @return Tree with lambdas inlined
   */
  @SuppressWarnings("unchecked")
  public static <N extends Ir.Node> N apply(N node, boolean opcountPreserving,
      boolean forceInlineLift, boolean forceInlineLambdaArgs) {
    return (N) node.accept(
        new InlineLambdas(opcountPreserving, forceInlineLift,
            forceInlineLambdaArgs));
  }

  /** Inlines all applied lambdas in a tree, with the default options. */
  public static <N extends Ir.Node> N apply(N node,
      boolean opcountPreserving) {
    return apply(node, opcountPreserving, false, false);
  }

  @Override
  protected Ir.Expr visit(Ir.FunCall funCall) {
    final Ir.Expr e = super.visit(funCall);
    if (e instanceof Ir.FunCall && ((Ir.FunCall) e).fun instanceof Ir.Lambda) {
      return inlineLambda((Ir.FunCall) e, opcountPreserving, forceInlineLift,
          forceInlineLambdaArgs);
    }
    return e;
  }

  /** Inlines a single call to a lambda. Does not inline lambdas that occur
   * within the arguments or the body. */
  public static Ir.Expr inlineLambda(Ir.FunCall call,
      boolean opcountPreserving, boolean forceInlineLift,
      boolean forceInlineLambdaArgs) {
    checkArgument(call.fun instanceof Ir.Lambda, "not a lambda call: %s",
        call);
    final Ir.Lambda lambda = (Ir.Lambda) call.fun;
    checkArgument(lambda.params.size() == call.args.size(),
        "wrong number of arguments to %s", lambda);
    final int n = lambda.params.size();
    final boolean[] eligible = new boolean[n];
    final @Nullable Map<String, Integer> refCounts =
        opcountPreserving ? SymbolRefs.countFree(lambda.expr) : null;
    for (int i = 0; i < n; i++) {
      final Ir.Expr arg = call.arg(i);
      eligible[i] = true;
      if (refCounts != null
          && refCounts.getOrDefault(lambda.params.get(i).id, 0) != 1
          && !(arg instanceof Ir.SymRef || arg.isLiteral())) {
        eligible[i] = false;
      }
      if (forceInlineLift && arg.isAppliedLift()) {
        eligible[i] = true;
      }
      if (forceInlineLambdaArgs && arg instanceof Ir.Lambda) {
        eligible[i] = true;
      }
    }

    final Map<String, Ir.Expr> substitution = new LinkedHashMap<>();
    final ImmutableList.Builder<Ir.Sym> keptParams = ImmutableList.builder();
    final ImmutableList.Builder<Ir.Expr> keptArgs = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      if (eligible[i]) {
        substitution.put(lambda.params.get(i).id, call.arg(i));
      } else {
        keptParams.add(lambda.params.get(i));
        keptArgs.add(call.arg(i));
      }
    }
    if (substitution.isEmpty() && n > 0) {
      return call;
    }
    final List<Ir.Sym> outerParams = keptParams.build();
    if (outerParams.isEmpty()) {
      return Replacer.substitute(substitution, lambda.expr);
    }

    // The parameters that are not inlined will enclose the substituted
    // arguments. Rename any of them that an argument references.
    final Set<String> argFree = SymbolRefs.free(substitution.values());
    final Set<String> used = new HashSet<>(argFree);
    used.addAll(SymbolRefs.all(lambda));
    final ImmutableList.Builder<Ir.Sym> newParams = ImmutableList.builder();
    for (Ir.Sym param : outerParams) {
      if (argFree.contains(param.id)) {
        String id = param.id;
        while (used.contains(id)) {
          id += "_";
        }
        used.add(id);
        substitution.put(param.id, ir.ref(id, param.type));
        newParams.add(ir.sym(param.pos, id, param.type));
      } else {
        newParams.add(param);
      }
    }
    final Ir.Expr body = Replacer.substitute(substitution, lambda.expr);
    return ir.call(call.pos, call.type,
        ir.lambda(newParams.build(), body), keptArgs.build());
  }
}

// End InlineLambdas.java
