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
import static net.hydromatic.itir.util.Static.splice;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.ast.Shuttle;

/** Fuses nested {@code map_} calls, and {@code reduce} over {@code map_}.
 *
 * <p>{@code map_(f)(a, map_(g)(b, c))} becomes
 * {@code map_(λ(x, y, z) → f(x, g(y, z)))(a, b, c)}, and
 * {@code reduce(f, init)(map_(g)(b))} becomes
 * {@code reduce(λ(acc, y) → f(acc, g(y)), init)(b)}. The new parameters are
 * named using a generator of unique ids. */
public class FuseMaps extends Shuttle {
  private final UidGenerator uids;

  private FuseMaps(UidGenerator uids) {
    this.uids = uids;
  }

  /** Fuses maps in a tree. */
  @SuppressWarnings("unchecked")
  public static <N extends Ir.Node> N apply(N node, UidGenerator uids) {
    return (N) node.accept(new FuseMaps(uids));
  }

  @Override
  protected Ir.Expr visit(Ir.FunCall funCall) {
    Ir.Expr e = super.visit(funCall);
    for (;;) {
      final Ir.Expr e2 = fuse(e);
      if (e2 == e) {
        return e;
      }
      e = e2;
    }
  }

  private Ir.Expr fuse(Ir.Expr e) {
    final boolean isMap = Matchers.isAppliedCallTo(e, "map_");
    final boolean isReduce = Matchers.isAppliedCallTo(e, "reduce");
    if (!isMap && !isReduce) {
      return e;
    }
    final Ir.FunCall call = (Ir.FunCall) e;
    for (int i = 0; i < call.args.size(); i++) {
      final Ir.Expr arg = call.arg(i);
      if (Matchers.isAppliedCallTo(arg, "map_")) {
        return isMap ? fuseMap(call, i) : fuseReduce(call, i);
      }
    }
    return e;
  }

  /** Fuses the {@code i}th argument of {@code map_(f)(args)}, which is
   * itself an applied map. */
  private Ir.Expr fuseMap(Ir.FunCall call, int i) {
    final Ir.FunCall map = (Ir.FunCall) call.fun;
    final Ir.FunCall inner = (Ir.FunCall) call.arg(i);
    final Ir.Expr f = map.arg(0);
    final Ir.Expr g = ((Ir.FunCall) inner.fun).arg(0);
    final Fused fused = fused(ImmutableList.of(), f, call.args, i, g,
        inner.args);
    return ir.call(ir.call(map.pos, null, map.fun, ImmutableList.of(fused.fun)),
        fused.args);
  }

  /** Fuses the {@code i}th argument of {@code reduce(f, init)(args)}, which
   * is an applied map. */
  private Ir.Expr fuseReduce(Ir.FunCall call, int i) {
    final Ir.FunCall reduce = (Ir.FunCall) call.fun;
    final Ir.FunCall inner = (Ir.FunCall) call.arg(i);
    final Ir.Expr f = reduce.arg(0);
    final Ir.Expr g = ((Ir.FunCall) inner.fun).arg(0);
    final Ir.Sym acc = ir.sym(uids.get("__acc"));
    final Fused fused = fused(ImmutableList.of(acc), f, call.args, i, g,
        inner.args);
    return ir.call(
        ir.call(reduce.pos, null, reduce.fun,
            ImmutableList.of(fused.fun, reduce.arg(1))),
        fused.args);
  }

  /** Builds the function
   * {@code λ(leading, x..., y..., z...) → f(leading, x..., g(y...), z...)}
   * and its arguments, where {@code g(y...)} replaces the {@code i}th
   * argument. */
  private Fused fused(List<Ir.Sym> leading, Ir.Expr f, List<Ir.Expr> args,
      int i, Ir.Expr g, List<Ir.Expr> innerArgs) {
    final ImmutableList.Builder<Ir.Sym> outerParams = ImmutableList.builder();
    final ImmutableList.Builder<Ir.Sym> innerParams = ImmutableList.builder();
    for (int j = 0; j < args.size(); j++) {
      outerParams.add(ir.sym(uids.get("__map")));
    }
    for (int j = 0; j < innerArgs.size(); j++) {
      innerParams.add(ir.sym(uids.get("__map")));
    }
    final List<Ir.Sym> xs = outerParams.build();
    final List<Ir.Sym> ys = innerParams.build();
    final List<Ir.Expr> gArgs = refs(ys);
    final Ir.Expr gCall = call(g, gArgs);
    final ImmutableList.Builder<Ir.Expr> fArgs = ImmutableList.builder();
    fArgs.addAll(refs(leading));
    fArgs.addAll(splice(refs(xs), i, ImmutableList.of(gCall)));
    final ImmutableList.Builder<Ir.Sym> params = ImmutableList.builder();
    params.addAll(leading);
    params.addAll(xs.subList(0, i));
    params.addAll(ys);
    params.addAll(xs.subList(i + 1, xs.size()));
    return new Fused(ir.lambda(params.build(), call(f, fArgs.build())),
        splice(args, i, innerArgs));
  }

  /** Calls a function. If the function is a lambda, inlines it without
   * duplicating the evaluation of arguments. */
  private static Ir.Expr call(Ir.Expr fun, List<Ir.Expr> args) {
    final Ir.FunCall call = ir.call(fun, args);
    return fun instanceof Ir.Lambda
        ? InlineLambdas.inlineLambda(call, true, false, false)
        : call;
  }

  private static List<Ir.Expr> refs(List<Ir.Sym> syms) {
    final ImmutableList.Builder<Ir.Expr> refs = ImmutableList.builder();
    syms.forEach(s -> refs.add(ir.ref(s.id)));
    return refs.build();
  }

  /** Fused function and its arguments. */
  private static class Fused {
    final Ir.Lambda fun;
    final List<Ir.Expr> args;

    Fused(Ir.Lambda fun, List<Ir.Expr> args) {
      this.fun = fun;
      this.args = args;
    }
  }
}

// End FuseMaps.java
