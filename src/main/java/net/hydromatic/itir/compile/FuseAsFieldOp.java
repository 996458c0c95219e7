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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Objects;
import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.ast.Shuttle;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Fuses nested field operators.
 *
 * <p>In {@code as_fieldop(λ(a, b) → e, d)(x, as_fieldop(s, d)(y, z))},
 * the inner field operator is evaluated on the same domain as the outer
 * one. If {@code e} dereferences {@code b} exactly once, and does not
 * otherwise use it, the call becomes
 * {@code as_fieldop(λ(a, p, q) → e[b := lift(s)(p, q)], d)(x, y, z)}.
 *
 * <p>Also fuses lifts: {@code deref(lift(f)(args))} becomes
 * {@code f(args)}. */
public class FuseAsFieldOp extends Shuttle {
  private final UidGenerator uids;

  private FuseAsFieldOp(UidGenerator uids) {
    this.uids = uids;
  }

  /** Fuses field operators and lifts in a tree. */
  @SuppressWarnings("unchecked")
  public static <N extends Ir.Node> N apply(N node, UidGenerator uids) {
    return (N) node.accept(new FuseAsFieldOp(uids));
  }

  @Override
  protected Ir.Expr visit(Ir.FunCall funCall) {
    final Ir.Expr e = super.visit(funCall);
    if (e.isCallTo("deref") && ((Ir.FunCall) e).args.size() == 1
        && ((Ir.FunCall) e).arg(0).isAppliedLift()) {
      final Ir.FunCall lifted = (Ir.FunCall) ((Ir.FunCall) e).arg(0);
      final Ir.FunCall lift = (Ir.FunCall) lifted.fun;
      return ir.call(lift.arg(0), lifted.args);
    }
    if (Matchers.isAppliedCallTo(e, "as_fieldop")) {
      Ir.FunCall call = (Ir.FunCall) e;
      for (int i = 0; i < call.args.size(); ) {
        final Ir.FunCall fused = fuse(call, i);
        if (fused == null) {
          ++i;
        } else {
          call = fused;
        }
      }
      return call;
    }
    return e;
  }

  /** Fuses the {@code i}th argument of an applied field operator, if
   * possible; returns null if not possible. */
  private Ir.@Nullable FunCall fuse(Ir.FunCall call, int i) {
    final Ir.FunCall fieldop = (Ir.FunCall) call.fun;
    final Ir.Expr arg = call.arg(i);
    if (!Matchers.isAppliedCallTo(arg, "as_fieldop")
        || !(fieldop.arg(0) instanceof Ir.Lambda)) {
      return null;
    }
    final Ir.Lambda stencil = (Ir.Lambda) fieldop.arg(0);
    if (stencil.params.size() != call.args.size()) {
      return null;
    }
    final Ir.FunCall inner = (Ir.FunCall) arg;
    final Ir.FunCall innerFieldop = (Ir.FunCall) inner.fun;
    if (!Objects.equals(domain(innerFieldop), domain(fieldop))
        && domain(innerFieldop) != null) {
      return null;
    }
    final String param = stencil.params.get(i).id;
    if (SymbolRefs.countFree(stencil.expr, param) != 1
        || !isDereferenced(stencil.expr, param)) {
      return null;
    }

    final ImmutableList.Builder<Ir.Sym> newParams = ImmutableList.builder();
    final ImmutableList.Builder<Ir.Expr> liftArgs = ImmutableList.builder();
    for (int j = 0; j < inner.args.size(); j++) {
      final String id = uids.get("__arg");
      newParams.add(ir.sym(id));
      liftArgs.add(ir.ref(id));
    }
    final Ir.Expr lifted =
        ir.call(ir.lift(innerFieldop.arg(0)), liftArgs.build());
    final Ir.Expr body =
        Replacer.substitute(ImmutableMap.of(param, lifted), stencil.expr);
    final List<Ir.Sym> params =
        splice(stencil.params, i, newParams.build());
    final Ir.Lambda stencil2 =
        ir.lambda(params, body.accept(this));
    final ImmutableList.Builder<Ir.Expr> fieldopArgs =
        ImmutableList.builder();
    fieldopArgs.add(stencil2);
    fieldopArgs.addAll(fieldop.args.subList(1, fieldop.args.size()));
    return ir.call(call.pos, call.type,
        ir.call(fieldop.pos, null, fieldop.fun, fieldopArgs.build()),
        splice(call.args, i, inner.args));
  }

  private static Ir.@Nullable Expr domain(Ir.FunCall fieldop) {
    return fieldop.args.size() > 1 ? fieldop.arg(1) : null;
  }

  /** Returns whether a free reference to {@code id} occurs as the argument
   * of {@code deref}. */
  private static boolean isDereferenced(Ir.Expr expr, String id) {
    final DerefFinder finder =
        new DerefFinder(ImmutableSet.of(), id, new boolean[1]);
    expr.accept(finder);
    return finder.found[0];
  }

  /** Looks for {@code deref(id)} where {@code id} is free. */
  private static class DerefFinder extends ScopedVisitor {
    final String id;
    final boolean[] found;

    DerefFinder(ImmutableSet<String> bound, String id, boolean[] found) {
      super(bound);
      this.id = id;
      this.found = found;
    }

    @Override
    protected ScopedVisitor push(ImmutableSet<String> bound) {
      return new DerefFinder(bound, id, found);
    }

    @Override
    protected void visit(Ir.FunCall funCall) {
      if (funCall.isCallTo("deref") && funCall.args.size() == 1
          && funCall.arg(0).isRef(id) && !bound.contains(id)) {
        found[0] = true;
      }
      super.visit(funCall);
    }
  }
}

// End FuseAsFieldOp.java
