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

import com.google.common.collect.ImmutableList;
import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.ast.Shuttle;
import net.hydromatic.itir.type.Connectivity;
import net.hydromatic.itir.type.OffsetProvider;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Unrolls reductions over neighbor lists whose length is known from the
 * offset provider.
 *
 * <p>{@code reduce(f, init)(neighbors(C2Eₒ, it))}, where {@code C2E} has
 * 3 neighbors, becomes
 * {@code f(f(f(init, list_get(0, ns)), list_get(1, ns)), list_get(2, ns))}
 * with {@code ns} the neighbor list. If the connectivity has skip values,
 * each step is guarded by {@code can_deref} and keeps the accumulator when
 * the neighbor is missing. */
public class UnrollReduce extends Shuttle {
  private final OffsetProvider offsetProvider;
  private final UidGenerator uids;

  private UnrollReduce(OffsetProvider offsetProvider, UidGenerator uids) {
    this.offsetProvider = offsetProvider;
    this.uids = uids;
  }

  /** Unrolls reductions in a tree. */
  @SuppressWarnings("unchecked")
  public static <N extends Ir.Node> N apply(N node,
      OffsetProvider offsetProvider, UidGenerator uids) {
    return (N) node.accept(new UnrollReduce(offsetProvider, uids));
  }

  @Override
  protected Ir.Expr visit(Ir.FunCall funCall) {
    final Ir.Expr e = super.visit(funCall);
    if (!Matchers.isAppliedCallTo(e, "reduce")) {
      return e;
    }
    final Ir.FunCall call = (Ir.FunCall) e;
    final Ir.FunCall reduce = (Ir.FunCall) call.fun;
    if (reduce.args.size() != 2 || call.args.isEmpty()) {
      return call;
    }

    // All neighbor lists must have the same length.
    Ir.@Nullable FunCall neighbors = null;
    @Nullable Connectivity connectivity = null;
    for (Ir.Expr arg : call.args) {
      final Ir.@Nullable FunCall n = findNeighbors(arg);
      if (n == null) {
        continue;
      }
      final @Nullable Connectivity c = connectivity(n);
      if (c == null) {
        return call;
      }
      if (connectivity == null) {
        neighbors = n;
        connectivity = c;
      } else if (c.maxNeighbors != connectivity.maxNeighbors) {
        return call;
      }
    }
    if (neighbors == null || connectivity == null) {
      return call;
    }

    final Ir.Expr fun = reduce.arg(0);
    Ir.Expr acc = reduce.arg(1);
    for (int k = 0; k < connectivity.maxNeighbors; k++) {
      final ImmutableList.Builder<Ir.Expr> args = ImmutableList.builder();
      if (connectivity.hasSkipValues) {
        final String accId = uids.get("__acc");
        args.add(ir.ref(accId));
        addListGets(args, k, call);
        final Ir.Expr canDeref =
            ir.canDeref(
                ir.call(ir.shift(neighbors.arg(0), ir.offset(k)),
                    neighbors.arg(1)));
        acc = ir.let(accId, acc,
            ir.ifThenElse(canDeref, ir.call(fun, args.build()),
                ir.ref(accId)));
      } else {
        args.add(acc);
        addListGets(args, k, call);
        acc = ir.call(fun, args.build());
      }
    }
    return acc;
  }

  private static void addListGets(ImmutableList.Builder<Ir.Expr> args, int k,
      Ir.FunCall call) {
    for (Ir.Expr arg : call.args) {
      args.add(ir.listGet(k, arg));
    }
  }

  private @Nullable Connectivity connectivity(Ir.FunCall neighbors) {
    final Ir.Expr tag = neighbors.arg(0);
    if (!(tag instanceof Ir.OffsetLiteral)
        || ((Ir.OffsetLiteral) tag).isInt()) {
      return null;
    }
    return offsetProvider.connectivity(((Ir.OffsetLiteral) tag).tag());
  }

  /** Finds the call to {@code neighbors} that determines the length of a
   * list argument, looking through {@code map_}. */
  private static Ir.@Nullable FunCall findNeighbors(Ir.Expr arg) {
    if (arg.isCallTo("neighbors") && ((Ir.FunCall) arg).args.size() == 2) {
      return (Ir.FunCall) arg;
    }
    if (Matchers.isAppliedCallTo(arg, "map_")) {
      for (Ir.Expr e : ((Ir.FunCall) arg).args) {
        final Ir.FunCall neighbors = findNeighbors(e);
        if (neighbors != null) {
          return neighbors;
        }
      }
    }
    return null;
  }
}

// End UnrollReduce.java
