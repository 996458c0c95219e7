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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.ast.Shuttle;
import net.hydromatic.itir.type.OffsetProvider;

/** Brings shifts into canonical form.
 *
 * <ul>
 *   <li>{@code shift(b...)(shift(a...)(it))} becomes
 *     {@code shift(a..., b...)(it)};
 *   <li>adjacent integer shifts along the same cartesian offset are merged,
 *     so {@code shift(Iₒ, 1ₒ, Iₒ, 2ₒ)} becomes {@code shift(Iₒ, 3ₒ)};
 *   <li>integer shifts of zero along a cartesian offset are removed;
 *   <li>{@code shift()(it)} becomes {@code it}.
 * </ul>
 */
public class NormalizeShifts extends Shuttle {
  private final OffsetProvider offsetProvider;

  private NormalizeShifts(OffsetProvider offsetProvider) {
    this.offsetProvider = offsetProvider;
  }

  /** Normalizes shifts in a tree. */
  @SuppressWarnings("unchecked")
  public static <N extends Ir.Node> N apply(N node,
      OffsetProvider offsetProvider) {
    return (N) node.accept(new NormalizeShifts(offsetProvider));
  }

  @Override
  protected Ir.Expr visit(Ir.FunCall funCall) {
    final Ir.Expr e = super.visit(funCall);
    if (!Matchers.isAppliedCallTo(e, "shift")) {
      return e;
    }
    final Ir.FunCall call = (Ir.FunCall) e;
    if (call.args.size() != 1) {
      return call;
    }
    final Ir.FunCall shift = (Ir.FunCall) call.fun;
    List<Ir.Expr> offsets = shift.args;
    Ir.Expr it = call.arg(0);
    while (Matchers.isAppliedCallTo(it, "shift")
        && ((Ir.FunCall) it).args.size() == 1) {
      final Ir.FunCall inner = (Ir.FunCall) it;
      offsets = concat(((Ir.FunCall) inner.fun).args, offsets);
      it = inner.arg(0);
    }
    final List<Ir.Expr> normalized = simplify(offsets);
    if (normalized.isEmpty()) {
      return it;
    }
    if (it == call.arg(0) && normalized.equals(shift.args)) {
      return call;
    }
    return ir.call(call.pos, call.type,
        ir.call(shift.pos, shift.type, shift.fun, normalized),
        ImmutableList.of(it));
  }

  /** Merges adjacent integer shifts along the same cartesian offset and
   * removes zero shifts. Offsets that do not come in (tag, integer) pairs,
   * such as the partial shifts used with neighbor lists, are left alone. */
  private List<Ir.Expr> simplify(List<Ir.Expr> offsets) {
    if (offsets.size() % 2 != 0) {
      return offsets;
    }
    final List<Ir.Expr> list = new ArrayList<>();
    for (int i = 0; i < offsets.size(); i += 2) {
      final Ir.Expr tag = offsets.get(i);
      final Ir.Expr index = offsets.get(i + 1);
      final int n = list.size();
      if (isCartesian(tag) && index instanceof Ir.OffsetLiteral
          && ((Ir.OffsetLiteral) index).isInt()) {
        int value = ((Ir.OffsetLiteral) index).intValue();
        if (n >= 2 && list.get(n - 2).equals(tag)
            && list.get(n - 1) instanceof Ir.OffsetLiteral
            && ((Ir.OffsetLiteral) list.get(n - 1)).isInt()) {
          value += ((Ir.OffsetLiteral) list.get(n - 1)).intValue();
          list.remove(n - 1);
          list.remove(n - 2);
        }
        if (value != 0) {
          list.add(tag);
          list.add(
              value == ((Ir.OffsetLiteral) index).intValue()
                  ? index : ir.offset(value));
        }
      } else {
        list.add(tag);
        list.add(index);
      }
    }
    return list;
  }

  private boolean isCartesian(Ir.Expr tag) {
    return tag instanceof Ir.OffsetLiteral
        && !((Ir.OffsetLiteral) tag).isInt()
        && offsetProvider.dimension(((Ir.OffsetLiteral) tag).tag()) != null;
  }
}

// End NormalizeShifts.java
