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

import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.ast.Shuttle;

/** Replaces element access on neighbor and constant lists.
 *
 * <p>{@code list_get(i, neighbors(o, it))} becomes
 * {@code deref(shift(o, i)(it))}, and
 * {@code list_get(i, make_const_list(x))} becomes {@code x}. */
public class CollapseListGet extends Shuttle {
  private static final CollapseListGet INSTANCE = new CollapseListGet();

  private CollapseListGet() {}

  @SuppressWarnings("unchecked")
  public static <N extends Ir.Node> N apply(N node) {
    return (N) node.accept(INSTANCE);
  }

  @Override
  protected Ir.Expr visit(Ir.FunCall funCall) {
    final Ir.Expr e = super.visit(funCall);
    if (!e.isCallTo("list_get") || ((Ir.FunCall) e).args.size() != 2) {
      return e;
    }
    final Ir.FunCall call = (Ir.FunCall) e;
    final Integer index = Matchers.intValue(call.arg(0));
    if (index == null) {
      return call;
    }
    final Ir.Expr list = call.arg(1);
    if (list.isCallTo("neighbors")) {
      final Ir.FunCall neighbors = (Ir.FunCall) list;
      return ir.deref(
          ir.call(ir.shift(neighbors.arg(0), ir.offset(index)),
              neighbors.arg(1)));
    }
    if (list.isCallTo("make_const_list")) {
      return ((Ir.FunCall) list).arg(0);
    }
    return call;
  }
}

// End CollapseListGet.java
