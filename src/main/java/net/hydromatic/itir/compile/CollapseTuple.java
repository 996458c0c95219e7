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
import java.util.List;
import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.ast.Shuttle;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Simplifies the construction of tuples followed by the extraction of
 * their components.
 *
 * <ul>
 *   <li>{@code tuple_get(i, make_tuple(e0, ..., en))} becomes {@code ei};
 *   <li>{@code make_tuple(tuple_get(0, t), ..., tuple_get(n - 1, t))}
 *     becomes {@code t}, provided that {@code t} is known to have {@code n}
 *     elements, or unconditionally if {@code ignoreTupleSize};
 *   <li>{@code tuple_get(i, if_(c, a, b))} becomes
 *     {@code if_(c, tuple_get(i, a), tuple_get(i, b))};
 *   <li>{@code tuple_get(i, let x = v in e)} becomes
 *     {@code let x = v in tuple_get(i, e)}.
 * </ul>
 */
public class CollapseTuple extends Shuttle {
  private final boolean ignoreTupleSize;

  private CollapseTuple(boolean ignoreTupleSize) {
    this.ignoreTupleSize = ignoreTupleSize;
  }

  /** Collapses tuples in a tree. */
  @SuppressWarnings("unchecked")
  public static <N extends Ir.Node> N apply(N node, boolean ignoreTupleSize) {
    return (N) node.accept(new CollapseTuple(ignoreTupleSize));
  }

  @Override
  protected Ir.Expr visit(Ir.FunCall funCall) {
    return collapse(super.visit(funCall));
  }

  private Ir.Expr collapse(Ir.Expr e) {
    if (e.isCallTo("tuple_get")) {
      return collapseTupleGet((Ir.FunCall) e);
    }
    if (e.isCallTo("make_tuple")) {
      return collapseMakeTuple((Ir.FunCall) e);
    }
    return e;
  }

  private Ir.Expr collapseTupleGet(Ir.FunCall call) {
    if (call.args.size() != 2) {
      return call;
    }
    final Integer index = Matchers.intValue(call.arg(0));
    if (index == null) {
      return call;
    }
    final Ir.Expr tuple = call.arg(1);
    if (tuple.isCallTo("make_tuple")) {
      final List<Ir.Expr> elements = ((Ir.FunCall) tuple).args;
      if (index >= 0 && index < elements.size()) {
        return elements.get(index);
      }
      return call;
    }
    if (tuple.isCallTo("if_")) {
      final Ir.FunCall ifCall = (Ir.FunCall) tuple;
      return ifCall.copy(ifCall.fun,
          ImmutableList.of(ifCall.arg(0),
              collapse(ir.call(call.fun, call.arg(0), ifCall.arg(1))),
              collapse(ir.call(call.fun, call.arg(0), ifCall.arg(2)))));
    }
    if (tuple.isLet()) {
      final Ir.FunCall let = (Ir.FunCall) tuple;
      final Ir.Lambda lambda = (Ir.Lambda) let.fun;
      return let.copy(
          lambda.copy(lambda.params,
              collapse(ir.call(call.fun, call.arg(0), lambda.expr))),
          let.args);
    }
    return call;
  }

  private Ir.Expr collapseMakeTuple(Ir.FunCall call) {
    Ir.@Nullable Expr first = null;
    for (int i = 0; i < call.args.size(); i++) {
      final Ir.Expr arg = call.arg(i);
      if (!arg.isCallTo("tuple_get")) {
        return call;
      }
      final Ir.FunCall get = (Ir.FunCall) arg;
      if (get.args.size() != 2) {
        return call;
      }
      final Integer index = Matchers.intValue(get.arg(0));
      if (index == null || index != i) {
        return call;
      }
      if (first == null) {
        first = get.arg(1);
      } else if (!first.equals(get.arg(1))) {
        return call;
      }
    }
    if (first == null) {
      return call;
    }
    if (ignoreTupleSize || Matchers.tupleArity(first) == call.args.size()) {
      return first;
    }
    return call;
  }
}

// End CollapseTuple.java
