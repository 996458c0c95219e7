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

import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.ast.Shuttle;
import net.hydromatic.itir.ast.Visitor;
import net.hydromatic.itir.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Extracts subexpressions that occur more than once in the same scope
 * into a let.
 *
 * <p>A scope is the body of a lambda or function definition, or the
 * expression of a {@code SetAt} statement. A call is a candidate if it is
 * fully applied and does not reference symbols bound within the scope.
 * Occurrences in the branches of {@code if_} are not counted, because
 * extracting them would evaluate them unconditionally. The largest
 * repeated candidate is extracted first, into a symbol named "_csN". */
public class CommonSubexpressionElimination extends Shuttle {
  private final UidGenerator uids;

  private CommonSubexpressionElimination(UidGenerator uids) {
    this.uids = uids;
  }

  /** Eliminates common subexpressions in a tree. */
  @SuppressWarnings("unchecked")
  public static <N extends Ir.Node> N apply(N node, UidGenerator uids) {
    return (N) node.accept(new CommonSubexpressionElimination(uids));
  }

  @Override
  protected Ir.Expr visit(Ir.Lambda lambda) {
    final Ir.Lambda lambda2 = (Ir.Lambda) super.visit(lambda);
    return lambda2.copy(lambda2.params, extract(lambda2.expr));
  }

  @Override
  protected Ir.FunctionDefinition visit(
      Ir.FunctionDefinition functionDefinition) {
    final Ir.FunctionDefinition f = super.visit(functionDefinition);
    return f.copy(f.params, extract(f.expr));
  }

  @Override
  protected Ir.SetAt visit(Ir.SetAt setAt) {
    final Ir.SetAt setAt2 = super.visit(setAt);
    return setAt2.copy(extract(setAt2.expr), setAt2.domain, setAt2.target);
  }

  /** Repeatedly extracts the largest common subexpression of an
   * expression. */
  private Ir.Expr extract(Ir.Expr expr) {
    for (;;) {
      final Map<Key, Integer> counts = new LinkedHashMap<>();
      expr.accept(new Counter(ImmutableSet.of(), counts));
      @Nullable Key best = null;
      int bestSize = 0;
      for (Map.Entry<Key, Integer> entry : counts.entrySet()) {
        if (entry.getValue() > 1) {
          final int size = size(entry.getKey().expr);
          if (size > bestSize) {
            best = entry.getKey();
            bestSize = size;
          }
        }
      }
      if (best == null) {
        return expr;
      }
      final String id = uids.get("_cs");
      final Key key = best;
      final Ir.Expr body =
          Substituter.replace(expr, e -> key.equals(new Key(e)), ir.ref(id));
      expr = ir.let(id, best.expr, body);
    }
  }

  /** Returns the number of nodes in a tree. */
  private static int size(Ir.Expr expr) {
    final int[] count = {0};
    expr.accept(
        new Visitor() {
          @Override
          protected void visit(Ir.SymRef symRef) {
            ++count[0];
          }

          @Override
          protected void visit(Ir.Literal literal) {
            ++count[0];
          }

          @Override
          protected void visit(Ir.OffsetLiteral offsetLiteral) {
            ++count[0];
          }

          @Override
          protected void visit(Ir.AxisLiteral axisLiteral) {
            ++count[0];
          }

          @Override
          protected void visit(Ir.Lambda lambda) {
            ++count[0];
            super.visit(lambda);
          }

          @Override
          protected void visit(Ir.FunCall funCall) {
            ++count[0];
            super.visit(funCall);
          }
        });
    return count[0];
  }

  /** Key for an expression, by structure and type. */
  private static class Key {
    final Ir.Expr expr;
    final @Nullable Type type;

    Key(Ir.Expr expr) {
      this.expr = expr;
      this.type = expr.type;
    }

    @Override
    public int hashCode() {
      return expr.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Key
              && expr.equals(((Key) o).expr)
              && Objects.equals(type, ((Key) o).type);
    }
  }

  /** Counts occurrences of candidate expressions. */
  private static class Counter extends ScopedVisitor {
    final Map<Key, Integer> counts;

    Counter(ImmutableSet<String> bound, Map<Key, Integer> counts) {
      super(bound);
      this.counts = counts;
    }

    @Override
    protected ScopedVisitor push(ImmutableSet<String> bound) {
      return new Counter(bound, counts);
    }

    @Override
    protected void visit(Ir.FunCall funCall) {
      if (!Substituter.references(funCall, bound)) {
        counts.merge(new Key(funCall), 1, Integer::sum);
      }
      visitChildren(funCall);
    }

    /** Visits the children of a call, but does not count a partial
     * application such as {@code shift(Iₒ, 1ₒ)} in {@code shift(Iₒ, 1ₒ)(x)}
     * as a candidate. */
    private void visitChildren(Ir.FunCall funCall) {
      if (funCall.fun instanceof Ir.FunCall) {
        visitChildren((Ir.FunCall) funCall.fun);
      } else {
        funCall.fun.accept(this);
      }
      if (funCall.isCallTo("if_") && funCall.args.size() == 3) {
        funCall.arg(0).accept(this);
      } else {
        funCall.args.forEach(this::accept);
      }
    }
  }
}

// End CommonSubexpressionElimination.java
