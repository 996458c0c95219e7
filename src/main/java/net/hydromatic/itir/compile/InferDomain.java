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
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.type.OffsetProvider;

/** Annotates each field operator with the domain on which it is
 * evaluated.
 *
 * <p>The expression of a {@code SetAt} statement is evaluated on the
 * statement's domain. A field operator that is an argument of another field
 * operator must be evaluated on the domain of the outer operator, extended
 * by the offsets at which the outer stencil accesses it.
 *
 * <p>All function definitions must have been inlined, because the offsets
 * are found by tracing the stencils. */
public class InferDomain {
  private final OffsetProvider offsetProvider;
  private final Map<String, String> symbolicDomainSizes;

  private InferDomain(OffsetProvider offsetProvider,
      Map<String, String> symbolicDomainSizes) {
    this.offsetProvider = offsetProvider;
    this.symbolicDomainSizes = symbolicDomainSizes;
  }

  /** Infers the domains of the field operators in a program. */
  public static Ir.Program apply(Ir.Program program,
      OffsetProvider offsetProvider, Map<String, String> symbolicDomainSizes) {
    final InferDomain inferDomain =
        new InferDomain(offsetProvider, symbolicDomainSizes);
    final ImmutableList.Builder<Ir.Stmt> body = ImmutableList.builder();
    for (Ir.Stmt stmt : program.body) {
      if (stmt instanceof Ir.SetAt) {
        final Ir.SetAt setAt = (Ir.SetAt) stmt;
        body.add(
            setAt.copy(inferDomain.infer(setAt.expr, setAt.domain),
                setAt.domain, setAt.target));
      } else {
        body.add(stmt);
      }
    }
    return program.copy(program.functionDefinitions, program.params,
        program.declarations, body.build());
  }

  /** Infers the domains of an expression that is evaluated on a given
   * domain. */
  public static Ir.Expr apply(Ir.Expr expr, Ir.FunCall domain,
      OffsetProvider offsetProvider, Map<String, String> symbolicDomainSizes) {
    return new InferDomain(offsetProvider, symbolicDomainSizes)
        .infer(expr, domain);
  }

  private Ir.Expr infer(Ir.Expr expr, Ir.FunCall domain) {
    if (expr.isCallTo("make_tuple")) {
      final Ir.FunCall call = (Ir.FunCall) expr;
      final ImmutableList.Builder<Ir.Expr> args = ImmutableList.builder();
      call.args.forEach(arg -> args.add(infer(arg, domain)));
      return call.copy(call.fun, args.build());
    }
    if (expr.isCallTo("if_") && ((Ir.FunCall) expr).args.size() == 3) {
      final Ir.FunCall call = (Ir.FunCall) expr;
      return call.copy(call.fun,
          ImmutableList.of(call.arg(0), infer(call.arg(1), domain),
              infer(call.arg(2), domain)));
    }
    if (!Matchers.isAppliedCallTo(expr, "as_fieldop")) {
      return expr;
    }
    final Ir.FunCall call = (Ir.FunCall) expr;
    final Ir.FunCall fieldop = (Ir.FunCall) call.fun;
    final Ir.Expr stencil = fieldop.arg(0);
    final Ir.FunCall actualDomain;
    final Ir.FunCall fieldop2;
    if (fieldop.args.size() > 1 && fieldop.arg(1) instanceof Ir.FunCall) {
      actualDomain = (Ir.FunCall) fieldop.arg(1);
      fieldop2 = fieldop;
    } else {
      actualDomain = domain;
      fieldop2 = ir.call(fieldop.pos, null, fieldop.fun,
          ImmutableList.of(stencil, domain));
    }

    final ImmutableList.Builder<String> names = ImmutableList.builder();
    for (int i = 0; i < call.args.size(); i++) {
      names.add("__in" + i);
    }
    final Map<String, Set<List<Object>>> shifts =
        TraceShifts.trace(stencil, names.build());
    final ImmutableList.Builder<Ir.Expr> args = ImmutableList.builder();
    for (int i = 0; i < call.args.size(); i++) {
      final Ir.Expr arg = call.arg(i);
      final Set<List<Object>> argShifts =
          shifts.getOrDefault("__in" + i, ImmutableSet.of());
      args.add(
          infer(arg,
              SymbolicDomain.accessed(actualDomain, argShifts,
                  offsetProvider, symbolicDomainSizes)));
    }
    return call.copy(fieldop2, args.build());
  }
}

// End InferDomain.java
