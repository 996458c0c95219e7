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
import static net.hydromatic.itir.util.Static.append;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.type.DeferredType;
import net.hydromatic.itir.type.IteratorType;
import net.hydromatic.itir.type.OffsetProvider;
import net.hydromatic.itir.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Extracts applied lifts from stencil closures into temporaries.
 *
 * <p>A closure {@code out ← (λ(x) → e[lift(f)(x)])(inp) @ d} becomes two
 * closures:
 *
 * <pre>{@code
 * __tmp1 ← (λ(x) → f(x))(inp) @ d';
 * out ← (λ(x, __tmp1) → e[__tmp1])(inp, __tmp1) @ d;
 * }</pre>
 *
 * <p>and the program declares the temporary {@code __tmp1}. Its domain
 * {@code d'} is {@code d} extended by the offsets at which the consumer
 * accesses it, and its element type is the element type of the lifted
 * iterator. The program must have been typed by {@link TypeInference};
 * a lift whose element type is not known is an error.
 *
 * <p>Only lifts that do not reference symbols bound inside the stencil are
 * extracted. A heuristic may further restrict which lifts are
 * extracted. */
public class CreateGlobalTmps {
  private final OffsetProvider offsetProvider;
  private final UidGenerator uids;
  private final @Nullable Function<Ir.StencilClosure, Predicate<Ir.Expr>>
      heuristic;
  private final Map<String, String> symbolicDomainSizes;
  private final List<Ir.Temporary> temporaries = new ArrayList<>();

  private CreateGlobalTmps(OffsetProvider offsetProvider, UidGenerator uids,
      @Nullable Function<Ir.StencilClosure, Predicate<Ir.Expr>> heuristic,
      Map<String, String> symbolicDomainSizes) {
    this.offsetProvider = offsetProvider;
    this.uids = uids;
    this.heuristic = heuristic;
    this.symbolicDomainSizes = symbolicDomainSizes;
  }

  /** Extracts temporaries from a program.
   *
   * @param program Typed program
   * @param offsetProvider Offset provider
   * @param uids Generator of names for temporaries
   * @param heuristic Given a closure, returns a predicate that decides
   *   whether to extract an applied lift; if null, all eligible lifts are
   *   extracted
   * @param symbolicDomainSizes Size of each unstructured dimension, as an
   *   expression; required if a temporary is accessed via a connectivity
   * @return Program with temporaries
   */
  public static Ir.Program apply(Ir.Program program,
      OffsetProvider offsetProvider, UidGenerator uids,
      @Nullable Function<Ir.StencilClosure, Predicate<Ir.Expr>> heuristic,
      Map<String, String> symbolicDomainSizes) {
    checkArgument(program.type != null,
        "program must be typed before temporaries are extracted");
    final CreateGlobalTmps createGlobalTmps =
        new CreateGlobalTmps(offsetProvider, uids, heuristic,
            symbolicDomainSizes);
    final List<Ir.Stmt> body = new ArrayList<>();
    for (Ir.Stmt stmt : program.body) {
      if (stmt instanceof Ir.StencilClosure) {
        createGlobalTmps.split((Ir.StencilClosure) stmt, body);
      } else {
        body.add(stmt);
      }
    }
    if (createGlobalTmps.temporaries.isEmpty()) {
      return program;
    }
    return program.copy(program.functionDefinitions, program.params,
        ImmutableList.<Ir.Temporary>builder()
            .addAll(program.declarations)
            .addAll(createGlobalTmps.temporaries)
            .build(),
        body);
  }

  /** Splits a closure into closures that compute temporaries, followed by
   * a closure that reads them. Adds the closures to {@code body}. */
  private void split(Ir.StencilClosure closure, List<Ir.Stmt> body) {
    if (!(closure.stencil instanceof Ir.Lambda)) {
      body.add(closure);
      return;
    }
    final Ir.Lambda stencil = (Ir.Lambda) closure.stencil;
    final Predicate<Ir.Expr> predicate =
        heuristic == null ? e -> true : heuristic.apply(closure);
    final Ir.@Nullable FunCall lifted = findLift(stencil.expr, predicate);
    if (lifted == null) {
      body.add(closure);
      return;
    }

    // The closure that reads the temporary.
    final String tmp = uids.get("__tmp");
    final Ir.Expr consumerBody =
        Substituter.replace(stencil.expr, lifted::equals, ir.ref(tmp));
    final Ir.StencilClosure consumer =
        closure.copy(closure.domain,
            ir.lambda(append(stencil.params, ir.sym(tmp)), consumerBody),
            closure.output, append(closure.inputs, ir.ref(tmp)));

    // The closure that computes the temporary, on every position where
    // the consumer reads it.
    final Set<List<Object>> shifts =
        TraceShifts.trace(consumer).getOrDefault(tmp, ImmutableSet.of());
    final Ir.FunCall domain =
        SymbolicDomain.accessed(closure.domain, shifts, offsetProvider,
            symbolicDomainSizes);
    final Set<String> free = SymbolRefs.free(lifted);
    final ImmutableList.Builder<Ir.Sym> params = ImmutableList.builder();
    final ImmutableList.Builder<Ir.SymRef> inputs = ImmutableList.builder();
    for (int i = 0; i < stencil.params.size(); i++) {
      if (free.contains(stencil.params.get(i).id)) {
        params.add(stencil.params.get(i));
        inputs.add(closure.inputs.get(i));
      }
    }
    final Ir.FunCall lift = (Ir.FunCall) lifted.fun;
    final Ir.StencilClosure producer =
        ir.closure(domain,
            ir.lambda(params.build(), ir.call(lift.arg(0), lifted.args)),
            ir.ref(tmp), inputs.build());
    final @Nullable Type dtype = elementType(lifted);
    if (dtype == null) {
      throw new TypeInference.TypeException("cannot derive element type of "
          + "temporary " + tmp + " from " + lifted, lifted.pos);
    }
    temporaries.add(ir.temporary(tmp, domain, dtype));

    split(producer, body);
    split(consumer, body);
  }

  /** Returns the element type of a lifted iterator, or null if it is not
   * known. */
  private static @Nullable Type elementType(Ir.Expr lifted) {
    if (!(lifted.type instanceof IteratorType)) {
      return null;
    }
    final Type elementType = ((IteratorType) lifted.type).elementType;
    return elementType instanceof DeferredType ? null : elementType;
  }

  /** Finds the outermost applied lift that can be extracted: it satisfies
   * the predicate, and does not reference symbols bound inside the
   * stencil. */
  private static Ir.@Nullable FunCall findLift(Ir.Expr expr,
      Predicate<Ir.Expr> predicate) {
    final List<Ir.FunCall> found = new ArrayList<>();
    expr.accept(new LiftFinder(ImmutableSet.of(), predicate, found));
    return found.isEmpty() ? null : found.get(0);
  }

  /** Visitor that finds extractable lifts, outermost first. */
  private static class LiftFinder extends ScopedVisitor {
    final Predicate<Ir.Expr> predicate;
    final List<Ir.FunCall> found;

    LiftFinder(ImmutableSet<String> bound, Predicate<Ir.Expr> predicate,
        List<Ir.FunCall> found) {
      super(bound);
      this.predicate = predicate;
      this.found = found;
    }

    @Override
    protected ScopedVisitor push(ImmutableSet<String> bound) {
      return new LiftFinder(bound, predicate, found);
    }

    @Override
    protected void visit(Ir.FunCall funCall) {
      if (!found.isEmpty()) {
        return;
      }
      if (funCall.isAppliedLift()
          && Collections.disjoint(SymbolRefs.free(funCall), bound)
          && predicate.test(funCall)) {
        found.add(funCall);
        return;
      }
      super.visit(funCall);
    }
  }
}

// End CreateGlobalTmps.java
