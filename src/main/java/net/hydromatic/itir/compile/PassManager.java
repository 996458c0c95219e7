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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.function.UnaryOperator;
import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.type.OffsetProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs the sequence of passes that every backend applies to a program
 * before lowering it.
 *
 * <p>The stages are:
 *
 * <ol>
 * <li>merge lets, inline function definitions and prune the unused ones,
 *   normalize shifts;
 * <li>inline lambdas and lifts, then infer the domains of field operators;
 * <li>until a fixpoint: inline lambdas, fold constants, collapse tuples,
 *   fuse field operators;
 * <li>optionally, eliminate common subexpressions, merge lets, and inline
 *   lambdas again;
 * <li>optionally, infer types and extract temporaries;
 * <li>optionally collapse tuples without checking their size; then
 *   normalize shifts, fuse maps, and collapse list accesses;
 * <li>optionally, until a fixpoint: unroll reductions, collapse list
 *   accesses, normalize shifts;
 * <li>inline lambdas.
 * </ol>
 *
 * <p>A fixpoint loop that does not converge within
 * {@link Prop#MAX_FIXPOINT_ITERATIONS} iterations throws
 * {@link ConvergenceException}. */
public class PassManager {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(PassManager.class);

  private final OffsetProvider offsetProvider;
  private final PassOptions options;
  private final Tracer tracer;
  private final UidGenerator uids;

  private PassManager(OffsetProvider offsetProvider, PassOptions options,
      Tracer tracer, UidGenerator uids) {
    this.offsetProvider = requireNonNull(offsetProvider);
    this.options = requireNonNull(options);
    this.tracer = requireNonNull(tracer);
    this.uids = requireNonNull(uids);
  }

  /** Applies the common transforms to a program. */
  public static Ir.Program applyCommonTransforms(Ir.Program program,
      OffsetProvider offsetProvider, PassOptions options) {
    return applyCommonTransforms(program, offsetProvider, options,
        Tracers.empty());
  }

  /** Applies the common transforms to a program, notifying a tracer after
   * each pass. */
  public static Ir.Program applyCommonTransforms(Ir.Program program,
      OffsetProvider offsetProvider, PassOptions options, Tracer tracer) {
    final UidGenerator uids =
        new UidGenerator().reserve(SymbolRefs.all(program));
    final PassManager passManager =
        new PassManager(offsetProvider, options, tracer, uids);
    LOGGER.debug("Applying common transforms to program '{}' with options {}",
        program.id, options);
    final Ir.Program result = passManager.run(program);
    LOGGER.debug("Finished common transforms of program '{}'", program.id);
    return result;
  }

  private Ir.Program run(Ir.Program program) {
    LOGGER.debug("Stage 1: let merging and function inlining");
    program = pass("MergeLet", 0, program, MergeLet::apply);
    program = pass("InlineFundefs", 0, program, InlineFundefs::apply);
    program = pass("PruneUnreferencedFundefs", 0, program,
        InlineFundefs::pruneUnreferenced);
    program = pass("NormalizeShifts", 0, program,
        p -> NormalizeShifts.apply(p, offsetProvider));

    // Domain inference cannot see through local functions such as
    // "let f = λ(x) → ... in f(...)", so inline everything first.
    LOGGER.debug("Stage 2: inlining and domain inference");
    program = pass("InlineLambdas", 0, program,
        p -> InlineLambdas.apply(p, true, true, true));
    program = pass("InferDomain", 0, program,
        p -> InferDomain.apply(p, offsetProvider,
            options.symbolicDomainSizes));

    LOGGER.debug("Stage 3: inlining fixpoint");
    program = fixpoint("inline", program, options.maxFixpointIterations(),
        (p, i) -> {
          p = pass("InlineLambdas", i, p, q -> InlineLambdas.apply(q, true));
          p = pass("ConstantFolding", i, p, ConstantFolding::apply);
          // Runs inside the loop so that tuple_get calls around a folded
          // if_ are removed.
          p = pass("CollapseTuple", i, p, q -> CollapseTuple.apply(q, false));
          return pass("FuseAsFieldOp", i, p,
              q -> FuseAsFieldOp.apply(q, uids));
        }, tracer);

    if (options.commonSubexpressionElimination()) {
      LOGGER.debug("Stage 4: common subexpression elimination");
      program = pass("CommonSubexpressionElimination", 0, program,
          p -> CommonSubexpressionElimination.apply(p, uids));
      program = pass("MergeLet", 0, program, MergeLet::apply);
      program = pass("InlineLambdas", 0, program,
          p -> InlineLambdas.apply(p, true));
    }

    if (options.extractTemporaries()) {
      LOGGER.debug("Stage 5: temporary extraction");
      program = pass("TypeInference", 0, program,
          p -> TypeInference.infer(p, offsetProvider));
      program = pass("CreateGlobalTmps", 0, program,
          p -> CreateGlobalTmps.apply(p, offsetProvider, uids,
              options.temporaryExtractionHeuristic,
              options.symbolicDomainSizes));
    }

    LOGGER.debug("Stage 6: map fusion");
    if (options.unconditionallyCollapseTuples()) {
      program = pass("CollapseTuple", 0, program,
          p -> CollapseTuple.apply(p, true));
    }
    program = pass("NormalizeShifts", 0, program,
        p -> NormalizeShifts.apply(p, offsetProvider));
    program = pass("FuseMaps", 0, program, p -> FuseMaps.apply(p, uids));
    program = pass("CollapseListGet", 0, program, CollapseListGet::apply);

    if (options.unrollReduce()) {
      LOGGER.debug("Stage 7: reduction unrolling");
      program = fixpoint("unrollReduce", program,
          options.maxFixpointIterations(),
          (p, i) -> {
            p = pass("UnrollReduce", i, p,
                q -> UnrollReduce.apply(q, offsetProvider, uids));
            p = pass("CollapseListGet", i, p, CollapseListGet::apply);
            return pass("NormalizeShifts", i, p,
                q -> NormalizeShifts.apply(q, offsetProvider));
          }, tracer);
    }

    LOGGER.debug("Stage 8: final inlining");
    return pass("InlineLambdas", 0, program,
        p -> InlineLambdas.apply(p, true, false,
            options.forceInlineLambdaArgs()));
  }

  /** Applies a pass, and notifies the tracer. */
  private <N extends Ir.Node> N pass(String name, int iteration, N node,
      UnaryOperator<N> pass) {
    final N result = pass.apply(node);
    if (LOGGER.isTraceEnabled() && !result.equals(node)) {
      LOGGER.trace("{} changed tree:\n{}", name, result);
    }
    tracer.onPass(name, iteration, result);
    return result;
  }

  /** Applies a step repeatedly until the tree no longer changes.
   *
   * <p>The step is called at most {@code maxIterations} times; if the last
   * call still changes the tree, throws {@link ConvergenceException}.
   *
   * @param loop Name of the loop, for messages
   * @param node Initial tree
   * @param maxIterations Maximum number of iterations
   * @param step Step; its second argument is the iteration, starting at 1
   * @param tracer Tracer to notify on convergence
   * @return Tree on which the step is a no-op
   */
  public static <N extends Ir.Node> N fixpoint(String loop, N node,
      int maxIterations, Step<N> step, Tracer tracer) {
    checkArgument(maxIterations > 0, "maxIterations must be positive: %s",
        maxIterations);
    N previous = node;
    for (int i = 1; i <= maxIterations; i++) {
      final N next = step.apply(previous, i);
      if (next.equals(previous)) {
        LOGGER.debug("Loop '{}' converged after {} iterations", loop, i);
        tracer.onConverged(loop, i);
        return previous;
      }
      if (i == maxIterations) {
        throw new ConvergenceException(loop, maxIterations,
            ImmutableList.of(previous, next));
      }
      previous = next;
    }
    throw new AssertionError("unreachable");
  }

  /** Step of a fixpoint loop.
   *
   * @param <N> Node type */
  @FunctionalInterface
  public interface Step<N extends Ir.Node> {
    N apply(N node, int iteration);
  }
}

// End PassManager.java
