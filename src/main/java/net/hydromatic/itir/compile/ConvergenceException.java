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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.itir.ast.Ir;

/** Thrown when a bounded fixpoint loop of the pass pipeline does not reach
 * a fixpoint within its iteration limit.
 *
 * <p>Unlike a {@link CompileException}, this indicates a bug in one of the
 * passes, which keep rewriting the tree instead of converging. */
public class ConvergenceException extends RuntimeException {
  /** Name of the loop that did not converge. */
  public final String loopName;
  /** Maximum number of iterations. */
  public final int maxIterations;
  /** The trees produced by the last few iterations, oldest first. */
  public final List<Ir.Node> lastTrees;

  public ConvergenceException(String loopName, int maxIterations,
      List<? extends Ir.Node> lastTrees) {
    super("Loop '" + loopName + "' did not converge after " + maxIterations
        + " iterations; last trees:\n" + describe(lastTrees));
    this.loopName = loopName;
    this.maxIterations = maxIterations;
    this.lastTrees = ImmutableList.copyOf(lastTrees);
  }

  private static String describe(List<? extends Ir.Node> trees) {
    final StringBuilder b = new StringBuilder();
    for (Ir.Node tree : trees) {
      b.append(tree).append('\n');
    }
    return b.toString();
  }
}

// End ConvergenceException.java
