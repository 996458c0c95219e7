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

import net.hydromatic.itir.ast.Ir;

/** Called on various events while the pass pipeline runs. */
public interface Tracer {
  /** Called after each pass of the pipeline with the tree it produced.
   *
   * @param pass Name of the pass, for example "InlineLambdas"
   * @param iteration Iteration of the enclosing fixpoint loop, starting at
   *   1, or 0 if the pass is not in a loop
   * @param node Tree produced by the pass
   */
  void onPass(String pass, int iteration, Ir.Node node);

  /** Called when a fixpoint loop has converged. */
  void onConverged(String loop, int iterations);
}

// End Tracer.java
