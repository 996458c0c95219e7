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
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import net.hydromatic.itir.ast.Ir;

/** Inlines the top-level function definitions of a program, and removes
 * those that are no longer referenced. */
public abstract class InlineFundefs {
  private InlineFundefs() {}

  /** Replaces each free reference to a function definition with the
   * equivalent lambda.
   *
   * <p>Function definitions that call other function definitions are
   * expanded first. A recursive function definition is left as a
   * reference. */
  public static Ir.Program apply(Ir.Program program) {
    if (program.functionDefinitions.isEmpty()) {
      return program;
    }
    final Map<String, Ir.FunctionDefinition> fundefs = new LinkedHashMap<>();
    program.functionDefinitions.forEach(f -> fundefs.put(f.id, f));
    final Map<String, Ir.Lambda> expanded = new HashMap<>();
    for (String id : fundefs.keySet()) {
      expand(id, fundefs, expanded, new ArrayDeque<>());
    }
    return Replacer.substitute(expanded, program);
  }

  private static Ir.Lambda expand(String id,
      Map<String, Ir.FunctionDefinition> fundefs,
      Map<String, Ir.Lambda> expanded, Deque<String> stack) {
    final Ir.Lambda cached = expanded.get(id);
    if (cached != null) {
      return cached;
    }
    stack.push(id);
    final Ir.Lambda lambda = fundefs.get(id).asLambda();
    final Map<String, Ir.Expr> substitution = new HashMap<>();
    for (String ref : SymbolRefs.free(lambda)) {
      if (fundefs.containsKey(ref) && !stack.contains(ref)) {
        substitution.put(ref, expand(ref, fundefs, expanded, stack));
      }
    }
    stack.pop();
    final Ir.Lambda result = Replacer.substitute(substitution, lambda);
    expanded.put(id, result);
    return result;
  }

  /** Removes function definitions that are not referenced, directly or
   * indirectly, by the body or the declarations of a program. */
  public static Ir.Program pruneUnreferenced(Ir.Program program) {
    if (program.functionDefinitions.isEmpty()) {
      return program;
    }
    final Map<String, Ir.FunctionDefinition> fundefs = new HashMap<>();
    program.functionDefinitions.forEach(f -> fundefs.put(f.id, f));
    final Set<String> referenced = new LinkedHashSet<>();
    final Deque<String> queue = new ArrayDeque<>();
    SymbolRefs.free(program.body).forEach(queue::add);
    SymbolRefs.free(program.declarations).forEach(queue::add);
    while (!queue.isEmpty()) {
      final String id = queue.remove();
      final Ir.FunctionDefinition fundef = fundefs.get(id);
      if (fundef != null && referenced.add(id)) {
        queue.addAll(SymbolRefs.free(fundef));
      }
    }
    final ImmutableList.Builder<Ir.FunctionDefinition> kept =
        ImmutableList.builder();
    for (Ir.FunctionDefinition fundef : program.functionDefinitions) {
      if (referenced.contains(fundef.id)) {
        kept.add(fundef);
      }
    }
    final ImmutableList<Ir.FunctionDefinition> list = kept.build();
    if (list.size() == program.functionDefinitions.size()) {
      return program;
    }
    return program.copy(list, program.params, program.declarations,
        program.body);
  }
}

// End InlineFundefs.java
