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
import com.google.common.collect.ImmutableMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.ast.Shuttle;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Replaces free references to symbols with expressions.
 *
 * <p>Substitution is capture-avoiding. If a lambda inside the tree binds a
 * symbol that is free in one of the replacement expressions, the lambda's
 * parameter is renamed (by appending "_" until the name is unused) before
 * the replacement is made. */
public class Replacer extends Shuttle {
  private final ImmutableMap<String, Ir.Expr> substitution;

  private Replacer(Map<String, ? extends Ir.Expr> substitution) {
    this.substitution = ImmutableMap.copyOf(substitution);
  }

  /** Substitutes expressions for free references in a node. The node may
   * be an expression or a larger tree such as a program. */
  @SuppressWarnings("unchecked")
  public static <N extends Ir.Node> N substitute(
      Map<String, ? extends Ir.Expr> substitution, N node) {
    if (substitution.isEmpty()) {
      return node;
    }
    return (N) node.accept(new Replacer(substitution));
  }

  @Override
  protected Ir.Expr visit(Ir.SymRef symRef) {
    final Ir.Expr expr = substitution.get(symRef.id);
    return expr != null ? expr : symRef;
  }

  @Override
  protected Ir.Expr visit(Ir.Lambda lambda) {
    final Scope scope = scope(lambda.params, lambda.expr);
    if (scope == null) {
      return lambda;
    }
    return lambda.copy(scope.params,
        lambda.expr.accept(new Replacer(scope.substitution)));
  }

  @Override
  protected Ir.FunctionDefinition visit(
      Ir.FunctionDefinition functionDefinition) {
    final Scope scope =
        scope(functionDefinition.params, functionDefinition.expr);
    if (scope == null) {
      return functionDefinition;
    }
    return functionDefinition.copy(scope.params,
        functionDefinition.expr.accept(new Replacer(scope.substitution)));
  }

  /** Computes the substitution that applies inside a scope that binds
   * {@code params}, renaming parameters that would capture a free symbol of
   * a replacement. Returns null if there is nothing to substitute. */
  private @Nullable Scope scope(List<Ir.Sym> params, Ir.Expr body) {
    final Map<String, Ir.Expr> map = new LinkedHashMap<>(substitution);
    params.forEach(p -> map.remove(p.id));
    final Set<String> bodyFree = SymbolRefs.free(body);
    map.keySet().retainAll(bodyFree);
    if (map.isEmpty()) {
      return null;
    }
    final Set<String> free = SymbolRefs.free(map.values());
    final Set<String> used = new HashSet<>(free);
    used.addAll(SymbolRefs.all(body));
    params.forEach(p -> used.add(p.id));
    final ImmutableList.Builder<Ir.Sym> newParams = ImmutableList.builder();
    for (Ir.Sym param : params) {
      if (free.contains(param.id)) {
        String id = param.id;
        while (used.contains(id)) {
          id += "_";
        }
        used.add(id);
        newParams.add(ir.sym(param.pos, id, param.type));
        map.put(param.id, ir.ref(id, param.type));
      } else {
        newParams.add(param);
      }
    }
    return new Scope(newParams.build(), map);
  }

  /** Parameters and substitution inside a lambda or function. */
  private static class Scope {
    final List<Ir.Sym> params;
    final Map<String, Ir.Expr> substitution;

    Scope(List<Ir.Sym> params, Map<String, Ir.Expr> substitution) {
      this.params = params;
      this.substitution = substitution;
    }
  }
}

// End Replacer.java
