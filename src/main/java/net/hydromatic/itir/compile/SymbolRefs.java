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

import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.ast.Visitor;

/** Utilities for finding the symbols that a tree declares and
 * references. */
public abstract class SymbolRefs {
  private SymbolRefs() {}

  /** Returns the free symbols of a node: those that are referenced but
   * not bound within the node. Includes references to builtins. */
  public static Set<String> free(Ir.Node node) {
    final Set<String> set = new LinkedHashSet<>();
    node.accept(new FreeFinder(ImmutableSet.of(), set::add));
    return set;
  }

  /** Returns the free symbols of several nodes. */
  public static Set<String> free(Iterable<? extends Ir.Node> nodes) {
    final Set<String> set = new LinkedHashSet<>();
    for (Ir.Node node : nodes) {
      node.accept(new FreeFinder(ImmutableSet.of(), set::add));
    }
    return set;
  }

  /** Returns the number of free references to each symbol in a node. */
  public static Map<String, Integer> countFree(Ir.Node node) {
    final Map<String, Integer> counts = new HashMap<>();
    node.accept(
        new FreeFinder(ImmutableSet.of(),
            id -> counts.merge(id, 1, Integer::sum)));
    return counts;
  }

  /** Returns the number of free references to a symbol in a node. */
  public static int countFree(Ir.Node node, String id) {
    return countFree(node).getOrDefault(id, 0);
  }

  /** Returns every symbol that is declared or referenced anywhere in a
   * node. */
  public static Set<String> all(Ir.Node node) {
    final Set<String> set = new LinkedHashSet<>();
    node.accept(
        new Visitor() {
          @Override
          protected void visit(Ir.Sym sym) {
            set.add(sym.id);
          }

          @Override
          protected void visit(Ir.SymRef symRef) {
            set.add(symRef.id);
          }

          @Override
          protected void visit(Ir.FunctionDefinition functionDefinition) {
            set.add(functionDefinition.id);
            super.visit(functionDefinition);
          }

          @Override
          protected void visit(Ir.Temporary temporary) {
            set.add(temporary.id);
            super.visit(temporary);
          }
        });
    return set;
  }

  /** Finds free symbols. */
  private static class FreeFinder extends ScopedVisitor {
    final Consumer<String> consumer;

    FreeFinder(ImmutableSet<String> bound, Consumer<String> consumer) {
      super(bound);
      this.consumer = consumer;
    }

    @Override
    protected ScopedVisitor push(ImmutableSet<String> bound) {
      return new FreeFinder(bound, consumer);
    }

    @Override
    protected void visit(Ir.SymRef symRef) {
      if (!bound.contains(symRef.id)) {
        consumer.accept(symRef.id);
      }
    }
  }
}

// End SymbolRefs.java
