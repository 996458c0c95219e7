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
package net.hydromatic.itir.ast;

import java.util.ArrayList;
import java.util.List;

/** Visits and transforms iterator IR trees.
 *
 * <p>Each {@code visit} method returns the node itself if none of its
 * children changed. */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {}

  protected <E extends Ir.Node> List<E> visitList(List<E> nodes) {
    final List<E> list = new ArrayList<>();
    for (E node : nodes) {
      //noinspection unchecked
      list.add((E) node.accept(this));
    }
    return list;
  }

  // expressions

  protected Ir.Sym visit(Ir.Sym sym) {
    return sym; // leaf
  }

  protected Ir.Expr visit(Ir.SymRef symRef) {
    return symRef; // leaf
  }

  protected Ir.Expr visit(Ir.Literal literal) {
    return literal; // leaf
  }

  protected Ir.Expr visit(Ir.OffsetLiteral offsetLiteral) {
    return offsetLiteral; // leaf
  }

  protected Ir.Expr visit(Ir.AxisLiteral axisLiteral) {
    return axisLiteral; // leaf
  }

  protected Ir.Expr visit(Ir.Lambda lambda) {
    return lambda.copy(visitList(lambda.params), lambda.expr.accept(this));
  }

  protected Ir.Expr visit(Ir.FunCall funCall) {
    return funCall.copy(funCall.fun.accept(this), visitList(funCall.args));
  }

  // declarations and statements

  protected Ir.FunctionDefinition visit(
      Ir.FunctionDefinition functionDefinition) {
    return functionDefinition.copy(visitList(functionDefinition.params),
        functionDefinition.expr.accept(this));
  }

  protected Ir.StencilClosure visit(Ir.StencilClosure closure) {
    return closure.copy((Ir.FunCall) closure.domain.accept(this),
        closure.stencil.accept(this), closure.output.accept(this),
        visitRefs(closure.inputs));
  }

  /** Visits a list of references; each must remain a reference. */
  protected List<Ir.SymRef> visitRefs(List<Ir.SymRef> refs) {
    final List<Ir.SymRef> list = new ArrayList<>();
    for (Ir.SymRef ref : refs) {
      list.add((Ir.SymRef) ref.accept(this));
    }
    return list;
  }

  protected Ir.SetAt visit(Ir.SetAt setAt) {
    return setAt.copy(setAt.expr.accept(this),
        (Ir.FunCall) setAt.domain.accept(this), setAt.target.accept(this));
  }

  protected Ir.Temporary visit(Ir.Temporary temporary) {
    return temporary.domain == null ? temporary
        : temporary.copy((Ir.FunCall) temporary.domain.accept(this));
  }

  protected Ir.Program visit(Ir.Program program) {
    return program.copy(visitList(program.functionDefinitions),
        visitList(program.params), visitList(program.declarations),
        visitList(program.body));
  }
}

// End Shuttle.java
