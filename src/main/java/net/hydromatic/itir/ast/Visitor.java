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

/** Visits iterator IR trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends Ir.Node> void accept(E e) {
    e.accept(this);
  }

  // expressions

  protected void visit(Ir.Sym sym) {}

  protected void visit(Ir.SymRef symRef) {}

  protected void visit(Ir.Literal literal) {}

  protected void visit(Ir.OffsetLiteral offsetLiteral) {}

  protected void visit(Ir.AxisLiteral axisLiteral) {}

  protected void visit(Ir.Lambda lambda) {
    lambda.params.forEach(this::accept);
    lambda.expr.accept(this);
  }

  protected void visit(Ir.FunCall funCall) {
    funCall.fun.accept(this);
    funCall.args.forEach(this::accept);
  }

  // declarations and statements

  protected void visit(Ir.FunctionDefinition functionDefinition) {
    functionDefinition.params.forEach(this::accept);
    functionDefinition.expr.accept(this);
  }

  protected void visit(Ir.StencilClosure closure) {
    closure.domain.accept(this);
    closure.stencil.accept(this);
    closure.output.accept(this);
    closure.inputs.forEach(this::accept);
  }

  protected void visit(Ir.SetAt setAt) {
    setAt.expr.accept(this);
    setAt.domain.accept(this);
    setAt.target.accept(this);
  }

  protected void visit(Ir.Temporary temporary) {
    if (temporary.domain != null) {
      temporary.domain.accept(this);
    }
  }

  protected void visit(Ir.Program program) {
    program.declarations.forEach(this::accept);
    program.functionDefinitions.forEach(this::accept);
    program.params.forEach(this::accept);
    program.body.forEach(this::accept);
  }
}

// End Visitor.java
