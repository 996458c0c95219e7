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
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.ast.Visitor;
import net.hydromatic.itir.type.Connectivity;
import net.hydromatic.itir.type.Dimension;
import net.hydromatic.itir.type.FieldType;
import net.hydromatic.itir.type.OffsetProvider;
import net.hydromatic.itir.type.ScalarType;
import net.hydromatic.itir.type.Type;

/** Offset providers, domains and programs shared by the compiler tests. */
abstract class Fixtures {
  private Fixtures() {}

  static final Dimension I_DIM = Dimension.of("IDim");
  static final Dimension J_DIM = Dimension.of("JDim");
  static final Dimension VERTEX = Dimension.of("Vertex");
  static final Dimension EDGE = Dimension.of("Edge");

  /** Cartesian offsets "Ioff" and "Joff". */
  static final OffsetProvider CARTESIAN =
      OffsetProvider.builder()
          .add("Ioff", I_DIM)
          .add("Joff", J_DIM)
          .build();

  /** Cartesian offsets plus the mesh connectivities "V2E" (each vertex has
   * up to 4 edges, some missing) and "E2V" (each edge has exactly 2
   * vertices). */
  static final OffsetProvider MESH =
      OffsetProvider.builder()
          .add("Ioff", I_DIM)
          .add("Joff", J_DIM)
          .add("V2E", new Connectivity(VERTEX, EDGE, 4, true))
          .add("E2V", Connectivity.of(EDGE, VERTEX, 2))
          .build();

  /** Returns {@code cartesian_domain(named_range(IDimₐ, 0, n))}. */
  static Ir.FunCall iDomain(String n) {
    return ir.cartesianDomain(
        ir.namedRange(I_DIM.value, ir.intLiteral(0), ir.ref(n)));
  }

  /** Returns {@code unstructured_domain(named_range(dimₐ, 0, n))}. */
  static Ir.FunCall meshDomain(Dimension dim, String n) {
    return ir.unstructuredDomain(
        ir.namedRange(dim.value, ir.intLiteral(0), ir.ref(n)));
  }

  static FieldType field(Dimension dim, Type dtype) {
    return new FieldType(ImmutableList.of(dim), dtype);
  }

  /** Returns a program parameter that is a field over one dimension. */
  static Ir.Sym fieldParam(String id, Dimension dim) {
    return ir.sym(id, field(dim, ScalarType.FLOAT64));
  }

  /** Returns a program parameter of type int32. */
  static Ir.Sym sizeParam(String id) {
    return ir.sym(id, ScalarType.INT32);
  }

  /** Returns a program that applies a stencil to one input on
   * {@code IDim}. */
  static Ir.Program cartesianProgram(Ir.Expr stencil) {
    return ir.program("p",
        ImmutableList.of(fieldParam("inp", I_DIM), fieldParam("out", I_DIM),
            sizeParam("n")),
        ir.closure(iDomain("n"), stencil, "out", "inp"));
  }

  /** Returns the types of all nodes in a tree, in visiting order, as
   * strings; "null" for a node without a type. */
  static List<String> types(Ir.Node node) {
    final List<String> list = new ArrayList<>();
    node.accept(new Visitor() {
      void add(Ir.Node n) {
        list.add(n.op + ":" + n.type);
      }

      @Override protected void visit(Ir.Sym sym) {
        add(sym);
      }

      @Override protected void visit(Ir.SymRef symRef) {
        add(symRef);
      }

      @Override protected void visit(Ir.Literal literal) {
        add(literal);
      }

      @Override protected void visit(Ir.Lambda lambda) {
        add(lambda);
        super.visit(lambda);
      }

      @Override protected void visit(Ir.FunCall funCall) {
        add(funCall);
        super.visit(funCall);
      }
    });
    return list;
  }
}

// End Fixtures.java
