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
import static net.hydromatic.itir.compile.Fixtures.CARTESIAN;
import static net.hydromatic.itir.compile.Fixtures.I_DIM;
import static net.hydromatic.itir.compile.Fixtures.MESH;
import static net.hydromatic.itir.compile.Fixtures.VERTEX;
import static net.hydromatic.itir.compile.Fixtures.fieldParam;
import static net.hydromatic.itir.compile.Fixtures.iDomain;
import static net.hydromatic.itir.compile.Fixtures.meshDomain;
import static net.hydromatic.itir.compile.Fixtures.sizeParam;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.itir.ast.Ir;
import org.junit.jupiter.api.Test;

/** Tests for {@link InferDomain}. */
public class InferDomainTest {
  private final Ir.SymRef a = ir.ref("a");
  private final Ir.SymRef b = ir.ref("b");

  /** {@code λ(a) → ·⟪Ioffₒ, 1ₒ⟫(a) + ·a}. */
  private final Ir.Lambda forwardSum =
      ir.lambda("a",
          ir.plus(ir.deref(ir.call(ir.shift("Ioff", 1), a)), ir.deref(a)));

  /** {@code λ(b) → ·b}. */
  private final Ir.Lambda copy = ir.lambda("b", ir.deref(b));

  private static Ir.Program program(Ir.Expr expr, Ir.FunCall domain) {
    return ir.program("p",
        ImmutableList.of(fieldParam("inp", I_DIM), fieldParam("out", I_DIM),
            sizeParam("n")),
        ir.setAt(expr, domain, ir.ref("out")));
  }

  private static Ir.Expr statement(Ir.Program program) {
    return ((Ir.SetAt) program.body.get(0)).expr;
  }

  /** The inner field operator is read at offsets 0 and 1, so it must be
   * computed on one more point than the outer one. */
  @Test void testNested() {
    final Ir.FunCall domain = iDomain("n");
    final Ir.FunCall inner = ir.call(ir.asFieldop(copy), ir.ref("inp"));
    final Ir.Program program =
        program(ir.call(ir.asFieldop(forwardSum), inner), domain);
    final Ir.Program inferred =
        InferDomain.apply(program, CARTESIAN, ImmutableMap.of());

    final Ir.FunCall innerDomain =
        ir.cartesianDomain(
            ir.namedRange(I_DIM.value, ir.intLiteral(0),
                ir.plus(ir.ref("n"), ir.intLiteral(1))));
    assertThat(statement(inferred),
        is(
            ir.call(ir.asFieldop(forwardSum, domain),
                ir.call(ir.asFieldop(copy, innerDomain), ir.ref("inp")))));
    assertThat(innerDomain,
        hasToString("cartesian_domain(named_range(IDimₐ, 0, n + 1))"));
  }

  /** A domain that is already given is not changed. */
  @Test void testExplicitDomain() {
    final Ir.FunCall given = iDomain("m");
    final Ir.FunCall expr =
        ir.call(ir.asFieldop(copy, given), ir.ref("inp"));
    final Ir.Program inferred =
        InferDomain.apply(program(expr, iDomain("n")), CARTESIAN,
            ImmutableMap.of());
    assertThat(statement(inferred), is(expr));
  }

  @Test void testTupleAndIf() {
    final Ir.FunCall domain = iDomain("n");
    final Ir.FunCall fo = ir.call(ir.asFieldop(copy), ir.ref("inp"));
    final Ir.FunCall foWithDomain =
        ir.call(ir.asFieldop(copy, domain), ir.ref("inp"));
    final Ir.Expr tuple =
        InferDomain.apply(ir.makeTuple(fo, ir.ifThenElse(ir.ref("c"), fo, fo)),
            domain, CARTESIAN, ImmutableMap.of());
    assertThat(tuple,
        is(
            ir.makeTuple(foWithDomain,
                ir.ifThenElse(ir.ref("c"), foWithDomain, foWithDomain))));
  }

  /** A vertex field operator that reads edges needs the number of
   * edges. */
  @Test void testUnstructured() {
    final Ir.FunCall domain = meshDomain(VERTEX, "nVertices");
    final Ir.Lambda edgeSum =
        ir.lambda("e",
            ir.call(ir.reduce(ir.ref("plus"), ir.floatLiteral(0)),
                ir.neighbors("V2E", ir.ref("e"))));
    final Ir.FunCall expr =
        ir.call(ir.asFieldop(edgeSum),
            ir.call(ir.asFieldop(copy), ir.ref("edges")));

    final Ir.Expr inferred =
        InferDomain.apply(expr, domain, MESH,
            ImmutableMap.of("Edge", "nEdges"));
    final Ir.FunCall inner = (Ir.FunCall) ((Ir.FunCall) inferred).arg(0);
    assertThat(((Ir.FunCall) inner.fun).arg(1),
        hasToString("unstructured_domain(named_range(Edgeₐ, 0, nEdges))"));

    assertThrows(CompileException.class, () ->
        InferDomain.apply(expr, domain, MESH, ImmutableMap.of()));
  }
}

// End InferDomainTest.java
