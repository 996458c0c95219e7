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
import static net.hydromatic.itir.compile.Fixtures.MESH;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.itir.ast.Ir;
import org.junit.jupiter.api.Test;

/** Tests for {@link UnrollReduce}. */
public class UnrollReduceTest {
  private final Ir.SymRef it = ir.ref("it");
  private final Ir.SymRef plus = ir.ref("plus");
  private final Ir.Literal zero = ir.intLiteral(0);

  private static Ir.FunCall sum(Ir.Expr list) {
    return ir.call(ir.reduce(ir.ref("plus"), ir.intLiteral(0)), list);
  }

  /** Each edge has exactly two vertices, so the reduction becomes two
   * additions. */
  @Test void testUnrollFixedLength() {
    final Ir.FunCall neighbors = ir.neighbors("E2V", it);
    final Ir.Expr unrolled =
        UnrollReduce.apply(sum(neighbors), MESH, new UidGenerator());
    assertThat(unrolled,
        is(
            ir.plus(ir.plus(zero, ir.listGet(0, neighbors)),
                ir.listGet(1, neighbors))));

    // After collapsing list_get, each neighbor is a dereferenced shift.
    assertThat(CollapseListGet.apply(unrolled),
        is(
            ir.plus(
                ir.plus(zero, ir.deref(ir.call(ir.shift("E2V", 0), it))),
                ir.deref(ir.call(ir.shift("E2V", 1), it)))));
  }

  /** A vertex may have fewer than four edges, so each step checks that the
   * neighbor exists. */
  @Test void testUnrollWithSkipValues() {
    final Ir.FunCall neighbors = ir.neighbors("V2E", it);
    final Ir.Expr unrolled =
        UnrollReduce.apply(sum(neighbors), MESH, new UidGenerator());
    assertThat(unrolled.isLet(), is(true));
    final Ir.FunCall let = (Ir.FunCall) unrolled;
    final Ir.Lambda lambda = (Ir.Lambda) let.fun;
    assertThat(lambda.params.get(0).id, is("__acc4"));
    final Ir.SymRef acc4 = ir.ref("__acc4");
    assertThat(lambda.expr,
        is(
            ir.ifThenElse(
                ir.canDeref(ir.call(ir.shift("V2E", 3), it)),
                ir.call(plus, acc4, ir.listGet(3, neighbors)),
                acc4)));

    // The innermost accumulator is the initial value.
    Ir.Expr e = unrolled;
    while (e.isLet()) {
      e = ((Ir.FunCall) e).arg(0);
    }
    assertThat(e, is(zero));
  }

  @Test void testMappedNeighbors() {
    final Ir.FunCall list =
        ir.call(ir.map(ir.ref("f")), ir.neighbors("E2V", it));
    final Ir.Expr unrolled =
        UnrollReduce.apply(sum(list), MESH, new UidGenerator());
    assertThat(unrolled,
        is(
            ir.plus(ir.plus(zero, ir.listGet(0, list)),
                ir.listGet(1, list))));
  }

  @Test void testUnknownLength() {
    final Ir.FunCall e = sum(ir.ref("xs"));
    assertThat(UnrollReduce.apply(e, MESH, new UidGenerator()),
        sameInstance(e));
    final Ir.FunCall e2 = sum(ir.neighbors("V2E", it));
    assertThat(UnrollReduce.apply(e2, CARTESIAN, new UidGenerator()),
        sameInstance(e2));
  }
}

// End UnrollReduceTest.java
