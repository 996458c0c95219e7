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
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import net.hydromatic.itir.ast.Ir;
import org.junit.jupiter.api.Test;

/** Tests for {@link FuseMaps}. */
public class FuseMapsTest {
  private final Ir.SymRef a = ir.ref("a");
  private final Ir.SymRef b = ir.ref("b");
  private final Ir.SymRef c = ir.ref("c");
  private final Ir.SymRef plus = ir.ref("plus");
  private final Ir.SymRef multiplies = ir.ref("multiplies");

  private static Ir.FunCall map(Ir.Expr f, Ir.Expr... args) {
    return ir.call(ir.map(f), args);
  }

  /** {@code map_(plus)(a, map_(multiplies)(b, c))} becomes a single map
   * over {@code a, b, c}. */
  @Test void testMapOfMap() {
    final Ir.FunCall e = map(plus, a, map(multiplies, b, c));
    final Ir.Expr fused = FuseMaps.apply(e, new UidGenerator());
    final Ir.SymRef m1 = ir.ref("__map1");
    final Ir.SymRef m3 = ir.ref("__map3");
    final Ir.SymRef m4 = ir.ref("__map4");
    assertThat(fused,
        is(
            map(
                ir.lambda(ir.syms("__map1", "__map3", "__map4"),
                    ir.plus(m1, ir.multiplies(m3, m4))),
                a, b, c)));
  }

  @Test void testReduceOfMap() {
    final Ir.FunCall e =
        ir.call(ir.reduce(plus, ir.intLiteral(0)), map(multiplies, a, b));
    final Ir.Expr fused = FuseMaps.apply(e, new UidGenerator());
    final Ir.SymRef acc = ir.ref("__acc1");
    final Ir.SymRef m2 = ir.ref("__map2");
    final Ir.SymRef m3 = ir.ref("__map3");
    assertThat(fused,
        is(
            ir.call(
                ir.reduce(
                    ir.lambda(ir.syms("__acc1", "__map2", "__map3"),
                        ir.plus(acc, ir.multiplies(m2, m3))),
                    ir.intLiteral(0)),
                a, b)));
  }

  /** When the outer function is a lambda, it is inlined, but an argument
   * that it uses twice stays bound by a let. */
  @Test void testLambdaIsInlined() {
    final Ir.SymRef x = ir.ref("x");
    final Ir.SymRef g = ir.ref("g");
    final Ir.FunCall e = map(ir.lambda("x", ir.plus(x, x)), map(g, b));
    final Ir.Expr fused = FuseMaps.apply(e, new UidGenerator());
    final Ir.SymRef m2 = ir.ref("__map2");
    assertThat(fused,
        is(
            map(
                ir.lambda(ImmutableList.of(ir.sym("__map2")),
                    ir.let("x", ir.call(g, m2), ir.plus(x, x))),
                b)));
  }

  /** Generated names avoid names that are already in use. */
  @Test void testReservedNames() {
    final UidGenerator uids =
        new UidGenerator().reserve(ImmutableList.of("__map1", "__map2"));
    final Ir.SymRef neg = ir.ref("neg");
    final Ir.Expr fused = FuseMaps.apply(map(neg, map(plus, a, b)), uids);
    assertThat(fused,
        is(
            map(
                ir.lambda(ir.syms("__map4", "__map5"),
                    ir.call(neg,
                        ir.plus(ir.ref("__map4"), ir.ref("__map5")))),
                a, b)));
  }

  @Test void testNothingToFuse() {
    final Ir.FunCall e = map(plus, a, b);
    assertThat(FuseMaps.apply(e, new UidGenerator()), sameInstance(e));
  }
}

// End FuseMapsTest.java
