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
import static net.hydromatic.itir.compile.Fixtures.iDomain;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.itir.ast.Ir;
import org.junit.jupiter.api.Test;

/** Tests for {@link FuseAsFieldOp}. */
public class FuseAsFieldOpTest {
  private final Ir.SymRef a = ir.ref("a");
  private final Ir.SymRef b = ir.ref("b");
  private final Ir.SymRef x = ir.ref("x");
  private final Ir.SymRef y = ir.ref("y");

  /** {@code λ(it) → ·it × 2}. */
  private final Ir.Lambda twice =
      ir.lambda("it", ir.multiplies(ir.deref(ir.ref("it")), ir.intLiteral(2)));

  private static Ir.Expr fuse(Ir.Expr e) {
    return FuseAsFieldOp.apply(e, new UidGenerator());
  }

  @Test void testFuse() {
    final Ir.FunCall domain = iDomain("n");
    final Ir.FunCall e =
        ir.call(
            ir.asFieldop(ir.lambda("a", "b", ir.plus(ir.deref(a), ir.deref(b))),
                domain),
            x, ir.call(ir.asFieldop(twice, domain), y));
    final Ir.SymRef arg1 = ir.ref("__arg1");
    assertThat(fuse(e),
        is(
            ir.call(
                ir.asFieldop(
                    ir.lambda("a", "__arg1",
                        ir.plus(ir.deref(a), ir.call(twice, arg1))),
                    domain),
                x, y)));
  }

  /** An inner field operator without a domain takes the outer one. */
  @Test void testFuseInnerWithoutDomain() {
    final Ir.FunCall domain = iDomain("n");
    final Ir.FunCall e =
        ir.call(ir.asFieldop(ir.lambda("b", ir.deref(b)), domain),
            ir.call(ir.asFieldop(twice), y));
    assertThat(fuse(e),
        is(
            ir.call(
                ir.asFieldop(
                    ir.lambda("__arg1", ir.call(twice, ir.ref("__arg1"))),
                    domain),
                y)));
  }

  @Test void testDifferentDomains() {
    final Ir.FunCall e =
        ir.call(ir.asFieldop(ir.lambda("b", ir.deref(b)), iDomain("n")),
            ir.call(ir.asFieldop(twice, iDomain("m")), y));
    assertThat(fuse(e), sameInstance(e));
  }

  /** The argument is shifted as well as dereferenced, so the inner field
   * operator would have to be evaluated at two positions. */
  @Test void testUsedTwice() {
    final Ir.FunCall e =
        ir.call(
            ir.asFieldop(
                ir.lambda("b",
                    ir.plus(ir.deref(b),
                        ir.deref(ir.call(ir.shift("Ioff", 1), b))))),
            ir.call(ir.asFieldop(twice), y));
    assertThat(fuse(e), sameInstance(e));
  }

  @Test void testDerefOfLift() {
    final Ir.FunCall e = ir.deref(ir.liftedCall(twice, x));
    assertThat(fuse(e), is(ir.call(twice, x)));
  }
}

// End FuseAsFieldOpTest.java
