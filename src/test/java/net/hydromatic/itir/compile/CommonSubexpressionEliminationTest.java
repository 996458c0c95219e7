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
import net.hydromatic.itir.ast.Pos;
import net.hydromatic.itir.type.ScalarType;
import org.junit.jupiter.api.Test;

/** Tests for {@link CommonSubexpressionElimination}. */
public class CommonSubexpressionEliminationTest {
  private final Ir.SymRef x = ir.ref("x");
  private final Ir.Literal one = ir.intLiteral(1);
  private final Ir.Literal two = ir.intLiteral(2);

  private static Ir.Expr cse(Ir.Expr e) {
    return CommonSubexpressionElimination.apply(e, new UidGenerator());
  }

  @Test void testSimple() {
    final Ir.FunCall xPlusOne = ir.plus(x, one);
    final Ir.Lambda lambda =
        ir.lambda("x", ir.multiplies(xPlusOne, xPlusOne));
    final Ir.SymRef cs1 = ir.ref("_cs1");
    assertThat(cse(lambda),
        is(ir.lambda("x", ir.let("_cs1", xPlusOne, ir.multiplies(cs1, cs1)))));
  }

  /** The largest repeated expression is extracted; its subexpressions then
   * occur only once. */
  @Test void testLargestFirst() {
    final Ir.FunCall big = ir.multiplies(ir.plus(x, one), two);
    final Ir.Lambda lambda = ir.lambda("x", ir.plus(big, big));
    final Ir.SymRef cs1 = ir.ref("_cs1");
    assertThat(cse(lambda),
        is(ir.lambda("x", ir.let("_cs1", big, ir.plus(cs1, cs1)))));
  }

  /** An expression that references a symbol bound inside the scope cannot
   * be moved out of its lambda. */
  @Test void testBoundSymbol() {
    final Ir.SymRef y = ir.ref("y");
    final Ir.FunCall yPlusOne = ir.plus(y, one);
    final Ir.Lambda lambda =
        ir.lambda("x",
            ir.call(ir.ref("f"), ir.lambda("y", yPlusOne),
                ir.lambda("y", yPlusOne)));
    assertThat(cse(lambda), sameInstance(lambda));
  }

  @Test void testIfBranchesNotCounted() {
    final Ir.FunCall xPlusOne = ir.plus(x, one);
    final Ir.Lambda lambda =
        ir.lambda("x", ir.ifThenElse(ir.ref("c"), xPlusOne, xPlusOne));
    assertThat(cse(lambda), sameInstance(lambda));
  }

  /** Expressions that print the same but have different types are
   * different. */
  @Test void testTypesDistinguish() {
    final Ir.SymRef g = ir.ref("g");
    final Ir.FunCall g32 = ir.call(Pos.ZERO, ScalarType.INT32, g,
        ImmutableList.of(x));
    final Ir.FunCall g64 = ir.call(Pos.ZERO, ScalarType.FLOAT64, g,
        ImmutableList.of(x));
    final Ir.Lambda lambda = ir.lambda("x", ir.call(ir.ref("h"), g32, g64));
    assertThat(cse(lambda), sameInstance(lambda));
  }

  /** Outside a lambda there is no scope to bind a let. */
  @Test void testNoScope() {
    final Ir.FunCall xPlusOne = ir.plus(x, one);
    final Ir.FunCall e = ir.multiplies(xPlusOne, xPlusOne);
    assertThat(cse(e), sameInstance(e));
  }

  /** Partial applications such as {@code shift(Iₒ, 1ₒ)} are not extracted
   * on their own. */
  @Test void testPartialApplication() {
    final Ir.SymRef a = ir.ref("a");
    final Ir.SymRef b = ir.ref("b");
    final Ir.Lambda lambda =
        ir.lambda("a", "b",
            ir.plus(ir.deref(ir.call(ir.shift("Ioff", 1), a)),
                ir.deref(ir.call(ir.shift("Ioff", 1), b))));
    assertThat(cse(lambda), sameInstance(lambda));
  }
}

// End CommonSubexpressionEliminationTest.java
