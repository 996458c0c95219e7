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

/** Tests for {@link MergeLet}. */
public class MergeLetTest {
  private final Ir.SymRef a = ir.ref("a");
  private final Ir.SymRef b = ir.ref("b");
  private final Ir.SymRef x = ir.ref("x");
  private final Ir.SymRef y = ir.ref("y");

  @Test void testMerge() {
    final Ir.FunCall e = ir.let("a", x, ir.let("b", y, ir.plus(a, b)));
    assertThat(MergeLet.apply(e),
        is(ir.call(ir.lambda("a", "b", ir.plus(a, b)), x, y)));
  }

  @Test void testMergeThree() {
    final Ir.SymRef c = ir.ref("c");
    final Ir.FunCall e =
        ir.let("a", x,
            ir.let("b", y, ir.let("c", ir.ref("z"), ir.plus(a, c))));
    assertThat(MergeLet.apply(e),
        is(
            ir.call(ir.lambda(ir.syms("a", "b", "c"), ir.plus(a, c)),
                ImmutableList.of(x, y, ir.ref("z")))));
  }

  /** The inner value references the outer symbol, so the lets cannot be
   * evaluated side by side. */
  @Test void testDependentNotMerged() {
    final Ir.FunCall e = ir.let("a", x, ir.let("b", a, ir.plus(a, b)));
    assertThat(MergeLet.apply(e), sameInstance(e));
  }

  @Test void testShadowingNotMerged() {
    final Ir.FunCall e = ir.let("a", x, ir.let("a", y, a));
    assertThat(MergeLet.apply(e), sameInstance(e));
  }
}

// End MergeLetTest.java
