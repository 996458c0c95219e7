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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import net.hydromatic.itir.ast.Ir;
import org.junit.jupiter.api.Test;

/** Tests for {@link SymbolRefs} and {@link Replacer}. */
public class ReplacerTest {
  private final Ir.SymRef x = ir.ref("x");
  private final Ir.SymRef y = ir.ref("y");

  @Test void testFree() {
    final Ir.Lambda lambda = ir.lambda("x", ir.plus(x, y));
    assertThat(SymbolRefs.free(lambda), is(ImmutableSet.of("plus", "y")));
    assertThat(SymbolRefs.all(lambda),
        is(ImmutableSet.of("x", "plus", "y")));
  }

  @Test void testCountFree() {
    final Ir.FunCall e = ir.plus(ir.plus(x, x), y);
    assertThat(SymbolRefs.countFree(e),
        is(ImmutableMap.of("plus", 2, "x", 2, "y", 1)));
    assertThat(SymbolRefs.countFree(e, "x"), is(2));
    assertThat(SymbolRefs.countFree(e, "z"), is(0));

    // References inside a lambda that binds the symbol are not free.
    final Ir.FunCall let = ir.let("x", y, ir.plus(x, x));
    assertThat(SymbolRefs.countFree(let, "x"), is(0));
  }

  @Test void testFreeInProgram() {
    final Ir.Program program =
        ir.program("p", ImmutableList.of(ir.sym("inp"), ir.sym("out")),
            ir.closure(Fixtures.iDomain("n"),
                ir.lambda("it", ir.deref(ir.ref("it"))), "out", "inp"));
    assertThat(SymbolRefs.free(program).contains("n"), is(true));
    assertThat(SymbolRefs.free(program).contains("it"), is(false));
    assertThat(SymbolRefs.all(program).contains("it"), is(true));
  }

  @Test void testSubstitute() {
    final Ir.FunCall e = ir.plus(x, y);
    assertThat(
        Replacer.substitute(ImmutableMap.of("x", ir.intLiteral(1)), e),
        is(ir.plus(ir.intLiteral(1), y)));
    assertThat(Replacer.substitute(ImmutableMap.of(), e), sameInstance(e));
  }

  @Test void testSubstituteShadowed() {
    final Ir.Lambda lambda = ir.lambda("x", x);
    assertThat(
        Replacer.substitute(ImmutableMap.of("x", ir.ref("a")), lambda),
        sameInstance(lambda));
  }

  /** Replacing {@code x} by {@code y + 1} inside {@code λ(y) → x + y}
   * renames the lambda's parameter. */
  @Test void testSubstituteAvoidsCapture() {
    final Ir.Lambda lambda = ir.lambda("y", ir.plus(x, y));
    final Ir.FunCall yPlusOne = ir.plus(y, ir.intLiteral(1));
    final Ir.SymRef y_ = ir.ref("y_");
    assertThat(Replacer.substitute(ImmutableMap.of("x", yPlusOne), lambda),
        is(ir.lambda("y_", ir.plus(yPlusOne, y_))));
  }
}

// End ReplacerTest.java
