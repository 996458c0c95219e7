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

import net.hydromatic.itir.ast.Ir;
import org.junit.jupiter.api.Test;

/** Tests for {@link CollapseListGet}. */
public class CollapseListGetTest {
  private final Ir.SymRef it = ir.ref("it");

  @Test void testNeighbors() {
    final Ir.FunCall e = ir.listGet(2, ir.neighbors("V2E", it));
    assertThat(CollapseListGet.apply(e),
        is(ir.deref(ir.call(ir.shift("V2E", 2), it))));
  }

  @Test void testConstList() {
    final Ir.Literal one = ir.intLiteral(1);
    assertThat(CollapseListGet.apply(ir.listGet(3, ir.makeConstList(one))),
        is(one));
  }

  @Test void testUnknown() {
    final Ir.FunCall e = ir.call("list_get", ir.ref("i"), ir.ref("xs"));
    assertThat(CollapseListGet.apply(e), sameInstance(e));
    final Ir.FunCall e2 = ir.listGet(0, ir.ref("xs"));
    assertThat(CollapseListGet.apply(e2), sameInstance(e2));
  }
}

// End CollapseListGetTest.java
