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
import net.hydromatic.itir.type.ScalarType;
import net.hydromatic.itir.type.TupleType;
import org.junit.jupiter.api.Test;

/** Tests for {@link CollapseTuple}. */
public class CollapseTupleTest {
  private final Ir.SymRef a = ir.ref("a");
  private final Ir.SymRef b = ir.ref("b");
  private final Ir.SymRef c = ir.ref("c");

  @Test void testGetOfMakeTuple() {
    assertThat(CollapseTuple.apply(ir.tupleGet(0, ir.makeTuple(a, b)), false),
        is(a));
    assertThat(CollapseTuple.apply(ir.tupleGet(1, ir.makeTuple(a, b)), false),
        is(b));
    final Ir.FunCall outOfRange = ir.tupleGet(2, ir.makeTuple(a, b));
    assertThat(CollapseTuple.apply(outOfRange, false),
        sameInstance(outOfRange));
  }

  /** A malformed {@code tuple_get} is left alone. */
  @Test void testGetWithoutArguments() {
    final Ir.FunCall noArgs = ir.call("tuple_get");
    assertThat(CollapseTuple.apply(noArgs, false), sameInstance(noArgs));
    final Ir.FunCall oneArg = ir.call("tuple_get", ir.intLiteral(0));
    assertThat(CollapseTuple.apply(oneArg, false), sameInstance(oneArg));
    final Ir.FunCall tuple = ir.makeTuple(oneArg);
    assertThat(CollapseTuple.apply(tuple, true), sameInstance(tuple));
  }

  @Test void testMakeTupleOfGets() {
    final Ir.SymRef t = ir.ref("t");
    final Ir.FunCall call = ir.makeTuple(ir.tupleGet(0, t), ir.tupleGet(1, t));
    // The size of "t" is unknown.
    assertThat(CollapseTuple.apply(call, false), sameInstance(call));
    assertThat(CollapseTuple.apply(call, true), is(t));

    final Ir.SymRef t2 =
        ir.ref("t",
            new TupleType(ImmutableList.of(ScalarType.INT32, ScalarType.BOOL)));
    assertThat(
        CollapseTuple.apply(
            ir.makeTuple(ir.tupleGet(0, t2), ir.tupleGet(1, t2)), false),
        is(t));

    final Ir.SymRef t3 =
        ir.ref("t",
            new TupleType(
                ImmutableList.of(ScalarType.INT32, ScalarType.BOOL,
                    ScalarType.INT32)));
    final Ir.FunCall prefix =
        ir.makeTuple(ir.tupleGet(0, t3), ir.tupleGet(1, t3));
    assertThat(CollapseTuple.apply(prefix, false), sameInstance(prefix));
  }

  @Test void testMakeTupleOfGetsOutOfOrder() {
    final Ir.SymRef t = ir.ref("t");
    final Ir.FunCall call = ir.makeTuple(ir.tupleGet(1, t), ir.tupleGet(0, t));
    assertThat(CollapseTuple.apply(call, true), sameInstance(call));
  }

  @Test void testGetOfIf() {
    final Ir.FunCall call =
        ir.tupleGet(1,
            ir.ifThenElse(c, ir.makeTuple(a, b),
                ir.makeTuple(ir.ref("d"), ir.ref("e"))));
    assertThat(CollapseTuple.apply(call, false),
        is(ir.ifThenElse(c, b, ir.ref("e"))));
  }

  @Test void testGetOfLet() {
    final Ir.FunCall call =
        ir.tupleGet(0, ir.let("x", c, ir.makeTuple(ir.ref("x"), b)));
    assertThat(CollapseTuple.apply(call, false),
        is(ir.let("x", c, ir.ref("x"))));
  }
}

// End CollapseTupleTest.java
