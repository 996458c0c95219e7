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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.type.ScalarType;
import org.junit.jupiter.api.Test;

/** Tests for {@link TraceShifts}. */
public class TraceShiftsTest {
  private final Ir.SymRef x = ir.ref("x");
  private final Ir.SymRef y = ir.ref("y");

  private static Map<String, Set<List<Object>>> trace(Ir.Expr stencil,
      String... inputs) {
    return TraceShifts.trace(stencil, ImmutableList.copyOf(inputs));
  }

  @Test void testDeref() {
    assertThat(trace(ir.lambda("x", ir.deref(x)), "inp"),
        hasToString("{inp=[[]]}"));
  }

  @Test void testShift() {
    final Ir.Lambda stencil =
        ir.lambda("x",
            ir.plus(ir.deref(ir.call(ir.shift("Ioff", 1), x)),
                ir.deref(ir.call(ir.shift("Ioff", -1), x))));
    assertThat(trace(stencil, "x"),
        hasToString("{x=[[Ioffₒ, 1ₒ], [Ioffₒ, -1ₒ]]}"));
  }

  /** An input that is shifted but never dereferenced is not accessed. */
  @Test void testUnused() {
    final Ir.Lambda stencil =
        ir.lambda("x", "y",
            ir.plus(ir.deref(x),
                ir.canDeref(ir.call(ir.shift("Ioff", 1), y))));
    assertThat(trace(stencil, "x", "y"), hasToString("{x=[[]], y=[]}"));
  }

  /** Dereferencing a shifted lift evaluates the lifted stencil on shifted
   * arguments. */
  @Test void testLift() {
    final Ir.SymRef z = ir.ref("z");
    final Ir.Lambda inner =
        ir.lambda("z",
            ir.plus(ir.deref(ir.call(ir.shift("Joff", 1), z)), ir.deref(z)));
    final Ir.Lambda stencil =
        ir.lambda("x",
            ir.deref(
                ir.call(ir.shift("Ioff", 1), ir.liftedCall(inner, x))));
    assertThat(trace(stencil, "x"),
        hasToString("{x=[[Ioffₒ, 1ₒ, Joffₒ, 1ₒ], [Ioffₒ, 1ₒ]]}"));
  }

  @Test void testReduceOverNeighbors() {
    final Ir.Lambda stencil =
        ir.lambda("x",
            ir.call(ir.reduce(ir.ref("plus"), ir.intLiteral(0)),
                ir.neighbors("V2E", x)));
    assertThat(trace(stencil, "x"),
        hasToString("{x=[[V2Eₒ, ALL_NEIGHBORS]]}"));
  }

  /** Both branches of a conditional may be accessed. */
  @Test void testIf() {
    final Ir.Lambda stencil =
        ir.lambda("x", "y",
            ir.deref(ir.ifThenElse(ir.ref("c"), x,
                ir.call(ir.shift("Ioff", 1), y))));
    assertThat(trace(stencil, "x", "y"),
        hasToString("{x=[[]], y=[[Ioffₒ, 1ₒ]]}"));
  }

  @Test void testTuple() {
    final Ir.Lambda stencil =
        ir.lambda("x", "y",
            ir.tupleGet(1, ir.deref(ir.makeTuple(x, y))));
    assertThat(trace(stencil, "x", "y"), hasToString("{x=[[]], y=[[]]}"));
  }

  /** An index that is not a valid int accesses the whole tuple. */
  @Test void testTupleIndexOutOfIntRange() {
    final Ir.Lambda stencil =
        ir.lambda("x", "y",
            ir.call("tuple_get", ir.literal("9999999999", ScalarType.INT64),
                ir.deref(ir.makeTuple(x, y))));
    assertThat(trace(stencil, "x", "y"), hasToString("{x=[[]], y=[[]]}"));
  }

  @Test void testClosure() {
    final Ir.StencilClosure closure =
        ir.closure(iDomain("n"),
            ir.lambda("a", "b", ir.plus(ir.deref(ir.ref("a")),
                ir.deref(ir.call(ir.shift("Ioff", 2), ir.ref("b"))))),
            "out", "inp1", "inp2");
    assertThat(TraceShifts.trace(closure),
        hasToString("{inp1=[[]], inp2=[[Ioffₒ, 2ₒ]]}"));
  }
}

// End TraceShiftsTest.java
