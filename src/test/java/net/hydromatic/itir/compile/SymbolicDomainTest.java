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
import static net.hydromatic.itir.compile.Fixtures.J_DIM;
import static net.hydromatic.itir.compile.Fixtures.MESH;
import static net.hydromatic.itir.compile.Fixtures.VERTEX;
import static net.hydromatic.itir.compile.Fixtures.iDomain;
import static net.hydromatic.itir.compile.Fixtures.meshDomain;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.itir.ast.Ir;
import org.junit.jupiter.api.Test;

/** Tests for {@link SymbolicDomain}. */
public class SymbolicDomainTest {
  /** Converts strings to offset tags and integers to offset indices;
   * {@link TraceShifts#ALL_NEIGHBORS} is kept as is. */
  private static List<Object> offsets(Object... offsets) {
    final ImmutableList.Builder<Object> list = ImmutableList.builder();
    for (Object o : offsets) {
      if (o instanceof String) {
        list.add(ir.offset((String) o));
      } else if (o instanceof Integer) {
        list.add(ir.offset((Integer) o));
      } else {
        list.add(o);
      }
    }
    return list.build();
  }

  @SafeVarargs
  private static Set<List<Object>> shifts(List<Object>... lists) {
    return ImmutableSet.copyOf(lists);
  }

  @Test void testNoShifts() {
    final Ir.FunCall domain = iDomain("n");
    assertThat(
        SymbolicDomain.accessed(domain, ImmutableSet.of(), CARTESIAN,
            ImmutableMap.of()),
        sameInstance(domain));
  }

  @Test void testCartesian() {
    final Ir.FunCall accessed =
        SymbolicDomain.accessed(iDomain("n"),
            shifts(offsets("Ioff", 1), offsets("Ioff", -1), offsets()),
            CARTESIAN, ImmutableMap.of());
    assertThat(accessed,
        hasToString("cartesian_domain(named_range(IDimₐ, -1, n + 1))"));
  }

  @Test void testTwoDimensions() {
    final Ir.FunCall domain =
        ir.cartesianDomain(
            ir.namedRange(I_DIM.value, ir.intLiteral(0), ir.ref("n")),
            ir.namedRange(J_DIM.value, ir.intLiteral(0), ir.ref("m")));
    final Ir.FunCall accessed =
        SymbolicDomain.accessed(domain,
            shifts(offsets("Ioff", 1, "Joff", -1)), CARTESIAN,
            ImmutableMap.of());
    assertThat(accessed,
        hasToString("cartesian_domain(named_range(IDimₐ, 1, n + 1), "
            + "named_range(JDimₐ, -1, m - 1))"));
  }

  @Test void testUnionOfDifferentBounds() {
    final SymbolicDomain d =
        SymbolicDomain.of(iDomain("n")).union(SymbolicDomain.of(iDomain("m")));
    assertThat(d,
        hasToString("cartesian_domain(named_range(IDimₐ, 0, maximum(n, m)))"));
  }

  /** Shifting from vertices to their edges requires the producer to cover
   * all edges. */
  @Test void testConnectivity() {
    final Ir.FunCall accessed =
        SymbolicDomain.accessed(meshDomain(VERTEX, "nVertices"),
            shifts(offsets("V2E", TraceShifts.ALL_NEIGHBORS)), MESH,
            ImmutableMap.of("Edge", "nEdges"));
    assertThat(accessed,
        hasToString("unstructured_domain(named_range(Edgeₐ, 0, nEdges))"));
  }

  @Test void testConnectivityWithoutSize() {
    final CompileException e =
        assertThrows(CompileException.class, () ->
            SymbolicDomain.accessed(meshDomain(VERTEX, "nVertices"),
                shifts(offsets("V2E", 0)), MESH, ImmutableMap.of()));
    assertThat(e.getMessage(), is("size of dimension Edge is not known"));
  }

  @Test void testUnknownOffset() {
    final CompileException e =
        assertThrows(CompileException.class, () ->
            SymbolicDomain.accessed(iDomain("n"), shifts(offsets("Koff", 1)),
                CARTESIAN, ImmutableMap.of()));
    assertThat(e.getMessage(), is("unknown offset Koff"));
  }

  @Test void testNotADomain() {
    final CompileException e =
        assertThrows(CompileException.class, () ->
            SymbolicDomain.of(ir.ref("d")));
    assertThat(e.getMessage(), containsString("cannot analyze domain"));
  }
}

// End SymbolicDomainTest.java
