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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;
import java.util.function.Predicate;
import net.hydromatic.itir.ast.Ir;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop} and {@link PassOptions}. */
public class PassOptionsTest {
  @Test void testDefaults() {
    final PassOptions options = PassOptions.DEFAULT;
    assertThat(options.commonSubexpressionElimination(), is(true));
    assertThat(options.extractTemporaries(), is(false));
    assertThat(options.forceInlineLambdaArgs(), is(false));
    assertThat(options.unconditionallyCollapseTuples(), is(false));
    assertThat(options.unrollReduce(), is(false));
    assertThat(options.maxFixpointIterations(), is(10));
    assertThat(options,
        hasToString("{commonSubexpressionElimination=true, "
            + "extractTemporaries=false, forceInlineLambdaArgs=false, "
            + "maxFixpointIterations=10, "
            + "unconditionallyCollapseTuples=false, unrollReduce=false}"));
  }

  @Test void testWith() {
    final PassOptions options =
        PassOptions.DEFAULT.with(Prop.UNROLL_REDUCE, true)
            .with(Prop.MAX_FIXPOINT_ITERATIONS, 3);
    assertThat(options.unrollReduce(), is(true));
    assertThat(options.maxFixpointIterations(), is(3));
    assertThat(PassOptions.DEFAULT.unrollReduce(), is(false));

    // Setting a property to its current value returns the same object.
    assertThat(PassOptions.DEFAULT.with(Prop.UNROLL_REDUCE, false),
        sameInstance(PassOptions.DEFAULT));
    assertThat(PassOptions.DEFAULT.with(Prop.UNROLL_REDUCE, true),
        is(PassOptions.DEFAULT.with(Prop.UNROLL_REDUCE, true)));
  }

  @Test void testInvalidValues() {
    assertThrows(IllegalArgumentException.class, () ->
        PassOptions.DEFAULT.with(Prop.UNROLL_REDUCE, 1));
    assertThrows(IllegalArgumentException.class, () ->
        PassOptions.DEFAULT.with(Prop.MAX_FIXPOINT_ITERATIONS, 0));
  }

  @Test void testProperties() {
    final Properties properties = new Properties();
    properties.setProperty("extractTemporaries", "true");
    properties.setProperty("MAX_FIXPOINT_ITERATIONS", " 20 ");
    final PassOptions options = PassOptions.of(properties);
    assertThat(options.extractTemporaries(), is(true));
    assertThat(options.maxFixpointIterations(), is(20));

    final Properties bad = new Properties();
    bad.setProperty("unrollReduce", "yes");
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () ->
            PassOptions.of(bad));
    assertThat(e.getMessage(),
        is("value yes is not valid for boolean property unrollReduce"));

    final Properties unknown = new Properties();
    unknown.setProperty("inlineEverything", "true");
    final IllegalArgumentException e2 =
        assertThrows(IllegalArgumentException.class, () ->
            PassOptions.of(unknown));
    assertThat(e2.getMessage(), is("property inlineEverything not found"));
  }

  @Test void testNonScalarOptions() {
    final Function<Ir.StencilClosure, Predicate<Ir.Expr>> heuristic =
        closure -> e -> true;
    final PassOptions options =
        PassOptions.DEFAULT.withTemporaryExtractionHeuristic(heuristic)
            .withSymbolicDomainSizes(ImmutableMap.of("Edge", "nEdges"));
    assertThat(options.temporaryExtractionHeuristic, sameInstance(heuristic));
    assertThat(options.symbolicDomainSizes,
        is(ImmutableMap.of("Edge", "nEdges")));
    assertThat(options.toString().endsWith(
        ", symbolicDomainSizes={Edge=nEdges}}"), is(true));
  }

  @Test void testProp() {
    assertThat(Prop.lookup("unrollReduce"), is(Prop.UNROLL_REDUCE));
    assertThat(Prop.lookup("UNROLL_REDUCE"), is(Prop.UNROLL_REDUCE));

    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    assertThat(Prop.MAX_FIXPOINT_ITERATIONS.intValue(map), is(10));
    Prop.MAX_FIXPOINT_ITERATIONS.set(map, 4);
    assertThat(Prop.MAX_FIXPOINT_ITERATIONS.intValue(map), is(4));
    Prop.MAX_FIXPOINT_ITERATIONS.set(map, null);
    assertThat(Prop.MAX_FIXPOINT_ITERATIONS.intValue(map), is(10));

    // Asking for a value of the wrong type is an error.
    assertThrows(IllegalArgumentException.class, () ->
        Prop.MAX_FIXPOINT_ITERATIONS.booleanValue(map));
  }
}

// End PassOptionsTest.java
