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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.itir.type.ScalarType;
import net.hydromatic.itir.type.Type;
import org.junit.jupiter.api.Test;

/** Tests for {@link TypeCell}. */
public class TypeCellTest {
  @Test
  void testCallbacksFireOnResolve() {
    final TypeCell cell = new TypeCell();
    final List<String> events = new ArrayList<>();
    cell.onReady(t -> events.add("a:" + t));
    cell.onReady(t -> events.add("b:" + t));
    assertThat(cell.isResolved(), is(false));
    assertThat(events.isEmpty(), is(true));

    cell.resolve(ScalarType.INT32);
    assertThat(cell.isResolved(), is(true));
    assertThat(cell.get(), is(ScalarType.INT32));
    assertThat(events, hasToString("[a:int32, b:int32]"));

    // A callback registered after resolution fires immediately
    cell.onReady(t -> events.add("c:" + t));
    assertThat(events, hasToString("[a:int32, b:int32, c:int32]"));
  }

  @Test
  void testResolveTwice() {
    final TypeCell cell = new TypeCell();
    cell.resolve(ScalarType.INT32);
    final AssertionError e =
        assertThrows(AssertionError.class, () -> cell.resolve(ScalarType.BOOL));
    assertThat(e.getMessage(), startsWith("cell resolved twice"));
  }

  @Test
  void testGetUnresolved() {
    assertThrows(IllegalStateException.class, () -> new TypeCell().get());
  }

  @Test
  void testCycleIsDetected() {
    final TypeCell cell = new TypeCell();
    cell.onReady(t -> cell.resolve(ScalarType.BOOL));
    final AssertionError e =
        assertThrows(AssertionError.class,
            () -> cell.resolve(ScalarType.INT32));
    assertThat(e.getMessage(), startsWith("cyclic dependency"));
  }

  /** Tests that a combined callback fires once, when the last of its
   * dependencies is ready, with the types in order. */
  @Test
  void testOnReadyMany() {
    final Typing.Rule rule0 = new Typing.Rule("f", args -> Typing.DEFERRED,
        false);
    final Typing.Rule rule1 = new Typing.Rule("g", args -> Typing.DEFERRED,
        false);
    final List<List<Type>> fired = new ArrayList<>();
    TypeCell.onReady(
        ImmutableList.of(rule0, Typing.of(ScalarType.BOOL), rule1),
        fired::add);
    assertThat(fired.isEmpty(), is(true));
    rule1.cell.resolve(ScalarType.INT64);
    assertThat(fired.isEmpty(), is(true));
    rule0.cell.resolve(ScalarType.FLOAT32);
    assertThat(fired, hasToString("[[float32, bool, int64]]"));
  }

  @Test
  void testOnReadyAllKnown() {
    final List<List<Type>> fired = new ArrayList<>();
    TypeCell.onReady(fired::add, Typing.of(ScalarType.INT32));
    assertThat(fired, hasToString("[[int32]]"));
  }
}

// End TypeCellTest.java
