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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;
import java.util.function.Predicate;
import net.hydromatic.itir.ast.Ir;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Options for {@link PassManager#applyCommonTransforms}.
 *
 * <p>Immutable. The scalar options are {@link Prop properties}; the
 * heuristic for extracting temporaries and the sizes of unstructured
 * dimensions are held separately. */
public class PassOptions {
  /** Options with every property at its default value. */
  public static final PassOptions DEFAULT =
      new PassOptions(ImmutableMap.of(), null, ImmutableMap.of());

  private final ImmutableMap<Prop, Object> map;
  public final @Nullable Function<Ir.StencilClosure, Predicate<Ir.Expr>>
      temporaryExtractionHeuristic;
  public final ImmutableMap<String, String> symbolicDomainSizes;

  private PassOptions(Map<Prop, Object> map,
      @Nullable Function<Ir.StencilClosure, Predicate<Ir.Expr>> heuristic,
      Map<String, String> symbolicDomainSizes) {
    this.map = ImmutableMap.copyOf(map);
    this.temporaryExtractionHeuristic = heuristic;
    this.symbolicDomainSizes = ImmutableMap.copyOf(symbolicDomainSizes);
  }

  /** Creates options from properties whose keys are property names, for
   * example "unrollReduce=true". Unknown keys are an error. */
  public static PassOptions of(Properties properties) {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    for (String name : properties.stringPropertyNames()) {
      Prop.lookup(name).setLenient(map, properties.getProperty(name));
    }
    return new PassOptions(map, null, ImmutableMap.of());
  }

  /** Returns a copy of these options with a property set. */
  public PassOptions with(Prop prop, Object value) {
    requireNonNull(value, "value");
    if (value.equals(prop.get(map))) {
      return this;
    }
    final Map<Prop, Object> map2 = new EnumMap<>(Prop.class);
    map2.putAll(map);
    prop.set(map2, value);
    return new PassOptions(map2, temporaryExtractionHeuristic,
        symbolicDomainSizes);
  }

  /** Returns a copy of these options with a given heuristic for extracting
   * temporaries. */
  public PassOptions withTemporaryExtractionHeuristic(
      @Nullable Function<Ir.StencilClosure, Predicate<Ir.Expr>> heuristic) {
    return heuristic == temporaryExtractionHeuristic ? this
        : new PassOptions(map, heuristic, symbolicDomainSizes);
  }

  /** Returns a copy of these options with given sizes of unstructured
   * dimensions. Each size is an expression, usually the name of a program
   * parameter. */
  public PassOptions withSymbolicDomainSizes(Map<String, String> sizes) {
    return sizes.equals(symbolicDomainSizes) ? this
        : new PassOptions(map, temporaryExtractionHeuristic, sizes);
  }

  public boolean extractTemporaries() {
    return Prop.EXTRACT_TEMPORARIES.booleanValue(map);
  }

  public boolean unrollReduce() {
    return Prop.UNROLL_REDUCE.booleanValue(map);
  }

  public boolean commonSubexpressionElimination() {
    return Prop.COMMON_SUBEXPRESSION_ELIMINATION.booleanValue(map);
  }

  public boolean forceInlineLambdaArgs() {
    return Prop.FORCE_INLINE_LAMBDA_ARGS.booleanValue(map);
  }

  public boolean unconditionallyCollapseTuples() {
    return Prop.UNCONDITIONALLY_COLLAPSE_TUPLES.booleanValue(map);
  }

  public int maxFixpointIterations() {
    return Prop.MAX_FIXPOINT_ITERATIONS.intValue(map);
  }

  @Override
  public int hashCode() {
    return Objects.hash(map, temporaryExtractionHeuristic,
        symbolicDomainSizes);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof PassOptions
            && map.equals(((PassOptions) o).map)
            && Objects.equals(temporaryExtractionHeuristic,
                ((PassOptions) o).temporaryExtractionHeuristic)
            && symbolicDomainSizes.equals(
                ((PassOptions) o).symbolicDomainSizes);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("{");
    for (Prop prop : Prop.BY_CAMEL_NAME) {
      if (b.length() > 1) {
        b.append(", ");
      }
      b.append(prop.camelName).append('=').append(prop.get(map));
    }
    if (!symbolicDomainSizes.isEmpty()) {
      b.append(", symbolicDomainSizes=").append(symbolicDomainSizes);
    }
    return b.append('}').toString();
  }
}

// End PassOptions.java
