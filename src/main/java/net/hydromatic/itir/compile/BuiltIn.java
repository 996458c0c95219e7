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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Built-in functions of the iterator IR.
 *
 * <p>Every program implicitly declares these names. The table is immutable
 * and is built once. */
public enum BuiltIn {
  ABS(Category.UNARY_MATH_NUMBER),
  NOT_(Category.UNARY_LOGICAL),
  SIN(Category.UNARY_MATH_FP),
  COS(Category.UNARY_MATH_FP),
  TAN(Category.UNARY_MATH_FP),
  ARCSIN(Category.UNARY_MATH_FP),
  ARCCOS(Category.UNARY_MATH_FP),
  ARCTAN(Category.UNARY_MATH_FP),
  SINH(Category.UNARY_MATH_FP),
  COSH(Category.UNARY_MATH_FP),
  TANH(Category.UNARY_MATH_FP),
  ARCSINH(Category.UNARY_MATH_FP),
  ARCCOSH(Category.UNARY_MATH_FP),
  ARCTANH(Category.UNARY_MATH_FP),
  SQRT(Category.UNARY_MATH_FP),
  EXP(Category.UNARY_MATH_FP),
  LOG(Category.UNARY_MATH_FP),
  GAMMA(Category.UNARY_MATH_FP),
  CBRT(Category.UNARY_MATH_FP),
  FLOOR(Category.UNARY_MATH_FP),
  CEIL(Category.UNARY_MATH_FP),
  TRUNC(Category.UNARY_MATH_FP),
  ISFINITE(Category.UNARY_FP_PREDICATE),
  ISINF(Category.UNARY_FP_PREDICATE),
  ISNAN(Category.UNARY_FP_PREDICATE),
  MINIMUM(Category.BINARY_MATH_NUMBER),
  MAXIMUM(Category.BINARY_MATH_NUMBER),
  FMOD(Category.BINARY_MATH_NUMBER),
  PLUS(Category.BINARY_MATH_NUMBER),
  MINUS(Category.BINARY_MATH_NUMBER),
  MULTIPLIES(Category.BINARY_MATH_NUMBER),
  DIVIDES(Category.BINARY_MATH_NUMBER),
  MOD(Category.BINARY_MATH_NUMBER),
  FLOORDIV(Category.BINARY_MATH_NUMBER),
  POWER(Category.BINARY_MATH_NUMBER),
  EQ(Category.COMPARISON),
  NOT_EQ(Category.COMPARISON),
  LESS(Category.COMPARISON),
  LESS_EQUAL(Category.COMPARISON),
  GREATER(Category.COMPARISON),
  GREATER_EQUAL(Category.COMPARISON),
  AND_(Category.BINARY_LOGICAL),
  OR_(Category.BINARY_LOGICAL),
  XOR_(Category.BINARY_LOGICAL),
  INT32(Category.TYPE),
  INT64(Category.TYPE),
  FLOAT32(Category.TYPE),
  FLOAT64(Category.TYPE),
  BOOL(Category.TYPE),
  MAKE_TUPLE(Category.STRUCTURAL),
  TUPLE_GET(Category.STRUCTURAL),
  CAST_(Category.STRUCTURAL),
  IF_(Category.STRUCTURAL),
  CARTESIAN_DOMAIN(Category.DOMAIN),
  UNSTRUCTURED_DOMAIN(Category.DOMAIN),
  NAMED_RANGE(Category.DOMAIN),
  SHIFT(Category.ITERATOR),
  NEIGHBORS(Category.ITERATOR),
  DEREF(Category.ITERATOR),
  CAN_DEREF(Category.ITERATOR),
  LIFT(Category.ITERATOR),
  REDUCE(Category.ITERATOR),
  SCAN(Category.ITERATOR),
  LIST_GET(Category.LIST),
  MAP_(Category.LIST),
  MAKE_CONST_LIST(Category.LIST),
  AS_FIELDOP(Category.FIELD);

  /** Name by which programs refer to this builtin, e.g. "make_tuple". */
  public final String id;
  public final Category category;

  private static final ImmutableMap<String, BuiltIn> BY_ID;

  /** Names of all builtins. */
  public static final ImmutableSet<String> NAMES;

  static {
    final ImmutableMap.Builder<String, BuiltIn> byId = ImmutableMap.builder();
    for (BuiltIn builtIn : values()) {
      byId.put(builtIn.id, builtIn);
    }
    BY_ID = byId.build();
    NAMES = BY_ID.keySet();
  }

  BuiltIn(Category category) {
    this.id = name().toLowerCase(Locale.ROOT);
    this.category = category;
  }

  /** Looks up a builtin by name; returns null if not found. */
  public static @Nullable BuiltIn lookup(String id) {
    return BY_ID.get(id);
  }

  /** Returns whether a name is the name of a builtin. */
  public static boolean isBuiltIn(String id) {
    return BY_ID.containsKey(id);
  }

  /** Returns the names of the builtins in the given categories. */
  public static Set<String> namesIn(Category... categories) {
    final Set<Category> set = EnumSet.noneOf(Category.class);
    set.addAll(Arrays.asList(categories));
    final ImmutableSet.Builder<String> names = ImmutableSet.builder();
    for (BuiltIn builtIn : values()) {
      if (set.contains(builtIn.category)) {
        names.add(builtIn.id);
      }
    }
    return names.build();
  }

  /** Category of builtin; builtins in a category share a typing rule. */
  public enum Category {
    UNARY_MATH_NUMBER,
    UNARY_LOGICAL,
    UNARY_MATH_FP,
    UNARY_FP_PREDICATE,
    BINARY_MATH_NUMBER,
    COMPARISON,
    BINARY_LOGICAL,
    TYPE,
    STRUCTURAL,
    DOMAIN,
    ITERATOR,
    LIST,
    FIELD
  }
}

// End BuiltIn.java
