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
package net.hydromatic.itir.ast;

import com.google.common.collect.ImmutableMap;

/** Sub-types of {@link Ir.Node} and of {@link net.hydromatic.itir.type.Type}.
 *
 * <p>Binary arithmetic, comparison and logical builtins also have an op, used
 * only when writing a call to them in infix form. */
public enum Op {
  // symbols
  SYM(true),
  SYM_REF(true),

  // literals
  LITERAL(true),
  OFFSET_LITERAL(true),
  AXIS_LITERAL(true),

  // expressions
  LAMBDA,
  FUN_CALL(" ", 9),

  // top-level nodes
  FUNCTION_DEFINITION,
  STENCIL_CLOSURE,
  SET_AT,
  TEMPORARY,
  PROGRAM,

  // types
  SCALAR_TYPE(true),
  FIELD_TYPE(true),
  TUPLE_TYPE(true),
  FUNCTION_TYPE(" -> ", 6, false),
  ITERATOR_TYPE(true),
  LIST_TYPE(true),
  DOMAIN_TYPE(true),
  NAMED_RANGE_TYPE(true),
  OFFSET_LITERAL_TYPE(true),
  DIMENSION_TYPE(true),
  DEFERRED_TYPE(true),
  STENCIL_CLOSURE_TYPE,
  PROGRAM_TYPE,

  // infix forms of builtins
  TIMES(" * ", 7),
  DIVIDE(" / ", 7),
  MOD(" % ", 7),
  PLUS(" + ", 6),
  MINUS(" - ", 6),
  LT(" < ", 4),
  LE(" <= ", 4),
  GT(" > ", 4),
  GE(" >= ", 4),
  EQ(" == ", 4),
  NE(" != ", 4),
  AND(" && ", 3),
  XOR(" ^ ", 2),
  OR(" || ", 1);

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  /** Map from builtin function name to the infix op that prints it. */
  public static final ImmutableMap<String, Op> BY_BUILTIN_NAME =
      ImmutableMap.<String, Op>builder()
          .put("multiplies", TIMES)
          .put("divides", DIVIDE)
          .put("mod", MOD)
          .put("plus", PLUS)
          .put("minus", MINUS)
          .put("less", LT)
          .put("less_equal", LE)
          .put("greater", GT)
          .put("greater_equal", GE)
          .put("eq", EQ)
          .put("not_eq", NE)
          .put("and_", AND)
          .put("xor_", XOR)
          .put("or_", OR)
          .build();

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(
        padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this op is a type. */
  public boolean isType() {
    return name().endsWith("_TYPE");
  }
}

// End Op.java
