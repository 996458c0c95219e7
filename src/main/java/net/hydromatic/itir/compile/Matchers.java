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

import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.type.FieldType;
import net.hydromatic.itir.type.TupleType;
import net.hydromatic.itir.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Recognizes common shapes of expression. */
abstract class Matchers {
  private Matchers() {}

  /** Returns whether an expression is an applied call to a curried builtin,
   * such as {@code shift(Iₒ, 1ₒ)(it)} or {@code map_(f)(xs)}. */
  static boolean isAppliedCallTo(Ir.Expr e, String name) {
    return e instanceof Ir.FunCall && ((Ir.FunCall) e).fun.isCallTo(name);
  }

  /** Returns the value of an integer literal or an integer offset literal,
   * or null. */
  static @Nullable Integer intValue(Ir.Expr e) {
    if (e instanceof Ir.Literal
        && ((Ir.Literal) e).scalarType.kind.isIntegral()) {
      try {
        return Integer.parseInt(((Ir.Literal) e).value);
      } catch (NumberFormatException ex) {
        return null;
      }
    }
    if (e instanceof Ir.OffsetLiteral && ((Ir.OffsetLiteral) e).isInt()) {
      return ((Ir.OffsetLiteral) e).intValue();
    }
    return null;
  }

  /** Returns the number of elements of a tuple-valued expression, or -1 if
   * not known. */
  static int tupleArity(Ir.Expr e) {
    if (e.isCallTo("make_tuple")) {
      return ((Ir.FunCall) e).args.size();
    }
    Type type = e.type;
    if (type instanceof FieldType) {
      type = ((FieldType) type).dtype;
    }
    if (type instanceof TupleType) {
      return ((TupleType) type).types.size();
    }
    return -1;
  }
}

// End Matchers.java
