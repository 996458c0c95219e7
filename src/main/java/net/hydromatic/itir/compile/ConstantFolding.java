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

import java.util.List;
import java.util.Locale;
import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.ast.Shuttle;
import net.hydromatic.itir.type.ScalarKind;
import net.hydromatic.itir.type.ScalarType;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Evaluates calls to builtins whose arguments are literals.
 *
 * <p>Also simplifies {@code if_} whose condition is a literal, and
 * {@code minimum} and {@code maximum} whose operands are identical.
 * Integer arithmetic follows the wrap-around and truncating-division rules
 * of the generated C++ code. Calls whose result would not be finite, or
 * that would divide by zero, are left alone. */
public class ConstantFolding extends Shuttle {
  private static final ConstantFolding INSTANCE = new ConstantFolding();

  private ConstantFolding() {}

  /** Folds constants in a tree. */
  @SuppressWarnings("unchecked")
  public static <N extends Ir.Node> N apply(N node) {
    return (N) node.accept(INSTANCE);
  }

  @Override
  protected Ir.Expr visit(Ir.FunCall funCall) {
    final Ir.Expr e = super.visit(funCall);
    if (!(e instanceof Ir.FunCall)
        || !(((Ir.FunCall) e).fun instanceof Ir.SymRef)) {
      return e;
    }
    final Ir.FunCall call = (Ir.FunCall) e;
    final BuiltIn builtIn = BuiltIn.lookup(((Ir.SymRef) call.fun).id);
    if (builtIn == null) {
      return call;
    }
    switch (builtIn) {
    case IF_:
      if (call.args.size() == 3 && call.arg(0) instanceof Ir.Literal) {
        final Boolean b = bool((Ir.Literal) call.arg(0));
        if (b != null) {
          return b ? call.arg(1) : call.arg(2);
        }
      }
      return call;
    case MINIMUM:
    case MAXIMUM:
      if (call.args.size() == 2 && call.arg(0).equals(call.arg(1))) {
        return call.arg(0);
      }
      break;
    case CAST_:
      if (call.args.size() == 2 && call.arg(0) instanceof Ir.Literal
          && call.arg(1) instanceof Ir.SymRef) {
        final Ir.Expr folded =
            convert((Ir.Literal) call.arg(0), ((Ir.SymRef) call.arg(1)).id);
        return folded != null ? folded : call;
      }
      return call;
    default:
      break;
    }
    for (Ir.Expr arg : call.args) {
      if (!(arg instanceof Ir.Literal)) {
        return call;
      }
    }
    final Ir.Expr folded = fold(builtIn, literals(call.args));
    return folded != null ? folded : call;
  }

  @SuppressWarnings("unchecked")
  private static List<Ir.Literal> literals(List<Ir.Expr> args) {
    return (List<Ir.Literal>) (List<?>) args;
  }

  private static Ir.@Nullable Expr fold(BuiltIn builtIn,
      List<Ir.Literal> args) {
    try {
      switch (builtIn.category) {
      case TYPE:
        return args.size() == 1 ? convert(args.get(0), builtIn.id) : null;
      case UNARY_LOGICAL:
        final Boolean b = args.size() == 1 ? bool(args.get(0)) : null;
        return b == null ? null : ir.boolLiteral(!b);
      case BINARY_LOGICAL:
        return args.size() == 2 ? logical(builtIn, args.get(0), args.get(1))
            : null;
      case UNARY_MATH_NUMBER:
      case UNARY_MATH_FP:
      case UNARY_FP_PREDICATE:
        return args.size() == 1 ? unary(builtIn, args.get(0)) : null;
      case BINARY_MATH_NUMBER:
        return args.size() == 2 ? binary(builtIn, args.get(0), args.get(1))
            : null;
      case COMPARISON:
        return args.size() == 2
            ? compare(builtIn, args.get(0), args.get(1)) : null;
      default:
        return null;
      }
    } catch (NumberFormatException e) {
      // Literal is not in a format we can evaluate; leave the call alone.
      return null;
    }
  }

  private static @Nullable Boolean bool(Ir.Literal literal) {
    if (literal.scalarType.kind != ScalarKind.BOOL) {
      return null;
    }
    switch (literal.value.toLowerCase(Locale.ROOT)) {
    case "true":
      return true;
    case "false":
      return false;
    default:
      return null;
    }
  }

  private static Ir.@Nullable Expr logical(BuiltIn builtIn, Ir.Literal a0,
      Ir.Literal a1) {
    final Boolean b0 = bool(a0);
    final Boolean b1 = bool(a1);
    if (b0 == null || b1 == null) {
      return null;
    }
    switch (builtIn) {
    case AND_:
      return ir.boolLiteral(b0 && b1);
    case OR_:
      return ir.boolLiteral(b0 || b1);
    case XOR_:
      return ir.boolLiteral(b0 ^ b1);
    default:
      return null;
    }
  }

  private static Ir.@Nullable Expr unary(BuiltIn builtIn, Ir.Literal a) {
    final ScalarKind kind = a.scalarType.kind;
    if (builtIn == BuiltIn.ABS && kind.isIntegral()) {
      return integral(a.scalarType, Math.abs(Long.parseLong(a.value)));
    }
    if (!kind.isFloatingPoint()) {
      return null;
    }
    final double d = Double.parseDouble(a.value);
    switch (builtIn) {
    case ISFINITE:
      return ir.boolLiteral(Double.isFinite(d));
    case ISINF:
      return ir.boolLiteral(Double.isInfinite(d));
    case ISNAN:
      return ir.boolLiteral(Double.isNaN(d));
    case ABS:
      return floating(a.scalarType, Math.abs(d));
    case SIN:
      return floating(a.scalarType, Math.sin(d));
    case COS:
      return floating(a.scalarType, Math.cos(d));
    case TAN:
      return floating(a.scalarType, Math.tan(d));
    case ARCSIN:
      return floating(a.scalarType, Math.asin(d));
    case ARCCOS:
      return floating(a.scalarType, Math.acos(d));
    case ARCTAN:
      return floating(a.scalarType, Math.atan(d));
    case SINH:
      return floating(a.scalarType, Math.sinh(d));
    case COSH:
      return floating(a.scalarType, Math.cosh(d));
    case TANH:
      return floating(a.scalarType, Math.tanh(d));
    case SQRT:
      return floating(a.scalarType, Math.sqrt(d));
    case EXP:
      return floating(a.scalarType, Math.exp(d));
    case LOG:
      return floating(a.scalarType, Math.log(d));
    case CBRT:
      return floating(a.scalarType, Math.cbrt(d));
    case FLOOR:
      return floating(a.scalarType, Math.floor(d));
    case CEIL:
      return floating(a.scalarType, Math.ceil(d));
    case TRUNC:
      return floating(a.scalarType, d < 0 ? Math.ceil(d) : Math.floor(d));
    default:
      // The inverse hyperbolic functions and gamma have no counterpart in
      // java.lang.Math.
      return null;
    }
  }

  /** Raises {@code base} to a non-negative {@code exponent} by repeated
   * squaring; overflow wraps. */
  static long power(long base, long exponent) {
    long result = 1;
    long b = base;
    for (long e = exponent; e > 0; e >>>= 1) {
      if ((e & 1) != 0) {
        result *= b;
      }
      b *= b;
    }
    return result;
  }

  private static Ir.@Nullable Expr binary(BuiltIn builtIn, Ir.Literal a0,
      Ir.Literal a1) {
    final ScalarType type = a0.scalarType;
    if (!type.equals(a1.scalarType)) {
      return null;
    }
    if (type.kind.isIntegral()) {
      final long v0 = Long.parseLong(a0.value);
      final long v1 = Long.parseLong(a1.value);
      switch (builtIn) {
      case PLUS:
        return integral(type, v0 + v1);
      case MINUS:
        return integral(type, v0 - v1);
      case MULTIPLIES:
        return integral(type, v0 * v1);
      case DIVIDES:
        return v1 == 0 ? null : integral(type, v0 / v1);
      case MOD:
        return v1 == 0 ? null : integral(type, v0 % v1);
      case FLOORDIV:
        return v1 == 0 ? null : integral(type, Math.floorDiv(v0, v1));
      case MINIMUM:
        return integral(type, Math.min(v0, v1));
      case MAXIMUM:
        return integral(type, Math.max(v0, v1));
      case POWER:
        if (v1 < 0) {
          return null;
        }
        return integral(type, power(v0, v1));
      default:
        return null;
      }
    }
    if (type.kind.isFloatingPoint()) {
      final double v0 = Double.parseDouble(a0.value);
      final double v1 = Double.parseDouble(a1.value);
      switch (builtIn) {
      case PLUS:
        return floating(type, v0 + v1);
      case MINUS:
        return floating(type, v0 - v1);
      case MULTIPLIES:
        return floating(type, v0 * v1);
      case DIVIDES:
        return floating(type, v0 / v1);
      case FMOD:
        return floating(type, v0 % v1);
      case FLOORDIV:
        return floating(type, Math.floor(v0 / v1));
      case MINIMUM:
        return floating(type, Math.min(v0, v1));
      case MAXIMUM:
        return floating(type, Math.max(v0, v1));
      case POWER:
        return floating(type, Math.pow(v0, v1));
      default:
        return null;
      }
    }
    return null;
  }

  private static Ir.@Nullable Expr compare(BuiltIn builtIn, Ir.Literal a0,
      Ir.Literal a1) {
    if (!a0.scalarType.equals(a1.scalarType)) {
      return null;
    }
    final int c;
    final ScalarKind kind = a0.scalarType.kind;
    if (kind.isIntegral()) {
      c = Long.compare(Long.parseLong(a0.value), Long.parseLong(a1.value));
    } else if (kind.isFloatingPoint()) {
      final double d0 = Double.parseDouble(a0.value);
      final double d1 = Double.parseDouble(a1.value);
      if (Double.isNaN(d0) || Double.isNaN(d1)) {
        return null;
      }
      c = Double.compare(d0, d1);
    } else if (kind == ScalarKind.BOOL) {
      final Boolean b0 = bool(a0);
      final Boolean b1 = bool(a1);
      if (b0 == null || b1 == null) {
        return null;
      }
      c = Boolean.compare(b0, b1);
    } else {
      return null;
    }
    switch (builtIn) {
    case EQ:
      return ir.boolLiteral(c == 0);
    case NOT_EQ:
      return ir.boolLiteral(c != 0);
    case LESS:
      return ir.boolLiteral(c < 0);
    case LESS_EQUAL:
      return ir.boolLiteral(c <= 0);
    case GREATER:
      return ir.boolLiteral(c > 0);
    case GREATER_EQUAL:
      return ir.boolLiteral(c >= 0);
    default:
      return null;
    }
  }

  /** Converts a literal to the scalar type named by a type builtin, such as
   * "float64". */
  private static Ir.@Nullable Expr convert(Ir.Literal literal,
      String typeName) {
    final BuiltIn target = BuiltIn.lookup(typeName);
    if (target == null || target.category != BuiltIn.Category.TYPE) {
      return null;
    }
    final ScalarType type = ScalarType.of(ScalarKind.of(typeName));
    final ScalarKind from = literal.scalarType.kind;
    try {
      if (type.kind == ScalarKind.BOOL) {
        if (from == ScalarKind.BOOL) {
          return literal;
        }
        return from.isNumber()
            ? ir.boolLiteral(Double.parseDouble(literal.value) != 0d)
            : null;
      }
      if (type.kind.isIntegral()) {
        if (from.isIntegral()) {
          return integral(type, Long.parseLong(literal.value));
        }
        if (from.isFloatingPoint()) {
          final double d = Double.parseDouble(literal.value);
          return Double.isFinite(d) ? integral(type, (long) d) : null;
        }
        final Boolean b = bool(literal);
        return b == null ? null : integral(type, b ? 1 : 0);
      }
      if (from.isNumber()) {
        return floating(type, Double.parseDouble(literal.value));
      }
      final Boolean b = bool(literal);
      return b == null ? null : floating(type, b ? 1 : 0);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static Ir.Literal integral(ScalarType type, long value) {
    final long v = type.kind == ScalarKind.INT32 ? (int) value : value;
    return ir.literal(Long.toString(v), type);
  }

  private static Ir.@Nullable Literal floating(ScalarType type,
      double value) {
    if (type.kind == ScalarKind.FLOAT32) {
      final float f = (float) value;
      return Float.isFinite(f) ? ir.literal(Float.toString(f), type) : null;
    }
    return Double.isFinite(value)
        ? ir.literal(Double.toString(value), type) : null;
  }
}

// End ConstantFolding.java
