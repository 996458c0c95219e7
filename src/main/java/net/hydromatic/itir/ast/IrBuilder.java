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

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.itir.type.ScalarType;
import net.hydromatic.itir.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds iterator IR nodes. */
public enum IrBuilder {
  /** The singleton instance of the IR builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  ir;

  private final Ir.Literal trueLiteral =
      new Ir.Literal(Pos.ZERO, null, "true", ScalarType.BOOL);

  private final Ir.Literal falseLiteral =
      new Ir.Literal(Pos.ZERO, null, "false", ScalarType.BOOL);

  // symbols

  /** Creates a symbol. */
  public Ir.Sym sym(String id) {
    return new Ir.Sym(Pos.ZERO, null, id);
  }

  /** Creates a symbol with a type. */
  public Ir.Sym sym(String id, @Nullable Type type) {
    return new Ir.Sym(Pos.ZERO, type, id);
  }

  /** Creates a symbol at a position. */
  public Ir.Sym sym(Pos pos, String id, @Nullable Type type) {
    return new Ir.Sym(pos, type, id);
  }

  /** Creates a list of untyped symbols. */
  public List<Ir.Sym> syms(String... ids) {
    final ImmutableList.Builder<Ir.Sym> list = ImmutableList.builder();
    for (String id : ids) {
      list.add(sym(id));
    }
    return list.build();
  }

  /** Creates a reference to a symbol. */
  public Ir.SymRef ref(String id) {
    return new Ir.SymRef(Pos.ZERO, null, id);
  }

  /** Creates a reference to a symbol, with a type. */
  public Ir.SymRef ref(String id, @Nullable Type type) {
    return new Ir.SymRef(Pos.ZERO, type, id);
  }

  /** Creates a reference to a symbol at a position. */
  public Ir.SymRef ref(Pos pos, String id) {
    return new Ir.SymRef(pos, null, id);
  }

  /** Creates a list of references. */
  public List<Ir.SymRef> refs(String... ids) {
    final ImmutableList.Builder<Ir.SymRef> list = ImmutableList.builder();
    for (String id : ids) {
      list.add(ref(id));
    }
    return list.build();
  }

  // literals

  /** Creates a literal. */
  public Ir.Literal literal(String value, ScalarType scalarType) {
    return new Ir.Literal(Pos.ZERO, null, value, scalarType);
  }

  /** Creates a literal at a position. */
  public Ir.Literal literal(Pos pos, String value, ScalarType scalarType) {
    return new Ir.Literal(pos, null, value, scalarType);
  }

  /** Creates an {@code int32} literal. */
  public Ir.Literal intLiteral(int value) {
    return literal(Integer.toString(value), ScalarType.INT32);
  }

  /** Creates a {@code float64} literal. */
  public Ir.Literal floatLiteral(double value) {
    return literal(Double.toString(value), ScalarType.FLOAT64);
  }

  /** Creates a {@code bool} literal. */
  public Ir.Literal boolLiteral(boolean b) {
    return b ? trueLiteral : falseLiteral;
  }

  /** Creates an offset literal that names an offset. */
  public Ir.OffsetLiteral offset(String tag) {
    return new Ir.OffsetLiteral(Pos.ZERO, null, tag);
  }

  /** Creates an offset literal that is a constant displacement. */
  public Ir.OffsetLiteral offset(int index) {
    return new Ir.OffsetLiteral(Pos.ZERO, null, index);
  }

  /** Creates an axis literal. */
  public Ir.AxisLiteral axis(String value) {
    return new Ir.AxisLiteral(Pos.ZERO, null, value);
  }

  // functions

  /** Creates a lambda. */
  public Ir.Lambda lambda(List<Ir.Sym> params, Ir.Expr expr) {
    return new Ir.Lambda(Pos.ZERO, null, params, expr);
  }

  /** Creates a lambda with one parameter. */
  public Ir.Lambda lambda(String param, Ir.Expr expr) {
    return lambda(syms(param), expr);
  }

  /** Creates a lambda with two parameters. */
  public Ir.Lambda lambda(String param0, String param1, Ir.Expr expr) {
    return lambda(syms(param0, param1), expr);
  }

  /** Creates a function call. */
  public Ir.FunCall call(Ir.Expr fun, List<? extends Ir.Expr> args) {
    return new Ir.FunCall(Pos.ZERO, null, fun, ImmutableList.copyOf(args));
  }

  /** Creates a function call at a position, with a type. */
  public Ir.FunCall call(Pos pos, @Nullable Type type, Ir.Expr fun,
      List<? extends Ir.Expr> args) {
    return new Ir.FunCall(pos, type, fun, ImmutableList.copyOf(args));
  }

  /** Creates a function call. */
  public Ir.FunCall call(Ir.Expr fun, Ir.Expr... args) {
    return call(fun, Arrays.asList(args));
  }

  /** Creates a call to a builtin or other named function. */
  public Ir.FunCall call(String fun, Ir.Expr... args) {
    return call(ref(fun), Arrays.asList(args));
  }

  /** Creates a call to a builtin or other named function. */
  public Ir.FunCall call(String fun, List<? extends Ir.Expr> args) {
    return call(ref(fun), args);
  }

  /** Creates "let var = init in body", which is represented as
   * {@code (λ(var) → body)(init)}. */
  public Ir.FunCall let(String var, Ir.Expr init, Ir.Expr body) {
    return call(lambda(var, body), init);
  }

  // builtins

  public Ir.FunCall deref(Ir.Expr it) {
    return call("deref", it);
  }

  public Ir.FunCall canDeref(Ir.Expr it) {
    return call("can_deref", it);
  }

  /** Creates a call to {@code shift}, not yet applied to an iterator.
   *
   * <p>Each offset is a {@link String} (an offset tag), an {@link Integer}
   * or an {@link Ir.Expr}. */
  public Ir.FunCall shift(Object... offsets) {
    final ImmutableList.Builder<Ir.Expr> args = ImmutableList.builder();
    for (Object offset : offsets) {
      if (offset instanceof Ir.Expr) {
        args.add((Ir.Expr) offset);
      } else if (offset instanceof Integer) {
        args.add(offset((Integer) offset));
      } else {
        args.add(offset((String) offset));
      }
    }
    return call("shift", args.build());
  }

  /** Creates {@code lift(stencil)}, not yet applied to iterators. */
  public Ir.FunCall lift(Ir.Expr stencil) {
    return call("lift", stencil);
  }

  /** Creates {@code lift(stencil)(args)}. */
  public Ir.FunCall liftedCall(Ir.Expr stencil, Ir.Expr... args) {
    return call(lift(stencil), args);
  }

  public Ir.FunCall tupleGet(int index, Ir.Expr tuple) {
    return call("tuple_get", intLiteral(index), tuple);
  }

  public Ir.FunCall makeTuple(Ir.Expr... args) {
    return call("make_tuple", args);
  }

  public Ir.FunCall makeTuple(List<? extends Ir.Expr> args) {
    return call("make_tuple", args);
  }

  public Ir.FunCall plus(Ir.Expr a0, Ir.Expr a1) {
    return call("plus", a0, a1);
  }

  public Ir.FunCall minus(Ir.Expr a0, Ir.Expr a1) {
    return call("minus", a0, a1);
  }

  public Ir.FunCall multiplies(Ir.Expr a0, Ir.Expr a1) {
    return call("multiplies", a0, a1);
  }

  public Ir.FunCall divides(Ir.Expr a0, Ir.Expr a1) {
    return call("divides", a0, a1);
  }

  public Ir.FunCall less(Ir.Expr a0, Ir.Expr a1) {
    return call("less", a0, a1);
  }

  public Ir.FunCall eq(Ir.Expr a0, Ir.Expr a1) {
    return call("eq", a0, a1);
  }

  public Ir.FunCall and(Ir.Expr a0, Ir.Expr a1) {
    return call("and_", a0, a1);
  }

  public Ir.FunCall not(Ir.Expr a) {
    return call("not_", a);
  }

  public Ir.FunCall ifThenElse(Ir.Expr condition, Ir.Expr ifTrue,
      Ir.Expr ifFalse) {
    return call("if_", condition, ifTrue, ifFalse);
  }

  /** Creates a conversion of a value to a scalar type. */
  public Ir.FunCall cast(Ir.Expr expr, ScalarType type) {
    return call("cast_", expr, ref(type.kind.lowerName));
  }

  /** Creates {@code reduce(fun, init)}, not yet applied to lists. */
  public Ir.FunCall reduce(Ir.Expr fun, Ir.Expr init) {
    return call("reduce", fun, init);
  }

  /** Creates {@code scan(fun, forward, init)}, not yet applied to
   * iterators. */
  public Ir.FunCall scan(Ir.Expr fun, boolean forward, Ir.Expr init) {
    return call("scan", fun, boolLiteral(forward), init);
  }

  public Ir.FunCall neighbors(String offset, Ir.Expr it) {
    return call("neighbors", offset(offset), it);
  }

  public Ir.FunCall listGet(int index, Ir.Expr list) {
    return call("list_get", intLiteral(index), list);
  }

  /** Creates {@code map_(fun)}, not yet applied to lists. */
  public Ir.FunCall map(Ir.Expr fun) {
    return call("map_", fun);
  }

  public Ir.FunCall makeConstList(Ir.Expr value) {
    return call("make_const_list", value);
  }

  /** Creates {@code as_fieldop(stencil)}, a field operator whose domain is
   * not yet known. */
  public Ir.FunCall asFieldop(Ir.Expr stencil) {
    return call("as_fieldop", stencil);
  }

  /** Creates {@code as_fieldop(stencil, domain)}. */
  public Ir.FunCall asFieldop(Ir.Expr stencil, Ir.Expr domain) {
    return call("as_fieldop", stencil, domain);
  }

  /** Creates {@code named_range(axis, start, stop)}. */
  public Ir.FunCall namedRange(String axis, Ir.Expr start, Ir.Expr stop) {
    return call("named_range", axis(axis), start, stop);
  }

  public Ir.FunCall cartesianDomain(Ir.Expr... ranges) {
    return call("cartesian_domain", ranges);
  }

  public Ir.FunCall cartesianDomain(List<? extends Ir.Expr> ranges) {
    return call("cartesian_domain", ranges);
  }

  public Ir.FunCall unstructuredDomain(Ir.Expr... ranges) {
    return call("unstructured_domain", ranges);
  }

  public Ir.FunCall unstructuredDomain(List<? extends Ir.Expr> ranges) {
    return call("unstructured_domain", ranges);
  }

  // declarations and statements

  public Ir.FunctionDefinition functionDefinition(String id,
      List<Ir.Sym> params, Ir.Expr expr) {
    return new Ir.FunctionDefinition(Pos.ZERO, null, id, params, expr);
  }

  public Ir.StencilClosure closure(Ir.FunCall domain, Ir.Expr stencil,
      Ir.Expr output, List<Ir.SymRef> inputs) {
    return new Ir.StencilClosure(Pos.ZERO, null, domain, stencil, output,
        inputs);
  }

  /** Creates a stencil closure that writes to a single field. */
  public Ir.StencilClosure closure(Ir.FunCall domain, Ir.Expr stencil,
      String output, String... inputs) {
    return closure(domain, stencil, ref(output), refs(inputs));
  }

  public Ir.SetAt setAt(Ir.Expr expr, Ir.FunCall domain, Ir.Expr target) {
    return new Ir.SetAt(Pos.ZERO, null, expr, domain, target);
  }

  public Ir.Temporary temporary(String id, Ir.@Nullable FunCall domain,
      @Nullable Type dtype) {
    return new Ir.Temporary(Pos.ZERO, null, id, domain, dtype);
  }

  public Ir.Program program(String id,
      List<Ir.FunctionDefinition> functionDefinitions, List<Ir.Sym> params,
      List<Ir.Temporary> declarations, List<? extends Ir.Stmt> body) {
    return new Ir.Program(Pos.ZERO, null, id, functionDefinitions, params,
        declarations, ImmutableList.copyOf(body));
  }

  /** Creates a program with no function definitions or temporaries. */
  public Ir.Program program(String id, List<Ir.Sym> params,
      Ir.Stmt... body) {
    return program(id, ImmutableList.of(), params, ImmutableList.of(),
        Arrays.asList(body));
  }
}

// End IrBuilder.java
