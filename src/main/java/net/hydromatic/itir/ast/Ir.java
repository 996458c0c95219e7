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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.itir.ast.IrBuilder.ir;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import net.hydromatic.itir.type.ScalarType;
import net.hydromatic.itir.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Iterator IR: the tree of expressions, functions, statements and programs.
 *
 * <p>Nodes are immutable. Equality and hash code are structural; they ignore
 * {@link Node#pos} and {@link Node#type}. */
public class Ir {
  private Ir() {}

  /** Abstract base class of iterator IR nodes. */
  public abstract static class Node {
    public final Pos pos;
    public final Op op;
    /** Type of this node; null if it has not been inferred. */
    public final @Nullable Type type;

    Node(Pos pos, Op op, @Nullable Type type) {
      this.pos = requireNonNull(pos);
      this.op = requireNonNull(op);
      this.type = type;
    }

    /** Converts this node into a string.
     *
     * <p>The string uses infix notation for arithmetic builtins and short
     * forms for common iterator builtins, and is intended for debugging and
     * tests. */
    @Override
    public final String toString() {
      return unparse(new IrWriter(), 0, 0).toString();
    }

    abstract IrWriter unparse(IrWriter w, int left, int right);

    /** Returns a copy of this node with a given type, or this node if the
     * type is the same. */
    public abstract Node withType(@Nullable Type type);

    /** Accepts a shuttle, calling the {@link Shuttle#visit} method
     * appropriate to the type of this node, and returning the result. */
    public abstract Node accept(Shuttle shuttle);

    /** Accepts a visitor, calling the {@link Visitor#visit} method
     * appropriate to the type of this node. */
    public abstract void accept(Visitor visitor);
  }

  /** Declared name: a parameter of a lambda, function or program. */
  public static class Sym extends Node {
    public final String id;

    Sym(Pos pos, @Nullable Type type, String id) {
      super(pos, Op.SYM, type);
      this.id = requireNonNull(id);
    }

    @Override
    public int hashCode() {
      return id.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Sym && id.equals(((Sym) o).id);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.id(id);
    }

    @Override
    public Sym withType(@Nullable Type type) {
      return Objects.equals(type, this.type) ? this : new Sym(pos, type, id);
    }

    @Override
    public Sym accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Abstract base class of expressions. */
  public abstract static class Expr extends Node {
    Expr(Pos pos, Op op, @Nullable Type type) {
      super(pos, op, type);
    }

    @Override
    public abstract Expr withType(@Nullable Type type);

    @Override
    public abstract Expr accept(Shuttle shuttle);

    /** Whether this is a call to a builtin (or other function referenced
     * by name) with one of the given names. */
    public boolean isCallTo(String... names) {
      return false;
    }

    /** Whether this is a reference to a symbol with a given name. */
    public boolean isRef(String id) {
      return false;
    }

    /** Whether this is an applied lambda, {@code (λ(x) → e)(y)}, which
     * plays the role of "let x = y in e". */
    public boolean isLet() {
      return false;
    }

    /** Whether this is an applied lift, {@code lift(f)(args)}. */
    public boolean isAppliedLift() {
      return false;
    }

    /** Whether this is a literal. */
    public boolean isLiteral() {
      return false;
    }
  }

  /** Reference to a symbol. */
  public static class SymRef extends Expr {
    public final String id;

    SymRef(Pos pos, @Nullable Type type, String id) {
      super(pos, Op.SYM_REF, type);
      this.id = requireNonNull(id);
    }

    @Override
    public int hashCode() {
      return id.hashCode() + 1;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof SymRef && id.equals(((SymRef) o).id);
    }

    @Override
    public boolean isRef(String id) {
      return this.id.equals(id);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.id(id);
    }

    @Override
    public SymRef withType(@Nullable Type type) {
      return Objects.equals(type, this.type) ? this : new SymRef(pos, type, id);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Scalar constant. */
  public static class Literal extends Expr {
    /** Value, as it would be written in source code, e.g. "1.5". */
    public final String value;
    public final ScalarType scalarType;

    Literal(Pos pos, @Nullable Type type, String value, ScalarType scalarType) {
      super(pos, Op.LITERAL, type);
      this.value = requireNonNull(value);
      this.scalarType = requireNonNull(scalarType);
    }

    @Override
    public int hashCode() {
      return Objects.hash(value, scalarType);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
              && value.equals(((Literal) o).value)
              && scalarType.equals(((Literal) o).scalarType);
    }

    @Override
    public boolean isLiteral() {
      return true;
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.append(value);
    }

    @Override
    public Literal withType(@Nullable Type type) {
      return Objects.equals(type, this.type) ? this
          : new Literal(pos, type, value, scalarType);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Compile-time displacement: either a constant integer or the name of
   * an offset in the offset provider. */
  public static class OffsetLiteral extends Expr {
    /** Value; an {@link Integer} or a {@link String}. */
    public final Object value;

    OffsetLiteral(Pos pos, @Nullable Type type, Object value) {
      super(pos, Op.OFFSET_LITERAL, type);
      checkArgument(value instanceof Integer || value instanceof String,
          "offset must be int or string: %s", value);
      this.value = value;
    }

    /** Whether this offset is a constant integer displacement. */
    public boolean isInt() {
      return value instanceof Integer;
    }

    /** Returns the value of an integer offset. */
    public int intValue() {
      return (Integer) value;
    }

    /** Returns the name of an offset tag. */
    public String tag() {
      return (String) value;
    }

    @Override
    public int hashCode() {
      return value.hashCode() + 3;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof OffsetLiteral
              && value.equals(((OffsetLiteral) o).value);
    }

    @Override
    public boolean isLiteral() {
      return true;
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.append(value.toString()).append("ₒ");
    }

    @Override
    public OffsetLiteral withType(@Nullable Type type) {
      return Objects.equals(type, this.type) ? this
          : new OffsetLiteral(pos, type, value);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Names a dimension. */
  public static class AxisLiteral extends Expr {
    public final String value;

    AxisLiteral(Pos pos, @Nullable Type type, String value) {
      super(pos, Op.AXIS_LITERAL, type);
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode() + 5;
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof AxisLiteral && value.equals(((AxisLiteral) o).value);
    }

    @Override
    public boolean isLiteral() {
      return true;
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.append(value).append("ₐ");
    }

    @Override
    public AxisLiteral withType(@Nullable Type type) {
      return Objects.equals(type, this.type) ? this
          : new AxisLiteral(pos, type, value);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Lambda expression; introduces a scope binding its parameters. */
  public static class Lambda extends Expr {
    public final List<Sym> params;
    public final Expr expr;

    Lambda(Pos pos, @Nullable Type type, List<Sym> params, Expr expr) {
      super(pos, Op.LAMBDA, type);
      this.params = ImmutableList.copyOf(params);
      this.expr = requireNonNull(expr);
    }

    /** Returns the names of the parameters. */
    public Set<String> paramIds() {
      final ImmutableSet.Builder<String> ids = ImmutableSet.builder();
      params.forEach(p -> ids.add(p.id));
      return ids.build();
    }

    @Override
    public int hashCode() {
      return Objects.hash(params, expr);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Lambda
              && params.equals(((Lambda) o).params)
              && expr.equals(((Lambda) o).expr);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      w.append("λ(").appendAll(params, ", ").append(") → ");
      return w.append(expr, 0, 0);
    }

    @Override
    public Lambda withType(@Nullable Type type) {
      return Objects.equals(type, this.type) ? this
          : new Lambda(pos, type, params, expr);
    }

    public Lambda copy(List<Sym> params, Expr expr) {
      return sameElements(params, this.params) && expr == this.expr ? this
          : new Lambda(pos, type, params, expr);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Function application.
   *
   * <p>The function may be a reference to a builtin or a symbol, a lambda
   * (in which case the call is a "let"), or another call (a curried
   * builtin such as {@code shift(Iₒ, 1ₒ)(it)}). */
  public static class FunCall extends Expr {
    public final Expr fun;
    public final List<Expr> args;

    FunCall(Pos pos, @Nullable Type type, Expr fun, List<Expr> args) {
      super(pos, Op.FUN_CALL, type);
      this.fun = requireNonNull(fun);
      this.args = ImmutableList.copyOf(args);
    }

    /** Returns the {@code i}th argument. */
    public Expr arg(int i) {
      return args.get(i);
    }

    @Override
    public int hashCode() {
      return Objects.hash(fun, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof FunCall
              && fun.equals(((FunCall) o).fun)
              && args.equals(((FunCall) o).args);
    }

    @Override
    public boolean isCallTo(String... names) {
      if (fun instanceof SymRef) {
        for (String name : names) {
          if (((SymRef) fun).id.equals(name)) {
            return true;
          }
        }
      }
      return false;
    }

    @Override
    public boolean isLet() {
      return fun instanceof Lambda;
    }

    @Override
    public boolean isAppliedLift() {
      return fun.isCallTo("lift");
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      if (fun instanceof SymRef) {
        final String name = ((SymRef) fun).id;
        final Op op = Op.BY_BUILTIN_NAME.get(name);
        if (op != null && args.size() == 2) {
          return w.infix(left, args.get(0), op, args.get(1), right);
        }
        switch (name) {
        case "deref":
          if (args.size() == 1) {
            return w.prefix(left, "·", args.get(0), right);
          }
          break;
        case "lift":
          if (args.size() == 1) {
            return w.prefix(left, "↑", args.get(0), right);
          }
          break;
        case "shift":
          return w.append("⟪").appendAll(args, ", ").append("⟫");
        case "make_tuple":
          return w.append("{").appendAll(args, ", ").append("}");
        case "tuple_get":
          if (args.size() == 2 && args.get(0) instanceof Literal) {
            return w.postfix(left, args.get(1),
                "[" + ((Literal) args.get(0)).value + "]", right);
          }
          break;
        case "if_":
          if (args.size() == 3) {
            if (left > 0 || right > 0) {
              return w.append("(").append(this, 0, 0).append(")");
            }
            return w.append("if ").append(args.get(0), 0, 0)
                .append(" then ").append(args.get(1), 0, 0)
                .append(" else ").append(args.get(2), 0, 0);
          }
          break;
        default:
          break;
        }
      }
      return w.append(fun, left, Op.FUN_CALL.left)
          .append("(").appendAll(args, ", ").append(")");
    }

    @Override
    public FunCall withType(@Nullable Type type) {
      return Objects.equals(type, this.type) ? this
          : new FunCall(pos, type, fun, args);
    }

    public FunCall copy(Expr fun, List<Expr> args) {
      return fun == this.fun && sameElements(args, this.args) ? this
          : new FunCall(pos, type, fun, args);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Named, top-level function. */
  public static class FunctionDefinition extends Node {
    public final String id;
    public final List<Sym> params;
    public final Expr expr;

    FunctionDefinition(Pos pos, @Nullable Type type, String id,
        List<Sym> params, Expr expr) {
      super(pos, Op.FUNCTION_DEFINITION, type);
      this.id = requireNonNull(id);
      this.params = ImmutableList.copyOf(params);
      this.expr = requireNonNull(expr);
    }

    /** Returns a lambda equivalent to this function. */
    public Lambda asLambda() {
      return ir.lambda(params, expr);
    }

    @Override
    public int hashCode() {
      return Objects.hash(id, params, expr);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof FunctionDefinition
              && id.equals(((FunctionDefinition) o).id)
              && params.equals(((FunctionDefinition) o).params)
              && expr.equals(((FunctionDefinition) o).expr);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.id(id).append(" = λ(").appendAll(params, ", ").append(") → ")
          .append(expr, 0, 0).append(";");
    }

    @Override
    public FunctionDefinition withType(@Nullable Type type) {
      return Objects.equals(type, this.type) ? this
          : new FunctionDefinition(pos, type, id, params, expr);
    }

    public FunctionDefinition copy(List<Sym> params, Expr expr) {
      return sameElements(params, this.params) && expr == this.expr ? this
          : new FunctionDefinition(pos, type, id, params, expr);
    }

    @Override
    public FunctionDefinition accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Abstract base class of the statements in the body of a program. */
  public abstract static class Stmt extends Node {
    Stmt(Pos pos, Op op, @Nullable Type type) {
      super(pos, op, type);
    }

    @Override
    public abstract Stmt withType(@Nullable Type type);

    @Override
    public abstract Stmt accept(Shuttle shuttle);
  }

  /** Applies a stencil at every point of a domain, reading iterators over
   * the input fields and writing the output field (or fields). */
  public static class StencilClosure extends Stmt {
    public final FunCall domain;
    public final Expr stencil;
    /** Output; a reference to a field, or a {@code make_tuple} of
     * references. */
    public final Expr output;
    public final List<SymRef> inputs;

    StencilClosure(Pos pos, @Nullable Type type, FunCall domain, Expr stencil,
        Expr output, List<SymRef> inputs) {
      super(pos, Op.STENCIL_CLOSURE, type);
      this.domain = requireNonNull(domain);
      this.stencil = requireNonNull(stencil);
      this.output = requireNonNull(output);
      this.inputs = ImmutableList.copyOf(inputs);
      if (output instanceof FunCall) {
        checkArgument(output.isCallTo("make_tuple")
                && ((FunCall) output).args.stream()
                    .allMatch(a -> a instanceof SymRef),
            "output of closure must be a field reference or a tuple of "
                + "field references: %s", output);
      } else {
        checkArgument(output instanceof SymRef,
            "output of closure must be a field reference: %s", output);
      }
    }

    @Override
    public int hashCode() {
      return Objects.hash(domain, stencil, output, inputs);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof StencilClosure
              && domain.equals(((StencilClosure) o).domain)
              && stencil.equals(((StencilClosure) o).stencil)
              && output.equals(((StencilClosure) o).output)
              && inputs.equals(((StencilClosure) o).inputs);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.append(output, 0, 0).append(" ← ")
          .append(stencil, 0, Op.FUN_CALL.left)
          .append("(").appendAll(inputs, ", ").append(") @ ")
          .append(domain, 0, 0).append(";");
    }

    @Override
    public StencilClosure withType(@Nullable Type type) {
      return Objects.equals(type, this.type) ? this
          : new StencilClosure(pos, type, domain, stencil, output, inputs);
    }

    public StencilClosure copy(FunCall domain, Expr stencil, Expr output,
        List<SymRef> inputs) {
      return domain == this.domain
          && stencil == this.stencil
          && output == this.output
          && sameElements(inputs, this.inputs)
          ? this
          : new StencilClosure(pos, type, domain, stencil, output, inputs);
    }

    @Override
    public StencilClosure accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Assigns the value of a field expression, evaluated on a domain, to a
   * target field. */
  public static class SetAt extends Stmt {
    public final Expr expr;
    public final FunCall domain;
    public final Expr target;

    SetAt(Pos pos, @Nullable Type type, Expr expr, FunCall domain,
        Expr target) {
      super(pos, Op.SET_AT, type);
      this.expr = requireNonNull(expr);
      this.domain = requireNonNull(domain);
      this.target = requireNonNull(target);
    }

    @Override
    public int hashCode() {
      return Objects.hash(expr, domain, target);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof SetAt
              && expr.equals(((SetAt) o).expr)
              && domain.equals(((SetAt) o).domain)
              && target.equals(((SetAt) o).target);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      return w.append(target, 0, 0).append(" @ ").append(domain, 0, 0)
          .append(" ← ").append(expr, 0, 0).append(";");
    }

    @Override
    public SetAt withType(@Nullable Type type) {
      return Objects.equals(type, this.type) ? this
          : new SetAt(pos, type, expr, domain, target);
    }

    public SetAt copy(Expr expr, FunCall domain, Expr target) {
      return expr == this.expr && domain == this.domain
          && target == this.target ? this
          : new SetAt(pos, type, expr, domain, target);
    }

    @Override
    public SetAt accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Declaration of a field that the compiler introduced to hold an
   * intermediate result. */
  public static class Temporary extends Node {
    public final String id;
    /** Domain on which the temporary is allocated; null if not yet
     * inferred. */
    public final @Nullable FunCall domain;
    /** Element type; null if not yet inferred. */
    public final @Nullable Type dtype;

    Temporary(Pos pos, @Nullable Type type, String id,
        @Nullable FunCall domain, @Nullable Type dtype) {
      super(pos, Op.TEMPORARY, type);
      this.id = requireNonNull(id);
      this.domain = domain;
      this.dtype = dtype;
    }

    @Override
    public int hashCode() {
      return Objects.hash(id, domain, dtype);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Temporary
              && id.equals(((Temporary) o).id)
              && Objects.equals(domain, ((Temporary) o).domain)
              && Objects.equals(dtype, ((Temporary) o).dtype);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      w.id(id).append(" = temporary(domain=");
      if (domain == null) {
        w.append("?");
      } else {
        w.append(domain, 0, 0);
      }
      return w.append(", dtype=")
          .append(dtype == null ? "?" : dtype.toString())
          .append(");");
    }

    @Override
    public Temporary withType(@Nullable Type type) {
      return Objects.equals(type, this.type) ? this
          : new Temporary(pos, type, id, domain, dtype);
    }

    public Temporary copy(@Nullable FunCall domain) {
      return domain == this.domain ? this
          : new Temporary(pos, type, id, domain, dtype);
    }

    @Override
    public Temporary accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Top-level compilation unit. */
  public static class Program extends Node {
    public final String id;
    public final List<FunctionDefinition> functionDefinitions;
    public final List<Sym> params;
    public final List<Temporary> declarations;
    public final List<Stmt> body;

    Program(Pos pos, @Nullable Type type, String id,
        List<FunctionDefinition> functionDefinitions, List<Sym> params,
        List<Temporary> declarations, List<Stmt> body) {
      super(pos, Op.PROGRAM, type);
      this.id = requireNonNull(id);
      this.functionDefinitions = ImmutableList.copyOf(functionDefinitions);
      this.params = ImmutableList.copyOf(params);
      this.declarations = ImmutableList.copyOf(declarations);
      this.body = ImmutableList.copyOf(body);
    }

    /** Returns the stencil closures in the body of this program. */
    public List<StencilClosure> closures() {
      final ImmutableList.Builder<StencilClosure> closures =
          ImmutableList.builder();
      for (Stmt stmt : body) {
        if (stmt instanceof StencilClosure) {
          closures.add((StencilClosure) stmt);
        }
      }
      return closures.build();
    }

    @Override
    public int hashCode() {
      return Objects.hash(id, functionDefinitions, params, declarations, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Program
              && id.equals(((Program) o).id)
              && functionDefinitions.equals(
                  ((Program) o).functionDefinitions)
              && params.equals(((Program) o).params)
              && declarations.equals(((Program) o).declarations)
              && body.equals(((Program) o).body);
    }

    @Override
    IrWriter unparse(IrWriter w, int left, int right) {
      w.id(id).append("(").appendAll(params, ", ").append(") {");
      for (Temporary declaration : declarations) {
        w.newline().append(declaration, 0, 0);
      }
      for (FunctionDefinition functionDefinition : functionDefinitions) {
        w.newline().append(functionDefinition, 0, 0);
      }
      for (Stmt stmt : body) {
        w.newline().append(stmt, 0, 0);
      }
      return w.append("\n}");
    }

    @Override
    public Program withType(@Nullable Type type) {
      return Objects.equals(type, this.type) ? this
          : new Program(pos, type, id, functionDefinitions, params,
              declarations, body);
    }

    public Program copy(List<FunctionDefinition> functionDefinitions,
        List<Sym> params, List<Temporary> declarations, List<Stmt> body) {
      return sameElements(functionDefinitions, this.functionDefinitions)
          && sameElements(params, this.params)
          && sameElements(declarations, this.declarations)
          && sameElements(body, this.body)
          ? this
          : new Program(pos, type, id, functionDefinitions, params,
              declarations, body);
    }

    @Override
    public Program accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Returns whether two lists contain the same objects, compared by
   * identity. */
  static boolean sameElements(List<?> list0, List<?> list1) {
    if (list0.size() != list1.size()) {
      return false;
    }
    for (int i = 0; i < list0.size(); i++) {
      if (list0.get(i) != list1.get(i)) {
        return false;
      }
    }
    return true;
  }
}

// End Ir.java
