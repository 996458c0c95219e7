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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.ast.Pos;
import net.hydromatic.itir.ast.Shuttle;
import net.hydromatic.itir.ast.Visitor;
import net.hydromatic.itir.type.Connectivity;
import net.hydromatic.itir.type.DeferredType;
import net.hydromatic.itir.type.Dimension;
import net.hydromatic.itir.type.DimensionKind;
import net.hydromatic.itir.type.DimensionType;
import net.hydromatic.itir.type.DomainType;
import net.hydromatic.itir.type.FieldType;
import net.hydromatic.itir.type.FunctionType;
import net.hydromatic.itir.type.OffsetLiteralType;
import net.hydromatic.itir.type.OffsetProvider;
import net.hydromatic.itir.type.ProgramType;
import net.hydromatic.itir.type.ScalarKind;
import net.hydromatic.itir.type.ScalarType;
import net.hydromatic.itir.type.StencilClosureType;
import net.hydromatic.itir.type.TupleType;
import net.hydromatic.itir.type.Type;
import net.hydromatic.itir.type.Types;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Infers the type of every node in an iterator IR tree.
 *
 * <p>The input tree is not modified. Inference records the type of each
 * node in a table keyed by node identity, then a shuttle copies the tree,
 * writing the types into the new nodes.
 *
 * <p>A function value (a lambda, a function definition, a builtin, or a
 * partial application of a builtin) is represented by a
 * {@link Typing.Rule}. Its type becomes known only when it is applied and
 * the types of its arguments and result are known. Each application
 * re-infers the function body, so a function may be applied to arguments
 * of different types; the nodes inside such a polymorphic function, whose
 * types differ between applications, receive {@link DeferredType}. */
public class TypeInference {
  private final OffsetProvider offsetProvider;
  private final boolean allowUndeclared;
  /** Dimensions that axis and offset literals may refer to, by name. */
  private final Map<String, Dimension> dimensions;

  private final Map<Ir.Node, Type> types = new IdentityHashMap<>();
  private final Set<Ir.Node> polymorphicNodes =
      Collections.newSetFromMap(new IdentityHashMap<>());
  private final TypeRules.Context context = new ContextImpl();

  /** Greater than zero while inferring the second or later application of
   * a function. */
  private int polymorphicDepth;
  /** Position of the node being typed, for error messages. */
  private Pos pos = Pos.ZERO;

  private TypeInference(OffsetProvider offsetProvider,
      boolean allowUndeclared, Map<String, Dimension> dimensions) {
    this.offsetProvider = offsetProvider;
    this.allowUndeclared = allowUndeclared;
    this.dimensions = ImmutableMap.copyOf(dimensions);
  }

  /** Infers the types of a program. */
  public static Ir.Program infer(Ir.Program program,
      OffsetProvider offsetProvider) {
    return infer(program, offsetProvider, false);
  }

  /** Infers the types of a node, returning a copy of the node in which
   * every node whose type could be inferred has a type.
   *
   * @param node Node
   * @param offsetProvider Offset provider
   * @param allowUndeclared Whether references to undeclared symbols are
   *   allowed; such a reference has the type it already carries, or
   *   {@link DeferredType}
   */
  public static <N extends Ir.Node> N infer(N node,
      OffsetProvider offsetProvider, boolean allowUndeclared) {
    final TypeInference inference =
        new TypeInference(offsetProvider, allowUndeclared,
            dimensionUniverse(offsetProvider, node));
    inference.visit(node, ImmutableMap.of());
    //noinspection unchecked
    return (N) node.accept(inference.new TypeWriter());
  }

  /** Returns the dimensions known to an offset provider and used in the
   * types already present in a tree.
   *
   * <p>Each offset name is a local dimension; the axes of connectivities and
   * the dimensions of cartesian offsets are dimensions too. */
  static Map<String, Dimension> dimensionUniverse(
      OffsetProvider offsetProvider, Ir.Node node) {
    final List<Type> existingTypes = new ArrayList<>();
    node.accept(new TypeCollector(existingTypes));
    final Map<String, Dimension> map =
        new LinkedHashMap<>(Types.dimensions(existingTypes));
    for (String name : offsetProvider.names()) {
      map.put(name, new Dimension(name, DimensionKind.LOCAL));
    }
    for (Dimension dimension : offsetProvider.dimensions.values()) {
      map.put(dimension.value, dimension);
    }
    for (Connectivity connectivity : offsetProvider.connectivities.values()) {
      map.put(connectivity.originAxis.value, connectivity.originAxis);
      map.put(connectivity.neighborAxis.value, connectivity.neighborAxis);
    }
    return map;
  }

  private TypeException error(String message) {
    return new TypeException(message, pos);
  }

  /** Infers the typing of a node and records it. */
  private Typing visit(Ir.Node node, Map<String, Typing> env) {
    final Pos savedPos = pos;
    if (!node.pos.equals(Pos.ZERO)) {
      pos = node.pos;
    }
    try {
      final Typing typing = deduce(node, env);
      if (typing instanceof Typing.Known) {
        record(node, ((Typing.Known) typing).type, polymorphicDepth > 0);
      } else {
        attach((Typing.Rule) typing, node);
      }
      return typing;
    } finally {
      pos = savedPos;
    }
  }

  private Typing deduce(Ir.Node node, Map<String, Typing> env) {
    switch (node.op) {
    case LITERAL:
      return Typing.of(((Ir.Literal) node).scalarType);

    case OFFSET_LITERAL:
      final Ir.OffsetLiteral offsetLiteral = (Ir.OffsetLiteral) node;
      if (offsetLiteral.isInt()) {
        return Typing.of(OffsetLiteralType.of(offsetLiteral.intValue()));
      }
      final Dimension offsetDim = dimensions.get(offsetLiteral.tag());
      if (offsetDim == null) {
        throw error("offset '" + offsetLiteral.tag() + "' not found");
      }
      return Typing.of(OffsetLiteralType.of(offsetDim));

    case AXIS_LITERAL:
      final Ir.AxisLiteral axisLiteral = (Ir.AxisLiteral) node;
      final Dimension axisDim = dimensions.get(axisLiteral.value);
      if (axisDim == null) {
        throw error("dimension '" + axisLiteral.value + "' not found");
      }
      return Typing.of(new DimensionType(axisDim));

    case SYM_REF:
      return deduceSymRef((Ir.SymRef) node, env);

    case LAMBDA:
      final Ir.Lambda lambda = (Ir.Lambda) node;
      return functionRule("λ", lambda.params, lambda.expr, env);

    case FUN_CALL:
      return deduceCall((Ir.FunCall) node, env);

    case FUNCTION_DEFINITION:
      final Ir.FunctionDefinition functionDefinition =
          (Ir.FunctionDefinition) node;
      return functionRule(functionDefinition.id, functionDefinition.params,
          functionDefinition.expr, env);

    case STENCIL_CLOSURE:
      return deduceClosure((Ir.StencilClosure) node, env);

    case SET_AT:
      return deduceSetAt((Ir.SetAt) node, env);

    case TEMPORARY:
      return deduceTemporary((Ir.Temporary) node, env);

    case PROGRAM:
      return deduceProgram((Ir.Program) node, env);

    default:
      throw new AssertionError("cannot deduce type for " + node.op);
    }
  }

  private Typing deduceSymRef(Ir.SymRef symRef, Map<String, Typing> env) {
    final Typing typing = env.get(symRef.id);
    if (typing != null) {
      return typing;
    }
    if (BuiltIn.isBuiltIn(symRef.id)) {
      final TypeRules.BuiltInRule rule = TypeRules.get(symRef.id);
      return newRule(symRef.id, args -> rule.apply(context, args));
    }
    if (allowUndeclared) {
      return symRef.type != null ? Typing.of(symRef.type) : Typing.DEFERRED;
    }
    throw error("undeclared symbol '" + symRef.id + "'");
  }

  private Typing deduceCall(Ir.FunCall call, Map<String, Typing> env) {
    if (call.isCallTo(BuiltIn.CAST_.id) && !env.containsKey("cast_")) {
      return deduceCast(call, env);
    }
    if (call.isCallTo(BuiltIn.TUPLE_GET.id)
        && !env.containsKey("tuple_get")) {
      return deduceTupleGet(call, env);
    }
    final Typing fun = visit(call.fun, env);
    final List<Typing> args = new ArrayList<>();
    for (Ir.Expr arg : call.args) {
      args.add(visit(arg, env));
    }
    return apply(fun, args);
  }

  /** Deduces the type of {@code cast_(expr, type)}. The second argument is
   * the name of a type builtin, which is not evaluated. */
  private Typing deduceCast(Ir.FunCall call, Map<String, Typing> env) {
    if (call.args.size() != 2 || !(call.arg(1) instanceof Ir.SymRef)) {
      throw error("cast_ expects a value and the name of a type");
    }
    final Type source = valueType(visit(call.arg(0), env), "cast_");
    final String typeName = ((Ir.SymRef) call.arg(1)).id;
    final BuiltIn builtIn = BuiltIn.lookup(typeName);
    if (builtIn == null || builtIn.category != BuiltIn.Category.TYPE) {
      throw error("'" + typeName + "' is not a type");
    }
    final ScalarType target = ScalarType.of(ScalarKind.of(typeName));
    final FunctionType conversionType =
        FunctionType.of(ImmutableList.of(source), target);
    record(call.arg(1), conversionType, polymorphicDepth > 0);
    record(call.fun,
        FunctionType.of(ImmutableList.of(source, conversionType), target),
        polymorphicDepth > 0);
    return Typing.of(target);
  }

  /** Deduces the type of {@code tuple_get(i, tuple)}. The index must be a
   * literal, because the type of the result depends on its value. */
  private Typing deduceTupleGet(Ir.FunCall call, Map<String, Typing> env) {
    if (call.args.size() != 2 || !(call.arg(0) instanceof Ir.Literal)) {
      throw error("tuple_get expects a literal index and a tuple");
    }
    final Type indexType = valueType(visit(call.arg(0), env), "tuple_get");
    final Type tupleType = valueType(visit(call.arg(1), env), "tuple_get");
    final Type result;
    if (tupleType instanceof DeferredType) {
      result = DeferredType.INSTANCE;
    } else if (tupleType instanceof TupleType) {
      final List<Type> elementTypes = ((TupleType) tupleType).types;
      final int index;
      try {
        index = Integer.parseInt(((Ir.Literal) call.arg(0)).value);
      } catch (NumberFormatException e) {
        throw error("index of tuple_get must be an integer");
      }
      if (index < 0 || index >= elementTypes.size()) {
        throw error("tuple index " + index + " out of range for "
            + tupleType);
      }
      result = elementTypes.get(index);
    } else {
      throw error("tuple_get expects a tuple, got " + tupleType);
    }
    record(call.fun,
        FunctionType.of(ImmutableList.of(indexType, tupleType), result),
        polymorphicDepth > 0);
    return Typing.of(result);
  }

  private Typing deduceClosure(Ir.StencilClosure closure,
      Map<String, Typing> env) {
    final Type domain = valueType(visit(closure.domain, env), "closure");
    if (!(domain instanceof DomainType)) {
      throw error("domain of closure must be a domain, got " + domain);
    }
    final List<Type> inputs = new ArrayList<>();
    for (Ir.SymRef input : closure.inputs) {
      inputs.add(valueType(visit(input, env), "closure"));
    }
    final Type output = valueType(visit(closure.output, env), "closure");
    for (Type t : Types.primitiveConstituents(output)) {
      if (!(t instanceof FieldType) && !(t instanceof DeferredType)) {
        throw error("output of closure must be a field, got " + t);
      }
    }
    final Typing stencil = visit(closure.stencil, env);
    final List<Typing> its = new ArrayList<>();
    final List<Type> itTypes = new ArrayList<>();
    for (Type input : inputs) {
      final Type it = input instanceof DeferredType
          ? input
          : TypeRules.toIterator(context, (DomainType) domain, input);
      its.add(Typing.of(it));
      itTypes.add(it);
    }
    final Type returnType = valueType(apply(stencil, its), "stencil");
    return Typing.of(
        new StencilClosureType((DomainType) domain,
            FunctionType.of(itTypes, returnType), output, inputs));
  }

  private Typing deduceSetAt(Ir.SetAt setAt, Map<String, Typing> env) {
    final Type exprType = valueType(visit(setAt.expr, env), "set_at");
    visit(setAt.domain, env);
    final Type targetType = valueType(visit(setAt.target, env), "set_at");
    if (!(exprType instanceof DeferredType)
        && !(targetType instanceof DeferredType)) {
      final List<Type> sources = Types.primitiveConstituents(exprType);
      final List<Type> targets = Types.primitiveConstituents(targetType);
      if (sources.size() != targets.size()) {
        throw error("cannot assign " + exprType + " to " + targetType);
      }
      for (int i = 0; i < sources.size(); i++) {
        final Type source = sources.get(i);
        final Type target = targets.get(i);
        if (!(source instanceof FieldType) || !(target instanceof FieldType)
            || !ImmutableSet.copyOf(((FieldType) source).dims)
                .equals(ImmutableSet.copyOf(((FieldType) target).dims))) {
          throw error("cannot assign " + source + " to " + target);
        }
      }
    }
    return Typing.of(targetType);
  }

  private Typing deduceTemporary(Ir.Temporary temporary,
      Map<String, Typing> env) {
    if (temporary.domain == null || temporary.dtype == null) {
      return Typing.DEFERRED;
    }
    final Type domain = valueType(visit(temporary.domain, env), "temporary");
    if (domain instanceof DeferredType) {
      return Typing.DEFERRED;
    }
    if (!(domain instanceof DomainType)) {
      throw error("domain of temporary must be a domain, got " + domain);
    }
    final List<Dimension> dims = ((DomainType) domain).dims;
    return Typing.of(
        Types.applyToPrimitiveConstituents(temporary.dtype,
            t -> new FieldType(dims, t)));
  }

  private Typing deduceProgram(Ir.Program program, Map<String, Typing> env) {
    final Map<String, Typing> env2 = new LinkedHashMap<>(env);
    final List<Type> paramTypes = new ArrayList<>();
    for (Ir.Sym param : program.params) {
      if (param.type == null || !param.type.isDataType()
          && !(param.type instanceof TupleType)) {
        throw error("parameter '" + param.id + "' of program '"
            + program.id + "' must have a data type");
      }
      record(param, param.type, false);
      paramTypes.add(param.type);
      env2.put(param.id, Typing.of(param.type));
    }
    for (Ir.FunctionDefinition functionDefinition
        : program.functionDefinitions) {
      env2.put(functionDefinition.id,
          visit(functionDefinition, ImmutableMap.copyOf(env2)));
    }
    for (Ir.Temporary temporary : program.declarations) {
      env2.put(temporary.id, visit(temporary, ImmutableMap.copyOf(env2)));
    }
    final Map<String, Typing> bodyEnv = ImmutableMap.copyOf(env2);
    final List<Type> statementTypes = new ArrayList<>();
    for (Ir.Stmt stmt : program.body) {
      statementTypes.add(valueType(visit(stmt, bodyEnv), "statement"));
    }
    return Typing.of(new ProgramType(paramTypes, statementTypes));
  }

  /** Creates the rule for a lambda or function definition. Each application
   * infers the type of the body with the parameters bound to the
   * arguments. */
  private Typing.Rule functionRule(String name, List<Ir.Sym> params,
      Ir.Expr body, Map<String, Typing> env) {
    final Typing.Rule rule =
        newRule(name, args -> {
          if (args.size() != params.size()) {
            throw error("function " + name + " expects " + params.size()
                + " arguments, got " + args.size());
          }
          final Map<String, Typing> env2 = new LinkedHashMap<>(env);
          for (int i = 0; i < params.size(); i++) {
            env2.put(params.get(i).id, args.get(i));
          }
          return visit(body, ImmutableMap.copyOf(env2));
        });
    rule.params.addAll(params);
    rule.cell.onReady(type -> {
      final FunctionType functionType = (FunctionType) type;
      for (int i = 0; i < params.size(); i++) {
        record(params.get(i), functionType.posArgs.get(i), rule.polymorphic);
      }
    });
    return rule;
  }

  private Typing.Rule newRule(String name, Typing.TypeRule rule) {
    return new Typing.Rule(name, rule, polymorphicDepth > 0);
  }

  /** Associates a node with a function value. The first node becomes the
   * owner of the rule; later nodes (references to the same function value)
   * are aliases. All receive the type of the function when it is known. */
  private void attach(Typing.Rule rule, Ir.Node node) {
    if (rule.node == null) {
      rule.node = node;
    } else if (rule.node != node) {
      rule.aliases.add(node);
    } else {
      return;
    }
    rule.cell.onReady(type -> record(node, type, rule.polymorphic));
  }

  /** Applies a function value to arguments.
   *
   * <p>When the types of the result and of all arguments are known, the
   * type of the function is known. If a function is applied more than once
   * with incompatible types, it is polymorphic, and the nodes that denote
   * it receive {@link DeferredType}. */
  private Typing apply(Typing fun, List<Typing> args) {
    if (fun instanceof Typing.Known) {
      final Type type = ((Typing.Known) fun).type;
      if (type instanceof DeferredType) {
        return Typing.DEFERRED;
      }
      if (type instanceof FunctionType) {
        final FunctionType functionType = (FunctionType) type;
        if (functionType.posArgs.size() != args.size()) {
          throw error("function of type " + type + " applied to "
              + args.size() + " arguments");
        }
        return Typing.of(functionType.returns);
      }
      throw error("cannot apply a value of type " + type);
    }
    final Typing.Rule rule = (Typing.Rule) fun;
    final boolean polymorphic = rule.instanceCount++ > 0;
    if (polymorphic) {
      ++polymorphicDepth;
    }
    final Typing result;
    try {
      result = rule.rule.apply(args);
    } finally {
      if (polymorphic) {
        --polymorphicDepth;
      }
    }
    final List<Typing> typings = new ArrayList<>();
    typings.add(result);
    typings.addAll(args);
    TypeCell.onReady(typings, types ->
        resolve(rule,
            FunctionType.of(types.subList(1, types.size()), types.get(0))));
    return result;
  }

  private void resolve(Typing.Rule rule, FunctionType type) {
    if (!rule.cell.isResolved()) {
      rule.cell.resolve(type);
    } else if (!Types.isCompatible(rule.cell.get(), type)) {
      // Applied to arguments of different types.
      markPolymorphic(rule.node);
      rule.aliases.forEach(this::markPolymorphic);
      rule.params.forEach(this::markPolymorphic);
    }
  }

  private void markPolymorphic(Ir.@Nullable Node node) {
    if (node != null) {
      polymorphicNodes.add(node);
      types.put(node, DeferredType.INSTANCE);
    }
  }

  /** Records the type of a node.
   *
   * <p>A type may refine {@link DeferredType}, or replace a compatible type.
   * An incompatible type is allowed only inside a polymorphic function, and
   * makes the type of the node deferred; anywhere else, it indicates a bug,
   * such as a pass that produced an ill-typed tree. */
  private void record(Ir.Node node, Type type, boolean polymorphic) {
    if (polymorphicNodes.contains(node)) {
      return;
    }
    Type existing = types.get(node);
    if (existing == null) {
      existing = node.type;
    }
    if (existing != null && !Types.isCompatible(existing, type)) {
      if (polymorphic) {
        markPolymorphic(node);
        return;
      }
      throw new AssertionError("type of " + node + " was " + existing
          + ", now incompatible type " + type);
    }
    if (type instanceof DeferredType && existing != null) {
      return;
    }
    types.put(node, type);
  }

  private Type valueType(Typing typing, String context) {
    if (typing instanceof Typing.Rule) {
      throw error(context + " expects a value, got function "
          + ((Typing.Rule) typing).name);
    }
    return ((Typing.Known) typing).type;
  }

  /** Error in the types of a program. */
  public static class TypeException extends CompileException {
    public TypeException(String message, Pos pos) {
      super(message, pos);
    }
  }

  /** Implementation of {@link TypeRules.Context} that delegates to this
   * inference run. */
  private class ContextImpl implements TypeRules.Context {
    @Override
    public OffsetProvider offsetProvider() {
      return offsetProvider;
    }

    @Override
    public Typing.Rule rule(String name, Typing.TypeRule rule) {
      return newRule(name, rule);
    }

    @Override
    public Typing apply(Typing fun, List<Typing> args) {
      return TypeInference.this.apply(fun, args);
    }

    @Override
    public TypeException error(String message) {
      return TypeInference.this.error(message);
    }
  }

  /** Collects the types that nodes already carry. */
  private static class TypeCollector extends Visitor {
    private final List<Type> types;

    TypeCollector(List<Type> types) {
      this.types = types;
    }

    private void add(@Nullable Type type) {
      if (type != null) {
        types.add(type);
      }
    }

    @Override
    protected void visit(Ir.Sym sym) {
      add(sym.type);
    }

    @Override
    protected void visit(Ir.SymRef symRef) {
      add(symRef.type);
    }

    @Override
    protected void visit(Ir.Lambda lambda) {
      add(lambda.type);
      super.visit(lambda);
    }

    @Override
    protected void visit(Ir.FunCall funCall) {
      add(funCall.type);
      super.visit(funCall);
    }

    @Override
    protected void visit(Ir.Temporary temporary) {
      add(temporary.type);
      add(temporary.dtype);
      super.visit(temporary);
    }
  }

  /** Copies a tree, writing the inferred types into the new nodes. */
  private class TypeWriter extends Shuttle {
    private @Nullable Type typeOf(Ir.Node node) {
      return types.containsKey(node) ? types.get(node) : node.type;
    }

    @Override
    protected Ir.Sym visit(Ir.Sym sym) {
      return super.visit(sym).withType(typeOf(sym));
    }

    @Override
    protected Ir.Expr visit(Ir.SymRef symRef) {
      return super.visit(symRef).withType(typeOf(symRef));
    }

    @Override
    protected Ir.Expr visit(Ir.Literal literal) {
      return super.visit(literal).withType(typeOf(literal));
    }

    @Override
    protected Ir.Expr visit(Ir.OffsetLiteral offsetLiteral) {
      return super.visit(offsetLiteral).withType(typeOf(offsetLiteral));
    }

    @Override
    protected Ir.Expr visit(Ir.AxisLiteral axisLiteral) {
      return super.visit(axisLiteral).withType(typeOf(axisLiteral));
    }

    @Override
    protected Ir.Expr visit(Ir.Lambda lambda) {
      return super.visit(lambda).withType(typeOf(lambda));
    }

    @Override
    protected Ir.Expr visit(Ir.FunCall funCall) {
      return super.visit(funCall).withType(typeOf(funCall));
    }

    @Override
    protected Ir.FunctionDefinition visit(
        Ir.FunctionDefinition functionDefinition) {
      return super.visit(functionDefinition)
          .withType(typeOf(functionDefinition));
    }

    @Override
    protected Ir.StencilClosure visit(Ir.StencilClosure closure) {
      return super.visit(closure).withType(typeOf(closure));
    }

    @Override
    protected Ir.SetAt visit(Ir.SetAt setAt) {
      return super.visit(setAt).withType(typeOf(setAt));
    }

    @Override
    protected Ir.Temporary visit(Ir.Temporary temporary) {
      return super.visit(temporary).withType(typeOf(temporary));
    }

    @Override
    protected Ir.Program visit(Ir.Program program) {
      return super.visit(program).withType(typeOf(program));
    }
  }
}

// End TypeInference.java
