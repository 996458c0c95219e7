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
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.itir.type.Connectivity;
import net.hydromatic.itir.type.DeferredType;
import net.hydromatic.itir.type.Dimension;
import net.hydromatic.itir.type.DimensionKind;
import net.hydromatic.itir.type.DimensionType;
import net.hydromatic.itir.type.DomainType;
import net.hydromatic.itir.type.FieldType;
import net.hydromatic.itir.type.IteratorType;
import net.hydromatic.itir.type.ListType;
import net.hydromatic.itir.type.NamedRangeType;
import net.hydromatic.itir.type.OffsetLiteralType;
import net.hydromatic.itir.type.OffsetProvider;
import net.hydromatic.itir.type.ScalarKind;
import net.hydromatic.itir.type.ScalarType;
import net.hydromatic.itir.type.TupleType;
import net.hydromatic.itir.type.Type;
import net.hydromatic.itir.type.Types;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Typing rules of the built-in functions.
 *
 * <p>The table is immutable; the state of a particular inference run is
 * reached through a {@link Context}.
 *
 * <p>Rules tolerate {@link DeferredType} arguments; if an argument that
 * determines the result is deferred, so is the result. */
public abstract class TypeRules {
  private TypeRules() {}

  private static final ImmutableMap<String, BuiltInRule> RULES;

  static {
    final ImmutableMap.Builder<String, BuiltInRule> b =
        ImmutableMap.builder();
    for (String name
        : BuiltIn.namesIn(BuiltIn.Category.UNARY_MATH_NUMBER,
            BuiltIn.Category.UNARY_MATH_FP)) {
      b.put(name, unaryMath(name));
    }
    for (String name
        : BuiltIn.namesIn(BuiltIn.Category.UNARY_FP_PREDICATE)) {
      b.put(name, (cx, args) -> {
        checkArgCount(cx, name, args, 1);
        return Typing.of(ScalarType.BOOL);
      });
    }
    for (String name
        : BuiltIn.namesIn(BuiltIn.Category.BINARY_MATH_NUMBER)) {
      if (name.equals(BuiltIn.POWER.id)) {
        b.put(name, (cx, args) -> {
          checkArgCount(cx, name, args, 2);
          return Typing.of(type(cx, name, args, 0));
        });
      } else {
        b.put(name, binaryMath(name));
      }
    }
    for (String name : BuiltIn.namesIn(BuiltIn.Category.COMPARISON)) {
      b.put(name, comparison(name));
    }
    b.put(BuiltIn.NOT_.id, (cx, args) -> {
      checkArgCount(cx, BuiltIn.NOT_.id, args, 1);
      checkBool(cx, BuiltIn.NOT_.id, type(cx, BuiltIn.NOT_.id, args, 0));
      return Typing.of(ScalarType.BOOL);
    });
    for (String name : BuiltIn.namesIn(BuiltIn.Category.BINARY_LOGICAL)) {
      b.put(name, (cx, args) -> {
        checkArgCount(cx, name, args, 2);
        checkBool(cx, name, type(cx, name, args, 0));
        checkBool(cx, name, type(cx, name, args, 1));
        return Typing.of(ScalarType.BOOL);
      });
    }
    for (String name : BuiltIn.namesIn(BuiltIn.Category.TYPE)) {
      final ScalarType scalarType = ScalarType.of(ScalarKind.of(name));
      b.put(name, (cx, args) -> {
        checkArgCount(cx, name, args, 1);
        type(cx, name, args, 0);
        return Typing.of(scalarType);
      });
    }
    b.put(BuiltIn.MAKE_TUPLE.id, TypeRules::makeTuple);
    b.put(BuiltIn.TUPLE_GET.id, (cx, args) -> {
      throw cx.error("tuple_get must be called with a literal index");
    });
    b.put(BuiltIn.CAST_.id, (cx, args) -> {
      throw cx.error("cast_ must be called with the name of a type");
    });
    b.put(BuiltIn.IF_.id, TypeRules::ifThenElse);
    b.put(BuiltIn.CARTESIAN_DOMAIN.id, domain(BuiltIn.CARTESIAN_DOMAIN.id));
    b.put(BuiltIn.UNSTRUCTURED_DOMAIN.id,
        domain(BuiltIn.UNSTRUCTURED_DOMAIN.id));
    b.put(BuiltIn.NAMED_RANGE.id, TypeRules::namedRange);
    b.put(BuiltIn.SHIFT.id, TypeRules::shift);
    b.put(BuiltIn.NEIGHBORS.id, TypeRules::neighbors);
    b.put(BuiltIn.DEREF.id, TypeRules::deref);
    b.put(BuiltIn.CAN_DEREF.id, (cx, args) -> {
      checkArgCount(cx, BuiltIn.CAN_DEREF.id, args, 1);
      final Type it = type(cx, BuiltIn.CAN_DEREF.id, args, 0);
      if (!(it instanceof IteratorType) && !(it instanceof DeferredType)) {
        throw cx.error("can_deref expects an iterator, got " + it);
      }
      return Typing.of(ScalarType.BOOL);
    });
    b.put(BuiltIn.LIFT.id, TypeRules::lift);
    b.put(BuiltIn.REDUCE.id, TypeRules::reduce);
    b.put(BuiltIn.SCAN.id, TypeRules::scan);
    b.put(BuiltIn.LIST_GET.id, TypeRules::listGet);
    b.put(BuiltIn.MAP_.id, TypeRules::map);
    b.put(BuiltIn.MAKE_CONST_LIST.id, (cx, args) -> {
      checkArgCount(cx, BuiltIn.MAKE_CONST_LIST.id, args, 1);
      final Type type = type(cx, BuiltIn.MAKE_CONST_LIST.id, args, 0);
      return type instanceof DeferredType ? Typing.DEFERRED
          : Typing.of(new ListType(type));
    });
    b.put(BuiltIn.AS_FIELDOP.id, TypeRules::asFieldop);
    RULES = b.build();
  }

  /** Returns the rule for a builtin; throws if there is no such builtin. */
  public static BuiltInRule get(String name) {
    final BuiltInRule rule = RULES.get(name);
    if (rule == null) {
      throw new IllegalArgumentException("not a builtin: " + name);
    }
    return rule;
  }

  // rules

  private static BuiltInRule unaryMath(String name) {
    return (cx, args) -> {
      checkArgCount(cx, name, args, 1);
      final Type type = type(cx, name, args, 0);
      if (type instanceof ScalarType && !((ScalarType) type).kind.isNumber()) {
        throw cx.error("argument of " + name + " must be a number, got "
            + type);
      }
      return Typing.of(type);
    };
  }

  private static BuiltInRule binaryMath(String name) {
    return (cx, args) -> {
      checkArgCount(cx, name, args, 2);
      final Type left = type(cx, name, args, 0);
      final Type right = type(cx, name, args, 1);
      if (left instanceof DeferredType) {
        return Typing.of(right);
      }
      if (right instanceof DeferredType) {
        return Typing.of(left);
      }
      if (!left.equals(right)) {
        throw cx.error("operands of " + name + " must have the same type, "
            + "got " + left + " and " + right);
      }
      return Typing.of(left);
    };
  }

  private static BuiltInRule comparison(String name) {
    return (cx, args) -> {
      checkArgCount(cx, name, args, 2);
      final Type left = type(cx, name, args, 0);
      final Type right = type(cx, name, args, 1);
      if (!Types.isCompatible(left, right)) {
        throw cx.error("cannot compare " + left + " and " + right);
      }
      return Typing.of(ScalarType.BOOL);
    };
  }

  private static Typing makeTuple(Context cx, List<Typing> args) {
    final List<Type> types = new ArrayList<>();
    for (int i = 0; i < args.size(); i++) {
      types.add(type(cx, BuiltIn.MAKE_TUPLE.id, args, i));
    }
    return Typing.of(new TupleType(types));
  }

  private static Typing ifThenElse(Context cx, List<Typing> args) {
    checkArgCount(cx, BuiltIn.IF_.id, args, 3);
    final Type condition = type(cx, BuiltIn.IF_.id, args, 0);
    if (!(condition instanceof DeferredType)
        && !condition.equals(ScalarType.BOOL)) {
      throw cx.error("condition of if_ must be bool, got " + condition);
    }
    final Type ifTrue = type(cx, BuiltIn.IF_.id, args, 1);
    final Type ifFalse = type(cx, BuiltIn.IF_.id, args, 2);
    if (ifTrue instanceof DeferredType) {
      return Typing.of(ifFalse);
    }
    if (!Types.isCompatible(ifTrue, ifFalse)) {
      throw cx.error("branches of if_ have incompatible types " + ifTrue
          + " and " + ifFalse);
    }
    return Typing.of(ifTrue);
  }

  private static BuiltInRule domain(String name) {
    return (cx, args) -> {
      final List<Dimension> dims = new ArrayList<>();
      for (int i = 0; i < args.size(); i++) {
        final Type type = type(cx, name, args, i);
        if (type instanceof DeferredType) {
          return Typing.DEFERRED;
        }
        if (!(type instanceof NamedRangeType)) {
          throw cx.error("arguments of " + name + " must be named ranges, "
              + "got " + type);
        }
        dims.add(((NamedRangeType) type).dim);
      }
      return Typing.of(new DomainType(dims));
    };
  }

  private static Typing namedRange(Context cx, List<Typing> args) {
    final String name = BuiltIn.NAMED_RANGE.id;
    checkArgCount(cx, name, args, 3);
    final Type axis = type(cx, name, args, 0);
    for (int i = 1; i < 3; i++) {
      final Type bound = type(cx, name, args, i);
      if (bound instanceof ScalarType
          && !((ScalarType) bound).kind.isIntegral()) {
        throw cx.error("bounds of named_range must be integers, got "
            + bound);
      }
    }
    if (axis instanceof DeferredType) {
      return Typing.DEFERRED;
    }
    if (!(axis instanceof DimensionType)) {
      throw cx.error("first argument of named_range must be an axis, got "
          + axis);
    }
    return Typing.of(new NamedRangeType(((DimensionType) axis).dim));
  }

  private static Typing shift(Context cx, List<Typing> args) {
    final List<Type> offsets = new ArrayList<>();
    for (int i = 0; i < args.size(); i++) {
      offsets.add(type(cx, BuiltIn.SHIFT.id, args, i));
    }
    if (offsets.size() % 2 != 0) {
      throw cx.error("shift expects pairs of offsets, got " + offsets.size()
          + " offsets");
    }
    return cx.rule("shift", its -> {
      checkArgCount(cx, "shift(...)", its, 1);
      return Typing.of(
          shiftIterator(cx, offsets, type(cx, "shift(...)", its, 0)));
    });
  }

  /** Returns the type of an iterator after it is shifted by a sequence of
   * (tag, index) offsets. Cartesian offsets do not change the position;
   * an offset along a connectivity moves from its origin axis to its
   * neighbor axis. */
  static Type shiftIterator(Context cx, List<Type> offsets, Type it) {
    if (it instanceof DeferredType) {
      return it;
    }
    if (!(it instanceof IteratorType)) {
      throw cx.error("shift expects an iterator, got " + it);
    }
    final IteratorType iteratorType = (IteratorType) it;
    if (iteratorType.positionDims == null) {
      return iteratorType;
    }
    final List<Dimension> positionDims =
        new ArrayList<>(iteratorType.positionDims);
    for (int i = 0; i < offsets.size(); i += 2) {
      final Type tag = offsets.get(i);
      if (!(tag instanceof OffsetLiteralType)
          || ((OffsetLiteralType) tag).dim == null) {
        throw cx.error("expected an offset tag, got " + tag);
      }
      final String offsetName = ((OffsetLiteralType) tag).dim.value;
      final OffsetProvider offsetProvider = cx.offsetProvider();
      if (offsetProvider.dimension(offsetName) != null) {
        continue;
      }
      final Connectivity connectivity =
          offsetProvider.connectivity(offsetName);
      if (connectivity == null) {
        throw cx.error("offset '" + offsetName
            + "' not found in offset provider");
      }
      boolean found = false;
      for (int j = 0; j < positionDims.size(); j++) {
        if (positionDims.get(j).value.equals(connectivity.originAxis.value)) {
          positionDims.set(j, connectivity.neighborAxis);
          found = true;
        }
      }
      if (!found) {
        throw cx.error("cannot shift iterator positioned on "
            + positionDims + " along '" + offsetName + "'");
      }
    }
    return iteratorType.withPositionDims(positionDims);
  }

  private static Typing neighbors(Context cx, List<Typing> args) {
    final String name = BuiltIn.NEIGHBORS.id;
    checkArgCount(cx, name, args, 2);
    final Type tag = type(cx, name, args, 0);
    if (!(tag instanceof OffsetLiteralType)
        || ((OffsetLiteralType) tag).dim == null) {
      throw cx.error("neighbors expects an offset tag, got " + tag);
    }
    final String offsetName = ((OffsetLiteralType) tag).dim.value;
    if (cx.offsetProvider().connectivity(offsetName) == null) {
      throw cx.error("offset '" + offsetName + "' is not a connectivity");
    }
    final Type it = type(cx, name, args, 1);
    if (it instanceof DeferredType) {
      return Typing.DEFERRED;
    }
    if (!(it instanceof IteratorType)) {
      throw cx.error("neighbors expects an iterator, got " + it);
    }
    return Typing.of(new ListType(((IteratorType) it).elementType));
  }

  private static Typing deref(Context cx, List<Typing> args) {
    checkArgCount(cx, BuiltIn.DEREF.id, args, 1);
    final Type it = type(cx, BuiltIn.DEREF.id, args, 0);
    if (it instanceof DeferredType) {
      return Typing.DEFERRED;
    }
    if (!(it instanceof IteratorType)) {
      throw cx.error("deref expects an iterator, got " + it);
    }
    return Typing.of(((IteratorType) it).elementType);
  }

  /** Rule for {@code lift(stencil)}. The lifted stencil, applied to
   * iterators, calls the stencil with iterators whose position is unknown,
   * and returns an iterator at the position of the first argument that is
   * defined everywhere. */
  private static Typing lift(Context cx, List<Typing> args) {
    checkArgCount(cx, BuiltIn.LIFT.id, args, 1);
    final Typing stencil = args.get(0);
    return cx.rule("lift(...)", its -> {
      final List<Typing> stencilArgs = new ArrayList<>();
      for (int i = 0; i < its.size(); i++) {
        final Type it = type(cx, "lift(...)", its, i);
        if (it instanceof IteratorType) {
          stencilArgs.add(
              Typing.of(((IteratorType) it).withPositionDims(null)));
        } else if (it instanceof DeferredType) {
          stencilArgs.add(Typing.DEFERRED);
        } else {
          throw cx.error("lifted stencil expects iterators, got " + it);
        }
      }
      final Type returnType =
          valueType(cx, "lifted stencil", cx.apply(stencil, stencilArgs));
      if (returnType instanceof DeferredType) {
        return Typing.DEFERRED;
      }
      final @Nullable List<Dimension> positionDims;
      if (its.isEmpty()) {
        positionDims = ImmutableList.of();
      } else {
        final Type it0 = ((Typing.Known) its.get(0)).type;
        positionDims = it0 instanceof IteratorType
            ? ((IteratorType) it0).positionDims
            : null;
      }
      return Typing.of(
          new IteratorType(positionDims, ImmutableList.of(), returnType));
    });
  }

  /** Rule for {@code reduce(fun, init)}. Applied to lists, calls
   * {@code fun(init, elements...)}. */
  private static Typing reduce(Context cx, List<Typing> args) {
    checkArgCount(cx, BuiltIn.REDUCE.id, args, 2);
    final Typing fun = args.get(0);
    final Typing init = args.get(1);
    return cx.rule("reduce(...)", lists -> {
      final List<Typing> funArgs = new ArrayList<>();
      funArgs.add(init);
      funArgs.addAll(listElementTypings(cx, "reduce(...)", lists));
      return Typing.of(valueType(cx, "reduce", cx.apply(fun, funArgs)));
    });
  }

  /** Rule for {@code scan(fun, forward, init)}. Applied to iterators,
   * calls {@code fun(init, iterators...)}. */
  private static Typing scan(Context cx, List<Typing> args) {
    final String name = BuiltIn.SCAN.id;
    checkArgCount(cx, name, args, 3);
    final Typing fun = args.get(0);
    final Type forward = type(cx, name, args, 1);
    if (!(forward instanceof DeferredType)
        && !forward.equals(ScalarType.BOOL)) {
      throw cx.error("direction of scan must be bool, got " + forward);
    }
    final Typing init = args.get(2);
    return cx.rule("scan(...)", its -> {
      final List<Typing> funArgs = new ArrayList<>();
      funArgs.add(init);
      funArgs.addAll(its);
      return Typing.of(valueType(cx, "scan", cx.apply(fun, funArgs)));
    });
  }

  private static Typing listGet(Context cx, List<Typing> args) {
    final String name = BuiltIn.LIST_GET.id;
    checkArgCount(cx, name, args, 2);
    final Type index = type(cx, name, args, 0);
    if (index instanceof ScalarType
        && !((ScalarType) index).kind.isIntegral()) {
      throw cx.error("index of list_get must be an integer, got " + index);
    }
    final Type list = type(cx, name, args, 1);
    if (list instanceof DeferredType) {
      return Typing.DEFERRED;
    }
    if (!(list instanceof ListType)) {
      throw cx.error("list_get expects a list, got " + list);
    }
    return Typing.of(((ListType) list).elementType);
  }

  /** Rule for {@code map_(fun)}. Applied to lists, returns a list of the
   * result of {@code fun} applied to their elements. */
  private static Typing map(Context cx, List<Typing> args) {
    checkArgCount(cx, BuiltIn.MAP_.id, args, 1);
    final Typing fun = args.get(0);
    return cx.rule("map_(...)", lists -> {
      final Type elementType =
          valueType(cx, "map_",
              cx.apply(fun, listElementTypings(cx, "map_(...)", lists)));
      return elementType instanceof DeferredType ? Typing.DEFERRED
          : Typing.of(new ListType(elementType));
    });
  }

  private static List<Typing> listElementTypings(Context cx, String name,
      List<Typing> lists) {
    final List<Typing> typings = new ArrayList<>();
    for (int i = 0; i < lists.size(); i++) {
      final Type list = type(cx, name, lists, i);
      if (list instanceof ListType) {
        typings.add(Typing.of(((ListType) list).elementType));
      } else if (list instanceof DeferredType) {
        typings.add(Typing.DEFERRED);
      } else {
        throw cx.error(name + " expects lists, got " + list);
      }
    }
    return typings;
  }

  /** Rule for {@code as_fieldop(stencil)} and
   * {@code as_fieldop(stencil, domain)}. Applied to fields, calls the
   * stencil with iterators over the fields and returns a field over the
   * domain. */
  private static Typing asFieldop(Context cx, List<Typing> args) {
    final String name = BuiltIn.AS_FIELDOP.id;
    if (args.size() != 1 && args.size() != 2) {
      throw cx.error(name + " expects 1 or 2 arguments, got " + args.size());
    }
    final Typing stencil = args.get(0);
    final @Nullable DomainType domain;
    if (args.size() == 2) {
      final Type domainType = type(cx, name, args, 1);
      if (domainType instanceof DomainType) {
        domain = (DomainType) domainType;
      } else if (domainType instanceof DeferredType) {
        domain = null;
      } else {
        throw cx.error("domain of as_fieldop must be a domain, got "
            + domainType);
      }
    } else {
      domain = null;
    }
    return cx.rule("as_fieldop(...)", fields -> {
      final List<Type> fieldTypes = new ArrayList<>();
      for (int i = 0; i < fields.size(); i++) {
        final Type field = type(cx, "as_fieldop(...)", fields, i);
        for (Type t : Types.primitiveConstituents(field)) {
          if (t instanceof DeferredType) {
            return Typing.DEFERRED;
          }
        }
        fieldTypes.add(field);
      }
      final DomainType domain2 =
          domain != null ? domain : new DomainType(fieldDims(fieldTypes));
      final List<Typing> its = new ArrayList<>();
      for (Type field : fieldTypes) {
        its.add(Typing.of(toIterator(cx, domain2, field)));
      }
      final Type returnType =
          valueType(cx, "field operator", cx.apply(stencil, its));
      if (returnType instanceof DeferredType) {
        return Typing.DEFERRED;
      }
      return Typing.of(
          Types.applyToPrimitiveConstituents(returnType,
              t -> new FieldType(domain2.dims, t)));
    });
  }

  /** Returns the dimensions of the first field that has any, ignoring
   * local dimensions. */
  private static List<Dimension> fieldDims(List<Type> fieldTypes) {
    for (Type fieldType : fieldTypes) {
      for (Type t : Types.primitiveConstituents(fieldType)) {
        if (t instanceof FieldType && !((FieldType) t).dims.isEmpty()) {
          final List<Dimension> dims = new ArrayList<>();
          for (Dimension dim : ((FieldType) t).dims) {
            if (dim.kind != DimensionKind.LOCAL) {
              dims.add(dim);
            }
          }
          return dims;
        }
      }
    }
    return ImmutableList.of();
  }

  /** Converts the type of a field (or tuple of fields) that is an input to
   * a stencil into the type of an iterator positioned on a domain.
   *
   * <p>The iterator is defined on the non-local dimensions of the field. If
   * the field has a local dimension (it is a sparse field), the element type
   * is a list. */
  static IteratorType toIterator(Context cx, DomainType domain, Type input) {
    @Nullable List<Dimension> inputDims = null;
    for (Type t : Types.primitiveConstituents(input)) {
      if (t instanceof FieldType && !((FieldType) t).dims.isEmpty()) {
        final List<Dimension> dims = ((FieldType) t).dims;
        if (inputDims == null) {
          inputDims = dims;
        } else if (!inputDims.equals(dims)) {
          throw cx.error("fields in a tuple must have the same dimensions, "
              + "got " + inputDims + " and " + dims);
        }
      }
    }
    Type elementType =
        Types.applyToPrimitiveConstituents(input,
            t -> t instanceof FieldType ? ((FieldType) t).dtype : t);
    final List<Dimension> definedDims = new ArrayList<>();
    boolean local = false;
    if (inputDims != null) {
      for (Dimension dim : inputDims) {
        if (dim.kind == DimensionKind.LOCAL) {
          if (local) {
            throw cx.error("field has more than one local dimension: "
                + input);
          }
          local = true;
        } else {
          definedDims.add(dim);
        }
      }
    }
    if (local) {
      elementType = new ListType(elementType);
    }
    return new IteratorType(domain.dims, definedDims, elementType);
  }

  // utilities

  private static void checkArgCount(Context cx, String name,
      List<Typing> args, int count) {
    if (args.size() != count) {
      throw cx.error(name + " expects " + count + " argument"
          + (count == 1 ? "" : "s") + ", got " + args.size());
    }
  }

  private static void checkBool(Context cx, String name, Type type) {
    if (!(type instanceof DeferredType) && !type.equals(ScalarType.BOOL)) {
      throw cx.error("arguments of " + name + " must be bool, got " + type);
    }
  }

  /** Returns the type of the {@code i}th argument, which must be a value,
   * not a function. */
  private static Type type(Context cx, String name, List<Typing> args,
      int i) {
    return valueType(cx, name, args.get(i));
  }

  private static Type valueType(Context cx, String name, Typing typing) {
    if (!(typing instanceof Typing.Known)) {
      throw cx.error(name + " expects a value, got function "
          + ((Typing.Rule) typing).name);
    }
    return ((Typing.Known) typing).type;
  }

  /** Rule for a builtin function. */
  @FunctionalInterface
  public interface BuiltInRule {
    Typing apply(Context cx, List<Typing> args);
  }

  /** State of an inference run, as seen by the rules. */
  public interface Context {
    /** Returns the offset provider. */
    OffsetProvider offsetProvider();

    /** Creates a rule for a function value. */
    Typing.Rule rule(String name, Typing.TypeRule rule);

    /** Applies a function value to arguments. */
    Typing apply(Typing fun, List<Typing> args);

    /** Creates an exception for a type error at the node being typed. */
    TypeInference.TypeException error(String message);
  }
}

// End TypeRules.java
