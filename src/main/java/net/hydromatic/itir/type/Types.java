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
package net.hydromatic.itir.type;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/** Utilities for {@link Type}. */
public abstract class Types {
  private Types() {}

  /**
   * Returns whether two types are compatible.
   *
   * <p>Iterators with an unknown position are compatible with an iterator at
   * any position, and an iterator with empty defined dimensions (defined
   * everywhere) is compatible with an iterator defined on any dimensions.
   * {@link DeferredType} is compatible with every type. Otherwise, types
   * must be equal, comparing tuples, functions, lists and fields component
   * by component.
   */
  public static boolean isCompatible(Type a, Type b) {
    if (a instanceof DeferredType || b instanceof DeferredType) {
      return true;
    }
    if (a instanceof IteratorType && b instanceof IteratorType) {
      final IteratorType itA = (IteratorType) a;
      final IteratorType itB = (IteratorType) b;
      if (!itA.isPositionUnknown()
          && !itB.isPositionUnknown()
          && !itA.positionDims.equals(itB.positionDims)) {
        return false;
      }
      if (!itA.definedDims.isEmpty()
          && !itB.definedDims.isEmpty()
          && !itA.definedDims.equals(itB.definedDims)) {
        return false;
      }
      return isCompatible(itA.elementType, itB.elementType);
    }
    if (a instanceof TupleType && b instanceof TupleType) {
      return allCompatible(((TupleType) a).types, ((TupleType) b).types);
    }
    if (a instanceof FunctionType && b instanceof FunctionType) {
      final FunctionType fnA = (FunctionType) a;
      final FunctionType fnB = (FunctionType) b;
      if (!fnA.kwArgs.keySet().equals(fnB.kwArgs.keySet())) {
        return false;
      }
      for (Map.Entry<String, Type> entry : fnA.kwArgs.entrySet()) {
        if (!isCompatible(entry.getValue(), fnB.kwArgs.get(entry.getKey()))) {
          return false;
        }
      }
      return allCompatible(fnA.posArgs, fnB.posArgs)
          && isCompatible(fnA.returns, fnB.returns);
    }
    if (a instanceof ListType && b instanceof ListType) {
      return isCompatible(((ListType) a).elementType,
          ((ListType) b).elementType);
    }
    if (a instanceof FieldType && b instanceof FieldType) {
      return ((FieldType) a).dims.equals(((FieldType) b).dims)
          && isCompatible(((FieldType) a).dtype, ((FieldType) b).dtype);
    }
    return a.equals(b);
  }

  private static boolean allCompatible(List<Type> as, List<Type> bs) {
    if (as.size() != bs.size()) {
      return false;
    }
    for (int i = 0; i < as.size(); i++) {
      if (!isCompatible(as.get(i), bs.get(i))) {
        return false;
      }
    }
    return true;
  }

  /** Returns the leaves of a (possibly nested) tuple type; for a type that
   * is not a tuple, returns a list containing just that type. */
  public static List<Type> primitiveConstituents(Type type) {
    final ImmutableList.Builder<Type> list = ImmutableList.builder();
    forEachPrimitiveConstituent(type, list::add);
    return list.build();
  }

  private static void forEachPrimitiveConstituent(Type type,
      Consumer<Type> consumer) {
    if (type instanceof TupleType) {
      ((TupleType) type).types.forEach(t ->
          forEachPrimitiveConstituent(t, consumer));
    } else {
      consumer.accept(type);
    }
  }

  /** Applies a transform to each leaf of a (possibly nested) tuple type,
   * preserving the tuple structure. */
  public static Type applyToPrimitiveConstituents(Type type,
      UnaryOperator<Type> transform) {
    if (type instanceof TupleType) {
      final ImmutableList.Builder<Type> types = ImmutableList.builder();
      for (Type t : ((TupleType) type).types) {
        types.add(applyToPrimitiveConstituents(t, transform));
      }
      return new TupleType(types.build());
    }
    return transform.apply(type);
  }

  /** Converts a scalar to a zero-dimensional field; returns a field
   * unchanged. */
  public static FieldType promoteToField(Type type) {
    if (type instanceof FieldType) {
      return (FieldType) type;
    }
    if (type instanceof ScalarType || type instanceof ListType) {
      return new FieldType(ImmutableList.of(), type);
    }
    throw new IllegalArgumentException("not a field or scalar: " + type);
  }

  /** Returns the dimensions that occur in a collection of types, keyed by
   * name. */
  public static Map<String, Dimension> dimensions(Iterable<Type> types) {
    final Map<String, Dimension> map = new LinkedHashMap<>();
    final TypeVisitor<Void> visitor =
        new TypeVisitor<Void>() {
          void add(Iterable<Dimension> dims) {
            dims.forEach(dim -> map.put(dim.value, dim));
          }

          @Override
          public Void visit(FieldType fieldType) {
            add(fieldType.dims);
            return super.visit(fieldType);
          }

          @Override
          public Void visit(IteratorType iteratorType) {
            if (iteratorType.positionDims != null) {
              add(iteratorType.positionDims);
            }
            add(iteratorType.definedDims);
            return super.visit(iteratorType);
          }

          @Override
          public Void visit(DomainType domainType) {
            add(domainType.dims);
            return null;
          }

          @Override
          public Void visit(NamedRangeType namedRangeType) {
            add(ImmutableList.of(namedRangeType.dim));
            return null;
          }

          @Override
          public Void visit(DimensionType dimensionType) {
            add(ImmutableList.of(dimensionType.dim));
            return null;
          }

          @Override
          public Void visit(OffsetLiteralType offsetLiteralType) {
            if (offsetLiteralType.dim != null) {
              add(ImmutableList.of(offsetLiteralType.dim));
            }
            return null;
          }
        };
    for (Type type : types) {
      type.accept(visitor);
    }
    return map;
  }
}

// End Types.java
