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

/** Visitor over {@link Type} objects.
 *
 * <p>The default methods visit the component types and return the result of
 * the last one, or null.
 *
 * @param <R> return type from {@code visit} methods
 *
 * @see Type#accept(TypeVisitor)
 */
public class TypeVisitor<R> {
  public R visit(ScalarType scalarType) {
    return null;
  }

  public R visit(FieldType fieldType) {
    return fieldType.dtype.accept(this);
  }

  public R visit(TupleType tupleType) {
    R r = null;
    for (Type type : tupleType.types) {
      r = type.accept(this);
    }
    return r;
  }

  public R visit(FunctionType functionType) {
    for (Type type : functionType.posArgs) {
      type.accept(this);
    }
    for (Type type : functionType.kwArgs.values()) {
      type.accept(this);
    }
    return functionType.returns.accept(this);
  }

  public R visit(IteratorType iteratorType) {
    return iteratorType.elementType.accept(this);
  }

  public R visit(ListType listType) {
    return listType.elementType.accept(this);
  }

  public R visit(DomainType domainType) {
    return null;
  }

  public R visit(NamedRangeType namedRangeType) {
    return null;
  }

  public R visit(OffsetLiteralType offsetLiteralType) {
    return null;
  }

  public R visit(DimensionType dimensionType) {
    return null;
  }

  public R visit(DeferredType deferredType) {
    return null;
  }

  public R visit(StencilClosureType stencilClosureType) {
    stencilClosureType.domain.accept(this);
    stencilClosureType.stencil.accept(this);
    stencilClosureType.inputs.forEach(t -> t.accept(this));
    return stencilClosureType.output.accept(this);
  }

  public R visit(ProgramType programType) {
    programType.params.forEach(t -> t.accept(this));
    R r = null;
    for (Type type : programType.statements) {
      r = type.accept(this);
    }
    return r;
  }
}

// End TypeVisitor.java
