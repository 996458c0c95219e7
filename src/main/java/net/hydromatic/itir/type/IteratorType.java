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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.itir.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Type of an iterator.
 *
 * <p>An iterator is positioned on an element of {@link #positionDims} and
 * can be dereferenced where its underlying field is defined,
 * {@link #definedDims}. */
public class IteratorType extends BaseType {
  /** Dimensions of the position, or null if the position is unknown (for
   * example, inside a lifted stencil). An unknown position is compatible
   * with any position. */
  public final @Nullable List<Dimension> positionDims;
  /** Dimensions where the iterator can be dereferenced; empty means
   * "defined everywhere". */
  public final List<Dimension> definedDims;
  public final Type elementType;

  public IteratorType(
      @Nullable List<Dimension> positionDims,
      List<Dimension> definedDims,
      Type elementType) {
    super(Op.ITERATOR_TYPE);
    this.positionDims =
        positionDims == null ? null : ImmutableList.copyOf(positionDims);
    this.definedDims = ImmutableList.copyOf(definedDims);
    this.elementType = requireNonNull(elementType);
  }

  /** Whether the position of this iterator is unknown. */
  public boolean isPositionUnknown() {
    return positionDims == null;
  }

  /** Returns a copy of this iterator type at a different position. */
  public IteratorType withPositionDims(@Nullable List<Dimension> positionDims) {
    return Objects.equals(positionDims, this.positionDims)
        ? this
        : new IteratorType(positionDims, definedDims, elementType);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append("It[");
    if (positionDims == null) {
      buf.append('?');
    } else {
      describeDims(buf, positionDims);
    }
    buf.append(", ");
    describeDims(buf, definedDims).append(", ");
    return elementType.describe(buf).append(']');
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(positionDims, definedDims, elementType);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof IteratorType
            && Objects.equals(positionDims, ((IteratorType) o).positionDims)
            && definedDims.equals(((IteratorType) o).definedDims)
            && elementType.equals(((IteratorType) o).elementType);
  }
}

// End IteratorType.java
