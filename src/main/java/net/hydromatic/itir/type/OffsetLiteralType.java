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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;
import net.hydromatic.itir.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Type of an offset literal: either a constant displacement or the
 * dimension (or connectivity) along which to shift. */
public class OffsetLiteralType extends BaseType {
  public final @Nullable Integer index;
  public final @Nullable Dimension dim;

  private OffsetLiteralType(@Nullable Integer index, @Nullable Dimension dim) {
    super(Op.OFFSET_LITERAL_TYPE);
    checkArgument((index == null) != (dim == null));
    this.index = index;
    this.dim = dim;
  }

  /** Creates the type of a constant displacement. */
  public static OffsetLiteralType of(int index) {
    return new OffsetLiteralType(index, null);
  }

  /** Creates the type of an offset tag. */
  public static OffsetLiteralType of(Dimension dim) {
    return new OffsetLiteralType(null, dim);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append("Offset[")
        .append(index != null ? index.toString() : dim.value)
        .append(']');
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(index, dim);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof OffsetLiteralType
            && Objects.equals(index, ((OffsetLiteralType) o).index)
            && Objects.equals(dim, ((OffsetLiteralType) o).dim);
  }
}

// End OffsetLiteralType.java
