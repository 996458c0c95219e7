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

/** Type of a field: values of a data type over some dimensions. */
public class FieldType extends BaseType {
  public final List<Dimension> dims;
  /** Element type; a {@link ScalarType} or a {@link ListType}. */
  public final Type dtype;

  public FieldType(List<Dimension> dims, Type dtype) {
    super(Op.FIELD_TYPE);
    this.dims = ImmutableList.copyOf(dims);
    this.dtype = requireNonNull(dtype);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append("Field[");
    describeDims(buf, dims).append(", ");
    return dtype.describe(buf).append(']');
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public boolean isDataType() {
    return true;
  }

  @Override
  public int hashCode() {
    return Objects.hash(dims, dtype);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof FieldType
            && dims.equals(((FieldType) o).dims)
            && dtype.equals(((FieldType) o).dtype);
  }
}

// End FieldType.java
