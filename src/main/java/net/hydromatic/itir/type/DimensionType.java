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

import net.hydromatic.itir.ast.Op;

/** Type of an axis literal; its value is a {@link Dimension}. */
public class DimensionType extends BaseType {
  public final Dimension dim;

  public DimensionType(Dimension dim) {
    super(Op.DIMENSION_TYPE);
    this.dim = requireNonNull(dim);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append("Dimension[").append(dim.value).append(']');
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return dim.hashCode() + 11;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof DimensionType && dim.equals(((DimensionType) o).dim);
  }
}

// End DimensionType.java
