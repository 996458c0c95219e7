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

/** Type of a range along one dimension, the result of {@code named_range}. */
public class NamedRangeType extends BaseType {
  public final Dimension dim;

  public NamedRangeType(Dimension dim) {
    super(Op.NAMED_RANGE_TYPE);
    this.dim = requireNonNull(dim);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append("NamedRange[").append(dim.value).append(']');
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return dim.hashCode() + 3;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof NamedRangeType && dim.equals(((NamedRangeType) o).dim);
  }
}

// End NamedRangeType.java
