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
import java.util.List;
import net.hydromatic.itir.ast.Op;

/** Type of a tuple value. */
public class TupleType extends BaseType {
  public final List<Type> types;

  public TupleType(List<? extends Type> types) {
    super(Op.TUPLE_TYPE);
    this.types = ImmutableList.copyOf(types);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append("tuple[");
    return describeTypes(buf, types).append(']');
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public boolean isDataType() {
    return types.stream().allMatch(Type::isDataType);
  }

  @Override
  public int hashCode() {
    return types.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TupleType && types.equals(((TupleType) o).types);
  }
}

// End TupleType.java
