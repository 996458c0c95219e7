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
import java.util.Objects;
import net.hydromatic.itir.ast.Op;

/** Type of a program: the types of its parameters and of its
 * statements. */
public class ProgramType extends BaseType {
  public final List<Type> params;
  public final List<Type> statements;

  public ProgramType(List<? extends Type> params,
      List<? extends Type> statements) {
    super(Op.PROGRAM_TYPE);
    this.params = ImmutableList.copyOf(params);
    this.statements = ImmutableList.copyOf(statements);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append("Program[(");
    describeTypes(buf, params).append("), [");
    return describeTypes(buf, statements).append("]]");
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(params, statements);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ProgramType
            && params.equals(((ProgramType) o).params)
            && statements.equals(((ProgramType) o).statements);
  }
}

// End ProgramType.java
