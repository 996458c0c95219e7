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
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.itir.ast.Op;

/** The type of a function value. */
public class FunctionType extends BaseType {
  public final List<Type> posArgs;
  public final Map<String, Type> kwArgs;
  public final Type returns;

  public FunctionType(
      List<? extends Type> posArgs, Map<String, ? extends Type> kwArgs,
      Type returns) {
    super(Op.FUNCTION_TYPE);
    this.posArgs = ImmutableList.copyOf(posArgs);
    this.kwArgs = ImmutableMap.copyOf(kwArgs);
    this.returns = requireNonNull(returns);
  }

  /** Creates a function type with positional arguments only. */
  public static FunctionType of(List<? extends Type> posArgs, Type returns) {
    return new FunctionType(posArgs, ImmutableMap.of(), returns);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append('(');
    describeTypes(buf, posArgs);
    int i = posArgs.size();
    for (Map.Entry<String, Type> entry : kwArgs.entrySet()) {
      buf.append(i++ == 0 ? "" : ", ").append(entry.getKey()).append(": ");
      entry.getValue().describe(buf);
    }
    buf.append(")").append(op.padded);
    return returns.describe(buf);
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(posArgs, kwArgs, returns);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof FunctionType
            && posArgs.equals(((FunctionType) o).posArgs)
            && kwArgs.equals(((FunctionType) o).kwArgs)
            && returns.equals(((FunctionType) o).returns);
  }
}

// End FunctionType.java
