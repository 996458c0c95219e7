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

/** Type of a stencil closure.
 *
 * <p>Records the types of the parts of the closure, including the type of
 * the stencil as applied to iterators over the inputs. */
public class StencilClosureType extends BaseType {
  public final DomainType domain;
  public final FunctionType stencil;
  public final Type output;
  public final List<Type> inputs;

  public StencilClosureType(
      DomainType domain, FunctionType stencil, Type output,
      List<? extends Type> inputs) {
    super(Op.STENCIL_CLOSURE_TYPE);
    this.domain = requireNonNull(domain);
    this.stencil = requireNonNull(stencil);
    this.output = requireNonNull(output);
    this.inputs = ImmutableList.copyOf(inputs);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append("StencilClosure[");
    domain.describe(buf).append(", ");
    stencil.describe(buf).append(", ");
    output.describe(buf).append(", [");
    return describeTypes(buf, inputs).append("]]");
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return Objects.hash(domain, stencil, output, inputs);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof StencilClosureType
            && domain.equals(((StencilClosureType) o).domain)
            && stencil.equals(((StencilClosureType) o).stencil)
            && output.equals(((StencilClosureType) o).output)
            && inputs.equals(((StencilClosureType) o).inputs);
  }
}

// End StencilClosureType.java
