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

/** Abstract implementation of Type. */
abstract class BaseType implements Type {
  final Op op;

  protected BaseType(Op op) {
    this.op = requireNonNull(op);
  }

  @Override
  public Op op() {
    return op;
  }

  @Override
  public String toString() {
    return describe(new StringBuilder()).toString();
  }

  /** Appends a list of dimensions, e.g. "[IDim, JDim]". */
  static StringBuilder describeDims(
      StringBuilder buf, Iterable<Dimension> dims) {
    buf.append('[');
    int i = 0;
    for (Dimension dim : dims) {
      buf.append(i++ == 0 ? "" : ", ").append(dim.value);
    }
    return buf.append(']');
  }

  /** Appends a list of types, separated by commas. */
  static StringBuilder describeTypes(
      StringBuilder buf, Iterable<? extends Type> types) {
    int i = 0;
    for (Type type : types) {
      if (i++ > 0) {
        buf.append(", ");
      }
      type.describe(buf);
    }
    return buf;
  }
}

// End BaseType.java
