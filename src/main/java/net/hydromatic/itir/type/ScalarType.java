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

/** Type of a scalar value. */
public class ScalarType extends BaseType {
  public static final ScalarType BOOL = new ScalarType(ScalarKind.BOOL);
  public static final ScalarType INT32 = new ScalarType(ScalarKind.INT32);
  public static final ScalarType INT64 = new ScalarType(ScalarKind.INT64);
  public static final ScalarType FLOAT32 = new ScalarType(ScalarKind.FLOAT32);
  public static final ScalarType FLOAT64 = new ScalarType(ScalarKind.FLOAT64);
  public static final ScalarType STRING = new ScalarType(ScalarKind.STRING);

  public final ScalarKind kind;

  private ScalarType(ScalarKind kind) {
    super(Op.SCALAR_TYPE);
    this.kind = requireNonNull(kind);
  }

  /** Returns the scalar type of a given kind. */
  public static ScalarType of(ScalarKind kind) {
    switch (kind) {
    case BOOL:
      return BOOL;
    case INT32:
      return INT32;
    case INT64:
      return INT64;
    case FLOAT32:
      return FLOAT32;
    case FLOAT64:
      return FLOAT64;
    case STRING:
      return STRING;
    default:
      throw new AssertionError(kind);
    }
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append(kind.lowerName);
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
    return kind.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ScalarType && ((ScalarType) o).kind == kind;
  }
}

// End ScalarType.java
