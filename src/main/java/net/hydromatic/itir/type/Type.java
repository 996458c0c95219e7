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

import net.hydromatic.itir.ast.Op;

/** Type of an iterator IR node.
 *
 * <p>Types are immutable values; two types are equal if they are
 * structurally equal. */
public interface Type {
  /** Type operator. */
  Op op();

  /** Writes a description of this type to a string builder. */
  StringBuilder describe(StringBuilder buf);

  <R> R accept(TypeVisitor<R> typeVisitor);

  /** Whether this type describes a value that can be stored in a field
   * (scalars, lists, fields, and tuples of those). */
  default boolean isDataType() {
    return false;
  }
}

// End Type.java
