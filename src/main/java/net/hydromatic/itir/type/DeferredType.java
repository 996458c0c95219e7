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

/** Placeholder for a type that is not known yet.
 *
 * <p>Compatible with every type; a node whose type is deferred may later be
 * given a concrete type. */
public class DeferredType extends BaseType {
  public static final DeferredType INSTANCE = new DeferredType();

  private DeferredType() {
    super(Op.DEFERRED_TYPE);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append('?');
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public int hashCode() {
    return 0;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof DeferredType;
  }
}

// End DeferredType.java
