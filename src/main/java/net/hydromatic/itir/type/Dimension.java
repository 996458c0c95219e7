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

import java.util.Objects;

/** Named dimension of a field or domain. */
public class Dimension {
  public final String value;
  public final DimensionKind kind;

  public Dimension(String value, DimensionKind kind) {
    this.value = requireNonNull(value);
    this.kind = requireNonNull(kind);
  }

  /** Creates a horizontal dimension. */
  public static Dimension of(String value) {
    return new Dimension(value, DimensionKind.HORIZONTAL);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, kind);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Dimension
            && value.equals(((Dimension) o).value)
            && kind == ((Dimension) o).kind;
  }

  @Override
  public String toString() {
    return value;
  }
}

// End Dimension.java
