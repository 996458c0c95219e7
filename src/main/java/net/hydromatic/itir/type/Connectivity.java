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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;

/** Neighbor relation between two horizontal dimensions, as supplied by the
 * offset provider.
 *
 * <p>Shifting an iterator positioned on {@link #originAxis} along the
 * connectivity moves it to one of at most {@link #maxNeighbors} elements of
 * {@link #neighborAxis}. */
public class Connectivity {
  public final Dimension originAxis;
  public final Dimension neighborAxis;
  public final int maxNeighbors;
  /** Whether some elements have fewer than {@link #maxNeighbors} neighbors,
   * the missing ones being marked by a skip value. */
  public final boolean hasSkipValues;

  public Connectivity(Dimension originAxis, Dimension neighborAxis,
      int maxNeighbors, boolean hasSkipValues) {
    this.originAxis = requireNonNull(originAxis);
    this.neighborAxis = requireNonNull(neighborAxis);
    checkArgument(maxNeighbors >= 0, "negative neighbor count");
    this.maxNeighbors = maxNeighbors;
    this.hasSkipValues = hasSkipValues;
  }

  /** Creates a connectivity without skip values. */
  public static Connectivity of(Dimension originAxis, Dimension neighborAxis,
      int maxNeighbors) {
    return new Connectivity(originAxis, neighborAxis, maxNeighbors, false);
  }

  @Override
  public int hashCode() {
    return Objects.hash(originAxis, neighborAxis, maxNeighbors, hasSkipValues);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Connectivity
            && originAxis.equals(((Connectivity) o).originAxis)
            && neighborAxis.equals(((Connectivity) o).neighborAxis)
            && maxNeighbors == ((Connectivity) o).maxNeighbors
            && hasSkipValues == ((Connectivity) o).hasSkipValues;
  }

  @Override
  public String toString() {
    return "Connectivity(" + originAxis + " -> " + neighborAxis + ", "
        + maxNeighbors + (hasSkipValues ? ", skip" : "") + ")";
  }
}

// End Connectivity.java
