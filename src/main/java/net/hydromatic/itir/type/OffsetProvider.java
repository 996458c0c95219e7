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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Maps offset names to the dimension or connectivity they shift along.
 *
 * <p>An offset that maps to a {@link Dimension} is a cartesian offset; one
 * that maps to a {@link Connectivity} moves between mesh elements. */
public class OffsetProvider {
  public static final OffsetProvider EMPTY =
      new OffsetProvider(ImmutableMap.of(), ImmutableMap.of());

  public final ImmutableMap<String, Dimension> dimensions;
  public final ImmutableMap<String, Connectivity> connectivities;

  private OffsetProvider(Map<String, Dimension> dimensions,
      Map<String, Connectivity> connectivities) {
    this.dimensions = ImmutableMap.copyOf(dimensions);
    this.connectivities = ImmutableMap.copyOf(connectivities);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Whether an offset of the given name is known. */
  public boolean contains(String name) {
    return dimensions.containsKey(name) || connectivities.containsKey(name);
  }

  /** Returns the dimension of a cartesian offset, or null. */
  public @Nullable Dimension dimension(String name) {
    return dimensions.get(name);
  }

  /** Returns the connectivity of an offset, or null. */
  public @Nullable Connectivity connectivity(String name) {
    return connectivities.get(name);
  }

  /** Returns the names of all offsets, dimensions first. */
  public Iterable<String> names() {
    return Iterables.concat(
        dimensions.keySet(), connectivities.keySet());
  }

  @Override
  public String toString() {
    return "{dimensions=" + dimensions + ", connectivities=" + connectivities
        + "}";
  }

  /** Builder for {@link OffsetProvider}. */
  public static class Builder {
    private final Map<String, Dimension> dimensions = new LinkedHashMap<>();
    private final Map<String, Connectivity> connectivities =
        new LinkedHashMap<>();

    private Builder() {}

    public Builder add(String name, Dimension dimension) {
      checkArgument(!connectivities.containsKey(name),
          "duplicate offset %s", name);
      dimensions.put(name, dimension);
      return this;
    }

    public Builder add(String name, Connectivity connectivity) {
      checkArgument(!dimensions.containsKey(name),
          "duplicate offset %s", name);
      connectivities.put(name, connectivity);
      return this;
    }

    public OffsetProvider build() {
      return new OffsetProvider(dimensions, connectivities);
    }
  }
}

// End OffsetProvider.java
