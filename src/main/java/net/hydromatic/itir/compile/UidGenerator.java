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
package net.hydromatic.itir.compile;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generates unique identifiers.
 *
 * <p>Each prefix has its own sequence, so that the ids generated for common
 * subexpressions ("_cs1", "_cs2") and temporaries ("__tmp1") are dense.
 * Identifiers already used in the program can be reserved; the generator
 * skips them.
 */
public class UidGenerator {
  private final Map<String, AtomicInteger> counts = new HashMap<>();
  private final Set<String> used = new HashSet<>();

  /** Generates an identifier with a given prefix that has not been
   * generated or reserved before. */
  public String get(String prefix) {
    final AtomicInteger count =
        counts.computeIfAbsent(prefix, p -> new AtomicInteger(0));
    for (;;) {
      final String id = prefix + count.incrementAndGet();
      if (used.add(id)) {
        return id;
      }
    }
  }

  /** Marks identifiers as used, so that they will not be generated. */
  public UidGenerator reserve(Collection<String> ids) {
    used.addAll(ids);
    return this;
  }
}

// End UidGenerator.java
