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
package net.hydromatic.itir.util;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Utilities. */
public class Static {
  private Static() {}

  /** Returns a list with one element appended. */
  public static <E> List<E> append(List<E> list, E e) {
    return ImmutableList.<E>builder().addAll(list).add(e).build();
  }

  /** Returns the concatenation of two lists. */
  public static <E> List<E> concat(List<? extends E> list0,
      List<? extends E> list1) {
    return ImmutableList.<E>builder().addAll(list0).addAll(list1).build();
  }

  /** Returns a copy of a list with the element at position {@code i}
   * replaced by the elements of {@code replacement}. */
  public static <E> List<E> splice(List<? extends E> list, int i,
      List<? extends E> replacement) {
    return ImmutableList.<E>builder()
        .addAll(list.subList(0, i))
        .addAll(replacement)
        .addAll(list.subList(i + 1, list.size()))
        .build();
  }
}

// End Static.java
