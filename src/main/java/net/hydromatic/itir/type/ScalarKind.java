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

import java.util.Locale;

/** Kind of scalar value. */
public enum ScalarKind {
  BOOL,
  INT32,
  INT64,
  FLOAT32,
  FLOAT64,
  STRING;

  /** Name as used by the type builtins, e.g. "float64". */
  public final String lowerName = name().toLowerCase(Locale.ROOT);

  public boolean isIntegral() {
    return this == INT32 || this == INT64;
  }

  public boolean isFloatingPoint() {
    return this == FLOAT32 || this == FLOAT64;
  }

  public boolean isNumber() {
    return isIntegral() || isFloatingPoint();
  }

  /** Looks up a kind by the name of its type builtin ("int32", "bool").
   * Throws if not found. */
  public static ScalarKind of(String name) {
    return valueOf(name.toUpperCase(Locale.ROOT));
  }
}

// End ScalarKind.java
