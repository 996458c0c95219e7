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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls the pass pipeline.
 *
 * @see PassOptions
 */
public enum Prop {
  /**
   * Boolean property "commonSubexpressionElimination" controls whether
   * repeated subexpressions are extracted into let-bound symbols after the
   * main inlining loop. Default is true.
   */
  COMMON_SUBEXPRESSION_ELIMINATION("commonSubexpressionElimination",
      Boolean.class, true),

  /**
   * Boolean property "extractTemporaries" controls whether applied lifts are
   * extracted into temporary fields. The program is typed first. Default is
   * false.
   */
  EXTRACT_TEMPORARIES("extractTemporaries", Boolean.class, false),

  /**
   * Boolean property "forceInlineLambdaArgs" controls whether the final
   * inlining pass inlines lambda arguments even if doing so duplicates
   * them. Default is false.
   */
  FORCE_INLINE_LAMBDA_ARGS("forceInlineLambdaArgs", Boolean.class, false),

  /** Maximum number of iterations of each fixpoint loop. */
  MAX_FIXPOINT_ITERATIONS("maxFixpointIterations", Integer.class, 10),

  /**
   * Boolean property "unconditionallyCollapseTuples" controls whether
   * tuples are collapsed without checking their size, once, after the main
   * inlining loop. Default is false.
   */
  UNCONDITIONALLY_COLLAPSE_TUPLES("unconditionallyCollapseTuples",
      Boolean.class, false),

  /**
   * Boolean property "unrollReduce" controls whether reductions over
   * neighbors are unrolled. Default is false.
   */
  UNROLL_REDUCE("unrollReduce", Boolean.class, false);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(CaseFormat.LOWER_CAMEL
        .to(CaseFormat.UPPER_UNDERSCORE, camelName)
        .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for property %s", type, camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /** Sets the value of a property. A null value reverts to the default. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
      return;
    }
    checkArgument(type.isInstance(value),
        "value %s is not valid for property %s of type %s", value,
        camelName, type.getSimpleName());
    if (this == MAX_FIXPOINT_ITERATIONS) {
      checkArgument((Integer) value > 0,
          "%s must be positive: %s", camelName, value);
    }
    map.put(this, value);
  }

  /** Sets the value of a property, allowing strings for boolean and
   * integer types. */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String) {
      final String s = ((String) value).trim();
      if (type == Boolean.class) {
        if (!s.equalsIgnoreCase("true") && !s.equalsIgnoreCase("false")) {
          throw new IllegalArgumentException("value " + s
              + " is not valid for boolean property " + camelName);
        }
        value = Boolean.valueOf(s);
      } else if (type == Integer.class) {
        try {
          value = Integer.valueOf(s);
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("value " + s
              + " is not valid for integer property " + camelName, e);
        }
      }
    }
    set(map, value);
  }
}

// End Prop.java
