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

import static net.hydromatic.itir.ast.IrBuilder.ir;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.ast.Pos;
import net.hydromatic.itir.type.Connectivity;
import net.hydromatic.itir.type.Dimension;
import net.hydromatic.itir.type.OffsetProvider;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Domain whose bounds are expressions, plus constant offsets.
 *
 * <p>Used to compute the domain on which an expression must be evaluated
 * so that a consumer, which accesses it at shifted positions, can read
 * every value it needs. */
public class SymbolicDomain {
  /** Name of the domain builtin, "cartesian_domain" or
   * "unstructured_domain". */
  public final String kind;
  /** Range of each axis, in order. */
  public final ImmutableMap<String, Range> ranges;

  private SymbolicDomain(String kind, Map<String, Range> ranges) {
    this.kind = kind;
    this.ranges = ImmutableMap.copyOf(ranges);
  }

  /** Analyzes a domain expression, such as
   * {@code cartesian_domain(named_range(IDimₐ, 0, n))}. */
  public static SymbolicDomain of(Ir.Expr domain) {
    if (!domain.isCallTo("cartesian_domain", "unstructured_domain")) {
      throw new CompileException("cannot analyze domain " + domain,
          domain.pos);
    }
    final Ir.FunCall call = (Ir.FunCall) domain;
    final Map<String, Range> ranges = new LinkedHashMap<>();
    for (Ir.Expr arg : call.args) {
      if (!arg.isCallTo("named_range")
          || ((Ir.FunCall) arg).args.size() != 3
          || !(((Ir.FunCall) arg).arg(0) instanceof Ir.AxisLiteral)) {
        throw new CompileException("cannot analyze range " + arg, arg.pos);
      }
      final Ir.FunCall range = (Ir.FunCall) arg;
      ranges.put(((Ir.AxisLiteral) range.arg(0)).value,
          new Range(range.arg(1), range.arg(2), 0, 0));
    }
    return new SymbolicDomain(((Ir.SymRef) call.fun).id, ranges);
  }

  /** Returns the domain that a producer must cover so that a consumer on
   * {@code domain} can access it at each of {@code shifts}. If there are no
   * shifts, returns the consumer's domain. */
  public static Ir.FunCall accessed(Ir.FunCall domain,
      Set<List<Object>> shifts, OffsetProvider offsetProvider,
      Map<String, String> symbolicDomainSizes) {
    if (shifts.isEmpty()) {
      return domain;
    }
    final SymbolicDomain symbolicDomain = of(domain);
    @Nullable SymbolicDomain result = null;
    for (List<Object> offsets : shifts) {
      final SymbolicDomain d =
          symbolicDomain.translate(offsets, offsetProvider,
              symbolicDomainSizes);
      result = result == null ? d : result.union(d);
    }
    return result.toExpr();
  }

  /** Converts this domain back to an expression. */
  public Ir.FunCall toExpr() {
    final ImmutableList.Builder<Ir.Expr> args = ImmutableList.builder();
    ranges.forEach((axis, range) ->
        args.add(
            ir.namedRange(axis, offset(range.start, range.startOffset),
                offset(range.stop, range.stopOffset))));
    return ir.call(kind, args.build());
  }

  /** Returns the domain that a producer must cover so that a consumer on
   * this domain can access it at the given offsets.
   *
   * <p>A shift along a cartesian offset moves the range of its dimension.
   * A shift along a connectivity replaces the origin dimension with the
   * neighbor dimension, whose size must be given in
   * {@code symbolicDomainSizes}. */
  public SymbolicDomain translate(List<Object> offsets,
      OffsetProvider offsetProvider, Map<String, String> symbolicDomainSizes) {
    SymbolicDomain domain = this;
    for (int i = 0; i < offsets.size(); i += 2) {
      final Object tag = offsets.get(i);
      final @Nullable Object index =
          i + 1 < offsets.size() ? offsets.get(i + 1) : null;
      if (!(tag instanceof Ir.OffsetLiteral)
          || ((Ir.OffsetLiteral) tag).isInt()) {
        throw new CompileException("invalid offset " + tag,
            tag instanceof Ir.Node ? ((Ir.Node) tag).pos : Pos.ZERO);
      }
      final String name = ((Ir.OffsetLiteral) tag).tag();
      final @Nullable Dimension dimension = offsetProvider.dimension(name);
      final @Nullable Connectivity connectivity =
          offsetProvider.connectivity(name);
      if (dimension != null) {
        if (!(index instanceof Ir.OffsetLiteral)
            || !((Ir.OffsetLiteral) index).isInt()) {
          throw new CompileException("invalid cartesian shift " + offsets,
              ((Ir.OffsetLiteral) tag).pos);
        }
        domain = domain.move(dimension.value,
            ((Ir.OffsetLiteral) index).intValue());
      } else if (connectivity != null) {
        domain = domain.replace(connectivity, symbolicDomainSizes,
            (Ir.OffsetLiteral) tag);
      } else {
        throw new CompileException("unknown offset " + name,
            ((Ir.OffsetLiteral) tag).pos);
      }
    }
    return domain;
  }

  private SymbolicDomain move(String axis, int offset) {
    final @Nullable Range range = ranges.get(axis);
    if (range == null) {
      return this;
    }
    final Map<String, Range> map = new LinkedHashMap<>(ranges);
    map.put(axis, new Range(range.start, range.stop,
        range.startOffset + offset, range.stopOffset + offset));
    return new SymbolicDomain(kind, map);
  }

  private SymbolicDomain replace(Connectivity connectivity,
      Map<String, String> symbolicDomainSizes, Ir.OffsetLiteral tag) {
    final @Nullable String size =
        symbolicDomainSizes.get(connectivity.neighborAxis.value);
    if (size == null) {
      throw new CompileException("size of dimension "
          + connectivity.neighborAxis + " is not known", tag.pos);
    }
    final Map<String, Range> map = new LinkedHashMap<>();
    ranges.forEach((axis, range) -> {
      if (axis.equals(connectivity.originAxis.value)) {
        map.put(connectivity.neighborAxis.value,
            new Range(ir.intLiteral(0), ir.ref(size), 0, 0));
      } else {
        map.put(axis, range);
      }
    });
    return new SymbolicDomain("unstructured_domain", map);
  }

  /** Returns the smallest domain that contains this and another
   * domain. */
  public SymbolicDomain union(SymbolicDomain other) {
    if (!ranges.keySet().asList().equals(other.ranges.keySet().asList())) {
      throw new CompileException("cannot combine domains " + toExpr()
          + " and " + other.toExpr(), toExpr().pos);
    }
    final Map<String, Range> map = new LinkedHashMap<>();
    ranges.forEach((axis, range) ->
        map.put(axis, range.union(other.ranges.get(axis))));
    return new SymbolicDomain(kind, map);
  }

  /** Adds a constant to an expression, folding if the expression is an
   * integer literal. */
  private static Ir.Expr offset(Ir.Expr e, int offset) {
    if (offset == 0) {
      return e;
    }
    final @Nullable Integer value = Matchers.intValue(e);
    if (value != null && e instanceof Ir.Literal) {
      return ir.literal(Integer.toString(value + offset),
          ((Ir.Literal) e).scalarType);
    }
    return offset > 0 ? ir.plus(e, ir.intLiteral(offset))
        : ir.minus(e, ir.intLiteral(-offset));
  }

  @Override
  public String toString() {
    return toExpr().toString();
  }

  /** Range of one axis: {@code [start + startOffset, stop + stopOffset)}. */
  public static class Range {
    public final Ir.Expr start;
    public final Ir.Expr stop;
    public final int startOffset;
    public final int stopOffset;

    Range(Ir.Expr start, Ir.Expr stop, int startOffset, int stopOffset) {
      this.start = start;
      this.stop = stop;
      this.startOffset = startOffset;
      this.stopOffset = stopOffset;
    }

    Range union(Range other) {
      final Ir.Expr start2;
      final Ir.Expr stop2;
      final int startOffset2;
      final int stopOffset2;
      if (start.equals(other.start)) {
        start2 = start;
        startOffset2 = Math.min(startOffset, other.startOffset);
      } else {
        start2 = ir.call("minimum", offset(start, startOffset),
            offset(other.start, other.startOffset));
        startOffset2 = 0;
      }
      if (stop.equals(other.stop)) {
        stop2 = stop;
        stopOffset2 = Math.max(stopOffset, other.stopOffset);
      } else {
        stop2 = ir.call("maximum", offset(stop, stopOffset),
            offset(other.stop, other.stopOffset));
        stopOffset2 = 0;
      }
      return new Range(start2, stop2, startOffset2, stopOffset2);
    }
  }
}

// End SymbolicDomain.java
