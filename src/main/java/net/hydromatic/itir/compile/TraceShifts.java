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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import net.hydromatic.itir.ast.Ir;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Computes, for each input of a stencil, the sequences of offsets by
 * which the stencil shifts the input before dereferencing it.
 *
 * <p>The stencil is evaluated abstractly: each input is a symbolic
 * iterator, shifting it records the offsets, and dereferencing it records
 * the sequence. Dereferencing a lifted iterator evaluates the lifted
 * stencil on its shifted arguments. A reduction over neighbors, whose
 * length is not known statically, is recorded as a shift by
 * {@link #ALL_NEIGHBORS}.
 *
 * <p>For example, for stencil {@code λ(x) → ·⟪Iₒ, 1ₒ⟫(x)} the result is
 * {@code {x: [[Iₒ, 1ₒ]]}}. An input that is never dereferenced maps to the
 * empty set. */
public class TraceShifts {
  /** Marker for a shift to all neighbors. */
  public enum Marker {
    ALL_NEIGHBORS
  }

  /** Offset that stands for every neighbor along the preceding offset. */
  public static final Marker ALL_NEIGHBORS = Marker.ALL_NEIGHBORS;

  private final Map<String, Set<List<Object>>> shifts = new LinkedHashMap<>();

  private TraceShifts() {}

  /** Traces the shifts applied to each input of a stencil closure. */
  public static Map<String, Set<List<Object>>> trace(
      Ir.StencilClosure closure) {
    final ImmutableList.Builder<String> inputs = ImmutableList.builder();
    closure.inputs.forEach(input -> inputs.add(input.id));
    return trace(closure.stencil, inputs.build());
  }

  /** Traces the shifts applied to the arguments of a stencil, which are
   * given the names {@code inputs}. */
  public static Map<String, Set<List<Object>>> trace(Ir.Expr stencil,
      List<String> inputs) {
    final TraceShifts traceShifts = new TraceShifts();
    final List<Value> args = new ArrayList<>();
    for (String input : inputs) {
      traceShifts.shifts.putIfAbsent(input, new LinkedHashSet<>());
      args.add(
          new Iterators(
              ImmutableList.of(new Input(input, ImmutableList.of()))));
    }
    final Value fn = traceShifts.eval(stencil, ImmutableMap.of());
    traceShifts.apply(fn, args);
    return traceShifts.shifts;
  }

  private Value eval(Ir.Expr expr, Map<String, Value> env) {
    switch (expr.op) {
    case SYM_REF:
      final String id = ((Ir.SymRef) expr).id;
      final Value value = env.get(id);
      return value != null ? value : builtIn(id);
    case LITERAL:
      return new Constant((Ir.Literal) expr);
    case OFFSET_LITERAL:
      return new Offset((Ir.OffsetLiteral) expr);
    case LAMBDA:
      final Ir.Lambda lambda = (Ir.Lambda) expr;
      return new Fn(args -> {
        if (args.size() != lambda.params.size()) {
          return Data.INSTANCE;
        }
        final Map<String, Value> env2 = new LinkedHashMap<>(env);
        for (int i = 0; i < args.size(); i++) {
          env2.put(lambda.params.get(i).id, args.get(i));
        }
        return eval(lambda.expr, env2);
      });
    case FUN_CALL:
      final Ir.FunCall call = (Ir.FunCall) expr;
      final Value fn = eval(call.fun, env);
      final List<Value> args = new ArrayList<>();
      call.args.forEach(arg -> args.add(eval(arg, env)));
      return apply(fn, args);
    default:
      return Data.INSTANCE;
    }
  }

  private Value apply(Value fn, List<Value> args) {
    if (fn instanceof Fn) {
      return ((Fn) fn).function.apply(args);
    }
    return Data.INSTANCE;
  }

  private Value builtIn(String id) {
    switch (id) {
    case "deref":
      return new Fn(args ->
          args.isEmpty() ? Data.INSTANCE : deref(args.get(0)));
    case "shift":
      return new Fn(offsets ->
          new Fn(its -> its.isEmpty() ? Data.INSTANCE
              : shift(its.get(0), offsets(offsets))));
    case "lift":
      return new Fn(fs ->
          new Fn(its -> fs.isEmpty() ? Data.INSTANCE
              : new Iterators(
                  ImmutableList.of(
                      new Lifted(fs.get(0), its, ImmutableList.of())))));
    case "reduce":
      return new Fn(fAndInit ->
          new Fn(its -> {
            if (fAndInit.size() != 2) {
              return Data.INSTANCE;
            }
            final List<Value> args = new ArrayList<>();
            args.add(fAndInit.get(1));
            for (Value it : its) {
              args.add(
                  deref(shift(it, ImmutableList.of(ALL_NEIGHBORS))));
            }
            return apply(fAndInit.get(0), args);
          }));
    case "neighbors":
      return new Fn(args -> {
        if (args.size() == 2 && args.get(0) instanceof Offset) {
          deref(
              shift(args.get(1),
                  ImmutableList.of(((Offset) args.get(0)).literal,
                      ALL_NEIGHBORS)));
        }
        return Data.INSTANCE;
      });
    case "scan":
      return new Fn(scanArgs ->
          new Fn(its -> {
            if (scanArgs.size() != 3) {
              return Data.INSTANCE;
            }
            final List<Value> args = new ArrayList<>();
            args.add(scanArgs.get(2));
            args.addAll(its);
            return apply(scanArgs.get(0), args);
          }));
    case "map_":
      return new Fn(fs ->
          new Fn(lists -> {
            if (!fs.isEmpty()) {
              apply(fs.get(0), lists);
            }
            return Data.INSTANCE;
          }));
    case "as_fieldop":
      return new Fn(stencilAndDomain ->
          new Fn(fields -> stencilAndDomain.isEmpty() ? Data.INSTANCE
              : apply(stencilAndDomain.get(0), fields)));
    case "make_tuple":
      return new Fn(Tuple::new);
    case "tuple_get":
      return new Fn(args -> {
        if (args.size() == 2 && args.get(0) instanceof Constant
            && args.get(1) instanceof Tuple) {
          final List<Value> values = ((Tuple) args.get(1)).values;
          final Integer i =
              Matchers.intValue(((Constant) args.get(0)).literal);
          if (i != null && i >= 0 && i < values.size()) {
            return values.get(i);
          }
        }
        return Data.INSTANCE;
      });
    case "if_":
      return new Fn(args ->
          args.size() == 3 ? merge(args.get(1), args.get(2)) : Data.INSTANCE);
    case "cast_":
      return new Fn(args -> args.isEmpty() ? Data.INSTANCE : args.get(0));
    default:
      return new Fn(args -> Data.INSTANCE);
    }
  }

  private static List<Object> offsets(List<Value> values) {
    final ImmutableList.Builder<Object> offsets = ImmutableList.builder();
    for (Value value : values) {
      if (value instanceof Offset) {
        offsets.add(((Offset) value).literal);
      } else {
        offsets.add(ALL_NEIGHBORS);
      }
    }
    return offsets.build();
  }

  private Value shift(Value value, List<Object> offsets) {
    if (value instanceof Iterators) {
      final ImmutableList.Builder<Source> sources = ImmutableList.builder();
      for (Source source : ((Iterators) value).sources) {
        sources.add(source.shift(offsets));
      }
      return new Iterators(sources.build());
    }
    if (value instanceof Tuple) {
      final ImmutableList.Builder<Value> values = ImmutableList.builder();
      for (Value v : ((Tuple) value).values) {
        values.add(shift(v, offsets));
      }
      return new Tuple(values.build());
    }
    return Data.INSTANCE;
  }

  private Value deref(Value value) {
    if (value instanceof Iterators) {
      @Nullable Value result = null;
      for (Source source : ((Iterators) value).sources) {
        final Value v = source.deref(this);
        result = result == null ? v : merge(result, v);
      }
      return result == null ? Data.INSTANCE : result;
    }
    if (value instanceof Tuple) {
      final ImmutableList.Builder<Value> values = ImmutableList.builder();
      for (Value v : ((Tuple) value).values) {
        values.add(deref(v));
      }
      return new Tuple(values.build());
    }
    return Data.INSTANCE;
  }

  /** Combines the values of two branches of a conditional. */
  private Value merge(Value v0, Value v1) {
    if (v0.equals(v1)) {
      return v0;
    }
    if (v0 instanceof Iterators && v1 instanceof Iterators) {
      return new Iterators(
          ImmutableList.<Source>builder()
              .addAll(((Iterators) v0).sources)
              .addAll(((Iterators) v1).sources)
              .build());
    }
    if (v0 instanceof Tuple && v1 instanceof Tuple
        && ((Tuple) v0).values.size() == ((Tuple) v1).values.size()) {
      final ImmutableList.Builder<Value> values = ImmutableList.builder();
      for (int i = 0; i < ((Tuple) v0).values.size(); i++) {
        values.add(
            merge(((Tuple) v0).values.get(i), ((Tuple) v1).values.get(i)));
      }
      return new Tuple(values.build());
    }
    if (v0 instanceof Fn && v1 instanceof Fn) {
      return new Fn(args ->
          merge(apply(v0, args), apply(v1, args)));
    }
    return Data.INSTANCE;
  }

  /** Abstract value. */
  private abstract static class Value {
  }

  /** Value about which nothing is known, such as the result of
   * arithmetic. */
  private static class Data extends Value {
    static final Data INSTANCE = new Data();
  }

  /** Value of a literal. */
  private static class Constant extends Value {
    final Ir.Literal literal;

    Constant(Ir.Literal literal) {
      this.literal = literal;
    }
  }

  /** Value of an offset literal. */
  private static class Offset extends Value {
    final Ir.OffsetLiteral literal;

    Offset(Ir.OffsetLiteral literal) {
      this.literal = literal;
    }
  }

  /** Function value. */
  private static class Fn extends Value {
    final Function<List<Value>, Value> function;

    Fn(Function<List<Value>, Value> function) {
      this.function = function;
    }
  }

  /** Tuple value. */
  private static class Tuple extends Value {
    final List<Value> values;

    Tuple(List<Value> values) {
      this.values = ImmutableList.copyOf(values);
    }
  }

  /** Iterator, or a choice between several iterators. */
  private static class Iterators extends Value {
    final List<Source> sources;

    Iterators(List<Source> sources) {
      this.sources = sources;
    }
  }

  /** Where an iterator comes from. */
  private abstract static class Source {
    abstract Source shift(List<Object> offsets);

    abstract Value deref(TraceShifts traceShifts);
  }

  /** Iterator over an input of the stencil, shifted by some offsets. */
  private static class Input extends Source {
    final String id;
    final ImmutableList<Object> offsets;

    Input(String id, ImmutableList<Object> offsets) {
      this.id = id;
      this.offsets = offsets;
    }

    @Override
    Source shift(List<Object> offsets) {
      return new Input(id,
          ImmutableList.builder().addAll(this.offsets).addAll(offsets)
              .build());
    }

    @Override
    Value deref(TraceShifts traceShifts) {
      traceShifts.shifts.computeIfAbsent(id, k -> new LinkedHashSet<>())
          .add(offsets);
      return Data.INSTANCE;
    }
  }

  /** Iterator returned by an applied lift, shifted by some offsets. */
  private static class Lifted extends Source {
    final Value fn;
    final List<Value> args;
    final ImmutableList<Object> offsets;

    Lifted(Value fn, List<Value> args, ImmutableList<Object> offsets) {
      this.fn = fn;
      this.args = ImmutableList.copyOf(args);
      this.offsets = offsets;
    }

    @Override
    Source shift(List<Object> offsets) {
      return new Lifted(fn, args,
          ImmutableList.builder().addAll(this.offsets).addAll(offsets)
              .build());
    }

    @Override
    Value deref(TraceShifts traceShifts) {
      final List<Value> shifted = new ArrayList<>();
      for (Value arg : args) {
        shifted.add(traceShifts.shift(arg, offsets));
      }
      return traceShifts.apply(fn, shifted);
    }
  }
}

// End TraceShifts.java
