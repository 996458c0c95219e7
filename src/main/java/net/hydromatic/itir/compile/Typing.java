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

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.itir.ast.Ir;
import net.hydromatic.itir.type.DeferredType;
import net.hydromatic.itir.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** What type inference knows about a node: either its type, or, for a
 * function value, a rule that computes the type of the result when the
 * function is applied. */
public abstract class Typing {
  /** Typing of a node whose type is not known yet. */
  public static final Known DEFERRED = new Known(DeferredType.INSTANCE);

  private Typing() {}

  /** Creates a typing for a known type. */
  public static Known of(Type type) {
    return type instanceof DeferredType ? DEFERRED : new Known(type);
  }

  /** Typing whose type is known. */
  public static final class Known extends Typing {
    public final Type type;

    private Known(Type type) {
      this.type = requireNonNull(type);
    }

    @Override
    public String toString() {
      return type.toString();
    }
  }

  /** Typing of a function value.
   *
   * <p>Each application of the function applies the {@link TypeRule} to the
   * typings of the arguments. When the arguments and the result of an
   * application all have types, the function has a type, and
   * {@link #cell} is resolved with a
   * {@link net.hydromatic.itir.type.FunctionType}. */
  public static final class Rule extends Typing {
    public final String name;
    final TypeRule rule;
    final TypeCell cell = new TypeCell();
    /** Whether the rule was created while inferring the second or later
     * instantiation of a function. */
    final boolean polymorphic;
    /** Node whose type is the type of this function, or null. */
    Ir.@Nullable Node node;
    /** References to the same function value, which receive the same
     * type. */
    final List<Ir.Node> aliases = new ArrayList<>();
    /** Parameters of the lambda or function definition that defines this
     * function; empty for builtins. */
    final List<Ir.Sym> params = new ArrayList<>();
    /** Number of times the rule has been applied. */
    int instanceCount;

    Rule(String name, TypeRule rule, boolean polymorphic) {
      this.name = requireNonNull(name);
      this.rule = requireNonNull(rule);
      this.polymorphic = polymorphic;
    }

    @Override
    public String toString() {
      return "Rule(" + name + ", " + cell + ")";
    }
  }

  /** Computes the typing of the result of applying a function to
   * arguments. */
  @FunctionalInterface
  public interface TypeRule {
    Typing apply(List<Typing> args);
  }
}

// End Typing.java
