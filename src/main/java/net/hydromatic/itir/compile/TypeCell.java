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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.itir.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Cell that holds a type that is not known yet.
 *
 * <p>A cell is resolved at most once. Callbacks registered before
 * resolution fire, synchronously and in registration order, when the cell
 * is resolved; callbacks registered after resolution fire immediately.
 *
 * <p>Resolving a cell twice, or resolving a cell from one of its own
 * callbacks (which would indicate a cyclic dependency), is an internal
 * error. */
public class TypeCell {
  private @Nullable Type type;
  private @Nullable List<Consumer<Type>> callbacks = new ArrayList<>();
  private boolean firing;

  /** Returns whether this cell has been resolved. */
  public boolean isResolved() {
    return type != null;
  }

  /** Returns the type; throws if the cell has not been resolved. */
  public Type get() {
    if (type == null) {
      throw new IllegalStateException("type cell is not resolved");
    }
    return type;
  }

  /** Resolves this cell, and fires its callbacks. */
  public void resolve(Type type) {
    requireNonNull(type);
    if (firing) {
      throw new AssertionError("cyclic dependency: cell resolved while its "
          + "callbacks fire; was " + this.type + ", now " + type);
    }
    if (this.type != null) {
      throw new AssertionError("cell resolved twice: was " + this.type
          + ", now " + type);
    }
    this.type = type;
    final List<Consumer<Type>> callbacks = requireNonNull(this.callbacks);
    this.callbacks = null;
    firing = true;
    try {
      for (Consumer<Type> callback : callbacks) {
        callback.accept(type);
      }
    } finally {
      firing = false;
    }
  }

  /** Registers a callback to be called with the type when the cell is
   * resolved. */
  public void onReady(Consumer<Type> callback) {
    if (type != null) {
      callback.accept(type);
    } else {
      requireNonNull(callbacks).add(callback);
    }
  }

  @Override
  public String toString() {
    return type == null ? "TypeCell(?)" : "TypeCell(" + type + ")";
  }

  /** Calls a callback, exactly once, when all of the given typings have a
   * type.
   *
   * <p>A {@link Typing.Known} has a type already; a {@link Typing.Rule} has
   * a type when its cell is resolved. If every typing is ready, the callback
   * fires before this method returns. */
  public static void onReady(List<? extends Typing> typings,
      Consumer<List<Type>> callback) {
    final Type[] types = new Type[typings.size()];
    final Countdown countdown =
        new Countdown(typings.size() + 1,
            () -> callback.accept(ImmutableList.copyOf(types)));
    for (int i = 0; i < typings.size(); i++) {
      final int ordinal = i;
      final Typing typing = typings.get(i);
      if (typing instanceof Typing.Known) {
        types[i] = ((Typing.Known) typing).type;
        countdown.decrement();
      } else {
        ((Typing.Rule) typing).cell.onReady(type -> {
          types[ordinal] = type;
          countdown.decrement();
        });
      }
    }
    // The extra count prevents the callback from firing while we are still
    // registering.
    countdown.decrement();
  }

  /** Calls a callback when all of the given typings have a type. */
  public static void onReady(Consumer<List<Type>> callback,
      Typing... typings) {
    onReady(Arrays.asList(typings), callback);
  }

  /** Counter that runs an action when it reaches zero. */
  private static class Countdown {
    private int count;
    private final Runnable action;

    Countdown(int count, Runnable action) {
      this.count = count;
      this.action = action;
    }

    void decrement() {
      if (--count == 0) {
        action.run();
      } else if (count < 0) {
        throw new AssertionError("countdown below zero");
      }
    }
  }
}

// End TypeCell.java
