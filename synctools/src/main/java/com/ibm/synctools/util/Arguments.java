/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: synctools
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.synctools.util;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * An immutable, fixed-size list of call arguments, together with adapters that unpack such a list
 * into the parameters of an ordinary Java functional interface.
 *
 * <p>
 * This lets a wrapper which only knows how to forward a single value (such as
 * {@link com.ibm.synctools.locks.MultiLockInvoker}) front functions of any of the common arities.
 * Elements may be null.
 */
public final class Arguments {
  private static final Arguments EMPTY = new Arguments(new Object[0]);

  private final Object[] values;

  private Arguments(final Object[] values) {
    this.values = values;
  }

  /**
   * @return an argument list holding no values
   */
  public static Arguments empty() {
    return EMPTY;
  }

  /**
   * Creates an argument list holding a copy of the given values, in order.
   *
   * @param values the arguments
   * @return a new {@link Arguments} of size {@code values.length}
   */
  public static Arguments of(final Object... values) {
    return values.length == 0 ? EMPTY : new Arguments(values.clone());
  }

  public int size() {
    return this.values.length;
  }

  /**
   * Returns the argument at the given position, cast to the caller's expected type.
   *
   * @param index position of the argument
   * @param <A> the expected type of the argument
   * @return the argument at {@code index}
   * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0, size())}
   */
  @SuppressWarnings("unchecked")
  public <A> A get(final int index) {
    Objects.checkIndex(index, this.values.length);
    return (A) this.values[index];
  }

  private Arguments requireSize(final int arity) {
    if (this.values.length != arity) {
      throw new IllegalArgumentException(
          "expected " + arity + " arguments but got " + this.values.length);
    }
    return this;
  }

  /**
   * Adapts a no-argument function so that it accepts an empty argument list.
   *
   * @param fn the function to adapt
   * @param <R> the result type
   * @return a function which rejects non-empty argument lists with
   *         {@link IllegalArgumentException} and otherwise calls {@code fn}
   */
  public static <R> ThrowingFunction<Arguments, R, RuntimeException> spread(
      final Supplier<? extends R> fn) {
    Objects.requireNonNull(fn);
    return args -> {
      args.requireSize(0);
      return fn.get();
    };
  }

  /**
   * Adapts a one-argument function so that it accepts a single-element argument list.
   *
   * @param fn the function to adapt
   * @param <A> the argument type
   * @param <R> the result type
   * @return a function which unpacks exactly one argument into {@code fn}
   */
  public static <A, R> ThrowingFunction<Arguments, R, RuntimeException> spread(
      final Function<? super A, ? extends R> fn) {
    Objects.requireNonNull(fn);
    return args -> fn.apply(args.requireSize(1).<A>get(0));
  }

  /**
   * Adapts a two-argument function so that it accepts a two-element argument list.
   *
   * @param fn the function to adapt
   * @param <A> the first argument type
   * @param <B> the second argument type
   * @param <R> the result type
   * @return a function which unpacks exactly two arguments into {@code fn}
   */
  public static <A, B, R> ThrowingFunction<Arguments, R, RuntimeException> spread(
      final BiFunction<? super A, ? super B, ? extends R> fn) {
    Objects.requireNonNull(fn);
    return args -> {
      args.requireSize(2);
      return fn.apply(args.<A>get(0), args.<B>get(1));
    };
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof Arguments && Arrays.equals(this.values, ((Arguments) o).values);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(this.values);
  }

  @Override
  public String toString() {
    return "Arguments" + Arrays.toString(this.values);
  }
}
