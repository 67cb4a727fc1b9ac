/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: synctools
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.synctools.locks;

import java.util.Collection;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.Lock;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

import com.ibm.synctools.util.Arguments;

/**
 * Static factories that guard the standard functional interfaces with a {@link MultiLockInvoker}.
 * Each returned object has the same shape as the one it wraps; its arguments are forwarded through
 * the invoker, so every call holds all of the given locks for its duration.
 */
public final class LockedCalls {
  private LockedCalls() {}

  /**
   * @param locks the locks to hold while {@code action} runs
   * @param action the action to guard
   * @return a {@link Runnable} which runs {@code action} while holding all of {@code locks}
   */
  public static Runnable runnable(final Collection<? extends Lock> locks, final Runnable action) {
    final MultiLockInvoker<Arguments, Void, RuntimeException> invoker =
        new MultiLockInvoker<>(locks, Arguments.<Void>spread(() -> {
          action.run();
          return null;
        }));
    return () -> invoker.call(Arguments.empty());
  }

  /**
   * @param locks the locks to hold while {@code supplier} runs
   * @param supplier the supplier to guard
   * @param <R> the result type
   * @return a {@link Supplier} which calls {@code supplier} while holding all of {@code locks}
   */
  public static <R> Supplier<R> supplier(final Collection<? extends Lock> locks,
      final Supplier<? extends R> supplier) {
    final MultiLockInvoker<Arguments, R, RuntimeException> invoker =
        new MultiLockInvoker<>(locks, Arguments.<R>spread(supplier));
    return () -> invoker.call(Arguments.empty());
  }

  /**
   * Guards a {@link Callable}, whose checked exceptions reach the caller unchanged.
   *
   * @param locks the locks to hold while {@code callable} runs
   * @param callable the callable to guard
   * @param <R> the result type
   * @return a {@link Callable} which calls {@code callable} while holding all of {@code locks}
   */
  public static <R> Callable<R> callable(final Collection<? extends Lock> locks,
      final Callable<? extends R> callable) {
    final MultiLockInvoker<Void, R, Exception> invoker =
        new MultiLockInvoker<>(locks, ignored -> callable.call());
    return () -> invoker.call(null);
  }

  /**
   * @param locks the locks to hold while {@code fn} runs
   * @param fn the function to guard
   * @param <A> the argument type
   * @param <R> the result type
   * @return a {@link Function} which applies {@code fn} while holding all of {@code locks}
   */
  public static <A, R> Function<A, R> function(final Collection<? extends Lock> locks,
      final Function<? super A, ? extends R> fn) {
    final MultiLockInvoker<Arguments, R, RuntimeException> invoker =
        new MultiLockInvoker<>(locks, Arguments.<A, R>spread(fn));
    return a -> invoker.call(Arguments.of(a));
  }

  /**
   * @param locks the locks to hold while {@code fn} runs
   * @param fn the function to guard
   * @param <A> the first argument type
   * @param <B> the second argument type
   * @param <R> the result type
   * @return a {@link BiFunction} which applies {@code fn} while holding all of {@code locks}
   */
  public static <A, B, R> BiFunction<A, B, R> biFunction(final Collection<? extends Lock> locks,
      final BiFunction<? super A, ? super B, ? extends R> fn) {
    final MultiLockInvoker<Arguments, R, RuntimeException> invoker =
        new MultiLockInvoker<>(locks, Arguments.<A, B, R>spread(fn));
    return (a, b) -> invoker.call(Arguments.of(a, b));
  }
}
