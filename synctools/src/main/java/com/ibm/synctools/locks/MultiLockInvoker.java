/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: synctools
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.synctools.locks;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.locks.Lock;

import com.ibm.synctools.locks.LockGroup.GroupToken;
import com.ibm.synctools.util.ThrowingFunction;

/**
 * Wraps a function so that every call to it runs while holding a fixed set of locks.
 *
 * <p>
 * Each {@link #call} acquires the whole {@link LockGroup} as one atomic group, applies the wrapped
 * function, and releases the group before returning or propagating whatever the function threw.
 * Two calls whose lock sets share at least one lock never run their functions concurrently,
 * whether they go through the same invoker or different ones. An invoker built over no locks calls
 * its function without any synchronization.
 *
 * <p>
 * The deadlock freedom described in {@link LockGroup} extends only to code which acquires these
 * locks through a {@code LockGroup}; see that class for the remaining hazard.
 *
 * @param <T> the argument type of the wrapped function
 * @param <R> the result type of the wrapped function
 * @param <X> the type of throwable the wrapped function may raise
 * @see LockedCalls
 */
public final class MultiLockInvoker<T, R, X extends Throwable> {
  private final LockGroup group;
  private final ThrowingFunction<? super T, ? extends R, ? extends X> function;

  /**
   * Creates an invoker which runs {@code function} while holding all of {@code locks}.
   *
   * @param locks the locks to hold during each call; may be empty
   * @param function the function to wrap
   */
  public MultiLockInvoker(final Collection<? extends Lock> locks,
      final ThrowingFunction<? super T, ? extends R, ? extends X> function) {
    this(LockGroup.of(locks), function);
  }

  private MultiLockInvoker(final LockGroup group,
      final ThrowingFunction<? super T, ? extends R, ? extends X> function) {
    this.group = Objects.requireNonNull(group);
    this.function = Objects.requireNonNull(function);
  }

  /**
   * Creates an invoker over an existing {@link LockGroup}.
   *
   * @param group the locks to hold during each call
   * @param function the function to wrap
   * @param <T> the argument type of the wrapped function
   * @param <R> the result type of the wrapped function
   * @param <X> the type of throwable the wrapped function may raise
   * @return a new {@link MultiLockInvoker}
   */
  public static <T, R, X extends Throwable> MultiLockInvoker<T, R, X> of(final LockGroup group,
      final ThrowingFunction<? super T, ? extends R, ? extends X> function) {
    return new MultiLockInvoker<>(group, function);
  }

  /**
   * Acquires every lock of this invoker, applies the wrapped function to {@code argument}, and
   * releases the locks. The locks are released on every exit path, before the result is returned
   * or the function's exception reaches the caller.
   *
   * @param argument the argument forwarded to the wrapped function
   * @return the value returned by the wrapped function
   * @throws X if the wrapped function throws
   */
  public R call(final T argument) throws X {
    try (GroupToken token = this.group.acquire()) {
      return this.function.apply(argument);
    }
  }

  /**
   * @return the group of locks held during each call
   */
  public LockGroup lockGroup() {
    return this.group;
  }
}
