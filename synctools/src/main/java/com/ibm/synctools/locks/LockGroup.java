/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: synctools
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.synctools.locks;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;

/**
 * An ordered set of {@link Lock locks} which are acquired and released as a single unit: a thread
 * either holds every member of the group or none of them.
 *
 * <p>
 * Membership is by identity; a lock supplied more than once is kept only at its first position.
 * The group holds ordinary references to its members, so a lock stays alive for as long as any
 * group, invoker or caller can still reach it. An empty group is legal, and acquiring it does
 * nothing.
 *
 * <p>
 * Acquisition never blocks while holding a strict subset of the group, so any number of threads
 * may acquire overlapping groups, listed in any order, without deadlocking each other. This only
 * holds among acquisitions made through {@code LockGroup}: a thread which takes a member lock
 * directly while holding some other lock can still deadlock against a group acquisition.
 *
 * <p>
 * {@link GroupToken tokens} must be released by the thread that acquired them, as required by
 * most {@link Lock} implementations.
 */
public final class LockGroup {
  /*
   * Acquisition rotates through the members: block on one lock (initially the first), then
   * tryLock the remaining members in circular order starting after it. If any tryLock fails,
   * everything held is unlocked in reverse order and the next round blocks on the lock that
   * failed, since it is the one most likely to be contended. No thread ever waits while holding
   * part of the group, so there is no hold-and-wait cycle between group acquirers.
   */

  private static final LockGroup EMPTY = new LockGroup(new Lock[0]);

  private final Lock[] locks;

  private LockGroup(final Lock[] locks) {
    this.locks = locks;
  }

  /**
   * Creates a group from the given locks, in iteration order.
   *
   * @param locks the members of the group; duplicates (by identity) are ignored
   * @return a new {@link LockGroup}
   * @throws NullPointerException if {@code locks} or any of its elements is null
   */
  public static LockGroup of(final Collection<? extends Lock> locks) {
    final Set<Lock> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    final List<Lock> members = new ArrayList<>(locks.size());
    for (final Lock lock : locks) {
      if (seen.add(Objects.requireNonNull(lock, "lock"))) {
        members.add(lock);
      }
    }
    return members.isEmpty() ? EMPTY : new LockGroup(members.toArray(new Lock[0]));
  }

  /**
   * Creates a group from the given locks, in argument order.
   *
   * @param locks the members of the group; duplicates (by identity) are ignored
   * @return a new {@link LockGroup}
   */
  public static LockGroup of(final Lock... locks) {
    return of(Arrays.asList(locks));
  }

  /**
   * @return the number of distinct locks in this group
   */
  public int size() {
    return this.locks.length;
  }

  /**
   * @return an unmodifiable view of this group's members, in acquisition order
   */
  public List<Lock> locks() {
    return Collections.unmodifiableList(Arrays.asList(this.locks));
  }

  /**
   * Acquires every lock in this group, blocking until all of them can be held at once. The wait is
   * not interruptible and has no timeout.
   *
   * @return a {@link GroupToken} used to release the whole group
   */
  public GroupToken acquire() {
    final int n = this.locks.length;
    if (n == 0) {
      return new GroupToken(this.locks);
    }

    int first = 0;
    while (true) {
      this.locks[first].lock();
      final int failed = tryLockRemaining(first);
      if (failed < 0) {
        return new GroupToken(rotate(first));
      }
      first = failed;
      Thread.yield();
    }
  }

  /**
   * Attempts to acquire every lock in this group without blocking. If any member is unavailable,
   * none are left held.
   *
   * @return An {@link Optional} holding a {@link GroupToken} if the whole group was acquired;
   *         otherwise an empty Optional
   */
  public Optional<GroupToken> tryAcquire() {
    final int n = this.locks.length;
    if (n == 0) {
      return Optional.of(new GroupToken(this.locks));
    }
    if (!this.locks[0].tryLock()) {
      return Optional.empty();
    }
    return tryLockRemaining(0) < 0
        ? Optional.of(new GroupToken(this.locks))
        : Optional.empty();
  }

  /**
   * With {@code locks[first]} already held, tries the other members in circular order. On failure
   * every lock taken so far, including {@code locks[first]}, is unlocked again.
   *
   * @return -1 if the whole group is now held, otherwise the index of the lock that was busy
   */
  private int tryLockRemaining(final int first) {
    final int n = this.locks.length;
    int held = 1;
    try {
      for (; held < n; held++) {
        final int index = (first + held) % n;
        if (!this.locks[index].tryLock()) {
          unlockRotated(first, held);
          return index;
        }
      }
      return -1;
    } catch (final RuntimeException | Error e) {
      unlockRotated(first, held);
      throw e;
    }
  }

  /** Unlocks, in reverse order, the {@code count} locks held starting at {@code first}. */
  private void unlockRotated(final int first, final int count) {
    for (int i = count - 1; i >= 0; i--) {
      this.locks[(first + i) % this.locks.length].unlock();
    }
  }

  private Lock[] rotate(final int first) {
    if (first == 0) {
      return this.locks;
    }
    final int n = this.locks.length;
    final Lock[] ordered = new Lock[n];
    for (int i = 0; i < n; i++) {
      ordered[i] = this.locks[(first + i) % n];
    }
    return ordered;
  }

  @Override
  public String toString() {
    return "LockGroup" + Arrays.toString(this.locks);
  }

  /**
   * A token indicating that every lock of a {@link LockGroup} is held by the acquiring thread. The
   * group is released by calling {@link #release()}, or by {@link #close() closing} the token in a
   * try-with-resources block.
   */
  public static final class GroupToken implements AutoCloseable {
    // acquisition order; released back to front
    private final Lock[] held;
    private volatile boolean released;

    private GroupToken(final Lock[] held) {
      this.held = held;
    }

    /**
     * Releases every lock of the group.
     *
     * <p>
     * If the first unlock fails, for instance because this is called from a thread other than the
     * acquirer, nothing has been released and the token stays valid for the owning thread to
     * release. Once one lock has been released the token is spent, and the remaining members are
     * released even if some of them fail.
     *
     * @throws IllegalStateException if this token was already released
     */
    public void release() {
      if (this.released) {
        throw new IllegalStateException("released lock group not in locked state");
      }
      final int last = this.held.length - 1;
      if (last >= 0) {
        this.held[last].unlock();
      }
      this.released = true;

      Throwable failure = null;
      for (int i = last - 1; i >= 0; i--) {
        try {
          this.held[i].unlock();
        } catch (final RuntimeException | Error e) {
          // keep releasing the rest of the group before reporting
          if (failure == null) {
            failure = e;
          } else {
            failure.addSuppressed(e);
          }
        }
      }
      if (failure instanceof RuntimeException) {
        throw (RuntimeException) failure;
      } else if (failure != null) {
        throw (Error) failure;
      }
    }

    /**
     * Releases every lock of the group.
     *
     * <p>
     * {@inheritDoc}
     */
    @Override
    public void close() {
      release();
    }
  }
}
