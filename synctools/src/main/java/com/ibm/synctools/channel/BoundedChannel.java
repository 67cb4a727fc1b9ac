/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: synctools
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.synctools.channel;

import java.util.Optional;

/**
 * A fixed-capacity, thread safe FIFO channel for handing values from producer threads to consumer
 * threads, with blocking backpressure on both ends.
 *
 * <p>
 * {@link #write} blocks while the channel is full and {@link #read} blocks while it is empty. All
 * operations on one channel are totally ordered, so values are read back in exactly the order in
 * which they were written, across all threads. When several threads are blocked on the same end of
 * the channel, which one is woken first is unspecified.
 *
 * <p>
 * A channel has no close or shutdown step. A thread blocked on a channel which no other thread
 * will ever write to (or read from) stays blocked forever. Blocking operations can be neither
 * interrupted nor timed out; use {@link #tryWrite} and {@link #poll} to avoid waiting.
 *
 * <p>
 * Null values may be written and read like any other value; only {@link #poll} cannot report
 * them.
 *
 * @param <T> the type of values passed through this channel
 */
public interface BoundedChannel<T> {

  /**
   * Appends a value to the back of this channel, blocking while the channel is full. Once the value
   * is appended, one thread waiting in {@link #read} is woken.
   *
   * @param value the value to write, possibly null
   */
  void write(T value);

  /**
   * Removes and returns the value at the front of this channel, blocking while the channel is
   * empty. Once the value is removed, one thread waiting in {@link #write} is woken.
   *
   * @return the oldest value in this channel
   */
  T read();

  /**
   * Appends a value to the back of this channel if there is space for it, without blocking.
   *
   * @param value the value to write, possibly null
   * @return true if the value was appended, false if the channel was full
   */
  boolean tryWrite(T value);

  /**
   * Removes and returns the value at the front of this channel if one is present, without
   * blocking. This method <b>should not</b> be used on a channel that may hold null values; a null
   * at the front is left in place and reported as an exception, and must be taken with
   * {@link #read}.
   *
   * @throws NullPointerException if the value at the front of the channel is null
   * @return An {@link Optional} holding the oldest value, or an empty Optional if the channel was
   *         empty
   */
  Optional<T> poll();

  /**
   * @return the number of values currently buffered, between 0 and {@link #capacity()}
   */
  int size();

  /**
   * @return the maximum number of values this channel can buffer
   */
  int capacity();

  /**
   * Creates a {@link BoundedChannel} which can buffer up to {@code capacity} values.
   *
   * @param capacity the maximum number of buffered values
   * @param <T> the type of values passed through the channel
   * @return a new, empty {@link BoundedChannel}
   * @throws IllegalArgumentException if {@code capacity} is less than 1
   */
  static <T> BoundedChannel<T> create(final int capacity) {
    return new LockingBoundedChannel<>(capacity);
  }
}
