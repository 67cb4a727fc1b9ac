/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: synctools
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.synctools.channel;

import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A {@link BoundedChannel} backed by a circular array, guarded by a single {@link ReentrantLock}
 * with one {@link Condition} per direction. Null values are carried like any other value.
 *
 * @param <T> the type of values passed through this channel
 */
public class LockingBoundedChannel<T> implements BoundedChannel<T> {
  /*
   * Every access to the buffer happens under `lock`, which is what gives the channel a single total
   * order of writes and reads. Writers wait on `canWrite` while the buffer is full and readers wait
   * on `canRead` while it is empty. A successful write signals one reader; a successful read
   * signals one writer. Waiters re-check their predicate after every wakeup, since a signalled
   * thread can lose the race for the freed slot (or value) to a thread that never waited.
   */

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition canRead = this.lock.newCondition();
  private final Condition canWrite = this.lock.newCondition();
  // circular buffer: `count` values starting at `head`
  private final Object[] items;
  private int head;
  private int count;

  /**
   * @param capacity the maximum number of buffered values
   * @throws IllegalArgumentException if {@code capacity} is less than 1
   */
  public LockingBoundedChannel(final int capacity) {
    if (capacity < 1) {
      // a zero-capacity channel could never accept a write
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.items = new Object[capacity];
  }

  @Override
  public void write(final T value) {
    this.lock.lock();
    try {
      while (isFull()) {
        this.canWrite.awaitUninterruptibly();
      }
      enqueue(value);
    } finally {
      this.lock.unlock();
    }
  }

  @Override
  public T read() {
    this.lock.lock();
    try {
      while (this.count == 0) {
        this.canRead.awaitUninterruptibly();
      }
      return dequeue();
    } finally {
      this.lock.unlock();
    }
  }

  @Override
  public boolean tryWrite(final T value) {
    this.lock.lock();
    try {
      if (isFull()) {
        return false;
      }
      enqueue(value);
      return true;
    } finally {
      this.lock.unlock();
    }
  }

  @Override
  public Optional<T> poll() {
    this.lock.lock();
    try {
      if (this.count == 0) {
        return Optional.empty();
      }
      if (this.items[this.head] == null) {
        // left in place so that read() can still take it
        throw new NullPointerException("head of channel is null");
      }
      return Optional.of(dequeue());
    } finally {
      this.lock.unlock();
    }
  }

  @Override
  public int size() {
    this.lock.lock();
    try {
      return this.count;
    } finally {
      this.lock.unlock();
    }
  }

  @Override
  public int capacity() {
    return this.items.length;
  }

  // the following require holding `lock`

  private boolean isFull() {
    return this.count == this.items.length;
  }

  private void enqueue(final T value) {
    this.items[(this.head + this.count) % this.items.length] = value;
    this.count++;
    this.canRead.signal();
  }

  @SuppressWarnings("unchecked")
  private T dequeue() {
    final T value = (T) this.items[this.head];
    this.items[this.head] = null;
    this.head = (this.head + 1) % this.items.length;
    this.count--;
    this.canWrite.signal();
    return value;
  }

  @Override
  public String toString() {
    return "LockingBoundedChannel[size=" + size() + ", capacity=" + this.items.length + "]";
  }
}
