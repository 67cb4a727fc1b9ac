/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: synctools
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package com.ibm.synctools.channel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.ibm.synctools.util.TestUtil;
import org.junit.AfterClass;
import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;

public abstract class AbstractBoundedChannelTest {
  private static ExecutorService pool;

  protected abstract BoundedChannel<Integer> getChannel(int capacity);

  @BeforeClass
  public static void setupPool() {
    pool = Executors.newCachedThreadPool();
  }

  @AfterClass
  public static void shutdownPool() {
    pool.shutdownNow();
  }

  private CompletableFuture<Void> writeAsync(final BoundedChannel<Integer> channel,
      final int value) {
    return CompletableFuture.runAsync(() -> channel.write(value), pool);
  }

  @Test
  public final void testFifo() {
    final BoundedChannel<Integer> channel = getChannel(10);
    for (int i = 0; i < 10; i++) {
      channel.write(i);
    }
    for (int i = 0; i < 10; i++) {
      Assert.assertEquals(i, channel.read().intValue());
    }
    Assert.assertEquals(0, channel.size());
  }

  @Test
  public final void testFifoAcrossWriterThreads() throws TimeoutException {
    final BoundedChannel<Integer> channel = getChannel(8);
    for (int i = 0; i < 8; i++) {
      TestUtil.join(writeAsync(channel, i), 2, TimeUnit.SECONDS);
    }
    final List<Integer> read =
        IntStream.range(0, 8).mapToObj(i -> channel.read()).collect(Collectors.toList());
    Assert.assertEquals(IntStream.range(0, 8).boxed().collect(Collectors.toList()), read);
  }

  @Test
  public final void testWriteBlocksWhileFull() throws TimeoutException {
    final BoundedChannel<Integer> channel = getChannel(2);

    // accepted right away
    channel.write(1);
    channel.write(2);
    Assert.assertEquals(2, channel.size());

    // waiting
    final CompletableFuture<Void> third = writeAsync(channel, 3);
    TestUtil.assertBlocked(third, 100);

    Assert.assertEquals(1, channel.read().intValue());
    TestUtil.join(third, 2, TimeUnit.SECONDS);

    Assert.assertEquals(2, channel.size());
    Assert.assertEquals(2, channel.read().intValue());
    Assert.assertEquals(3, channel.read().intValue());
  }

  @Test
  public final void testReadBlocksWhileEmpty() throws TimeoutException {
    final BoundedChannel<Integer> channel = getChannel(1);

    final CompletableFuture<Integer> read = CompletableFuture.supplyAsync(channel::read, pool);
    TestUtil.assertBlocked(read, 100);

    channel.write(7);
    Assert.assertEquals(7, TestUtil.join(read, 2, TimeUnit.SECONDS).intValue());
    Assert.assertEquals(0, channel.size());
  }

  @Test
  public final void testBlockedReadIgnoresInterrupt() throws Exception {
    final BoundedChannel<Integer> channel = getChannel(1);
    final CompletableFuture<Integer> read = new CompletableFuture<>();
    final AtomicBoolean stillInterrupted = new AtomicBoolean();
    final Thread reader = new Thread(() -> {
      final Integer value = channel.read();
      stillInterrupted.set(Thread.currentThread().isInterrupted());
      read.complete(value);
    });
    reader.start();

    TestUtil.assertBlocked(read, 50);
    reader.interrupt();
    TestUtil.assertBlocked(read, 50);

    channel.write(5);
    Assert.assertEquals(5, TestUtil.join(read, 2, TimeUnit.SECONDS).intValue());
    Assert.assertTrue("interrupt status lost", stillInterrupted.get());
    reader.join(2000);
  }

  @Test
  public final void testEveryBlockedWriterCompletes() throws TimeoutException {
    final BoundedChannel<Integer> channel = getChannel(1);
    channel.write(0);

    final List<CompletableFuture<Void>> writers = new ArrayList<>();
    for (int i = 1; i <= 3; i++) {
      writers.add(writeAsync(channel, i));
    }
    writers.forEach(w -> TestUtil.assertBlocked(w, 20));

    final BitSet seen = new BitSet();
    for (int i = 0; i <= 3; i++) {
      seen.set(channel.read());
    }
    TestUtil.join(CompletableFuture.allOf(writers.toArray(new CompletableFuture[0])), 2,
        TimeUnit.SECONDS);
    Assert.assertEquals(4, seen.cardinality());
    Assert.assertEquals(0, channel.size());
  }

  @Test
  public final void testTryWriteAndPoll() {
    final BoundedChannel<Integer> channel = getChannel(1);
    Assert.assertEquals(Optional.empty(), channel.poll());

    Assert.assertTrue(channel.tryWrite(1));
    Assert.assertFalse(channel.tryWrite(2));
    Assert.assertEquals(1, channel.size());

    Assert.assertEquals(Optional.of(1), channel.poll());
    Assert.assertEquals(Optional.empty(), channel.poll());
    Assert.assertEquals(0, channel.size());
  }

  @Test
  public final void testPollReleasesBlockedWriter() throws TimeoutException {
    final BoundedChannel<Integer> channel = getChannel(1);
    channel.write(1);
    final CompletableFuture<Void> second = writeAsync(channel, 2);
    TestUtil.assertBlocked(second, 50);

    Assert.assertEquals(Optional.of(1), channel.poll());
    TestUtil.join(second, 2, TimeUnit.SECONDS);
    Assert.assertEquals(2, channel.read().intValue());
  }

  @Test
  public final void testCapacity() {
    Assert.assertEquals(3, getChannel(3).capacity());
  }

  @Test(expected = IllegalArgumentException.class)
  public final void testZeroCapacityRejected() {
    getChannel(0);
  }

  @Test
  public final void testSizeWithinBounds() throws TimeoutException {
    final int capacity = 4;
    final BoundedChannel<Integer> channel = getChannel(capacity);
    final AtomicBoolean running = new AtomicBoolean(true);

    final CompletableFuture<Void> producer = CompletableFuture.runAsync(() -> {
      for (int i = 0; i < 20_000; i++) {
        channel.write(i);
      }
    }, pool);
    final CompletableFuture<Void> consumer = CompletableFuture.runAsync(() -> {
      for (int i = 0; i < 20_000; i++) {
        channel.read();
      }
    }, pool);
    final CompletableFuture<Void> sampler = CompletableFuture.runAsync(() -> {
      while (running.get()) {
        final int size = channel.size();
        if (size < 0 || size > capacity) {
          throw new AssertionError("size out of bounds: " + size);
        }
      }
    }, pool);

    try {
      TestUtil.join(CompletableFuture.allOf(producer, consumer), 10, TimeUnit.SECONDS);
    } finally {
      running.set(false);
    }
    TestUtil.join(sampler, 2, TimeUnit.SECONDS);
  }

  @Test
  public final void testProducerConsumerStress() throws TimeoutException {
    final int producers = 4;
    final int perProducer = 10_000;
    final int consumers = 2;
    final BoundedChannel<Integer> channel = getChannel(16);

    final List<CompletableFuture<Void>> writes = IntStream.range(0, producers)
        .mapToObj(p -> CompletableFuture.runAsync(() -> {
          for (int i = 0; i < perProducer; i++) {
            channel.write(p * perProducer + i);
          }
        }, pool))
        .collect(Collectors.toList());

    // each consumer checks that every producer's values arrive in the order they were written
    final List<CompletableFuture<List<Integer>>> reads = IntStream.range(0, consumers)
        .mapToObj(c -> CompletableFuture.supplyAsync(() -> {
          final int[] last = new int[producers];
          Arrays.fill(last, -1);
          final List<Integer> values = new ArrayList<>();
          for (int i = 0; i < producers * perProducer / consumers; i++) {
            final int value = channel.read();
            final int p = value / perProducer;
            if (value <= last[p]) {
              throw new AssertionError("out of order value " + value + " after " + last[p]);
            }
            last[p] = value;
            values.add(value);
          }
          return values;
        }, pool))
        .collect(Collectors.toList());

    TestUtil.join(CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])), 20,
        TimeUnit.SECONDS);
    final BitSet seen = new BitSet(producers * perProducer);
    int total = 0;
    for (final CompletableFuture<List<Integer>> read : reads) {
      for (final int value : TestUtil.join(read, 20, TimeUnit.SECONDS)) {
        Assert.assertFalse("duplicate value " + value, seen.get(value));
        seen.set(value);
        total++;
      }
    }
    Assert.assertEquals(producers * perProducer, total);
    Assert.assertEquals(producers * perProducer, seen.cardinality());
    Assert.assertEquals(0, channel.size());
  }
}
