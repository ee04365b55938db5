package org.waabox.satellite.adapter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link TransactionMutex}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class TransactionMutexTest {

  @Test
  void whenQueued_givenHeldLock_shouldRunInArrivalOrder() throws Exception {
    final TransactionMutex mutex = new TransactionMutex();
    final CompletableFuture<Void> first = new CompletableFuture<>();
    final List<String> order = new ArrayList<>();

    mutex.runExclusive(() -> {
      order.add("first");
      return first;
    });
    final CompletableFuture<String> second = mutex.runExclusive(() -> {
      order.add("second");
      return CompletableFuture.completedFuture("two");
    });
    final CompletableFuture<String> third = mutex.runExclusive(() -> {
      order.add("third");
      return CompletableFuture.completedFuture("three");
    });

    assertTrue(mutex.isLocked());
    assertEquals(List.of("first"), order);

    first.complete(null);

    assertEquals("two", second.get());
    assertEquals("three", third.get());
    assertEquals(List.of("first", "second", "third"), order);
    assertFalse(mutex.isLocked());
  }

  @Test
  void whenTaskFails_givenQueuedTask_shouldReleaseTheLock() throws Exception {
    final TransactionMutex mutex = new TransactionMutex();
    final IllegalStateException failure = new IllegalStateException("boom");

    final CompletableFuture<Void> failed = mutex.runExclusive(
        () -> CompletableFuture.failedFuture(failure));
    final CompletableFuture<String> next = mutex.runExclusive(
        () -> CompletableFuture.completedFuture("next"));

    final ExecutionException error = assertThrows(ExecutionException.class,
        failed::get);
    assertSame(failure, error.getCause());
    assertEquals("next", next.get());
    assertFalse(mutex.isLocked());
  }

  @Test
  void whenTaskThrows_givenNoFuture_shouldFailAndRelease() {
    final TransactionMutex mutex = new TransactionMutex();

    final CompletableFuture<Void> failed = mutex.runExclusive(() -> {
      throw new IllegalArgumentException("sync");
    });

    assertTrue(failed.isCompletedExceptionally());
    assertFalse(mutex.isLocked());
  }

  @Test
  void whenReleased_givenAnotherThread_shouldHandOverTheLock()
      throws Exception {
    final TransactionMutex mutex = new TransactionMutex();
    final ExecutorService pool = Executors.newFixedThreadPool(4);
    final AtomicInteger inside = new AtomicInteger();
    final AtomicInteger maxInside = new AtomicInteger();
    final CountDownLatch done = new CountDownLatch(50);

    try {
      for (int i = 0; i < 50; i++) {
        mutex.runExclusive(() -> CompletableFuture.supplyAsync(() -> {
          maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
          inside.decrementAndGet();
          return null;
        }, pool)).whenComplete((value, error) -> done.countDown());
      }
      assertTrue(done.await(10, TimeUnit.SECONDS));
    } finally {
      pool.shutdownNow();
    }

    assertEquals(1, maxInside.get());
    assertFalse(mutex.isLocked());
  }

  @Test
  void whenReleased_givenThousandsOfInlineWaiters_shouldGrantEveryOne() {
    final TransactionMutex mutex = new TransactionMutex();
    final CompletableFuture<Void> gate = new CompletableFuture<>();
    final AtomicInteger ran = new AtomicInteger();
    final List<CompletableFuture<Integer>> queued = new ArrayList<>();

    mutex.runExclusive(() -> gate);
    for (int i = 0; i < 10_000; i++) {
      queued.add(mutex.runExclusive(
          () -> CompletableFuture.completedFuture(ran.incrementAndGet())));
    }

    gate.complete(null);

    assertEquals(10_000, ran.get());
    for (int i = 0; i < queued.size(); i++) {
      assertEquals(i + 1, queued.get(i).join());
    }
    assertFalse(mutex.isLocked());
  }
}
