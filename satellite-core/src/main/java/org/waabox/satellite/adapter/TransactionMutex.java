package org.waabox.satellite.adapter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * An asynchronous, first-in first-out mutual exclusion lock.
 *
 * <p>Unlike a {@link java.util.concurrent.locks.ReentrantLock}, the lock is
 * not owned by a thread: it is held for the lifetime of an asynchronous task
 * and released from whichever thread completes that task. Waiters are
 * granted the lock strictly in the order they asked for it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TransactionMutex {

  /** The tasks waiting for the lock, in arrival order. */
  private final Deque<CompletableFuture<Void>> waiters = new ArrayDeque<>();

  /** The waiters granted the lock but not yet resumed, guarded by this. */
  private final Deque<CompletableFuture<Void>> granted = new ArrayDeque<>();

  /** Whether the lock is held, guarded by this. */
  private boolean locked;

  /** Whether a thread is resuming granted waiters, guarded by this. */
  private boolean handingOver;

  /**
   * Runs a task while holding the lock.
   *
   * <p>The lock is taken before {@code task} is invoked and released once
   * the future it returns completes, before the returned future completes.
   * An exception thrown by the task itself completes the returned future
   * exceptionally.
   *
   * @param <T>  the result type
   * @param task the task, never null
   *
   * @return a future with the task's outcome, never null
   */
  public <T> CompletableFuture<T> runExclusive(
      final Supplier<CompletableFuture<T>> task) {
    final CompletableFuture<T> outcome = new CompletableFuture<>();
    acquire().thenRun(() -> {
      CompletableFuture<T> result;
      try {
        result = task.get();
        if (result == null) {
          result = CompletableFuture.completedFuture(null);
        }
      } catch (final RuntimeException e) {
        result = CompletableFuture.failedFuture(e);
      }
      result.whenComplete((value, error) -> {
        release();
        if (error != null) {
          outcome.completeExceptionally(Futures.unwrap(error));
        } else {
          outcome.complete(value);
        }
      });
    });
    return outcome;
  }

  /**
   * Returns whether the lock is currently held.
   *
   * @return true if held
   */
  public synchronized boolean isLocked() {
    return locked;
  }

  /**
   * Takes the lock, or queues for it.
   *
   * @return a future completed once the lock is held, never null
   */
  private synchronized CompletableFuture<Void> acquire() {
    if (!locked) {
      locked = true;
      return CompletableFuture.completedFuture(null);
    }
    final CompletableFuture<Void> waiter = new CompletableFuture<>();
    waiters.addLast(waiter);
    return waiter;
  }

  /**
   * Hands the lock to the next waiter, or frees it.
   *
   * <p>A waiter whose task completes inline releases the lock again from
   * within {@code complete}. Those nested releases only queue the next
   * grant; the outermost call resumes the waiters one at a time, so the
   * stack does not grow with the number of queued tasks.
   */
  private void release() {
    synchronized (this) {
      final CompletableFuture<Void> next = waiters.pollFirst();
      if (next == null) {
        locked = false;
        return;
      }
      granted.addLast(next);
      if (handingOver) {
        return;
      }
      handingOver = true;
    }
    while (true) {
      final CompletableFuture<Void> next;
      synchronized (this) {
        next = granted.pollFirst();
        if (next == null) {
          handingOver = false;
          return;
        }
      }
      next.complete(null);
    }
  }
}
