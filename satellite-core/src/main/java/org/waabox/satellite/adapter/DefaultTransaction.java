package org.waabox.satellite.adapter;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@link Transaction} handed out by {@link AbstractDatabaseAdapter}.
 *
 * <p>The transaction is an explicit state machine:
 * <pre>
 * OPEN --setResult--&gt; COMMITTING --COMMIT ok--&gt; COMMITTED
 *   |                     |
 *   +--- failure ---------+----------------------&gt; ROLLED_BACK
 * </pre>
 * Operations are appended to a single chain so that they run in issue
 * order; an operation reached after the transaction left {@code OPEN} or
 * {@code COMMITTING} is skipped.
 *
 * @param <T> the type of the transaction result
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class DefaultTransaction<T> implements Transaction {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(DefaultTransaction.class);

  /** The states of a transaction. */
  enum State {
    /** Accepting operations. */
    OPEN,
    /** {@code setResult} was called, waiting for the commit. */
    COMMITTING,
    /** Committed. */
    COMMITTED,
    /** Rolled back after a failure. */
    ROLLED_BACK
  }

  /** The adapter executing the statements, already holding the lock. */
  private final AbstractDatabaseAdapter adapter;

  /** The outcome of the whole transaction. */
  private final CompletableFuture<T> outcome = new CompletableFuture<>();

  /** The current state, guarded by this. */
  private State state = State.OPEN;

  /** The last link of the operation chain, never completes exceptionally. */
  private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

  /**
   * Creates a transaction; {@code BEGIN} must already have been executed.
   *
   * @param theAdapter the adapter, never null
   */
  DefaultTransaction(final AbstractDatabaseAdapter theAdapter) {
    adapter = Objects.requireNonNull(theAdapter, "adapter cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public void run(final Statement statement,
      final TransactionCallback<RunResult> onSuccess,
      final Consumer<Throwable> onError) {
    Objects.requireNonNull(statement, "statement cannot be null");
    enqueue(statement, () -> adapter.doRun(statement), onSuccess, onError);
  }

  /** {@inheritDoc} */
  @Override
  public void query(final Statement statement,
      final TransactionCallback<List<Map<String, Object>>> onSuccess,
      final Consumer<Throwable> onError) {
    Objects.requireNonNull(statement, "statement cannot be null");
    Objects.requireNonNull(onSuccess, "onSuccess cannot be null");
    enqueue(statement, () -> adapter.doQuery(statement), onSuccess, onError);
  }

  /**
   * Commits the transaction with the given result once every operation
   * issued so far has completed.
   *
   * @param result the transaction result
   *
   * @throws IllegalStateException if the transaction is not open
   */
  void setResult(final T result) {
    final CompletableFuture<Void> previous;
    final CompletableFuture<Void> next = new CompletableFuture<>();
    synchronized (this) {
      requireOpen("setResult");
      state = State.COMMITTING;
      previous = tail;
      tail = next;
    }
    chain(previous, next, () -> commit(result));
  }

  /**
   * Rolls the transaction back and fails it with the given error.
   *
   * <p>Only the first failure counts; later ones are logged.
   *
   * @param error the failure, never null
   */
  void fail(final Throwable error) {
    final CompletableFuture<Void> previous;
    final CompletableFuture<Void> next = new CompletableFuture<>();
    synchronized (this) {
      if (state == State.ROLLED_BACK || state == State.COMMITTED) {
        log.debug("Ignoring failure of a {} transaction", state, error);
        return;
      }
      state = State.ROLLED_BACK;
      previous = tail;
      tail = next;
    }
    chain(previous, next, () -> rollback(error));
  }

  /**
   * Returns the outcome of the transaction.
   *
   * @return the future completed after the commit or the rollback, never
   *         null
   */
  CompletableFuture<T> outcome() {
    return outcome;
  }

  /**
   * Returns the current state.
   *
   * @return the state, never null
   */
  synchronized State state() {
    return state;
  }

  /**
   * Appends an operation to the chain.
   *
   * @param <R>       the operation result type
   * @param statement the statement, for logging
   * @param operation starts the operation, never null
   * @param onSuccess the success callback, may be null
   * @param onError   the error callback, may be null
   */
  private <R> void enqueue(final Statement statement,
      final Supplier<CompletableFuture<R>> operation,
      final TransactionCallback<R> onSuccess,
      final Consumer<Throwable> onError) {
    final CompletableFuture<Void> previous;
    final CompletableFuture<Void> next = new CompletableFuture<>();
    synchronized (this) {
      requireOpen("issue '" + statement.sql() + "'");
      previous = tail;
      tail = next;
    }
    chain(previous, next, () -> {
      if (!isLive()) {
        return CompletableFuture.completedFuture(null);
      }
      return operation.get().handle((result, error) -> {
        if (error != null) {
          operationFailed(Futures.unwrap(error), onError);
        } else if (onSuccess != null) {
          try {
            onSuccess.onSuccess(this, result);
          } catch (final RuntimeException e) {
            fail(e);
          }
        }
        return null;
      });
    });
  }

  /**
   * Runs a step once the previous link of the chain completed, then
   * completes the next link.
   *
   * <p>Links are created under the lock but steps run outside of it, so a
   * callback may issue further operations; those are appended after the
   * link of the step that issued them.
   *
   * @param previous the link to wait for, never null
   * @param next     the link to complete afterwards, never null
   * @param step     the step, never null
   */
  private void chain(final CompletableFuture<Void> previous,
      final CompletableFuture<Void> next,
      final Supplier<CompletableFuture<Void>> step) {
    previous.thenCompose(ignored -> step.get())
        .whenComplete((ignored, error) -> {
          if (error != null) {
            final Throwable cause = Futures.unwrap(error);
            log.error("Unexpected failure in transaction step", cause);
            fail(cause);
          }
          next.complete(null);
        });
  }

  /**
   * Handles a failed operation: rolls back, then notifies the caller.
   *
   * @param error   the failure, never null
   * @param onError the error callback, may be null
   */
  private void operationFailed(final Throwable error,
      final Consumer<Throwable> onError) {
    fail(error);
    if (onError != null) {
      try {
        onError.accept(error);
      } catch (final RuntimeException e) {
        log.warn("Transaction error callback failed", e);
      }
    }
  }

  /**
   * Issues {@code COMMIT} unless a failure rolled the transaction back in
   * the meantime.
   *
   * @param result the transaction result
   *
   * @return a future completed once the outcome is settled, never null
   */
  private CompletableFuture<Void> commit(final T result) {
    synchronized (this) {
      if (state != State.COMMITTING) {
        return CompletableFuture.completedFuture(null);
      }
    }
    return adapter.doRun(AbstractDatabaseAdapter.COMMIT)
        .handle((ignored, error) -> {
          if (error != null) {
            fail(Futures.unwrap(error));
          } else {
            synchronized (this) {
              state = State.COMMITTED;
            }
            outcome.complete(result);
          }
          return null;
        });
  }

  /**
   * Issues {@code ROLLBACK} and fails the outcome with the original error.
   *
   * <p>The only place where a failed transaction settles its outcome.
   *
   * @param error the original failure, never null
   *
   * @return a future completed once the outcome is settled, never null
   */
  private CompletableFuture<Void> rollback(final Throwable error) {
    CompletableFuture<RunResult> rollback;
    try {
      rollback = adapter.doRun(AbstractDatabaseAdapter.ROLLBACK);
    } catch (final RuntimeException e) {
      rollback = CompletableFuture.failedFuture(e);
    }
    return rollback
        .handle((ignored, rollbackError) -> {
          if (rollbackError != null) {
            log.error("Rollback failed, reporting the original error",
                Futures.unwrap(rollbackError));
          }
          outcome.completeExceptionally(error);
          return null;
        });
  }

  /**
   * Returns whether queued operations should still execute.
   *
   * @return true when open or committing
   */
  private synchronized boolean isLive() {
    return state == State.OPEN || state == State.COMMITTING;
  }

  /**
   * Ensures the transaction accepts new operations.
   *
   * @param operation the attempted operation, for the error message
   */
  private void requireOpen(final String operation) {
    if (state != State.OPEN) {
      throw new IllegalStateException(
          "Cannot " + operation + " on a " + state + " transaction");
    }
  }
}
