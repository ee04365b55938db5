package org.waabox.satellite.adapter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Serialized access to the local database.
 *
 * <p>Every operation takes a single lock, so that a query never runs in the
 * middle of someone else's transaction. Callers queue on the lock in
 * arrival order. All operations are asynchronous: the returned future
 * completes once the operation finished and the lock was released.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface DatabaseAdapter {

  /**
   * Runs a statement that modifies data.
   *
   * @param statement the statement, never null
   *
   * @return the number of modified rows, never null
   */
  CompletableFuture<RunResult> run(Statement statement);

  /**
   * Runs a query.
   *
   * @param statement the statement, never null
   *
   * @return the rows read, never null
   */
  CompletableFuture<List<Map<String, Object>>> query(Statement statement);

  /**
   * Runs a callback-style transaction.
   *
   * <p>{@code BEGIN} is issued before {@code body} is invoked. The
   * transaction commits when the body calls {@code setResult}, after every
   * operation issued before it, and the future completes with that value.
   * If an operation fails or the body throws, the transaction is rolled
   * back and the future completes exceptionally with that error, even when
   * the rollback itself fails.
   *
   * @param <T>  the result type
   * @param body the transaction body, never null
   *
   * @return the committed result, never null
   */
  <T> CompletableFuture<T> transaction(TransactionBody<T> body);

  /**
   * Runs the statements atomically.
   *
   * @param statements the statements, never null
   *
   * @return the number of modified rows, never null
   */
  CompletableFuture<RunResult> runInTransaction(Statement... statements);

  /**
   * Runs several operations back to back without other callers interleaving,
   * without wrapping them in a SQL transaction.
   *
   * <p>The lock is held until the future returned by {@code body}
   * completes.
   *
   * @param body the grouped work, never null
   *
   * @return a future completed when the body's future completes, never null
   */
  CompletableFuture<Void> group(
      Function<UncoordinatedDatabaseAdapter, CompletableFuture<Void>> body);

  /**
   * Returns whether an operation currently holds the lock.
   *
   * @return true if locked
   */
  boolean isLocked();
}
