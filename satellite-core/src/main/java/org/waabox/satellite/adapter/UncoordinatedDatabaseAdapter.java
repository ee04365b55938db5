package org.waabox.satellite.adapter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Database operations that bypass the adapter lock.
 *
 * <p>Handed to the body of {@link DatabaseAdapter#group}, which already holds
 * the lock for its whole duration. Must not be used outside that body.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface UncoordinatedDatabaseAdapter {

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
   * @param <T>  the result type
   * @param body the transaction body, never null
   *
   * @return the committed result, never null
   *
   * @see DatabaseAdapter#transaction(TransactionBody)
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
   * Runs nested grouped work. The enclosing group already holds the lock,
   * so the body simply runs with this same view.
   *
   * @param body the grouped work, never null
   *
   * @return a future completed when the body's future completes, never null
   */
  CompletableFuture<Void> group(
      Function<UncoordinatedDatabaseAdapter, CompletableFuture<Void>> body);
}
