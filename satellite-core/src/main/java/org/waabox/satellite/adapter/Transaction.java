package org.waabox.satellite.adapter;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * An open transaction handed to a {@link TransactionBody}.
 *
 * <p>Operations are executed in the order they are issued, on the lock
 * already held by the transaction. Results are delivered through callbacks.
 * A failing operation rolls the whole transaction back: its error callback
 * is invoked, and any operation issued afterwards is rejected with an
 * {@link IllegalStateException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface Transaction {

  /**
   * Runs a statement that modifies data.
   *
   * @param statement the statement, never null
   * @param onSuccess the success callback, may be null
   * @param onError   the error callback, may be null
   *
   * @throws IllegalStateException if the transaction is no longer open
   */
  void run(Statement statement, TransactionCallback<RunResult> onSuccess,
      Consumer<Throwable> onError);

  /**
   * Runs a query.
   *
   * @param statement the statement, never null
   * @param onSuccess the success callback, never null
   * @param onError   the error callback, may be null
   *
   * @throws IllegalStateException if the transaction is no longer open
   */
  void query(Statement statement,
      TransactionCallback<List<Map<String, Object>>> onSuccess,
      Consumer<Throwable> onError);

  /**
   * Runs a statement, ignoring its result.
   *
   * @param statement the statement, never null
   */
  default void run(final Statement statement) {
    run(statement, null, null);
  }

  /**
   * Runs a statement.
   *
   * @param statement the statement, never null
   * @param onSuccess the success callback, may be null
   */
  default void run(final Statement statement,
      final TransactionCallback<RunResult> onSuccess) {
    run(statement, onSuccess, null);
  }

  /**
   * Runs a query.
   *
   * @param statement the statement, never null
   * @param onSuccess the success callback, never null
   */
  default void query(final Statement statement,
      final TransactionCallback<List<Map<String, Object>>> onSuccess) {
    query(statement, onSuccess, null);
  }
}
