package org.waabox.satellite.adapter;

/**
 * Receives the result of an operation issued inside a transaction.
 *
 * <p>The transaction is passed back so further operations can be chained
 * from the callback.
 *
 * @param <R> the result type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface TransactionCallback<R> {

  /**
   * Called when the operation succeeded.
   *
   * @param tx     the transaction, never null
   * @param result the operation result
   */
  void onSuccess(Transaction tx, R result);
}
