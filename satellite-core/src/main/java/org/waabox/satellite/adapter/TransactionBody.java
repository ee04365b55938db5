package org.waabox.satellite.adapter;

import java.util.function.Consumer;

/**
 * The work performed inside {@link DatabaseAdapter#transaction}.
 *
 * <p>The body issues operations through the transaction and commits by
 * handing the final value to {@code setResult}. A body that never calls
 * {@code setResult} and never fails keeps the transaction, and the adapter
 * lock, open.
 *
 * @param <T> the type of the transaction result
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface TransactionBody<T> {

  /**
   * Runs the body.
   *
   * @param tx        the open transaction, never null
   * @param setResult commits the transaction with the given result, never
   *                  null
   */
  void execute(Transaction tx, Consumer<T> setResult);
}
