package org.waabox.satellite.adapter;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * A {@link DatabaseAdapter} over a driver that executes batches natively.
 *
 * <p>{@link #runInTransaction(Statement...)} is a single
 * {@link BatchStorageDriver#execBatch(List)} call under the lock.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BatchDatabaseAdapter extends AbstractDatabaseAdapter {

  /** The batch-capable driver, never null. */
  private final BatchStorageDriver batchDriver;

  /**
   * Creates an adapter that calls the driver on the caller's thread.
   *
   * @param theDriver the driver, never null
   */
  public BatchDatabaseAdapter(final BatchStorageDriver theDriver) {
    this(theDriver, Runnable::run);
  }

  /**
   * Creates an adapter.
   *
   * @param theDriver   the driver, never null
   * @param theExecutor runs the driver calls, never null
   */
  public BatchDatabaseAdapter(final BatchStorageDriver theDriver,
      final Executor theExecutor) {
    super(theDriver, theExecutor);
    batchDriver = theDriver;
  }

  /** {@inheritDoc} */
  @Override
  protected RunResult executeInTransaction(final List<Statement> statements) {
    return batchDriver.execBatch(statements);
  }
}
