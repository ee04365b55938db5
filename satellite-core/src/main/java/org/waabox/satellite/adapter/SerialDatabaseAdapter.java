package org.waabox.satellite.adapter;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link DatabaseAdapter} over a driver that executes one statement at a
 * time.
 *
 * <p>{@link #runInTransaction(Statement...)} issues {@code BEGIN}, every
 * statement, then {@code COMMIT}. The first failure rolls back and is
 * rethrown. Only {@code INSERT}, {@code UPDATE} and {@code DELETE}
 * statements count towards the reported rows.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SerialDatabaseAdapter extends AbstractDatabaseAdapter {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(SerialDatabaseAdapter.class);

  /** Matches the statements whose modified rows are counted. */
  private static final Pattern MODIFYING_STATEMENT = Pattern.compile(
      "^\\s*(INSERT|UPDATE|DELETE)\\b", Pattern.CASE_INSENSITIVE);

  /**
   * Creates an adapter that calls the driver on the caller's thread.
   *
   * @param theDriver the driver, never null
   */
  public SerialDatabaseAdapter(final StorageDriver theDriver) {
    this(theDriver, Runnable::run);
  }

  /**
   * Creates an adapter.
   *
   * @param theDriver   the driver, never null
   * @param theExecutor runs the driver calls, never null
   */
  public SerialDatabaseAdapter(final StorageDriver theDriver,
      final Executor theExecutor) {
    super(theDriver, theExecutor);
  }

  /** {@inheritDoc} */
  @Override
  protected RunResult executeInTransaction(final List<Statement> statements) {
    final StorageDriver driver = driver();
    driver.exec(BEGIN);
    try {
      long rows = 0;
      for (Statement statement : statements) {
        driver.exec(statement);
        if (isModifying(statement)) {
          rows += driver.rowsModified();
        }
      }
      driver.exec(COMMIT);
      return new RunResult(rows);
    } catch (final RuntimeException e) {
      try {
        driver.exec(ROLLBACK);
      } catch (final RuntimeException rollbackError) {
        log.error("Rollback failed, reporting the original error",
            rollbackError);
        e.addSuppressed(rollbackError);
      }
      throw e;
    }
  }

  /**
   * Checks whether the statement modifies rows.
   *
   * @param statement the statement, never null
   *
   * @return true for INSERT, UPDATE and DELETE statements
   */
  static boolean isModifying(final Statement statement) {
    return MODIFYING_STATEMENT.matcher(statement.sql()).find();
  }
}
