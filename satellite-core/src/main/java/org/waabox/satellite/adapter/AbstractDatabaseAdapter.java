package org.waabox.satellite.adapter;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base {@link DatabaseAdapter} that serializes every operation through one
 * {@link TransactionMutex}.
 *
 * <p>Driver calls are blocking; they are submitted to the configured
 * {@link Executor}. Subclasses only decide how
 * {@link #runInTransaction(Statement...)} reaches the driver.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public abstract class AbstractDatabaseAdapter implements DatabaseAdapter {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(AbstractDatabaseAdapter.class);

  /** Opens a transaction. */
  public static final Statement BEGIN = Statement.of("BEGIN");

  /** Commits a transaction. */
  public static final Statement COMMIT = Statement.of("COMMIT");

  /** Rolls a transaction back. */
  public static final Statement ROLLBACK = Statement.of("ROLLBACK");

  /** The lock shared by every operation of this adapter. */
  private final TransactionMutex mutex = new TransactionMutex();

  /** The operations handed to grouped work, they skip the lock. */
  private final UncoordinatedDatabaseAdapter uncoordinated =
      new Uncoordinated();

  /** The driver, never null. */
  private final StorageDriver driver;

  /** Runs the blocking driver calls, never null. */
  private final Executor executor;

  /**
   * Creates a new adapter.
   *
   * @param theDriver   the storage driver, never null
   * @param theExecutor runs the driver calls, never null
   */
  protected AbstractDatabaseAdapter(final StorageDriver theDriver,
      final Executor theExecutor) {
    driver = Objects.requireNonNull(theDriver, "driver must not be null");
    executor = Objects.requireNonNull(theExecutor,
        "executor must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<RunResult> run(final Statement statement) {
    Objects.requireNonNull(statement, "statement must not be null");
    return mutex.runExclusive(() -> doRun(statement));
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<List<Map<String, Object>>> query(
      final Statement statement) {
    Objects.requireNonNull(statement, "statement must not be null");
    return mutex.runExclusive(() -> doQuery(statement));
  }

  /** {@inheritDoc} */
  @Override
  public <T> CompletableFuture<T> transaction(final TransactionBody<T> body) {
    Objects.requireNonNull(body, "body must not be null");
    return mutex.runExclusive(() -> doTransaction(body));
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<RunResult> runInTransaction(
      final Statement... statements) {
    final List<Statement> list = copyOf(statements);
    return mutex.runExclusive(() -> doRunInTransaction(list));
  }

  /** {@inheritDoc} */
  @Override
  public CompletableFuture<Void> group(
      final Function<UncoordinatedDatabaseAdapter,
          CompletableFuture<Void>> body) {
    Objects.requireNonNull(body, "body must not be null");
    return mutex.runExclusive(() -> body.apply(uncoordinated));
  }

  /** {@inheritDoc} */
  @Override
  public boolean isLocked() {
    return mutex.isLocked();
  }

  /**
   * Returns the storage driver.
   *
   * @return the driver, never null
   */
  protected StorageDriver driver() {
    return driver;
  }

  /**
   * Runs the statements atomically; the lock is already held.
   *
   * <p>Invoked on the adapter executor.
   *
   * @param statements the statements, never null
   *
   * @return the number of modified rows, never null
   */
  protected abstract RunResult executeInTransaction(
      List<Statement> statements);

  /**
   * Executes a statement on the executor, without taking the lock.
   *
   * @param statement the statement, never null
   *
   * @return the modified rows as reported by the driver, never null
   */
  CompletableFuture<RunResult> doRun(final Statement statement) {
    return CompletableFuture.supplyAsync(() -> {
      log.debug("Running {}", statement.sql());
      driver.exec(statement);
      return new RunResult(driver.rowsModified());
    }, executor);
  }

  /**
   * Executes a query on the executor, without taking the lock.
   *
   * @param statement the statement, never null
   *
   * @return the rows, never null
   */
  CompletableFuture<List<Map<String, Object>>> doQuery(
      final Statement statement) {
    return CompletableFuture.supplyAsync(() -> {
      log.debug("Querying {}", statement.sql());
      return driver.exec(statement);
    }, executor);
  }

  /**
   * Opens a transaction and hands it to the body, without taking the lock.
   *
   * @param <T>  the result type
   * @param body the body, never null
   *
   * @return the committed result, never null
   */
  private <T> CompletableFuture<T> doTransaction(
      final TransactionBody<T> body) {
    return doRun(BEGIN).thenCompose(ignored -> {
      final DefaultTransaction<T> tx = new DefaultTransaction<>(this);
      try {
        body.execute(tx, tx::setResult);
      } catch (final RuntimeException e) {
        log.debug("Transaction body failed", e);
        tx.fail(e);
      }
      return tx.outcome();
    });
  }

  /**
   * Runs the statements atomically on the executor, without taking the
   * lock.
   *
   * @param statements the statements, never null
   *
   * @return the number of modified rows, never null
   */
  private CompletableFuture<RunResult> doRunInTransaction(
      final List<Statement> statements) {
    return CompletableFuture.supplyAsync(
        () -> executeInTransaction(statements), executor);
  }

  /**
   * Validates and copies a statement array.
   *
   * @param statements the statements, never null
   *
   * @return an immutable list, never null
   */
  private static List<Statement> copyOf(final Statement... statements) {
    Objects.requireNonNull(statements, "statements must not be null");
    return List.copyOf(Arrays.asList(statements));
  }

  /** The lock-free view handed to {@link #group}. */
  private final class Uncoordinated implements UncoordinatedDatabaseAdapter {

    /** {@inheritDoc} */
    @Override
    public CompletableFuture<RunResult> run(final Statement statement) {
      Objects.requireNonNull(statement, "statement must not be null");
      return doRun(statement);
    }

    /** {@inheritDoc} */
    @Override
    public CompletableFuture<List<Map<String, Object>>> query(
        final Statement statement) {
      Objects.requireNonNull(statement, "statement must not be null");
      return doQuery(statement);
    }

    /** {@inheritDoc} */
    @Override
    public <T> CompletableFuture<T> transaction(
        final TransactionBody<T> body) {
      Objects.requireNonNull(body, "body must not be null");
      return doTransaction(body);
    }

    /** {@inheritDoc} */
    @Override
    public CompletableFuture<RunResult> runInTransaction(
        final Statement... statements) {
      return doRunInTransaction(copyOf(statements));
    }

    /** {@inheritDoc} */
    @Override
    public CompletableFuture<Void> group(
        final Function<UncoordinatedDatabaseAdapter,
            CompletableFuture<Void>> body) {
      Objects.requireNonNull(body, "body must not be null");
      final CompletableFuture<Void> result = body.apply(this);
      return result != null ? result : CompletableFuture.completedFuture(null);
    }
  }
}
