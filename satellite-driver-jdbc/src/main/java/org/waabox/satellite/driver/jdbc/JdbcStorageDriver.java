package org.waabox.satellite.driver.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.satellite.SatelliteException;
import org.waabox.satellite.adapter.BatchStorageDriver;
import org.waabox.satellite.adapter.RunResult;
import org.waabox.satellite.adapter.Statement;

/**
 * A {@link BatchStorageDriver} over a single JDBC {@link Connection}.
 *
 * <p>The connection is taken from the configured data source when the
 * driver is created and kept until {@link #close()}. Transaction control
 * statements are not sent to the database as SQL: {@code BEGIN} turns
 * auto-commit off, {@code COMMIT} and {@code ROLLBACK} end the JDBC
 * transaction and turn auto-commit back on.
 *
 * <p>Every {@link SQLException} is reported as a {@link SatelliteException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcStorageDriver implements BatchStorageDriver,
    AutoCloseable {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(JdbcStorageDriver.class);

  /** The statements that open a transaction. */
  private static final Set<String> BEGIN =
      Set.of("BEGIN", "BEGIN TRANSACTION", "START TRANSACTION");

  /** The statements that commit a transaction. */
  private static final Set<String> COMMIT = Set.of("COMMIT", "END");

  /** The statement that rolls a transaction back. */
  private static final String ROLLBACK = "ROLLBACK";

  /** The configuration, never null. */
  private final JdbcDriverConfig config;

  /** The connection, never null. */
  private final Connection connection;

  /** The update count of the last statement. */
  private long rowsModified;

  /**
   * Creates a driver and opens its connection.
   *
   * @param theConfig the configuration, never null
   *
   * @throws SatelliteException if the connection cannot be opened
   */
  public JdbcStorageDriver(final JdbcDriverConfig theConfig) {
    config = Objects.requireNonNull(theConfig, "config cannot be null");
    try {
      connection = config.dataSource().getConnection();
      connection.setAutoCommit(true);
    } catch (final SQLException e) {
      throw new SatelliteException("Failed to open JDBC connection", e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public synchronized List<Map<String, Object>> exec(
      final Statement statement) {
    Objects.requireNonNull(statement, "statement cannot be null");
    final String control = normalize(statement.sql());
    try {
      if (BEGIN.contains(control)) {
        connection.setAutoCommit(false);
        rowsModified = 0;
        return List.of();
      }
      if (COMMIT.contains(control)) {
        connection.commit();
        connection.setAutoCommit(true);
        rowsModified = 0;
        return List.of();
      }
      if (ROLLBACK.equals(control)) {
        try {
          connection.rollback();
        } finally {
          connection.setAutoCommit(true);
          rowsModified = 0;
        }
        return List.of();
      }
      return execute(statement);
    } catch (final SQLException e) {
      throw new SatelliteException(
          "Failed to execute '" + statement.sql() + "'", e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public synchronized long rowsModified() {
    return rowsModified;
  }

  /**
   * {@inheritDoc}
   *
   * <p>Runs in its own JDBC transaction, rolled back on the first failure.
   *
   * @throws IllegalStateException if a transaction opened with
   *                               {@code BEGIN} is still running
   */
  @Override
  public synchronized RunResult execBatch(final List<Statement> statements) {
    Objects.requireNonNull(statements, "statements cannot be null");
    try {
      if (!connection.getAutoCommit()) {
        throw new IllegalStateException(
            "Cannot execute a batch inside an open transaction");
      }
      connection.setAutoCommit(false);
    } catch (final SQLException e) {
      throw new SatelliteException("Failed to open JDBC transaction", e);
    }

    long total = 0;
    try {
      for (final Statement statement : statements) {
        execute(statement);
        total += rowsModified;
      }
      connection.commit();
      log.debug("Batch of {} statements committed, {} rows modified",
          statements.size(), total);
      return new RunResult(total);
    } catch (final SQLException e) {
      rollbackQuietly(e);
      throw new SatelliteException("Failed to execute batch", e);
    } catch (final RuntimeException e) {
      rollbackQuietly(e);
      throw e;
    } finally {
      try {
        connection.setAutoCommit(true);
      } catch (final SQLException e) {
        log.error("Failed to restore auto-commit", e);
      }
    }
  }

  /**
   * Returns whether a transaction opened with {@code BEGIN} is running.
   *
   * @return true inside a transaction
   */
  public synchronized boolean inTransaction() {
    try {
      return !connection.getAutoCommit();
    } catch (final SQLException e) {
      throw new SatelliteException("Failed to read auto-commit mode", e);
    }
  }

  /** Closes the connection. */
  @Override
  public synchronized void close() {
    try {
      connection.close();
    } catch (final SQLException e) {
      throw new SatelliteException("Failed to close JDBC connection", e);
    }
  }

  /**
   * Executes a data statement and records its update count.
   *
   * @param statement the statement, never null
   *
   * @return the rows read, empty when the statement returns none
   *
   * @throws SQLException on database errors
   */
  private List<Map<String, Object>> execute(final Statement statement)
      throws SQLException {
    try (PreparedStatement ps = connection.prepareStatement(statement.sql())) {
      final long timeout = config.queryTimeout().getSeconds();
      if (timeout > 0) {
        ps.setQueryTimeout((int) Math.min(timeout, Integer.MAX_VALUE));
      }
      final List<Object> args = statement.args();
      for (int i = 0; i < args.size(); i++) {
        ps.setObject(i + 1, args.get(i));
      }
      if (ps.execute()) {
        rowsModified = 0;
        try (ResultSet rs = ps.getResultSet()) {
          return readRows(rs);
        }
      }
      rowsModified = Math.max(0, ps.getUpdateCount());
      return List.of();
    }
  }

  /**
   * Reads every row of a result set, keyed by column label.
   *
   * @param rs the result set, never null
   *
   * @return the rows, never null
   *
   * @throws SQLException on database errors
   */
  private static List<Map<String, Object>> readRows(final ResultSet rs)
      throws SQLException {
    final ResultSetMetaData meta = rs.getMetaData();
    final int columns = meta.getColumnCount();
    final List<Map<String, Object>> rows = new ArrayList<>();
    while (rs.next()) {
      final Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 1; i <= columns; i++) {
        row.put(meta.getColumnLabel(i), rs.getObject(i));
      }
      rows.add(row);
    }
    return rows;
  }

  /**
   * Rolls back after a failed batch, keeping the original failure.
   *
   * @param cause the failure, never null
   */
  private void rollbackQuietly(final Exception cause) {
    try {
      connection.rollback();
    } catch (final SQLException e) {
      log.error("Rollback failed after batch error", e);
      cause.addSuppressed(e);
    }
  }

  /**
   * Normalizes a statement for transaction control detection.
   *
   * @param sql the SQL text, never null
   *
   * @return the trimmed, upper case text without trailing semicolon
   */
  private static String normalize(final String sql) {
    String text = sql.trim();
    if (text.endsWith(";")) {
      text = text.substring(0, text.length() - 1).trim();
    }
    return text.toUpperCase(Locale.ROOT);
  }
}
