package org.waabox.satellite.adapter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.waabox.satellite.SatelliteException;

/**
 * An in-memory {@link BatchStorageDriver} that records every statement it
 * executes and fails on demand.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RecordingStorageDriver implements BatchStorageDriver {

  /** The executed SQL, in order. */
  private final List<String> log = new ArrayList<>();

  /** The SQL that fails when executed. */
  private final Set<String> failing = new HashSet<>();

  /** The rows returned per SQL. */
  private final Map<String, List<Map<String, Object>>> rows = new HashMap<>();

  /** The modified row count per SQL, 1 when absent. */
  private final Map<String, Long> counts = new HashMap<>();

  /** The count of the last data statement. */
  private long rowsModified;

  RecordingStorageDriver failOn(final String sql) {
    failing.add(sql);
    return this;
  }

  RecordingStorageDriver returning(final String sql,
      final List<Map<String, Object>> result) {
    rows.put(sql, result);
    return this;
  }

  RecordingStorageDriver counting(final String sql, final long count) {
    counts.put(sql, count);
    return this;
  }

  synchronized List<String> log() {
    return List.copyOf(log);
  }

  @Override
  public synchronized List<Map<String, Object>> exec(
      final Statement statement) {
    final String sql = statement.sql();
    log.add(sql);
    if (failing.contains(sql)) {
      throw new SatelliteException("Statement failed: " + sql);
    }
    if (!isControl(sql)) {
      rowsModified = counts.getOrDefault(sql, 1L);
    }
    return rows.getOrDefault(sql, List.of());
  }

  @Override
  public synchronized long rowsModified() {
    return rowsModified;
  }

  @Override
  public synchronized RunResult execBatch(final List<Statement> statements) {
    log.add("BATCH " + statements.size());
    long total = 0;
    for (final Statement statement : statements) {
      if (failing.contains(statement.sql())) {
        throw new SatelliteException("Batch failed on: " + statement.sql());
      }
      total += counts.getOrDefault(statement.sql(), 1L);
    }
    return new RunResult(total);
  }

  private static boolean isControl(final String sql) {
    return sql.equals("BEGIN") || sql.equals("COMMIT")
        || sql.equals("ROLLBACK");
  }
}
