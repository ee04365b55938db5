package org.waabox.satellite.adapter;

import java.util.List;
import java.util.Map;

/**
 * A raw connection to the local database.
 *
 * <p>Drivers are not expected to be safe for concurrent use: a
 * {@link DatabaseAdapter} serializes every call. Transaction control is
 * expressed as plain statements ({@code BEGIN}, {@code COMMIT},
 * {@code ROLLBACK}) executed through {@link #exec(Statement)}.
 *
 * <p>Failures are reported as unchecked exceptions, typically
 * {@link org.waabox.satellite.SatelliteException} wrapping the driver's own
 * error.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface StorageDriver {

  /**
   * Executes a statement.
   *
   * @param statement the statement, never null
   *
   * @return the rows read, empty for statements that return no rows
   */
  List<Map<String, Object>> exec(Statement statement);

  /**
   * Returns the number of rows modified by the last executed statement.
   *
   * @return the number of modified rows, never negative
   */
  long rowsModified();
}
